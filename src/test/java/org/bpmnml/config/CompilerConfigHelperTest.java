package org.bpmnml.config;

import org.bpmnml.generator.GeneratorOptions;
import org.bpmnml.language.scope.ScopeMode;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class CompilerConfigHelperTest {
    private static final String LANE_LOCAL_CONFIG = "src/test/resources/config/lane_local.json";
    private static final String STRICT_CONFIG = "src/test/resources/config/strict.json";
    private static final String INVALID_INDENT_CONFIG = "src/test/resources/config/invalid_indent.json";

    @Test
    void shouldReturnDefaultsWithoutFile() throws IOException {
        CompilerConfig config = CompilerConfigHelper.loadConfigFile(null);

        assertEquals(ScopeMode.POOL_WIDE, config.scopeMode);
        assertTrue(config.prettify);
        assertEquals(2, config.indent);
        assertFalse(config.validateOutput);
        assertFalse(config.failOnWarnings);
        assertEquals(GeneratorOptions.defaults(), config.toGeneratorOptions());
    }

    @Test
    @SuppressWarnings("deprecation")
    void shouldLoadConfigFileSuccessfully() throws IOException {
        CompilerConfig config = CompilerConfigHelper.loadConfigFile(LANE_LOCAL_CONFIG);

        assertEquals(ScopeMode.LANE_LOCAL, config.scopeMode);
        assertFalse(config.prettify);
        assertTrue(config.validateOutput);
        assertEquals(2, config.indent);
    }

    @Test
    void shouldKeepDefaultsForOmittedProperties() throws IOException {
        CompilerConfig config = CompilerConfigHelper.loadConfigFile(STRICT_CONFIG);

        assertTrue(config.failOnWarnings);
        assertEquals(ScopeMode.POOL_WIDE, config.scopeMode);
        assertTrue(config.prettify);
    }

    @Test
    void shouldRejectIndentOutOfRange() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompilerConfigHelper.validateConfigFile(INVALID_INDENT_CONFIG));
        assertTrue(e.getMessage().startsWith("Compiler config JSON is invalid: " + INVALID_INDENT_CONFIG));
        assertTrue(e.getMessage().contains("\n - "));
        assertThrows(IllegalArgumentException.class, () -> CompilerConfigHelper.loadConfigFile(INVALID_INDENT_CONFIG));
    }

    @Test
    void shouldFailOnMissingFile() {
        assertThrows(IOException.class, () -> CompilerConfigHelper.loadConfigFile("does/not/exist.json"));
    }
}
