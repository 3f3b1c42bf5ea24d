package org.bpmnml;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {
    private static final String SIMPLE_PROCESS = "src/test/resources/models/simple_process.json";
    private static final String POOL_CROSSING = "src/test/resources/models/pool_crossing.json";
    private static final String INVALID_TASK_TYPE = "src/test/resources/models/invalid_task_type.json";
    private static final String STRICT_CONFIG = "src/test/resources/config/strict.json";
    private static final String INVALID_INDENT_CONFIG = "src/test/resources/config/invalid_indent.json";

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Main main;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        main = new Main(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintXmlWithoutOutputFile() {
        int exitCode = main.run(new String[]{SIMPLE_PROCESS});

        assertEquals(0, exitCode);
        assertTrue(stdout().startsWith("<?xml"));
        assertTrue(stdout().contains("startEvent"));
        assertEquals("", stderr());
    }

    @Test
    void shouldWriteOutputFile(@TempDir Path tempDir) throws IOException {
        Path output = tempDir.resolve("nested/simple.bpmn");

        int exitCode = main.run(new String[]{"--", SIMPLE_PROCESS, output.toString()});

        assertEquals(0, exitCode);
        assertTrue(Files.exists(output));
        assertTrue(Files.readString(output).contains("sequenceFlow"));
        assertTrue(stdout().startsWith("BPMN written to: "));
    }

    @Test
    void shouldReportDiagnosticsAndFail() {
        int exitCode = main.run(new String[]{POOL_CROSSING});

        assertEquals(1, exitCode);
        assertEquals("", stdout());
        assertTrue(stderr().contains("pool_crossing.json: error: Connection target node is not defined."));
    }

    @Test
    void shouldAcceptCleanModelWithStrictConfig() {
        int exitCode = main.run(new String[]{SIMPLE_PROCESS, "--config", STRICT_CONFIG});

        assertEquals(0, exitCode);
    }

    @Test
    void shouldReportInvalidConfigOnErrorStreamOnly() {
        int exitCode = main.run(new String[]{SIMPLE_PROCESS, "--config", INVALID_INDENT_CONFIG});

        assertEquals(1, exitCode);
        assertEquals("", stdout());
        assertTrue(stderr().contains("Compiler config JSON is invalid"));
        assertTrue(stderr().contains(" - "));
    }

    @Test
    void shouldFailOnInvalidModel() {
        int exitCode = main.run(new String[]{INVALID_TASK_TYPE});

        assertEquals(1, exitCode);
        assertTrue(stderr().contains("BPMNml model JSON is invalid"));
    }

    @Test
    void shouldRejectBadUsage() {
        assertEquals(2, main.run(new String[]{}));
        assertEquals(2, main.run(new String[]{SIMPLE_PROCESS, "a.bpmn", "b.bpmn"}));
        assertEquals(2, main.run(new String[]{SIMPLE_PROCESS, "--config"}));
        assertTrue(stderr().contains("Usage: bpmnml"));
    }
}
