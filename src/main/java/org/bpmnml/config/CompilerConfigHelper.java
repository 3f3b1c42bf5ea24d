package org.bpmnml.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

public class CompilerConfigHelper {
    private static final String SCHEMA_RESOURCE = "schema/compiler_config_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Validates a config file against the config schema.
     *
     * @param configFilePath path of the JSON config file
     * @throws IllegalArgumentException if the file does not match the schema; the message lists every violation
     * @throws IOException              if the file cannot be read
     */
    public static void validateConfigFile(String configFilePath) throws IOException {
        ClassLoader cl = CompilerConfigHelper.class.getClassLoader();

        try (InputStream schemaStream = cl.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }

            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            JsonNode configNode = mapper.readTree(new File(configFilePath));

            Set<ValidationMessage> result = schema.validate(configNode);
            if (!result.isEmpty()) {
                StringBuilder message = new StringBuilder("Compiler config JSON is invalid: " + configFilePath);
                result.forEach(e -> message.append("\n - ").append(e.getMessage()));
                throw new IllegalArgumentException(message.toString());
            }
        }
    }

    /**
     * Loads and validates a config file.
     *
     * @param configFilePath path of the JSON config file, or null for the defaults
     * @return the loaded config
     */
    public static CompilerConfig loadConfigFile(String configFilePath) throws IOException {
        if (configFilePath == null) {
            return new CompilerConfig();
        }
        validateConfigFile(configFilePath);
        return mapper.readValue(new File(configFilePath), CompilerConfig.class);
    }
}
