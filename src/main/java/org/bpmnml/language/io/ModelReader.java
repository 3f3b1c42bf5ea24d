package org.bpmnml.language.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Connector;
import org.bpmnml.language.model.Event;
import org.bpmnml.language.model.EventType;
import org.bpmnml.language.model.Gateway;
import org.bpmnml.language.model.GatewayType;
import org.bpmnml.language.model.Lane;
import org.bpmnml.language.model.NodeReference;
import org.bpmnml.language.model.Pool;
import org.bpmnml.language.model.PoolElement;
import org.bpmnml.language.model.RootElement;
import org.bpmnml.language.model.Task;
import org.bpmnml.language.model.TaskType;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads a BPMNml parse tree from its JSON form.
 * <p>
 * Example:
 * <pre>
 * { "elements": [
 *   { "type": "event", "name": "Start", "eventType": "start" },
 *   { "type": "connection", "source": "Start", "connector": "-->", "target": "End" }
 * ] }
 * </pre>
 * Connection endpoints come back unresolved; run the linker before validating.
 */
public class ModelReader {
    private static final String SCHEMA_RESOURCE = "schema/bpmnml_model_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Validates a JSON document against the model schema.
     *
     * @param document the parsed JSON document
     * @return the schema violations, empty when the document is valid
     */
    public static Set<ValidationMessage> validate(JsonNode document) {
        ClassLoader cl = ModelReader.class.getClassLoader();
        try (InputStream schemaStream = cl.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema.validate(document);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load schema: " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the file is not well-formed JSON or does not match the model schema
     * @throws RuntimeException         if the file cannot be read
     */
    public static BpmnModel readModel(File file) {
        try {
            return readModel(mapper.readTree(file));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed BPMNml model JSON: " + file.getPath(), e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read BPMNml model: " + file.getPath(), e);
        }
    }

    public static BpmnModel readModel(String json) {
        try {
            return readModel(mapper.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed BPMNml model JSON", e);
        }
    }

    /**
     * Builds the model tree from an already parsed JSON document.
     *
     * @throws IllegalArgumentException if the document does not match the model schema
     */
    public static BpmnModel readModel(JsonNode document) {
        Set<ValidationMessage> errors = validate(document);
        if (!errors.isEmpty()) {
            StringBuilder message = new StringBuilder("BPMNml model JSON is invalid:");
            errors.forEach(e -> message.append("\n - ").append(e.getMessage()));
            throw new IllegalArgumentException(message.toString());
        }

        List<RootElement> elements = new ArrayList<>();
        for (JsonNode element : document.get("elements")) {
            elements.add(readRootElement(element));
        }
        return new BpmnModel(elements);
    }

    private static RootElement readRootElement(JsonNode json) {
        String type = json.get("type").asText();
        return switch (type) {
            case "event" -> readEvent(json);
            case "task" -> readTask(json);
            case "gateway" -> readGateway(json);
            case "connection" -> readConnection(json);
            case "pool" -> new Pool(json.get("name").asText(), readPoolElements(json));
            default -> throw new IllegalArgumentException("Element type not allowed at top level: " + type);
        };
    }

    private static PoolElement readPoolElement(JsonNode json) {
        String type = json.get("type").asText();
        return switch (type) {
            case "event" -> readEvent(json);
            case "task" -> readTask(json);
            case "gateway" -> readGateway(json);
            case "connection" -> readConnection(json);
            case "lane" -> new Lane(json.get("name").asText(), readPoolElements(json));
            default -> throw new IllegalArgumentException("Element type not allowed in a pool or lane: " + type);
        };
    }

    private static List<PoolElement> readPoolElements(JsonNode container) {
        List<PoolElement> elements = new ArrayList<>();
        for (JsonNode element : container.get("elements")) {
            elements.add(readPoolElement(element));
        }
        return elements;
    }

    private static Event readEvent(JsonNode json) {
        String eventType = text(json, "eventType");
        return new Event(json.get("name").asText(), eventType != null ? EventType.fromKeyword(eventType) : null);
    }

    private static Task readTask(JsonNode json) {
        String taskType = text(json, "taskType");
        return new Task(json.get("name").asText(), taskType != null ? TaskType.fromKeyword(taskType) : null);
    }

    private static Gateway readGateway(JsonNode json) {
        String gatewayType = text(json, "gatewayType");
        return new Gateway(json.get("name").asText(),
                gatewayType != null ? GatewayType.fromKeyword(gatewayType) : null);
    }

    private static Connection readConnection(JsonNode json) {
        String source = text(json, "source");
        String target = text(json, "target");
        return new Connection(
                source != null ? new NodeReference(source) : null,
                Connector.fromToken(json.get("connector").asText()),
                target != null ? new NodeReference(target) : null,
                text(json, "label"));
    }

    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
