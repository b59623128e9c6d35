package com.deepansh.orchestrator.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * JSON Schema (draft 7) validation of call arguments.
 *
 * Tool schemas are compiled once, at registration, and the compiled {@link JsonSchema}
 * is kept on the {@link RegisteredTool}. Nested objects, arrays, {@code items}, {@code enum}
 * and the other draft-7 keywords are all enforced; extra arguments are allowed unless the
 * schema sets {@code additionalProperties: false}.
 */
public final class ToolArgumentValidator {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private static final SchemaValidatorsConfig CONFIG = new SchemaValidatorsConfig();

    static {
        CONFIG.setLocale(Locale.ENGLISH);
    }

    private ToolArgumentValidator() {}

    /**
     * Compiles a tool's input schema.
     *
     * @throws RuntimeException when the schema itself is malformed
     */
    public static JsonSchema compile(Map<String, Object> schema) {
        return FACTORY.getSchema(MAPPER.valueToTree(schema), CONFIG);
    }

    /**
     * @return one message per violation, sorted; empty when the arguments are valid
     */
    public static List<String> validate(JsonSchema schema, Map<String, Object> arguments) {
        JsonNode node = MAPPER.valueToTree(arguments != null ? arguments : Map.of());
        Set<ValidationMessage> messages = schema.validate(node);
        return messages.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .toList();
    }

    public static List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        return validate(compile(schema), arguments);
    }
}
