package com.deepansh.orchestrator.tool;

import com.networknt.schema.JsonSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolArgumentValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "filename", Map.of("type", "string"),
                    "limit", Map.of("type", "integer"),
                    "mode", Map.of("type", "string", "enum", List.of("read", "write")),
                    "tags", Map.of("type", "array")
            ),
            "required", List.of("filename")
    );

    private static final JsonSchema COMPILED = ToolArgumentValidator.compile(SCHEMA);

    @Test
    void validate_validArguments_noViolations() {
        assertThat(ToolArgumentValidator.validate(COMPILED,
                Map.of("filename", "a.txt", "limit", 5, "mode", "read", "tags", List.of("x"))))
                .isEmpty();
    }

    @Test
    void validate_missingRequired_reportsField() {
        assertThat(ToolArgumentValidator.validate(COMPILED, Map.of()))
                .singleElement()
                .asString()
                .contains("filename");
    }

    @Test
    void validate_nullArguments_treatedAsEmpty() {
        assertThat(ToolArgumentValidator.validate(COMPILED, null)).hasSize(1);
    }

    @Test
    void validate_wrongType_reportsExpectedType() {
        assertThat(ToolArgumentValidator.validate(COMPILED, Map.of("filename", 42)))
                .singleElement()
                .asString()
                .contains("filename", "string");
    }

    @Test
    void validate_fractionForInteger_isRejected() {
        assertThat(ToolArgumentValidator.validate(COMPILED, Map.of("filename", "a", "limit", 3.5)))
                .singleElement()
                .asString()
                .contains("limit");
    }

    @Test
    void validate_valueOutsideEnum_isRejected() {
        assertThat(ToolArgumentValidator.validate(COMPILED, Map.of("filename", "a", "mode", "delete")))
                .singleElement()
                .asString()
                .contains("mode");
    }

    @Test
    void validate_extraArguments_areAllowed() {
        assertThat(ToolArgumentValidator.validate(COMPILED, Map.of("filename", "a", "verbose", true))).isEmpty();
    }

    @Test
    void validate_nestedObjectAndArrayItems_reportsEachViolation() {
        Map<String, Object> nested = Map.of(
                "type", "object",
                "properties", Map.of(
                        "opts", Map.of("type", "object", "required", List.of("x")),
                        "tags", Map.of("type", "array", "items", Map.of("type", "string"))));

        List<String> violations = ToolArgumentValidator.validate(nested,
                Map.of("opts", Map.of(), "tags", List.of(1, 2)));

        assertThat(violations).hasSize(3);
        assertThat(violations).anySatisfy(v -> assertThat(v).contains("opts"));
        assertThat(violations).filteredOn(v -> v.contains("tags")).hasSize(2);
    }

    @Test
    void validate_nestedArgumentsSatisfyingSchema_noViolations() {
        Map<String, Object> nested = Map.of(
                "type", "object",
                "properties", Map.of(
                        "opts", Map.of("type", "object", "required", List.of("x")),
                        "tags", Map.of("type", "array", "items", Map.of("type", "string"))));

        assertThat(ToolArgumentValidator.validate(nested,
                Map.of("opts", Map.of("x", 1), "tags", List.of("a", "b"))))
                .isEmpty();
    }
}
