package com.deepansh.orchestrator.tool;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the oracle.
 * Decouples the prompt/serialization format from the AgentTool implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;
    private List<String> dependencies;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .dependencies(tool.getDependencies() != null ? tool.getDependencies() : List.of())
                .build();
    }

    /**
     * Converts to OpenAI's function-tool format.
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
