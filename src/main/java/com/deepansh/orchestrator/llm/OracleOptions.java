package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import com.deepansh.orchestrator.tool.ToolDefinition;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Model parameters passed through to the oracle on every request.
 * Tool definitions are included for oracles that support native function calling.
 */
@Data
@Builder
public class OracleOptions {

    private String model;
    private double temperature;
    private int maxTokens;
    private List<ToolDefinition> tools;

    public static OracleOptions from(AgentLoopProperties.Oracle config, List<ToolDefinition> tools) {
        return OracleOptions.builder()
                .model(config.getModel())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .tools(tools)
                .build();
    }
}
