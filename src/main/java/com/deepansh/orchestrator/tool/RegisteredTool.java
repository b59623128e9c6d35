package com.deepansh.orchestrator.tool;

import com.networknt.schema.JsonSchema;

import java.time.Duration;
import java.util.List;

/**
 * Registry entry: the tool plus its effective timeout, dependency list and compiled
 * argument schema, resolved once at registration.
 */
public record RegisteredTool(
        AgentTool tool,
        Duration timeout,
        List<String> dependencies,
        JsonSchema argumentSchema
) {
    public RegisteredTool(AgentTool tool, Duration timeout, List<String> dependencies) {
        this(tool, timeout, dependencies, ToolArgumentValidator.compile(tool.getInputSchema()));
    }

    public String name() {
        return tool.getName();
    }
}
