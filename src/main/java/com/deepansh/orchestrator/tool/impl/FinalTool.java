package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.core.TurnState;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.tool.AgentTool;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reserved terminal tool. A successful call ends the run with its result as the final answer.
 */
@Component
public class FinalTool implements AgentTool {

    public static final String NAME = "final";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return """
                Call this tool to provide your final answer when the task is complete. Use when: \
                (1) you have completed the user's request, (2) all necessary operations are done, \
                (3) you can provide a complete response, or (4) you need to explain why the task \
                cannot be completed. This tool ends the conversation.""";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "value", Map.of(
                                "type", "string",
                                "description", "The final, complete answer summarizing what was accomplished and any results."
                        )
                ),
                "required", List.of("value")
        );
    }

    @Override
    public ExecutionResult execute(String name, Map<String, Object> arguments, TurnState turnState) {
        return ExecutionResult.success(name, arguments.get("value"));
    }
}
