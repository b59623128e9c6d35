package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.core.TurnState;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.tool.AgentTool;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Smoke-test tool to verify the tool system wires up correctly.
 * Also stashes the last echoed message in the turn state under {@link #LAST_ECHO_KEY}
 * so a later tool in the same run can pick it up.
 */
@Component
public class EchoTool implements AgentTool {

    public static final String LAST_ECHO_KEY = "echo.last";

    @Override
    public String getName() {
        return "echo";
    }

    @Override
    public String getDescription() {
        return "Echoes back the provided message. Use this to test the tool system is working.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "message", Map.of(
                                "type", "string",
                                "description", "The message to echo back"
                        )
                ),
                "required", List.of("message")
        );
    }

    @Override
    public ExecutionResult execute(String name, Map<String, Object> arguments, TurnState turnState) {
        Object message = arguments.get("message");
        turnState.put(LAST_ECHO_KEY, message);
        return ExecutionResult.success(name, "Echo: " + message);
    }
}
