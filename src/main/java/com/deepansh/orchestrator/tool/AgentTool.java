package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.core.TurnState;
import com.deepansh.orchestrator.model.ExecutionResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the oracle so it knows exactly how to invoke the tool. The scheduler
 * validates arguments against the same schema before calling {@link #execute}.
 *
 * Handlers may throw: the scheduler converts any exception into a failed
 * {@link ExecutionResult} so the loop keeps going.
 */
public interface AgentTool {

    /** Unique identifier-shaped name the oracle uses to invoke this tool */
    String getName();

    /** Human-readable description. This is the primary signal the oracle uses to pick a tool. */
    String getDescription();

    /**
     * JSON Schema (as a Map) describing the tool's input parameters:
     * type, properties, required, enum, descriptions.
     */
    Map<String, Object> getInputSchema();

    /**
     * Names of tools whose calls in the same batch must finish successfully
     * before this tool runs. Dependencies not called in the batch are ignored.
     */
    default List<String> getDependencies() {
        return List.of();
    }

    /** Per-call timeout. Null means the configured default. */
    default Duration getTimeout() {
        return null;
    }

    /**
     * Execute one call.
     *
     * @param name       the tool name the call was dispatched under
     * @param arguments  arguments already validated against {@link #getInputSchema()}
     * @param turnState  scratch space shared by all handlers of the current run
     */
    ExecutionResult execute(String name, Map<String, Object> arguments, TurnState turnState) throws Exception;
}
