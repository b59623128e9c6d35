package com.deepansh.orchestrator.model;

import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one tool call. Appended to the call history and never mutated afterwards.
 *
 * Exactly one of {@code output} / {@code error} is meaningful, depending on {@code success}.
 * {@code argumentsHash} is the canonical digest of the call that produced this result, when known,
 * so the history can be compared call-for-call by the stagnation checks.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionResult {

    String toolName;
    boolean success;
    Object output;
    String error;
    AgentErrorType errorType;

    @Builder.Default
    Map<String, Object> context = Map.of();

    String argumentsHash;

    @Builder.Default
    Instant timestamp = Instant.now();

    public static ExecutionResult success(String toolName, Object output) {
        return ExecutionResult.builder()
                .toolName(toolName)
                .success(true)
                .output(output)
                .build();
    }

    public static ExecutionResult success(String toolName, Object output, Map<String, Object> context) {
        return ExecutionResult.builder()
                .toolName(toolName)
                .success(true)
                .output(output)
                .context(context != null ? context : Map.of())
                .build();
    }

    public static ExecutionResult failure(String toolName, AgentException error) {
        return ExecutionResult.builder()
                .toolName(toolName)
                .success(false)
                .error(error.getMessage())
                .errorType(error.getType())
                .context(error.getContext())
                .build();
    }

    public ExecutionResult withArgumentsHash(String hash) {
        return toBuilder().argumentsHash(hash).build();
    }
}
