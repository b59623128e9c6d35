package com.deepansh.orchestrator.scheduler;

import com.deepansh.orchestrator.core.AgentLifecycleHooks;
import com.deepansh.orchestrator.core.TurnState;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.stagnation.CallSignatureHasher;
import com.deepansh.orchestrator.tool.RegisteredTool;
import com.deepansh.orchestrator.tool.ToolArgumentValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single call: schema validation, handler on the tool executor raced against the
 * tool's timeout, and conversion of every outcome into an {@link ExecutionResult}.
 *
 * The returned future never completes exceptionally. A timed-out handler is abandoned,
 * not interrupted: it keeps its thread until it returns and its result is discarded.
 */
@Slf4j
class ToolInvoker {

    private final Executor executor;

    ToolInvoker(Executor executor) {
        this.executor = executor;
    }

    CompletableFuture<ExecutionResult> invoke(RegisteredTool tool,
                                              ProposedCall call,
                                              TurnState turnState,
                                              AgentLifecycleHooks hooks) {
        String name = tool.name();
        String argumentsHash = CallSignatureHasher.hashCall(call);
        hooks.onToolCallStart(call);

        List<String> violations = ToolArgumentValidator.validate(tool.argumentSchema(), call.getArguments());
        if (!violations.isEmpty()) {
            AgentException invalid = new AgentException(
                    "Invalid arguments for tool '" + name + "': " + String.join("; ", violations),
                    AgentErrorType.TOOL_EXECUTION_ERROR,
                    Map.of("toolName", name, "validationErrors", violations));
            return CompletableFuture.completedFuture(finish(failure(name, invalid, argumentsHash), hooks));
        }

        log.info("Executing tool: [{}] with args: {}", name, call.getArguments());
        long start = System.nanoTime();
        Duration timeout = tool.timeout();

        CompletableFuture<ExecutionResult> running;
        try {
            running = CompletableFuture.supplyAsync(() -> runHandler(tool, call, turnState), executor);
        } catch (RejectedExecutionException e) {
            AgentException rejected = new AgentException(
                    "Tool '" + name + "' could not be scheduled: " + e.getMessage(),
                    AgentErrorType.TOOL_EXECUTION_ERROR,
                    Map.of("toolName", name), e);
            return CompletableFuture.completedFuture(finish(failure(name, rejected, argumentsHash), hooks));
        }

        return running
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    ExecutionResult outcome = error == null
                            ? normalize(name, result)
                            : failure(name, classify(tool, call, error), argumentsHash);
                    log.debug("Tool [{}] finished in {}ms success={}", name, latencyMs, outcome.isSuccess());
                    return finish(outcome.withArgumentsHash(argumentsHash), hooks);
                });
    }

    private ExecutionResult runHandler(RegisteredTool tool, ProposedCall call, TurnState turnState) {
        try {
            return tool.tool().execute(tool.name(), call.getArguments(), turnState);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private ExecutionResult normalize(String name, ExecutionResult result) {
        if (result == null) {
            return ExecutionResult.failure(name, new AgentException(
                    "Tool '" + name + "' returned no result.",
                    AgentErrorType.TOOL_EXECUTION_ERROR,
                    Map.of("toolName", name)));
        }
        if (result.getToolName() == null) {
            return result.toBuilder().toolName(name).build();
        }
        return result;
    }

    private AgentException classify(RegisteredTool tool, ProposedCall call, Throwable error) {
        Throwable cause = unwrap(error);
        String name = tool.name();

        if (cause instanceof TimeoutException) {
            log.warn("Tool [{}] exceeded timeout of {}ms", name, tool.timeout().toMillis());
            return new AgentException(
                    "Tool '" + name + "' exceeded timeout of " + tool.timeout().toMillis() + "ms.",
                    AgentErrorType.TOOL_TIMEOUT_ERROR,
                    Map.of("toolName", name, "timeout", tool.timeout().toMillis()));
        }
        if (cause instanceof AgentException agentException) {
            return agentException;
        }

        log.error("Unexpected error in tool [{}]", name, cause);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("toolName", name);
        context.put("arguments", call.getArguments());
        context.put("exception", cause.getClass().getName());
        return new AgentException(
                "An unexpected error occurred in tool '" + name + "': " + cause.getMessage(),
                AgentErrorType.TOOL_EXECUTION_ERROR,
                context,
                cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ExecutionResult failure(String name, AgentException error, String argumentsHash) {
        return ExecutionResult.failure(name, error).withArgumentsHash(argumentsHash);
    }

    private static ExecutionResult finish(ExecutionResult result, AgentLifecycleHooks hooks) {
        hooks.onToolCallEnd(result);
        return result;
    }
}
