package com.deepansh.orchestrator.scheduler;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import com.deepansh.orchestrator.core.AgentLifecycleHooks;
import com.deepansh.orchestrator.core.CompositeLifecycleHooks;
import com.deepansh.orchestrator.core.TurnState;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.stagnation.CallSignatureHasher;
import com.deepansh.orchestrator.tool.RegisteredTool;
import com.deepansh.orchestrator.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Executes the batch of calls proposed in one iteration.
 *
 * Parallel mode builds the batch's dependency graph, rejects it whole if it is cyclic,
 * runs independent tools concurrently and cascades a failure to every transitive dependent
 * as a skip. Sequential mode ignores dependencies, runs calls strictly in proposal order
 * and stops at the first failure.
 *
 * Never throws for tool-level problems: unknown tools, invalid arguments, handler exceptions
 * and timeouts all come back as failed {@link ExecutionResult}s. {@code onToolCallEnd} fires
 * for every result returned, including not-found, cycle and skip results.
 */
@Component
@Slf4j
public class ToolScheduler {

    private final ToolRegistry toolRegistry;
    private final AgentLoopProperties properties;
    private final ToolInvoker invoker;

    public ToolScheduler(ToolRegistry toolRegistry,
                         AgentLoopProperties properties,
                         @Qualifier("toolTaskExecutor") Executor toolTaskExecutor) {
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.invoker = new ToolInvoker(toolTaskExecutor);
    }

    public List<ExecutionResult> execute(List<ProposedCall> batch, TurnState turnState) {
        return execute(batch, turnState, new CompositeLifecycleHooks(List.of()));
    }

    public List<ExecutionResult> execute(List<ProposedCall> batch, TurnState turnState, AgentLifecycleHooks hooks) {
        if (batch == null || batch.isEmpty()) {
            return List.of();
        }
        AgentLifecycleHooks safeHooks = hooks instanceof CompositeLifecycleHooks
                ? hooks
                : new CompositeLifecycleHooks(List.of(hooks));

        return properties.isParallelExecution()
                ? executeWithDependencies(batch, turnState, safeHooks)
                : executeSequentially(batch, turnState, safeHooks);
    }

    private List<ExecutionResult> executeSequentially(List<ProposedCall> batch, TurnState turnState, AgentLifecycleHooks hooks) {
        List<ExecutionResult> results = new ArrayList<>();

        for (ProposedCall call : batch) {
            Optional<RegisteredTool> tool = toolRegistry.find(call.getToolName());
            if (tool.isEmpty()) {
                results.add(notFound(call, hooks));
                break;
            }

            ExecutionResult result = invoker.invoke(tool.get(), call, turnState, hooks).join();
            results.add(result);

            if (!result.isSuccess()) {
                log.warn("Sequential batch halted after failure in [{}]: {}", call.getToolName(), result.getError());
                break;
            }
        }
        return results;
    }

    private List<ExecutionResult> executeWithDependencies(List<ProposedCall> batch, TurnState turnState, AgentLifecycleHooks hooks) {
        List<ExecutionResult> results = new ArrayList<>();
        List<ProposedCall> valid = new ArrayList<>();
        Map<String, RegisteredTool> resolved = new LinkedHashMap<>();

        for (ProposedCall call : batch) {
            Optional<RegisteredTool> tool = toolRegistry.find(call.getToolName());
            if (tool.isPresent()) {
                valid.add(call);
                resolved.put(call.getToolName(), tool.get());
            } else {
                results.add(notFound(call, hooks));
            }
        }
        if (valid.isEmpty()) {
            return results;
        }

        ExecutionGraph graph = ExecutionGraph.build(valid, resolved);
        List<String> cycle = graph.findCycle();
        if (!cycle.isEmpty()) {
            String path = String.join(" -> ", cycle);
            log.warn("Rejecting batch: circular dependency {}", path);
            ExecutionResult rejected = ExecutionResult.failure(cycle.get(0), new AgentException(
                    "Circular dependency detected in tool batch: " + path,
                    AgentErrorType.TOOL_EXECUTION_ERROR,
                    Map.of("cycle", cycle, "batch", graph.nodes().stream().toList())));
            hooks.onToolCallEnd(rejected);
            results.add(rejected);
            return results;
        }

        log.debug("Executing batch of {} call(s) across {} tool(s), ready={}",
                valid.size(), graph.size(), graph.initiallyReady());
        results.addAll(new DependencyBatchExecution(graph, invoker, turnState, hooks).run());
        return results;
    }

    private ExecutionResult notFound(ProposedCall call, AgentLifecycleHooks hooks) {
        String message = String.format("Tool '%s' not found. Available tools: %s",
                call.getToolName(), toolRegistry.names().stream().sorted().toList());
        log.warn(message);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("toolName", call.getToolName());
        ExecutionResult result = ExecutionResult.failure(call.getToolName(), new AgentException(message, AgentErrorType.TOOL_NOT_FOUND, context))
                .withArgumentsHash(CallSignatureHasher.hashCall(call));
        hooks.onToolCallEnd(result);
        return result;
    }
}
