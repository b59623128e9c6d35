package com.deepansh.orchestrator.scheduler;

import com.deepansh.orchestrator.core.AgentLifecycleHooks;
import com.deepansh.orchestrator.core.TurnState;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.stagnation.CallSignatureHasher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

/**
 * Drives one acyclic batch to completion.
 *
 * Every node ends in exactly one of three states: finished (all its calls succeeded),
 * failed, or skipped because a transitive dependency failed. A node starts only once all
 * of its in-batch dependencies have finished. All bookkeeping happens under this object's
 * monitor, so concurrent completions cannot start a node twice or report a skip twice.
 */
@Slf4j
class DependencyBatchExecution {

    private final ExecutionGraph graph;
    private final ToolInvoker invoker;
    private final TurnState turnState;
    private final AgentLifecycleHooks hooks;

    private final List<ExecutionResult> results = new ArrayList<>();
    private final Map<String, Set<String>> waitingOn = new LinkedHashMap<>();
    private final Set<String> started = new HashSet<>();
    private final Set<String> settled = new HashSet<>();
    private final CountDownLatch unsettled;

    DependencyBatchExecution(ExecutionGraph graph, ToolInvoker invoker, TurnState turnState, AgentLifecycleHooks hooks) {
        this.graph = graph;
        this.invoker = invoker;
        this.turnState = turnState;
        this.hooks = hooks;
        this.unsettled = new CountDownLatch(graph.size());
        graph.nodes().forEach(node -> waitingOn.put(node, new LinkedHashSet<>(graph.dependenciesOf(node))));
    }

    /**
     * Blocks until every node has settled.
     *
     * @return results in settlement order; a dependency's results precede its dependents'
     */
    List<ExecutionResult> run() {
        List<String> ready;
        synchronized (this) {
            ready = graph.initiallyReady();
            started.addAll(ready);
        }
        ready.forEach(this::launch);

        try {
            unsettled.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandonUnsettled().forEach(hooks::onToolCallEnd);
        }

        synchronized (this) {
            return List.copyOf(results);
        }
    }

    private void launch(String node) {
        List<CompletableFuture<ExecutionResult>> futures = graph.callsFor(node).stream()
                .map(call -> invoker.invoke(graph.toolFor(node), call, turnState, hooks))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> settle(node, futures.stream().map(CompletableFuture::join).toList()));
    }

    private void settle(String node, List<ExecutionResult> nodeResults) {
        List<String> toLaunch = new ArrayList<>();

        synchronized (this) {
            if (settled.contains(node)) {
                return;
            }
            results.addAll(nodeResults);
            settled.add(node);
            unsettled.countDown();

            if (nodeResults.stream().allMatch(ExecutionResult::isSuccess)) {
                for (String dependent : graph.dependentsOf(node)) {
                    Set<String> waiting = waitingOn.get(dependent);
                    waiting.remove(node);
                    if (waiting.isEmpty() && !started.contains(dependent) && !settled.contains(dependent)) {
                        started.add(dependent);
                        toLaunch.add(dependent);
                    }
                }
            } else {
                List<String> chain = new ArrayList<>();
                chain.add(node);
                List<ExecutionResult> skipped = new ArrayList<>();
                skipDependents(node, chain, skipped);
                // still under the monitor: run() collects results only after these hooks fired
                skipped.forEach(hooks::onToolCallEnd);
            }
        }

        toLaunch.forEach(this::launch);
    }

    /** Caller holds the monitor. */
    private void skipDependents(String failed, List<String> chain, List<ExecutionResult> skipped) {
        for (String dependent : graph.dependentsOf(failed)) {
            if (settled.contains(dependent) || started.contains(dependent)) {
                continue;
            }
            log.warn("Skipping tool [{}]: dependency [{}] failed", dependent, failed);

            for (ProposedCall call : graph.callsFor(dependent)) {
                AgentException skip = new AgentException(
                        "Skipped due to failure in dependency '" + failed + "'",
                        AgentErrorType.TOOL_EXECUTION_ERROR,
                        Map.of("toolName", dependent,
                                "failedDependency", failed,
                                "dependencyChain", List.copyOf(chain)));
                ExecutionResult result = ExecutionResult.failure(dependent, skip)
                        .withArgumentsHash(CallSignatureHasher.hashCall(call));
                results.add(result);
                skipped.add(result);
            }
            settled.add(dependent);
            unsettled.countDown();

            List<String> next = new ArrayList<>(chain);
            next.add(dependent);
            skipDependents(dependent, next, skipped);
        }
    }

    private synchronized List<ExecutionResult> abandonUnsettled() {
        List<ExecutionResult> abandoned = new ArrayList<>();
        for (String node : graph.nodes()) {
            if (settled.contains(node)) {
                continue;
            }
            AgentException interrupted = new AgentException(
                    "Batch execution interrupted before tool '" + node + "' completed",
                    AgentErrorType.TOOL_EXECUTION_ERROR,
                    Map.of("toolName", node));
            ExecutionResult result = ExecutionResult.failure(node, interrupted);
            results.add(result);
            abandoned.add(result);
            settled.add(node);
        }
        return abandoned;
    }
}
