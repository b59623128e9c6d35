package com.deepansh.orchestrator.scheduler;

import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.tool.RegisteredTool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency graph of one batch.
 *
 * Nodes are the distinct tool names called in the batch, in proposal order. Edges are the
 * declared dependencies restricted to tools that are themselves in the batch: a dependency
 * that was not called this turn has nothing to wait on. All calls to the same tool form one node.
 */
public final class ExecutionGraph {

    private final Map<String, RegisteredTool> tools;
    private final Map<String, List<ProposedCall>> callsByNode;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, List<String>> dependents;

    private ExecutionGraph(Map<String, RegisteredTool> tools,
                           Map<String, List<ProposedCall>> callsByNode,
                           Map<String, Set<String>> dependencies,
                           Map<String, List<String>> dependents) {
        this.tools = tools;
        this.callsByNode = callsByNode;
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    /**
     * @param calls calls whose tools have already been resolved
     * @param tools resolved registry entries, keyed by tool name
     */
    public static ExecutionGraph build(List<ProposedCall> calls, Map<String, RegisteredTool> tools) {
        Map<String, List<ProposedCall>> callsByNode = new LinkedHashMap<>();
        for (ProposedCall call : calls) {
            callsByNode.computeIfAbsent(call.getToolName(), k -> new ArrayList<>()).add(call);
        }

        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (String node : callsByNode.keySet()) {
            Set<String> inBatch = new LinkedHashSet<>();
            for (String dep : tools.get(node).dependencies()) {
                if (callsByNode.containsKey(dep)) {
                    inBatch.add(dep);
                }
            }
            dependencies.put(node, Collections.unmodifiableSet(inBatch));
            for (String dep : inBatch) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(node);
            }
        }
        return new ExecutionGraph(Map.copyOf(tools), callsByNode, dependencies, dependents);
    }

    public Set<String> nodes() {
        return callsByNode.keySet();
    }

    public int size() {
        return callsByNode.size();
    }

    public RegisteredTool toolFor(String node) {
        return tools.get(node);
    }

    public List<ProposedCall> callsFor(String node) {
        return callsByNode.getOrDefault(node, List.of());
    }

    public Set<String> dependenciesOf(String node) {
        return dependencies.getOrDefault(node, Set.of());
    }

    public List<String> dependentsOf(String node) {
        return dependents.getOrDefault(node, List.of());
    }

    /** Nodes with no unresolved in-batch dependency, in proposal order */
    public List<String> initiallyReady() {
        return callsByNode.keySet().stream()
                .filter(node -> dependenciesOf(node).isEmpty())
                .toList();
    }

    /**
     * @return the first cycle found as a closed path (e.g. [a, b, a]), or an empty list
     */
    public List<String> findCycle() {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        dependencies.forEach((node, deps) -> adjacency.put(node, List.copyOf(deps)));
        return findCycle(adjacency);
    }

    /**
     * Depth-first search with a recursion stack. Edges to names that are not keys of
     * the adjacency map are ignored.
     *
     * @return the first cycle found as a closed path, or an empty list
     */
    public static List<String> findCycle(Map<String, List<String>> adjacency) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        List<String> path = new ArrayList<>();

        for (String node : adjacency.keySet()) {
            if (!visited.contains(node)) {
                List<String> cycle = dfs(node, adjacency, visited, onStack, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    private static List<String> dfs(String node,
                                    Map<String, List<String>> adjacency,
                                    Set<String> visited,
                                    Set<String> onStack,
                                    List<String> path) {
        visited.add(node);
        onStack.add(node);
        path.add(node);

        for (String next : adjacency.getOrDefault(node, List.of())) {
            if (!adjacency.containsKey(next)) {
                continue;
            }
            if (onStack.contains(next)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (!visited.contains(next)) {
                List<String> cycle = dfs(next, adjacency, visited, onStack, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }

        onStack.remove(node);
        path.remove(path.size() - 1);
        return List.of();
    }
}
