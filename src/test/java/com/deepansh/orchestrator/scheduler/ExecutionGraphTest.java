package com.deepansh.orchestrator.scheduler;

import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.tool.RegisteredTool;
import com.deepansh.orchestrator.tool.StubTool;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionGraphTest {

    @Test
    void build_restrictsEdgesToToolsInBatch() {
        Map<String, RegisteredTool> tools = tools(
                entry("fetch"),
                entry("parse", "fetch", "auth"));

        ExecutionGraph graph = ExecutionGraph.build(List.of(call("parse"), call("fetch")), tools);

        assertThat(graph.dependenciesOf("parse")).containsExactly("fetch");
        assertThat(graph.dependentsOf("fetch")).containsExactly("parse");
        assertThat(graph.initiallyReady()).containsExactly("fetch");
    }

    @Test
    void build_repeatedToolName_isOneNode() {
        ExecutionGraph graph = ExecutionGraph.build(
                List.of(call("fetch"), call("fetch")), tools(entry("fetch")));

        assertThat(graph.size()).isEqualTo(1);
        assertThat(graph.callsFor("fetch")).hasSize(2);
    }

    @Test
    void findCycle_acyclic_isEmpty() {
        ExecutionGraph graph = ExecutionGraph.build(
                List.of(call("a"), call("b"), call("c")),
                tools(entry("a"), entry("b", "a"), entry("c", "a", "b")));

        assertThat(graph.findCycle()).isEmpty();
    }

    @Test
    void findCycle_twoNodeCycle_returnsClosedPath() {
        ExecutionGraph graph = ExecutionGraph.build(
                List.of(call("a"), call("b")),
                tools(entry("a", "b"), entry("b", "a")));

        List<String> cycle = graph.findCycle();

        assertThat(cycle).hasSize(3);
        assertThat(cycle.get(0)).isEqualTo(cycle.get(2));
        assertThat(cycle).contains("a", "b");
    }

    @Test
    void findCycle_adjacency_ignoresUnknownNames() {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        adjacency.put("a", List.of("ghost"));
        adjacency.put("b", List.of("c"));
        adjacency.put("c", List.of("b"));

        assertThat(ExecutionGraph.findCycle(adjacency)).containsExactly("b", "c", "b");
    }

    @Test
    void findCycle_selfDependency_isCycle() {
        assertThat(ExecutionGraph.findCycle(Map.of("a", List.of("a")))).containsExactly("a", "a");
    }

    private static ProposedCall call(String name) {
        return ProposedCall.of(name, Map.of());
    }

    private static RegisteredTool entry(String name, String... dependencies) {
        return new RegisteredTool(StubTool.succeeding(name, name), Duration.ofSeconds(1), List.of(dependencies));
    }

    private static Map<String, RegisteredTool> tools(RegisteredTool... entries) {
        Map<String, RegisteredTool> map = new LinkedHashMap<>();
        for (RegisteredTool entry : entries) {
            map.put(entry.name(), entry);
        }
        return map;
    }
}
