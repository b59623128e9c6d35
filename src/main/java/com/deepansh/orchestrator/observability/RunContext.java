package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.tool.ToolRegistry;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable per-run context for collecting observability data.
 * Created at the start of each run, populated by the controller thread only,
 * then logged as a one-line summary at the end. Conversation state lives in AgentContext.
 */
@Getter
public class RunContext {

    private final String runId;
    private final long startTimeMs = System.currentTimeMillis();
    private final Map<String, ToolStats> toolStats = new TreeMap<>();
    private final List<Long> oracleLatenciesMs = new ArrayList<>();
    private final List<Long> batchLatenciesMs = new ArrayList<>();

    public RunContext(String runId) {
        this.runId = runId;
    }

    public void recordOracleCall(long latencyMs) {
        oracleLatenciesMs.add(latencyMs);
    }

    public void recordBatch(List<ExecutionResult> results, long latencyMs) {
        batchLatenciesMs.add(latencyMs);
        results.forEach(this::recordResult);
    }

    public void recordResult(ExecutionResult result) {
        ToolStats stats = toolStats.computeIfAbsent(result.getToolName(), name -> new ToolStats());
        if (result.isSuccess()) {
            stats.successes++;
        } else {
            stats.failures++;
        }
    }

    /**
     * Successful calls per tool, excluding the terminal tool, in tool-name order.
     */
    public Map<String, Integer> successCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        toolStats.forEach((name, stats) -> {
            if (!ToolRegistry.FINAL_TOOL_NAME.equals(name) && stats.successes > 0) {
                counts.put(name, stats.successes);
            }
        });
        return counts;
    }

    public int totalFailures() {
        return toolStats.values().stream().mapToInt(ToolStats::getFailures).sum();
    }

    /**
     * Human-readable progress report used as the output of a forced final answer.
     */
    public String progressSummary(String reason) {
        Map<String, Integer> successes = successCounts();
        String done = successes.isEmpty()
                ? "no successful tool calls"
                : successes.entrySet().stream()
                        .map(e -> e.getKey() + " x" + e.getValue())
                        .reduce((a, b) -> a + ", " + b)
                        .orElse("");
        return String.format("Task terminated early: %s. Progress so far: %s; %d failed call(s).",
                reason, done, totalFailures());
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public long totalOracleLatencyMs() {
        return oracleLatenciesMs.stream().mapToLong(Long::longValue).sum();
    }

    public long totalToolLatencyMs() {
        return batchLatenciesMs.stream().mapToLong(Long::longValue).sum();
    }

    @Getter
    public static class ToolStats {
        private int successes;
        private int failures;
    }
}
