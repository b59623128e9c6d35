package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ExecutionResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class RunContextTest {

    @Test
    void progressSummary_listsSuccessesByToolAndCountsFailures() {
        RunContext ctx = new RunContext("run-1");
        ctx.recordBatch(List.of(
                ExecutionResult.success("search", "a"),
                ExecutionResult.success("echo", "b"),
                ExecutionResult.success("search", "c"),
                ExecutionResult.failure("fetch", new AgentException("boom", AgentErrorType.TOOL_EXECUTION_ERROR))
        ), 12);

        assertThat(ctx.successCounts()).containsExactly(
                entry("echo", 1),
                entry("search", 2));
        assertThat(ctx.progressSummary("stuck"))
                .isEqualTo("Task terminated early: stuck. Progress so far: echo x1, search x2; 1 failed call(s).");
    }

    @Test
    void progressSummary_nothingSucceeded_saysSo() {
        RunContext ctx = new RunContext("run-2");
        ctx.recordResult(ExecutionResult.success("final", "ignored"));

        assertThat(ctx.successCounts()).isEmpty();
        assertThat(ctx.progressSummary("looping")).contains("no successful tool calls", "0 failed call(s)");
    }

    @Test
    void latencies_areSummed() {
        RunContext ctx = new RunContext("run-3");
        ctx.recordOracleCall(10);
        ctx.recordOracleCall(15);
        ctx.recordBatch(List.of(), 7);

        assertThat(ctx.totalOracleLatencyMs()).isEqualTo(25);
        assertThat(ctx.totalToolLatencyMs()).isEqualTo(7);
        assertThat(ctx.getRunId()).isEqualTo("run-3");
    }
}
