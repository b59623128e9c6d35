package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a caller needs to continue the conversation in a later run.
 * Successful and failed runs have the same shape; inspect {@code finalAnswer.success}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunOutput {

    private String runId;

    @Builder.Default
    private List<ChatEntry> conversationHistory = new ArrayList<>();

    @Builder.Default
    private List<ExecutionResult> toolCallHistory = new ArrayList<>();

    private ExecutionResult finalAnswer;

    private int iterationsUsed;

    private TerminationReason terminationReason;
}
