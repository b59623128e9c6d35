package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ChatEntry;
import com.deepansh.orchestrator.model.ExecutionResult;
import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds all mutable state for a single agent run.
 * Passed through every step of the iteration loop.
 * Only the controller thread touches it; tool handlers see {@link TurnState} alone.
 */
@Data
@Builder
public class AgentContext {

    private String runId;
    private String userPrompt;
    private Map<String, Object> context;
    private List<ChatEntry> conversationHistory;
    private List<ExecutionResult> toolCallHistory;
    private TurnState turnState;
    private int currentIteration;

    /** Fed back into the next prompt; null when the previous iteration went cleanly */
    private AgentException lastError;

    @Builder.Default
    private boolean keepRetry = true;

    /** Consecutive unparsable oracle responses */
    private int parseRetryCount;

    /** Tool-failure messages seen so far, with how often each recurred */
    @Builder.Default
    private Map<String, Integer> errorOccurrences = new HashMap<>();

    /** Executed batch digests, see RepeatedBatchTracker */
    @Builder.Default
    private Map<String, Integer> batchOccurrences = new HashMap<>();
}
