package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunInput {

    private String userPrompt;

    /**
     * Optional. Prior conversation carried over by the caller.
     * The loop copies it and never mutates the caller's list.
     */
    @Builder.Default
    private List<ChatEntry> conversationHistory = new ArrayList<>();

    /**
     * Optional. Prior tool results. They seed the stagnation window, so a loop that
     * started in an earlier run is still detected.
     */
    @Builder.Default
    private List<ExecutionResult> toolCallHistory = new ArrayList<>();

    /** Free-form data rendered into the prompt */
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();
}
