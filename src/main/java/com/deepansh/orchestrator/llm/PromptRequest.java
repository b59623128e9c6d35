package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ChatEntry;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.tool.ToolDefinition;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class PromptRequest {

    String systemPrompt;
    String userPrompt;

    @Builder.Default
    Map<String, Object> context = Map.of();

    @Builder.Default
    List<ChatEntry> conversationHistory = List.of();

    @Builder.Default
    List<ExecutionResult> toolCallHistory = List.of();

    /** Error from the previous iteration, fed back so the oracle can correct itself */
    AgentException lastError;

    /** false once the loop has stopped retrying automatically */
    boolean keepRetry;

    @Builder.Default
    List<ToolDefinition> toolDefinitions = List.of();

    boolean parallelExecution;
}
