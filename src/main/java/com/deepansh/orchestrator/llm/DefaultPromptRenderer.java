package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.model.ChatEntry;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain-text prompt with one Markdown section per input.
 *
 * Sections:
 * 1. System prompt
 * 2. Tools (OpenAI function schema, JSON)
 * 3. Response format
 * 4. Context
 * 5. Conversation so far
 * 6. Recent tool results (last {@value #MAX_HISTORY_ENTRIES})
 * 7. Last error, with retry guidance
 * 8. User request
 */
@Component
@Slf4j
public class DefaultPromptRenderer implements PromptRenderer {

    static final int MAX_HISTORY_ENTRIES = 50;
    private static final int MAX_VALUE_CHARS = 2000;

    private final ObjectMapper objectMapper;

    public DefaultPromptRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String render(PromptRequest request) {
        StringBuilder sb = new StringBuilder();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            sb.append(request.getSystemPrompt().strip()).append("\n\n");
        }

        appendTools(sb, request.getToolDefinitions());
        appendResponseFormat(sb, request.isParallelExecution());

        if (request.getContext() != null && !request.getContext().isEmpty()) {
            sb.append("# CONTEXT\n").append(toJson(request.getContext())).append("\n\n");
        }

        appendConversation(sb, request.getConversationHistory());
        appendToolHistory(sb, request.getToolCallHistory());

        if (request.getLastError() != null) {
            sb.append("# LAST ERROR\n").append(request.getLastError().getDetailedMessage()).append("\n\n");
            sb.append(request.isKeepRetry()
                    ? "Analyse the error above and correct your tool calls before trying again.\n\n"
                    : "Do NOT retry the same approach. Either change strategy or call 'final' "
                      + "explaining what was done and why the task cannot be completed.\n\n");
        }

        sb.append("# USER REQUEST\n")
                .append(request.getUserPrompt() != null ? request.getUserPrompt() : "")
                .append('\n');

        return sb.toString();
    }

    private void appendTools(StringBuilder sb, List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return;
        }
        sb.append("# AVAILABLE TOOLS\n");
        for (ToolDefinition tool : tools) {
            sb.append(toJson(tool.toOpenAiSchema())).append('\n');
            if (tool.getDependencies() != null && !tool.getDependencies().isEmpty()) {
                sb.append("  (runs after: ").append(String.join(", ", tool.getDependencies())).append(")\n");
            }
        }
        sb.append('\n');
    }

    private void appendResponseFormat(StringBuilder sb, boolean parallel) {
        sb.append("# RESPONSE FORMAT\n")
                .append("Respond with JSON only: {\"tool_calls\": [{\"name\": \"<tool>\", \"arguments\": {...}}]}\n")
                .append(parallel
                        ? "Independent calls in one response run concurrently; declared dependencies run first.\n"
                        : "Calls run in the order given; the first failure stops the rest.\n")
                .append("Call 'final' with your answer when the task is complete.\n\n");
    }

    private void appendConversation(StringBuilder sb, List<ChatEntry> conversation) {
        if (conversation == null || conversation.isEmpty()) {
            return;
        }
        sb.append("# CONVERSATION\n");
        for (ChatEntry entry : conversation) {
            sb.append(entry.getSender()).append(": ").append(entry.getMessage()).append('\n');
        }
        sb.append('\n');
    }

    private void appendToolHistory(StringBuilder sb, List<ExecutionResult> history) {
        if (history == null || history.isEmpty()) {
            return;
        }
        List<ExecutionResult> recent = history.size() <= MAX_HISTORY_ENTRIES
                ? history
                : history.subList(history.size() - MAX_HISTORY_ENTRIES, history.size());

        sb.append("# TOOL RESULTS SO FAR\n");
        for (ExecutionResult result : recent) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("tool", result.getToolName());
            entry.put("success", result.isSuccess());
            if (result.isSuccess()) {
                entry.put("output", truncate(String.valueOf(result.getOutput())));
            } else {
                entry.put("error", result.getError());
                entry.put("errorType", result.getErrorType());
            }
            sb.append(toJson(entry)).append('\n');
        }
        sb.append('\n');
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Falling back to toString for prompt value: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    private String truncate(String s) {
        return s.length() <= MAX_VALUE_CHARS ? s : s.substring(0, MAX_VALUE_CHARS) + "...[truncated]";
    }
}
