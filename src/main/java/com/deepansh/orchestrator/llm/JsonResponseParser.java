package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses JSON tool-call completions.
 *
 * Accepted shapes (optionally inside a ```json fence):
 * - [ {"name": "...", "arguments": {...}}, ... ]
 * - {"tool_calls": [...]} or {"toolCalls": [...]}
 * - a single call object
 * - OpenAI style {"id": "...", "function": {"name": "...", "arguments": "{...json...}"}}
 *
 * Unknown tool names are passed through; the scheduler reports them as TOOL_NOT_FOUND
 * so the oracle sees which name it got wrong.
 */
@Component
@Slf4j
public class JsonResponseParser implements ResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ProposedCall> parseAndValidate(String completion, ToolRegistry toolRegistry) {
        if (completion == null || completion.isBlank()) {
            throw invalid("Oracle returned an empty response.", completion);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripFence(completion));
        } catch (JsonProcessingException e) {
            throw invalid("Oracle response is not valid JSON: " + e.getOriginalMessage(), completion);
        }

        List<ProposedCall> calls = new ArrayList<>();
        for (JsonNode node : callNodes(root, completion)) {
            calls.add(toCall(node, completion));
        }
        if (calls.isEmpty()) {
            throw invalid("Oracle response contains no tool calls.", completion);
        }

        calls.stream()
                .filter(call -> !toolRegistry.hasTool(call.getToolName()))
                .forEach(call -> log.warn("Oracle proposed unknown tool [{}]", call.getToolName()));
        return calls;
    }

    private List<JsonNode> callNodes(JsonNode root, String completion) {
        JsonNode list = root;
        if (root.isObject()) {
            if (root.has("tool_calls")) {
                list = root.get("tool_calls");
            } else if (root.has("toolCalls")) {
                list = root.get("toolCalls");
            } else {
                return List.of(root);
            }
        }
        if (!list.isArray()) {
            throw invalid("Expected an array of tool calls.", completion);
        }
        List<JsonNode> nodes = new ArrayList<>();
        list.forEach(nodes::add);
        return nodes;
    }

    private ProposedCall toCall(JsonNode node, String completion) {
        if (!node.isObject()) {
            throw invalid("Each tool call must be a JSON object.", completion);
        }
        JsonNode body = node.has("function") ? node.get("function") : node;

        String name = text(body, "name");
        if (name == null) {
            name = text(body, "toolName");
        }
        if (name == null || name.isBlank()) {
            throw invalid("Tool call is missing a 'name'.", completion);
        }

        JsonNode args = body.has("arguments") ? body.get("arguments") : body.get("args");
        return ProposedCall.builder()
                .id(text(node, "id"))
                .toolName(name)
                .arguments(toArguments(args, name, completion))
                .build();
    }

    private Map<String, Object> toArguments(JsonNode args, String toolName, String completion) {
        if (args == null || args.isNull()) {
            return Map.of();
        }
        try {
            if (args.isTextual()) {
                String raw = args.asText();
                return raw.isBlank() ? Map.of() : objectMapper.readValue(raw, MAP_TYPE);
            }
            if (args.isObject()) {
                return objectMapper.convertValue(args, MAP_TYPE);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw invalid("Arguments for tool '" + toolName + "' are not a valid JSON object.", completion);
        }
        throw invalid("Arguments for tool '" + toolName + "' must be a JSON object.", completion);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String stripFence(String completion) {
        Matcher matcher = CODE_FENCE.matcher(completion);
        return matcher.find() ? matcher.group(1) : completion.strip();
    }

    private static AgentException invalid(String message, String completion) {
        String preview = completion == null ? "" : completion.length() <= 500 ? completion : completion.substring(0, 500);
        return new AgentException(message, AgentErrorType.INVALID_RESPONSE, Map.of("response", preview));
    }
}
