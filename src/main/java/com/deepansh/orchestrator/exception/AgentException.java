package com.deepansh.orchestrator.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed failure carried through the agent loop.
 *
 * Tool-level failures are folded into {@link com.deepansh.orchestrator.model.ExecutionResult}s
 * and never thrown out of the scheduler. Registration errors are thrown to the caller directly.
 * Everything else is caught by the loop and turned into a failure final answer.
 */
@Getter
public class AgentException extends RuntimeException {

    private static final ObjectMapper CONTEXT_MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final AgentErrorType type;
    private final Map<String, Object> context;
    private final Instant timestamp = Instant.now();

    public AgentException(String message, AgentErrorType type) {
        this(message, type, Map.of(), null);
    }

    public AgentException(String message, AgentErrorType type, Map<String, Object> context) {
        this(message, type, context, null);
    }

    public AgentException(String message, AgentErrorType type, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * Returns the throwable as an AgentException, classifying anything foreign as UNKNOWN.
     */
    public static AgentException wrap(Throwable t) {
        if (t instanceof AgentException agentException) {
            return agentException;
        }
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new AgentException(message, AgentErrorType.UNKNOWN, Map.of(), t);
    }

    /**
     * Full dump used as feedback for the oracle: type, message and context as JSON.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder()
                .append("Error Type: ").append(type).append('\n')
                .append("Message: ").append(getMessage());

        if (!context.isEmpty()) {
            sb.append('\n').append("Error Context: ").append(renderContext());
        }
        return sb.toString();
    }

    private String renderContext() {
        try {
            return CONTEXT_MAPPER.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            return context.toString();
        }
    }
}
