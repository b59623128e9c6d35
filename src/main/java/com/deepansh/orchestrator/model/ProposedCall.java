package com.deepansh.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A tool call parsed from the oracle's completion, not yet validated against the tool's schema.
 */
@Value
@Builder
public class ProposedCall {

    /** Optional id echoed by function-calling oracles */
    String id;

    String toolName;

    @Builder.Default
    Map<String, Object> arguments = Map.of();

    public static ProposedCall of(String toolName, Map<String, Object> arguments) {
        return ProposedCall.builder()
                .toolName(toolName)
                .arguments(arguments != null ? arguments : Map.of())
                .build();
    }
}
