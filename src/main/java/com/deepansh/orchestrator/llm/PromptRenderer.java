package com.deepansh.orchestrator.llm;

/**
 * Pure formatting of everything the oracle needs to see into one prompt.
 * Implementations must tolerate missing optional fields and never throw.
 */
@FunctionalInterface
public interface PromptRenderer {

    String render(PromptRequest request);
}
