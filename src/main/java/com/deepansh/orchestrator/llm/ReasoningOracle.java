package com.deepansh.orchestrator.llm;

/**
 * The external completion service that proposes tool calls as text.
 * Any exception is treated as a transient failure and retried with backoff.
 */
@FunctionalInterface
public interface ReasoningOracle {

    /**
     * @param prompt  fully rendered prompt
     * @param options model parameters from configuration
     * @return raw completion text, handed to the {@link ResponseParser}
     */
    String complete(String prompt, OracleOptions options) throws Exception;
}
