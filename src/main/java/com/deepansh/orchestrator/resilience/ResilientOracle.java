package com.deepansh.orchestrator.resilience;

import com.deepansh.orchestrator.core.AgentLifecycleHooks;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.llm.OracleOptions;
import com.deepansh.orchestrator.llm.ReasoningOracle;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

/**
 * Decorator around a {@link ReasoningOracle} that adds retry with exponential backoff
 * through a resilience4j {@link Retry}.
 *
 * Backoff: retryDelay, 2 x retryDelay, 4 x retryDelay ...
 * Every exception is retried. Once attempts are exhausted the last failure is rethrown
 * as an UNKNOWN {@link AgentException} which ends the run.
 */
@Slf4j
public class ResilientOracle {

    private final ReasoningOracle delegate;
    private final Retry retry;

    public ResilientOracle(ReasoningOracle delegate, int maxAttempts, Duration initialDelay) {
        this.delegate = delegate;

        long delayMs = Math.max(1L, initialDelay.toMillis());
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(delayMs), 2.0))
                .build();

        this.retry = Retry.of("reasoningOracle", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Oracle attempt {} failed, retrying in {}ms: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Sends the prompt, firing the oracle request hooks around every attempt.
     *
     * @throws AgentException of type UNKNOWN when every attempt failed
     */
    public String complete(String prompt, OracleOptions options, AgentLifecycleHooks hooks) {
        try {
            return retry.executeCallable(() -> {
                hooks.onOracleRequestStart(prompt);
                String completion = delegate.complete(prompt, options);
                hooks.onOracleRequestEnd(completion);
                return completion;
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("Interrupted while waiting for the oracle", AgentErrorType.UNKNOWN, Map.of(), e);
        } catch (Exception e) {
            int attempts = retry.getRetryConfig().getMaxAttempts();
            log.error("Oracle request failed after {} attempt(s): {}", attempts, e.getMessage());
            throw new AgentException(
                    "Oracle request failed after " + attempts + " attempt(s): " + e.getMessage(),
                    AgentErrorType.UNKNOWN,
                    Map.of("attempts", attempts, "exception", e.getClass().getName()),
                    e);
        }
    }
}
