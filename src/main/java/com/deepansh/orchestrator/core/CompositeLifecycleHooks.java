package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.AgentRunInput;
import com.deepansh.orchestrator.model.AgentRunOutput;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.model.ProposedCall;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans every callback out to the registered hooks in order.
 * A hook that throws is logged and skipped; it never breaks the run.
 */
@Slf4j
public class CompositeLifecycleHooks implements AgentLifecycleHooks {

    private final List<AgentLifecycleHooks> delegates;

    public CompositeLifecycleHooks(List<AgentLifecycleHooks> delegates) {
        this.delegates = delegates != null ? List.copyOf(delegates) : List.of();
    }

    @Override
    public void onRunStart(AgentRunInput input) {
        dispatch("onRunStart", h -> h.onRunStart(input));
    }

    @Override
    public void onRunEnd(AgentRunOutput output) {
        dispatch("onRunEnd", h -> h.onRunEnd(output));
    }

    @Override
    public void onIterationStart(int iteration) {
        dispatch("onIterationStart", h -> h.onIterationStart(iteration));
    }

    @Override
    public void onIterationEnd(int iteration, List<ExecutionResult> results) {
        dispatch("onIterationEnd", h -> h.onIterationEnd(iteration, results));
    }

    /**
     * Chains the rewrites. A hook that throws or returns null leaves the prompt as it was.
     */
    @Override
    public String onPromptCreate(String prompt) {
        String current = prompt;
        for (AgentLifecycleHooks hook : delegates) {
            try {
                String rewritten = hook.onPromptCreate(current);
                if (rewritten != null) {
                    current = rewritten;
                }
            } catch (RuntimeException e) {
                log.warn("Lifecycle hook onPromptCreate failed, keeping prompt unchanged: {}", e.getMessage());
            }
        }
        return current;
    }

    @Override
    public void onOracleRequestStart(String prompt) {
        dispatch("onOracleRequestStart", h -> h.onOracleRequestStart(prompt));
    }

    @Override
    public void onOracleRequestEnd(String completion) {
        dispatch("onOracleRequestEnd", h -> h.onOracleRequestEnd(completion));
    }

    @Override
    public void onToolCallStart(ProposedCall call) {
        dispatch("onToolCallStart", h -> h.onToolCallStart(call));
    }

    @Override
    public void onToolCallEnd(ExecutionResult result) {
        dispatch("onToolCallEnd", h -> h.onToolCallEnd(result));
    }

    @Override
    public void onFinalAnswer(ExecutionResult finalAnswer) {
        dispatch("onFinalAnswer", h -> h.onFinalAnswer(finalAnswer));
    }

    @Override
    public void onError(AgentException error) {
        dispatch("onError", h -> h.onError(error));
    }

    private void dispatch(String event, Consumer<AgentLifecycleHooks> callback) {
        for (AgentLifecycleHooks hook : delegates) {
            try {
                callback.accept(hook);
            } catch (RuntimeException e) {
                log.warn("Lifecycle hook {} failed: {}", event, e.getMessage());
            }
        }
    }
}
