package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.AgentRunInput;
import com.deepansh.orchestrator.model.AgentRunOutput;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.model.ProposedCall;

import java.util.List;

/**
 * Optional observers of a run. Every method defaults to a no-op.
 *
 * All hooks are notifications except {@link #onPromptCreate(String)}, which may return
 * a rewritten prompt. Tool-call hooks fire on scheduler threads.
 */
public interface AgentLifecycleHooks {

    default void onRunStart(AgentRunInput input) {}

    default void onRunEnd(AgentRunOutput output) {}

    default void onIterationStart(int iteration) {}

    default void onIterationEnd(int iteration, List<ExecutionResult> results) {}

    default String onPromptCreate(String prompt) {
        return prompt;
    }

    default void onOracleRequestStart(String prompt) {}

    default void onOracleRequestEnd(String completion) {}

    default void onToolCallStart(ProposedCall call) {}

    default void onToolCallEnd(ExecutionResult result) {}

    default void onFinalAnswer(ExecutionResult finalAnswer) {}

    default void onError(AgentException error) {}
}
