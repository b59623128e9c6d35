package com.deepansh.orchestrator.resilience;

import com.deepansh.orchestrator.core.AgentLifecycleHooks;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.llm.OracleOptions;
import com.deepansh.orchestrator.llm.ReasoningOracle;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientOracleTest {

    private static final OracleOptions OPTIONS = OracleOptions.builder().tools(List.of()).build();

    @Test
    void complete_transientFailures_retriesUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        ReasoningOracle flaky = (prompt, options) -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "ok";
        };
        CountingHooks hooks = new CountingHooks();

        String completion = new ResilientOracle(flaky, 3, Duration.ofMillis(1)).complete("prompt", OPTIONS, hooks);

        assertThat(completion).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(hooks.starts.get()).isEqualTo(3);
        assertThat(hooks.ends.get()).isEqualTo(1);
    }

    @Test
    void complete_allAttemptsFail_throwsUnknownAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        ReasoningOracle down = (prompt, options) -> {
            calls.incrementAndGet();
            throw new IOException("503 Service Unavailable");
        };

        assertThatThrownBy(() -> new ResilientOracle(down, 3, Duration.ofMillis(1))
                .complete("prompt", OPTIONS, new CountingHooks()))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("after 3 attempt(s)")
                .hasMessageContaining("503 Service Unavailable")
                .satisfies(e -> assertThat(((AgentException) e).getType()).isEqualTo(AgentErrorType.UNKNOWN));
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void complete_singleAttempt_doesNotRetry() {
        AtomicInteger calls = new AtomicInteger();
        ReasoningOracle down = (prompt, options) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bad key");
        };

        assertThatThrownBy(() -> new ResilientOracle(down, 1, Duration.ZERO)
                .complete("prompt", OPTIONS, new CountingHooks()))
                .isInstanceOf(AgentException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void complete_passesPromptAndOptionsThrough() {
        ReasoningOracle echo = (prompt, options) -> prompt + "|" + options.getMaxTokens();
        OracleOptions options = OracleOptions.builder().maxTokens(128).build();

        assertThat(new ResilientOracle(echo, 2, Duration.ofMillis(1)).complete("hi", options, new CountingHooks()))
                .isEqualTo("hi|128");
    }

    static class CountingHooks implements AgentLifecycleHooks {
        final AtomicInteger starts = new AtomicInteger();
        final AtomicInteger ends = new AtomicInteger();

        @Override
        public void onOracleRequestStart(String prompt) {
            starts.incrementAndGet();
        }

        @Override
        public void onOracleRequestEnd(String completion) {
            ends.incrementAndGet();
        }
    }
}
