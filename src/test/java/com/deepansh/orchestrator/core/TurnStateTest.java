package com.deepansh.orchestrator.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnStateTest {

    private final TurnState state = new TurnState();

    @Test
    void put_thenGet_returnsValue() {
        state.put("content", "hello");

        assertThat(state.<String>get("content")).contains("hello");
        assertThat(state.has("content")).isTrue();
    }

    @Test
    void put_null_removesKey() {
        state.put("content", "hello");
        state.put("content", null);

        assertThat(state.has("content")).isFalse();
        assertThat(state.get("content")).isEmpty();
    }

    @Test
    void getOrFail_missingKey_throws() {
        assertThatThrownBy(() -> state.getOrFail("missing"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'missing'");
    }

    @Test
    void getAndClear_removesAfterRead() {
        state.put("draft", 42);

        assertThat(state.<Integer>getAndClear("draft")).contains(42);
        assertThat(state.has("draft")).isFalse();
    }

    @Test
    void concurrentWriters_allKeysLand() {
        List<CompletableFuture<Void>> writers = IntStream.range(0, 50)
                .mapToObj(i -> CompletableFuture.runAsync(() -> state.put("key" + i, i)))
                .toList();
        writers.forEach(CompletableFuture::join);

        assertThat(state.size()).isEqualTo(50);
        state.clear();
        assertThat(state.size()).isZero();
    }
}
