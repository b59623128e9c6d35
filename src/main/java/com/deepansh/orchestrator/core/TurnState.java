package com.deepansh.orchestrator.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key-value scratch space shared by every tool handler within one run.
 *
 * Created fresh by each {@code AgentLoop.run()} and dropped when it returns.
 * Handlers of a parallel batch may read and write concurrently; writes to the
 * same key are last-writer-wins. Null values are not stored: putting null removes the key.
 */
public class TurnState {

    private final Map<String, Object> store = new ConcurrentHashMap<>();

    public void put(String key, Object value) {
        if (value == null) {
            store.remove(key);
        } else {
            store.put(key, value);
        }
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        return Optional.ofNullable((T) store.get(key));
    }

    public boolean has(String key) {
        return store.containsKey(key);
    }

    /**
     * For handlers that cannot proceed without a value stashed by an earlier tool.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrFail(String key) {
        Object value = store.get(key);
        if (value == null) {
            throw new IllegalStateException(
                    "State Error: Required key '" + key + "' not found in the current turn's state.");
        }
        return (T) value;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> getAndClear(String key) {
        return Optional.ofNullable((T) store.remove(key));
    }

    public void clear() {
        store.clear();
    }

    public int size() {
        return store.size();
    }
}
