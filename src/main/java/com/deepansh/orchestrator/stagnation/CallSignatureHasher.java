package com.deepansh.orchestrator.stagnation;

import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.model.ProposedCall;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Stable, order-independent digests of calls and results.
 *
 * Arguments are canonicalized (map keys sorted, nested collections walked) before hashing,
 * so two maps built in a different key order hash the same. Pure and total: inputs that
 * cannot be serialized, including self-referencing structures, hash to a fixed placeholder.
 */
public final class CallSignatureHasher {

    static final String UNHASHABLE = "unhashable";
    private static final String CIRCULAR = "[Circular]";
    private static final int DIGEST_HEX_LENGTH = 16;

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private CallSignatureHasher() {}

    public static String hashCall(ProposedCall call) {
        return hashArguments(call.getArguments());
    }

    public static String hashArguments(Map<String, Object> arguments) {
        return digestOf(arguments != null ? arguments : Map.of());
    }

    /**
     * Digest of what a result produced: its output, else its context, else its error.
     * Two unrelated calls that yielded the same outcome hash the same.
     */
    public static String hashResult(ExecutionResult result) {
        Object content;
        if (result.getOutput() != null) {
            content = result.getOutput();
        } else if (result.getContext() != null && !result.getContext().isEmpty()) {
            content = result.getContext();
        } else if (result.getError() != null) {
            content = result.getError();
        } else {
            content = Map.of();
        }
        return digestOf(content);
    }

    /**
     * Key used by the stagnation checks: the producing call's argument digest when the
     * scheduler recorded it, otherwise the outcome digest.
     */
    public static String signatureOf(ExecutionResult result) {
        return result.getArgumentsHash() != null ? result.getArgumentsHash() : hashResult(result);
    }

    private static String digestOf(Object value) {
        try {
            Object canonical = canonicalize(value, Collections.newSetFromMap(new IdentityHashMap<>()));
            byte[] json = CANONICAL_MAPPER.writeValueAsBytes(canonical);
            return hex(MessageDigest.getInstance("MD5").digest(json));
        } catch (NoSuchAlgorithmException | RuntimeException | IOException e) {
            return UNHASHABLE;
        }
    }

    private static Object canonicalize(Object value, Set<Object> path) {
        if (value instanceof Map<?, ?> map) {
            if (!path.add(map)) return CIRCULAR;
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonicalize(v, path)));
            path.remove(map);
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            if (!path.add(collection)) return CIRCULAR;
            List<Object> items = new ArrayList<>(collection.size());
            collection.forEach(item -> items.add(canonicalize(item, path)));
            path.remove(collection);
            return items;
        }
        return value;
    }

    private static String hex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes).substring(0, DIGEST_HEX_LENGTH);
    }
}
