package com.deepansh.orchestrator.model;

import java.time.Instant;

/**
 * Comparison key for one call in the stagnation window. Never persisted.
 */
public record CallSignature(
        String toolName,
        String argsHash,
        Instant timestamp
) {}
