package com.deepansh.orchestrator.stagnation;

public enum StagnationCheck {
    ERROR_LOOP,
    REPEATED_CALLS,
    CYCLIC_PATTERN,
    NO_PROGRESS,
    RAPID_FIRE
}
