package com.deepansh.orchestrator.model;

public enum TerminationReason {
    /** The oracle called the terminal tool */
    FINAL_ANSWER,
    /** Stagnation confidence crossed the hard limit */
    FORCED_TERMINATION,
    /** Iteration or retry budget exhausted */
    MAX_ITERATIONS,
    /** Any other failure, including oracle exhaustion */
    FAILURE
}
