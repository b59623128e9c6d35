package com.deepansh.orchestrator.exception;

/**
 * Classification of every failure the loop can record or raise.
 */
public enum AgentErrorType {

    /** The oracle named a tool that is not registered */
    TOOL_NOT_FOUND,

    /** Handler threw, returned nothing, a dependency failed, or the batch was rejected */
    TOOL_EXECUTION_ERROR,

    /** Handler did not finish within the tool's timeout */
    TOOL_TIMEOUT_ERROR,

    /** Oracle output could not be parsed into tool calls */
    INVALID_RESPONSE,

    /** The oracle is repeating itself without progress */
    STAGNATION_ERROR,

    /** Iteration or retry budget exhausted */
    MAX_ITERATIONS_REACHED,

    DUPLICATE_TOOL_NAME,

    INVALID_TOOL_NAME,

    /** Bad oracle or tool setup */
    CONFIGURATION_ERROR,

    UNKNOWN
}
