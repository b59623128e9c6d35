package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.tool.ToolRegistry;

import java.util.List;

public interface ResponseParser {

    /**
     * Turns a completion into the batch of calls it proposes.
     *
     * @throws AgentException INVALID_RESPONSE when the text holds no well-formed calls
     */
    List<ProposedCall> parseAndValidate(String completion, ToolRegistry toolRegistry);
}
