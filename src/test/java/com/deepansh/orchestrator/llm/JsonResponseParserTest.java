package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.deepansh.orchestrator.tool.impl.EchoTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonResponseParserTest {

    private JsonResponseParser parser;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        parser = new JsonResponseParser(new ObjectMapper());
        registry = new ToolRegistry(List.of(new EchoTool()), new AgentLoopProperties());
        registry.ensureTerminalTool();
    }

    @Test
    void parse_toolCallsObject_returnsCallsInOrder() {
        List<ProposedCall> calls = parser.parseAndValidate("""
                {"tool_calls": [
                  {"name": "echo", "arguments": {"message": "hi"}},
                  {"name": "final", "arguments": {"value": "done"}}
                ]}""", registry);

        assertThat(calls).extracting(ProposedCall::getToolName).containsExactly("echo", "final");
        assertThat(calls.get(0).getArguments()).containsEntry("message", "hi");
    }

    @Test
    void parse_bareArray_isAccepted() {
        List<ProposedCall> calls = parser.parseAndValidate(
                "[{\"name\": \"echo\", \"arguments\": {\"message\": \"hi\"}}]", registry);

        assertThat(calls).singleElement().extracting(ProposedCall::getToolName).isEqualTo("echo");
    }

    @Test
    void parse_singleObjectWithAliases_isAccepted() {
        List<ProposedCall> calls = parser.parseAndValidate(
                "{\"toolName\": \"echo\", \"args\": {\"message\": \"hi\"}}", registry);

        assertThat(calls).singleElement().satisfies(call -> {
            assertThat(call.getToolName()).isEqualTo("echo");
            assertThat(call.getArguments()).containsEntry("message", "hi");
        });
    }

    @Test
    void parse_codeFence_isStripped() {
        List<ProposedCall> calls = parser.parseAndValidate("""
                Sure, here you go:
                ```json
                {"toolCalls": [{"name": "final", "arguments": {"value": "42"}}]}
                ```""", registry);

        assertThat(calls).singleElement().extracting(ProposedCall::getToolName).isEqualTo("final");
    }

    @Test
    void parse_openAiFunctionWithStringArguments_isDecoded() {
        List<ProposedCall> calls = parser.parseAndValidate("""
                {"tool_calls": [{"id": "call_1", "type": "function",
                  "function": {"name": "echo", "arguments": "{\\"message\\": \\"nested\\"}"}}]}""", registry);

        assertThat(calls).singleElement().satisfies(call -> {
            assertThat(call.getId()).isEqualTo("call_1");
            assertThat(call.getArguments()).isEqualTo(Map.of("message", "nested"));
        });
    }

    @Test
    void parse_missingArguments_defaultsToEmpty() {
        List<ProposedCall> calls = parser.parseAndValidate("{\"name\": \"echo\"}", registry);

        assertThat(calls.get(0).getArguments()).isEmpty();
    }

    @Test
    void parse_unknownTool_isPassedThrough() {
        List<ProposedCall> calls = parser.parseAndValidate("{\"name\": \"teleport\"}", registry);

        assertThat(calls).singleElement().extracting(ProposedCall::getToolName).isEqualTo("teleport");
    }

    @Test
    void parse_malformedJson_isInvalidResponse() {
        assertInvalid("I think I should call echo next");
    }

    @Test
    void parse_emptyCallList_isInvalidResponse() {
        assertInvalid("{\"tool_calls\": []}");
    }

    @Test
    void parse_blank_isInvalidResponse() {
        assertInvalid("   ");
    }

    @Test
    void parse_callWithoutName_isInvalidResponse() {
        assertInvalid("[{\"arguments\": {\"message\": \"hi\"}}]");
    }

    @Test
    void parse_nonObjectArguments_isInvalidResponse() {
        assertInvalid("{\"name\": \"echo\", \"arguments\": [1, 2]}");
    }

    private void assertInvalid(String completion) {
        assertThatThrownBy(() -> parser.parseAndValidate(completion, registry))
                .isInstanceOf(AgentException.class)
                .satisfies(e -> assertThat(((AgentException) e).getType()).isEqualTo(AgentErrorType.INVALID_RESPONSE));
    }
}
