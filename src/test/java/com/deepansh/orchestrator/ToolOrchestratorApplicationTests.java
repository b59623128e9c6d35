package com.deepansh.orchestrator;

import com.deepansh.orchestrator.core.AgentLoopFactory;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.AgentRunInput;
import com.deepansh.orchestrator.model.AgentRunOutput;
import com.deepansh.orchestrator.model.TerminationReason;
import com.deepansh.orchestrator.tool.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {
        "agent.sleep-between-iterations=0s",
        "agent.retry-delay=1ms"
})
class ToolOrchestratorApplicationTests {

    @Autowired
    private ToolRegistry toolRegistry;

    @Autowired
    private AgentLoopFactory agentLoopFactory;

    @Test
    void contextLoads_registersBuiltInTools() {
        assertThat(toolRegistry.hasTool("echo")).isTrue();
        assertThat(toolRegistry.hasTool(ToolRegistry.FINAL_TOOL_NAME)).isTrue();
    }

    @Test
    void factoryLoop_runsEchoThenFinal() {
        AtomicInteger turn = new AtomicInteger();
        AgentRunOutput output = agentLoopFactory.create((prompt, options) -> turn.getAndIncrement() == 0
                        ? "{\"name\": \"echo\", \"arguments\": {\"message\": \"wired\"}}"
                        : "{\"name\": \"final\", \"arguments\": {\"value\": \"all good\"}}",
                "You are a wiring test.")
                .run(AgentRunInput.builder().userPrompt("check the wiring").build());

        assertThat(output.getTerminationReason()).isEqualTo(TerminationReason.FINAL_ANSWER);
        assertThat(output.getFinalAnswer().getOutput()).isEqualTo("all good");
        assertThat(output.getToolCallHistory()).hasSize(2);
        assertThat(output.getToolCallHistory().get(0).getOutput()).isEqualTo("Echo: wired");
    }

    @Test
    void create_withoutOracle_throwsConfigurationError() {
        assertThatThrownBy(() -> agentLoopFactory.create(null, "prompt"))
                .isInstanceOf(AgentException.class)
                .extracting(e -> ((AgentException) e).getType())
                .isEqualTo(AgentErrorType.CONFIGURATION_ERROR);
    }
}
