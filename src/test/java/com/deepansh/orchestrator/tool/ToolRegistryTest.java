package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.tool.impl.EchoTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private AgentLoopProperties props;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        props = new AgentLoopProperties();
        props.setToolTimeout(Duration.ofSeconds(10));
        registry = new ToolRegistry(List.of(new EchoTool()), props);
    }

    @Test
    void constructor_registersToolBeans() {
        assertThat(registry.hasTool("echo")).isTrue();
        assertThat(registry.toolCount()).isEqualTo(1);
    }

    @Test
    void register_duplicateName_failsFast() {
        assertThatThrownBy(() -> registry.register(StubTool.succeeding("echo", "again")))
                .isInstanceOf(AgentException.class)
                .satisfies(e -> assertThat(((AgentException) e).getType()).isEqualTo(AgentErrorType.DUPLICATE_TOOL_NAME));
    }

    @Test
    void register_nameWithSpace_failsFast() {
        assertThatThrownBy(() -> registry.register(StubTool.succeeding("read files", "x")))
                .isInstanceOf(AgentException.class)
                .satisfies(e -> assertThat(((AgentException) e).getType()).isEqualTo(AgentErrorType.INVALID_TOOL_NAME));
    }

    @Test
    void register_nameStartingWithDigit_failsFast() {
        assertThatThrownBy(() -> registry.register(StubTool.succeeding("1tool", "x")))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("1tool");
    }

    @Test
    void register_nonObjectSchema_isConfigurationError() {
        StubTool tool = StubTool.succeeding("bad_schema", "x").withSchema(Map.of("type", "string"));

        assertThatThrownBy(() -> registry.register(tool))
                .isInstanceOf(AgentException.class)
                .satisfies(e -> assertThat(((AgentException) e).getType()).isEqualTo(AgentErrorType.CONFIGURATION_ERROR));
    }

    @Test
    void register_missingOrBlankDescription_isConfigurationError() {
        assertThatThrownBy(() -> registry.register(StubTool.succeeding("no_desc", "x").withDescription(null)))
                .isInstanceOf(AgentException.class)
                .satisfies(e -> assertThat(((AgentException) e).getType()).isEqualTo(AgentErrorType.CONFIGURATION_ERROR));
        assertThatThrownBy(() -> registry.register(StubTool.succeeding("blank_desc", "x").withDescription("  ")))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("blank_desc");

        assertThat(registry.hasTool("no_desc")).isFalse();
        assertThat(registry.getAllDefinitions())
                .allSatisfy(definition -> assertThat(definition.toOpenAiSchema()).containsKey("function"));
    }

    @Test
    void register_noTimeout_backfillsGlobalTimeout() {
        RegisteredTool entry = registry.register(StubTool.succeeding("plain", "x"));
        assertThat(entry.timeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void register_timeoutAboveGlobal_isClamped() {
        RegisteredTool entry = registry.register(StubTool.succeeding("slow", "x").withTimeout(Duration.ofMinutes(5)));
        assertThat(entry.timeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void register_shorterTimeout_isKept() {
        RegisteredTool entry = registry.register(StubTool.succeeding("quick", "x").withTimeout(Duration.ofMillis(250)));
        assertThat(entry.timeout()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void register_dependencyCycle_isAcceptedWithWarning() {
        registry.register(StubTool.succeeding("tool_a", "a").dependsOn("tool_b"));
        registry.register(StubTool.succeeding("tool_b", "b").dependsOn("tool_a"));

        assertThat(registry.names()).contains("tool_a", "tool_b");
    }

    @Test
    void ensureTerminalTool_calledTwice_registersOnce() {
        registry.ensureTerminalTool();
        registry.ensureTerminalTool();

        assertThat(registry.hasTool(ToolRegistry.FINAL_TOOL_NAME)).isTrue();
        assertThat(registry.toolCount()).isEqualTo(2);
    }

    @Test
    void getAllDefinitions_sortedByName() {
        registry.register(StubTool.succeeding("alpha", "x"));
        registry.ensureTerminalTool();

        assertThat(registry.getAllDefinitions())
                .extracting(ToolDefinition::getName)
                .containsExactly("alpha", "echo", "final");
    }

    @Test
    void find_unknownOrNull_isEmpty() {
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }
}
