package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.scheduler.ExecutionGraph;
import com.deepansh.orchestrator.tool.impl.FinalTool;
import com.networknt.schema.JsonSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Central registry for all AgentTool implementations.
 *
 * Spring auto-discovers every @Component that implements AgentTool and injects
 * them as a List<AgentTool>; more can be added with {@link #register(AgentTool)}.
 * Tools are indexed by name for O(1) dispatch. Name shape and uniqueness are
 * checked here, at registration, never at call time.
 */
@Component
@Slf4j
public class ToolRegistry {

    public static final String FINAL_TOOL_NAME = FinalTool.NAME;

    private static final Pattern VALID_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private final Map<String, RegisteredTool> tools = new ConcurrentHashMap<>();
    private final AgentLoopProperties properties;

    public ToolRegistry(List<AgentTool> toolBeans, AgentLoopProperties properties) {
        this.properties = properties;
        toolBeans.forEach(this::register);
        log.info("Total tools registered: {}", tools.size());
    }

    /**
     * Registers a tool, back-filling the default timeout.
     *
     * @throws AgentException INVALID_TOOL_NAME, DUPLICATE_TOOL_NAME or CONFIGURATION_ERROR
     */
    public synchronized RegisteredTool register(AgentTool tool) {
        String name = tool.getName();

        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new AgentException(
                    "Tool name '" + name + "' must start with a letter or underscore and contain only letters, numbers, and underscores.",
                    AgentErrorType.INVALID_TOOL_NAME,
                    contextOf("toolName", name, "validPattern", VALID_NAME.pattern()));
        }
        if (tools.containsKey(name)) {
            throw new AgentException(
                    "A tool with the name '" + name + "' is already defined.",
                    AgentErrorType.DUPLICATE_TOOL_NAME,
                    contextOf("toolName", name, "existingTools", names()));
        }
        if (tool.getDescription() == null || tool.getDescription().isBlank()) {
            throw new AgentException(
                    "Tool '" + name + "' must have a non-blank description.",
                    AgentErrorType.CONFIGURATION_ERROR,
                    contextOf("toolName", name));
        }
        Map<String, Object> schema = tool.getInputSchema();
        if (schema == null || !"object".equals(schema.get("type"))) {
            throw new AgentException(
                    "The input schema for tool '" + name + "' must be a JSON Schema of type 'object'.",
                    AgentErrorType.CONFIGURATION_ERROR,
                    contextOf("toolName", name));
        }

        JsonSchema argumentSchema;
        try {
            argumentSchema = ToolArgumentValidator.compile(schema);
        } catch (RuntimeException e) {
            throw new AgentException(
                    "The input schema for tool '" + name + "' could not be compiled: " + e.getMessage(),
                    AgentErrorType.CONFIGURATION_ERROR,
                    contextOf("toolName", name),
                    e);
        }

        RegisteredTool entry = new RegisteredTool(
                tool,
                resolveTimeout(tool),
                tool.getDependencies() != null ? List.copyOf(tool.getDependencies()) : List.of(),
                argumentSchema);
        tools.put(name, entry);
        log.info("Registered tool: [{}] dependencies={} timeout={}", name, entry.dependencies(), entry.timeout());

        warnOnDependencyCycle();
        return entry;
    }

    /**
     * Registers the built-in terminal tool unless one is already present. Safe to call repeatedly.
     */
    public synchronized void ensureTerminalTool() {
        if (!tools.containsKey(FINAL_TOOL_NAME)) {
            register(new FinalTool());
        }
    }

    public Optional<RegisteredTool> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .sorted(Comparator.comparing(RegisteredTool::name))
                .map(entry -> ToolDefinition.from(entry.tool()))
                .collect(Collectors.toList());
    }

    public Set<String> names() {
        return Set.copyOf(tools.keySet());
    }

    public int toolCount() {
        return tools.size();
    }

    private Duration resolveTimeout(AgentTool tool) {
        Duration global = properties.getToolTimeout();
        Duration requested = tool.getTimeout();
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return global;
        }
        if (requested.compareTo(global) > 0) {
            log.warn("Tool [{}] timeout {} exceeds global timeout {}. Using global timeout.",
                    tool.getName(), requested, global);
            return global;
        }
        return requested;
    }

    private void warnOnDependencyCycle() {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        tools.values().forEach(t -> adjacency.put(t.name(), t.dependencies()));
        List<String> cycle = ExecutionGraph.findCycle(adjacency);
        if (!cycle.isEmpty()) {
            log.warn("Registered tools form a dependency cycle: {}. Batches calling all of them will be rejected.",
                    String.join(" -> ", cycle));
        }
    }

    private static Map<String, Object> contextOf(Object... kv) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            ctx.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return ctx;
    }
}
