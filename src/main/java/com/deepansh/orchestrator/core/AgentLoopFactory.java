package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.llm.PromptRenderer;
import com.deepansh.orchestrator.llm.ReasoningOracle;
import com.deepansh.orchestrator.llm.ResponseParser;
import com.deepansh.orchestrator.resilience.ResilientOracle;
import com.deepansh.orchestrator.scheduler.ToolScheduler;
import com.deepansh.orchestrator.stagnation.RepeatedBatchTracker;
import com.deepansh.orchestrator.stagnation.StagnationDetector;
import com.deepansh.orchestrator.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link AgentLoop}s around caller-supplied oracles.
 *
 * The registry, scheduler, detector, parser and renderer are shared singletons.
 * Every {@link AgentLifecycleHooks} bean in the context is attached to each loop, ahead of
 * any hooks passed to {@link #create(ReasoningOracle, String, List)}.
 */
@Service
@Slf4j
public class AgentLoopFactory {

    private final ToolRegistry toolRegistry;
    private final ToolScheduler toolScheduler;
    private final StagnationDetector stagnationDetector;
    private final RepeatedBatchTracker batchTracker;
    private final ResponseParser responseParser;
    private final PromptRenderer promptRenderer;
    private final AgentLoopProperties properties;
    private final ObjectProvider<AgentLifecycleHooks> hookBeans;

    public AgentLoopFactory(ToolRegistry toolRegistry,
                            ToolScheduler toolScheduler,
                            StagnationDetector stagnationDetector,
                            RepeatedBatchTracker batchTracker,
                            ResponseParser responseParser,
                            PromptRenderer promptRenderer,
                            AgentLoopProperties properties,
                            ObjectProvider<AgentLifecycleHooks> hookBeans) {
        this.toolRegistry = toolRegistry;
        this.toolScheduler = toolScheduler;
        this.stagnationDetector = stagnationDetector;
        this.batchTracker = batchTracker;
        this.responseParser = responseParser;
        this.promptRenderer = promptRenderer;
        this.properties = properties;
        this.hookBeans = hookBeans;
    }

    public AgentLoop create(ReasoningOracle oracle, String systemPrompt) {
        return create(oracle, systemPrompt, List.of());
    }

    public AgentLoop create(ReasoningOracle oracle, String systemPrompt, List<AgentLifecycleHooks> extraHooks) {
        if (oracle == null) {
            throw new AgentException(
                    "A reasoning oracle is required to build an agent loop.",
                    AgentErrorType.CONFIGURATION_ERROR);
        }

        List<AgentLifecycleHooks> hooks = new ArrayList<>(hookBeans.orderedStream().toList());
        hooks.addAll(extraHooks);
        log.debug("Creating agent loop with {} tool(s) and {} hook(s)", toolRegistry.toolCount(), hooks.size());

        return new AgentLoop(
                new ResilientOracle(oracle, properties.getRetryAttempts(), properties.getRetryDelay()),
                systemPrompt,
                toolRegistry,
                toolScheduler,
                stagnationDetector,
                batchTracker,
                responseParser,
                promptRenderer,
                hooks,
                properties);
    }
}
