package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.llm.OracleOptions;
import com.deepansh.orchestrator.llm.PromptRenderer;
import com.deepansh.orchestrator.llm.PromptRequest;
import com.deepansh.orchestrator.llm.ResponseParser;
import com.deepansh.orchestrator.model.AgentRunInput;
import com.deepansh.orchestrator.model.AgentRunOutput;
import com.deepansh.orchestrator.model.ChatEntry;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.model.TerminationReason;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.resilience.ResilientOracle;
import com.deepansh.orchestrator.scheduler.ToolScheduler;
import com.deepansh.orchestrator.stagnation.RepeatedBatchTracker;
import com.deepansh.orchestrator.stagnation.StagnationDetector;
import com.deepansh.orchestrator.stagnation.StagnationVerdict;
import com.deepansh.orchestrator.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Core iteration loop (Prompt → Oracle → Parse → Check → Schedule → Inspect).
 *
 * Per-run flow:
 * 1. Ensure the terminal tool exists, record the user prompt
 * 2. Render the prompt and let hooks rewrite it
 * 3. Ask the oracle, retrying with backoff
 * 4. Parse the completion into proposed calls
 * 5. Stagnation check per call: warn once, or force a terminal answer
 * 6. Schedule the batch and append its results to history
 * 7. Count recurring failures, stop on the terminal tool, track repeated batches
 *
 * One instance per oracle; see {@link AgentLoopFactory}. {@link #run(AgentRunInput)} keeps
 * all per-run state in an {@link AgentContext}, so an instance may serve consecutive runs.
 * It never throws: every failure ends up as a failed final answer.
 */
@Slf4j
public class AgentLoop {

    private final ResilientOracle oracle;
    private final String systemPrompt;
    private final ToolRegistry toolRegistry;
    private final ToolScheduler toolScheduler;
    private final StagnationDetector stagnationDetector;
    private final RepeatedBatchTracker batchTracker;
    private final ResponseParser responseParser;
    private final PromptRenderer promptRenderer;
    private final AgentLifecycleHooks hooks;
    private final AgentLoopProperties properties;

    public AgentLoop(ResilientOracle oracle,
                     String systemPrompt,
                     ToolRegistry toolRegistry,
                     ToolScheduler toolScheduler,
                     StagnationDetector stagnationDetector,
                     RepeatedBatchTracker batchTracker,
                     ResponseParser responseParser,
                     PromptRenderer promptRenderer,
                     List<AgentLifecycleHooks> hooks,
                     AgentLoopProperties properties) {
        this.oracle = oracle;
        this.systemPrompt = systemPrompt;
        this.toolRegistry = toolRegistry;
        this.toolScheduler = toolScheduler;
        this.stagnationDetector = stagnationDetector;
        this.batchTracker = batchTracker;
        this.responseParser = responseParser;
        this.promptRenderer = promptRenderer;
        this.hooks = new CompositeLifecycleHooks(hooks);
        this.properties = properties;
    }

    public AgentRunOutput run(AgentRunInput input) {
        String runId = UUID.randomUUID().toString();
        RunContext runCtx = new RunContext(runId);

        AgentContext context = AgentContext.builder()
                .runId(runId)
                .userPrompt(input.getUserPrompt())
                .context(input.getContext() != null ? input.getContext() : Map.of())
                .conversationHistory(copyOf(input.getConversationHistory()))
                .toolCallHistory(copyOf(input.getToolCallHistory()))
                .turnState(new TurnState())
                .build();

        log.info("Agent run started [run={}, input='{}']", runId, input.getUserPrompt());
        hooks.onRunStart(input);

        AgentRunOutput output;
        try {
            toolRegistry.ensureTerminalTool();
            context.getConversationHistory().add(ChatEntry.of(ChatEntry.Sender.user, input.getUserPrompt()));
            output = executeLoop(context, runCtx);

        } catch (RuntimeException e) {
            AgentException error = AgentException.wrap(e);
            log.error("Agent run failed [run={}, type={}]", runId, error.getType(), e);
            hooks.onError(error);

            ExecutionResult failure = ExecutionResult.failure(StagnationDetector.RUN_FAILURE_TOOL_NAME, error);
            context.getToolCallHistory().add(failure);
            output = buildOutput(context, failure,
                    error.getType() == AgentErrorType.MAX_ITERATIONS_REACHED
                            ? TerminationReason.MAX_ITERATIONS
                            : TerminationReason.FAILURE);
        } finally {
            context.getTurnState().clear();
        }

        log.info("Agent run complete [run={}, reason={}, iterations={}, latency={}ms, oracle={}ms, tools={}ms]",
                runId, output.getTerminationReason(), output.getIterationsUsed(),
                runCtx.elapsedMs(), runCtx.totalOracleLatencyMs(), runCtx.totalToolLatencyMs());
        hooks.onRunEnd(output);
        return output;
    }

    private AgentRunOutput executeLoop(AgentContext context, RunContext runCtx) {
        int maxIterations = properties.getMaxIterations();
        OracleOptions options = OracleOptions.from(properties.getOracle(), toolRegistry.getAllDefinitions());

        for (int i = 0; i < maxIterations; i++) {
            int iteration = i + 1;
            context.setCurrentIteration(iteration);
            log.info("Agent iteration {}/{} [run={}]", iteration, maxIterations, context.getRunId());
            hooks.onIterationStart(iteration);

            List<ProposedCall> calls;
            try {
                calls = proposeCalls(context, runCtx, options);
            } catch (AgentException e) {
                if (e.getType() != AgentErrorType.INVALID_RESPONSE) {
                    throw e;
                }
                recordParseFailure(context, e);
                hooks.onIterationEnd(iteration, List.of());
                pause(i, maxIterations);
                continue;
            }
            context.setParseRetryCount(0);
            context.setLastError(null);

            Optional<ExecutionResult> forced = checkStagnation(context, calls, runCtx);
            if (forced.isPresent()) {
                hooks.onIterationEnd(iteration, List.of(forced.get()));
                return finish(context, forced.get(), TerminationReason.FORCED_TERMINATION);
            }

            long start = System.nanoTime();
            List<ExecutionResult> results = toolScheduler.execute(calls, context.getTurnState(), hooks);
            runCtx.recordBatch(results, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            context.getToolCallHistory().addAll(results);
            results.forEach(r -> log.debug("Tool [{}] success={} output={}", r.getToolName(), r.isSuccess(),
                    r.isSuccess() ? r.getOutput() : r.getError()));

            recordToolFailures(context, results);

            Optional<ExecutionResult> finalAnswer = results.stream()
                    .filter(r -> ToolRegistry.FINAL_TOOL_NAME.equals(r.getToolName()) && r.isSuccess())
                    .findFirst();
            if (finalAnswer.isPresent()) {
                hooks.onIterationEnd(iteration, results);
                return finish(context, finalAnswer.get(), TerminationReason.FINAL_ANSWER);
            }

            Optional<ExecutionResult> repeated = trackRepeatedBatch(context, results, runCtx);
            hooks.onIterationEnd(iteration, results);
            if (repeated.isPresent()) {
                return finish(context, repeated.get(), TerminationReason.FORCED_TERMINATION);
            }

            pause(i, maxIterations);
        }

        log.warn("Agent hit max iterations ({}) [run={}]", maxIterations, context.getRunId());
        throw new AgentException("Maximum iterations reached", AgentErrorType.MAX_ITERATIONS_REACHED,
                Map.of("maxIterations", maxIterations));
    }

    private List<ProposedCall> proposeCalls(AgentContext context, RunContext runCtx, OracleOptions options) {
        PromptRequest request = PromptRequest.builder()
                .systemPrompt(systemPrompt)
                .userPrompt(context.getUserPrompt())
                .context(context.getContext())
                .conversationHistory(List.copyOf(context.getConversationHistory()))
                .toolCallHistory(List.copyOf(context.getToolCallHistory()))
                .lastError(context.getLastError())
                .keepRetry(context.isKeepRetry())
                .toolDefinitions(options.getTools())
                .parallelExecution(properties.isParallelExecution())
                .build();

        String prompt = hooks.onPromptCreate(promptRenderer.render(request));

        long start = System.nanoTime();
        String completion = oracle.complete(prompt, options, hooks);
        runCtx.recordOracleCall(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));

        try {
            return responseParser.parseAndValidate(completion, toolRegistry);
        } catch (AgentException e) {
            if (e.getType() == AgentErrorType.INVALID_RESPONSE) {
                throw e;
            }
            throw new AgentException(e.getMessage(), AgentErrorType.INVALID_RESPONSE, e.getContext(), e);
        } catch (RuntimeException e) {
            throw new AgentException("Could not parse oracle response: " + e.getMessage(),
                    AgentErrorType.INVALID_RESPONSE, Map.of(), e);
        }
    }

    private void recordParseFailure(AgentContext context, AgentException error) {
        int count = context.getParseRetryCount() + 1;
        context.setParseRetryCount(count);
        context.setLastError(error);
        log.warn("Unparsable oracle response ({}/{}) [run={}]: {}",
                count, properties.getRetryAttempts(), context.getRunId(), error.getMessage());
        hooks.onError(error);

        if (count >= properties.getRetryAttempts()) {
            throw new AgentException("Maximum retry attempts for error: " + error.getMessage(),
                    AgentErrorType.MAX_ITERATIONS_REACHED,
                    Map.of("attempts", count, "lastErrorType", error.getType()),
                    error);
        }
    }

    /**
     * Consults the detector for every proposed call. Warns at most once per iteration.
     *
     * @return a forced terminal result when confidence reaches the termination level
     */
    private Optional<ExecutionResult> checkStagnation(AgentContext context, List<ProposedCall> calls, RunContext runCtx) {
        AgentLoopProperties.Stagnation config = properties.getStagnation();

        for (ProposedCall call : calls) {
            StagnationVerdict verdict = stagnationDetector.evaluate(context.getToolCallHistory(), call);
            if (!verdict.stagnant()) {
                continue;
            }

            if (verdict.confidence() >= config.getTerminateConfidence()) {
                log.warn("Forcing termination: {} (confidence {}) [run={}]",
                        verdict.reason(), verdict.confidence(), context.getRunId());
                return Optional.of(forcedFinal(context, runCtx, verdict.reason(), verdict.confidence()));
            }

            if (verdict.confidence() > config.getWarnConfidence()) {
                context.setKeepRetry(false);
                Map<String, Object> warningContext = new LinkedHashMap<>();
                warningContext.put("check", verdict.check());
                warningContext.put("confidence", verdict.confidence());
                warningContext.put("toolName", call.getToolName());
                AgentException warning = new AgentException(
                        "Stagnation detected: " + verdict.reason()
                                + ". Change approach or call '" + ToolRegistry.FINAL_TOOL_NAME + "'.",
                        AgentErrorType.STAGNATION_ERROR,
                        warningContext);
                context.setLastError(warning);
                log.warn("Stagnation warning [run={}]: {} (confidence {}), diagnostics={}",
                        context.getRunId(), verdict.reason(), verdict.confidence(),
                        stagnationDetector.diagnostics(context.getToolCallHistory()));
                hooks.onError(warning);
                break;
            }
        }
        return Optional.empty();
    }

    private void recordToolFailures(AgentContext context, List<ExecutionResult> results) {
        List<ExecutionResult> failed = results.stream().filter(r -> !r.isSuccess()).toList();
        if (failed.isEmpty()) {
            return;
        }

        String message = failed.stream()
                .map(f -> "Tool: " + f.getToolName() + "\n  Error: " + (f.getError() != null ? f.getError() : "Unknown error"))
                .collect(Collectors.joining("\n"));
        List<Map<String, Object>> failedResults = failed.stream()
                .map(f -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("toolName", f.getToolName());
                    entry.put("errorType", f.getErrorType());
                    entry.put("error", f.getError());
                    return entry;
                })
                .toList();
        AgentException error = new AgentException(message, AgentErrorType.TOOL_EXECUTION_ERROR,
                Map.of("userPrompt", String.valueOf(context.getUserPrompt()), "failedResults", failedResults));
        context.setLastError(error);
        hooks.onError(error);

        int retryAttempts = properties.getRetryAttempts();
        int occurrences = context.getErrorOccurrences().merge(message, 1, Integer::sum);
        log.warn("{} tool call(s) failed, occurrence {}/{} [run={}]",
                failed.size(), occurrences, retryAttempts, context.getRunId());

        if (occurrences >= retryAttempts) {
            throw new AgentException("Maximum retry attempts for error: " + message,
                    AgentErrorType.MAX_ITERATIONS_REACHED,
                    Map.of("occurrences", occurrences, "failedResults", failedResults),
                    error);
        }
        if (occurrences >= retryAttempts - 1) {
            context.setKeepRetry(false);
        }
    }

    private Optional<ExecutionResult> trackRepeatedBatch(AgentContext context, List<ExecutionResult> results, RunContext runCtx) {
        Optional<AgentException> warning = batchTracker.track(context.getBatchOccurrences(), results);
        if (warning.isEmpty()) {
            return Optional.empty();
        }

        AgentException stagnation = warning.get();
        int count = (Integer) stagnation.getContext().get(RepeatedBatchTracker.OCCURRENCE_COUNT);
        if (count >= properties.getStagnation().getRepeatedBatchTerminationThreshold()) {
            return Optional.of(forcedFinal(context, runCtx,
                    "identical tool batch executed " + count + " times", 1.0));
        }

        context.setKeepRetry(false);
        context.setLastError(stagnation);
        hooks.onError(stagnation);
        return Optional.empty();
    }

    private ExecutionResult forcedFinal(AgentContext context, RunContext runCtx, String reason, double confidence) {
        Map<String, Object> resultContext = new LinkedHashMap<>();
        resultContext.put("forcedTermination", true);
        resultContext.put("reason", reason);
        resultContext.put("confidence", confidence);
        resultContext.put("successfulCalls", runCtx.successCounts());
        resultContext.put("failedCalls", runCtx.totalFailures());

        ExecutionResult forced = ExecutionResult.success(
                ToolRegistry.FINAL_TOOL_NAME, runCtx.progressSummary(reason), resultContext);
        context.getToolCallHistory().add(forced);
        return forced;
    }

    private AgentRunOutput finish(AgentContext context, ExecutionResult finalAnswer, TerminationReason reason) {
        context.getConversationHistory().add(ChatEntry.of(ChatEntry.Sender.ai, String.valueOf(finalAnswer.getOutput())));
        hooks.onFinalAnswer(finalAnswer);
        return buildOutput(context, finalAnswer, reason);
    }

    private AgentRunOutput buildOutput(AgentContext context, ExecutionResult finalAnswer, TerminationReason reason) {
        return AgentRunOutput.builder()
                .runId(context.getRunId())
                .conversationHistory(new ArrayList<>(context.getConversationHistory()))
                .toolCallHistory(new ArrayList<>(context.getToolCallHistory()))
                .finalAnswer(finalAnswer)
                .iterationsUsed(context.getCurrentIteration())
                .terminationReason(reason)
                .build();
    }

    private void pause(int index, int maxIterations) {
        long sleepMs = properties.getSleepBetweenIterations().toMillis();
        if (index >= maxIterations - 1 || sleepMs <= 0) {
            return;
        }
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("Run interrupted between iterations", AgentErrorType.UNKNOWN, Map.of(), e);
        }
    }

    private static <T> List<T> copyOf(List<T> source) {
        return source != null ? new ArrayList<>(source) : new ArrayList<>();
    }
}
