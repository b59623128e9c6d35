package com.deepansh.orchestrator.stagnation;

import com.deepansh.orchestrator.config.AgentLoopProperties;
import com.deepansh.orchestrator.model.CallSignature;
import com.deepansh.orchestrator.model.ExecutionResult;
import com.deepansh.orchestrator.model.ProposedCall;
import com.deepansh.orchestrator.tool.ToolRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags an oracle that is looping without progress.
 *
 * Five independent heuristics run against the call history plus the newly proposed call:
 * error loops, repeated identical calls, cyclic A→B→A patterns, low success with repetitive
 * outcomes, and rapid-fire bursts. The most confident positive check wins; on a tie the check
 * run first wins. Stateless: the window is derived from the history passed in on every call.
 */
@Component
public class StagnationDetector {

    /** Synthetic results that never count as calls */
    public static final String RUN_FAILURE_TOOL_NAME = "run-failure";

    private static final int REPEAT_LOOKBACK = 5;
    private static final int PROGRESS_LOOKBACK = 5;
    private static final int ERROR_LOOKBACK = 8;
    private static final int BURST_SIZE = 5;
    private static final Duration BURST_SPAN = Duration.ofSeconds(5);

    private final AgentLoopProperties.Stagnation config;

    public StagnationDetector(AgentLoopProperties properties) {
        this.config = properties.getStagnation();
    }

    public StagnationVerdict evaluate(List<ExecutionResult> history, ProposedCall newCall) {
        List<CallSignature> window = buildWindow(history, newCall);

        List<StagnationVerdict> checks = new ArrayList<>();
        checks.add(checkErrorLoops(history));
        checks.add(checkRepeatedCalls(window));
        checks.add(checkCyclicPatterns(window));
        checks.add(checkNoProgress(history));
        if (config.isTimeBasedDetection()) {
            checks.add(checkRapidFire(window));
        }

        StagnationVerdict best = StagnationVerdict.notStagnant();
        for (StagnationVerdict verdict : checks) {
            if (verdict.stagnant() && (!best.stagnant() || verdict.confidence() > best.confidence())) {
                best = verdict;
            }
        }
        return best;
    }

    /**
     * Summary for logs: the last ten calls with their outcome, per-tool frequency, success rate.
     */
    public StagnationDiagnostics diagnostics(List<ExecutionResult> history) {
        List<String> recent = tail(history, 10).stream()
                .map(r -> r.getToolName() + "(" + (r.isSuccess() ? "✓" : "✗") + ")")
                .toList();

        Map<String, Long> frequency = history.stream()
                .filter(r -> !isSynthetic(r))
                .collect(Collectors.groupingBy(ExecutionResult::getToolName, LinkedHashMap::new, Collectors.counting()));

        long successes = history.stream().filter(ExecutionResult::isSuccess).count();
        double successRate = history.isEmpty() ? 1.0 : (double) successes / history.size();

        return new StagnationDiagnostics(recent, frequency, successRate);
    }

    List<CallSignature> buildWindow(List<ExecutionResult> history, ProposedCall newCall) {
        List<CallSignature> window = new ArrayList<>();
        for (ExecutionResult result : history) {
            if (!isSynthetic(result)) {
                window.add(new CallSignature(
                        result.getToolName(),
                        CallSignatureHasher.signatureOf(result),
                        result.getTimestamp() != null ? result.getTimestamp() : Instant.now()));
            }
        }
        if (newCall != null) {
            window.add(new CallSignature(newCall.getToolName(), CallSignatureHasher.hashCall(newCall), Instant.now()));
        }
        return tail(window, config.getWindowSize());
    }

    private StagnationVerdict checkRepeatedCalls(List<CallSignature> window) {
        int threshold = config.getRepeatedCallThreshold();
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> toolByKey = new LinkedHashMap<>();

        for (CallSignature call : tail(window, REPEAT_LOOKBACK)) {
            String key = call.toolName() + ":" + call.argsHash();
            counts.merge(key, 1, Integer::sum);
            toolByKey.putIfAbsent(key, call.toolName());
        }

        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count >= threshold) {
                double confidence = count == threshold ? 0.75 : (double) count / (threshold + 1);
                return StagnationVerdict.stagnant(StagnationCheck.REPEATED_CALLS,
                        String.format("Tool call %s repeated %d times with same arguments",
                                toolByKey.get(entry.getKey()), count),
                        confidence);
            }
        }
        return StagnationVerdict.notStagnant();
    }

    private StagnationVerdict checkCyclicPatterns(List<CallSignature> window) {
        int threshold = config.getCyclicPatternThreshold();
        List<String> names = window.stream().map(CallSignature::toolName).toList();

        for (int length = 2; length <= 4; length++) {
            if (names.size() < length * 2) {
                break;
            }
            for (int start = 0; start <= names.size() - length * 2; start++) {
                List<String> pattern = names.subList(start, start + length);
                int matches = 1;
                for (int next = start + length; next <= names.size() - length; next += length) {
                    if (pattern.equals(names.subList(next, next + length))) {
                        matches++;
                    } else {
                        break;
                    }
                }
                if (matches >= threshold) {
                    return StagnationVerdict.stagnant(StagnationCheck.CYCLIC_PATTERN,
                            "Cyclic pattern detected: " + String.join("→", pattern) + " x" + matches,
                            (double) matches / threshold);
                }
            }
        }
        return StagnationVerdict.notStagnant();
    }

    private StagnationVerdict checkNoProgress(List<ExecutionResult> history) {
        if (history.size() < PROGRESS_LOOKBACK) {
            return StagnationVerdict.notStagnant();
        }
        List<ExecutionResult> recent = tail(history, PROGRESS_LOOKBACK);
        long successes = recent.stream().filter(ExecutionResult::isSuccess).count();
        double successRate = (double) successes / recent.size();
        if (successRate >= 0.4) {
            return StagnationVerdict.notStagnant();
        }

        long distinctOutcomes = recent.stream().map(CallSignatureHasher::hashResult).distinct().count();
        double diversity = (double) distinctOutcomes / recent.size();
        if (diversity < 0.3) {
            return StagnationVerdict.stagnant(StagnationCheck.NO_PROGRESS,
                    "Low success rate with repetitive outputs", 0.8);
        }
        return StagnationVerdict.notStagnant();
    }

    private StagnationVerdict checkErrorLoops(List<ExecutionResult> history) {
        int threshold = config.getErrorLoopThreshold();
        List<ExecutionResult> errors = tail(history, ERROR_LOOKBACK).stream()
                .filter(r -> !r.isSuccess() && r.getError() != null)
                .toList();
        if (errors.size() < threshold) {
            return StagnationVerdict.notStagnant();
        }

        List<List<ExecutionResult>> groups = new ArrayList<>();
        for (ExecutionResult error : errors) {
            groups.stream()
                    .filter(group -> similarErrors(error, group.get(0)))
                    .findFirst()
                    .ifPresentOrElse(group -> group.add(error), () -> {
                        List<ExecutionResult> group = new ArrayList<>();
                        group.add(error);
                        groups.add(group);
                    });
        }

        for (List<ExecutionResult> group : groups) {
            int size = group.size();
            if (size >= threshold) {
                double confidence = size == threshold ? 0.85 : (double) size / threshold;
                ExecutionResult first = group.get(0);
                return StagnationVerdict.stagnant(StagnationCheck.ERROR_LOOP,
                        String.format("Repeated error pattern in %s: %s...",
                                first.getToolName(), abbreviate(first.getError(), 50)),
                        confidence);
            }
        }
        return StagnationVerdict.notStagnant();
    }

    private StagnationVerdict checkRapidFire(List<CallSignature> window) {
        if (window.size() < BURST_SIZE) {
            return StagnationVerdict.notStagnant();
        }
        List<CallSignature> burst = tail(window, BURST_SIZE);
        Duration span = Duration.between(burst.get(0).timestamp(), burst.get(burst.size() - 1).timestamp());
        if (span.compareTo(BURST_SPAN) < 0) {
            return StagnationVerdict.stagnant(StagnationCheck.RAPID_FIRE, "Rapid-fire tool calls detected", 0.7);
        }
        return StagnationVerdict.notStagnant();
    }

    private boolean similarErrors(ExecutionResult a, ExecutionResult b) {
        return a.getToolName() != null
                && a.getToolName().equals(b.getToolName())
                && jaccard(a.getError(), b.getError()) > config.getSimilarityThreshold();
    }

    static double jaccard(String a, String b) {
        Set<String> wordsA = words(a);
        Set<String> wordsB = words(b);
        if (wordsA.isEmpty() && wordsB.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String s) {
        if (s == null || s.isBlank()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(s.toLowerCase(Locale.ROOT).trim().split("\\s+")));
    }

    private static boolean isSynthetic(ExecutionResult result) {
        return ToolRegistry.FINAL_TOOL_NAME.equals(result.getToolName())
                || RUN_FAILURE_TOOL_NAME.equals(result.getToolName());
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static <T> List<T> tail(List<T> list, int n) {
        return list.size() <= n ? list : list.subList(list.size() - n, list.size());
    }
}
