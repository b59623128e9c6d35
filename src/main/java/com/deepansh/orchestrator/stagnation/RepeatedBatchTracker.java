package com.deepansh.orchestrator.stagnation;

import com.deepansh.orchestrator.exception.AgentErrorType;
import com.deepansh.orchestrator.exception.AgentException;
import com.deepansh.orchestrator.model.ExecutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Counts how often the same batch of calls (tool names + argument digests, order ignored)
 * has been executed within a run.
 *
 * The occurrence map is owned by the caller, one per run, so the tracker itself holds no state.
 */
@Component
@Slf4j
public class RepeatedBatchTracker {

    public static final String OCCURRENCE_COUNT = "occurrenceCount";

    /**
     * Records the batch and reports a STAGNATION_ERROR from its second occurrence on.
     *
     * @param occurrences per-run counts keyed by batch digest; updated in place
     * @param batch       results of one executed batch
     * @return empty for an empty or first-seen batch
     */
    public Optional<AgentException> track(Map<String, Integer> occurrences, List<ExecutionResult> batch) {
        if (batch == null || batch.isEmpty()) {
            return Optional.empty();
        }

        List<String> calls = batch.stream()
                .map(r -> r.getToolName() + ":" + CallSignatureHasher.signatureOf(r))
                .sorted()
                .toList();
        String digest = String.join("|", calls);

        int count = occurrences.merge(digest, 1, Integer::sum);
        if (count < 2) {
            return Optional.empty();
        }

        log.warn("Identical tool batch executed {} times: {}", count, calls);
        return Optional.of(new AgentException(
                String.format("The same tool calls were executed %d times with identical arguments: %s. "
                        + "Change approach or call 'final'.", count, calls),
                AgentErrorType.STAGNATION_ERROR,
                Map.of(OCCURRENCE_COUNT, count, "calls", calls)));
    }
}
