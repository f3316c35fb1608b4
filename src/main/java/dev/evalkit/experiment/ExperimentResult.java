package dev.evalkit.experiment;

import java.time.Instant;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Outcome of one evaluator on one dataset item within a run.
 *
 * @param score null when the evaluator failed, produced no score, or was skipped
 * @param actualOutput the evaluated output text
 * @param executionTimeMs wall time of the evaluator invocation, 0 when skipped
 */
public record ExperimentResult(
        long id,
        long experimentId,
        long runId,
        long datasetItemId,
        long evaluatorId,
        @Nullable Double score,
        String reason,
        @Nullable Map<String, Object> details,
        String actualOutput,
        long executionTimeMs,
        @Nullable String errorMessage,
        String traceId,
        Instant createdAt) {

    public boolean isSuccess() {
        return score != null && errorMessage == null;
    }

    ExperimentResult withId(long id) {
        return new ExperimentResult(
                id,
                experimentId,
                runId,
                datasetItemId,
                evaluatorId,
                score,
                reason,
                details,
                actualOutput,
                executionTimeMs,
                errorMessage,
                traceId,
                createdAt);
    }
}
