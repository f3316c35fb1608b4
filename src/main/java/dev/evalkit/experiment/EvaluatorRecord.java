package dev.evalkit.experiment;

import dev.evalkit.evaluator.EvaluatorInput;
import dev.evalkit.evaluator.EvaluatorOutput;
import java.time.Instant;

/** Raw input and output of one actual evaluator invocation. */
public record EvaluatorRecord(
        long id,
        long evaluatorId,
        long experimentId,
        long runId,
        long datasetItemId,
        EvaluatorInput input,
        EvaluatorOutput output,
        Status status,
        String traceId,
        Instant createdAt) {

    public enum Status {
        SUCCESS,
        FAIL
    }

    EvaluatorRecord withId(long id) {
        return new EvaluatorRecord(
                id,
                evaluatorId,
                experimentId,
                runId,
                datasetItemId,
                input,
                output,
                status,
                traceId,
                createdAt);
    }
}
