package dev.evalkit.evaluator;

import dev.evalkit.json.EvalkitJsonMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * The persisted interpretation of one evaluator invocation: the score (null on any failure), the
 * reason shown to users, the error text, and the raw output as structured details.
 */
@Slf4j
public record EvaluatorOutcome(
        @Nullable Double score,
        String reason,
        @Nullable String errorMessage,
        @Nullable Map<String, Object> details) {

    public static final String SCORE_PARSE_FAILURE = "Failed to parse score from evaluator output";
    public static final String NO_RESULT_FAILURE = "Evaluator returned no result object";

    public boolean hasError() {
        return errorMessage != null;
    }

    public static EvaluatorOutcome fromOutput(
            long evaluatorId, EvaluatorOutput output, int maxReasonDepth) {
        var details = EvalkitJsonMapper.toMap(output);
        var runError = output.evaluatorRunError();
        if (runError != null) {
            var message = "Evaluator execution error: " + runError.message();
            log.warn("evaluator {} reported an error: {}", evaluatorId, message);
            return new EvaluatorOutcome(null, message, message, details);
        }
        var result = output.evaluatorResult();
        if (result == null) {
            log.error("evaluator {} returned no result object", evaluatorId);
            return new EvaluatorOutcome(
                    null,
                    diagnosticReason(NO_RESULT_FAILURE, null, debugInfo(evaluatorId, output)),
                    NO_RESULT_FAILURE,
                    details);
        }
        var reasoning = ReasonText.unwrap(result.reasoning(), maxReasonDepth);
        if (result.score() == null) {
            log.error("evaluator {} returned no score, raw reasoning: {}", evaluatorId, reasoning);
            return new EvaluatorOutcome(
                    null,
                    diagnosticReason(
                            SCORE_PARSE_FAILURE, reasoning, debugInfo(evaluatorId, output)),
                    SCORE_PARSE_FAILURE,
                    details);
        }
        return new EvaluatorOutcome(
                result.score(), reasoning == null ? "" : reasoning, null, details);
    }

    /** Outcome for an evaluator whose invocation (or input preparation) threw. */
    public static EvaluatorOutcome fromException(Exception e) {
        var message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
        return new EvaluatorOutcome(null, message, message, null);
    }

    private static String diagnosticReason(
            String error, @Nullable String rawOutput, String debugInfo) {
        var reason = new StringBuilder("Error: ").append(error);
        if (rawOutput != null && !rawOutput.isEmpty()) {
            reason.append("\n\nRaw Output: ").append(rawOutput);
        }
        return reason.append("\n\nDebug Info: ").append(debugInfo).toString();
    }

    private static String debugInfo(long evaluatorId, EvaluatorOutput output) {
        var info = new LinkedHashMap<String, Object>();
        info.put("evaluator_id", evaluatorId);
        info.put("has_evaluator_result", output.evaluatorResult() != null);
        info.put("has_evaluator_run_error", output.evaluatorRunError() != null);
        info.put("eval_result", output);
        return EvalkitJsonMapper.toPrettyJson(info);
    }
}
