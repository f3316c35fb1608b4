package dev.evalkit.evaluator;

import javax.annotation.Nullable;

/**
 * What the evaluator subsystem returned for one invocation. A present {@code evaluatorRunError}
 * is an evaluator-local failure; a present result with a null score is anomalous output.
 */
public record EvaluatorOutput(
        @Nullable EvaluatorResult evaluatorResult,
        @Nullable Usage evaluatorUsage,
        @Nullable RunError evaluatorRunError,
        long timeConsumingMs,
        @Nullable String stdout) {

    public static EvaluatorOutput scored(double score, String reasoning) {
        return new EvaluatorOutput(
                new EvaluatorResult(score, reasoning), new Usage(0, 0), null, 0, null);
    }

    public static EvaluatorOutput failed(int code, String message) {
        return new EvaluatorOutput(null, null, new RunError(code, message), 0, null);
    }

    public EvaluatorOutput withUsage(long inputTokens, long outputTokens) {
        return new EvaluatorOutput(
                evaluatorResult,
                new Usage(inputTokens, outputTokens),
                evaluatorRunError,
                timeConsumingMs,
                stdout);
    }

    public boolean isSuccess() {
        return evaluatorRunError == null
                && evaluatorResult != null
                && evaluatorResult.score() != null;
    }

    public record EvaluatorResult(@Nullable Double score, @Nullable String reasoning) {}

    public record Usage(long inputTokens, long outputTokens) {
        public long totalTokens() {
            return inputTokens + outputTokens;
        }
    }

    public record RunError(int code, String message) {}
}
