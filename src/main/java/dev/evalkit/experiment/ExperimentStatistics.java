package dev.evalkit.experiment;

import dev.evalkit.aggregate.EvaluatorAggregate;
import java.util.List;

/**
 * Result counts, per-evaluator aggregates and evaluator token usage of an experiment or one of its
 * runs.
 */
public record ExperimentStatistics(
        long experimentId,
        long totalCount,
        long successCount,
        long failureCount,
        long pendingCount,
        List<EvaluatorAggregate> evaluatorAggregates,
        TokenUsage tokenUsage) {

    public ExperimentStatistics {
        evaluatorAggregates = List.copyOf(evaluatorAggregates);
    }

    public record TokenUsage(long inputTokens, long outputTokens) {
        public long totalTokens() {
            return inputTokens + outputTokens;
        }
    }
}
