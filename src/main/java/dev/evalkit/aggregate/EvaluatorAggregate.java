package dev.evalkit.aggregate;

import javax.annotation.Nullable;

/**
 * Aggregate of one evaluator's non-null scores.
 *
 * @param averageScore null when the evaluator has no scores
 */
public record EvaluatorAggregate(
        long evaluatorId,
        AggregateSummary summary,
        @Nullable Double averageScore,
        long totalCount) {}
