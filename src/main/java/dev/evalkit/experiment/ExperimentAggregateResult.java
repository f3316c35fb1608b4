package dev.evalkit.experiment;

import dev.evalkit.aggregate.AggregateSummary;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * Latest aggregate of one evaluator's scores within an experiment. Recomputing replaces the row.
 *
 * @param averageScore copy of {@code aggregateData.average().value()}, null without scores
 */
public record ExperimentAggregateResult(
        long experimentId,
        long evaluatorId,
        AggregateSummary aggregateData,
        @Nullable Double averageScore,
        Instant updatedAt) {}
