package dev.evalkit.aggregate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Computes average, sum, max, min and a three-bin distribution over scores. Null scores are
 * ignored. The bin thresholds are {@code <= 0.50}, {@code <= 0.80} and everything above, so scores
 * in the unlabeled gap between 0.80 and 0.81 are counted in the last bin.
 */
public final class AggregationEngine {
    static final List<String> BIN_LABELS = List.of("0.00-0.50", "0.51-0.80", "0.81-1.00");
    static final double LOW_UPPER = 0.50;
    static final double MID_UPPER = 0.80;

    public AggregateSummary aggregate(Collection<Double> scores) {
        var values =
                scores.stream().filter(Objects::nonNull).mapToDouble(Double::doubleValue).toArray();
        if (values.length == 0) {
            return new AggregateSummary(
                    Statistic.EMPTY,
                    Statistic.EMPTY,
                    Statistic.EMPTY,
                    Statistic.EMPTY,
                    distribution(values));
        }
        double sum = 0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (double value : values) {
            sum += value;
            max = Math.max(max, value);
            min = Math.min(min, value);
        }
        long count = values.length;
        return new AggregateSummary(
                new Statistic(sum / count, count),
                new Statistic(sum, count),
                new Statistic(max, count),
                new Statistic(min, count),
                distribution(values));
    }

    /** Aggregates one evaluator's scores; an evaluator without scores gets a null average. */
    public EvaluatorAggregate aggregateEvaluator(long evaluatorId, Collection<Double> scores) {
        var summary = aggregate(scores);
        return new EvaluatorAggregate(
                evaluatorId,
                summary,
                summary.isEmpty() ? null : summary.average().value(),
                summary.count());
    }

    static int binIndex(double score) {
        var clamped = Math.max(0.0, Math.min(1.0, score));
        if (clamped <= LOW_UPPER) {
            return 0;
        }
        return clamped <= MID_UPPER ? 1 : 2;
    }

    private static ScoreDistribution distribution(double[] values) {
        var counts = new long[BIN_LABELS.size()];
        for (double value : values) {
            counts[binIndex(value)]++;
        }
        var bins = new ArrayList<ScoreDistribution.Bin>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            var percentage = values.length == 0 ? 0.0 : round2(counts[i] * 100.0 / values.length);
            bins.add(new ScoreDistribution.Bin(BIN_LABELS.get(i), counts[i], percentage));
        }
        return new ScoreDistribution(bins);
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
