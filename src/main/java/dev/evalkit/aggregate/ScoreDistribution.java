package dev.evalkit.aggregate;

import java.util.List;

/** Score histogram over the fixed bins of {@link AggregationEngine}. */
public record ScoreDistribution(List<Bin> items) {

    public ScoreDistribution {
        items = List.copyOf(items);
    }

    public int bins() {
        return items.size();
    }

    public long totalCount() {
        return items.stream().mapToLong(Bin::count).sum();
    }

    /**
     * @param scoreRange display label such as {@code 0.51-0.80}
     * @param percentage share of all scores, rounded to two decimals
     */
    public record Bin(String scoreRange, long count, double percentage) {}
}
