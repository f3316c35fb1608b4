package dev.evalkit.aggregate;

/** One aggregated value and the number of scores behind it. */
public record Statistic(double value, long count) {
    public static final Statistic EMPTY = new Statistic(0.0, 0);
}
