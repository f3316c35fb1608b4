package dev.evalkit.aggregate;

/** Statistical summary of one evaluator's scores. */
public record AggregateSummary(
        Statistic average,
        Statistic sum,
        Statistic max,
        Statistic min,
        ScoreDistribution distribution) {

    public long count() {
        return average.count();
    }

    public boolean isEmpty() {
        return count() == 0;
    }
}
