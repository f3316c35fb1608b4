package dev.evalkit.experiment;

import dev.evalkit.aggregate.AggregateSummary;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;

/**
 * Storage for experiments and everything they own. Updates go through {@link UnaryOperator}s so an
 * implementation can apply them atomically against the current row.
 */
public interface ExperimentStore {
    Experiment createExperiment(CreateExperimentRequest request, Instant now);

    Optional<Experiment> findExperiment(long experimentId);

    Optional<Experiment> findExperimentByName(String name);

    List<Experiment> listExperiments();

    /**
     * @throws NotFoundException when the experiment does not exist
     */
    Experiment updateExperiment(long experimentId, UnaryOperator<Experiment> update);

    /** Deletes the experiment with its runs, results, aggregates and evaluator records. */
    boolean deleteExperiment(long experimentId);

    /** Creates a pending run numbered one past the experiment's current run count. */
    ExperimentRun createRun(long experimentId, Instant now);

    Optional<ExperimentRun> findRun(long runId);

    /** Runs of one experiment ordered by run number. */
    List<ExperimentRun> listRuns(long experimentId);

    /**
     * @throws NotFoundException when the run does not exist
     */
    ExperimentRun updateRun(long runId, UnaryOperator<ExperimentRun> update);

    /** Stores the result under a fresh id, which is returned in the stored copy. */
    ExperimentResult insertResult(ExperimentResult result);

    /** Results in insertion order, optionally limited to one run. */
    List<ExperimentResult> listResults(long experimentId, @Nullable Long runId);

    EvaluatorRecord insertEvaluatorRecord(EvaluatorRecord evaluatorRecord);

    List<EvaluatorRecord> listEvaluatorRecords(long experimentId, @Nullable Long runId);

    /** Replaces the aggregate stored for (experiment, evaluator). */
    ExperimentAggregateResult upsertAggregate(
            long experimentId, long evaluatorId, AggregateSummary summary, Instant now);

    List<ExperimentAggregateResult> listAggregates(long experimentId);

    /** Implementation for test doubling and embedded use */
    class InMemoryImpl implements ExperimentStore {
        private final AtomicLong ids = new AtomicLong();
        private final Map<Long, Experiment> experiments = new ConcurrentHashMap<>();
        private final Map<Long, ExperimentRun> runs = new ConcurrentHashMap<>();
        private final Map<Long, ExperimentResult> results = new ConcurrentHashMap<>();
        private final Map<Long, EvaluatorRecord> evaluatorRecords = new ConcurrentHashMap<>();
        private final Map<AggregateKey, ExperimentAggregateResult> aggregates =
                new ConcurrentHashMap<>();

        @Override
        public synchronized Experiment createExperiment(
                CreateExperimentRequest request, Instant now) {
            var experiment = Experiment.create(ids.incrementAndGet(), request, now);
            experiments.put(experiment.id(), experiment);
            return experiment;
        }

        @Override
        public Optional<Experiment> findExperiment(long experimentId) {
            return Optional.ofNullable(experiments.get(experimentId));
        }

        @Override
        public Optional<Experiment> findExperimentByName(String name) {
            return experiments.values().stream()
                    .filter(experiment -> experiment.name().equals(name))
                    .findFirst();
        }

        @Override
        public List<Experiment> listExperiments() {
            return experiments.values().stream()
                    .sorted(Comparator.comparingLong(Experiment::id))
                    .toList();
        }

        @Override
        public synchronized Experiment updateExperiment(
                long experimentId, UnaryOperator<Experiment> update) {
            var current =
                    findExperiment(experimentId)
                            .orElseThrow(() -> NotFoundException.experiment(experimentId));
            var updated = update.apply(current);
            experiments.put(experimentId, updated);
            return updated;
        }

        @Override
        public synchronized boolean deleteExperiment(long experimentId) {
            if (experiments.remove(experimentId) == null) {
                return false;
            }
            runs.values().removeIf(run -> run.experimentId() == experimentId);
            results.values().removeIf(result -> result.experimentId() == experimentId);
            evaluatorRecords
                    .values()
                    .removeIf(evaluatorRecord -> evaluatorRecord.experimentId() == experimentId);
            aggregates.keySet().removeIf(key -> key.experimentId() == experimentId);
            return true;
        }

        @Override
        public synchronized ExperimentRun createRun(long experimentId, Instant now) {
            if (!experiments.containsKey(experimentId)) {
                throw NotFoundException.experiment(experimentId);
            }
            var runNumber = listRuns(experimentId).size() + 1;
            var run = ExperimentRun.create(ids.incrementAndGet(), experimentId, runNumber, now);
            runs.put(run.id(), run);
            return run;
        }

        @Override
        public Optional<ExperimentRun> findRun(long runId) {
            return Optional.ofNullable(runs.get(runId));
        }

        @Override
        public List<ExperimentRun> listRuns(long experimentId) {
            return runs.values().stream()
                    .filter(run -> run.experimentId() == experimentId)
                    .sorted(Comparator.comparingInt(ExperimentRun::runNumber))
                    .toList();
        }

        @Override
        public synchronized ExperimentRun updateRun(
                long runId, UnaryOperator<ExperimentRun> update) {
            var current = findRun(runId).orElseThrow(() -> NotFoundException.run(runId));
            var updated = update.apply(current);
            runs.put(runId, updated);
            return updated;
        }

        @Override
        public ExperimentResult insertResult(ExperimentResult result) {
            var stored = result.withId(ids.incrementAndGet());
            results.put(stored.id(), stored);
            return stored;
        }

        @Override
        public List<ExperimentResult> listResults(long experimentId, @Nullable Long runId) {
            return results.values().stream()
                    .filter(result -> result.experimentId() == experimentId)
                    .filter(result -> runId == null || result.runId() == runId)
                    .sorted(Comparator.comparingLong(ExperimentResult::id))
                    .toList();
        }

        @Override
        public EvaluatorRecord insertEvaluatorRecord(EvaluatorRecord evaluatorRecord) {
            var stored = evaluatorRecord.withId(ids.incrementAndGet());
            evaluatorRecords.put(stored.id(), stored);
            return stored;
        }

        @Override
        public List<EvaluatorRecord> listEvaluatorRecords(
                long experimentId, @Nullable Long runId) {
            return evaluatorRecords.values().stream()
                    .filter(evaluatorRecord -> evaluatorRecord.experimentId() == experimentId)
                    .filter(evaluatorRecord -> runId == null || evaluatorRecord.runId() == runId)
                    .sorted(Comparator.comparingLong(EvaluatorRecord::id))
                    .toList();
        }

        @Override
        public ExperimentAggregateResult upsertAggregate(
                long experimentId, long evaluatorId, AggregateSummary summary, Instant now) {
            var aggregate =
                    new ExperimentAggregateResult(
                            experimentId,
                            evaluatorId,
                            summary,
                            summary.isEmpty() ? null : summary.average().value(),
                            now);
            aggregates.put(new AggregateKey(experimentId, evaluatorId), aggregate);
            return aggregate;
        }

        @Override
        public List<ExperimentAggregateResult> listAggregates(long experimentId) {
            var list = new ArrayList<ExperimentAggregateResult>();
            aggregates.forEach(
                    (key, aggregate) -> {
                        if (key.experimentId() == experimentId) {
                            list.add(aggregate);
                        }
                    });
            list.sort(Comparator.comparingLong(ExperimentAggregateResult::evaluatorId));
            return list;
        }

        private record AggregateKey(long experimentId, long evaluatorId) {}
    }
}
