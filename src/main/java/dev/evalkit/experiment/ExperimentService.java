package dev.evalkit.experiment;

import dev.evalkit.aggregate.AggregationEngine;
import dev.evalkit.aggregate.EvaluatorAggregate;
import dev.evalkit.config.EvalkitConfig;
import dev.evalkit.trace.TraceStore;
import dev.evalkit.trace.TraceTree;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Operations around the orchestrator: experiment and run lifecycle, stop and retry, results,
 * aggregates and statistics. Owns the cancellation tokens of runs that were started through it.
 */
@Slf4j
public final class ExperimentService implements AutoCloseable {
    private final ExperimentStore store;
    private final ExperimentOrchestrator orchestrator;
    private final TraceStore traceStore;
    private final AggregationEngine aggregationEngine;
    private final Clock clock;
    private final RunStateWriter stateWriter;
    private final JobSubmitter jobSubmitter;
    private final Map<Long, CancellationToken> runTokens = new ConcurrentHashMap<>();

    private ExperimentService(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.orchestrator = Objects.requireNonNull(builder.orchestrator, "orchestrator");
        this.traceStore = Objects.requireNonNull(builder.traceStore, "traceStore");
        this.aggregationEngine = builder.aggregationEngine;
        this.clock = builder.clock;
        this.stateWriter = new RunStateWriter(store, clock);
        var config = builder.config != null ? builder.config : EvalkitConfig.fromEnvironment();
        var submitterFactory =
                builder.jobSubmitterFactory != null
                        ? builder.jobSubmitterFactory
                        : (Function<JobSubmitter.JobRunner, JobSubmitter>)
                                runner -> new JobSubmitter.ExecutorImpl(config, runner);
        this.jobSubmitter = submitterFactory.apply(this::runJob);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws IllegalArgumentException when the name is already taken
     */
    public Experiment createExperiment(CreateExperimentRequest request) {
        if (store.findExperimentByName(request.name()).isPresent()) {
            throw new IllegalArgumentException(
                    "Experiment name already exists: " + request.name());
        }
        var experiment = store.createExperiment(request, clock.instant());
        log.info("created experiment {} ({})", experiment.id(), experiment.name());
        return experiment;
    }

    public Optional<Experiment> getExperiment(long experimentId) {
        return store.findExperiment(experimentId);
    }

    public Optional<ExperimentRun> getRun(long runId) {
        return store.findRun(runId);
    }

    public List<ExperimentRun> listRuns(long experimentId) {
        return store.listRuns(experimentId);
    }

    /** Creates a pending run numbered one past the experiment's existing runs. */
    public ExperimentRun createRun(long experimentId) {
        var run = store.createRun(experimentId, clock.instant());
        log.info("created run {} (#{}) for experiment {}", run.id(), run.runNumber(), experimentId);
        return run;
    }

    /** Creates a run and submits it for background execution. */
    public ExperimentRun start(long experimentId) {
        var run = createRun(experimentId);
        runTokens.put(run.id(), new CancellationToken());
        final JobSubmitter.JobHandle handle;
        try {
            handle = jobSubmitter.submit(experimentId, run.id());
        } catch (RuntimeException e) {
            runTokens.remove(run.id());
            stateWriter.fail(experimentId, run.id(), "Failed to submit job: " + e.getMessage());
            throw e;
        }
        return store.updateRun(run.id(), current -> current.withJobId(handle.jobId()));
    }

    /**
     * Executes one run on the calling thread with the run's registered cancellation token. This is
     * what submitted jobs call. Completed runs get their aggregates computed afterwards.
     */
    public void runJob(long experimentId, long runId) {
        var token = runTokens.computeIfAbsent(runId, id -> new CancellationToken());
        try {
            orchestrator.execute(experimentId, runId, token);
        } finally {
            runTokens.remove(runId);
        }
        var finished = store.findRun(runId).map(ExperimentRun::status);
        if (finished.isPresent() && finished.get() == ExperimentStatus.COMPLETED) {
            calculateAggregateResults(experimentId, runId);
        }
    }

    /**
     * Requests a stop. Executing runs move to {@code terminating} and stop at the next item
     * boundary; runs that are not executing move straight to {@code stopped}.
     */
    public Experiment stop(long experimentId) {
        requireExperiment(experimentId);
        boolean terminating = false;
        for (var run : store.listRuns(experimentId)) {
            if (run.status().isTerminal()) {
                continue;
            }
            var token = runTokens.get(run.id());
            if (token != null) {
                token.cancel();
            }
            if (run.status().isActive() && token != null) {
                stateWriter.updateRun(run.id(), ExperimentStatus.TERMINATING, null, null);
                terminating = true;
            } else {
                stateWriter.updateRun(run.id(), ExperimentStatus.STOPPED, null, null);
            }
        }
        var status = terminating ? ExperimentStatus.TERMINATING : ExperimentStatus.STOPPED;
        log.info("stop requested for experiment {}, now {}", experimentId, status.wireName());
        return stateWriter.updateExperiment(experimentId, status, null);
    }

    /**
     * Writes an experiment status. Writing {@code stopped} also signals every unfinished run of the
     * experiment, so an executing run halts at its next item boundary.
     */
    public Experiment updateExperimentStatus(
            long experimentId, ExperimentStatus status, @Nullable Integer progress) {
        requireExperiment(experimentId);
        if (status == ExperimentStatus.STOPPED) {
            store.listRuns(experimentId).stream()
                    .filter(run -> !run.status().isTerminal())
                    .forEach(run -> signal(run.id()));
        }
        return stateWriter.updateExperiment(experimentId, status, progress);
    }

    /** Writes a run status. Writing {@code stopped} also signals the run if it is executing. */
    public ExperimentRun updateRunStatus(
            long runId,
            ExperimentStatus status,
            @Nullable Integer progress,
            @Nullable String errorMessage) {
        store.findRun(runId).orElseThrow(() -> NotFoundException.run(runId));
        if (status == ExperimentStatus.STOPPED) {
            signal(runId);
        }
        return stateWriter.updateRun(runId, status, progress, errorMessage);
    }

    /** Updates progress on both entities without touching their status. */
    public void updateProgress(long experimentId, long runId, int progress) {
        stateWriter.progress(experimentId, runId, progress);
    }

    /**
     * Starts a new run. Every mode re-runs all items; earlier results stay untouched.
     *
     * @throws IllegalStateException when a run of the experiment is still executing
     */
    public ExperimentRun retry(long experimentId, RetryMode mode) {
        requireExperiment(experimentId);
        var active =
                store.listRuns(experimentId).stream().anyMatch(run -> run.status().isActive());
        if (active) {
            throw new IllegalStateException(
                    "Experiment " + experimentId + " has a run in progress");
        }
        if (mode != RetryMode.RETRY_ALL) {
            log.info("retry mode {} for experiment {} re-runs all items", mode, experimentId);
        }
        return start(experimentId);
    }

    /**
     * Copies an experiment definition into a new pending experiment. Without a name the copy is
     * called {@code <name>_copy_1}, then {@code <name>_copy_2} and so on.
     */
    public Experiment cloneExperiment(long experimentId, @Nullable String newName) {
        var original = requireExperiment(experimentId);
        var name = newName != null ? newName : nextCopyName(original.name());
        return createExperiment(original.toRequest(name));
    }

    private String nextCopyName(String baseName) {
        int counter = 1;
        var candidate = baseName + "_copy_" + counter;
        while (store.findExperimentByName(candidate).isPresent()) {
            candidate = baseName + "_copy_" + ++counter;
        }
        return candidate;
    }

    /** Deletes an experiment with its runs, results, aggregates and evaluator records. */
    public boolean deleteExperiment(long experimentId) {
        store.listRuns(experimentId).forEach(run -> signal(run.id()));
        var deleted = store.deleteExperiment(experimentId);
        if (deleted) {
            log.info("deleted experiment {}", experimentId);
        }
        return deleted;
    }

    public List<ExperimentResult> getResults(long experimentId, @Nullable Long runId) {
        requireExperiment(experimentId);
        return store.listResults(experimentId, runId);
    }

    /** Computes per-evaluator aggregates and replaces the stored ones. */
    public List<ExperimentAggregateResult> calculateAggregateResults(
            long experimentId, @Nullable Long runId) {
        requireExperiment(experimentId);
        var saved = new ArrayList<ExperimentAggregateResult>();
        for (var aggregate : aggregateByEvaluator(experimentId, runId)) {
            saved.add(
                    store.upsertAggregate(
                            experimentId,
                            aggregate.evaluatorId(),
                            aggregate.summary(),
                            clock.instant()));
        }
        log.info(
                "saved {} aggregate results for experiment {} run {}",
                saved.size(),
                experimentId,
                runId);
        return saved;
    }

    public List<ExperimentAggregateResult> getAggregateResults(long experimentId) {
        return store.listAggregates(experimentId);
    }

    public ExperimentStatistics getStatistics(long experimentId, @Nullable Long runId) {
        var experiment = requireExperiment(experimentId);
        var results = store.listResults(experimentId, runId);
        long total = results.size();
        long success = results.stream().filter(ExperimentResult::isSuccess).count();
        // unscored rows without an error are still pending while the experiment runs
        long pending =
                experiment.status().isTerminal()
                        ? 0
                        : results.stream()
                                .filter(r -> r.score() == null && r.errorMessage() == null)
                                .count();
        long failure = total - success - pending;

        long inputTokens = 0;
        long outputTokens = 0;
        for (var evaluatorRecord : store.listEvaluatorRecords(experimentId, runId)) {
            var usage = evaluatorRecord.output().evaluatorUsage();
            if (usage != null) {
                inputTokens += usage.inputTokens();
                outputTokens += usage.outputTokens();
            }
        }
        return new ExperimentStatistics(
                experimentId,
                total,
                success,
                failure,
                pending,
                aggregateByEvaluator(experimentId, runId),
                new ExperimentStatistics.TokenUsage(inputTokens, outputTokens));
    }

    public TraceTree getTraceTree(String traceId) {
        return TraceTree.build(traceId, traceStore);
    }

    private List<EvaluatorAggregate> aggregateByEvaluator(
            long experimentId, @Nullable Long runId) {
        var scoresByEvaluator = new LinkedHashMap<Long, List<Double>>();
        for (var result : store.listResults(experimentId, runId)) {
            if (result.score() != null) {
                scoresByEvaluator
                        .computeIfAbsent(result.evaluatorId(), id -> new ArrayList<>())
                        .add(result.score());
            }
        }
        var aggregates = new ArrayList<EvaluatorAggregate>();
        scoresByEvaluator.forEach(
                (evaluatorId, scores) ->
                        aggregates.add(aggregationEngine.aggregateEvaluator(evaluatorId, scores)));
        return aggregates;
    }

    private Experiment requireExperiment(long experimentId) {
        return store.findExperiment(experimentId)
                .orElseThrow(() -> NotFoundException.experiment(experimentId));
    }

    private void signal(long runId) {
        var token = runTokens.get(runId);
        if (token != null && token.cancel()) {
            log.info("signalled stop for run {}", runId);
        }
    }

    @Override
    public void close() {
        jobSubmitter.close();
    }

    public static final class Builder {
        private ExperimentStore store;
        private ExperimentOrchestrator orchestrator;
        private TraceStore traceStore;
        private AggregationEngine aggregationEngine = new AggregationEngine();
        private Clock clock = Clock.systemUTC();
        private EvalkitConfig config;
        private Function<JobSubmitter.JobRunner, JobSubmitter> jobSubmitterFactory;

        public Builder store(ExperimentStore store) {
            this.store = store;
            return this;
        }

        public Builder orchestrator(ExperimentOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        public Builder traceStore(TraceStore traceStore) {
            this.traceStore = traceStore;
            return this;
        }

        public Builder aggregationEngine(AggregationEngine aggregationEngine) {
            this.aggregationEngine = aggregationEngine;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder config(EvalkitConfig config) {
            this.config = config;
            return this;
        }

        /** Chooses how runs are executed; defaults to {@link JobSubmitter.ExecutorImpl}. */
        public Builder jobSubmitter(Function<JobSubmitter.JobRunner, JobSubmitter> factory) {
            this.jobSubmitterFactory = factory;
            return this;
        }

        public ExperimentService build() {
            return new ExperimentService(this);
        }
    }
}
