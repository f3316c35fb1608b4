package dev.evalkit.experiment;

import dev.evalkit.config.EvalkitConfig;
import dev.evalkit.dataset.Content;
import dev.evalkit.dataset.DatasetItem;
import dev.evalkit.dataset.DatasetProvider;
import dev.evalkit.dataset.FieldExtractor;
import dev.evalkit.evaluator.EvaluatorInput;
import dev.evalkit.evaluator.EvaluatorInputBuilder;
import dev.evalkit.evaluator.EvaluatorKind;
import dev.evalkit.evaluator.EvaluatorOutcome;
import dev.evalkit.evaluator.EvaluatorOutput;
import dev.evalkit.evaluator.EvaluatorRegistry;
import dev.evalkit.target.TargetAdapter;
import dev.evalkit.target.TargetResult;
import dev.evalkit.trace.PipelineSpan;
import dev.evalkit.trace.PipelineTracer;
import dev.evalkit.trace.SpanPersister;
import dev.evalkit.trace.SpanRef;
import dev.evalkit.trace.TraceStore;
import io.opentelemetry.api.trace.SpanKind;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one experiment run end to end. Items are processed strictly one after another; for each
 * item the orchestrator opens a root span, runs the target, runs every evaluator, persists one
 * result per evaluator and then reports progress.
 *
 * <p>Stop requests arrive through the run's {@link CancellationToken} and are honored between
 * items. A failure inside an item is recorded on that item's root span and the loop moves on; a
 * failure outside the loop marks the experiment and the run failed and is rethrown.
 */
@Slf4j
public final class ExperimentOrchestrator {
    static final String ITEM_SPAN_PREFIX = "experiment_item_";
    static final String TARGET_SPAN_NAME = "evaluation_target";
    static final String EVALUATOR_SPAN_PREFIX = "evaluator_";

    private final ExperimentStore store;
    private final DatasetProvider datasetProvider;
    private final EvaluatorRegistry evaluatorRegistry;
    private final TargetAdapter targetAdapter;
    private final PipelineTracer tracer;
    private final TraceStore traceStore;
    private final SpanPersister spanPersister;
    private final FieldExtractor fieldExtractor;
    private final EvaluatorInputBuilder inputBuilder;
    private final EvalkitConfig config;
    private final Clock clock;
    private final RunStateWriter stateWriter;

    private ExperimentOrchestrator(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.datasetProvider = Objects.requireNonNull(builder.datasetProvider, "datasetProvider");
        this.evaluatorRegistry =
                Objects.requireNonNull(builder.evaluatorRegistry, "evaluatorRegistry");
        this.targetAdapter = Objects.requireNonNull(builder.targetAdapter, "targetAdapter");
        this.tracer = Objects.requireNonNull(builder.tracer, "tracer");
        this.traceStore = Objects.requireNonNull(builder.traceStore, "traceStore");
        this.spanPersister = builder.spanPersister;
        this.fieldExtractor = builder.fieldExtractor;
        this.inputBuilder = builder.inputBuilder;
        this.config = builder.config != null ? builder.config : EvalkitConfig.fromEnvironment();
        this.clock = builder.clock;
        this.stateWriter = new RunStateWriter(store, clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Runs without an external stop signal. */
    public void execute(long experimentId, long runId) {
        execute(experimentId, runId, new CancellationToken());
    }

    /**
     * @throws NotFoundException when the experiment, the run or the dataset version is missing;
     *     nothing is changed in that case
     */
    public void execute(long experimentId, long runId, CancellationToken cancellation) {
        var experiment =
                store.findExperiment(experimentId)
                        .orElseThrow(() -> NotFoundException.experiment(experimentId));
        var run = store.findRun(runId).orElseThrow(() -> NotFoundException.run(runId));
        if (run.experimentId() != experimentId) {
            throw new NotFoundException(
                    "Experiment run %d does not belong to experiment %d"
                            .formatted(runId, experimentId));
        }
        if (experiment.status() == ExperimentStatus.STOPPED
                || run.status() == ExperimentStatus.STOPPED) {
            log.info("experiment {} run {} already stopped, nothing to do", experimentId, runId);
            return;
        }
        var versionItems =
                datasetProvider
                        .getVersionItems(experiment.datasetVersionId())
                        .orElseThrow(
                                () ->
                                        NotFoundException.datasetVersion(
                                                experiment.datasetVersionId()));

        try {
            run(experiment, runId, versionItems, cancellation);
        } catch (RuntimeException e) {
            var message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
            log.error("experiment {} run {} failed: {}", experimentId, runId, message, e);
            stateWriter.fail(experimentId, runId, message);
            throw e;
        }
    }

    private void run(
            Experiment experiment,
            long runId,
            List<DatasetItem> items,
            CancellationToken cancellation) {
        var experimentId = experiment.id();
        stateWriter.transition(experimentId, runId, ExperimentStatus.RUNNING, 0);
        if (items.size() > config.maxDatasetItems()) {
            throw new IllegalStateException(
                    "dataset version %d has %d items, more than the limit of %d"
                            .formatted(
                                    experiment.datasetVersionId(),
                                    items.size(),
                                    config.maxDatasetItems()));
        }
        var total = items.size();
        log.info(
                "experiment {} run {} started: {} items, {} evaluators, target {}",
                experimentId,
                runId,
                total,
                experiment.evaluatorIds().size(),
                experiment.targetConfig().kind().wireName());
        if (total == 0) {
            stateWriter.transition(experimentId, runId, ExperimentStatus.COMPLETED, 100);
            log.info("experiment {} run {} has no items, completed", experimentId, runId);
            return;
        }
        if (stopRequested(experimentId, runId, cancellation)) {
            return;
        }
        for (int i = 0; i < total; i++) {
            if (stopRequested(experimentId, runId, cancellation)) {
                return;
            }
            var item = items.get(i);
            log.info(
                    "experiment {} run {}: item {}/{} (id {})",
                    experimentId,
                    runId,
                    i + 1,
                    total,
                    item.id());
            processItem(experiment, runId, item);
            stateWriter.progress(experimentId, runId, progressAfter(i + 1, total));
        }
        stateWriter.transition(experimentId, runId, ExperimentStatus.COMPLETED, 100);
        log.info("experiment {} run {} completed", experimentId, runId);
    }

    static int progressAfter(int processed, int total) {
        return (int) Math.round(processed * 100.0 / total);
    }

    private boolean stopRequested(long experimentId, long runId, CancellationToken cancellation) {
        if (!cancellation.isCancelled()) {
            return false;
        }
        stateWriter.transition(experimentId, runId, ExperimentStatus.STOPPED, null);
        log.info("experiment {} run {} stopped", experimentId, runId);
        return true;
    }

    private void processItem(Experiment experiment, long runId, DatasetItem item) {
        var rootAttributes = new LinkedHashMap<String, Object>();
        rootAttributes.put("experiment_id", experiment.id());
        rootAttributes.put("run_id", runId);
        rootAttributes.put("dataset_item_id", item.id());
        var root =
                tracer.startRootSpan(
                        ITEM_SPAN_PREFIX + item.id(), SpanKind.INTERNAL, rootAttributes);
        var context = new ItemContext(experiment, runId, item, root.traceId());
        try {
            spanPersister.persist(root.snapshot(), traceStore);

            var fields = fieldExtractor.extract(item);
            if (fields.isEmpty()) {
                log.warn("dataset item {} yielded no fields", item.id());
            }
            var rootInput = new LinkedHashMap<String, Object>();
            rootInput.put("dataset_item_id", item.id());
            rootInput.put("turn_fields_keys", List.copyOf(fields.keySet()));
            root.setInput(rootInput);
            root.addEvent("field_extraction_completed", Map.of("field_count", fields.size()));

            var target = callTarget(context, fields, root.ref());
            Map<Long, EvaluatorOutcome> outcomes;
            if (target.failed() && experiment.targetConfig().isConfigured()) {
                log.warn(
                        "target failed for item {}, skipping {} evaluators: {}",
                        item.id(),
                        experiment.evaluatorIds().size(),
                        target.error());
                outcomes = skipEvaluators(context, target);
            } else {
                outcomes = callEvaluators(context, fields, target, root.ref());
            }
            root.setOutput(itemSummary(outcomes));
        } catch (RuntimeException e) {
            log.error("experiment {} item {} failed", experiment.id(), item.id(), e);
            root.setError(e);
        } finally {
            spanPersister.persist(root.finish(), traceStore);
        }
    }

    private TargetResult callTarget(
            ItemContext context, Map<String, Content> fields, SpanRef parent) {
        var targetConfig = context.experiment().targetConfig();
        var span =
                tracer.startSpan(
                        TARGET_SPAN_NAME,
                        parent,
                        SpanKind.CLIENT,
                        Map.of("target_type", targetConfig.kind().wireName()));
        try {
            var input = new LinkedHashMap<String, Object>();
            input.put("target_type", targetConfig.kind().wireName());
            input.put("input_fields", List.copyOf(fields.keySet()));
            span.setInput(input);
            var result = targetAdapter.invoke(targetConfig, fields, context.item());
            var output = new LinkedHashMap<String, Object>();
            output.put("actual_output", result.actualOutput());
            if (result.failed()) {
                output.put("error", result.error());
                span.setError(result.error());
            }
            span.setOutput(output);
            return result;
        } finally {
            spanPersister.persist(span.finish(), traceStore);
        }
    }

    private Map<Long, EvaluatorOutcome> skipEvaluators(ItemContext context, TargetResult target) {
        var outcomes = new LinkedHashMap<Long, EvaluatorOutcome>();
        var reason = "Target invocation failed, evaluation skipped: " + target.error();
        var error = "Target invocation failed: " + target.error();
        for (var evaluatorId : context.experiment().evaluatorIds()) {
            var outcome = new EvaluatorOutcome(null, reason, error, null);
            saveResult(context, evaluatorId, outcome, target.actualOutput(), 0);
            outcomes.put(evaluatorId, outcome);
        }
        return outcomes;
    }

    private Map<Long, EvaluatorOutcome> callEvaluators(
            ItemContext context,
            Map<String, Content> fields,
            TargetResult target,
            SpanRef parent) {
        var outcomes = new LinkedHashMap<Long, EvaluatorOutcome>();
        for (var evaluatorId : context.experiment().evaluatorIds()) {
            long started = System.nanoTime();
            var outcome = callEvaluator(context, evaluatorId, fields, target, parent);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            saveResult(context, evaluatorId, outcome, target.actualOutput(), elapsedMs);
            outcomes.put(evaluatorId, outcome);
        }
        return outcomes;
    }

    private EvaluatorOutcome callEvaluator(
            ItemContext context,
            long evaluatorId,
            Map<String, Content> fields,
            TargetResult target,
            SpanRef parent) {
        var span =
                tracer.startSpan(
                        EVALUATOR_SPAN_PREFIX + evaluatorId,
                        parent,
                        SpanKind.INTERNAL,
                        Map.of("evaluator_id", evaluatorId));
        try {
            var kind = evaluatorRegistry.getEvaluatorKind(evaluatorId);
            var kindName = kind.name().toLowerCase(Locale.ROOT);
            var input = inputBuilder.build(evaluatorId, kind, fields, target.targetFields());
            var spanInput = new LinkedHashMap<String, Object>();
            spanInput.put("evaluator_kind", kindName);
            spanInput.put("input_data", input);
            span.setInput(spanInput);
            span.addEvent("input_data_prepared", Map.of("evaluator_kind", kindName));

            var output = evaluatorRegistry.invoke(evaluatorId, input);
            var outcome =
                    EvaluatorOutcome.fromOutput(evaluatorId, output, config.maxReasonParseDepth());
            if (kind == EvaluatorKind.PROMPT) {
                recordLlmAttributes(span, output);
            }
            recordEvaluatorRun(context, evaluatorId, input, output);
            span.setOutput(outcomeSummary(outcome));
            span.addEvent("evaluation_completed", Map.of("has_error", outcome.hasError()));
            return outcome;
        } catch (RuntimeException e) {
            log.error(
                    "evaluator {} failed on dataset item {}", evaluatorId, context.item().id(), e);
            span.setError(e);
            return EvaluatorOutcome.fromException(e);
        } finally {
            spanPersister.persist(span.finish(), traceStore);
        }
    }

    private static void recordLlmAttributes(PipelineSpan span, EvaluatorOutput output) {
        var result = output.evaluatorResult();
        if (result != null) {
            span.setAttribute("llm.response.score", result.score());
            span.setAttribute("llm.response.reasoning", result.reasoning());
        }
        var usage = output.evaluatorUsage();
        if (usage != null) {
            span.setAttribute("llm.usage.input_tokens", usage.inputTokens());
            span.setAttribute("llm.usage.output_tokens", usage.outputTokens());
            span.setAttribute("llm.usage.total_tokens", usage.totalTokens());
        }
        if (output.timeConsumingMs() > 0) {
            span.setAttribute("llm.time_consuming_ms", output.timeConsumingMs());
        }
        var runError = output.evaluatorRunError();
        if (runError != null) {
            span.setAttribute("llm.error.code", runError.code());
            span.setAttribute("llm.error.message", runError.message());
        }
    }

    /** The audit row is best effort; losing it never discards the evaluator's score. */
    private void recordEvaluatorRun(
            ItemContext context, long evaluatorId, EvaluatorInput input, EvaluatorOutput output) {
        try {
            store.insertEvaluatorRecord(
                    new EvaluatorRecord(
                            0,
                            evaluatorId,
                            context.experiment().id(),
                            context.runId(),
                            context.item().id(),
                            input,
                            output,
                            output.isSuccess()
                                    ? EvaluatorRecord.Status.SUCCESS
                                    : EvaluatorRecord.Status.FAIL,
                            context.traceId(),
                            clock.instant()));
        } catch (RuntimeException e) {
            log.error(
                    "could not record evaluator {} run on dataset item {}",
                    evaluatorId,
                    context.item().id(),
                    e);
        }
    }

    private void saveResult(
            ItemContext context,
            long evaluatorId,
            EvaluatorOutcome outcome,
            String actualOutput,
            long elapsedMs) {
        store.insertResult(
                new ExperimentResult(
                        0,
                        context.experiment().id(),
                        context.runId(),
                        context.item().id(),
                        evaluatorId,
                        outcome.score(),
                        outcome.reason(),
                        outcome.details(),
                        actualOutput,
                        elapsedMs,
                        outcome.errorMessage(),
                        context.traceId(),
                        clock.instant()));
    }

    private static Map<String, Object> outcomeSummary(EvaluatorOutcome outcome) {
        var summary = new LinkedHashMap<String, Object>();
        summary.put("score", outcome.score());
        summary.put("reason", outcome.reason());
        summary.put("error", outcome.errorMessage());
        summary.put("has_error", outcome.hasError());
        return summary;
    }

    private static Map<String, Object> itemSummary(Map<Long, EvaluatorOutcome> outcomes) {
        var results = new LinkedHashMap<String, Object>();
        outcomes.forEach(
                (evaluatorId, outcome) -> {
                    var entry = new LinkedHashMap<String, Object>();
                    entry.put("score", outcome.score());
                    entry.put("has_error", outcome.hasError());
                    results.put(String.valueOf(evaluatorId), entry);
                });
        var summary = new LinkedHashMap<String, Object>();
        summary.put("evaluator_results", results);
        summary.put("total_evaluators", outcomes.size());
        return summary;
    }

    private record ItemContext(
            Experiment experiment, long runId, DatasetItem item, String traceId) {}

    public static final class Builder {
        private ExperimentStore store;
        private DatasetProvider datasetProvider;
        private EvaluatorRegistry evaluatorRegistry;
        private TargetAdapter targetAdapter;
        private PipelineTracer tracer;
        private TraceStore traceStore;
        private SpanPersister spanPersister = new SpanPersister();
        private FieldExtractor fieldExtractor = new FieldExtractor();
        private EvaluatorInputBuilder inputBuilder = new EvaluatorInputBuilder();
        private EvalkitConfig config;
        private Clock clock = Clock.systemUTC();

        public Builder store(ExperimentStore store) {
            this.store = store;
            return this;
        }

        public Builder datasetProvider(DatasetProvider datasetProvider) {
            this.datasetProvider = datasetProvider;
            return this;
        }

        public Builder evaluatorRegistry(EvaluatorRegistry evaluatorRegistry) {
            this.evaluatorRegistry = evaluatorRegistry;
            return this;
        }

        public Builder targetAdapter(TargetAdapter targetAdapter) {
            this.targetAdapter = targetAdapter;
            return this;
        }

        public Builder tracer(PipelineTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder traceStore(TraceStore traceStore) {
            this.traceStore = traceStore;
            return this;
        }

        public Builder spanPersister(SpanPersister spanPersister) {
            this.spanPersister = spanPersister;
            return this;
        }

        public Builder fieldExtractor(FieldExtractor fieldExtractor) {
            this.fieldExtractor = fieldExtractor;
            return this;
        }

        public Builder inputBuilder(EvaluatorInputBuilder inputBuilder) {
            this.inputBuilder = inputBuilder;
            return this;
        }

        public Builder config(EvalkitConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ExperimentOrchestrator build() {
            return new ExperimentOrchestrator(this);
        }
    }
}
