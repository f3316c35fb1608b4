package dev.evalkit.experiment;

import java.time.Clock;
import java.util.Objects;
import javax.annotation.Nullable;

/** Status and progress writes for an experiment and one of its runs. */
final class RunStateWriter {
    private final ExperimentStore store;
    private final Clock clock;

    RunStateWriter(ExperimentStore store, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.clock = Objects.requireNonNull(clock);
    }

    /** Moves both entities to {@code status}, optionally setting progress. */
    void transition(
            long experimentId, long runId, ExperimentStatus status, @Nullable Integer progress) {
        updateRun(runId, status, progress, null);
        updateExperiment(experimentId, status, progress);
    }

    void fail(long experimentId, long runId, String errorMessage) {
        updateRun(runId, ExperimentStatus.FAILED, null, errorMessage);
        updateExperiment(experimentId, ExperimentStatus.FAILED, null);
    }

    /** Progress only; a concurrently requested stop stays visible. */
    void progress(long experimentId, long runId, int progress) {
        var clamped = clamp(progress);
        store.updateRun(runId, run -> run.withProgress(clamped));
        store.updateExperiment(
                experimentId, experiment -> experiment.withProgress(clamped, clock.instant()));
    }

    ExperimentRun updateRun(
            long runId,
            ExperimentStatus status,
            @Nullable Integer progress,
            @Nullable String errorMessage) {
        var now = clock.instant();
        return store.updateRun(
                runId,
                run -> {
                    var updated = run.withStatus(status, now);
                    if (progress != null) {
                        updated = updated.withProgress(clamp(progress));
                    }
                    if (errorMessage != null) {
                        updated = updated.withErrorMessage(errorMessage);
                    }
                    return updated;
                });
    }

    Experiment updateExperiment(
            long experimentId, ExperimentStatus status, @Nullable Integer progress) {
        var now = clock.instant();
        return store.updateExperiment(
                experimentId,
                experiment -> {
                    var updated = experiment.withStatus(status, now);
                    return progress == null ? updated : updated.withProgress(clamp(progress), now);
                });
    }

    static int clamp(int progress) {
        return Math.max(0, Math.min(100, progress));
    }
}
