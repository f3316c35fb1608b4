package dev.evalkit.experiment;

import dev.evalkit.target.TargetConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A stored experiment definition plus its lifecycle state. Status and progress are written by the
 * orchestrator and the status operations of {@link ExperimentService}.
 *
 * @param itemConcurrency a hint only; items are always processed one after another
 */
public record Experiment(
        long id,
        String name,
        Optional<String> description,
        long datasetVersionId,
        List<Long> evaluatorIds,
        TargetConfig targetConfig,
        ExperimentStatus status,
        int progress,
        ExperimentType type,
        int itemConcurrency,
        Optional<Duration> maxAliveTime,
        Instant createdAt,
        Instant updatedAt) {

    public Experiment {
        evaluatorIds = List.copyOf(evaluatorIds);
        targetConfig = targetConfig == null ? TargetConfig.none() : targetConfig;
    }

    static Experiment create(long id, CreateExperimentRequest request, Instant now) {
        return new Experiment(
                id,
                request.name(),
                request.description(),
                request.datasetVersionId(),
                request.evaluatorIds(),
                request.targetConfig(),
                ExperimentStatus.PENDING,
                0,
                request.type(),
                request.itemConcurrency(),
                request.maxAliveTime(),
                now,
                now);
    }

    /** Definition of this experiment under another name, for cloning. */
    public CreateExperimentRequest toRequest(String newName) {
        return new CreateExperimentRequest(
                newName,
                description,
                datasetVersionId,
                evaluatorIds,
                targetConfig,
                type,
                itemConcurrency,
                maxAliveTime);
    }

    public Experiment withStatus(ExperimentStatus status, Instant now) {
        return new Experiment(
                id,
                name,
                description,
                datasetVersionId,
                evaluatorIds,
                targetConfig,
                status,
                progress,
                type,
                itemConcurrency,
                maxAliveTime,
                createdAt,
                now);
    }

    public Experiment withProgress(int progress, Instant now) {
        return new Experiment(
                id,
                name,
                description,
                datasetVersionId,
                evaluatorIds,
                targetConfig,
                status,
                progress,
                type,
                itemConcurrency,
                maxAliveTime,
                createdAt,
                now);
    }
}
