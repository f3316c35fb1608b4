package dev.evalkit.experiment;

import dev.evalkit.target.TargetConfig;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Definition of a new experiment. A null {@code targetConfig} means no target. */
public record CreateExperimentRequest(
        String name,
        Optional<String> description,
        long datasetVersionId,
        List<Long> evaluatorIds,
        TargetConfig targetConfig,
        ExperimentType type,
        int itemConcurrency,
        Optional<Duration> maxAliveTime) {

    public CreateExperimentRequest {
        evaluatorIds = List.copyOf(evaluatorIds);
        targetConfig = targetConfig == null ? TargetConfig.none() : targetConfig;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("experiment name must not be blank");
        }
        if (itemConcurrency < 1) {
            throw new IllegalArgumentException(
                    "itemConcurrency must be positive: " + itemConcurrency);
        }
    }

    public CreateExperimentRequest(
            String name,
            long datasetVersionId,
            List<Long> evaluatorIds,
            TargetConfig targetConfig) {
        this(
                name,
                Optional.empty(),
                datasetVersionId,
                evaluatorIds,
                targetConfig,
                ExperimentType.OFFLINE,
                1,
                Optional.empty());
    }
}
