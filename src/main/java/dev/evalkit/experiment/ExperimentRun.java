package dev.evalkit.experiment;

import java.time.Instant;
import java.util.Optional;

/** One execution attempt of an experiment. */
public record ExperimentRun(
        long id,
        long experimentId,
        int runNumber,
        ExperimentStatus status,
        int progress,
        Optional<String> jobId,
        Optional<String> errorMessage,
        Optional<Instant> startedAt,
        Optional<Instant> completedAt,
        Instant createdAt) {

    static ExperimentRun create(long id, long experimentId, int runNumber, Instant now) {
        return new ExperimentRun(
                id,
                experimentId,
                runNumber,
                ExperimentStatus.PENDING,
                0,
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                now);
    }

    /**
     * Applies a status change: {@code RUNNING} stamps the start time, a terminal status stamps the
     * completion time.
     */
    public ExperimentRun withStatus(ExperimentStatus status, Instant now) {
        return new ExperimentRun(
                id,
                experimentId,
                runNumber,
                status,
                progress,
                jobId,
                errorMessage,
                status == ExperimentStatus.RUNNING ? Optional.of(now) : startedAt,
                status.isTerminal() ? Optional.of(now) : completedAt,
                createdAt);
    }

    public ExperimentRun withProgress(int progress) {
        return new ExperimentRun(
                id,
                experimentId,
                runNumber,
                status,
                progress,
                jobId,
                errorMessage,
                startedAt,
                completedAt,
                createdAt);
    }

    public ExperimentRun withErrorMessage(String errorMessage) {
        return new ExperimentRun(
                id,
                experimentId,
                runNumber,
                status,
                progress,
                jobId,
                Optional.of(errorMessage),
                startedAt,
                completedAt,
                createdAt);
    }

    public ExperimentRun withJobId(String jobId) {
        return new ExperimentRun(
                id,
                experimentId,
                runNumber,
                status,
                progress,
                Optional.of(jobId),
                errorMessage,
                startedAt,
                completedAt,
                createdAt);
    }
}
