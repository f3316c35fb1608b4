package dev.evalkit.experiment;

/** A referenced experiment, run or dataset version does not exist. */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException experiment(long experimentId) {
        return new NotFoundException("Experiment " + experimentId + " not found");
    }

    public static NotFoundException run(long runId) {
        return new NotFoundException("Experiment run " + runId + " not found");
    }

    public static NotFoundException datasetVersion(long datasetVersionId) {
        return new NotFoundException("Dataset version " + datasetVersionId + " not found");
    }
}
