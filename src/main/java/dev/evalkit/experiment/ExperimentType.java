package dev.evalkit.experiment;

public enum ExperimentType {
    OFFLINE,
    ONLINE
}
