package dev.evalkit.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle shared by experiments and runs. {@code TERMINATING} is a stop that was requested but
 * not yet honored by the orchestrator.
 */
public enum ExperimentStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED,
    TERMINATED,
    TERMINATING;

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETED, FAILED, STOPPED, TERMINATED -> true;
            case PENDING, RUNNING, TERMINATING -> false;
        };
    }

    /** Running, or asked to stop but still running. */
    public boolean isActive() {
        return this == RUNNING || this == TERMINATING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExperimentStatus fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
