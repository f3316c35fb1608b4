package dev.evalkit.trace;

/** Result channel of {@link SpanPersister#persist}; persistence never throws. */
public enum PersistOutcome {
    PERSISTED,
    /** Storage stayed unhealthy after one recovery attempt; only this span was dropped. */
    SKIPPED_UNHEALTHY,
    /** Storage raised while writing; the cause was logged. */
    FAILED;

    public boolean isPersisted() {
        return this == PERSISTED;
    }
}
