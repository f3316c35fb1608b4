package dev.evalkit.experiment;

import java.util.concurrent.atomic.AtomicBoolean;

/** Stop signal for one run, checked by the orchestrator between items. */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** Returns true when this call flipped the token. */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
