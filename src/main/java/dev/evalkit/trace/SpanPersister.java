package dev.evalkit.trace;

import lombok.extern.slf4j.Slf4j;

/**
 * Second phase of span completion: writes a {@link SpanRecord} to a {@link TraceStore}, creating
 * the trace row on demand so children may be stored before their root.
 */
@Slf4j
public class SpanPersister {

    public PersistOutcome persist(SpanRecord span, TraceStore store) {
        try {
            if (!store.isHealthy()) {
                log.warn(
                        "trace storage unhealthy, attempting recovery before span {}",
                        span.spanId());
                if (!store.recover()) {
                    log.error(
                            "trace storage still unhealthy, skipping span {} ({}) of trace {}",
                            span.spanId(),
                            span.name(),
                            span.traceId());
                    return PersistOutcome.SKIPPED_UNHEALTHY;
                }
            }
            var candidate =
                    span.isRoot() ? TraceRecord.fromRoot(span) : TraceRecord.placeholder(span);
            var stored = store.createTraceIfAbsent(candidate);
            store.upsertSpan(span);
            if (span.isRoot() && stored != candidate) {
                store.updateTrace(TraceRecord.fromRoot(span));
            }
            log.debug(
                    "persisted span {} ({}) of trace {}, root={}",
                    span.spanId(),
                    span.name(),
                    span.traceId(),
                    span.isRoot());
            return PersistOutcome.PERSISTED;
        } catch (RuntimeException e) {
            log.error(
                    "failed to persist span {} ({}) of trace {}",
                    span.spanId(),
                    span.name(),
                    span.traceId(),
                    e);
            return PersistOutcome.FAILED;
        }
    }
}
