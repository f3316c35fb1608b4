package dev.evalkit.trace;

import java.time.Instant;
import java.util.Map;
import javax.annotation.Nullable;

/** Root row of one item's trace. Created on first span persistence for its trace id. */
public record TraceRecord(
        String traceId,
        String name,
        Instant startTime,
        @Nullable Instant endTime,
        @Nullable Double durationMs,
        Map<String, Object> attributes) {
    static final String PLACEHOLDER_PREFIX = "experiment_trace_";

    public TraceRecord {
        attributes = Map.copyOf(attributes);
    }

    /** Trace row materialized by a span that arrived before its root. */
    static TraceRecord placeholder(SpanRecord span) {
        var shortId = span.traceId().substring(0, Math.min(8, span.traceId().length()));
        return new TraceRecord(
                span.traceId(),
                PLACEHOLDER_PREFIX + shortId,
                span.startTime(),
                null,
                null,
                Map.of());
    }

    static TraceRecord fromRoot(SpanRecord root) {
        return new TraceRecord(
                root.traceId(),
                root.name(),
                root.startTime(),
                root.endTime(),
                root.durationMs(),
                root.attributes());
    }
}
