package dev.evalkit.trace;

import java.util.Objects;

/** Identity of a span that children can be parented on. */
public record SpanRef(String traceId, String spanId) {
    public SpanRef {
        Objects.requireNonNull(traceId);
        Objects.requireNonNull(spanId);
    }
}
