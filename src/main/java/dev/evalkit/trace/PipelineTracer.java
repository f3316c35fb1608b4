package dev.evalkit.trace;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens pipeline spans. Root spans always start a fresh trace; child spans are parented explicitly
 * by {@link SpanRef}, so no ambient context is involved.
 *
 * <p>A tracer that records nothing (such as {@link OpenTelemetry#noop()}) still yields complete
 * span records; see {@link PipelineSpan}.
 */
@Slf4j
public final class PipelineTracer {
    private final Tracer tracer;
    private final AtomicBoolean warnedUnrecorded = new AtomicBoolean();

    public PipelineTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer);
    }

    public static PipelineTracer of(OpenTelemetry openTelemetry) {
        return new PipelineTracer(PipelineTracing.getTracer(openTelemetry));
    }

    public PipelineSpan startRootSpan(String name, SpanKind kind, Map<String, ?> attributes) {
        return start(tracer.spanBuilder(name).setNoParent(), name, kind, null, attributes);
    }

    public PipelineSpan startSpan(
            String name, SpanRef parent, SpanKind kind, Map<String, ?> attributes) {
        var parentContext =
                SpanContext.create(
                        parent.traceId(),
                        parent.spanId(),
                        TraceFlags.getSampled(),
                        TraceState.getDefault());
        if (!parentContext.isValid()) {
            throw new IllegalArgumentException("invalid parent span reference: " + parent);
        }
        var builder =
                tracer.spanBuilder(name).setParent(Context.root().with(Span.wrap(parentContext)));
        return start(builder, name, kind, parent, attributes);
    }

    private PipelineSpan start(
            SpanBuilder builder,
            String name,
            SpanKind kind,
            @Nullable SpanRef parent,
            Map<String, ?> attributes) {
        var span = new PipelineSpan(builder.setSpanKind(kind).startSpan(), name, kind, parent);
        if (!span.isRecorded() && warnedUnrecorded.compareAndSet(false, true)) {
            log.warn("tracer does not record spans, span records are tracked locally");
        }
        span.setAttributes(attributes);
        return span;
    }
}
