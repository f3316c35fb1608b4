package dev.evalkit.trace;

import dev.evalkit.json.EvalkitJsonMapper;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.IdGenerator;
import io.opentelemetry.sdk.trace.ReadableSpan;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One open pipeline span, backed by an OpenTelemetry span.
 *
 * <p>{@link #finish()} ends the span and returns its {@link SpanRecord}; it does not persist.
 * Calling it again returns the same record without touching the span.
 *
 * <p>Spans the OpenTelemetry SDK does not record (a no-op tracer, or a sampler that dropped the
 * span) still produce complete records: identity, timing, status, attributes and events are then
 * tracked here. Ids missing from such spans are generated locally.
 */
public final class PipelineSpan {
    public static final String INPUT = "input";
    public static final String OUTPUT = "output";
    public static final String ERROR_TYPE = "error.type";
    public static final String ERROR_MESSAGE = "error.message";

    private static final IdGenerator IDS = IdGenerator.random();

    private final Span span;
    private final @Nullable ReadableSpan readable;
    private final String traceId;
    private final String spanId;
    private final @Nullable String parentSpanId;
    private final String name;
    private final SpanKind kind;
    private final Instant startTime;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<SpanRecord.Event> events = new ArrayList<>();
    private StatusCode status = StatusCode.UNSET;
    private @Nullable String statusMessage;
    private boolean errored;
    private @Nullable SpanRecord finished;

    PipelineSpan(
            @Nonnull Span span, String name, SpanKind kind, @Nullable SpanRef parent) {
        this.span = Objects.requireNonNull(span);
        this.readable = span instanceof ReadableSpan readableSpan ? readableSpan : null;
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.parentSpanId = parent == null ? null : parent.spanId();
        this.startTime = Instant.now();
        var context = span.getSpanContext();
        if (readable != null) {
            this.traceId = context.getTraceId();
            this.spanId = context.getSpanId();
        } else {
            // a no-op span may carry its parent's context, so only the trace id is reused
            if (parent != null) {
                this.traceId = parent.traceId();
            } else {
                this.traceId = context.isValid() ? context.getTraceId() : IDS.generateTraceId();
            }
            this.spanId = IDS.generateSpanId();
        }
    }

    public String traceId() {
        return traceId;
    }

    public String spanId() {
        return spanId;
    }

    public SpanRef ref() {
        return new SpanRef(traceId, spanId);
    }

    public String name() {
        return name;
    }

    /** True when the OpenTelemetry SDK records this span itself. */
    public boolean isRecorded() {
        return readable != null;
    }

    public synchronized boolean isFinished() {
        return finished != null;
    }

    public synchronized PipelineSpan setAttribute(String key, @Nullable Object value) {
        if (finished == null && value != null) {
            setTyped(key, value);
        }
        return this;
    }

    public PipelineSpan setAttributes(Map<String, ?> attributes) {
        attributes.forEach(this::setAttribute);
        return this;
    }

    /** Records the stage input as a JSON attribute. */
    public PipelineSpan setInput(Object input) {
        return setAttribute(INPUT, asJsonText(input));
    }

    /** Records the stage output as a JSON attribute. */
    public PipelineSpan setOutput(Object output) {
        return setAttribute(OUTPUT, asJsonText(output));
    }

    public synchronized PipelineSpan addEvent(String eventName, Map<String, ?> eventAttributes) {
        if (finished == null) {
            var builder = Attributes.builder();
            var recorded = new LinkedHashMap<String, Object>();
            eventAttributes.forEach(
                    (key, value) -> {
                        if (value != null) {
                            var normalized = normalize(value);
                            putTyped(builder, key, normalized);
                            recorded.put(key, normalized);
                        }
                    });
            span.addEvent(eventName, builder.build());
            events.add(new SpanRecord.Event(eventName, Instant.now(), recorded));
        }
        return this;
    }

    /** Marks the span failed; {@link #finish()} then keeps the error status. */
    public synchronized PipelineSpan setError(Throwable error) {
        if (finished == null) {
            var message = String.valueOf(error.getMessage());
            markError(message);
            span.recordException(error);
            var exception = new LinkedHashMap<String, Object>();
            exception.put("exception.type", error.getClass().getName());
            exception.put("exception.message", message);
            events.add(new SpanRecord.Event("exception", Instant.now(), exception));
            setTyped(ERROR_TYPE, error.getClass().getSimpleName());
            setTyped(ERROR_MESSAGE, message);
        }
        return this;
    }

    /** Marks the span failed without an exception, for failures reported as values. */
    public synchronized PipelineSpan setError(String message) {
        if (finished == null) {
            markError(message);
            setTyped(ERROR_MESSAGE, message);
        }
        return this;
    }

    /** Current state as a record without ending the span. */
    public synchronized SpanRecord snapshot() {
        if (finished != null) {
            return finished;
        }
        return readable != null ? SpanRecord.from(readable.toSpanData()) : localRecord(null);
    }

    public SpanRecord finish() {
        return finish(null);
    }

    public synchronized SpanRecord finish(@Nullable Instant endTime) {
        if (finished != null) {
            return finished;
        }
        if (!errored) {
            span.setStatus(StatusCode.OK);
            status = StatusCode.OK;
        }
        var end = endTime == null ? Instant.now() : endTime;
        if (endTime == null) {
            span.end();
        } else {
            span.end(endTime);
        }
        finished = readable != null ? SpanRecord.from(readable.toSpanData()) : localRecord(end);
        return finished;
    }

    private void markError(String message) {
        errored = true;
        status = StatusCode.ERROR;
        statusMessage = message;
        span.setStatus(StatusCode.ERROR, message);
    }

    private SpanRecord localRecord(@Nullable Instant endTime) {
        Double durationMs =
                endTime == null
                        ? null
                        : Duration.between(startTime, endTime).toNanos() / 1_000_000.0;
        return new SpanRecord(
                traceId,
                spanId,
                parentSpanId,
                name,
                kind,
                startTime,
                endTime,
                durationMs,
                status,
                statusMessage,
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes)),
                List.copyOf(events));
    }

    private void setTyped(String key, Object value) {
        var normalized = normalize(value);
        if (normalized instanceof String text) {
            span.setAttribute(key, text);
        } else if (normalized instanceof Boolean flag) {
            span.setAttribute(key, flag);
        } else if (normalized instanceof Long number) {
            span.setAttribute(key, number);
        } else {
            span.setAttribute(key, (Double) normalized);
        }
        attributes.put(key, normalized);
    }

    private static void putTyped(AttributesBuilder builder, String key, Object normalized) {
        if (normalized instanceof String text) {
            builder.put(AttributeKey.stringKey(key), text);
        } else if (normalized instanceof Boolean flag) {
            builder.put(AttributeKey.booleanKey(key), flag);
        } else if (normalized instanceof Long number) {
            builder.put(AttributeKey.longKey(key), number);
        } else {
            builder.put(AttributeKey.doubleKey(key), (Double) normalized);
        }
    }

    /** Maps a value onto an attribute type OpenTelemetry stores: string, boolean, long, double. */
    private static Object normalize(Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return EvalkitJsonMapper.toJson(value);
    }

    private static String asJsonText(Object value) {
        return value instanceof String s ? s : EvalkitJsonMapper.toJson(value);
    }
}
