package dev.evalkit.trace;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Storage form of one span. A record taken before the span finished has no end time, no duration
 * and status {@code UNSET}.
 */
public record SpanRecord(
        String traceId,
        String spanId,
        @Nullable String parentSpanId,
        String name,
        SpanKind kind,
        Instant startTime,
        @Nullable Instant endTime,
        @Nullable Double durationMs,
        StatusCode status,
        @Nullable String statusMessage,
        Map<String, Object> attributes,
        List<Event> events) {

    public boolean isRoot() {
        return parentSpanId == null;
    }

    public boolean hasEnded() {
        return endTime != null;
    }

    public record Event(String name, Instant timestamp, Map<String, Object> attributes) {}

    static SpanRecord from(SpanData data) {
        var start = toInstant(data.getStartEpochNanos());
        Instant end = null;
        Double durationMs = null;
        if (data.hasEnded()) {
            end = toInstant(data.getEndEpochNanos());
            durationMs = (data.getEndEpochNanos() - data.getStartEpochNanos()) / 1_000_000.0;
        }
        var status = data.getStatus();
        var description = status.getDescription();
        return new SpanRecord(
                data.getTraceId(),
                data.getSpanId(),
                data.getParentSpanContext().isValid() ? data.getParentSpanId() : null,
                data.getName(),
                data.getKind(),
                start,
                end,
                durationMs,
                status.getStatusCode(),
                description == null || description.isEmpty() ? null : description,
                toMap(data.getAttributes()),
                data.getEvents().stream()
                        .map(
                                event ->
                                        new Event(
                                                event.getName(),
                                                toInstant(event.getEpochNanos()),
                                                toMap(event.getAttributes())))
                        .toList());
    }

    private static Instant toInstant(long epochNanos) {
        return Instant.EPOCH.plusNanos(epochNanos);
    }

    private static Map<String, Object> toMap(Attributes attributes) {
        var map = new LinkedHashMap<String, Object>();
        attributes.forEach((key, value) -> map.put(key.getKey(), value));
        return Collections.unmodifiableMap(map);
    }
}
