package dev.evalkit.trace;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** Storage for traces and spans. Spans reference their trace by id and may arrive in any order. */
public interface TraceStore {
    Optional<TraceRecord> findTrace(String traceId);

    /**
     * Inserts {@code trace} unless a row with the same id exists. Returns whichever row is stored
     * afterwards. Must be atomic: concurrent callers never produce two rows for one trace id.
     */
    TraceRecord createTraceIfAbsent(TraceRecord trace);

    void updateTrace(TraceRecord trace);

    /** Inserts the span, or replaces the stored span with the same span id. */
    void upsertSpan(SpanRecord span);

    Optional<SpanRecord> findSpan(String spanId);

    /** Spans of one trace ordered by start time. */
    List<SpanRecord> listSpans(String traceId);

    List<TraceRecord> listTraces();

    boolean isHealthy();

    /** Attempts to restore a usable connection. Returns the health afterwards. */
    boolean recover();

    /** Implementation for test doubling and embedded use */
    class InMemoryImpl implements TraceStore {
        private final Map<String, TraceRecord> traces = new ConcurrentHashMap<>();
        private final Map<String, SpanRecord> spans = new ConcurrentHashMap<>();
        private final AtomicBoolean healthy = new AtomicBoolean(true);
        private final AtomicBoolean recoverable = new AtomicBoolean(true);
        private final AtomicInteger recoveryAttempts = new AtomicInteger();

        @Override
        public Optional<TraceRecord> findTrace(String traceId) {
            return Optional.ofNullable(traces.get(traceId));
        }

        @Override
        public TraceRecord createTraceIfAbsent(TraceRecord trace) {
            return traces.computeIfAbsent(trace.traceId(), id -> trace);
        }

        @Override
        public void updateTrace(TraceRecord trace) {
            traces.put(trace.traceId(), trace);
        }

        @Override
        public void upsertSpan(SpanRecord span) {
            spans.put(span.spanId(), span);
        }

        @Override
        public Optional<SpanRecord> findSpan(String spanId) {
            return Optional.ofNullable(spans.get(spanId));
        }

        @Override
        public List<SpanRecord> listSpans(String traceId) {
            return spans.values().stream()
                    .filter(span -> span.traceId().equals(traceId))
                    .sorted(Comparator.comparing(SpanRecord::startTime))
                    .toList();
        }

        @Override
        public List<TraceRecord> listTraces() {
            var all = new ArrayList<>(traces.values());
            all.sort(Comparator.comparing(TraceRecord::startTime));
            return all;
        }

        @Override
        public boolean isHealthy() {
            return healthy.get();
        }

        @Override
        public boolean recover() {
            recoveryAttempts.incrementAndGet();
            if (recoverable.get()) {
                healthy.set(true);
            }
            return healthy.get();
        }

        /** Simulates a lost connection; {@code recoverable} controls whether recovery succeeds. */
        public void breakConnection(boolean recoverable) {
            this.healthy.set(false);
            this.recoverable.set(recoverable);
        }

        public int recoveryAttempts() {
            return recoveryAttempts.get();
        }
    }
}
