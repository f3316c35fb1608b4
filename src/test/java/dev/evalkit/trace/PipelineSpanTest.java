package dev.evalkit.trace;

import static org.assertj.core.api.Assertions.*;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.junit5.OpenTelemetryExtension;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class PipelineSpanTest {

    @RegisterExtension
    static final OpenTelemetryExtension otelTesting = OpenTelemetryExtension.create();

    private PipelineTracer tracer;

    @BeforeEach
    void setUp() {
        tracer = PipelineTracer.of(otelTesting.getOpenTelemetry());
    }

    @Test
    void finishIsIdempotent() {
        var span = tracer.startRootSpan("experiment_item_1", SpanKind.INTERNAL, Map.of());
        var end = Instant.now().plusMillis(5);

        var first = span.finish(end);
        var second = span.finish(end.plusSeconds(60));

        assertThat(second).isSameAs(first);
        assertThat(second.endTime()).isEqualTo(first.endTime());
        assertThat(second.durationMs()).isEqualTo(first.durationMs());
        assertThat(span.isFinished()).isTrue();
        assertThat(otelTesting.getSpans()).hasSize(1);
    }

    @Test
    void finishDefaultsToOkStatus() {
        var record = tracer.startRootSpan("root", SpanKind.INTERNAL, Map.of()).finish();

        assertThat(record.status()).isEqualTo(StatusCode.OK);
        assertThat(record.hasEnded()).isTrue();
        assertThat(record.durationMs()).isNotNull().isGreaterThanOrEqualTo(0.0);
        assertThat(record.isRoot()).isTrue();
    }

    @Test
    void errorStatusSurvivesFinish() {
        var span = tracer.startRootSpan("root", SpanKind.INTERNAL, Map.of());
        span.setError(new IllegalStateException("boom"));

        var record = span.finish();

        assertThat(record.status()).isEqualTo(StatusCode.ERROR);
        assertThat(record.statusMessage()).isEqualTo("boom");
        assertThat(record.attributes())
                .containsEntry(PipelineSpan.ERROR_TYPE, "IllegalStateException")
                .containsEntry(PipelineSpan.ERROR_MESSAGE, "boom");
        assertThat(record.events()).extracting(SpanRecord.Event::name).contains("exception");
    }

    @Test
    void childSpansShareTraceAndGetFreshIds() {
        var root = tracer.startRootSpan("root", SpanKind.INTERNAL, Map.of());
        var child = tracer.startSpan("evaluation_target", root.ref(), SpanKind.CLIENT, Map.of());
        var otherRoot = tracer.startRootSpan("root", SpanKind.INTERNAL, Map.of());

        var childRecord = child.finish();

        assertThat(childRecord.traceId()).isEqualTo(root.traceId());
        assertThat(childRecord.parentSpanId()).isEqualTo(root.spanId());
        assertThat(childRecord.spanId()).isNotEqualTo(root.spanId());
        assertThat(childRecord.kind()).isEqualTo(SpanKind.CLIENT);
        assertThat(otherRoot.traceId()).isNotEqualTo(root.traceId());
    }

    @Test
    void inputOutputAndEventsAreRecorded() {
        var span =
                tracer.startRootSpan("root", SpanKind.INTERNAL, Map.of("dataset_item_id", 7L));
        span.setInput(Map.of("question", "2+2"));
        span.setOutput("4");
        span.addEvent("field_extraction_completed", Map.of("field_count", 2));

        var record = span.finish();

        assertThat(record.attributes())
                .containsEntry("dataset_item_id", 7L)
                .containsEntry(PipelineSpan.INPUT, "{\"question\":\"2+2\"}")
                .containsEntry(PipelineSpan.OUTPUT, "4");
        assertThat(record.events()).hasSize(1);
        assertThat(record.events().get(0).attributes()).containsEntry("field_count", 2L);
    }

    @Test
    void snapshotBeforeFinishHasNoEnd() {
        var span = tracer.startRootSpan("root", SpanKind.INTERNAL, Map.of());

        var snapshot = span.snapshot();

        assertThat(snapshot.hasEnded()).isFalse();
        assertThat(snapshot.durationMs()).isNull();
        assertThat(snapshot.status()).isEqualTo(StatusCode.UNSET);
    }

    @Test
    void changesAfterFinishAreIgnored() {
        var span = tracer.startRootSpan("root", SpanKind.INTERNAL, Map.of());
        var record = span.finish();

        span.setAttribute("late", "value").setError(new RuntimeException("late"));

        assertThat(span.finish()).isSameAs(record);
        assertThat(record.attributes()).doesNotContainKey("late");
        assertThat(record.status()).isEqualTo(StatusCode.OK);
    }

    @Test
    void unrecordedSpansStillProduceCompleteRecords() {
        var noopTracer = PipelineTracer.of(OpenTelemetry.noop());
        var root = noopTracer.startRootSpan("experiment_item_1", SpanKind.INTERNAL, Map.of("a", 1));
        var child = noopTracer.startSpan("evaluator", root.ref(), SpanKind.CLIENT, Map.of());
        child.setInput(Map.of("q", "question")).setError(new IllegalStateException("boom"));

        var childRecord = child.finish();
        var rootRecord = root.finish();

        assertThat(root.isRecorded()).isFalse();
        assertThat(rootRecord.name()).isEqualTo("experiment_item_1");
        assertThat(rootRecord.isRoot()).isTrue();
        assertThat(rootRecord.status()).isEqualTo(StatusCode.OK);
        assertThat(rootRecord.attributes()).containsEntry("a", 1L);
        assertThat(rootRecord.durationMs()).isNotNull().isGreaterThanOrEqualTo(0.0);
        assertThat(childRecord.traceId()).isEqualTo(rootRecord.traceId());
        assertThat(childRecord.parentSpanId()).isEqualTo(rootRecord.spanId());
        assertThat(childRecord.spanId()).isNotEqualTo(rootRecord.spanId());
        assertThat(childRecord.kind()).isEqualTo(SpanKind.CLIENT);
        assertThat(childRecord.status()).isEqualTo(StatusCode.ERROR);
        assertThat(childRecord.statusMessage()).isEqualTo("boom");
        assertThat(childRecord.attributes())
                .containsEntry(PipelineSpan.ERROR_TYPE, "IllegalStateException")
                .containsKey(PipelineSpan.INPUT);
        assertThat(childRecord.events()).extracting(SpanRecord.Event::name).contains("exception");
    }

    @Test
    void unrecordedRootsGetDistinctTraces() {
        var noopTracer = PipelineTracer.of(OpenTelemetry.noop());

        var first = noopTracer.startRootSpan("root", SpanKind.INTERNAL, Map.of());
        var second = noopTracer.startRootSpan("root", SpanKind.INTERNAL, Map.of());

        assertThat(first.traceId()).hasSize(32).isNotEqualTo(second.traceId());
        assertThat(first.spanId()).hasSize(16);
    }
}
