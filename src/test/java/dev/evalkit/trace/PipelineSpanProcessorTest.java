package dev.evalkit.trace;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import dev.evalkit.config.EvalkitConfig;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PipelineSpanProcessorTest {

    private EvalkitConfig config;
    private SpanProcessor mockDelegate;
    private PipelineSpanProcessor processor;

    @BeforeEach
    void setUp() {
        config = EvalkitConfig.of("EVALKIT_SERVICE_NAME", "unit-test", "EVALKIT_DEBUG", "true");
        mockDelegate = mock(SpanProcessor.class);
        processor = new PipelineSpanProcessor(config, mockDelegate);
    }

    @Test
    void onStartStampsServiceName() {
        // Given
        var span = mock(ReadWriteSpan.class, RETURNS_DEEP_STUBS);

        // When
        processor.onStart(Context.root(), span);

        // Then
        verify(span).setAttribute(PipelineSpanProcessor.SERVICE_ATTRIBUTE, "unit-test");
        verify(mockDelegate).onStart(any(), eq(span));
    }

    @Test
    void onEndForwardsToDelegate() {
        var span = mock(ReadableSpan.class, RETURNS_DEEP_STUBS);

        processor.onEnd(span);

        verify(mockDelegate).onEnd(span);
    }

    @Test
    void lifecycleCallsAreDelegated() {
        when(mockDelegate.shutdown()).thenReturn(CompletableResultCode.ofSuccess());
        when(mockDelegate.forceFlush()).thenReturn(CompletableResultCode.ofSuccess());

        assertThat(processor.forceFlush().isSuccess()).isTrue();
        assertThat(processor.shutdown().isSuccess()).isTrue();
        verify(mockDelegate).forceFlush();
        verify(mockDelegate).shutdown();
    }

    @Test
    void enableInstallsProcessorAndResource() {
        var exporter = InMemorySpanExporter.create();
        var builder = SdkTracerProvider.builder();
        PipelineTracing.enable(config, builder, SimpleSpanProcessor.create(exporter));
        try (var provider = builder.build()) {
            var tracer = new PipelineTracer(provider.get(PipelineTracing.INSTRUMENTATION_NAME));

            tracer.startRootSpan("root", SpanKind.INTERNAL, Map.of()).finish();

            var spans = exporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            var span = spans.get(0);
            var serviceKey = AttributeKey.stringKey(PipelineSpanProcessor.SERVICE_ATTRIBUTE);
            assertThat(span.getAttributes().get(serviceKey)).isEqualTo("unit-test");
            Resource resource = span.getResource();
            assertThat(resource.getAttribute(AttributeKey.stringKey("service.name")))
                    .isEqualTo("unit-test");
        }
    }
}
