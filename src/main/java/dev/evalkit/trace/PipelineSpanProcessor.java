package dev.evalkit.trace;

import dev.evalkit.config.EvalkitConfig;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

/**
 * Span processor installed on the pipeline tracer provider. Stamps the service name on every span,
 * logs finished spans when debug is on, and forwards to an optional delegate.
 */
@Slf4j
public class PipelineSpanProcessor implements SpanProcessor {
    public static final String SERVICE_ATTRIBUTE = "evalkit.service";

    private final EvalkitConfig config;
    private final SpanProcessor delegate;

    public PipelineSpanProcessor(EvalkitConfig config, SpanProcessor delegate) {
        this.config = config;
        this.delegate = delegate;
    }

    @Override
    public void onStart(@NotNull Context parentContext, ReadWriteSpan span) {
        if (config.debug()) {
            log.debug(
                    "OnStart: span={}, trace={}",
                    span.getName(),
                    span.getSpanContext().getTraceId());
        }
        span.setAttribute(SERVICE_ATTRIBUTE, config.serviceName());
        delegate.onStart(parentContext, span);
    }

    @Override
    public boolean isStartRequired() {
        return true;
    }

    @Override
    public void onEnd(ReadableSpan span) {
        if (config.debug()) {
            logSpanDetails(span);
        }
        delegate.onEnd(span);
    }

    @Override
    public boolean isEndRequired() {
        return true;
    }

    @Override
    public CompletableResultCode shutdown() {
        return delegate.shutdown();
    }

    @Override
    public CompletableResultCode forceFlush() {
        return delegate.forceFlush();
    }

    private void logSpanDetails(ReadableSpan span) {
        var spanData = span.toSpanData();
        log.debug(
                "Span completed: name={}, traceId={}, spanId={}, parentSpanId={}, duration={}ms,"
                        + " status={}, attributes={}, events={}",
                spanData.getName(),
                spanData.getTraceId(),
                spanData.getSpanId(),
                spanData.getParentSpanId(),
                (spanData.getEndEpochNanos() - spanData.getStartEpochNanos()) / 1_000_000,
                spanData.getStatus().getStatusCode(),
                spanData.getAttributes(),
                spanData.getEvents().size());
    }

    static String formatSpan(SpanData span) {
        return String.format(
                "[%s] %s trace=%s span=%s (duration: %dms, status: %s, attributes: %s)",
                span.getKind(),
                span.getName(),
                span.getTraceId(),
                span.getSpanId(),
                (span.getEndEpochNanos() - span.getStartEpochNanos()) / 1_000_000,
                span.getStatus().getStatusCode(),
                span.getAttributes());
    }

    /** Builder for pipeline span processors. */
    public static final class Builder {
        private final EvalkitConfig config;
        private final List<SpanProcessor> processors = new ArrayList<>();
        private boolean enableConsoleLog;

        public Builder(EvalkitConfig config) {
            this.config = config;
            this.enableConsoleLog = config.enableTraceConsoleLog();
        }

        public Builder withProcessor(SpanProcessor processor) {
            this.processors.add(processor);
            return this;
        }

        public Builder enableConsoleLog(boolean enable) {
            this.enableConsoleLog = enable;
            return this;
        }

        public PipelineSpanProcessor build() {
            var all = new ArrayList<>(processors);
            if (enableConsoleLog) {
                all.add(createConsoleProcessor());
            }
            return new PipelineSpanProcessor(config, SpanProcessor.composite(all));
        }

        private static SpanProcessor createConsoleProcessor() {
            return new SpanProcessor() {
                @Override
                public void onStart(@NotNull Context parentContext, ReadWriteSpan span) {}

                @Override
                public boolean isStartRequired() {
                    return false;
                }

                @Override
                public void onEnd(ReadableSpan span) {
                    System.out.println(formatSpan(span.toSpanData()));
                }

                @Override
                public boolean isEndRequired() {
                    return true;
                }

                @Override
                public CompletableResultCode shutdown() {
                    return CompletableResultCode.ofSuccess();
                }

                @Override
                public CompletableResultCode forceFlush() {
                    return CompletableResultCode.ofSuccess();
                }
            };
        }
    }
}
