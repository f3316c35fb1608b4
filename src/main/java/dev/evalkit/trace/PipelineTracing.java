package dev.evalkit.trace;

import dev.evalkit.config.EvalkitConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.semconv.resource.attributes.ResourceAttributes;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Sets up the OpenTelemetry SDK that backs pipeline spans. Spans are persisted by {@link
 * SpanPersister}, so no exporter is required; extra processors (an OTLP batch processor, for
 * example) can be passed in.
 */
@Slf4j
public final class PipelineTracing {
    static final String INSTRUMENTATION_NAME = "evalkit-pipeline";
    static final String INSTRUMENTATION_VERSION = loadVersionFromProperties();

    /** Builds an SDK instance from the environment and registers it globally. */
    public static OpenTelemetry quickstart() {
        return of(EvalkitConfig.fromEnvironment(), true);
    }

    public static OpenTelemetry of(
            @Nonnull EvalkitConfig config,
            boolean registerGlobal,
            @Nonnull SpanProcessor... extraProcessors) {
        var tracerBuilder = SdkTracerProvider.builder();
        enable(config, tracerBuilder, extraProcessors);
        var tracerProvider = tracerBuilder.build();
        var openTelemetry = OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build();
        if (registerGlobal) {
            GlobalOpenTelemetry.set(openTelemetry);
            log.debug("Registered OpenTelemetry globally");
        }
        Runtime.getRuntime()
                .addShutdownHook(
                        new Thread(
                                () -> {
                                    log.debug("Shutting down. Flushing pipeline span processors.");
                                    var result =
                                            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
                                    log.debug(
                                            "otel shutdown complete. Done: {}, successful: {}",
                                            result.isDone(),
                                            result.isSuccess());
                                }));
        return openTelemetry;
    }

    /**
     * Adds the pipeline span processor to an existing tracer provider builder. Should only be
     * invoked once per builder.
     */
    public static PipelineSpanProcessor enable(
            @Nonnull EvalkitConfig config,
            @Nonnull SdkTracerProviderBuilder tracerProviderBuilder,
            @Nonnull SpanProcessor... extraProcessors) {
        log.info(
                "Initializing evalkit tracing with service={}, instrumentation-name={},"
                        + " instrumentation-version={}, jvm-version={}",
                config.serviceName(),
                INSTRUMENTATION_NAME,
                INSTRUMENTATION_VERSION,
                System.getProperty("java.runtime.version"));
        var resource =
                Resource.getDefault().toBuilder()
                        .put(ResourceAttributes.SERVICE_NAME, config.serviceName())
                        .put(ResourceAttributes.SERVICE_VERSION, INSTRUMENTATION_VERSION)
                        .build();
        var builder = new PipelineSpanProcessor.Builder(config);
        for (var processor : extraProcessors) {
            builder.withProcessor(processor);
        }
        var spanProcessor = builder.build();
        tracerProviderBuilder.addResource(resource).addSpanProcessor(spanProcessor);
        return spanProcessor;
    }

    /** Gets a tracer with evalkit instrumentation scope. */
    public static Tracer getTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME, INSTRUMENTATION_VERSION);
    }

    private static String loadVersionFromProperties() {
        try (var is = PipelineTracing.class.getResourceAsStream("/evalkit.properties")) {
            var props = new Properties();
            props.load(is);
            return props.getProperty("evalkit.version");
        } catch (Exception e) {
            throw new RuntimeException("unable to determine evalkit version", e);
        }
    }

    private PipelineTracing() {}
}
