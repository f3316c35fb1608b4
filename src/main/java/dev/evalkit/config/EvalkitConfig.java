package dev.evalkit.config;

import java.time.Duration;
import java.util.Map;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Configuration for the evalkit pipeline. */
@Getter
@Accessors(fluent = true)
public final class EvalkitConfig extends BaseConfig {
    private final String serviceName = getConfig("EVALKIT_SERVICE_NAME", "evalkit");
    private final boolean enableTraceConsoleLog =
            getConfig("EVALKIT_ENABLE_TRACE_CONSOLE_LOG", false);
    private final boolean debug = getConfig("EVALKIT_DEBUG", false);
    private final int jobThreads = getConfig("EVALKIT_JOB_THREADS", 4);
    private final Duration targetRequestTimeout =
            getConfig("EVALKIT_TARGET_REQUEST_TIMEOUT", Duration.ofSeconds(60), Duration.class);
    private final Duration targetConnectTimeout =
            getConfig("EVALKIT_TARGET_CONNECT_TIMEOUT", Duration.ofSeconds(10), Duration.class);
    private final int maxReasonParseDepth = getConfig("EVALKIT_MAX_REASON_PARSE_DEPTH", 5);
    private final int maxDatasetItems = getConfig("EVALKIT_MAX_DATASET_ITEMS", 10_000);

    public static EvalkitConfig fromEnvironment() {
        return of();
    }

    public static EvalkitConfig of(String... envOverrides) {
        return new EvalkitConfig(toOverrideMap(envOverrides));
    }

    private EvalkitConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (jobThreads < 1) {
            throw new RuntimeException("EVALKIT_JOB_THREADS must be positive: " + jobThreads);
        }
        if (maxDatasetItems < 1) {
            throw new RuntimeException(
                    "EVALKIT_MAX_DATASET_ITEMS must be positive: " + maxDatasetItems);
        }
    }
}
