package dev.evalkit.target;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** The system under test configured on an experiment, tagged by {@link TargetKind}. */
public sealed interface TargetConfig
        permits TargetConfig.None, TargetConfig.Api, TargetConfig.ModelSet, TargetConfig.Prompt {

    TargetKind kind();

    /** True when an external system is actually invoked. */
    default boolean isConfigured() {
        return kind() != TargetKind.NONE;
    }

    static TargetConfig none() {
        return new None();
    }

    /** The item's own data is judged; nothing is invoked. */
    record None() implements TargetConfig {
        @Override
        public TargetKind kind() {
            return TargetKind.NONE;
        }
    }

    /**
     * An HTTP endpoint.
     *
     * @param inputMapping request field name to dataset field name; empty sends every field as is
     * @param bodyTemplate extra body entries; a string value {@code "{name}"} copies the mapped
     *     field {@code name}, any other value is used literally when the key is not mapped already
     */
    record Api(
            @Nonnull String url,
            @Nonnull String method,
            @Nonnull Map<String, String> headers,
            @Nonnull Map<String, Object> bodyTemplate,
            @Nonnull Map<String, String> inputMapping)
            implements TargetConfig {

        public Api {
            Objects.requireNonNull(url);
            method = method == null || method.isBlank() ? "POST" : method;
            headers = Map.copyOf(headers);
            bodyTemplate = Collections.unmodifiableMap(new LinkedHashMap<>(bodyTemplate));
            inputMapping = Collections.unmodifiableMap(new LinkedHashMap<>(inputMapping));
        }

        public static Api post(String url) {
            return new Api(url, "POST", Map.of(), Map.of(), Map.of());
        }

        @Override
        public TargetKind kind() {
            return TargetKind.API;
        }
    }

    /** A stored set of model configurations. */
    record ModelSet(long modelSetId) implements TargetConfig {
        @Override
        public TargetKind kind() {
            return TargetKind.MODEL_SET;
        }
    }

    /** A stored prompt run against a model configuration. */
    record Prompt(@Nullable Long modelConfigId, @Nonnull String promptTemplate)
            implements TargetConfig {
        @Override
        public TargetKind kind() {
            return TargetKind.PROMPT;
        }
    }
}
