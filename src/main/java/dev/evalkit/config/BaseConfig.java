package dev.evalkit.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Settings lookup shared by evalkit config objects. A setting resolves from the override map
 * first, then from the process environment, then from the supplied default.
 */
class BaseConfig {
    /** Sentinel that forces a setting to null. Only used for testing. */
    static final String NULL_OVERRIDE = "EVALKIT_NULL_SENTINEL_" + System.currentTimeMillis();

    private static final Map<Class<?>, Function<String, ?>> PARSERS =
            Map.of(
                    String.class, Function.identity(),
                    Boolean.class, Boolean::valueOf,
                    Integer.class, Integer::valueOf,
                    Long.class, Long::valueOf,
                    Double.class, Double::valueOf,
                    Duration.class, BaseConfig::parseDuration);

    private static final Map<Class<?>, Class<?>> BOXED =
            Map.of(
                    boolean.class, Boolean.class,
                    int.class, Integer.class,
                    long.class, Long.class,
                    double.class, Double.class);

    protected final Map<String, String> envOverrides;

    BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    @SuppressWarnings("unchecked")
    protected <T> @Nonnull T getConfig(@Nonnull String settingName, @Nonnull T defaultValue) {
        Objects.requireNonNull(defaultValue, settingName);
        var value = getConfig(settingName, defaultValue, (Class<T>) defaultValue.getClass());
        return Objects.requireNonNull(value, settingName);
    }

    protected <T> @Nullable T getConfig(
            @Nonnull String settingName, @Nullable T defaultValue, @Nonnull Class<T> settingClass) {
        var raw = getEnvValue(settingName);
        return raw == null ? defaultValue : cast(raw.trim(), settingClass);
    }

    protected @Nonnull <T> T getRequiredConfig(String settingName, Class<T> settingClass) {
        var value = getConfig(settingName, null, settingClass);
        if (value == null) {
            throw new RuntimeException(settingName + " is required");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    protected <T> T cast(@Nonnull String value, @Nonnull Class<T> settingClass) {
        Class<?> lookup = BOXED.getOrDefault(settingClass, settingClass);
        var parser = PARSERS.get(lookup);
        if (parser == null) {
            throw new RuntimeException("no parser for setting type " + settingClass.getName());
        }
        return (T) parser.apply(value);
    }

    protected @Nullable String getEnvValue(@Nonnull String settingName) {
        var value =
                envOverrides.containsKey(settingName)
                        ? envOverrides.get(settingName)
                        : System.getenv(settingName);
        return NULL_OVERRIDE.equals(value) ? null : value;
    }

    /** Plain numbers are seconds; anything else is ISO-8601 such as {@code PT30S}. */
    private static Duration parseDuration(String value) {
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(value));
        }
        return Duration.parse(value);
    }

    /** Pairs up {@code KEY, value, KEY, value...} arguments. */
    static Map<String, String> toOverrideMap(String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new RuntimeException(
                    "config overrides must come in key-value pairs, dangling key: "
                            + keysAndValues[keysAndValues.length - 1]);
        }
        var overrides = new LinkedHashMap<String, String>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            overrides.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return overrides;
    }
}
