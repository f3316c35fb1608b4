package dev.evalkit.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;
import java.util.Optional;
import lombok.SneakyThrows;

/** Centralized ObjectMapper for evalkit. */
public final class EvalkitJsonMapper {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper INSTANCE =
            new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .registerModule(new Jdk8Module())
                    .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                    .setDefaultPropertyInclusion(JsonInclude.Include.NON_ABSENT)
                    .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EvalkitJsonMapper() {}

    public static ObjectMapper get() {
        return INSTANCE;
    }

    @SneakyThrows
    public static String toJson(Object o) {
        return INSTANCE.writeValueAsString(o);
    }

    @SneakyThrows
    public static String toPrettyJson(Object o) {
        return INSTANCE.writerWithDefaultPrettyPrinter().writeValueAsString(o);
    }

    @SneakyThrows
    public static <T> T fromJson(String jsonString, Class<T> targetClass) {
        return INSTANCE.readValue(jsonString, targetClass);
    }

    @SneakyThrows
    public static Map<String, Object> toMap(Object value) {
        return INSTANCE.convertValue(value, MAP_TYPE);
    }

    /** Parses {@code text} as a JSON object, or returns empty when it is not one. */
    public static Optional<JsonNode> parseObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        var trimmed = text.strip();
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return Optional.empty();
        }
        try {
            var node = INSTANCE.readTree(trimmed);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
