package dev.evalkit.dataset;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.evalkit.json.EvalkitJsonMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls the named fields out of a dataset item's first turn.
 *
 * <p>The result maps field name (falling back to the field key) to its text content, in stored
 * order. Later turns are ignored. Missing or empty turns yield an empty map rather than an error.
 */
@Slf4j
public final class FieldExtractor {
    public static final String TURNS_KEY = "turns";

    public Map<String, Content> extract(DatasetItem item) {
        var turns = readTurns(item);
        if (turns.isEmpty()) {
            log.warn("dataset item {} has no turns, no fields extracted", item.id());
            return Map.of();
        }
        if (!(turns.get(0) instanceof Map<?, ?> firstTurn)) {
            throw new IllegalArgumentException(
                    "first turn of dataset item %d is not an object: %s"
                            .formatted(item.id(), turns.get(0)));
        }
        var fieldDataList = firstTurn.get("field_data_list");
        if (fieldDataList == null) {
            fieldDataList = firstTurn.get("fieldDataList");
        }
        if (!(fieldDataList instanceof List<?> fields)) {
            log.warn("dataset item {} first turn has no field list", item.id());
            return Map.of();
        }

        var extracted = new LinkedHashMap<String, Content>();
        for (var field : fields) {
            if (!(field instanceof Map<?, ?> fieldData)) {
                continue;
            }
            var name = firstNonBlank(fieldData.get("name"), fieldData.get("key"));
            var content = fieldData.get("content");
            if (name == null || isEmpty(content)) {
                continue;
            }
            extracted.put(name, Content.fromRaw(content));
        }
        if (extracted.containsKey(TURNS_KEY)) {
            throw new IllegalStateException(
                    "field extraction produced the reserved key '%s' for dataset item %d: %s"
                            .formatted(TURNS_KEY, item.id(), extracted.keySet()));
        }
        log.debug("extracted fields {} from dataset item {}", extracted.keySet(), item.id());
        return Collections.unmodifiableMap(extracted);
    }

    private static List<?> readTurns(DatasetItem item) {
        var raw = item.dataContent().get(TURNS_KEY);
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> list) {
            return list;
        }
        if (raw instanceof String json) {
            try {
                var parsed = EvalkitJsonMapper.get().readValue(json, Object.class);
                return parsed instanceof List<?> list ? list : List.of();
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException(
                        "unable to parse turns of dataset item %d".formatted(item.id()), e);
            }
        }
        throw new IllegalArgumentException(
                "turns of dataset item %d has unsupported type %s"
                        .formatted(item.id(), raw.getClass().getName()));
    }

    private static String firstNonBlank(Object... candidates) {
        for (var candidate : candidates) {
            if (candidate != null && !String.valueOf(candidate).isBlank()) {
                return String.valueOf(candidate);
            }
        }
        return null;
    }

    private static boolean isEmpty(Object content) {
        if (content == null) {
            return true;
        }
        if (content instanceof String s) {
            return s.isEmpty();
        }
        return content instanceof Map<?, ?> map && map.isEmpty();
    }
}
