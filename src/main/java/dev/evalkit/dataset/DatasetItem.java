package dev.evalkit.dataset;

import dev.evalkit.json.EvalkitJsonMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * One row of a dataset version. The raw {@code dataContent} is kept as stored: normally a {@code
 * turns} list, optionally with top-level convenience fields such as {@code output}.
 */
public record DatasetItem(long id, @Nonnull Map<String, Object> dataContent) {

    public DatasetItem {
        Objects.requireNonNull(dataContent);
        dataContent = Collections.unmodifiableMap(new LinkedHashMap<>(dataContent));
    }

    /** Builds an item from typed turns, stored the same way a persisted row would be. */
    public static DatasetItem of(long id, Turn... turns) {
        var content = new LinkedHashMap<String, Object>();
        content.put("turns", EvalkitJsonMapper.get().convertValue(List.of(turns), List.class));
        return new DatasetItem(id, content);
    }

    /** Top-level value of the raw content as a non-blank string. */
    public Optional<String> topLevelText(String key) {
        var value = dataContent.get(key);
        if (value == null) {
            return Optional.empty();
        }
        var text = String.valueOf(value);
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }
}
