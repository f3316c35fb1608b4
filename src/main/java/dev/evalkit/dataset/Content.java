package dev.evalkit.dataset;

import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Typed value of one dataset field. Only text content is read by the pipeline. */
public record Content(
        @Nonnull ContentType contentType, @Nullable String text, @Nullable String format) {

    public Content {
        Objects.requireNonNull(contentType);
    }

    public static Content text(String text) {
        return new Content(ContentType.TEXT, text, null);
    }

    /** Text of this content, never null. */
    public String asText() {
        return text == null ? "" : text;
    }

    /**
     * Reads a raw stored content value. A map contributes its {@code text} entry (or its own string
     * form when there is none); any other value is used as text directly.
     */
    static Content fromRaw(@Nonnull Object raw) {
        if (raw instanceof Map<?, ?> map) {
            var text = map.get("text");
            return text(text == null ? String.valueOf(map) : String.valueOf(text));
        }
        return text(String.valueOf(raw));
    }
}
