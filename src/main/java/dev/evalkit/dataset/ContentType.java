package dev.evalkit.dataset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ContentType {
    TEXT,
    IMAGE,
    AUDIO,
    MULTIPART;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContentType fromWireName(String value) {
        return value == null ? TEXT : valueOf(value.toUpperCase(Locale.ROOT));
    }
}
