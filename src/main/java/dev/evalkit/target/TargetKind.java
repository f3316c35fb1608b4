package dev.evalkit.target;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TargetKind {
    NONE,
    API,
    MODEL_SET,
    PROMPT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
