package dev.evalkit.dataset;

import javax.annotation.Nullable;

/** One named field of a turn. {@code name} is what evaluators see; {@code key} is the column id. */
public record FieldData(@Nullable String key, @Nullable String name, @Nullable Content content) {

    public static FieldData of(String name, String text) {
        return new FieldData(name, name, Content.text(text));
    }
}
