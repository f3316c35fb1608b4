package dev.evalkit.dataset;

import java.util.List;

public record Turn(List<FieldData> fieldDataList) {

    public static Turn of(FieldData... fields) {
        return new Turn(List.of(fields));
    }
}
