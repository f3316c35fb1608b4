package dev.evalkit.dataset;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldExtractorTest {
    private final FieldExtractor extractor = new FieldExtractor();

    @Test
    void extractsFieldsOfFirstTurnByName() {
        var item =
                DatasetItem.of(
                        1,
                        Turn.of(FieldData.of("input", "2+2?"), FieldData.of("output", "4")),
                        Turn.of(FieldData.of("ignored", "second turn")));

        var fields = extractor.extract(item);

        assertThat(fields).containsOnlyKeys("input", "output");
        assertThat(fields.get("input").asText()).isEqualTo("2+2?");
        assertThat(fields.get("output").asText()).isEqualTo("4");
    }

    @Test
    void prefersNameOverKeyAndSkipsEmptyEntries() {
        var item =
                DatasetItem.of(
                        2,
                        Turn.of(
                                new FieldData("col_1", "question", Content.text("why?")),
                                new FieldData("col_2", null, Content.text("because")),
                                new FieldData("col_3", "missing", null)));

        var fields = extractor.extract(item);

        assertThat(fields).containsOnlyKeys("question", "col_2");
    }

    @Test
    void readsCamelCaseFieldListAndPlainStringContent() {
        var turn =
                Map.of(
                        "fieldDataList",
                        List.of(Map.of("key", "k", "name", "answer", "content", "42")));
        var item = new DatasetItem(3, Map.of("turns", List.of(turn)));

        assertThat(extractor.extract(item).get("answer").asText()).isEqualTo("42");
    }

    @Test
    void parsesTurnsStoredAsJsonString() {
        var item =
                new DatasetItem(
                        4,
                        Map.of(
                                "turns",
                                "[{\"field_data_list\": [{\"name\": \"input\", \"content\":"
                                        + " {\"content_type\": \"text\", \"text\": \"hi\"}}]}]"));

        assertThat(extractor.extract(item).get("input").asText()).isEqualTo("hi");
    }

    @Test
    void missingTurnsYieldEmptyMap() {
        assertThat(extractor.extract(new DatasetItem(5, Map.of()))).isEmpty();
        assertThat(extractor.extract(new DatasetItem(6, Map.of("turns", List.of())))).isEmpty();
        assertThat(extractor.extract(new DatasetItem(7, Map.of("turns", List.of(Map.of())))))
                .isEmpty();
    }

    @Test
    void malformedTurnsJsonIsRejected() {
        var item = new DatasetItem(8, Map.of("turns", "[{broken"));

        assertThatThrownBy(() -> extractor.extract(item))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dataset item 8");
    }

    @Test
    void reservedTurnsFieldNameIsAParsingBug() {
        var item = DatasetItem.of(9, Turn.of(FieldData.of("turns", "nested")));

        assertThatThrownBy(() -> extractor.extract(item))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("turns");
    }
}
