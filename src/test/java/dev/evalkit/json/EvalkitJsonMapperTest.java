package dev.evalkit.json;

import static org.assertj.core.api.Assertions.*;

import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EvalkitJsonMapperTest {

    record Sample(String fieldName, Optional<String> note, Instant at) {}

    @Test
    void writesSnakeCaseAndSkipsAbsentValues() {
        var json =
                EvalkitJsonMapper.toJson(
                        new Sample("x", Optional.empty(), Instant.parse("2024-01-02T03:04:05Z")));

        assertThat(json).contains("\"field_name\":\"x\"");
        assertThat(json).doesNotContain("note");
        assertThat(json).contains("2024-01-02T03:04:05Z");
    }

    @Test
    void parseObjectOnlyAcceptsJsonObjects() {
        assertThat(EvalkitJsonMapper.parseObject("{\"a\": 1}")).isPresent();
        assertThat(EvalkitJsonMapper.parseObject("[1, 2]")).isEmpty();
        assertThat(EvalkitJsonMapper.parseObject("{not json}")).isEmpty();
        assertThat(EvalkitJsonMapper.parseObject("plain text")).isEmpty();
        assertThat(EvalkitJsonMapper.parseObject(null)).isEmpty();
    }
}
