package dev.evalkit.evaluator;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ReasonTextTest {

    @Test
    void plainTextIsReturnedUnchanged() {
        assertThat(ReasonText.unwrap("looks fine", 5)).isEqualTo("looks fine");
        assertThat(ReasonText.unwrap(null, 5)).isNull();
    }

    @Test
    void unwrapsNestedJsonReasons() {
        var nested = "{\"result\": \"{\\\"reasoning\\\": \\\"inner text\\\"}\"}";

        assertThat(ReasonText.unwrap(nested, 5)).isEqualTo("inner text");
    }

    @Test
    void stopsAtDepthLimit() {
        var nested = "{\"reason\": \"{\\\"reason\\\": \\\"deep\\\"}\"}";

        assertThat(ReasonText.unwrap(nested, 1)).isEqualTo("{\"reason\": \"deep\"}");
    }

    @Test
    void objectWithoutReasonIsKept() {
        assertThat(ReasonText.unwrap("{\"score\": 1}", 5)).isEqualTo("{\"score\": 1}");
    }
}
