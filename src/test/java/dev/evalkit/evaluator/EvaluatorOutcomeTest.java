package dev.evalkit.evaluator;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class EvaluatorOutcomeTest {

    @Test
    void scoredOutputKeepsScoreAndUnwrapsReason() {
        var output = EvaluatorOutput.scored(0.75, "{\"reason\": \"mostly right\"}");

        var outcome = EvaluatorOutcome.fromOutput(1, output, 5);

        assertThat(outcome.score()).isEqualTo(0.75);
        assertThat(outcome.reason()).isEqualTo("mostly right");
        assertThat(outcome.hasError()).isFalse();
        assertThat(outcome.details()).containsKey("evaluator_result");
    }

    @Test
    void runErrorBecomesNullScoreWithMessage() {
        var output = EvaluatorOutput.failed(500, "sandbox died");

        var outcome = EvaluatorOutcome.fromOutput(1, output, 5);

        assertThat(outcome.score()).isNull();
        assertThat(outcome.errorMessage()).isEqualTo("Evaluator execution error: sandbox died");
        assertThat(outcome.reason()).isEqualTo(outcome.errorMessage());
    }

    @Test
    void missingScoreProducesDiagnosticWithRawOutput() {
        var output =
                new EvaluatorOutput(
                        new EvaluatorOutput.EvaluatorResult(null, "score: ???"),
                        null,
                        null,
                        12,
                        null);

        var outcome = EvaluatorOutcome.fromOutput(4, output, 5);

        assertThat(outcome.score()).isNull();
        assertThat(outcome.errorMessage()).isEqualTo(EvaluatorOutcome.SCORE_PARSE_FAILURE);
        assertThat(outcome.reason())
                .startsWith("Error: " + EvaluatorOutcome.SCORE_PARSE_FAILURE)
                .contains("Raw Output: score: ???")
                .contains("Debug Info:")
                .contains("\"evaluator_id\" : 4");
    }

    @Test
    void missingResultProducesDiagnostic() {
        var output = new EvaluatorOutput(null, null, null, 0, null);

        var outcome = EvaluatorOutcome.fromOutput(2, output, 5);

        assertThat(outcome.score()).isNull();
        assertThat(outcome.errorMessage()).isEqualTo(EvaluatorOutcome.NO_RESULT_FAILURE);
        assertThat(outcome.reason()).doesNotContain("Raw Output").contains("Debug Info:");
    }

    @Test
    void exceptionMessageIsReasonAndError() {
        var outcome = EvaluatorOutcome.fromException(new IllegalStateException("no input"));

        assertThat(outcome.score()).isNull();
        assertThat(outcome.reason()).isEqualTo("no input");
        assertThat(outcome.errorMessage()).isEqualTo("no input");
    }
}
