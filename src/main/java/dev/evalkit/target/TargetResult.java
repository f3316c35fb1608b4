package dev.evalkit.target;

import dev.evalkit.dataset.Content;
import dev.evalkit.evaluator.EvaluatorInputBuilder;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Output of the target stage for one item.
 *
 * @param targetFields normally a single {@code actual_output} entry; empty when a none-kind target
 *     failed
 * @param error raw failure text, null on success
 */
public record TargetResult(Map<String, Content> targetFields, @Nullable String error) {
    public static final String FAILURE_PREFIX = "[Target invocation failed] ";

    public TargetResult {
        targetFields = Map.copyOf(targetFields);
    }

    public static TargetResult success(String actualOutput) {
        return new TargetResult(
                Map.of(EvaluatorInputBuilder.ACTUAL_OUTPUT, Content.text(actualOutput)), null);
    }

    public boolean failed() {
        return error != null;
    }

    /** Text stored as the evaluated output on results. */
    public String actualOutput() {
        var content = targetFields.get(EvaluatorInputBuilder.ACTUAL_OUTPUT);
        if (content != null) {
            return content.asText();
        }
        return error == null ? "" : FAILURE_PREFIX + error;
    }
}
