package dev.evalkit.evaluator;

import dev.evalkit.dataset.Content;
import java.util.Map;

/**
 * Input handed to one evaluator invocation. Code evaluators read {@code evaluateDatasetFields}
 * and {@code evaluateTargetOutputFields}; prompt evaluators read {@code inputFields}. The unused
 * side is always empty.
 */
public record EvaluatorInput(
        Map<String, Content> inputFields,
        Map<String, Content> evaluateDatasetFields,
        Map<String, Content> evaluateTargetOutputFields) {

    public EvaluatorInput {
        inputFields = Map.copyOf(inputFields);
        evaluateDatasetFields = Map.copyOf(evaluateDatasetFields);
        evaluateTargetOutputFields = Map.copyOf(evaluateTargetOutputFields);
    }

    public static EvaluatorInput forCode(
            Map<String, Content> datasetFields, Map<String, Content> targetOutputFields) {
        return new EvaluatorInput(Map.of(), datasetFields, targetOutputFields);
    }

    public static EvaluatorInput forPrompt(Map<String, Content> inputFields) {
        return new EvaluatorInput(inputFields, Map.of(), Map.of());
    }

    public boolean containsField(String name) {
        return inputFields.containsKey(name)
                || evaluateDatasetFields.containsKey(name)
                || evaluateTargetOutputFields.containsKey(name);
    }
}
