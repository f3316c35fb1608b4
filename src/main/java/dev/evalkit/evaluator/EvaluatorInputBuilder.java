package dev.evalkit.evaluator;

import dev.evalkit.dataset.Content;
import dev.evalkit.dataset.FieldExtractor;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Shapes extracted dataset fields and target output into evaluator-kind specific input. */
@Slf4j
public final class EvaluatorInputBuilder {
    public static final String ACTUAL_OUTPUT = "actual_output";
    public static final String OUTPUT = "output";

    /**
     * @param datasetFields fields extracted from the item's first turn
     * @param targetFields target adapter output, normally just {@code actual_output}
     * @throws IllegalStateException when both sides are empty or the reserved {@code turns} key
     *     leaks into the input
     */
    public EvaluatorInput build(
            long evaluatorId,
            EvaluatorKind kind,
            Map<String, Content> datasetFields,
            Map<String, Content> targetFields) {
        if (datasetFields.isEmpty() && targetFields.isEmpty()) {
            throw new IllegalStateException(
                    "evaluator %d has no input: dataset fields and target fields are both empty"
                            .formatted(evaluatorId));
        }
        var input =
                switch (kind) {
                    case CODE -> EvaluatorInput.forCode(datasetFields, targetFields);
                    case PROMPT -> EvaluatorInput.forPrompt(
                            mergePromptFields(datasetFields, targetFields));
                };
        if (input.containsField(FieldExtractor.TURNS_KEY)) {
            throw new IllegalStateException(
                    "reserved key '%s' found in input of evaluator %d"
                            .formatted(FieldExtractor.TURNS_KEY, evaluatorId));
        }
        return input;
    }

    private static Map<String, Content> mergePromptFields(
            Map<String, Content> datasetFields, Map<String, Content> targetFields) {
        var merged = new LinkedHashMap<String, Content>();
        var targetOutput = targetFields.get(ACTUAL_OUTPUT);
        boolean hasTargetOutput = targetOutput != null && !targetOutput.asText().isEmpty();
        if (hasTargetOutput) {
            merged.put(OUTPUT, targetOutput);
        }
        merged.putAll(targetFields);
        datasetFields.forEach(
                (name, content) -> {
                    if (hasTargetOutput && OUTPUT.equals(name)) {
                        log.debug("dropping dataset field 'output' in favor of target output");
                        return;
                    }
                    merged.putIfAbsent(name, content);
                });
        return merged;
    }
}
