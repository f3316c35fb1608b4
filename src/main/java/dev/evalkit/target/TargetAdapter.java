package dev.evalkit.target;

import dev.evalkit.dataset.Content;
import dev.evalkit.dataset.DatasetItem;
import dev.evalkit.evaluator.EvaluatorInputBuilder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces the evaluated output for one item. A none-kind target reads the item's own output
 * fields; every other kind goes through the {@link TargetInvoker}. Failures never escape: they come
 * back as a {@link TargetResult} carrying the error.
 */
@Slf4j
public final class TargetAdapter {
    static final List<String> OUTPUT_FIELD_PRIORITY =
            List.of("output", "answer", "reference_output");
    static final List<String> RAW_OUTPUT_PRIORITY = List.of("output", "reference_output", "answer");

    private final TargetInvoker invoker;

    public TargetAdapter(TargetInvoker invoker) {
        this.invoker = Objects.requireNonNull(invoker);
    }

    public TargetResult invoke(
            TargetConfig config, Map<String, Content> extractedFields, DatasetItem item) {
        try {
            var output =
                    switch (config.kind()) {
                        case NONE -> outputFromItem(extractedFields, item);
                        case API, MODEL_SET, PROMPT -> invokeExternal(config, extractedFields);
                    };
            return TargetResult.success(output);
        } catch (RuntimeException e) {
            var error = "Failed to call evaluation target: " + e.getMessage();
            log.error(
                    "target {} failed for dataset item {}",
                    config.kind().wireName(),
                    item.id(),
                    e);
            if (config.isConfigured()) {
                return new TargetResult(
                        Map.of(
                                EvaluatorInputBuilder.ACTUAL_OUTPUT,
                                Content.text(TargetResult.FAILURE_PREFIX + error)),
                        error);
            }
            return new TargetResult(Map.of(), error);
        }
    }

    private String invokeExternal(TargetConfig config, Map<String, Content> extractedFields) {
        var inputFields = new LinkedHashMap<String, String>();
        extractedFields.forEach((name, content) -> inputFields.put(name, content.asText()));
        var output = invoker.invoke(config, inputFields);
        if (output == null || output.isBlank()) {
            log.warn("target {} returned empty output", config.kind().wireName());
            return output == null ? "" : output;
        }
        return output;
    }

    static String outputFromItem(Map<String, Content> extractedFields, DatasetItem item) {
        return firstPresent(extractedFields, OUTPUT_FIELD_PRIORITY)
                .or(
                        () ->
                                RAW_OUTPUT_PRIORITY.stream()
                                        .map(item::topLevelText)
                                        .flatMap(Optional::stream)
                                        .findFirst())
                .or(() -> extractedFields.values().stream().findFirst().map(Content::asText))
                .orElse("");
    }

    private static Optional<String> firstPresent(
            Map<String, Content> fields, List<String> priority) {
        for (var name : priority) {
            var content = fields.get(name);
            if (content != null && !content.asText().isEmpty()) {
                return Optional.of(content.asText());
            }
        }
        return Optional.empty();
    }
}
