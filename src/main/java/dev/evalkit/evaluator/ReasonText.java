package dev.evalkit.evaluator;

import dev.evalkit.json.EvalkitJsonMapper;

/** Unwraps evaluator reasons that arrive as (possibly nested) JSON-encoded objects. */
public final class ReasonText {
    private static final String[] REASON_FIELDS = {"reason", "reasoning"};

    private ReasonText() {}

    /**
     * Returns the innermost {@code reason}/{@code reasoning} text of a JSON-object reason, or the
     * input unchanged when it is not a JSON object.
     */
    public static String unwrap(String text, int maxDepth) {
        if (text == null || text.isEmpty() || maxDepth <= 0) {
            return text;
        }
        var parsed = EvalkitJsonMapper.parseObject(text).orElse(null);
        if (parsed == null) {
            return text;
        }
        for (var field : REASON_FIELDS) {
            var value = parsed.get(field);
            if (value != null) {
                return value.isTextual() ? unwrap(value.asText(), maxDepth - 1) : value.toString();
            }
        }
        var values = parsed.elements();
        while (values.hasNext()) {
            var value = values.next();
            if (value.isTextual() && value.asText().strip().startsWith("{")) {
                return unwrap(value.asText(), maxDepth - 1);
            }
        }
        return text;
    }
}
