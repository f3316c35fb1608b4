package dev.evalkit.trace;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** Read model of one trace: the trace row plus its spans arranged by parent linkage. */
public record TraceTree(Optional<TraceRecord> trace, List<Node> trees, List<SpanRecord> spans) {

    public record Node(SpanRecord span, List<Node> children) {}

    /**
     * Builds the tree for {@code traceId}. Spans whose parent is missing from the trace are treated
     * as roots. An unknown trace yields an empty tree rather than an error.
     */
    public static TraceTree build(String traceId, TraceStore store) {
        var trace = store.findTrace(traceId);
        if (trace.isEmpty()) {
            return new TraceTree(Optional.empty(), List.of(), List.of());
        }
        var spans = store.listSpans(traceId);
        Set<String> spanIds = spans.stream().map(SpanRecord::spanId).collect(Collectors.toSet());
        var roots =
                spans.stream()
                        .filter(span -> span.isRoot() || !spanIds.contains(span.parentSpanId()))
                        .map(root -> node(root, spans))
                        .toList();
        return new TraceTree(trace, roots, spans);
    }

    private static Node node(SpanRecord span, List<SpanRecord> spans) {
        var children =
                spans.stream()
                        .filter(candidate -> span.spanId().equals(candidate.parentSpanId()))
                        .map(child -> node(child, spans))
                        .toList();
        return new Node(span, children);
    }
}
