package dev.evalkit.trace;

import static org.assertj.core.api.Assertions.*;

import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.sdk.testing.junit5.OpenTelemetryExtension;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class TraceTreeTest {

    @RegisterExtension
    static final OpenTelemetryExtension otelTesting = OpenTelemetryExtension.create();

    @Test
    void arrangesSpansByParent() {
        var tracer = PipelineTracer.of(otelTesting.getOpenTelemetry());
        var store = new TraceStore.InMemoryImpl();
        var persister = new SpanPersister();
        var root = tracer.startRootSpan("experiment_item_1", SpanKind.INTERNAL, Map.of());
        var target = tracer.startSpan("evaluation_target", root.ref(), SpanKind.CLIENT, Map.of());
        var evaluator = tracer.startSpan("evaluator_1", root.ref(), SpanKind.INTERNAL, Map.of());
        persister.persist(evaluator.finish(), store);
        persister.persist(target.finish(), store);
        persister.persist(root.finish(), store);

        var tree = TraceTree.build(root.traceId(), store);

        assertThat(tree.trace()).isPresent();
        assertThat(tree.spans()).hasSize(3);
        assertThat(tree.trees()).hasSize(1);
        var rootNode = tree.trees().get(0);
        assertThat(rootNode.span().name()).isEqualTo("experiment_item_1");
        assertThat(rootNode.children())
                .extracting(node -> node.span().name())
                .containsExactly("evaluation_target", "evaluator_1");
    }

    @Test
    void orphanedSpansBecomeRoots() {
        var tracer = PipelineTracer.of(otelTesting.getOpenTelemetry());
        var store = new TraceStore.InMemoryImpl();
        var root = tracer.startRootSpan("never_persisted", SpanKind.INTERNAL, Map.of());
        var child = tracer.startSpan("evaluator_1", root.ref(), SpanKind.INTERNAL, Map.of());
        new SpanPersister().persist(child.finish(), store);

        var tree = TraceTree.build(root.traceId(), store);

        assertThat(tree.trees())
                .extracting(node -> node.span().name())
                .containsExactly("evaluator_1");
    }

    @Test
    void unknownTraceIsEmpty() {
        var store = new TraceStore.InMemoryImpl();

        var tree = TraceTree.build("0af7651916cd43dd8448eb211c80319c", store);

        assertThat(tree.trace()).isEmpty();
        assertThat(tree.trees()).isEmpty();
        assertThat(tree.spans()).isEmpty();
    }
}
