package dev.evalkit.target;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import dev.evalkit.dataset.Content;
import dev.evalkit.dataset.DatasetItem;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TargetAdapterTest {
    private static final DatasetItem ITEM = new DatasetItem(1, Map.of());

    @Mock TargetInvoker invoker;

    @Test
    void noneTargetUsesItemOutputByPriority() {
        var adapter = new TargetAdapter(invoker);
        var fields = new LinkedHashMap<String, Content>();
        fields.put("input", Content.text("q"));
        fields.put("reference_output", Content.text("ref"));
        fields.put("answer", Content.text("ans"));

        var result = adapter.invoke(TargetConfig.none(), fields, ITEM);

        assertThat(result.failed()).isFalse();
        assertThat(result.actualOutput()).isEqualTo("ans");
        verifyNoInteractions(invoker);
    }

    @Test
    void noneTargetFallsBackToRawItemThenFirstField() {
        var adapter = new TargetAdapter(invoker);
        var raw = new DatasetItem(2, Map.of("reference_output", "from raw"));

        assertThat(adapter.invoke(TargetConfig.none(), Map.of("input", Content.text("q")), raw)
                        .actualOutput())
                .isEqualTo("from raw");
        assertThat(adapter.invoke(TargetConfig.none(), Map.of("input", Content.text("q")), ITEM)
                        .actualOutput())
                .isEqualTo("q");
        assertThat(adapter.invoke(TargetConfig.none(), Map.of(), ITEM).actualOutput()).isEmpty();
    }

    @Test
    void configuredTargetReceivesFieldsAsText() {
        when(invoker.invoke(any(), anyMap())).thenReturn("target says hi");
        var adapter = new TargetAdapter(invoker);
        var config = TargetConfig.Api.post("http://localhost/x");

        var result = adapter.invoke(config, Map.of("input", Content.text("hello")), ITEM);

        assertThat(result.actualOutput()).isEqualTo("target says hi");
        assertThat(result.targetFields()).containsOnlyKeys("actual_output");
        verify(invoker).invoke(config, Map.of("input", "hello"));
    }

    @Test
    void configuredTargetFailureIsReturnedNotThrown() {
        when(invoker.invoke(any(), anyMap()))
                .thenThrow(new TargetInvocationException("connection refused"));
        var adapter = new TargetAdapter(invoker);

        var result =
                adapter.invoke(
                        TargetConfig.Api.post("http://localhost/x"),
                        Map.of("input", Content.text("hello")),
                        ITEM);

        assertThat(result.failed()).isTrue();
        assertThat(result.error())
                .isEqualTo("Failed to call evaluation target: connection refused");
        assertThat(result.actualOutput())
                .isEqualTo(TargetResult.FAILURE_PREFIX + result.error());
    }

    @Test
    void routingRejectsUnregisteredKinds() {
        var routing = TargetInvoker.routing().register(TargetKind.API, invoker);

        assertThatThrownBy(() -> routing.invoke(new TargetConfig.Prompt(1L, "{{input}}"), Map.of()))
                .isInstanceOf(TargetInvocationException.class)
                .hasMessageContaining("prompt");
    }
}
