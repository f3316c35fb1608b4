package dev.evalkit.target;

import java.util.EnumMap;
import java.util.Map;

/** Calls an external system under test and returns its textual output. */
public interface TargetInvoker {

    /**
     * @param inputFields extracted dataset fields as text, keyed by field name
     * @throws RuntimeException on any failure; the caller records it rather than propagating
     */
    String invoke(TargetConfig config, Map<String, String> inputFields);

    static Routing routing() {
        return new Routing();
    }

    /** Dispatches to one invoker per target kind. */
    final class Routing implements TargetInvoker {
        private final Map<TargetKind, TargetInvoker> invokers = new EnumMap<>(TargetKind.class);

        private Routing() {}

        public Routing register(TargetKind kind, TargetInvoker invoker) {
            invokers.put(kind, invoker);
            return this;
        }

        @Override
        public String invoke(TargetConfig config, Map<String, String> inputFields) {
            var invoker = invokers.get(config.kind());
            if (invoker == null) {
                throw new TargetInvocationException(
                        "no invoker registered for target type " + config.kind().wireName());
            }
            return invoker.invoke(config, inputFields);
        }
    }
}
