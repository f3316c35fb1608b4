package dev.evalkit.evaluator;

/** How an evaluator consumes its input. */
public enum EvaluatorKind {
    /** Sandboxed code; sees dataset fields and target output fields separately. */
    CODE,
    /** LLM prompt; sees one merged field map. */
    PROMPT
}
