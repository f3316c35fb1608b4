package dev.evalkit.evaluator;

/**
 * Narrow contract over the evaluator subsystem. How code is sandboxed or how prompts reach a model
 * is up to the implementation.
 */
public interface EvaluatorRegistry {
    /**
     * @throws RuntimeException when the evaluator does not exist
     */
    EvaluatorKind getEvaluatorKind(long evaluatorId);

    /**
     * Runs one evaluator. Evaluator-local failures should be reported through {@link
     * EvaluatorOutput#evaluatorRunError()}; a thrown exception is also tolerated by the pipeline.
     */
    EvaluatorOutput invoke(long evaluatorId, EvaluatorInput input);
}
