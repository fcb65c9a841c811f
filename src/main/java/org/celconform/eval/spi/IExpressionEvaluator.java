package org.celconform.eval.spi;

import org.celconform.translate.TypeAnnotation;

import java.util.Map;

/**
 * The boundary to an external CEL implementation. The conformance engine never looks inside
 * the evaluator; it only sees compiled programs, their results and their errors.
 */
public interface IExpressionEvaluator {

    /**
     * Compiles an expression against a type environment.
     *
     * @param expression   The CEL source text.
     * @param annotations  The declared names and their annotations.
     * @param container    The container (namespace) names are resolved in, or {@code null} for none.
     * @param checkEnabled Whether the expression is type-checked before evaluation.
     * @return The compiled program.
     * @throws EvaluationException if the expression does not parse or check.
     */
    ICompiledExpression compile(String expression, Map<String, TypeAnnotation> annotations, String container,
                                boolean checkEnabled) throws EvaluationException;
}
