package org.celconform.eval.spi;

import java.util.Map;

/**
 * A compiled expression, ready to be evaluated against an activation.
 */
public interface ICompiledExpression {

    /**
     * @param activation Variable names and their runtime values.
     * @return The result; never {@code null}.
     * @throws EvaluationException if evaluation fails.
     */
    Object evaluate(Map<String, Object> activation) throws EvaluationException;
}
