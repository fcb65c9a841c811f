package org.celconform.eval.spi;

/**
 * The error channel of an expression evaluator: raised when an expression fails to compile
 * or evaluate. Its message is what fixtures classify and compare.
 */
public class EvaluationException extends Exception {

    /**
     * @param message The evaluator's error message.
     */
    public EvaluationException(String message) {
        super(message, null);
    }

    /**
     * @param message The evaluator's error message.
     * @param cause   The evaluator-specific exception.
     */
    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
