package org.celconform.scenario;

import org.celconform.errors.ErrorCategory;

import java.util.Objects;

/**
 * The observed result of one evaluation attempt: exactly one of a value or a classified error.
 */
public sealed interface Outcome permits Outcome.Result, Outcome.Failure {

    /**
     * The expression evaluated to a value.
     * @param value The runtime value; never {@code null} (CEL null is a runtime value of its own).
     */
    record Result(Object value) implements Outcome {
        public Result {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * The evaluator raised an error. Any partial result is discarded.
     * @param message  The evaluator's message.
     * @param category The message's classification.
     */
    record Failure(String message, ErrorCategory category) implements Outcome {
        public Failure {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(category, "category");
        }
    }
}
