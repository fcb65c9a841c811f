package org.celconform.scenario;

/**
 * Signals that a scenario's outcome does not satisfy the fixture's expectation.
 * The message names both the expectation and what was observed.
 */
public class OutcomeMismatchError extends AssertionError {

    private final transient Object expected;
    private final transient Object actual;

    public OutcomeMismatchError(String message, Object expected, Object actual) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    public Object getExpected() {
        return expected;
    }

    public Object getActual() {
        return actual;
    }
}
