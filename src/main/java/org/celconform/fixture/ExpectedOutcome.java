package org.celconform.fixture;

import java.util.Objects;

/**
 * What a fixture expects an evaluation to produce. An expected null is stated explicitly and
 * never inferred from a missing value.
 */
public sealed interface ExpectedOutcome permits ExpectedOutcome.Value, ExpectedOutcome.ExplicitNull, ExpectedOutcome.Error, ExpectedOutcome.NoError {

    /** The evaluation yields a value equal to the translated literal. */
    record Value(FixtureValue value) implements ExpectedOutcome {
        public Value {
            Objects.requireNonNull(value, "value");
        }
    }

    /** The evaluation yields null. */
    record ExplicitNull() implements ExpectedOutcome {}

    /** The evaluation fails; the text is the fixture's description of the error. */
    record Error(String text) implements ExpectedOutcome {
        public Error {
            Objects.requireNonNull(text, "text");
        }
    }

    /** The evaluation does not fail; its value is not checked. */
    record NoError() implements ExpectedOutcome {}

    static ExpectedOutcome value(FixtureValue value) {
        return new Value(value);
    }

    static ExpectedOutcome explicitNull() {
        return new ExplicitNull();
    }

    static ExpectedOutcome error(String text) {
        return new Error(text);
    }

    static ExpectedOutcome noError() {
        return new NoError();
    }
}
