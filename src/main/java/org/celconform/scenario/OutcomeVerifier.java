package org.celconform.scenario;

import com.google.protobuf.NullValue;
import org.celconform.errors.ErrorCategory;
import org.celconform.errors.ErrorClassifier;
import org.celconform.errors.ErrorMatchPolicy;
import org.celconform.fixture.ExpectedOutcome;
import org.celconform.translate.ValueTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares a scenario's outcome with the fixture's expectation.
 * <p>
 * Values are compared by runtime equality: doubles compare numerically, so {@code -0.0}
 * equals {@code 0.0} and NaN equals nothing, also inside lists and maps. Errors are compared by category under the
 * configured {@link ErrorMatchPolicy}; with {@link ErrorMatchPolicy#ANY} a category mismatch
 * is logged at WARN and the scenario passes, as long as some error was captured.
 */
public final class OutcomeVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(OutcomeVerifier.class);

    private final ValueTranslator translator;
    private final ErrorClassifier classifier;
    private final ErrorMatchPolicy policy;

    public OutcomeVerifier(ValueTranslator translator, ErrorClassifier classifier, ErrorMatchPolicy policy) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param context  The evaluated scenario.
     * @param expected The fixture's expectation.
     * @throws OutcomeMismatchError if the outcome does not satisfy the expectation.
     * @throws IllegalStateException if the scenario was not evaluated.
     */
    public void verify(ScenarioContext context, ExpectedOutcome expected) {
        Outcome outcome = context.getOutcome()
                .orElseThrow(() -> new IllegalStateException("Scenario was not evaluated: " + context));

        if (expected instanceof ExpectedOutcome.Value value) {
            verifyValue(context, outcome, translator.translate(value.value()));
        } else if (expected instanceof ExpectedOutcome.ExplicitNull) {
            verifyValue(context, outcome, NullValue.NULL_VALUE);
        } else if (expected instanceof ExpectedOutcome.Error error) {
            verifyError(context, outcome, error.text());
        } else if (expected instanceof ExpectedOutcome.NoError) {
            if (outcome instanceof Outcome.Failure failure) {
                throw new OutcomeMismatchError(String.format("Expected no error but got %s (%s) in %s",
                        failure.message(), failure.category(), context), ErrorCategory.NO_ERROR, failure);
            }
        } else {
            throw new IllegalArgumentException("Unsupported expectation: " + expected);
        }
    }

    private void verifyValue(ScenarioContext context, Outcome outcome, Object expected) {
        if (outcome instanceof Outcome.Failure failure) {
            throw new OutcomeMismatchError(String.format("Error '%s' (%s); no result in %s",
                    failure.message(), failure.category(), context), expected, failure);
        }
        Object actual = ((Outcome.Result) outcome).value();
        if (!runtimeEquals(actual, expected)) {
            throw new OutcomeMismatchError(String.format("%s != %s in %s", actual, expected, context), expected, actual);
        }
    }

    private void verifyError(ScenarioContext context, Outcome outcome, String expectedText) {
        ErrorCategory expected = classifier.classify(expectedText);
        ErrorCategory actual = outcome instanceof Outcome.Failure failure ? failure.category() : ErrorCategory.NO_ERROR;

        if (policy == ErrorMatchPolicy.EXACT && expected != actual) {
            throw new OutcomeMismatchError(String.format("%s != %s in %s", expected, actual, context), expected, actual);
        }
        if (expected != actual) {
            LOG.warn("Error category mismatch: expected {} ('{}') but was {} in {}", expected, expectedText, actual, context);
        }
        if (!(outcome instanceof Outcome.Failure)) {
            throw new OutcomeMismatchError(String.format("Expected error '%s' but no error occurred in %s",
                    expectedText, context), expected, outcome);
        }
    }

    static boolean runtimeEquals(Object actual, Object expected) {
        if (actual instanceof Double a && expected instanceof Double e) {
            return a.doubleValue() == e.doubleValue();
        }
        if (actual instanceof List<?> a && expected instanceof List<?> e) {
            if (a.size() != e.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!runtimeEquals(a.get(i), e.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (actual instanceof Map<?, ?> a && expected instanceof Map<?, ?> e) {
            if (a.size() != e.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : e.entrySet()) {
                if (!a.containsKey(entry.getKey()) || !runtimeEquals(a.get(entry.getKey()), entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(actual, expected);
    }
}
