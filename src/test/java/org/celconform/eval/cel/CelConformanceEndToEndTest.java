package org.celconform.eval.cel;

import com.google.protobuf.ByteString;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.celconform.config.ConformanceSettings;
import org.celconform.errors.ErrorCategory;
import org.celconform.eval.spi.ISyntheticTypeProvider;
import org.celconform.fixture.ExpectedOutcome;
import org.celconform.fixture.FixtureValue;
import org.celconform.fixture.TypeBinding;
import org.celconform.fixture.ValueKind;
import org.celconform.fixture.VariableBinding;
import org.celconform.junit.extensions.logging.ExpectLog;
import org.celconform.junit.extensions.logging.LogLevel;
import org.celconform.junit.extensions.logging.LogWatchExtension;
import org.celconform.scenario.ConformanceSteps;
import org.celconform.scenario.Outcome;
import org.celconform.scenario.OutcomeMismatchError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives whole scenarios through the step vocabulary against the CEL Java runtime.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CelConformanceEndToEndTest {

    private static ConformanceSteps steps(String errorMatch) {
        ConformanceSettings settings = ConformanceSettings.from(ConfigFactory.parseResources("reference.conf")
                .withValue("celconform.error-match", ConfigValueFactory.fromAnyRef(errorMatch))
                .resolve());
        ConformanceSteps steps = ConformanceSteps.create(new CelExpressionEvaluator(), settings, ISyntheticTypeProvider.NONE);
        steps.newScenario();
        return steps;
    }

    @Test
    @DisplayName("Division by zero is classified and matches under both policies")
    void divisionByZero() {
        for (String policy : List.of("any", "exact")) {
            // Arrange
            ConformanceSteps steps = steps(policy);

            // Act
            Outcome outcome = steps.evaluateDoubleQuoted("2 / 0 > 4 ? 'baz' : 'quux'");

            // Assert
            assertThat(outcome).isInstanceOfSatisfying(Outcome.Failure.class,
                    failure -> assertThat(failure.category()).isEqualTo(ErrorCategory.DIVIDE_BY_ZERO));
            assertThatCode(() -> steps.evalErrorIs("division by zero")).doesNotThrowAnyException();
        }
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*expected no_such_overload.*but was divide_by_zero.*")
    void mismatchedErrorPassesUnderAny() {
        ConformanceSteps steps = steps("any");
        steps.evaluateDoubleQuoted("true && 1/0 != 0");

        assertThatCode(() -> steps.evalErrorIs("no matching overload")).doesNotThrowAnyException();
    }

    @Test
    void mismatchedErrorFailsUnderExact() {
        ConformanceSteps steps = steps("exact");
        steps.evaluateDoubleQuoted("true && 1/0 != 0");

        assertThatThrownBy(() -> steps.evalErrorIs("no matching overload"))
                .isInstanceOf(OutcomeMismatchError.class);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*expected modulus_by_zero.*but was divide_by_zero.*")
    @DisplayName("Modulus by zero is reported as division by zero")
    void modulusByZero() {
        ConformanceSteps steps = steps("any");
        Outcome outcome = steps.evaluateDoubleQuoted("5 % 0");

        assertThat(outcome).isInstanceOfSatisfying(Outcome.Failure.class,
                failure -> assertThat(failure.category()).isEqualTo(ErrorCategory.DIVIDE_BY_ZERO));
        assertThatCode(() -> steps.evalErrorIs("modulus by zero")).doesNotThrowAnyException();
    }

    @Test
    void modulusByZeroFailsUnderExact() {
        ConformanceSteps steps = steps("exact");
        steps.evaluateDoubleQuoted("5 % 0");

        assertThatThrownBy(() -> steps.evalErrorIs("modulus by zero")).isInstanceOf(OutcomeMismatchError.class);
    }

    @Test
    @DisplayName("Type references equal the types the runtime yields")
    void typeReferences() {
        ConformanceSteps steps = steps("exact");

        steps.evaluateDoubleQuoted("type(1)");
        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.TYPE, "int"))))
                .doesNotThrowAnyException();

        steps.newScenario();
        steps.evaluateDoubleQuoted("int");
        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.TYPE, "int"))))
                .doesNotThrowAnyException();

        steps.newScenario();
        steps.evaluateDoubleQuoted("type('a')");
        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.TYPE, "string"))))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.TYPE, "int"))))
                .isInstanceOf(OutcomeMismatchError.class);

        steps.newScenario();
        steps.evaluateDoubleQuoted("type(null)");
        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.TYPE, "null_type"))))
                .doesNotThrowAnyException();

        steps.newScenario();
        steps.evaluateDoubleQuoted("type(int)");
        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.TYPE, "type"))))
                .doesNotThrowAnyException();
    }

    @Test
    void negativeZeroEqualsZero() {
        ConformanceSteps steps = steps("exact");
        steps.evaluateDoubleQuoted("-0.0");

        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.DOUBLE, "0.0"))))
                .doesNotThrowAnyException();
    }

    @Test
    void integerOverflow() {
        ConformanceSteps steps = steps("exact");
        Outcome outcome = steps.evaluateDoubleQuoted("9223372036854775807 + 1");

        assertThat(outcome).isInstanceOf(Outcome.Failure.class);
        assertThatCode(() -> steps.evalErrorIs("return error for overflow")).doesNotThrowAnyException();
    }

    @Test
    void listLiteralEqualsExpectedList() {
        ConformanceSteps steps = steps("exact");
        steps.evaluateDoubleQuoted("[1, 2]");

        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.list(
                FixtureValue.of(ValueKind.INT64, 1), FixtureValue.of(ValueKind.INT64, 2)))))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.list(
                FixtureValue.of(ValueKind.INT64, 2), FixtureValue.of(ValueKind.INT64, 1)))))
                .isInstanceOf(OutcomeMismatchError.class);
    }

    @Test
    void mapLiteralEqualsExpectedMap() {
        ConformanceSteps steps = steps("exact");
        steps.evaluateDoubleQuoted("{'a': 1, 'b': 2}");

        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.map(
                FixtureValue.of(ValueKind.STRING, "a"), FixtureValue.of(ValueKind.INT64, 1),
                FixtureValue.of(ValueKind.STRING, "b"), FixtureValue.of(ValueKind.INT64, 2)))))
                .doesNotThrowAnyException();
    }

    @Test
    void declaredVariableIsBound() {
        ConformanceSteps steps = steps("exact");
        steps.typeEnv(TypeBinding.Declared.primitive("x", "INT64"));
        steps.bindings(List.of(new VariableBinding("x", FixtureValue.of(ValueKind.INT64, "41"))));
        steps.evaluateDoubleQuoted("x + 1");

        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.INT64, 42))))
                .doesNotThrowAnyException();
    }

    @Test
    void mapTypedVariable() {
        ConformanceSteps steps = steps("exact");
        steps.typeEnv(TypeBinding.Declared.mapOf("m", "STRING", "INT64"));
        steps.bindings(List.of(new VariableBinding("m", FixtureValue.map(
                FixtureValue.of(ValueKind.STRING, "k"), FixtureValue.of(ValueKind.INT64, 7)))));
        steps.evaluateDoubleQuoted("m['k'] * 2");

        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.INT64, 14))))
                .doesNotThrowAnyException();
    }

    @Test
    void durationBindingEqualsDurationLiteral() {
        ConformanceSteps steps = steps("exact");
        steps.typeEnv(TypeBinding.Declared.primitive("d", "google.protobuf.Duration"));
        steps.bindings(List.of(new VariableBinding("d", new FixtureValue.ObjectValue(
                "type.googleapis.com/google.protobuf.Duration",
                List.of(new FixtureValue.ObjectField("seconds", FixtureValue.of(ValueKind.INT64, 5)),
                        new FixtureValue.ObjectField("nanos", FixtureValue.of(ValueKind.INT64, 0)))))));
        steps.evaluateDoubleQuoted("d == duration('5s')");

        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.BOOL, true))))
                .doesNotThrowAnyException();
    }

    @Test
    void uncheckedExpressionStillEvaluates() {
        ConformanceSteps steps = steps("exact");
        steps.disableCheck(true);
        steps.bindings(List.of(new VariableBinding("x", FixtureValue.of(ValueKind.INT64, 1))));
        steps.evaluateDoubleQuoted("x + 1");

        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.INT64, 2))))
                .doesNotThrowAnyException();
    }

    @Test
    void undeclaredReferenceIsAnError() {
        ConformanceSteps steps = steps("exact");
        Outcome outcome = steps.evaluateDoubleQuoted("y + 1");

        assertThat(outcome).isInstanceOfSatisfying(Outcome.Failure.class,
                failure -> assertThat(failure.category()).isEqualTo(ErrorCategory.UNDECLARED_REFERENCE));
        assertThatCode(() -> steps.evalErrorIs("undeclared reference")).doesNotThrowAnyException();
    }

    @Test
    void successfulEvaluationHasNoError() {
        ConformanceSteps steps = steps("exact");
        steps.evaluateDoubleQuoted("1 + 1 == 2");

        assertThatCode(steps::evalErrorIsNone).doesNotThrowAnyException();
        assertThatThrownBy(() -> steps.evalErrorIs("division by zero")).isInstanceOf(OutcomeMismatchError.class);
    }

    @Test
    @DisplayName("Escaped quotes of the fixture's quoting style are unescaped before evaluation")
    void escapedQuotesAreNormalized() {
        ConformanceSteps steps = steps("exact");
        steps.evaluateSingleQuoted("\"it\\'s\"");

        assertThatCode(() -> steps.valueIs(ExpectedOutcome.value(FixtureValue.of(ValueKind.STRING, "it's"))))
                .doesNotThrowAnyException();
    }

    @Test
    void bytesLiteral() {
        ConformanceSteps steps = steps("exact");
        Outcome outcome = steps.evaluateDoubleQuoted("b'abc'");

        assertThat(outcome).isEqualTo(new Outcome.Result(ByteString.copyFromUtf8("abc")));
    }

    @Test
    void newScenarioDropsPreviousState() {
        ConformanceSteps steps = steps("exact");
        steps.typeEnv(TypeBinding.Declared.primitive("x", "INT64"));
        steps.evaluateDoubleQuoted("x");

        steps.newScenario();

        assertThat(steps.context().getTypeBindings()).isEmpty();
        assertThat(steps.context().getOutcome()).isEmpty();
    }
}
