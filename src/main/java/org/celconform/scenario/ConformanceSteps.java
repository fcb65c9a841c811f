package org.celconform.scenario;

import org.celconform.config.ConformanceSettings;
import org.celconform.errors.ErrorClassifier;
import org.celconform.eval.EvaluationOrchestrator;
import org.celconform.eval.spi.IExpressionEvaluator;
import org.celconform.eval.spi.ISyntheticTypeProvider;
import org.celconform.fixture.ExpectedOutcome;
import org.celconform.fixture.TypeBinding;
import org.celconform.fixture.VariableBinding;
import org.celconform.text.EscapeNormalizer;
import org.celconform.translate.TypeEnvironmentBuilder;
import org.celconform.translate.ValueTranslator;

import java.util.List;
import java.util.Objects;

/**
 * The step vocabulary of the conformance fixtures, applied to one scenario at a time.
 * <p>
 * A scenario starts with {@link #newScenario()}, collects its givens (check flag, type
 * environment, bindings, container), evaluates its expression once and then checks the
 * outcome. Instances are not thread-safe; parallel runners use one instance per scenario.
 */
public final class ConformanceSteps {

    private final ValueTranslator translator;
    private final EvaluationOrchestrator orchestrator;
    private final OutcomeVerifier verifier;
    private ScenarioContext context = new ScenarioContext();

    public ConformanceSteps(ValueTranslator translator, EvaluationOrchestrator orchestrator, OutcomeVerifier verifier) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
    }

    /**
     * Wires the steps for an evaluator from the given settings.
     *
     * @param evaluator      The evaluator under test.
     * @param settings       The error match policy and alias table.
     * @param syntheticTypes Stand-ins for container-scoped test message types.
     * @return The steps.
     */
    public static ConformanceSteps create(IExpressionEvaluator evaluator, ConformanceSettings settings,
                                          ISyntheticTypeProvider syntheticTypes) {
        ValueTranslator translator = new ValueTranslator();
        ErrorClassifier classifier = settings.newClassifier();
        EvaluationOrchestrator orchestrator =
                new EvaluationOrchestrator(evaluator, new TypeEnvironmentBuilder(), classifier, syntheticTypes);
        return new ConformanceSteps(translator, orchestrator,
                new OutcomeVerifier(translator, classifier, settings.errorMatch()));
    }

    /**
     * Discards the current scenario and starts a fresh one.
     *
     * @return The new scenario's context.
     */
    public ScenarioContext newScenario() {
        context = new ScenarioContext();
        return context;
    }

    public ScenarioContext context() {
        return context;
    }

    public void disableCheck(boolean disabled) {
        context.setCheckDisabled(disabled);
    }

    public void typeEnv(TypeBinding binding) {
        context.addTypeBinding(binding);
    }

    /**
     * Translates and adds variable bindings.
     * @throws org.celconform.translate.TranslationException if a binding's value cannot be translated.
     */
    public void bindings(List<VariableBinding> bindings) {
        context.putBindings(translator.translateAll(bindings));
    }

    public void container(String container) {
        context.setContainer(container);
    }

    /**
     * Evaluates an expression quoted with {@code "} in the fixture.
     */
    public Outcome evaluateDoubleQuoted(String expression) {
        return evaluate(EscapeNormalizer.normalize(expression, '"'));
    }

    /**
     * Evaluates an expression quoted with {@code '} in the fixture.
     */
    public Outcome evaluateSingleQuoted(String expression) {
        return evaluate(EscapeNormalizer.normalize(expression, '\''));
    }

    private Outcome evaluate(String expression) {
        context.setExpression(expression);
        return orchestrator.evaluate(context);
    }

    /**
     * Checks the outcome against an expected value, an explicit null or no error.
     */
    public void valueIs(ExpectedOutcome expected) {
        verifier.verify(context, expected);
    }

    public void evalErrorIs(String text) {
        verifier.verify(context, ExpectedOutcome.error(text));
    }

    public void evalErrorIsNone() {
        verifier.verify(context, ExpectedOutcome.noError());
    }
}
