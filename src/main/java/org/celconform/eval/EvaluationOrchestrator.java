package org.celconform.eval;

import org.celconform.errors.ErrorCategory;
import org.celconform.errors.ErrorClassifier;
import org.celconform.eval.spi.EvaluationException;
import org.celconform.eval.spi.ICompiledExpression;
import org.celconform.eval.spi.IExpressionEvaluator;
import org.celconform.eval.spi.ISyntheticTypeProvider;
import org.celconform.fixture.TypeBinding;
import org.celconform.scenario.Outcome;
import org.celconform.scenario.ScenarioContext;
import org.celconform.translate.TypeAnnotation;
import org.celconform.translate.TypeEnvironmentBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one evaluation attempt of a scenario's expression and records its outcome.
 * <p>
 * Only errors raised through the evaluator's error channel ({@link EvaluationException}) become
 * outcomes. Anything else, e.g. a translation failure, propagates: it points at a defect in a
 * fixture or in this engine, not at the behavior under test.
 */
public final class EvaluationOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    private final IExpressionEvaluator evaluator;
    private final TypeEnvironmentBuilder environmentBuilder;
    private final ErrorClassifier classifier;
    private final ISyntheticTypeProvider syntheticTypes;

    public EvaluationOrchestrator(IExpressionEvaluator evaluator, TypeEnvironmentBuilder environmentBuilder,
                                  ErrorClassifier classifier, ISyntheticTypeProvider syntheticTypes) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.environmentBuilder = Objects.requireNonNull(environmentBuilder, "environmentBuilder");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.syntheticTypes = Objects.requireNonNull(syntheticTypes, "syntheticTypes");
    }

    /**
     * Evaluates the context's expression and stores the outcome in the context.
     *
     * @param context The scenario; its expression must be set.
     * @return The stored outcome.
     * @throws IllegalStateException if the context has no expression.
     */
    public Outcome evaluate(ScenarioContext context) {
        String expression = context.getExpression()
                .orElseThrow(() -> new IllegalStateException("No expression to evaluate in " + context));
        Outcome outcome = evaluate(expression, context.getTypeBindings(), context.getActivation(),
                context.getContainer().orElse(null), !context.isCheckDisabled());
        context.setOutcome(outcome);
        return outcome;
    }

    /**
     * Compiles and evaluates an expression.
     *
     * @param expression   The normalized CEL source.
     * @param typeBindings The type environment, in declaration order.
     * @param activation   The translated variable bindings.
     * @param container    The container, or {@code null}.
     * @param checkEnabled Whether the expression is type-checked.
     * @return Exactly one of a result or a classified failure.
     */
    public Outcome evaluate(String expression, List<TypeBinding> typeBindings, Map<String, Object> activation,
                            String container, boolean checkEnabled) {
        List<TypeBinding> environment = new ArrayList<>(typeBindings);
        if (container != null && !container.isBlank()) {
            environment.addAll(syntheticTypes.bindingsFor(container));
        }
        Map<String, TypeAnnotation> annotations = environmentBuilder.build(environment);

        LOG.debug("Evaluating '{}' in container '{}' with activation={}", expression, container, activation);
        try {
            ICompiledExpression program = evaluator.compile(expression, annotations, container, checkEnabled);
            Object result = program.evaluate(activation);
            if (result == null) {
                throw new IllegalStateException("Evaluator returned neither a value nor an error for '" + expression + "'");
            }
            return new Outcome.Result(result);
        } catch (EvaluationException e) {
            String message = e.getMessage() == null ? "" : e.getMessage();
            // An error without a message still is an error.
            ErrorCategory category = message.isBlank() ? ErrorCategory.UNCLASSIFIED : classifier.classify(message);
            Outcome.Failure failure = new Outcome.Failure(message, category);
            LOG.debug("Evaluation of '{}' failed: {} ({})", expression, failure.message(), failure.category());
            return failure;
        }
    }
}
