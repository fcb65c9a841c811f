package org.celconform.scenario;

import org.celconform.fixture.TypeBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The mutable state of one conformance scenario. A context is allocated when a scenario
 * starts and dropped when it ends; it is never shared between scenarios.
 */
public final class ScenarioContext {

    private String expression;
    private final List<TypeBinding> typeBindings = new ArrayList<>();
    private final Map<String, Object> activation = new LinkedHashMap<>();
    private String container;
    private boolean checkDisabled;
    private Outcome outcome;

    public Optional<String> getExpression() {
        return Optional.ofNullable(expression);
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    /**
     * @return The type declarations, in the order they were added.
     */
    public List<TypeBinding> getTypeBindings() {
        return Collections.unmodifiableList(typeBindings);
    }

    public void addTypeBinding(TypeBinding binding) {
        typeBindings.add(binding);
    }

    /**
     * @return The translated variable bindings.
     */
    public Map<String, Object> getActivation() {
        return Collections.unmodifiableMap(activation);
    }

    /**
     * Adds translated bindings; a name bound again keeps the later value.
     */
    public void putBindings(Map<String, Object> bindings) {
        activation.putAll(bindings);
    }

    /**
     * @return The container, if one was set and is not blank.
     */
    public Optional<String> getContainer() {
        return Optional.ofNullable(container).filter(c -> !c.isBlank());
    }

    public void setContainer(String container) {
        this.container = container;
    }

    public boolean isCheckDisabled() {
        return checkDisabled;
    }

    public void setCheckDisabled(boolean checkDisabled) {
        this.checkDisabled = checkDisabled;
    }

    /**
     * @return The outcome of the evaluation, or empty before the expression was evaluated.
     */
    public Optional<Outcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    public void setOutcome(Outcome outcome) {
        this.outcome = outcome;
    }

    @Override
    public String toString() {
        return String.format("ScenarioContext{expression=%s, container=%s, checkDisabled=%s, typeBindings=%s, activation=%s, outcome=%s}",
                expression, container, checkDisabled, typeBindings, activation, outcome);
    }
}
