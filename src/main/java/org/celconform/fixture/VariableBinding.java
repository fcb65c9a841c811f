package org.celconform.fixture;

import java.util.Objects;

/**
 * One entry of a fixture's activation: a variable name and its literal value.
 */
public record VariableBinding(String name, FixtureValue value) {
    public VariableBinding {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
