package org.celconform.eval.spi;

import org.celconform.fixture.TypeBinding;

import java.util.List;

/**
 * Supplies pre-built stand-ins for the test message types some fixtures assume to exist in
 * their container, e.g. {@code <container>.TestAllTypes}.
 */
@FunctionalInterface
public interface ISyntheticTypeProvider {

    /** A provider that contributes nothing. */
    ISyntheticTypeProvider NONE = container -> List.of();

    /**
     * @param container The scenario's container; never blank.
     * @return The bindings to add to the scenario's type environment.
     */
    List<TypeBinding.Prebuilt> bindingsFor(String container);
}
