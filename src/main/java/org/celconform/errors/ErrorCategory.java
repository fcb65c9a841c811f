package org.celconform.errors;

import java.util.Optional;

/**
 * Coarse semantic buckets for evaluation errors. Independent CEL implementations word their
 * errors differently, so fixtures are compared by category rather than by message.
 * <p>
 * {@link #NO_ERROR} and {@link #UNCLASSIFIED} are outcomes of classification, not declared
 * categories: no fixture text names them directly.
 */
public enum ErrorCategory {
    DIVIDE_BY_ZERO("divide_by_zero"),
    MODULUS_BY_ZERO("modulus_by_zero"),
    NO_SUCH_OVERLOAD("no_such_overload"),
    INTEGER_OVERFLOW("integer_overflow"),
    UNDECLARED_REFERENCE("undeclared_reference"),
    UNKNOWN_VARIABLE("unknown_variable"),
    /** An error occurred but its message matched no category. */
    UNCLASSIFIED(null),
    /** No error occurred. */
    NO_ERROR(null);

    private final String identifier;

    ErrorCategory(String identifier) {
        this.identifier = identifier;
    }

    /**
     * @return The stable identifier of a declared category, or empty for the implicit outcomes.
     */
    public Optional<String> identifier() {
        return Optional.ofNullable(identifier);
    }

    /**
     * @param identifier A category identifier such as {@code divide_by_zero}.
     * @return The declared category with that identifier, or empty.
     */
    public static Optional<ErrorCategory> fromIdentifier(String identifier) {
        for (ErrorCategory category : values()) {
            if (category.identifier != null && category.identifier.equals(identifier)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return identifier != null ? identifier : name().toLowerCase();
    }
}
