package org.celconform.errors;

import java.util.Map;
import java.util.Objects;

/**
 * Maps free-text error messages to an {@link ErrorCategory}.
 * <p>
 * Classification order:
 * <ol>
 *   <li>no message: {@link ErrorCategory#NO_ERROR}</li>
 *   <li>a declared category identifier, e.g. {@code divide_by_zero}</li>
 *   <li>an alias from the alias table, e.g. {@code division by zero}</li>
 *   <li>a message starting with {@value #UNDECLARED_REFERENCE_PREFIX}, whatever symbol and
 *       container follow</li>
 *   <li>otherwise {@link ErrorCategory#UNCLASSIFIED}</li>
 * </ol>
 * The alias table is fixed at construction; instances are immutable and thread-safe.
 */
public final class ErrorClassifier {

    static final String UNDECLARED_REFERENCE_PREFIX = "undeclared reference";

    private final Map<String, ErrorCategory> aliases;

    /**
     * @param aliases Known phrasings, mapped to the category they stand for.
     */
    public ErrorClassifier(Map<String, ErrorCategory> aliases) {
        this.aliases = Map.copyOf(Objects.requireNonNull(aliases, "aliases"));
    }

    /**
     * @param message The error message, or {@code null} if no error occurred.
     * @return The category; never {@code null}.
     */
    public ErrorCategory classify(String message) {
        if (message == null || message.isBlank()) {
            return ErrorCategory.NO_ERROR;
        }
        return ErrorCategory.fromIdentifier(message)
                .orElseGet(() -> classifyPhrasing(message));
    }

    private ErrorCategory classifyPhrasing(String message) {
        ErrorCategory aliased = aliases.get(message);
        if (aliased != null) {
            return aliased;
        }
        if (message.startsWith(UNDECLARED_REFERENCE_PREFIX)) {
            return ErrorCategory.UNDECLARED_REFERENCE;
        }
        return ErrorCategory.UNCLASSIFIED;
    }

    public Map<String, ErrorCategory> getAliases() {
        return aliases;
    }
}
