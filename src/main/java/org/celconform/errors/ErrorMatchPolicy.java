package org.celconform.errors;

import java.util.Locale;

/**
 * How strictly an expected error is compared with the captured one.
 */
public enum ErrorMatchPolicy {
    /**
     * Any captured error satisfies an expected error. A category mismatch is only reported.
     * Implementations disagree on which of several sub-expression errors surfaces first,
     * e.g. {@code true && 1/0 != 0}.
     */
    ANY,
    /** The captured error must fall into the expected category. */
    EXACT;

    /**
     * @param text {@code any} or {@code exact}, in any case.
     * @return The policy.
     * @throws IllegalArgumentException if the text names no policy.
     */
    public static ErrorMatchPolicy parse(String text) {
        String normalized = text == null ? "" : text.trim().toUpperCase(Locale.ROOT);
        for (ErrorMatchPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown error match policy '" + text + "', expected 'any' or 'exact'");
    }
}
