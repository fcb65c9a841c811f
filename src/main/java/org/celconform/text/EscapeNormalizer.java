package org.celconform.text;

import java.util.Objects;

/**
 * Reconciles the escaping of quoted expression text in fixtures with CEL source syntax.
 * <p>
 * The fixture format escapes the delimiter of the quoted expression (e.g. {@code \"} inside a
 * double-quoted step) although CEL does not need that escape. Every other escape sequence is
 * already valid CEL and is left alone.
 */
public final class EscapeNormalizer {

    private EscapeNormalizer() {}

    /**
     * Replaces every escaped {@code quote} in {@code text} with the bare quote character.
     * <p>
     * The text is scanned as a sequence of units where a backslash and the character after it
     * form one unit. A unit of backslash plus {@code quote} becomes {@code quote}; every other
     * unit, including other backslash sequences and a trailing lone backslash, is copied as is.
     * This makes the operation idempotent.
     *
     * @param text  The quoted expression body, without its enclosing quotes.
     * @param quote The enclosing quote character, either {@code '} or {@code "}.
     * @return The normalized expression text.
     * @throws IllegalArgumentException if {@code quote} is not a quote character.
     */
    public static String normalize(String text, char quote) {
        Objects.requireNonNull(text, "text");
        if (quote != '\'' && quote != '"') {
            throw new IllegalArgumentException("quote must be ' or \", was: " + quote);
        }
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == quote) {
                    out.append(quote);
                } else {
                    out.append(c).append(next);
                }
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
