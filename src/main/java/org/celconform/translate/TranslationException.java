package org.celconform.translate;

/**
 * Thrown when a fixture literal cannot be turned into a runtime value or type.
 * <p>
 * A translation failure is a defect in the fixture or in the translator. It is never an
 * expected outcome of an evaluation and is not caught by the evaluation pipeline.
 */
public class TranslationException extends RuntimeException {

    private final TranslationErrorCode code;

    /**
     * @param code    The error code.
     * @param message The detail message.
     */
    public TranslationException(TranslationErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * @param code    The error code.
     * @param message The detail message.
     * @param cause   The underlying parse failure.
     */
    public TranslationException(TranslationErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public TranslationErrorCode getCode() {
        return code;
    }
}
