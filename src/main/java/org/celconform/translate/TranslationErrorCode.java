package org.celconform.translate;

/**
 * Identifies why a fixture literal could not be translated. Tests assert on the code, not on
 * the message text.
 */
public enum TranslationErrorCode {
    /** A scalar carried a kind that is not one of the known value kinds. */
    UNKNOWN_VALUE_KIND,
    /** A type reference named a type that has no runtime counterpart. */
    UNKNOWN_TYPE_NAME,
    /** An object literal used a namespace no builder is registered for. */
    UNSUPPORTED_OBJECT_NAMESPACE,
    /** A payload did not have the shape its kind requires. */
    MALFORMED_PAYLOAD
}
