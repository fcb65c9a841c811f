package org.celconform.fixture;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The scalar literal kinds a fixture can carry, keyed by their field name in the
 * conformance {@code Value} message.
 */
public enum ValueKind {
    /** A signed 64-bit integer. */
    INT64("int64_value"),
    /** An unsigned 64-bit integer. */
    UINT64("uint64_value"),
    /** A double, including the {@code inf} and {@code -inf} sentinels. */
    DOUBLE("double_value"),
    /** A unicode string. */
    STRING("string_value"),
    /** A byte sequence. */
    BYTES("bytes_value"),
    /** A boolean. */
    BOOL("bool_value"),
    /** The null value; the payload is ignored. */
    NULL("null_value"),
    /** A reference to a type by name. Older fixtures spell the field {@code type}. */
    TYPE("type_value", "type"),
    /** An enum literal; CEL treats enum values as signed integers. */
    ENUM("enum_value");

    private static final Map<String, ValueKind> BY_FIELD_NAME = new HashMap<>();

    static {
        for (ValueKind kind : values()) {
            for (String name : kind.fieldNames) {
                BY_FIELD_NAME.put(name, kind);
            }
        }
    }

    private final String[] fieldNames;

    ValueKind(String... fieldNames) {
        this.fieldNames = fieldNames;
    }

    /**
     * @return The canonical fixture field name of this kind.
     */
    public String fieldName() {
        return fieldNames[0];
    }

    /**
     * Looks up a kind by its fixture field name.
     *
     * @param fieldName The field name, e.g. {@code int64_value}.
     * @return The kind, or empty if the name is not a known scalar kind.
     */
    public static Optional<ValueKind> fromFieldName(String fieldName) {
        return Optional.ofNullable(fieldName == null ? null : BY_FIELD_NAME.get(fieldName));
    }
}
