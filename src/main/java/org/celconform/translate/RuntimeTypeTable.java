package org.celconform.translate;

import dev.cel.common.types.CelType;
import dev.cel.common.types.ListType;
import dev.cel.common.types.MapType;
import dev.cel.common.types.SimpleType;
import dev.cel.common.types.TypeType;

import java.util.Map;
import java.util.Optional;

/**
 * Maps the type names used by fixtures to CEL runtime types. The CEL spelling of a name is
 * not always the one the fixtures use for the protobuf well-known types, so both are listed.
 */
public final class RuntimeTypeTable {

    private static final String TYPE_NAME = "type";

    private static final Map<String, CelType> NAME_TO_TYPE = Map.ofEntries(
            Map.entry("bool", SimpleType.BOOL),
            Map.entry("bytes", SimpleType.BYTES),
            Map.entry("double", SimpleType.DOUBLE),
            Map.entry("duration", SimpleType.DURATION),
            Map.entry("int", SimpleType.INT),
            Map.entry("list", ListType.create(SimpleType.DYN)),
            Map.entry("map", MapType.create(SimpleType.DYN, SimpleType.DYN)),
            Map.entry("null_type", SimpleType.NULL_TYPE),
            Map.entry("string", SimpleType.STRING),
            Map.entry("timestamp", SimpleType.TIMESTAMP),
            Map.entry("uint", SimpleType.UINT),
            Map.entry(TYPE_NAME, TypeType.create(SimpleType.DYN)),
            Map.entry("google.protobuf.Duration", SimpleType.DURATION),
            Map.entry("google.protobuf.Timestamp", SimpleType.TIMESTAMP));

    private RuntimeTypeTable() {}

    /**
     * Looks up the type a name denotes in a declaration, e.g. {@code int} for a variable of type int.
     *
     * @param name A fixture type name.
     * @return The runtime type, or empty if the name is unknown.
     */
    public static Optional<CelType> find(String name) {
        return Optional.ofNullable(name == null ? null : NAME_TO_TYPE.get(name));
    }

    /**
     * Looks up the runtime value of a type reference, i.e. what evaluating {@code int} or
     * {@code type(1)} yields. The runtime wraps a type in {@link TypeType} when it is used as a
     * value; {@code type} itself is already {@code type(dyn)}.
     *
     * @param name A fixture type name.
     * @return The type value, or empty if the name is unknown.
     */
    public static Optional<CelType> findTypeValue(String name) {
        return find(name).map(type -> TYPE_NAME.equals(name) ? type : TypeType.create(type));
    }

    /**
     * @param name A fixture type name.
     * @return The runtime value of the type reference.
     * @throws TranslationException with {@link TranslationErrorCode#UNKNOWN_TYPE_NAME} if the name is unknown.
     * @see #findTypeValue(String)
     */
    public static CelType resolveTypeValue(String name) {
        return findTypeValue(name).orElseThrow(() -> new TranslationException(
                TranslationErrorCode.UNKNOWN_TYPE_NAME, "Unknown type name: " + name));
    }
}
