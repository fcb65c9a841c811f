package org.celconform.fixture;

import java.util.Optional;

/**
 * The kind tag of a type-environment declaration, as it appears in fixtures.
 * Only {@link #MAP_TYPE} changes how the declaration is turned into an annotation.
 */
public enum TypeKind {
    PRIMITIVE("primitive"),
    MAP_TYPE("map_type"),
    MESSAGE_TYPE("message_type"),
    STRING("STRING"),
    INT64("INT64"),
    MAP_TYPE_SPEC("map_type_spec"),
    ELEM_TYPE("elem_type"),
    TYPE_SPEC("type_spec");

    private final String tag;

    TypeKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<TypeKind> fromTag(String tag) {
        for (TypeKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
