package org.celconform.fixture;

import java.util.List;
import java.util.Objects;

/**
 * One declaration of the type environment a fixture expression is checked against.
 */
public sealed interface TypeBinding permits TypeBinding.Declared, TypeBinding.Prebuilt {

    /**
     * @return The declared identifier, possibly qualified by a container.
     */
    String name();

    /**
     * A declaration by type name.
     *
     * @param name            The variable being declared.
     * @param kind            The declaration kind.
     * @param typeIdentifiers One type name, or the (key, value) pair for {@link TypeKind#MAP_TYPE}.
     */
    record Declared(String name, TypeKind kind, List<String> typeIdentifiers) implements TypeBinding {
        public Declared {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
            typeIdentifiers = List.copyOf(typeIdentifiers);
            if (kind == TypeKind.MAP_TYPE && typeIdentifiers.size() != 2) {
                throw new IllegalArgumentException("map type '" + name + "' needs a key and a value type, got " + typeIdentifiers);
            }
            if (kind != TypeKind.MAP_TYPE && typeIdentifiers.size() != 1) {
                throw new IllegalArgumentException("type '" + name + "' needs exactly one type identifier, got " + typeIdentifiers);
            }
        }

        public static Declared primitive(String name, String typeIdentifier) {
            return new Declared(name, TypeKind.PRIMITIVE, List.of(typeIdentifier));
        }

        public static Declared mapOf(String name, String keyType, String valueType) {
            return new Declared(name, TypeKind.MAP_TYPE, List.of(keyType, valueType));
        }
    }

    /**
     * An opaque, pre-built runtime value injected into the environment as is, without going
     * through fixture translation. Used for stand-ins of conformance test messages.
     *
     * @param name     The identifier the value is bound to.
     * @param instance The runtime value.
     */
    record Prebuilt(String name, Object instance) implements TypeBinding {
        public Prebuilt {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(instance, "instance");
        }
    }
}
