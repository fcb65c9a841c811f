package org.celconform.fixture;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A single fixture literal as authored in the conformance suite, before translation into a
 * runtime value. Scalars carry their kind and raw payload; lists, maps and objects nest
 * further fixture values.
 */
public sealed interface FixtureValue permits FixtureValue.Scalar, FixtureValue.ListValue, FixtureValue.MapValue, FixtureValue.ObjectValue {

    /**
     * A scalar literal.
     * <p>
     * The kind is kept as the raw field name so that an unknown kind surfaces when the value
     * is translated, not when the fixture is read.
     *
     * @param kind    The fixture field name, e.g. {@code int64_value}.
     * @param payload The raw payload: text or an already parsed native value. May be null for
     *                {@code null_value}.
     */
    record Scalar(String kind, Object payload) implements FixtureValue {
        public Scalar {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /**
     * An ordered list of fixture values.
     * @param elements The elements, in fixture order.
     */
    record ListValue(List<FixtureValue> elements) implements FixtureValue {
        public ListValue {
            elements = List.copyOf(elements);
        }
    }

    /**
     * A map literal, possibly spread over several entry groups.
     * @param groups The entry groups, in fixture order.
     */
    record MapValue(List<List<MapEntry>> groups) implements FixtureValue {
        public MapValue {
            List<List<MapEntry>> copies = new ArrayList<>(groups.size());
            for (List<MapEntry> group : groups) {
                copies.add(List.copyOf(group));
            }
            groups = List.copyOf(copies);
        }
    }

    /**
     * A namespaced composite literal, e.g. a well-known protobuf message packed in an Any.
     * @param namespace The fully qualified type URL.
     * @param fields    The sub-field descriptors, in fixture order.
     */
    record ObjectValue(String namespace, List<ObjectField> fields) implements FixtureValue {
        public ObjectValue {
            Objects.requireNonNull(namespace, "namespace");
            fields = List.copyOf(fields);
        }
    }

    /**
     * One key/value entry of a {@link MapValue}.
     */
    record MapEntry(FixtureValue key, FixtureValue value) {
        public MapEntry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * One sub-field of an {@link ObjectValue}; the value is the nested special-value literal.
     */
    record ObjectField(String name, FixtureValue value) {
        public ObjectField {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    static Scalar of(String kind, Object payload) {
        return new Scalar(kind, payload);
    }

    static Scalar of(ValueKind kind, Object payload) {
        return new Scalar(kind.fieldName(), payload);
    }

    static ListValue list(FixtureValue... elements) {
        return new ListValue(Arrays.asList(elements));
    }

    /**
     * Builds a single-group map from alternating keys and values.
     */
    static MapValue map(FixtureValue... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("map literal needs an even number of keys and values");
        }
        List<MapEntry> entries = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.add(new MapEntry(keysAndValues[i], keysAndValues[i + 1]));
        }
        return new MapValue(List.of(entries));
    }
}
