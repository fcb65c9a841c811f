package org.celconform.translate;

import com.google.common.primitives.UnsignedLong;
import com.google.protobuf.ByteString;
import com.google.protobuf.Duration;
import com.google.protobuf.NullValue;
import org.celconform.fixture.FixtureValue;
import org.celconform.fixture.ValueKind;
import org.celconform.fixture.VariableBinding;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Translates fixture literals into the values the CEL Java runtime works with.
 * <p>
 * Runtime representations: {@code Long} for int and enum, {@link UnsignedLong} for uint,
 * {@code Double}, {@code String}, {@link ByteString} for bytes, {@code Boolean},
 * {@link NullValue#NULL_VALUE} for null, a {@link dev.cel.common.types.TypeType} for type
 * references, immutable lists, insertion-ordered maps and protobuf {@link Duration}s.
 * <p>
 * The translator holds no state and may be shared.
 */
public final class ValueTranslator {

    static final String DURATION_NAMESPACE = "type.googleapis.com/google.protobuf.Duration";

    private static final Map<String, Function<FixtureValue.ObjectValue, Object>> OBJECT_BUILDERS = Map.of(
            DURATION_NAMESPACE, ValueTranslator::buildDuration);

    /**
     * Translates one fixture literal, recursing into lists, maps and objects.
     *
     * @param value The fixture literal.
     * @return The runtime value; never {@code null}.
     * @throws TranslationException if the literal has an unknown kind, type name or namespace,
     *                              or a malformed payload.
     */
    public Object translate(FixtureValue value) {
        if (value instanceof FixtureValue.Scalar scalar) {
            return translateScalar(scalar);
        }
        if (value instanceof FixtureValue.ListValue list) {
            List<Object> elements = new ArrayList<>(list.elements().size());
            for (FixtureValue element : list.elements()) {
                elements.add(translate(element));
            }
            return Collections.unmodifiableList(elements);
        }
        if (value instanceof FixtureValue.MapValue map) {
            Map<Object, Object> entries = new LinkedHashMap<>();
            for (List<FixtureValue.MapEntry> group : map.groups()) {
                for (FixtureValue.MapEntry entry : group) {
                    entries.put(translate(entry.key()), translate(entry.value()));
                }
            }
            return Collections.unmodifiableMap(entries);
        }
        if (value instanceof FixtureValue.ObjectValue object) {
            Function<FixtureValue.ObjectValue, Object> builder = OBJECT_BUILDERS.get(object.namespace());
            if (builder == null) {
                throw new TranslationException(TranslationErrorCode.UNSUPPORTED_OBJECT_NAMESPACE,
                        "Cannot translate object of namespace '" + object.namespace() + "'");
            }
            return builder.apply(object);
        }
        throw new IllegalArgumentException("Unsupported fixture value: " + value);
    }

    /**
     * Translates variable bindings into an activation. A name bound twice keeps its last value.
     *
     * @param bindings The bindings, in fixture order.
     * @return An insertion-ordered, mutable activation map.
     */
    public Map<String, Object> translateAll(List<VariableBinding> bindings) {
        Map<String, Object> activation = new LinkedHashMap<>();
        for (VariableBinding binding : bindings) {
            activation.put(binding.name(), translate(binding.value()));
        }
        return activation;
    }

    private Object translateScalar(FixtureValue.Scalar scalar) {
        ValueKind kind = ValueKind.fromFieldName(scalar.kind()).orElseThrow(() -> new TranslationException(
                TranslationErrorCode.UNKNOWN_VALUE_KIND, "Unknown value kind '" + scalar.kind() + "'"));
        Object payload = scalar.payload();
        return switch (kind) {
            case INT64, ENUM -> toLong(kind, payload);
            case UINT64 -> toUnsignedLong(payload);
            case DOUBLE -> toDouble(payload);
            case STRING -> requirePayload(kind, payload, CharSequence.class).toString();
            case BYTES -> toBytes(payload);
            case BOOL -> toBoolean(payload);
            case NULL -> NullValue.NULL_VALUE;
            case TYPE -> RuntimeTypeTable.resolveTypeValue(requirePayload(kind, payload, CharSequence.class).toString());
        };
    }

    private static long toLong(ValueKind kind, Object payload) {
        if (payload instanceof Long || payload instanceof Integer || payload instanceof Short || payload instanceof Byte) {
            return ((Number) payload).longValue();
        }
        try {
            if (payload instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (payload instanceof CharSequence text) {
                return Long.parseLong(text.toString().trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw malformed(kind, payload, e);
        }
        throw malformed(kind, payload, null);
    }

    private static UnsignedLong toUnsignedLong(Object payload) {
        if (payload instanceof UnsignedLong unsigned) {
            return unsigned;
        }
        try {
            if (payload instanceof Long || payload instanceof Integer || payload instanceof Short || payload instanceof Byte) {
                return UnsignedLong.valueOf(((Number) payload).longValue());
            }
            if (payload instanceof BigInteger big) {
                return UnsignedLong.valueOf(big);
            }
            if (payload instanceof CharSequence text) {
                return UnsignedLong.valueOf(text.toString().trim());
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            throw malformed(ValueKind.UINT64, payload, e);
        }
        throw malformed(ValueKind.UINT64, payload, null);
    }

    private static double toDouble(Object payload) {
        if (payload instanceof Number number) {
            return number.doubleValue();
        }
        if (payload instanceof CharSequence chars) {
            String text = chars.toString().trim();
            if (text.equals("inf")) {
                return Double.POSITIVE_INFINITY;
            }
            if (text.equals("-inf")) {
                return Double.NEGATIVE_INFINITY;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw malformed(ValueKind.DOUBLE, payload, e);
            }
        }
        throw malformed(ValueKind.DOUBLE, payload, null);
    }

    private static ByteString toBytes(Object payload) {
        if (payload instanceof ByteString bytes) {
            return bytes;
        }
        if (payload instanceof byte[] bytes) {
            return ByteString.copyFrom(bytes);
        }
        if (payload instanceof CharSequence text) {
            return ByteString.copyFrom(text.toString(), StandardCharsets.UTF_8);
        }
        throw malformed(ValueKind.BYTES, payload, null);
    }

    private static boolean toBoolean(Object payload) {
        if (payload instanceof Boolean bool) {
            return bool;
        }
        if (payload instanceof CharSequence chars) {
            String text = chars.toString().trim();
            if (text.equals("true")) {
                return true;
            }
            if (text.equals("false")) {
                return false;
            }
        }
        throw malformed(ValueKind.BOOL, payload, null);
    }

    private static <T> T requirePayload(ValueKind kind, Object payload, Class<T> type) {
        if (!type.isInstance(payload)) {
            throw malformed(kind, payload, null);
        }
        return type.cast(payload);
    }

    private static Duration buildDuration(FixtureValue.ObjectValue object) {
        long seconds = integerField(object, "seconds");
        long nanos = integerField(object, "nanos");
        try {
            return Duration.newBuilder()
                    .setSeconds(seconds)
                    .setNanos(Math.toIntExact(nanos))
                    .build();
        } catch (ArithmeticException e) {
            throw new TranslationException(TranslationErrorCode.MALFORMED_PAYLOAD,
                    "Duration nanos out of range: " + nanos, e);
        }
    }

    private static long integerField(FixtureValue.ObjectValue object, String name) {
        for (FixtureValue.ObjectField field : object.fields()) {
            if (field.name().equals(name)) {
                if (field.value() instanceof FixtureValue.Scalar special) {
                    return toLong(ValueKind.INT64, special.payload());
                }
                throw new TranslationException(TranslationErrorCode.MALFORMED_PAYLOAD,
                        "Field '" + name + "' of " + object.namespace() + " is not a special value: " + field.value());
            }
        }
        throw new TranslationException(TranslationErrorCode.MALFORMED_PAYLOAD,
                "Missing field '" + name + "' in " + object.namespace());
    }

    private static TranslationException malformed(ValueKind kind, Object payload, Throwable cause) {
        String shape = payload == null ? "null" : payload.getClass().getSimpleName();
        return new TranslationException(TranslationErrorCode.MALFORMED_PAYLOAD,
                String.format("Malformed %s payload: %s (%s)", kind.fieldName(), payload, shape), cause);
    }
}
