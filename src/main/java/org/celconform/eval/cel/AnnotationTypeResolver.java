package org.celconform.eval.cel;

import dev.cel.common.types.CelType;
import dev.cel.common.types.MapType;
import dev.cel.common.types.SimpleType;
import org.celconform.translate.RuntimeTypeTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves the textual type annotations of a type environment into CEL declaration types.
 * <p>
 * Understands the primitive enum names of the conformance protos ({@code INT64}, ...), the
 * {@code Map[K, V]} form and every name of the {@link RuntimeTypeTable}. Other identifiers,
 * e.g. test message types this engine has no descriptors for, are declared as {@code dyn}.
 */
final class AnnotationTypeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AnnotationTypeResolver.class);

    private static final Map<String, CelType> PRIMITIVES = Map.of(
            "BOOL", SimpleType.BOOL,
            "INT64", SimpleType.INT,
            "UINT64", SimpleType.UINT,
            "DOUBLE", SimpleType.DOUBLE,
            "STRING", SimpleType.STRING,
            "BYTES", SimpleType.BYTES);

    private static final String MAP_PREFIX = "Map[";

    CelType resolve(String annotation) {
        String text = annotation.trim();
        if (text.startsWith(MAP_PREFIX) && text.endsWith("]")) {
            List<String> parameters = splitParameters(text.substring(MAP_PREFIX.length(), text.length() - 1));
            if (parameters.size() == 2) {
                return MapType.create(resolve(parameters.get(0)), resolve(parameters.get(1)));
            }
        }
        CelType primitive = PRIMITIVES.get(text);
        if (primitive != null) {
            return primitive;
        }
        return RuntimeTypeTable.find(text).orElseGet(() -> {
            LOG.debug("No CEL type for annotation '{}', declaring it as dyn", text);
            return SimpleType.DYN;
        });
    }

    /**
     * Splits on the commas that are not nested inside brackets.
     */
    private static List<String> splitParameters(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }
}
