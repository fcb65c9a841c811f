package org.celconform.eval.cel;

import dev.cel.common.types.ListType;
import dev.cel.common.types.MapType;
import dev.cel.common.types.SimpleType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AnnotationTypeResolverTest {

    private final AnnotationTypeResolver resolver = new AnnotationTypeResolver();

    @Test
    void resolvesPrimitiveNames() {
        assertThat(resolver.resolve("INT64")).isEqualTo(SimpleType.INT);
        assertThat(resolver.resolve("UINT64")).isEqualTo(SimpleType.UINT);
        assertThat(resolver.resolve("BYTES")).isEqualTo(SimpleType.BYTES);
        assertThat(resolver.resolve(" BOOL ")).isEqualTo(SimpleType.BOOL);
    }

    @Test
    void resolvesRuntimeTypeNames() {
        assertThat(resolver.resolve("google.protobuf.Duration")).isEqualTo(SimpleType.DURATION);
        assertThat(resolver.resolve("list")).isEqualTo(ListType.create(SimpleType.DYN));
        // A declaration names the type itself, not its type value.
        assertThat(resolver.resolve("int")).isEqualTo(SimpleType.INT);
    }

    @Test
    void resolvesMapAnnotations() {
        assertThat(resolver.resolve("Map[STRING, INT64]"))
                .isEqualTo(MapType.create(SimpleType.STRING, SimpleType.INT));
    }

    @Test
    void resolvesNestedMapAnnotations() {
        assertThat(resolver.resolve("Map[STRING, Map[INT64, BOOL]]"))
                .isEqualTo(MapType.create(SimpleType.STRING, MapType.create(SimpleType.INT, SimpleType.BOOL)));
    }

    @Test
    void unknownNamesAreDynamic() {
        // Arrange
        String messageType = "cel.expr.conformance.proto3.TestAllTypes";

        // Act & Assert
        assertThat(resolver.resolve(messageType)).isEqualTo(SimpleType.DYN);
        assertThat(resolver.resolve("Map[STRING]")).isEqualTo(SimpleType.DYN);
    }
}
