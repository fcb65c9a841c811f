package org.celconform.fixture;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FixtureModelTest {

    @Test
    void valueKindsResolveByFieldName() {
        assertThat(ValueKind.fromFieldName("uint64_value")).contains(ValueKind.UINT64);
        assertThat(ValueKind.fromFieldName("type")).contains(ValueKind.TYPE);
        assertThat(ValueKind.fromFieldName("object_value")).isEmpty();
    }

    @Test
    void typeKindsResolveByTag() {
        assertThat(TypeKind.fromTag("map_type")).contains(TypeKind.MAP_TYPE);
        assertThat(TypeKind.fromTag("oneof")).isEmpty();
    }

    @Test
    void mapTypeNeedsKeyAndValue() {
        assertThatThrownBy(() -> new TypeBinding.Declared("m", TypeKind.MAP_TYPE, List.of("STRING")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'m'");
    }

    @Test
    void otherKindsNeedOneIdentifier() {
        assertThatThrownBy(() -> new TypeBinding.Declared("x", TypeKind.PRIMITIVE, List.of("INT64", "STRING")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(TypeBinding.Declared.primitive("x", "INT64").typeIdentifiers()).containsExactly("INT64");
    }

    @Test
    void mapLiteralNeedsPairs() {
        assertThatThrownBy(() -> FixtureValue.map(FixtureValue.of(ValueKind.STRING, "a")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void aggregatesAreImmutableCopies() {
        // Arrange
        List<FixtureValue> elements = new ArrayList<>(List.of(FixtureValue.of(ValueKind.INT64, 1)));

        // Act
        FixtureValue.ListValue list = new FixtureValue.ListValue(elements);
        elements.clear();

        // Assert
        assertThat(list.elements()).hasSize(1);
    }
}
