package com.ryuqq.changetracker.core.metadata;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TypeMapping 테스트.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
class TypeMappingTest {

    @Test
    void of_WithoutConverter_HasNullConverter() {
        // When
        TypeMapping mapping = TypeMapping.of("int");

        // Then
        assertThat(mapping.storeType()).isEqualTo("int");
        assertThat(mapping.converter()).isNull();
    }

    @Test
    void of_WithConverter_KeepsConverter() {
        // Given
        ValueConverter<Boolean, Integer> bit = ValueConverter.of(
            Boolean.class, Integer.class, b -> b ? 1 : 0, i -> i != 0);

        // When
        TypeMapping mapping = TypeMapping.of("bit", bit);

        // Then
        assertThat(mapping.converter()).isSameAs(bit);
    }

    @Test
    void constructor_BlankStoreType_ThrowsException() {
        assertThatThrownBy(() -> TypeMapping.of("  "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("storeType cannot be null or blank");
    }
}
