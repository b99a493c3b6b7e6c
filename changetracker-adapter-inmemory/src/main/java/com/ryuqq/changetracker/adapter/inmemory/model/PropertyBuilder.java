package com.ryuqq.changetracker.adapter.inmemory.model;

import com.ryuqq.changetracker.core.metadata.TypeMapping;
import com.ryuqq.changetracker.core.metadata.ValueConverter;

/**
 * Fluent configuration of one property inside {@link EntityTypeBuilder}.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class PropertyBuilder {

    private final String name;
    private final Class<?> valueType;
    private boolean nullable;
    private ValueConverter<?, ?> valueConverter;
    private TypeMapping typeMapping;

    PropertyBuilder(String name, Class<?> valueType) {
        this.name = name;
        this.valueType = valueType;
        this.nullable = !valueType.isPrimitive();
    }

    /**
     * Configures a value converter.
     *
     * @param converter converter, whose model type must accept the property type
     * @return this builder
     * @throws IllegalArgumentException if converter is null
     */
    public PropertyBuilder hasConversion(ValueConverter<?, ?> converter) {
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
        this.valueConverter = converter;
        return this;
    }

    /**
     * Configures the store type mapping.
     *
     * @param mapping type mapping
     * @return this builder
     * @throws IllegalArgumentException if mapping is null
     */
    public PropertyBuilder hasTypeMapping(TypeMapping mapping) {
        if (mapping == null) {
            throw new IllegalArgumentException("mapping cannot be null");
        }
        this.typeMapping = mapping;
        return this;
    }

    /**
     * Configures nullability. Primitive properties cannot be made nullable.
     *
     * @param nullable whether null values are allowed
     * @return this builder
     * @throws IllegalArgumentException if a primitive property is made nullable
     */
    public PropertyBuilder isNullable(boolean nullable) {
        if (nullable && valueType.isPrimitive()) {
            throw new IllegalArgumentException("Primitive property " + name + " cannot be nullable");
        }
        this.nullable = nullable;
        return this;
    }

    String name() {
        return name;
    }

    Class<?> valueType() {
        return valueType;
    }

    boolean nullable() {
        return nullable;
    }

    ValueConverter<?, ?> valueConverter() {
        return valueConverter;
    }

    TypeMapping typeMapping() {
        return typeMapping;
    }
}
