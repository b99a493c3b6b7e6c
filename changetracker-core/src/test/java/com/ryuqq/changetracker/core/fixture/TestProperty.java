package com.ryuqq.changetracker.core.fixture;

import com.ryuqq.changetracker.core.metadata.EntityType;
import com.ryuqq.changetracker.core.metadata.Property;
import com.ryuqq.changetracker.core.metadata.TypeMapping;
import com.ryuqq.changetracker.core.metadata.ValueConverter;

/**
 * Minimal {@link Property} for core tests.
 */
public final class TestProperty implements Property {

    private final String name;
    private final Class<?> valueType;
    private ValueConverter<?, ?> valueConverter;
    private TypeMapping typeMapping;
    private EntityType declaringEntityType;

    public TestProperty(String name, Class<?> valueType) {
        this.name = name;
        this.valueType = valueType;
    }

    public static TestProperty of(String name, Class<?> valueType) {
        return new TestProperty(name, valueType);
    }

    public TestProperty withConverter(ValueConverter<?, ?> converter) {
        this.valueConverter = converter;
        return this;
    }

    public TestProperty withTypeMapping(TypeMapping mapping) {
        this.typeMapping = mapping;
        return this;
    }

    void setDeclaringEntityType(EntityType entityType) {
        this.declaringEntityType = entityType;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Class<?> getValueType() {
        return valueType;
    }

    @Override
    public EntityType getDeclaringEntityType() {
        return declaringEntityType;
    }

    @Override
    public ValueConverter<?, ?> getValueConverter() {
        return valueConverter;
    }

    @Override
    public TypeMapping getTypeMapping() {
        return typeMapping;
    }

    @Override
    public boolean isNullable() {
        return !valueType.isPrimitive();
    }
}
