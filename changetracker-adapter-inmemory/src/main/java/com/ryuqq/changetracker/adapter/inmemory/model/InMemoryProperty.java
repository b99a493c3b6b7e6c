package com.ryuqq.changetracker.adapter.inmemory.model;

import com.ryuqq.changetracker.core.metadata.EntityType;
import com.ryuqq.changetracker.core.metadata.Property;
import com.ryuqq.changetracker.core.metadata.TypeMapping;
import com.ryuqq.changetracker.core.metadata.ValueConverter;

/**
 * Scalar property of an {@link InMemoryEntityType}.
 *
 * <p>Identity-based equality: each property instance is its own comparator cache key.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class InMemoryProperty implements Property {

    private final InMemoryEntityType declaringEntityType;
    private final String name;
    private final Class<?> valueType;
    private final boolean nullable;
    private final ValueConverter<?, ?> valueConverter;
    private final TypeMapping typeMapping;
    private final int index;

    InMemoryProperty(InMemoryEntityType declaringEntityType, PropertyBuilder builder, int index) {
        this.declaringEntityType = declaringEntityType;
        this.name = builder.name();
        this.valueType = builder.valueType();
        this.nullable = builder.nullable();
        this.valueConverter = builder.valueConverter();
        this.typeMapping = builder.typeMapping();
        this.index = index;
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
        return nullable;
    }

    /**
     * Slot of this property in an entry's value array.
     *
     * @return zero-based declaration index
     */
    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return "Property{" + declaringEntityType.getName() + "." + name + " (" + valueType.getSimpleName() + ")}";
    }
}
