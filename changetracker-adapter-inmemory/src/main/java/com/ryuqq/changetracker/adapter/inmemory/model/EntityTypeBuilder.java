package com.ryuqq.changetracker.adapter.inmemory.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fluent configuration of one entity type inside {@link InMemoryModel.Builder}.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class EntityTypeBuilder {

    private final String name;
    private final Map<String, PropertyBuilder> properties;
    private final List<String> primaryKey;

    EntityTypeBuilder(String name) {
        this.name = name;
        this.properties = new LinkedHashMap<>();
        this.primaryKey = new ArrayList<>();
    }

    /**
     * Declares a property.
     *
     * @param propertyName property name
     * @param valueType declared value type
     * @return this builder
     * @throws IllegalArgumentException if the name is blank, already declared, or the type is null
     */
    public EntityTypeBuilder property(String propertyName, Class<?> valueType) {
        return property(propertyName, valueType, p -> { });
    }

    /**
     * Declares a property with additional configuration.
     *
     * @param propertyName property name
     * @param valueType declared value type
     * @param configuration property configuration
     * @return this builder
     * @throws IllegalArgumentException if the name is blank, already declared, or an argument is null
     */
    public EntityTypeBuilder property(String propertyName, Class<?> valueType, Consumer<PropertyBuilder> configuration) {
        if (propertyName == null || propertyName.isBlank()) {
            throw new IllegalArgumentException("propertyName cannot be null or blank");
        }
        if (valueType == null) {
            throw new IllegalArgumentException("valueType cannot be null");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        if (properties.containsKey(propertyName)) {
            throw new IllegalArgumentException(
                "Property " + propertyName + " is already declared on " + name
            );
        }
        PropertyBuilder builder = new PropertyBuilder(propertyName, valueType);
        configuration.accept(builder);
        properties.put(propertyName, builder);
        return this;
    }

    /**
     * Declares the primary key. Key properties must already be declared.
     *
     * @param propertyNames key property names in key order
     * @return this builder
     * @throws IllegalArgumentException if no name is given or a name is not declared
     */
    public EntityTypeBuilder primaryKey(String... propertyNames) {
        if (propertyNames == null || propertyNames.length == 0) {
            throw new IllegalArgumentException("primary key needs at least one property");
        }
        primaryKey.clear();
        for (String propertyName : propertyNames) {
            if (!properties.containsKey(propertyName)) {
                throw new IllegalArgumentException(
                    "Key property " + propertyName + " is not declared on " + name
                );
            }
            primaryKey.add(propertyName);
        }
        return this;
    }

    String name() {
        return name;
    }

    List<PropertyBuilder> properties() {
        return List.copyOf(properties.values());
    }

    List<String> primaryKey() {
        return List.copyOf(primaryKey);
    }
}
