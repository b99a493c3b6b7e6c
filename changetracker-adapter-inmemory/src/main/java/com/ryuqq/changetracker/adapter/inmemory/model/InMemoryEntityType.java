package com.ryuqq.changetracker.adapter.inmemory.model;

import com.ryuqq.changetracker.core.metadata.EntityType;
import com.ryuqq.changetracker.core.metadata.Key;
import com.ryuqq.changetracker.core.metadata.Property;
import com.ryuqq.changetracker.core.metadata.PropertyBase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entity type of an {@link InMemoryModel}. Immutable once built.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class InMemoryEntityType implements EntityType {

    private final String name;
    private final List<Property> properties;
    private final Map<String, InMemoryProperty> propertiesByName;
    private final InMemoryKey primaryKey;

    InMemoryEntityType(EntityTypeBuilder builder) {
        this.name = builder.name();

        Map<String, InMemoryProperty> byName = new LinkedHashMap<>();
        int index = 0;
        for (PropertyBuilder propertyBuilder : builder.properties()) {
            byName.put(propertyBuilder.name(), new InMemoryProperty(this, propertyBuilder, index++));
        }
        this.propertiesByName = Collections.unmodifiableMap(byName);
        this.properties = List.copyOf(byName.values());

        List<String> keyNames = builder.primaryKey();
        if (keyNames.isEmpty()) {
            this.primaryKey = null;
        } else {
            List<Property> keyProperties = new ArrayList<>(keyNames.size());
            for (String keyName : keyNames) {
                keyProperties.add(byName.get(keyName));
            }
            this.primaryKey = new InMemoryKey(this, keyProperties);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Key findPrimaryKey() {
        return primaryKey;
    }

    @Override
    public List<Property> getProperties() {
        return properties;
    }

    @Override
    public InMemoryProperty findProperty(String propertyName) {
        return propertiesByName.get(propertyName);
    }

    /**
     * Finds a property by name, failing when it is not declared.
     *
     * @param propertyName property name
     * @return the property
     * @throws IllegalArgumentException if the property is not declared
     */
    public InMemoryProperty getProperty(String propertyName) {
        InMemoryProperty property = propertiesByName.get(propertyName);
        if (property == null) {
            throw new IllegalArgumentException("Property " + propertyName + " is not declared on " + name);
        }
        return property;
    }

    /**
     * Value slot of a property of this entity type.
     *
     * @param property property
     * @return zero-based index
     * @throws IllegalArgumentException if the property is not one of this entity type's properties
     */
    public int indexOf(PropertyBase property) {
        if (property instanceof InMemoryProperty && property.getDeclaringEntityType() == this) {
            return ((InMemoryProperty) property).getIndex();
        }
        throw new IllegalArgumentException(
            "Property " + (property == null ? null : property.getName()) + " is not declared on " + name
        );
    }

    /**
     * Number of properties.
     *
     * @return property count
     */
    public int getPropertyCount() {
        return properties.size();
    }

    @Override
    public String toString() {
        return "EntityType{" + name + '}';
    }
}
