package com.ryuqq.changetracker.adapter.inmemory.model;

import com.ryuqq.changetracker.core.metadata.EntityType;
import com.ryuqq.changetracker.core.metadata.Key;
import com.ryuqq.changetracker.core.metadata.Property;

import java.util.List;

/**
 * Primary key of an {@link InMemoryEntityType}.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class InMemoryKey implements Key {

    private final InMemoryEntityType declaringEntityType;
    private final List<Property> properties;

    InMemoryKey(InMemoryEntityType declaringEntityType, List<Property> properties) {
        this.declaringEntityType = declaringEntityType;
        this.properties = List.copyOf(properties);
    }

    @Override
    public List<Property> getProperties() {
        return properties;
    }

    @Override
    public EntityType getDeclaringEntityType() {
        return declaringEntityType;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Key{");
        for (int i = 0; i < properties.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(properties.get(i).getName());
        }
        return builder.append('}').toString();
    }
}
