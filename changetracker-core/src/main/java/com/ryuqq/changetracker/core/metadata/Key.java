package com.ryuqq.changetracker.core.metadata;

import java.util.List;

/**
 * Primary or alternate key of an entity type.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public interface Key {

    /**
     * Key properties in declaration order.
     *
     * @return immutable, non-empty list of key properties
     */
    List<Property> getProperties();

    /**
     * Entity type declaring this key.
     *
     * @return declaring entity type
     */
    EntityType getDeclaringEntityType();
}
