package com.ryuqq.changetracker.core.metadata;

import java.util.List;

/**
 * Entity type in a finalized {@link Model}.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public interface EntityType {

    /**
     * Entity type name. Used as the primary sort key of debug output.
     *
     * @return entity type name
     */
    String getName();

    /**
     * Primary key of the entity type.
     *
     * @return the primary key, or {@code null} for keyless entity types
     */
    Key findPrimaryKey();

    /**
     * Scalar properties in declaration order.
     *
     * @return immutable list of properties
     */
    List<Property> getProperties();

    /**
     * Finds a scalar property by name.
     *
     * @param name property name
     * @return the property, or {@code null} if not declared
     */
    Property findProperty(String name);
}
