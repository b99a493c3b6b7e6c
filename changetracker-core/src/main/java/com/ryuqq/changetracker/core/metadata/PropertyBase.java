package com.ryuqq.changetracker.core.metadata;

/**
 * Member of an entity type whose current value can be read from a tracked entry.
 *
 * <p>Scalar properties, navigations and service properties are all property bases.
 * Only {@link Property} instances can carry a {@link ValueConverter}.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public interface PropertyBase {

    /**
     * Property name, unique within its declaring entity type.
     *
     * @return property name
     */
    String getName();

    /**
     * Declared value type. May be a primitive type.
     *
     * @return declared value type
     */
    Class<?> getValueType();

    /**
     * Entity type declaring this member.
     *
     * @return declaring entity type
     */
    EntityType getDeclaringEntityType();
}
