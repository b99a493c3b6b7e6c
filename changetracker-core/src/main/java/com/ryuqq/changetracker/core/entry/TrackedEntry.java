package com.ryuqq.changetracker.core.entry;

import com.ryuqq.changetracker.core.metadata.EntityType;
import com.ryuqq.changetracker.core.metadata.PropertyBase;

/**
 * Entity instance under change tracking.
 *
 * <p>Entries are owned by a state manager; comparators only read their current values.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public interface TrackedEntry {

    /**
     * Entity type of the tracked instance.
     *
     * @return entity type
     */
    EntityType getEntityType();

    /**
     * Current tracking state.
     *
     * @return entity state
     */
    EntityState getEntityState();

    /**
     * Current value of a property.
     *
     * @param property property declared on {@link #getEntityType()}
     * @return current value, may be {@code null}
     * @throws IllegalArgumentException if the property is not declared on this entry's entity type
     */
    Object getCurrentValue(PropertyBase property);

    /**
     * Value of a property when the entry was attached or last accepted.
     *
     * @param property property declared on {@link #getEntityType()}
     * @return original value, may be {@code null}
     * @throws IllegalArgumentException if the property is not declared on this entry's entity type
     */
    Object getOriginalValue(PropertyBase property);

    /**
     * Whether the property is flagged as modified.
     *
     * @param property property declared on {@link #getEntityType()}
     * @return {@code true} if modified
     */
    boolean isModified(PropertyBase property);
}
