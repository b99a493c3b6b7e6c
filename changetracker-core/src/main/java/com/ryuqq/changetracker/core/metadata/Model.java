package com.ryuqq.changetracker.core.metadata;

import com.ryuqq.changetracker.core.compare.CurrentValueComparatorCache;

import java.util.Collection;

/**
 * Finalized entity model.
 *
 * <p>The model owns the {@link CurrentValueComparatorCache}; comparators live exactly
 * as long as the model that created them.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public interface Model {

    /**
     * All entity types of the model.
     *
     * @return immutable collection of entity types
     */
    Collection<EntityType> getEntityTypes();

    /**
     * Finds an entity type by name.
     *
     * @param name entity type name
     * @return the entity type, or {@code null} if not found
     */
    EntityType findEntityType(String name);

    /**
     * Comparator cache scoped to this model.
     *
     * @return the comparator cache
     */
    CurrentValueComparatorCache getCurrentValueComparators();
}
