package com.ryuqq.changetracker.adapter.inmemory.tracking;

import com.ryuqq.changetracker.adapter.inmemory.model.InMemoryEntityType;
import com.ryuqq.changetracker.adapter.inmemory.model.InMemoryProperty;
import com.ryuqq.changetracker.core.compare.ValueTypes;
import com.ryuqq.changetracker.core.entry.EntityState;
import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.PropertyBase;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Tracked entry holding current and original property values.
 *
 * <p><strong>상태 전이:</strong></p>
 * <ul>
 *   <li>UNCHANGED 상태에서 다른 값 설정 → MODIFIED</li>
 *   <li>acceptChanges(): ADDED/MODIFIED → UNCHANGED, DELETED → DETACHED</li>
 * </ul>
 *
 * <p>Not thread-safe: an entry belongs to one unit of work. Readers such as comparators
 * must see a stable snapshot.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class InMemoryTrackedEntry implements TrackedEntry {

    private final long trackingId;
    private final InMemoryEntityType entityType;
    private final Object[] currentValues;
    private final Object[] originalValues;
    private final boolean[] modified;
    private EntityState entityState;

    InMemoryTrackedEntry(long trackingId, InMemoryEntityType entityType, Map<String, ?> values, EntityState entityState) {
        this.trackingId = trackingId;
        this.entityType = entityType;
        this.currentValues = new Object[entityType.getPropertyCount()];
        this.modified = new boolean[entityType.getPropertyCount()];
        for (Map.Entry<String, ?> value : values.entrySet()) {
            InMemoryProperty property = entityType.getProperty(value.getKey());
            currentValues[property.getIndex()] = checkValue(property, value.getValue());
        }
        for (InMemoryProperty property : propertiesOf(entityType)) {
            if (currentValues[property.getIndex()] == null && !property.isNullable()) {
                throw new IllegalArgumentException(
                    "Missing value for non-nullable property " + entityType.getName() + "." + property.getName()
                );
            }
        }
        this.originalValues = currentValues.clone();
        this.entityState = entityState;
    }

    @Override
    public InMemoryEntityType getEntityType() {
        return entityType;
    }

    @Override
    public EntityState getEntityState() {
        return entityState;
    }

    @Override
    public Object getCurrentValue(PropertyBase property) {
        return currentValues[entityType.indexOf(property)];
    }

    @Override
    public Object getOriginalValue(PropertyBase property) {
        return originalValues[entityType.indexOf(property)];
    }

    @Override
    public boolean isModified(PropertyBase property) {
        return modified[entityType.indexOf(property)];
    }

    /**
     * Sets the current value of a property.
     *
     * <p>On an UNCHANGED or MODIFIED entry a value different from the original marks the
     * property modified and moves the entry to MODIFIED.</p>
     *
     * @param propertyName property name
     * @param value new value
     * @throws IllegalArgumentException if the property is unknown, the value has the wrong type,
     *                                  or null is set on a non-nullable property
     * @throws IllegalStateException if the entry is DELETED or DETACHED
     */
    public void setCurrentValue(String propertyName, Object value) {
        if (entityState == EntityState.DELETED || entityState == EntityState.DETACHED) {
            throw new IllegalStateException("Cannot modify " + entityState + " entry of " + entityType.getName());
        }
        InMemoryProperty property = entityType.getProperty(propertyName);
        int index = property.getIndex();
        currentValues[index] = checkValue(property, value);

        if (entityState == EntityState.ADDED) {
            return;
        }
        modified[index] = !Objects.deepEquals(originalValues[index], currentValues[index]);
        entityState = anyModified() ? EntityState.MODIFIED : EntityState.UNCHANGED;
    }

    /**
     * Accepts pending changes.
     */
    public void acceptChanges() {
        switch (entityState) {
            case ADDED:
            case MODIFIED:
                System.arraycopy(currentValues, 0, originalValues, 0, currentValues.length);
                Arrays.fill(modified, false);
                entityState = EntityState.UNCHANGED;
                break;
            case DELETED:
                entityState = EntityState.DETACHED;
                break;
            default:
                break;
        }
    }

    long getTrackingId() {
        return trackingId;
    }

    void setEntityState(EntityState entityState) {
        this.entityState = entityState;
    }

    private boolean anyModified() {
        for (boolean flag : modified) {
            if (flag) {
                return true;
            }
        }
        return false;
    }

    private static Object checkValue(InMemoryProperty property, Object value) {
        if (value == null) {
            if (!property.isNullable()) {
                throw new IllegalArgumentException(
                    "Property " + property.getName() + " cannot be null"
                );
            }
            return null;
        }
        Class<?> expected = ValueTypes.wrap(property.getValueType());
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(
                "Property " + property.getName() + " expects " + expected.getName()
                    + " but got " + value.getClass().getName()
            );
        }
        return value;
    }

    private static Iterable<InMemoryProperty> propertiesOf(InMemoryEntityType entityType) {
        return entityType.getProperties().stream()
            .map(InMemoryProperty.class::cast)
            .toList();
    }

    @Override
    public String toString() {
        return "TrackedEntry{" + entityType.getName() + " #" + trackingId + " " + entityState + '}';
    }
}
