package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.PropertyBase;

import java.util.Comparator;

/**
 * Compares loosely-typed current values with a general comparer.
 *
 * <p>Base of the untyped comparator family. Subclasses change how a value is read
 * ({@link #getCurrentValue(TrackedEntry)}) or which comparer orders the values.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public class CurrentValueComparator implements Comparator<TrackedEntry> {

    private final PropertyBase property;
    private final Comparator<Object> underlyingComparator;

    /**
     * Creates a comparator using {@link Comparers#DEFAULT}.
     *
     * @param property property whose values are compared
     * @throws IllegalArgumentException if property is null
     */
    public CurrentValueComparator(PropertyBase property) {
        this(property, Comparers.DEFAULT);
    }

    /**
     * Creates a comparator with a custom underlying comparer.
     *
     * @param property property whose values are compared
     * @param underlyingComparator comparer for the values
     * @throws IllegalArgumentException if an argument is null
     */
    protected CurrentValueComparator(PropertyBase property, Comparator<Object> underlyingComparator) {
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        if (underlyingComparator == null) {
            throw new IllegalArgumentException("underlyingComparator cannot be null");
        }
        this.property = property;
        this.underlyingComparator = underlyingComparator;
    }

    /**
     * Value that takes part in the comparison.
     *
     * @param entry tracked entry
     * @return current value of the property
     */
    public Object getCurrentValue(TrackedEntry entry) {
        return entry.getCurrentValue(property);
    }

    @Override
    public int compare(TrackedEntry x, TrackedEntry y) {
        return compareValues(getCurrentValue(x), getCurrentValue(y));
    }

    /**
     * Compares two values read by {@link #getCurrentValue(TrackedEntry)}.
     *
     * @param x first value
     * @param y second value
     * @return comparison result
     */
    protected int compareValues(Object x, Object y) {
        return underlyingComparator.compare(x, y);
    }

    /**
     * Compared property.
     *
     * @return property
     */
    public PropertyBase getProperty() {
        return property;
    }
}
