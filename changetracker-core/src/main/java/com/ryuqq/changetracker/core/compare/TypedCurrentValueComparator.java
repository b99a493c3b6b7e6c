package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.PropertyBase;

import java.util.Comparator;

/**
 * Compares current values with the natural ordering of their own type.
 *
 * <p>Used for {@link ComparisonCapability#GENERIC_COMPARABLE} types. Values are cast to the
 * boxed value type, so an entry returning a value of another type fails fast.
 * {@code null} sorts first.</p>
 *
 * @param <T> boxed value type
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class TypedCurrentValueComparator<T> implements Comparator<TrackedEntry> {

    private final PropertyBase property;
    private final Class<T> valueType;
    private final Comparator<T> underlyingComparator;

    /**
     * 생성자.
     *
     * @param property property whose values are compared
     * @param valueType value type, must be naturally ordered against itself
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TypedCurrentValueComparator(PropertyBase property, Class<T> valueType) {
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        if (valueType == null) {
            throw new IllegalArgumentException("valueType cannot be null");
        }
        this.property = property;
        this.valueType = ValueTypes.wrap(valueType);
        this.underlyingComparator = naturalOrderNullsFirst();
    }

    @Override
    public int compare(TrackedEntry x, TrackedEntry y) {
        return underlyingComparator.compare(
            valueType.cast(x.getCurrentValue(property)),
            valueType.cast(y.getCurrentValue(property))
        );
    }

    /**
     * Compared property.
     *
     * @return property
     */
    public PropertyBase getProperty() {
        return property;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static <T> Comparator<T> naturalOrderNullsFirst() {
        Comparator natural = Comparator.naturalOrder();
        return Comparator.nullsFirst(natural);
    }
}
