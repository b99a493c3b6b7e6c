package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.PropertyBase;
import com.ryuqq.changetracker.core.metadata.ValueConverter;

import java.util.Comparator;

/**
 * Converts current values to their provider type, then compares them with the
 * provider type's natural ordering.
 *
 * <p>Converter failures propagate unchanged.</p>
 *
 * @param <M> model type
 * @param <P> provider type
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class ConvertedTypedCurrentValueComparator<M, P> implements Comparator<TrackedEntry> {

    private final PropertyBase property;
    private final ValueConverter<M, P> converter;
    private final Class<P> providerType;
    private final Comparator<P> underlyingComparator;

    /**
     * 생성자.
     *
     * @param property property whose values are compared
     * @param converter converter whose provider type is naturally ordered against itself
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ConvertedTypedCurrentValueComparator(PropertyBase property, ValueConverter<M, P> converter) {
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
        this.property = property;
        this.converter = converter;
        this.providerType = ValueTypes.wrap(converter.getProviderType());
        this.underlyingComparator = TypedCurrentValueComparator.naturalOrderNullsFirst();
    }

    @Override
    public int compare(TrackedEntry x, TrackedEntry y) {
        return underlyingComparator.compare(getProviderValue(x), getProviderValue(y));
    }

    /**
     * Current value of the property, converted to the provider type.
     *
     * @param entry tracked entry
     * @return provider value, {@code null} for a {@code null} model value
     */
    public P getProviderValue(TrackedEntry entry) {
        return providerType.cast(converter.convertToProvider(entry.getCurrentValue(property)));
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
