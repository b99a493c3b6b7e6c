package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.PropertyBase;
import com.ryuqq.changetracker.core.metadata.ValueConverter;

/**
 * {@link CurrentValueComparator} over provider values.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public class ConvertedCurrentValueComparator extends CurrentValueComparator {

    private final ValueConverter<?, ?> converter;

    /**
     * 생성자.
     *
     * @param property property whose values are compared
     * @param converter converter applied before comparison
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ConvertedCurrentValueComparator(PropertyBase property, ValueConverter<?, ?> converter) {
        super(property);
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
        this.converter = converter;
    }

    @Override
    public Object getCurrentValue(TrackedEntry entry) {
        return converter.convertToProvider(super.getCurrentValue(entry));
    }
}
