package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.metadata.PropertyBase;

/**
 * Compares current values element by element using {@link Comparers#STRUCTURAL}.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public class StructuralCurrentValueComparator extends CurrentValueComparator {

    /**
     * 생성자.
     *
     * @param property property whose values are compared
     * @throws IllegalArgumentException property가 null인 경우
     */
    public StructuralCurrentValueComparator(PropertyBase property) {
        super(property, Comparers.STRUCTURAL);
    }
}
