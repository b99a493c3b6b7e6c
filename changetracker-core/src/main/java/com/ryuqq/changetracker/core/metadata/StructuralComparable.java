package com.ryuqq.changetracker.core.metadata;

import java.util.Comparator;

/**
 * Element-wise comparison capability for sequence-like value types.
 *
 * <p>Arrays are structurally comparable without implementing this interface.
 * Value types that wrap a sequence implement it to be ordered element by element
 * instead of as a whole value.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public interface StructuralComparable {

    /**
     * Compares this value with another, element by element.
     *
     * @param other the other value, may be {@code null}
     * @param elementComparator comparator for individual elements
     * @return negative, zero or positive as this value sorts before, with or after {@code other}
     * @throws IllegalArgumentException if {@code other} is not of a compatible type
     */
    int compareTo(Object other, Comparator<Object> elementComparator);
}
