package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.metadata.StructuralComparable;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Loosely-typed value comparators shared by the current-value comparators.
 *
 * <p><strong>DEFAULT:</strong></p>
 * <ul>
 *   <li>{@code null} sorts before every non-null value, two nulls are equal</li>
 *   <li>otherwise delegates to {@link Comparable#compareTo(Object)} of whichever operand is comparable</li>
 *   <li>fails with {@link IllegalArgumentException} when neither operand is comparable</li>
 * </ul>
 *
 * <p><strong>STRUCTURAL:</strong></p>
 * <ul>
 *   <li>{@link StructuralComparable} values compare themselves element by element</li>
 *   <li>arrays compare element by element, {@code byte} elements as unsigned values</li>
 *   <li>the first unequal element decides; only when the overlapping range ties does the
 *       shorter sequence sort first</li>
 *   <li>anything else falls back to DEFAULT</li>
 * </ul>
 *
 * <pre>
 * STRUCTURAL.compare(new byte[] {1, 2}, new byte[] {1, 2, 3})  // &lt; 0
 * STRUCTURAL.compare(new byte[] {2}, new byte[] {1, 9, 9})     // &gt; 0
 * </pre>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class Comparers {

    /**
     * Default general comparer over loosely-typed values.
     */
    public static final Comparator<Object> DEFAULT = Comparers::compareDefault;

    /**
     * Element-wise comparer for arrays and {@link StructuralComparable} values.
     */
    public static final Comparator<Object> STRUCTURAL = Comparers::compareStructural;

    // Utility class - prevent instantiation
    private Comparers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareDefault(Object x, Object y) {
        if (x == y) {
            return 0;
        }
        if (x == null) {
            return -1;
        }
        if (y == null) {
            return 1;
        }
        if (x instanceof Comparable) {
            return ((Comparable) x).compareTo(y);
        }
        if (y instanceof Comparable) {
            return -Integer.signum(((Comparable) y).compareTo(x));
        }
        throw new IllegalArgumentException(
            "At least one value must implement Comparable (x: " + x.getClass().getName()
                + ", y: " + y.getClass().getName() + ")"
        );
    }

    private static int compareStructural(Object x, Object y) {
        if (x == y) {
            return 0;
        }
        if (x == null) {
            return -1;
        }
        if (y == null) {
            return 1;
        }
        if (x instanceof StructuralComparable) {
            return ((StructuralComparable) x).compareTo(y, STRUCTURAL);
        }
        if (y instanceof StructuralComparable) {
            return -Integer.signum(((StructuralComparable) y).compareTo(x, STRUCTURAL));
        }
        if (x.getClass().isArray() && y.getClass().isArray()) {
            return compareArrays(x, y);
        }
        return compareDefault(x, y);
    }

    private static int compareArrays(Object x, Object y) {
        if (x instanceof byte[] && y instanceof byte[]) {
            return Arrays.compareUnsigned((byte[]) x, (byte[]) y);
        }

        Class<?> xComponent = x.getClass().getComponentType();
        Class<?> yComponent = y.getClass().getComponentType();
        if ((xComponent.isPrimitive() || yComponent.isPrimitive()) && xComponent != yComponent) {
            throw new IllegalArgumentException(
                "Cannot compare arrays of different element types: "
                    + xComponent.getName() + "[] and " + yComponent.getName() + "[]"
            );
        }

        int xLength = Array.getLength(x);
        int yLength = Array.getLength(y);
        int overlap = Math.min(xLength, yLength);
        for (int i = 0; i < overlap; i++) {
            int result = compareStructural(Array.get(x, i), Array.get(y, i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(xLength, yLength);
    }
}
