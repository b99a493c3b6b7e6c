package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.metadata.StructuralComparable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Comparison capability of a value type, in selection priority order.
 *
 * <p>Detection inspects the type once; the resulting capability decides which
 * comparator variant {@link CurrentValueComparatorFactory} builds.</p>
 *
 * <p><strong>Detection order:</strong></p>
 * <ol>
 *   <li>{@link #GENERIC_COMPARABLE} - enum, or {@code Comparable<Self>} after boxing primitives</li>
 *   <li>{@link #STRUCTURAL_COMPARABLE} - array type or {@link StructuralComparable}</li>
 *   <li>{@link #COMPARABLE} - any other {@link Comparable}</li>
 * </ol>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public enum ComparisonCapability {

    /**
     * Type is ordered against its own type.
     */
    GENERIC_COMPARABLE,

    /**
     * Type is a sequence compared element by element.
     */
    STRUCTURAL_COMPARABLE,

    /**
     * Type is comparable, but not against exactly its own type.
     */
    COMPARABLE;

    /**
     * Detects the capability of a declared value type.
     *
     * @param type declared value type, primitives allowed
     * @return the highest-priority capability, or empty if the type cannot be ordered
     * @throws IllegalArgumentException if type is null
     */
    public static Optional<ComparisonCapability> detect(Class<?> type) {
        Class<?> boxed = ValueTypes.wrap(type);
        if (isGenericComparable(boxed)) {
            return Optional.of(GENERIC_COMPARABLE);
        }
        if (boxed.isArray() || StructuralComparable.class.isAssignableFrom(boxed)) {
            return Optional.of(STRUCTURAL_COMPARABLE);
        }
        if (Comparable.class.isAssignableFrom(boxed)) {
            return Optional.of(COMPARABLE);
        }
        return Optional.empty();
    }

    private static boolean isGenericComparable(Class<?> type) {
        if (Enum.class.isAssignableFrom(type)) {
            return true;
        }
        Type argument = findComparableArgument(type, Map.of());
        return argument != null && rawClass(argument) == type;
    }

    /**
     * Walks the generic supertypes of {@code type} and returns the type argument of the
     * first {@code Comparable} found, with type variables bound along the way.
     */
    private static Type findComparableArgument(Type type, Map<TypeVariable<?>, Type> bindings) {
        Class<?> raw;
        Map<TypeVariable<?>, Type> local;
        if (type instanceof ParameterizedType) {
            ParameterizedType parameterized = (ParameterizedType) type;
            raw = (Class<?>) parameterized.getRawType();
            Type[] arguments = parameterized.getActualTypeArguments();
            if (raw == Comparable.class) {
                return bind(arguments[0], bindings);
            }
            TypeVariable<?>[] parameters = raw.getTypeParameters();
            local = new HashMap<>();
            for (int i = 0; i < parameters.length; i++) {
                local.put(parameters[i], bind(arguments[i], bindings));
            }
        } else if (type instanceof Class) {
            raw = (Class<?>) type;
            if (raw == Comparable.class) {
                // raw Comparable
                return Object.class;
            }
            local = Map.of();
        } else {
            return null;
        }

        for (Type supertype : raw.getGenericInterfaces()) {
            Type argument = findComparableArgument(supertype, local);
            if (argument != null) {
                return argument;
            }
        }
        Type superclass = raw.getGenericSuperclass();
        return superclass == null ? null : findComparableArgument(superclass, local);
    }

    private static Type bind(Type type, Map<TypeVariable<?>, Type> bindings) {
        if (type instanceof TypeVariable) {
            Type bound = bindings.get(type);
            return bound == null ? type : bound;
        }
        return type;
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        return null;
    }
}
