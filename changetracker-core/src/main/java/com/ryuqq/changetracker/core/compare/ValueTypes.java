package com.ryuqq.changetracker.core.compare;

import java.lang.invoke.MethodType;

/**
 * Helpers for declared value types.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class ValueTypes {

    // Utility class - prevent instantiation
    private ValueTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Returns the wrapper class of a primitive type, or the type itself.
     *
     * <p>{@code int.class → Integer.class}, {@code String.class → String.class}</p>
     *
     * @param type declared value type
     * @param <T> value type
     * @return wrapper class for primitives, otherwise {@code type}
     * @throws IllegalArgumentException if type is null
     */
    @SuppressWarnings("unchecked")
    public static <T> Class<T> wrap(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (!type.isPrimitive()) {
            return type;
        }
        return (Class<T>) MethodType.methodType(type).wrap().returnType();
    }
}
