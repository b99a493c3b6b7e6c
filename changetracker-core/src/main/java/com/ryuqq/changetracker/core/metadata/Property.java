package com.ryuqq.changetracker.core.metadata;

/**
 * Scalar property of an entity type.
 *
 * <p>A property may map its model value to a store value in two ways:</p>
 * <ul>
 *   <li>a converter configured directly on the property ({@link #getValueConverter()})</li>
 *   <li>a converter supplied by the store type mapping ({@link #getTypeMapping()})</li>
 * </ul>
 *
 * <p>The property's own converter takes precedence.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public interface Property extends PropertyBase {

    /**
     * Converter configured on this property.
     *
     * @return the converter, or {@code null} if none was configured
     */
    ValueConverter<?, ?> getValueConverter();

    /**
     * Store type mapping of this property.
     *
     * @return the type mapping, or {@code null} if the property is not mapped yet
     */
    TypeMapping getTypeMapping();

    /**
     * Whether the property accepts {@code null}.
     *
     * @return {@code true} if null values are allowed
     */
    boolean isNullable();

    /**
     * Resolves the converter used for this property: the configured one first,
     * then the one from the type mapping.
     *
     * @return the effective converter, or {@code null}
     */
    default ValueConverter<?, ?> findEffectiveConverter() {
        ValueConverter<?, ?> converter = getValueConverter();
        if (converter != null) {
            return converter;
        }
        TypeMapping mapping = getTypeMapping();
        return mapping == null ? null : mapping.converter();
    }
}
