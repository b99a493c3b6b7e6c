package com.ryuqq.changetracker.core.metadata;

/**
 * Store type mapping of a property.
 *
 * @param storeType store type name (예: {@code int}, {@code varbinary(max)})
 * @param converter converter applied by the mapping, {@code null} when values are stored as-is
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public record TypeMapping(String storeType, ValueConverter<?, ?> converter) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException storeType이 null이거나 빈 문자열인 경우
     */
    public TypeMapping {
        if (storeType == null || storeType.isBlank()) {
            throw new IllegalArgumentException("storeType cannot be null or blank");
        }
        // converter는 null 허용
    }

    /**
     * converter 없는 TypeMapping 생성.
     *
     * @param storeType store type name
     * @return TypeMapping 인스턴스
     */
    public static TypeMapping of(String storeType) {
        return new TypeMapping(storeType, null);
    }

    /**
     * converter를 포함한 TypeMapping 생성.
     *
     * @param storeType store type name
     * @param converter converter
     * @return TypeMapping 인스턴스
     */
    public static TypeMapping of(String storeType, ValueConverter<?, ?> converter) {
        return new TypeMapping(storeType, converter);
    }
}
