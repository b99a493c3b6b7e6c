package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.EntityType;
import com.ryuqq.changetracker.core.metadata.Property;
import com.ryuqq.changetracker.core.metadata.PropertyBase;
import com.ryuqq.changetracker.core.metadata.ValueConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Optional;

/**
 * Builds the comparator that orders tracked entries by the current value of one property.
 *
 * <p><strong>선택 흐름:</strong></p>
 * <pre>
 * 1. detect(property.valueType)
 *    GENERIC_COMPARABLE    → TypedCurrentValueComparator
 *    STRUCTURAL_COMPARABLE → StructuralCurrentValueComparator
 *    COMPARABLE            → CurrentValueComparator (Comparers.DEFAULT)
 * 2. 실패 시 converter가 있으면 detect(converter.providerType)
 *    GENERIC_COMPARABLE    → ConvertedTypedCurrentValueComparator
 *    STRUCTURAL_COMPARABLE → ConvertedStructuralCurrentValueComparator
 *    COMPARABLE            → ConvertedCurrentValueComparator
 * 3. 둘 다 실패 → IllegalStateException (모델 설정 오류)
 * </pre>
 *
 * <p>Creation is deterministic: the same property always yields the same comparator variant.
 * Callers normally go through {@link CurrentValueComparatorCache} instead of calling
 * {@link #create(PropertyBase)} per comparison.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public class CurrentValueComparatorFactory {

    private static final Logger log = LoggerFactory.getLogger(CurrentValueComparatorFactory.class);

    /**
     * Creates a comparator for the property.
     *
     * @param propertyBase property whose current values are compared
     * @return comparator over tracked entries
     * @throws IllegalArgumentException if propertyBase is null
     * @throws IllegalStateException if neither the value type nor the converter's provider type can be ordered
     */
    public Comparator<TrackedEntry> create(PropertyBase propertyBase) {
        if (propertyBase == null) {
            throw new IllegalArgumentException("propertyBase cannot be null");
        }

        Class<?> valueType = propertyBase.getValueType();
        Optional<ComparisonCapability> capability = ComparisonCapability.detect(valueType);
        if (capability.isPresent()) {
            log.debug("Creating {} comparator for {}", capability.get(), describe(propertyBase));
            return createForModelType(propertyBase, valueType, capability.get());
        }

        if (propertyBase instanceof Property) {
            ValueConverter<?, ?> converter = ((Property) propertyBase).findEffectiveConverter();
            if (converter != null) {
                Optional<ComparisonCapability> providerCapability =
                    ComparisonCapability.detect(converter.getProviderType());
                if (providerCapability.isPresent()) {
                    log.debug("Creating converted {} comparator for {} ({})",
                        providerCapability.get(), describe(propertyBase), converter);
                    return createForProviderType(propertyBase, converter, providerCapability.get());
                }
            }
        }

        throw new IllegalStateException(
            "Type not comparable: " + valueType.getName() + " (property " + describe(propertyBase) + ")"
        );
    }

    private static Comparator<TrackedEntry> createForModelType(
        PropertyBase propertyBase,
        Class<?> valueType,
        ComparisonCapability capability
    ) {
        switch (capability) {
            case GENERIC_COMPARABLE:
                return new TypedCurrentValueComparator<>(propertyBase, valueType);
            case STRUCTURAL_COMPARABLE:
                return new StructuralCurrentValueComparator(propertyBase);
            case COMPARABLE:
                return new CurrentValueComparator(propertyBase);
            default:
                throw new IllegalStateException("Unknown capability: " + capability);
        }
    }

    private static Comparator<TrackedEntry> createForProviderType(
        PropertyBase propertyBase,
        ValueConverter<?, ?> converter,
        ComparisonCapability capability
    ) {
        switch (capability) {
            case GENERIC_COMPARABLE:
                return new ConvertedTypedCurrentValueComparator<>(propertyBase, converter);
            case STRUCTURAL_COMPARABLE:
                return new ConvertedStructuralCurrentValueComparator(propertyBase, converter);
            case COMPARABLE:
                return new ConvertedCurrentValueComparator(propertyBase, converter);
            default:
                throw new IllegalStateException("Unknown capability: " + capability);
        }
    }

    static String describe(PropertyBase propertyBase) {
        EntityType declaringType = propertyBase.getDeclaringEntityType();
        return declaringType == null
            ? propertyBase.getName()
            : declaringType.getName() + "." + propertyBase.getName();
    }
}
