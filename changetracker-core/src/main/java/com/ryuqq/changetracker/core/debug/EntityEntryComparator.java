package com.ryuqq.changetracker.core.debug;

import com.ryuqq.changetracker.core.compare.Comparers;
import com.ryuqq.changetracker.core.compare.ValueTypes;
import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.Key;
import com.ryuqq.changetracker.core.metadata.Property;

import java.util.Comparator;

/**
 * Total order over heterogeneous tracked entries for debug output.
 *
 * <p><strong>정렬 기준:</strong></p>
 * <ol>
 *   <li>entity type 이름 (ordinal, 대소문자 구분, locale 무관)</li>
 *   <li>primary key property 선언 순서대로 현재 값 비교 ({@link Comparers#DEFAULT})</li>
 * </ol>
 *
 * <p>Key properties whose type is not {@link Comparable} are skipped, never rejected.
 * Keyless entity types and entries whose comparable key values all tie compare as equal.</p>
 *
 * <p>Unlike the comparators built by the factory this ordering ignores value converters.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class EntityEntryComparator implements Comparator<TrackedEntry> {

    /**
     * Shared instance; the comparator is stateless.
     */
    public static final EntityEntryComparator INSTANCE = new EntityEntryComparator();

    private EntityEntryComparator() {
    }

    @Override
    public int compare(TrackedEntry x, TrackedEntry y) {
        int result = x.getEntityType().getName().compareTo(y.getEntityType().getName());
        if (result != 0) {
            return result;
        }

        Key primaryKey = x.getEntityType().findPrimaryKey();
        if (primaryKey != null) {
            for (Property keyProperty : primaryKey.getProperties()) {
                if (Comparable.class.isAssignableFrom(ValueTypes.wrap(keyProperty.getValueType()))) {
                    result = Comparers.DEFAULT.compare(
                        x.getCurrentValue(keyProperty),
                        y.getCurrentValue(keyProperty)
                    );
                    if (result != 0) {
                        return result;
                    }
                }
            }
        }

        return 0;
    }
}
