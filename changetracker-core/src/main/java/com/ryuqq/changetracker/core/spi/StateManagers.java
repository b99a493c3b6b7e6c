package com.ryuqq.changetracker.core.spi;

import com.ryuqq.changetracker.core.entry.TrackedEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link StateManager} 편의 메서드.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class StateManagers {

    // Utility class - prevent instantiation
    private StateManagers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 선택한 상태의 entry 목록을 복사.
     *
     * @param stateManager state manager
     * @param added ADDED 포함 여부
     * @param modified MODIFIED 포함 여부
     * @param deleted DELETED 포함 여부
     * @param unchanged UNCHANGED 포함 여부
     * @return 불변 목록 (tracking 순서)
     * @throws IllegalArgumentException stateManager가 null인 경우
     */
    public static List<TrackedEntry> toListForState(
        StateManager stateManager,
        boolean added,
        boolean modified,
        boolean deleted,
        boolean unchanged
    ) {
        if (stateManager == null) {
            throw new IllegalArgumentException("stateManager cannot be null");
        }

        List<TrackedEntry> list = new ArrayList<>(
            stateManager.getCountForState(added, modified, deleted, unchanged)
        );
        for (TrackedEntry entry : stateManager.getEntriesForState(added, modified, deleted, unchanged)) {
            list.add(entry);
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * 모든 tracked entry 목록을 복사.
     *
     * @param stateManager state manager
     * @return 불변 목록 (tracking 순서)
     * @throws IllegalArgumentException stateManager가 null인 경우
     */
    public static List<TrackedEntry> toList(StateManager stateManager) {
        return toListForState(stateManager, true, true, true, true);
    }
}
