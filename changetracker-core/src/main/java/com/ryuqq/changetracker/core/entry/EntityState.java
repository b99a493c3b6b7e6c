package com.ryuqq.changetracker.core.entry;

/**
 * Tracking state of an entity instance.
 *
 * <p><strong>전이:</strong></p>
 * <ul>
 *   <li>ADDED → UNCHANGED (acceptChanges)</li>
 *   <li>UNCHANGED → MODIFIED (값 변경)</li>
 *   <li>MODIFIED → UNCHANGED (acceptChanges)</li>
 *   <li>DELETED → DETACHED (acceptChanges)</li>
 * </ul>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public enum EntityState {

    /**
     * Not tracked.
     */
    DETACHED,

    /**
     * Tracked and unchanged since it was attached or last saved.
     */
    UNCHANGED,

    /**
     * Tracked and marked for deletion.
     */
    DELETED,

    /**
     * Tracked with at least one modified property.
     */
    MODIFIED,

    /**
     * Tracked and not yet saved.
     */
    ADDED;

    /**
     * Whether the state is one of the four tracked states.
     *
     * @return {@code false} only for {@link #DETACHED}
     */
    public boolean isTracked() {
        return this != DETACHED;
    }

    /**
     * Whether this state is selected by the given state flags.
     *
     * @param added include ADDED
     * @param modified include MODIFIED
     * @param deleted include DELETED
     * @param unchanged include UNCHANGED
     * @return {@code true} if selected
     */
    public boolean matches(boolean added, boolean modified, boolean deleted, boolean unchanged) {
        return switch (this) {
            case ADDED -> added;
            case MODIFIED -> modified;
            case DELETED -> deleted;
            case UNCHANGED -> unchanged;
            case DETACHED -> false;
        };
    }
}
