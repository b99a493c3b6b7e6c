package com.ryuqq.changetracker.core.spi;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.Model;

/**
 * Change-tracking state manager SPI.
 *
 * <p>This interface exposes the tracked entries of a unit of work to the
 * diagnostic and comparison facilities of the core.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Only tracked entries (any state except DETACHED) are returned</li>
 *   <li>{@link #getCountForState} must agree with {@link #getEntriesForState} for the same flags</li>
 *   <li>Returned iterables are snapshots or weakly consistent; callers must not mutate entries while iterating</li>
 * </ul>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public interface StateManager {

    /**
     * Model of the tracked entities.
     *
     * @return the model
     */
    Model getModel();

    /**
     * All tracked entries.
     *
     * @return tracked entries in tracking order
     */
    Iterable<? extends TrackedEntry> getEntries();

    /**
     * Tracked entries in any of the selected states.
     *
     * @param added include ADDED entries
     * @param modified include MODIFIED entries
     * @param deleted include DELETED entries
     * @param unchanged include UNCHANGED entries
     * @return matching entries in tracking order (may be empty)
     */
    Iterable<? extends TrackedEntry> getEntriesForState(
        boolean added,
        boolean modified,
        boolean deleted,
        boolean unchanged
    );

    /**
     * Number of tracked entries in any of the selected states.
     *
     * @param added include ADDED entries
     * @param modified include MODIFIED entries
     * @param deleted include DELETED entries
     * @param unchanged include UNCHANGED entries
     * @return number of matching entries
     */
    int getCountForState(boolean added, boolean modified, boolean deleted, boolean unchanged);
}
