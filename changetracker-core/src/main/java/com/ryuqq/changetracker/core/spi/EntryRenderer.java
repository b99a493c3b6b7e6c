package com.ryuqq.changetracker.core.spi;

import com.ryuqq.changetracker.core.debug.DebugStringOptions;
import com.ryuqq.changetracker.core.entry.TrackedEntry;

/**
 * Renders one tracked entry for debug output.
 *
 * <p>The rendering may span several lines but must not end with a line separator.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntryRenderer {

    /**
     * Renders an entry.
     *
     * @param entry tracked entry
     * @param options rendering options
     * @return human-readable rendering
     */
    String toDebugString(TrackedEntry entry, DebugStringOptions options);
}
