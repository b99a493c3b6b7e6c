package com.ryuqq.changetracker.core.debug;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.spi.EntryRenderer;
import com.ryuqq.changetracker.core.spi.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic ordering and rendering of tracked entries for diagnostics.
 *
 * <p>Produces the same output for the same entry contents on every run and machine,
 * so debug dumps can be diffed and used as test fixtures.</p>
 *
 * <p><strong>처리 흐름 (toDebugString):</strong></p>
 * <pre>
 * 1. stateManager.getEntries() → 모든 tracked entry
 * 2. toDebugOrder() → EntityEntryComparator로 안정 정렬
 * 3. entry마다 EntryRenderer.toDebugString() + '\n'
 * </pre>
 *
 * <p><strong>Stability:</strong> {@link List#sort} is stable, so entries that compare equal
 * (keyless types, non-comparable keys, equal keys) keep their input order.</p>
 *
 * <p>Never fails because a key type cannot be ordered; such key properties are skipped.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class EntryOrderingService {

    private static final Logger log = LoggerFactory.getLogger(EntryOrderingService.class);

    private final EntryRenderer renderer;

    /**
     * 생성자.
     *
     * @param renderer entry renderer
     * @throws IllegalArgumentException renderer가 null인 경우
     */
    public EntryOrderingService(EntryRenderer renderer) {
        if (renderer == null) {
            throw new IllegalArgumentException("renderer cannot be null");
        }
        this.renderer = renderer;
    }

    /**
     * Sorts entries into debug order.
     *
     * @param entries entries to order; not modified
     * @return new immutable list in debug order
     * @throws IllegalArgumentException if entries is null
     */
    public List<TrackedEntry> toDebugOrder(Iterable<? extends TrackedEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }

        List<TrackedEntry> ordered = new ArrayList<>();
        for (TrackedEntry entry : entries) {
            ordered.add(entry);
        }
        ordered.sort(EntityEntryComparator.INSTANCE);

        log.debug("Ordered {} entries for debug output", ordered.size());
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Renders all tracked entries of a state manager, one block per entry in debug order.
     *
     * @param stateManager state manager
     * @param options rendering options
     * @return rendered entries, each terminated by {@code '\n'}; empty when nothing is tracked
     * @throws IllegalArgumentException if an argument is null
     */
    public String toDebugString(StateManager stateManager, DebugStringOptions options) {
        if (stateManager == null) {
            throw new IllegalArgumentException("stateManager cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        StringBuilder builder = new StringBuilder();
        for (TrackedEntry entry : toDebugOrder(stateManager.getEntries())) {
            builder.append(renderer.toDebugString(entry, options)).append('\n');
        }
        return builder.toString();
    }
}
