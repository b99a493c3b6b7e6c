package com.ryuqq.changetracker.adapter.inmemory.tracking;

import com.ryuqq.changetracker.adapter.inmemory.model.InMemoryEntityType;
import com.ryuqq.changetracker.adapter.inmemory.model.InMemoryModel;
import com.ryuqq.changetracker.core.compare.CurrentValueComparatorCache;
import com.ryuqq.changetracker.core.entry.EntityState;
import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.spi.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link StateManager} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ConcurrentSkipListMap&lt;Long, InMemoryTrackedEntry&gt; - entries keyed by
 *       tracking sequence, iterated in tracking order</li>
 *   <li><strong>sequence:</strong> AtomicLong - next tracking id</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryStateManager stateManager = new InMemoryStateManager(model);
 * stateManager.attach("Order", Map.of("Id", 3));
 * stateManager.add("Order", Map.of("Id", 1));
 *
 * List&lt;TrackedEntry&gt; added = StateManagers.toListForState(stateManager, true, false, false, false);
 * </pre>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No identity resolution: two entries with the same key may be tracked</li>
 *   <li>No relationship fix-up or cascading</li>
 * </ul>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public class InMemoryStateManager implements StateManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateManager.class);

    private final InMemoryModel model;
    private final AtomicLong sequence;
    private final ConcurrentSkipListMap<Long, InMemoryTrackedEntry> entries;

    /**
     * Creates an empty state manager.
     *
     * @param model model of the tracked entities
     * @throws IllegalArgumentException if model is null
     */
    public InMemoryStateManager(InMemoryModel model) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        this.model = model;
        this.sequence = new AtomicLong();
        this.entries = new ConcurrentSkipListMap<>();
    }

    /**
     * Starts tracking a new entity instance.
     *
     * @param entityTypeName entity type name
     * @param values property values by name; omitted properties are null
     * @param entityState initial state, must not be DETACHED
     * @return the new entry
     * @throws IllegalArgumentException if the entity type or a property is unknown, a value is invalid,
     *                                  or the state is DETACHED
     */
    public InMemoryTrackedEntry startTracking(String entityTypeName, Map<String, ?> values, EntityState entityState) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (entityState == null || !entityState.isTracked()) {
            throw new IllegalArgumentException("entityState must be a tracked state (current: " + entityState + ")");
        }
        InMemoryEntityType entityType = model.getEntityType(entityTypeName);

        long trackingId = sequence.incrementAndGet();
        InMemoryTrackedEntry entry = new InMemoryTrackedEntry(trackingId, entityType, values, entityState);
        entries.put(trackingId, entry);

        log.debug("Tracking {}", entry);
        return entry;
    }

    /**
     * Tracks a new entity instance as ADDED.
     *
     * @param entityTypeName entity type name
     * @param values property values by name
     * @return the new entry
     */
    public InMemoryTrackedEntry add(String entityTypeName, Map<String, ?> values) {
        return startTracking(entityTypeName, values, EntityState.ADDED);
    }

    /**
     * Tracks an existing entity instance as UNCHANGED.
     *
     * @param entityTypeName entity type name
     * @param values property values by name
     * @return the new entry
     */
    public InMemoryTrackedEntry attach(String entityTypeName, Map<String, ?> values) {
        return startTracking(entityTypeName, values, EntityState.UNCHANGED);
    }

    /**
     * Marks an entry for deletion. An ADDED entry is detached immediately.
     *
     * @param entry tracked entry of this state manager
     * @throws IllegalArgumentException if the entry is not tracked by this state manager
     */
    public void remove(InMemoryTrackedEntry entry) {
        requireTracked(entry);
        if (entry.getEntityState() == EntityState.ADDED) {
            detach(entry);
        } else {
            entry.setEntityState(EntityState.DELETED);
        }
    }

    /**
     * Accepts changes of all entries and stops tracking deleted ones.
     */
    public void acceptAllChanges() {
        int detached = 0;
        for (InMemoryTrackedEntry entry : new ArrayList<>(entries.values())) {
            entry.acceptChanges();
            if (entry.getEntityState() == EntityState.DETACHED) {
                entries.remove(entry.getTrackingId());
                detached++;
            }
        }
        log.debug("Accepted all changes: {} tracked, {} detached", entries.size(), detached);
    }

    /**
     * Entries of one entity type ordered by current property values.
     *
     * <p>Uses the model's cached comparators, converters included.</p>
     *
     * @param entityTypeName entity type name
     * @param propertyNames properties to order by, most significant first
     * @return new immutable list of entries
     * @throws IllegalArgumentException if the entity type or a property is unknown, or no property is given
     * @throws IllegalStateException if a property type cannot be ordered
     */
    public List<TrackedEntry> getEntriesOrderedBy(String entityTypeName, String... propertyNames) {
        if (propertyNames == null || propertyNames.length == 0) {
            throw new IllegalArgumentException("at least one property is required");
        }
        InMemoryEntityType entityType = model.getEntityType(entityTypeName);

        CurrentValueComparatorCache comparators = model.getCurrentValueComparators();
        Comparator<TrackedEntry> comparator = comparators.getComparator(entityType.getProperty(propertyNames[0]));
        for (int i = 1; i < propertyNames.length; i++) {
            comparator = comparator.thenComparing(comparators.getComparator(entityType.getProperty(propertyNames[i])));
        }

        List<TrackedEntry> ordered = new ArrayList<>();
        for (InMemoryTrackedEntry entry : entries.values()) {
            if (entry.getEntityType() == entityType) {
                ordered.add(entry);
            }
        }
        ordered.sort(comparator);
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Stops tracking all entries.
     */
    public void clear() {
        for (InMemoryTrackedEntry entry : entries.values()) {
            entry.setEntityState(EntityState.DETACHED);
        }
        entries.clear();
    }

    @Override
    public InMemoryModel getModel() {
        return model;
    }

    @Override
    public Iterable<InMemoryTrackedEntry> getEntries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    @Override
    public Iterable<InMemoryTrackedEntry> getEntriesForState(
        boolean added,
        boolean modified,
        boolean deleted,
        boolean unchanged
    ) {
        List<InMemoryTrackedEntry> matching = new ArrayList<>();
        for (InMemoryTrackedEntry entry : entries.values()) {
            if (entry.getEntityState().matches(added, modified, deleted, unchanged)) {
                matching.add(entry);
            }
        }
        return Collections.unmodifiableList(matching);
    }

    @Override
    public int getCountForState(boolean added, boolean modified, boolean deleted, boolean unchanged) {
        int count = 0;
        for (InMemoryTrackedEntry entry : entries.values()) {
            if (entry.getEntityState().matches(added, modified, deleted, unchanged)) {
                count++;
            }
        }
        return count;
    }

    private void detach(InMemoryTrackedEntry entry) {
        entries.remove(entry.getTrackingId());
        entry.setEntityState(EntityState.DETACHED);
    }

    private void requireTracked(InMemoryTrackedEntry entry) {
        if (entry == null || entries.get(entry.getTrackingId()) != entry) {
            throw new IllegalArgumentException("Entry is not tracked by this state manager: " + entry);
        }
    }
}
