package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.PropertyBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model cache of current-value comparators.
 *
 * <p>Each property gets exactly one comparator for the lifetime of the owning model.
 * Concurrent first access from several threads constructs the comparator once
 * ({@link ConcurrentHashMap#computeIfAbsent}); a failed construction caches nothing and
 * the next access fails the same way.</p>
 *
 * <p><strong>Thread-safe:</strong> comparators are immutable and may be shared across threads.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class CurrentValueComparatorCache {

    private static final Logger log = LoggerFactory.getLogger(CurrentValueComparatorCache.class);

    private final CurrentValueComparatorFactory factory;
    private final ConcurrentHashMap<PropertyBase, Comparator<TrackedEntry>> comparators;

    /**
     * Creates a cache backed by a default {@link CurrentValueComparatorFactory}.
     */
    public CurrentValueComparatorCache() {
        this(new CurrentValueComparatorFactory());
    }

    /**
     * Creates a cache backed by the given factory.
     *
     * @param factory comparator factory
     * @throws IllegalArgumentException if factory is null
     */
    public CurrentValueComparatorCache(CurrentValueComparatorFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.factory = factory;
        this.comparators = new ConcurrentHashMap<>();
    }

    /**
     * Returns the comparator for a property, creating it on first use.
     *
     * @param property property whose current values are compared
     * @return cached comparator
     * @throws IllegalArgumentException if property is null
     * @throws IllegalStateException if the property's type cannot be ordered
     */
    public Comparator<TrackedEntry> getComparator(PropertyBase property) {
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        return comparators.computeIfAbsent(property, this::createComparator);
    }

    /**
     * Number of cached comparators.
     *
     * @return cache size
     */
    public int size() {
        return comparators.size();
    }

    private Comparator<TrackedEntry> createComparator(PropertyBase property) {
        Comparator<TrackedEntry> comparator = factory.create(property);
        log.debug("Cached {} for {}",
            comparator.getClass().getSimpleName(), CurrentValueComparatorFactory.describe(property));
        return comparator;
    }
}
