package com.ryuqq.changetracker.core.compare;

import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.fixture.SampleKeys.PlainKey;
import com.ryuqq.changetracker.core.fixture.TestEntityType;
import com.ryuqq.changetracker.core.fixture.TestProperty;
import com.ryuqq.changetracker.core.metadata.PropertyBase;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CurrentValueComparatorCache 테스트.
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
class CurrentValueComparatorCacheTest {

    @Test
    void getComparator_SameProperty_ReturnsSameInstance() {
        // Given
        CurrentValueComparatorCache cache = new CurrentValueComparatorCache();
        TestProperty id = TestProperty.of("Id", long.class);
        TestEntityType.named("Order").with(id);

        // When
        Comparator<TrackedEntry> first = cache.getComparator(id);
        Comparator<TrackedEntry> second = cache.getComparator(id);

        // Then
        assertThat(second).isSameAs(first);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void getComparator_DifferentProperties_CachesEach() {
        // Given
        CurrentValueComparatorCache cache = new CurrentValueComparatorCache();
        TestProperty id = TestProperty.of("Id", int.class);
        TestProperty name = TestProperty.of("Name", String.class);
        TestEntityType.named("Customer").with(id).with(name);

        // When
        cache.getComparator(id);
        cache.getComparator(name);

        // Then
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void getComparator_UnsupportedType_CachesNothing() {
        // Given
        CurrentValueComparatorCache cache = new CurrentValueComparatorCache();
        TestProperty id = TestProperty.of("Id", PlainKey.class);

        // When & Then
        assertThatThrownBy(() -> cache.getComparator(id)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> cache.getComparator(id)).isInstanceOf(IllegalStateException.class);
        assertThat(cache.size()).isZero();
    }

    @Test
    void getComparator_ConcurrentFirstAccess_CreatesOnce() throws Exception {
        // Given
        AtomicInteger creations = new AtomicInteger();
        CurrentValueComparatorFactory countingFactory = new CurrentValueComparatorFactory() {
            @Override
            public Comparator<TrackedEntry> create(PropertyBase propertyBase) {
                creations.incrementAndGet();
                return super.create(propertyBase);
            }
        };
        CurrentValueComparatorCache cache = new CurrentValueComparatorCache(countingFactory);
        TestProperty id = TestProperty.of("Id", int.class);
        TestEntityType.named("Order").with(id);

        int threadCount = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Comparator<TrackedEntry>>> results = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < threadCount; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return cache.getComparator(id);
                }));
            }
            start.countDown();

            // Then
            Comparator<TrackedEntry> expected = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Comparator<TrackedEntry>> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(expected);
            }
            assertThat(creations.get()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void constructor_NullFactory_ThrowsException() {
        assertThatThrownBy(() -> new CurrentValueComparatorCache(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("factory cannot be null");
    }

    @Test
    void getComparator_NullProperty_ThrowsException() {
        assertThatThrownBy(() -> new CurrentValueComparatorCache().getComparator(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
