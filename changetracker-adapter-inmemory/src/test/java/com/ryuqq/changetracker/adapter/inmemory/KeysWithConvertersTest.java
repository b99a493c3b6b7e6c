package com.ryuqq.changetracker.adapter.inmemory;

import com.ryuqq.changetracker.adapter.inmemory.KeyFixtures.BytesStructKey;
import com.ryuqq.changetracker.adapter.inmemory.KeyFixtures.ClassKey;
import com.ryuqq.changetracker.adapter.inmemory.KeyFixtures.ComparableIntStructKey;
import com.ryuqq.changetracker.adapter.inmemory.KeyFixtures.GenericComparableStructKey;
import com.ryuqq.changetracker.adapter.inmemory.KeyFixtures.StructKey;
import com.ryuqq.changetracker.adapter.inmemory.KeyFixtures.StructuralComparableStructKey;
import com.ryuqq.changetracker.adapter.inmemory.model.InMemoryModel;
import com.ryuqq.changetracker.adapter.inmemory.render.DefaultEntryRenderer;
import com.ryuqq.changetracker.adapter.inmemory.tracking.InMemoryStateManager;
import com.ryuqq.changetracker.core.debug.DebugStringOptions;
import com.ryuqq.changetracker.core.debug.EntryOrderingService;
import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.TypeMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Key 종류별 정렬 통합 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>비교 불가 key + converter (property / type mapping)</li>
 *   <li>Comparable, 제네릭 Comparable, StructuralComparable key</li>
 *   <li>byte[] key, byte[]로 변환되는 key</li>
 *   <li>복합 key</li>
 *   <li>debug 출력 순서</li>
 * </ul>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
class KeysWithConvertersTest {

    private InMemoryModel model;
    private InMemoryStateManager stateManager;

    @BeforeEach
    void setUp() {
        model = InMemoryModel.builder()
            .entityType("StructKeyEntity", e -> e
                .property("Id", StructKey.class, p -> p.hasConversion(KeyFixtures.STRUCT_KEY_TO_INT))
                .property("Name", String.class)
                .primaryKey("Id"))
            .entityType("ClassKeyEntity", e -> e
                .property("Id", ClassKey.class, p -> p.hasTypeMapping(TypeMapping.of("int", KeyFixtures.CLASS_KEY_TO_INT)))
                .property("Name", String.class)
                .primaryKey("Id"))
            .entityType("ComparableIntKeyEntity", e -> e
                .property("Id", ComparableIntStructKey.class)
                .property("Name", String.class)
                .primaryKey("Id"))
            .entityType("GenericComparableKeyEntity", e -> e
                .property("Id", GenericComparableStructKey.class)
                .property("Name", String.class)
                .primaryKey("Id"))
            .entityType("StructuralComparableKeyEntity", e -> e
                .property("Id", StructuralComparableStructKey.class)
                .property("Name", String.class)
                .primaryKey("Id"))
            .entityType("BytesKeyEntity", e -> e
                .property("Id", BytesStructKey.class, p -> p.hasConversion(KeyFixtures.BYTES_KEY_TO_BYTES))
                .property("Name", String.class)
                .primaryKey("Id"))
            .entityType("ByteArrayKeyEntity", e -> e
                .property("Id", byte[].class)
                .property("Name", String.class)
                .primaryKey("Id"))
            .entityType("CompositeKeyEntity", e -> e
                .property("Id1", StructKey.class, p -> p.hasConversion(KeyFixtures.STRUCT_KEY_TO_INT))
                .property("Id2", int.class)
                .property("Name", String.class)
                .primaryKey("Id1", "Id2"))
            .build();
        stateManager = new InMemoryStateManager(model);
    }

    // ==================== Model ====================

    @Test
    void build_CreatesComparatorForEveryKeyProperty() {
        assertThat(model.getCurrentValueComparators().size()).isEqualTo(9);
    }

    // ==================== Ordering per key kind ====================

    @Test
    void orderBy_StructKeyWithConverter_OrdersByProviderValue() {
        // Given
        track("StructKeyEntity", new StructKey(3), "c");
        track("StructKeyEntity", new StructKey(1), "a");
        track("StructKeyEntity", new StructKey(2), "b");

        // When & Then
        assertThat(names(stateManager.getEntriesOrderedBy("StructKeyEntity", "Id"))).containsExactly("a", "b", "c");
    }

    @Test
    void orderBy_ClassKeyWithTypeMappingConverter_OrdersByProviderValue() {
        // Given
        track("ClassKeyEntity", new ClassKey(20), "b");
        track("ClassKeyEntity", new ClassKey(-5), "a");
        track("ClassKeyEntity", new ClassKey(300), "c");

        // When & Then
        assertThat(names(stateManager.getEntriesOrderedBy("ClassKeyEntity", "Id"))).containsExactly("a", "b", "c");
    }

    @Test
    void orderBy_ComparableKey_OrdersByCompareTo() {
        // Given
        track("ComparableIntKeyEntity", new ComparableIntStructKey(2), "b");
        track("ComparableIntKeyEntity", new ComparableIntStructKey(3), "c");
        track("ComparableIntKeyEntity", new ComparableIntStructKey(1), "a");

        // When & Then
        assertThat(names(stateManager.getEntriesOrderedBy("ComparableIntKeyEntity", "Id")))
            .containsExactly("a", "b", "c");
    }

    @Test
    void orderBy_GenericComparableKey_OrdersByCompareTo() {
        // Given
        track("GenericComparableKeyEntity", new GenericComparableStructKey(9), "c");
        track("GenericComparableKeyEntity", new GenericComparableStructKey(0), "a");
        track("GenericComparableKeyEntity", new GenericComparableStructKey(4), "b");

        // When & Then
        assertThat(names(stateManager.getEntriesOrderedBy("GenericComparableKeyEntity", "Id")))
            .containsExactly("a", "b", "c");
    }

    @Test
    void orderBy_StructuralComparableKey_OrdersElementWise() {
        // Given
        track("StructuralComparableKeyEntity", new StructuralComparableStructKey(new byte[] {2}), "c");
        track("StructuralComparableKeyEntity", new StructuralComparableStructKey(new byte[] {1, 5}), "b");
        track("StructuralComparableKeyEntity", new StructuralComparableStructKey(new byte[] {1}), "a");

        // When & Then
        assertThat(names(stateManager.getEntriesOrderedBy("StructuralComparableKeyEntity", "Id")))
            .containsExactly("a", "b", "c");
    }

    @Test
    void orderBy_BytesKeyWithConverter_OrdersByConvertedBytes() {
        // Given
        track("BytesKeyEntity", new BytesStructKey(new byte[] {(byte) 0x80}), "c");
        track("BytesKeyEntity", new BytesStructKey(new byte[] {0x7F}), "b");
        track("BytesKeyEntity", new BytesStructKey(new byte[] {0x00, 0x7F}), "a");

        // When & Then
        assertThat(names(stateManager.getEntriesOrderedBy("BytesKeyEntity", "Id"))).containsExactly("a", "b", "c");
    }

    @Test
    void orderBy_ByteArrayKey_ShorterPrefixFirstAndUnsigned() {
        // Given
        track("ByteArrayKeyEntity", new byte[] {(byte) 0xFF}, "d");
        track("ByteArrayKeyEntity", new byte[] {1, 2}, "b");
        track("ByteArrayKeyEntity", new byte[] {1}, "a");
        track("ByteArrayKeyEntity", new byte[] {2}, "c");

        // When & Then
        assertThat(names(stateManager.getEntriesOrderedBy("ByteArrayKeyEntity", "Id")))
            .containsExactly("a", "b", "c", "d");
    }

    @Test
    void orderBy_CompositeKey_OrdersByEachPropertyInTurn() {
        // Given
        stateManager.attach("CompositeKeyEntity", Map.of("Id1", new StructKey(2), "Id2", 1, "Name", "c"));
        stateManager.attach("CompositeKeyEntity", Map.of("Id1", new StructKey(1), "Id2", 7, "Name", "b"));
        stateManager.attach("CompositeKeyEntity", Map.of("Id1", new StructKey(1), "Id2", 3, "Name", "a"));

        // When & Then
        assertThat(names(stateManager.getEntriesOrderedBy("CompositeKeyEntity", "Id1", "Id2")))
            .containsExactly("a", "b", "c");
    }

    // ==================== Debug output ====================

    @Test
    void toDebugString_OrdersComparableKeysAndKeepsOthersInTrackingOrder() {
        // Given
        stateManager.add("StructKeyEntity", Map.of("Id", new StructKey(2), "Name", "b"));
        stateManager.add("StructKeyEntity", Map.of("Id", new StructKey(1), "Name", "a"));
        stateManager.attach("GenericComparableKeyEntity", Map.of("Id", new GenericComparableStructKey(3), "Name", "c"));
        stateManager.attach("GenericComparableKeyEntity", Map.of("Id", new GenericComparableStructKey(1), "Name", "d"));
        EntryOrderingService orderingService = new EntryOrderingService(new DefaultEntryRenderer());

        // When
        String debugString = orderingService.toDebugString(stateManager, DebugStringOptions.SHORT_DEFAULT);

        // Then
        assertThat(debugString).isEqualTo(
            "GenericComparableKeyEntity {Id: GenericComparableStructKey[value=1]} Unchanged\n"
                + "GenericComparableKeyEntity {Id: GenericComparableStructKey[value=3]} Unchanged\n"
                + "StructKeyEntity {Id: StructKey[value=2]} Added\n"
                + "StructKeyEntity {Id: StructKey[value=1]} Added\n");
    }

    @Test
    void toDebugString_AllKeyKinds_IsDeterministic() {
        // Given
        track("ByteArrayKeyEntity", new byte[] {3}, "x");
        track("StructuralComparableKeyEntity", new StructuralComparableStructKey(new byte[] {1}), "y");
        track("ClassKeyEntity", new ClassKey(1), "z");
        track("ComparableIntKeyEntity", new ComparableIntStructKey(5), "w");
        track("BytesKeyEntity", new BytesStructKey(new byte[] {9}), "v");
        EntryOrderingService orderingService = new EntryOrderingService(new DefaultEntryRenderer());

        // When
        String first = orderingService.toDebugString(stateManager, DebugStringOptions.LONG_DEFAULT);
        String second = orderingService.toDebugString(stateManager, DebugStringOptions.LONG_DEFAULT);

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).startsWith("ByteArrayKeyEntity {Id: 0x03} Unchanged\n");
        assertThat(first.lines().filter(line -> !line.startsWith("  ")))
            .containsExactly(
                "ByteArrayKeyEntity {Id: 0x03} Unchanged",
                "BytesKeyEntity {Id: 0x09} Unchanged",
                "ClassKeyEntity {Id: ClassKey(1)} Unchanged",
                "ComparableIntKeyEntity {Id: ComparableIntStructKey[value=5]} Unchanged",
                "StructuralComparableKeyEntity {Id: 0x01} Unchanged");
    }

    private void track(String entityTypeName, Object id, String name) {
        stateManager.attach(entityTypeName, Map.of("Id", id, "Name", name));
    }

    private static List<Object> names(List<TrackedEntry> entries) {
        return entries.stream()
            .map(entry -> entry.getCurrentValue(entry.getEntityType().findProperty("Name")))
            .toList();
    }
}
