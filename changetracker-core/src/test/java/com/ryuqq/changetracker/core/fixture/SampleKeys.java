package com.ryuqq.changetracker.core.fixture;

import com.ryuqq.changetracker.core.metadata.StructuralComparable;

import java.util.Comparator;

/**
 * Value types covering each comparison capability.
 */
public final class SampleKeys {

    private SampleKeys() {
    }

    /** No comparison capability. */
    public record PlainKey(int id) {
    }

    /** Ordered against its own type. */
    public record GenericKey(int id) implements Comparable<GenericKey> {
        @Override
        public int compareTo(GenericKey other) {
            return Integer.compare(id, other.id);
        }
    }

    /** Ordered against any object. */
    public record LooseKey(int id) implements Comparable<Object> {
        @Override
        public int compareTo(Object other) {
            return Integer.compare(id, ((LooseKey) other).id);
        }
    }

    /** Wraps a byte sequence compared element by element. */
    public record SequenceKey(byte[] bytes) implements StructuralComparable {
        @Override
        public int compareTo(Object other, Comparator<Object> elementComparator) {
            if (!(other instanceof SequenceKey)) {
                throw new IllegalArgumentException("Not a SequenceKey: " + other);
            }
            return elementComparator.compare(bytes, ((SequenceKey) other).bytes);
        }
    }

    public enum Priority {
        LOW, MEDIUM, HIGH
    }

    /** Self-bounded base: subclasses are ordered against themselves. */
    public abstract static class Versioned<T extends Versioned<T>> implements Comparable<T> {
        private final int version;

        protected Versioned(int version) {
            this.version = version;
        }

        @Override
        public int compareTo(T other) {
            return Integer.compare(version, ((Versioned<?>) other).version);
        }
    }

    public static final class Revision extends Versioned<Revision> {
        public Revision(int version) {
            super(version);
        }
    }

    /** Generic type ordered against its own parameterization. */
    public static final class Box<T extends Comparable<T>> implements Comparable<Box<T>> {
        private final T value;

        public Box(T value) {
            this.value = value;
        }

        @Override
        public int compareTo(Box<T> other) {
            return value.compareTo(other.value);
        }
    }

    /** Inherits Comparable&lt;GenericKeyBase&gt;; not ordered against exactly its own type. */
    public static class GenericKeyBase implements Comparable<GenericKeyBase> {
        protected final int id;

        public GenericKeyBase(int id) {
            this.id = id;
        }

        @Override
        public int compareTo(GenericKeyBase other) {
            return Integer.compare(id, other.id);
        }
    }

    public static final class DerivedKey extends GenericKeyBase {
        public DerivedKey(int id) {
            super(id);
        }
    }
}
