// file: core/src/main/java/io/mergekit/core/Value.java
package io.mergekit.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A node of a configuration tree.
 * <p>
 * Shapes:
 *  - Mapping:  string keys to values, in the order of the host container.
 *  - Sequence: ordered list of values.
 *  - Scalar:   Text, Num, Bool or Null (explicit absence).
 * <p>
 * Equality is structural for every shape. Mappings and sequences are mutable
 * containers so that an in-place merge can update a destination tree; callers
 * that need the input untouched take a {@link #deepCopy()} first.
 * <p>
 * Trees must be finite: cycles are not detected.
 */
public sealed interface Value permits Value.Mapping, Value.Sequence, Value.Scalar {

    /** Independent copy of this tree. Scalars are immutable and return themselves. */
    Value deepCopy();

    /**
     * Convert plain Java data into a tree.
     * <p>
     * Accepts null, String, Number, Boolean, Map with String keys, Collection
     * and already-built Values. Anything else is rejected.
     */
    static Value of(Object raw) {
        if (raw == null) return Null.INSTANCE;
        if (raw instanceof Value v) return v;
        if (raw instanceof String s) return new Text(s);
        if (raw instanceof Boolean b) return Bool.of(b);
        if (raw instanceof Number n) return Num.of(n);
        if (raw instanceof Map<?, ?> m) {
            var mapping = new Mapping();
            for (var e : m.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("mapping keys must be strings: " + e.getKey());
                }
                mapping.put(key, of(e.getValue()));
            }
            return mapping;
        }
        if (raw instanceof Collection<?> c) {
            var seq = new Sequence();
            for (Object item : c) {
                seq.add(of(item));
            }
            return seq;
        }
        throw new IllegalArgumentException("unsupported value type: " + raw.getClass().getName());
    }

    static Text text(String s) { return new Text(s); }

    static Num num(long n) { return new Num(BigDecimal.valueOf(n)); }

    static Bool bool(boolean b) { return Bool.of(b); }

    static Null nil() { return Null.INSTANCE; }

    static Sequence seq(Object... items) {
        var seq = new Sequence();
        for (Object item : items) {
            seq.add(of(item));
        }
        return seq;
    }

    /**
     * Non-collection values.
     */
    sealed interface Scalar extends Value permits Text, Num, Bool, Null {
        @Override
        default Scalar deepCopy() { return this; }
    }

    record Text(String value) implements Scalar {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override public String toString() { return value; }
    }

    /**
     * Numeric scalar. Equality is numeric, so 1 and 1.0 are the same value.
     */
    record Num(BigDecimal value) implements Scalar {
        public Num {
            Objects.requireNonNull(value, "value");
        }

        public static Num of(Number n) {
            if (n instanceof BigDecimal d) return new Num(d);
            if (n instanceof BigInteger i) return new Num(new BigDecimal(i));
            if (n instanceof Double || n instanceof Float) {
                double d = n.doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new IllegalArgumentException("non-finite number: " + n);
                }
                return new Num(BigDecimal.valueOf(d));
            }
            return new Num(BigDecimal.valueOf(n.longValue()));
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Num other)) return false;
            return value.compareTo(other.value) == 0;
        }

        @Override public int hashCode() { return value.stripTrailingZeros().hashCode(); }

        @Override public String toString() { return value.toPlainString(); }
    }

    record Bool(boolean value) implements Scalar {
        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        public static Bool of(boolean b) { return b ? TRUE : FALSE; }

        @Override public String toString() { return String.valueOf(value); }
    }

    /** Explicit absence of a value. */
    enum Null implements Scalar {
        INSTANCE;

        @Override public String toString() { return "null"; }
    }

    /**
     * Keyed container. The backing map comes from a caller-supplied factory,
     * which must preserve insertion order; child mappings created while merging
     * into this one reuse the same factory.
     */
    final class Mapping implements Value {
        private final Supplier<Map<String, Value>> factory;
        private final Map<String, Value> entries;

        public Mapping() {
            this(LinkedHashMap::new);
        }

        public Mapping(Supplier<Map<String, Value>> factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
            this.entries = Objects.requireNonNull(factory.get(), "factory returned null");
            if (!entries.isEmpty()) throw new IllegalArgumentException("factory must return an empty map");
        }

        /** Value stored under {@code key}, or null when the key is missing. */
        public Value get(String key) { return entries.get(key); }

        public boolean containsKey(String key) { return entries.containsKey(key); }

        /** Store a value; a Java null is stored as {@link Null}. Returns this mapping. */
        public Mapping put(String key, Value value) {
            Objects.requireNonNull(key, "key");
            entries.put(key, value == null ? Null.INSTANCE : value);
            return this;
        }

        public Value remove(String key) { return entries.remove(key); }

        public void clear() { entries.clear(); }

        public int size() { return entries.size(); }

        public boolean isEmpty() { return entries.isEmpty(); }

        /** Read-only view of the keys, in container order. */
        public Set<String> keys() { return Collections.unmodifiableSet(entries.keySet()); }

        /** Read-only view of the entries, in container order. */
        public Map<String, Value> entries() { return Collections.unmodifiableMap(entries); }

        /** A new empty mapping backed by the same kind of container. */
        public Mapping emptyLike() { return new Mapping(factory); }

        @Override
        public Mapping deepCopy() {
            var copy = emptyLike();
            entries.forEach((k, v) -> copy.put(k, v.deepCopy()));
            return copy;
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Mapping other)) return false;
            return entries.equals(other.entries);
        }

        @Override public int hashCode() { return entries.hashCode(); }

        @Override public String toString() { return entries.toString(); }
    }

    /**
     * Ordered container of values.
     */
    final class Sequence implements Value {
        private final List<Value> items;

        public Sequence() {
            this.items = new ArrayList<>();
        }

        public static Sequence ofAll(Collection<? extends Value> values) {
            var seq = new Sequence();
            for (Value v : values) {
                seq.add(v);
            }
            return seq;
        }

        public Value get(int index) { return items.get(index); }

        public int size() { return items.size(); }

        public boolean isEmpty() { return items.isEmpty(); }

        public boolean contains(Value v) { return items.contains(v); }

        /** Read-only view of the elements. */
        public List<Value> items() { return Collections.unmodifiableList(items); }

        /** Append a value; a Java null is stored as {@link Null}. Returns this sequence. */
        public Sequence add(Value v) {
            items.add(v == null ? Null.INSTANCE : v);
            return this;
        }

        /** Remove every element equal to {@code v}. */
        public boolean removeAll(Value v) { return items.removeIf(v::equals); }

        public void clear() { items.clear(); }

        /** Replace the whole content, keeping this container's identity. */
        public void replaceWith(List<Value> values) {
            var snapshot = new ArrayList<>(values);
            items.clear();
            for (Value v : snapshot) {
                add(v);
            }
        }

        @Override
        public Sequence deepCopy() {
            var copy = new Sequence();
            for (Value v : items) {
                copy.add(v.deepCopy());
            }
            return copy;
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Sequence other)) return false;
            return items.equals(other.items);
        }

        @Override public int hashCode() { return items.hashCode(); }

        @Override public String toString() { return items.toString(); }
    }
}
