/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.ordered;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collector;

/**
 * Implements a mutable map that iterates in the order, in which keys were
 * first inserted.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null keys and null values</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>iterates in the order, in which keys were inserted, in both directions</li>
 *     <li>overwriting the value of an existing key does not move the key</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>put, apply, containsKey, remove: O(1) in an average sense</li>
 *     <li>popItem, head, last: O(1)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 *     <li>copy, keys, values, items, clear: O(N)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * A {@link HashMap} maps each key to a node handle. The nodes live in an arena
 * of parallel arrays ({@code keys}, {@code values}, {@code prev}, {@code next})
 * and form a circular doubly linked list in insertion order. Handle
 * {@code 0} is a sentinel node that is never removed: its {@code next} is the
 * first node and its {@code prev} is the last node. An empty map has a
 * sentinel that links to itself. With the sentinel in place, every insertion
 * and every removal is the same four-link splice.
 * <p>
 * Released handles are put on a free list and reused by later insertions.
 * <p>
 * Iteration:
 * <p>
 * The iterators returned by this map are <i>fail-fast</i>: if the map is
 * structurally modified after an iterator has been created, the iterator throws
 * a {@link ConcurrentModificationException} on its next step. Structural
 * modifications are insertions of new keys, removals and {@link #clear()}.
 * Overwriting the value of an existing key is not a structural modification.
 * Fail-fast behavior is best effort; it must not be relied upon for
 * correctness.
 * <p>
 * Equality:
 * <p>
 * Comparison with another {@code OrderedMap} is order-sensitive. Comparison
 * with a {@link java.util.Map} is order-insensitive.
 * <p>
 * Serialization:
 * <p>
 * A map is serialized as its entries in insertion order and rebuilt by
 * putting them back in that order. A map that contains itself, as a key or a
 * value, is rendered by {@link #toString()} but does not survive
 * serialization: the deserialized entry refers to the serialization proxy,
 * not to the map.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class OrderedMap<K, V> implements Iterable<Tuple2<K, V>>, Serializable {
    private static final long serialVersionUID = 1L;
    /**
     * Handle of the sentinel node.
     */
    static final int SENTINEL = 0;
    /**
     * Marks the end of the free list.
     */
    private static final int NIL = -1;
    static final int DEFAULT_CAPACITY = 8;
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private transient HashMap<K, Integer> index;
    private transient Object[] keys;
    private transient Object[] values;
    private transient int[] prev;
    private transient int[] next;
    /**
     * Head of the list of released handles, chained through {@code next}.
     */
    private transient int free;
    /**
     * Lowest handle that has never been allocated.
     */
    private transient int unused;
    private transient int modCount;

    /**
     * Creates an empty map.
     */
    public OrderedMap() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates an empty map with room for {@code initialCapacity} entries
     * before the node arena has to grow.
     *
     * @param initialCapacity the initial capacity
     * @throws IllegalArgumentException if {@code initialCapacity} is negative
     *                                  or too large for the node arena
     */
    public OrderedMap(int initialCapacity) {
        if (initialCapacity < 0 || initialCapacity > MAX_CAPACITY) {
            throw new IllegalArgumentException("initialCapacity: " + initialCapacity);
        }
        init(initialCapacity);
    }

    private void init(int initialCapacity) {
        int capacity = Math.max(initialCapacity, 1) + 1;
        index = new HashMap<>();
        keys = new Object[capacity];
        values = new Object[capacity];
        prev = new int[capacity];
        next = new int[capacity];
        prev[SENTINEL] = SENTINEL;
        next[SENTINEL] = SENTINEL;
        free = NIL;
        unused = SENTINEL + 1;
    }

    /**
     * Returns a new empty {@code OrderedMap}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return A new empty map
     */
    public static <K, V> OrderedMap<K, V> empty() {
        return new OrderedMap<>();
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedMap}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return An {@link OrderedMap} Collector.
     */
    public static <K, V> Collector<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, OrderedMap<K, V>> collector() {
        return Collector.of(ArrayList::new, ArrayList::add, (left, right) -> {
            left.addAll(right);
            return left;
        }, OrderedMap::ofEntries);
    }

    /**
     * Returns a map that contains a single entry.
     *
     * @param key   A singleton map key
     * @param value A singleton map value
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new map containing the given entry
     */
    public static <K, V> OrderedMap<K, V> of(K key, V value) {
        OrderedMap<K, V> m = new OrderedMap<>();
        m.put(key, value);
        return m;
    }

    /**
     * Creates an OrderedMap of the given list of key-value pairs.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param <K> The key type
     * @param <V> The value type
     * @return A new map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2) {
        OrderedMap<K, V> m = of(k1, v1);
        m.put(k2, v2);
        return m;
    }

    /**
     * Creates an OrderedMap of the given list of key-value pairs.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param k3  a key for the map
     * @param v3  the value for k3
     * @param <K> The key type
     * @param <V> The value type
     * @return A new map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        OrderedMap<K, V> m = of(k1, v1, k2, v2);
        m.put(k3, v3);
        return m;
    }

    /**
     * Creates an OrderedMap of the given entries.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new map containing the given entries
     */
    @SafeVarargs
    public static <K, V> OrderedMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return ofEntries(Arrays.asList(entries));
    }

    /**
     * Creates an OrderedMap of the given entries. The map iterates in the
     * order of the first occurrence of each key; a later entry with the same
     * key replaces the value.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        OrderedMap<K, V> m = new OrderedMap<>();
        m.putAllTuples(entries);
        return m;
    }

    /**
     * Returns an {@code OrderedMap} from a source java.util.Map, in the
     * iteration order of the source.
     *
     * @param map A map
     * @param <K> The key type
     * @param <V> The value type
     * @return A new map containing the given map
     */
    public static <K, V> OrderedMap<K, V> ofAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        OrderedMap<K, V> m = new OrderedMap<>(map.size());
        m.putAll(map);
        return m;
    }

    /**
     * Creates an OrderedMap that maps every key of {@code keys} to {@code null}.
     *
     * @param keys the keys
     * @param <K>  The key type
     * @param <V>  The value type
     * @return A new map
     */
    public static <K, V> OrderedMap<K, V> fromKeys(Iterable<? extends K> keys) {
        return fromKeys(keys, null);
    }

    /**
     * Creates an OrderedMap that maps every key of {@code keys} to
     * {@code value}, in the iteration order of {@code keys}. Duplicate keys
     * keep the position of their first occurrence.
     *
     * @param keys  the keys
     * @param value the value of every key
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new map
     */
    public static <K, V> OrderedMap<K, V> fromKeys(Iterable<? extends K> keys, V value) {
        Objects.requireNonNull(keys, "keys is null");
        OrderedMap<K, V> m = new OrderedMap<>();
        for (K key : keys) {
            m.put(key, value);
        }
        return m;
    }

    // -- node arena

    private int allocate() {
        if (free != NIL) {
            int handle = free;
            free = next[handle];
            return handle;
        }
        if (unused == keys.length) {
            grow();
        }
        return unused++;
    }

    private void grow() {
        if (keys.length > MAX_CAPACITY) {
            throw new OutOfMemoryError("node arena is full");
        }
        int newCapacity = keys.length + (keys.length >> 1) + 1;
        if (newCapacity < 0 || newCapacity > MAX_CAPACITY + 1) {
            newCapacity = MAX_CAPACITY + 1;
        }
        keys = Arrays.copyOf(keys, newCapacity);
        values = Arrays.copyOf(values, newCapacity);
        prev = Arrays.copyOf(prev, newCapacity);
        next = Arrays.copyOf(next, newCapacity);
    }

    private void release(int handle) {
        keys[handle] = null;
        values[handle] = null;
        prev[handle] = NIL;
        next[handle] = free;
        free = handle;
    }

    private void linkLast(int handle) {
        int last = prev[SENTINEL];
        prev[handle] = last;
        next[handle] = SENTINEL;
        next[last] = handle;
        prev[SENTINEL] = handle;
    }

    private void unlink(int handle) {
        int p = prev[handle];
        int n = next[handle];
        next[p] = n;
        prev[n] = p;
    }

    @SuppressWarnings("unchecked")
    private Tuple2<K, V> removeNode(int handle) {
        K key = (K) keys[handle];
        V value = (V) values[handle];
        index.remove(key);
        unlink(handle);
        release(handle);
        modCount++;
        return Tuple.of(key, value);
    }

    @SuppressWarnings("unchecked")
    private Tuple2<K, V> entryAt(int handle) {
        return Tuple.of((K) keys[handle], (V) values[handle]);
    }

    // -- queries

    /**
     * Returns the number of entries.
     *
     * @return the size of this map
     */
    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    public boolean containsKey(K key) {
        return index.containsKey(key);
    }

    /**
     * Returns the value associated with {@code key}.
     *
     * @param key a key
     * @return the value
     * @throws NoSuchElementException if this map does not contain {@code key}
     */
    @SuppressWarnings("unchecked")
    public V apply(K key) {
        Integer handle = index.get(key);
        if (handle == null) {
            throw new NoSuchElementException(String.valueOf(key));
        }
        return (V) values[handle];
    }

    /**
     * Returns the value associated with {@code key}, or {@code Option.none()}
     * if this map does not contain the key.
     *
     * @param key a key
     * @return the value, if present
     */
    @SuppressWarnings("unchecked")
    public Option<V> get(K key) {
        Integer handle = index.get(key);
        return handle == null ? Option.none() : Option.some((V) values[handle]);
    }

    public V getOrElse(K key, V defaultValue) {
        return get(key).getOrElse(defaultValue);
    }

    /**
     * Returns the first entry in insertion order.
     *
     * @return the oldest entry
     * @throws NoSuchElementException if this map is empty
     */
    public Tuple2<K, V> head() {
        if (isEmpty()) {
            throw new NoSuchElementException("head of empty " + stringPrefix());
        }
        return entryAt(next[SENTINEL]);
    }

    /**
     * Returns the last entry in insertion order.
     *
     * @return the newest entry
     * @throws NoSuchElementException if this map is empty
     */
    public Tuple2<K, V> last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty " + stringPrefix());
        }
        return entryAt(prev[SENTINEL]);
    }

    // -- updates

    /**
     * Associates {@code value} with {@code key}.
     * <p>
     * A new key is appended at the end of the insertion order. If the key is
     * already present, only its value is replaced; its position does not
     * change.
     *
     * @param key   a key
     * @param value a value
     * @return the previous value of the key, or {@code Option.none()} if the key is new
     */
    @SuppressWarnings("unchecked")
    public Option<V> put(K key, V value) {
        Integer handle = index.get(key);
        if (handle != null) {
            V old = (V) values[handle];
            values[handle] = value;
            return Option.some(old);
        }
        int h = allocate();
        keys[h] = key;
        values[h] = value;
        linkLast(h);
        index.put(key, h);
        modCount++;
        return Option.none();
    }

    /**
     * Puts all entries of {@code map} in the iteration order of {@code map}.
     *
     * @param map a map
     */
    public void putAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        for (Map.Entry<? extends K, ? extends V> e : map.entrySet()) {
            put(e.getKey(), e.getValue());
        }
    }

    /**
     * Puts all entries in the iteration order of {@code entries}.
     *
     * @param entries key-value pairs
     */
    public void putAllTuples(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        for (Tuple2<? extends K, ? extends V> e : entries) {
            put(e._1, e._2);
        }
    }

    /**
     * Returns the value of {@code key} if present. Otherwise, appends
     * {@code defaultValue} under {@code key} and returns it.
     *
     * @param key          a key
     * @param defaultValue the value to insert if the key is absent
     * @return the value now associated with {@code key}
     */
    @SuppressWarnings("unchecked")
    public V getOrPut(K key, V defaultValue) {
        Integer handle = index.get(key);
        if (handle != null) {
            return (V) values[handle];
        }
        put(key, defaultValue);
        return defaultValue;
    }

    /**
     * Removes {@code key} from this map.
     *
     * @param key a key
     * @throws NoSuchElementException if this map does not contain {@code key}
     */
    public void remove(K key) {
        pop(key);
    }

    /**
     * Removes {@code key} from this map and returns its value.
     *
     * @param key a key
     * @return the removed value
     * @throws NoSuchElementException if this map does not contain {@code key}
     */
    public V pop(K key) {
        Integer handle = index.get(key);
        if (handle == null) {
            throw new NoSuchElementException(String.valueOf(key));
        }
        return removeNode(handle)._2;
    }

    /**
     * Removes {@code key} from this map and returns its value. Returns
     * {@code defaultValue} and leaves the map unchanged if the key is absent.
     *
     * @param key          a key
     * @param defaultValue returned if the key is absent
     * @return the removed value or {@code defaultValue}
     */
    public V pop(K key, V defaultValue) {
        Integer handle = index.get(key);
        return handle == null ? defaultValue : removeNode(handle)._2;
    }

    /**
     * Removes and returns the newest entry.
     *
     * @return the removed entry
     * @throws NoSuchElementException if this map is empty
     */
    public Tuple2<K, V> popItem() {
        return popItem(true);
    }

    /**
     * Removes and returns the newest entry if {@code last} is true (LIFO), or
     * the oldest entry otherwise (FIFO).
     *
     * @param last whether to remove from the end of the insertion order
     * @return the removed entry
     * @throws NoSuchElementException if this map is empty
     */
    public Tuple2<K, V> popItem(boolean last) {
        if (isEmpty()) {
            throw new NoSuchElementException("popItem on empty " + stringPrefix());
        }
        return removeNode(last ? prev[SENTINEL] : next[SENTINEL]);
    }

    /**
     * Removes all entries and shrinks the node arena to its default capacity.
     */
    public void clear() {
        init(DEFAULT_CAPACITY);
        modCount++;
    }

    // -- copies

    /**
     * Returns a new, empty map of the same kind as this one.
     * Subclasses return an instance that carries their own configuration.
     *
     * @param initialCapacity capacity hint
     * @return a new empty map
     */
    protected OrderedMap<K, V> emptyCopy(int initialCapacity) {
        return new OrderedMap<>(initialCapacity);
    }

    /**
     * Returns a shallow copy of this map. The copy has the same entries in
     * the same order, but its own storage.
     *
     * @return a copy
     */
    public OrderedMap<K, V> copy() {
        OrderedMap<K, V> m = emptyCopy(size());
        m.putAllTuples(this);
        return m;
    }

    /**
     * Returns a copy of this map, in which every value has been passed
     * through {@code valueCopier}.
     *
     * @param valueCopier creates the value for the copy
     * @return a copy
     */
    public OrderedMap<K, V> copy(Function<? super V, ? extends V> valueCopier) {
        Objects.requireNonNull(valueCopier, "valueCopier is null");
        OrderedMap<K, V> m = emptyCopy(size());
        for (Tuple2<K, V> e : this) {
            m.put(e._1, valueCopier.apply(e._2));
        }
        return m;
    }

    // -- iteration

    /**
     * Returns a fail-fast iterator over the entries, oldest first.
     *
     * @return an iterator
     */
    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        return new SequenceIterator(false);
    }

    /**
     * Returns a fail-fast iterator over the entries, newest first.
     *
     * @return an iterator
     */
    public Iterator<Tuple2<K, V>> reverseIterator() {
        return new SequenceIterator(true);
    }

    public Iterator<K> keysIterator() {
        return iterator().map(Tuple2::_1);
    }

    public Iterator<V> valuesIterator() {
        return iterator().map(Tuple2::_2);
    }

    /**
     * Returns the keys in insertion order. The result is a snapshot; it does
     * not reflect later changes of this map.
     *
     * @return the keys
     */
    public Vector<K> keys() {
        return Vector.ofAll(keysIterator());
    }

    public Vector<V> values() {
        return Vector.ofAll(valuesIterator());
    }

    public Vector<Tuple2<K, V>> items() {
        return Vector.ofAll(iterator());
    }

    // -- conversions

    public java.util.LinkedHashMap<K, V> toJavaMap() {
        java.util.LinkedHashMap<K, V> m = new java.util.LinkedHashMap<>();
        for (Tuple2<K, V> e : this) {
            m.put(e._1, e._2);
        }
        return m;
    }

    public io.vavr.collection.LinkedHashMap<K, V> toLinkedHashMap() {
        return io.vavr.collection.LinkedHashMap.ofEntries(this);
    }

    // -- object methods

    /**
     * Compares this map with {@code o}.
     * <p>
     * If {@code o} is an {@code OrderedMap}, the maps are equal if they have
     * equal entries in the same order. If {@code o} is a {@link java.util.Map},
     * the maps are equal if they have equal entries in any order. A key that
     * {@code o} cannot look up, because of its type or because it is null,
     * makes the maps unequal.
     * <p>
     * Since this class does not implement {@link java.util.Map}, the
     * comparison is one-way: {@code orderedMap.equals(javaMap)} may be true
     * while {@code javaMap.equals(orderedMap)} is false. Any other object,
     * including an {@link io.vavr.collection.Map}, is never equal to this map;
     * use {@link #toLinkedHashMap()} to compare with vavr maps.
     *
     * @param o an object
     * @return whether {@code o} is equal to this map
     */
    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (o instanceof OrderedMap) {
            return equalsInOrder((OrderedMap<?, ?>) o);
        }
        if (o instanceof Map) {
            return equalsIgnoreOrder((Map<?, ?>) o);
        }
        return false;
    }

    private boolean equalsInOrder(OrderedMap<?, ?> that) {
        if (size() != that.size()) {
            return false;
        }
        java.util.Iterator<? extends Tuple2<?, ?>> it = that.iterator();
        for (Tuple2<K, V> e : this) {
            if (!e.equals(it.next())) {
                return false;
            }
        }
        return true;
    }

    private boolean equalsIgnoreOrder(Map<?, ?> that) {
        if (size() != that.size()) {
            return false;
        }
        try {
            for (Tuple2<K, V> e : this) {
                Object value = that.get(e._1);
                if (value == null ? e._2 != null || !that.containsKey(e._1) : !value.equals(e._2)) {
                    return false;
                }
            }
        } catch (ClassCastException | NullPointerException ignored) {
            return false;
        }
        return true;
    }

    /**
     * Returns the hash code defined by {@link java.util.Map#hashCode()}, which
     * does not depend on the insertion order. It is consistent with
     * {@link #equals(Object)} against both another {@code OrderedMap} and a
     * {@link java.util.Map}.
     *
     * @return the hash code
     */
    @Override
    public int hashCode() {
        int h = 0;
        for (Tuple2<K, V> e : this) {
            h += Objects.hashCode(e._1) ^ Objects.hashCode(e._2);
        }
        return h;
    }

    public String stringPrefix() {
        return "OrderedMap";
    }

    @Override
    public String toString() {
        return mkString(stringPrefix());
    }

    /**
     * Renders the entries as {@code prefix((k1, v1), (k2, v2))}.
     */
    String mkString(String prefix) {
        StringBuilder b = new StringBuilder(prefix).append('(');
        String self = "(this " + stringPrefix() + ")";
        boolean first = true;
        for (Tuple2<K, V> e : this) {
            if (!first) {
                b.append(", ");
            }
            first = false;
            b.append('(')
                    .append(e._1 == this ? self : String.valueOf(e._1))
                    .append(", ")
                    .append(e._2 == this ? self : String.valueOf(e._2))
                    .append(')');
        }
        return b.append(')').toString();
    }

    /**
     * Walks the sequence from the sentinel in one direction.
     */
    private final class SequenceIterator implements Iterator<Tuple2<K, V>> {
        private final boolean reverse;
        private final int expectedModCount;
        private int cursor;

        SequenceIterator(boolean reverse) {
            this.reverse = reverse;
            this.expectedModCount = modCount;
            this.cursor = reverse ? prev[SENTINEL] : next[SENTINEL];
        }

        @Override
        public boolean hasNext() {
            return cursor != SENTINEL;
        }

        @Override
        public Tuple2<K, V> next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (!hasNext()) {
                throw new NoSuchElementException("next() on empty iterator");
            }
            int handle = cursor;
            cursor = reverse ? prev[handle] : next[handle];
            return entryAt(handle);
        }
    }

    // -- serialization

    private Object writeReplace() throws ObjectStreamException {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream s) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    /**
     * Writes the size of {@code map} followed by its keys and values in
     * insertion order.
     */
    static <K, V> void writeEntries(ObjectOutputStream s, OrderedMap<K, V> map) throws IOException {
        s.writeInt(map.size());
        for (Tuple2<K, V> e : map) {
            s.writeObject(e._1);
            s.writeObject(e._2);
        }
    }

    /**
     * Reads entries written by {@link #writeEntries} and puts them into
     * {@code map} in the order they were written.
     */
    @SuppressWarnings("unchecked")
    static <K, V> void readEntries(ObjectInputStream s, OrderedMap<K, V> map) throws ClassNotFoundException, IOException {
        final int size = s.readInt();
        if (size < 0) {
            throw new InvalidObjectException("No elements");
        }
        for (int i = 0; i < size; i++) {
            final K key = (K) s.readObject();
            final V value = (V) s.readObject();
            map.put(key, value);
        }
    }

    /**
     * A serialization proxy which, in this context, is used to rebuild an
     * ordered map from its entries in insertion order.
     *
     * @param <K> The key type
     * @param <V> The value type
     */
    private static final class SerializationProxy<K, V> implements Serializable {

        private static final long serialVersionUID = 1L;

        // the instance to be serialized/deserialized
        private transient OrderedMap<K, V> map;

        /**
         * Constructor for the case of serialization, called by {@link OrderedMap#writeReplace()}.
         *
         * @param map a map
         */
        SerializationProxy(OrderedMap<K, V> map) {
            this.map = map;
        }

        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            map = new OrderedMap<>();
            readEntries(s, map);
        }

        /**
         * {@code readResolve} method for the serialization proxy pattern.
         *
         * @return A deserialized instance of the enclosing class.
         */
        private Object readResolve() {
            return map;
        }

        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            writeEntries(s, map);
        }
    }
}
