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

import io.vavr.Tuple2;
import io.vavr.control.Option;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An {@link OrderedMap} that creates a value for a missing key on first read.
 * <p>
 * If a factory is present, {@link #apply(Object)} of a missing key calls the
 * factory, appends the produced value under the key, and returns it. Without
 * a factory, {@code apply} of a missing key throws a
 * {@link NoSuchElementException}, like a plain {@code OrderedMap}.
 * <p>
 * {@link #get(Object)}, {@link #getOrElse(Object, Object)} and
 * {@link #containsKey(Object)} never create values.
 * <p>
 * The static factories inherited from {@code OrderedMap}, such as
 * {@code empty()}, {@code of(k, v)}, {@code ofEntries(Tuple2...)},
 * {@code fromKeys(Iterable, V)} and {@code collector()}, create plain
 * {@code OrderedMap}s. Use {@link #of(Option)}, {@link #ofEntries(Option, Iterable)},
 * {@link #ofAll(Option, Map)} or {@link #fromKeys(Option, Iterable, Object)}
 * to create a {@code DefaultOrderedMap}.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class DefaultOrderedMap<K, V> extends OrderedMap<K, V> {
    private static final long serialVersionUID = 1L;

    private final transient Option<Supplier<? extends V>> factory;

    DefaultOrderedMap(Option<? extends Supplier<? extends V>> factory, int initialCapacity) {
        super(initialCapacity);
        Objects.requireNonNull(factory, "factory is null");
        if (factory.isDefined() && factory.get() == null) {
            throw new IllegalArgumentException("factory must be invocable");
        }
        this.factory = Option.narrow(factory);
    }

    /**
     * Creates an empty map that calls {@code factory} for missing keys.
     *
     * @param factory creates values for missing keys
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new empty map
     * @throws IllegalArgumentException if {@code factory} is null
     */
    public static <K, V> DefaultOrderedMap<K, V> withFactory(Supplier<? extends V> factory) {
        return of(Option.some(factory));
    }

    /**
     * Creates an empty map without a factory.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return A new empty map
     */
    public static <K, V> DefaultOrderedMap<K, V> withoutFactory() {
        return of(Option.none());
    }

    /**
     * Creates an empty map with an optional factory.
     *
     * @param factory creates values for missing keys, if present
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new empty map
     * @throws NullPointerException     if {@code factory} is null
     * @throws IllegalArgumentException if {@code factory} is present but holds null
     */
    public static <K, V> DefaultOrderedMap<K, V> of(Option<? extends Supplier<? extends V>> factory) {
        return new DefaultOrderedMap<>(factory, DEFAULT_CAPACITY);
    }

    /**
     * Creates a map with an optional factory and the given entries, in the
     * iteration order of {@code entries}.
     *
     * @param factory creates values for missing keys, if present
     * @param entries initial entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new map
     */
    public static <K, V> DefaultOrderedMap<K, V> ofEntries(Option<? extends Supplier<? extends V>> factory,
                                                           Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        DefaultOrderedMap<K, V> m = of(factory);
        m.putAllTuples(entries);
        return m;
    }

    /**
     * Creates a map with an optional factory and the entries of a
     * java.util.Map, in the iteration order of {@code map}.
     *
     * @param factory creates values for missing keys, if present
     * @param map     initial entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new map
     */
    public static <K, V> DefaultOrderedMap<K, V> ofAll(Option<? extends Supplier<? extends V>> factory,
                                                       Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        DefaultOrderedMap<K, V> m = new DefaultOrderedMap<>(factory, map.size());
        m.putAll(map);
        return m;
    }

    /**
     * Creates a map with an optional factory that maps every key of
     * {@code keys} to {@code value}, in the iteration order of {@code keys}.
     * Duplicate keys keep the position of their first occurrence.
     *
     * @param factory creates values for missing keys, if present
     * @param keys    the keys
     * @param value   the value of every key
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new map
     */
    public static <K, V> DefaultOrderedMap<K, V> fromKeys(Option<? extends Supplier<? extends V>> factory,
                                                          Iterable<? extends K> keys, V value) {
        Objects.requireNonNull(keys, "keys is null");
        DefaultOrderedMap<K, V> m = of(factory);
        for (K key : keys) {
            m.put(key, value);
        }
        return m;
    }

    public Option<Supplier<? extends V>> factory() {
        return factory;
    }

    /**
     * Returns the value associated with {@code key}. If the key is missing
     * and a factory is present, appends a value created by the factory and
     * returns it.
     *
     * @param key a key
     * @return the value
     * @throws NoSuchElementException if the key is missing and there is no factory
     */
    @Override
    public V apply(K key) {
        Option<V> value = get(key);
        if (value.isDefined()) {
            return value.get();
        }
        return missing(key);
    }

    private V missing(K key) {
        if (factory.isEmpty()) {
            throw new NoSuchElementException(String.valueOf(key));
        }
        V value = factory.get().get();
        put(key, value);
        return value;
    }

    @Override
    protected DefaultOrderedMap<K, V> emptyCopy(int initialCapacity) {
        return new DefaultOrderedMap<>(factory, initialCapacity);
    }

    /**
     * Returns a shallow copy of this map that shares the factory of this map.
     *
     * @return a copy
     */
    @Override
    public DefaultOrderedMap<K, V> copy() {
        return (DefaultOrderedMap<K, V>) super.copy();
    }

    @Override
    public DefaultOrderedMap<K, V> copy(Function<? super V, ? extends V> valueCopier) {
        return (DefaultOrderedMap<K, V>) super.copy(valueCopier);
    }

    @Override
    public String stringPrefix() {
        return "DefaultOrderedMap";
    }

    @Override
    public String toString() {
        return stringPrefix() + "(" + factory.map(f -> String.valueOf(f)).getOrElse("None") + ", "
                + mkString("OrderedMap") + ")";
    }

    // -- serialization

    private Object writeReplace() throws ObjectStreamException {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream s) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    /**
     * Serialization proxy that writes the factory, if any, ahead of the
     * entries.
     *
     * @param <K> The key type
     * @param <V> The value type
     */
    private static final class SerializationProxy<K, V> implements Serializable {

        private static final long serialVersionUID = 1L;

        private transient DefaultOrderedMap<K, V> map;

        SerializationProxy(DefaultOrderedMap<K, V> map) {
            this.map = map;
        }

        @SuppressWarnings("unchecked")
        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final Supplier<? extends V> factory = (Supplier<? extends V>) s.readObject();
            map = of(Option.of(factory));
            readEntries(s, map);
        }

        private Object readResolve() {
            return map;
        }

        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeObject(map.factory.getOrNull());
            writeEntries(s, map);
        }
    }
}
