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
package ch.randelshofer.vavr.orderedset;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.HashMap;
import io.vavr.collection.HashSet;
import io.vavr.collection.Iterator;
import io.vavr.collection.LinkedHashMap;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * Implements a mutable map that remembers the order in which keys were
 * inserted, using a hash index (KeyIndex) and a sequence of keys (KeyOrder).
 * <p>
 * Features:
 * <ul>
 *     <li>allows null keys and null values</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>iterates in the order, in which keys were inserted, until a key is removed</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>add, upsert, contains, get, cell: O(1) in an amortized sense</li>
 *     <li>remove: O(N), because the key has to be located in the sequence of keys;
 *     the removal from the sequence itself is O(1)</li>
 *     <li>clear, drain, drainReverse: O(N)</li>
 *     <li>iterator creation: O(1)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * The set owns exactly one KeyIndex and one KeyOrder. Every key that is
 * present in the one structure is present in the other, and the size of the
 * set equals the size of either structure. Neither structure is exposed.
 * <p>
 * Insertion Order:
 * <p>
 * Keys are appended to the KeyOrder when they are added. Replacing the value
 * of a present key does not move the key. Removing a key swaps the last key
 * of the KeyOrder into the slot of the removed key, so the order of the
 * remaining keys is insertion order only up to the first removal.
 * <p>
 * Iteration:
 * <p>
 * {@link #iterator()} and {@link #forEachEntry(BiConsumer)} iterate over a
 * snapshot of the set and do not change it. {@link #drain(BiConsumer)},
 * {@link #drainReverse(BiConsumer)} and the draining iterators take over all
 * entries: the set is empty from that point on, and each entry is released
 * when it is handed out.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class OrderedSet<K, V> implements Iterable<Tuple2<K, V>> {

    private KeyIndex<K, V> index;
    private KeyOrder<K> order;
    private int size;

    /**
     * Creates an empty set.
     */
    public OrderedSet() {
        this(new KeyIndex<>(), new KeyOrder<>(), 0);
    }

    private OrderedSet(KeyIndex<K, V> index, KeyOrder<K> order, int size) {
        this.index = index;
        this.order = order;
        this.size = size;
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedSet}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return An {@link OrderedSet} Collector.
     */
    public static <K, V> Collector<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, OrderedSet<K, V>> collector() {
        final Supplier<ArrayList<Tuple2<K, V>>> supplier = ArrayList::new;
        final BiConsumer<ArrayList<Tuple2<K, V>>, Tuple2<K, V>> accumulator = ArrayList::add;
        final BinaryOperator<ArrayList<Tuple2<K, V>>> combiner = (left, right) -> {
            left.addAll(right);
            return left;
        };
        final Function<ArrayList<Tuple2<K, V>>, OrderedSet<K, V>> finisher = OrderedSet::ofEntries;
        return Collector.of(supplier, accumulator, combiner, finisher);
    }

    public static <K, V> OrderedSet<K, V> empty() {
        return new OrderedSet<>();
    }

    /**
     * Returns an {@code OrderedSet} with a single entry.
     *
     * @param key   a key
     * @param value the value for key
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new set containing the given entry
     */
    public static <K, V> OrderedSet<K, V> of(K key, V value) {
        final OrderedSet<K, V> set = new OrderedSet<>();
        set.add(key, value);
        return set;
    }

    /**
     * Creates an OrderedSet of the given list of key-value pairs.
     *
     * @param k1  a key for the set
     * @param v1  the value for k1
     * @param k2  a key for the set
     * @param v2  the value for k2
     * @param <K> The key type
     * @param <V> The value type
     * @return A new set containing the given entries
     * @throws KeyAlreadyExistsException if a key is given twice
     */
    public static <K, V> OrderedSet<K, V> of(K k1, V v1, K k2, V v2) {
        final OrderedSet<K, V> set = of(k1, v1);
        set.add(k2, v2);
        return set;
    }

    /**
     * Creates an OrderedSet of the given list of key-value pairs.
     *
     * @param k1  a key for the set
     * @param v1  the value for k1
     * @param k2  a key for the set
     * @param v2  the value for k2
     * @param k3  a key for the set
     * @param v3  the value for k3
     * @param <K> The key type
     * @param <V> The value type
     * @return A new set containing the given entries
     * @throws KeyAlreadyExistsException if a key is given twice
     */
    public static <K, V> OrderedSet<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        final OrderedSet<K, V> set = of(k1, v1, k2, v2);
        set.add(k3, v3);
        return set;
    }

    /**
     * Creates an OrderedSet of the given entries, in the order of the entries.
     *
     * @param entries Key-value pairs
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new set containing the given entries
     * @throws NullPointerException      if {@code entries} is null
     * @throws KeyAlreadyExistsException if a key is given twice
     */
    @SafeVarargs
    public static <K, V> OrderedSet<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        final OrderedSet<K, V> set = new OrderedSet<>();
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            set.add(entry._1, entry._2);
        }
        return set;
    }

    /**
     * Creates an OrderedSet of the given entries, in iteration order.
     *
     * @param entries Key-value pairs
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new set containing the given entries
     * @throws NullPointerException      if {@code entries} is null
     * @throws KeyAlreadyExistsException if a key is given twice
     */
    public static <K, V> OrderedSet<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        final OrderedSet<K, V> set = new OrderedSet<>();
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            set.add(entry._1, entry._2);
        }
        return set;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean contains(K key) {
        return index.contains(key);
    }

    /**
     * Adds a key that is not yet present. The key becomes the last key
     * in iteration order.
     *
     * @param key   a key, may be null
     * @param value a value, may be null
     * @throws KeyAlreadyExistsException if the key is present; the set is not changed
     */
    public void add(K key, V value) {
        addLast(key, value);
    }

    /**
     * Adds a key, or replaces the value of a present key.
     * <p>
     * A present key keeps its position in iteration order.
     *
     * @param key   a key, may be null
     * @param value a value, may be null
     * @return the previous value of the key, or none if the key was added
     */
    public Option<V> upsert(K key, V value) {
        final Option<ValueCell<V>> cell = index.find(key);
        if (cell.isDefined()) {
            return Option.some(cell.get().set(value));
        }
        addLast(key, value);
        return Option.none();
    }

    /**
     * Returns the value of a present key.
     *
     * @param key a key
     * @return the value, may be null
     * @throws KeyNotFoundException if the key is not present
     */
    public V get(K key) {
        return index.cell(key).get();
    }

    public Option<V> find(K key) {
        return index.find(key).map(ValueCell::get);
    }

    /**
     * Returns the value of the key, or the given default value if the key is
     * not present. The set is not changed.
     *
     * @param key          a key
     * @param defaultValue the default value
     * @return the value of the key or the default value
     */
    public V getOrElse(K key, V defaultValue) {
        return index.getOrElse(key, defaultValue);
    }

    /**
     * Returns a mutable view of the value of a present key.
     *
     * @param key a key
     * @return a cell, through which the value can be read and replaced
     * @throws KeyNotFoundException if the key is not present
     */
    public ValueCell<V> cell(K key) {
        return index.cell(key);
    }

    /**
     * Returns a mutable view of the value of the key. If the key is not
     * present, it is added with the given default value first.
     *
     * @param key          a key
     * @param defaultValue the value for the key, if it is not present
     * @return a cell, through which the value can be read and replaced
     */
    public ValueCell<V> cellOrAdd(K key, V defaultValue) {
        final Option<ValueCell<V>> cell = index.find(key);
        return cell.isDefined() ? cell.get() : addLast(key, defaultValue);
    }

    /**
     * Removes a present key.
     * <p>
     * The last key in iteration order takes the position of the removed key.
     *
     * @param key a key
     * @return the value of the removed key
     * @throws KeyNotFoundException if the key is not present; the set is not changed
     */
    public V remove(K key) {
        final V value = index.remove(key);
        order.swapRemove(order.indexOf(key));
        size--;
        return value;
    }

    /**
     * Removes all keys, one at a time, starting with the last key.
     */
    public void clear() {
        while (size > 0) {
            index.remove(order.popBack());
            size--;
        }
    }

    /**
     * Returns the first entry in iteration order.
     *
     * @return the first entry
     * @throws NoSuchElementException if the set is empty
     */
    public Tuple2<K, V> head() {
        if (isEmpty()) {
            throw new NoSuchElementException("head of empty OrderedSet");
        }
        return entry(order.get(0));
    }

    /**
     * Returns the last entry in iteration order.
     *
     * @return the last entry
     * @throws NoSuchElementException if the set is empty
     */
    public Tuple2<K, V> last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty OrderedSet");
        }
        return entry(order.last());
    }

    public Vector<K> keys() {
        return order.toVector();
    }

    public Vector<V> values() {
        return iterator().map(Tuple2::_2).toVector();
    }

    /**
     * Returns an iterator over a snapshot of the entries of this set in
     * iteration order. The iterator does not change the set, and changes of
     * the set do not affect the iterator, except for values that are
     * replaced in place.
     *
     * @return an iterator
     */
    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        final HashMap<K, ValueCell<V>> cells = index.toHashMap();
        return order.iterator().map(key -> Tuple.of(key, cells.get(key).get().get()));
    }

    /**
     * Performs the given action for each entry in iteration order.
     * The set is not changed, and can be iterated again.
     *
     * @param action an action
     * @throws NullPointerException if {@code action} is null
     */
    public void forEachEntry(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action is null");
        iterator().forEachRemaining(t -> action.accept(t._1, t._2));
    }

    /**
     * Removes all entries from this set and passes them to the given action
     * in iteration order.
     *
     * @param action an action
     * @throws NullPointerException if {@code action} is null
     */
    public void drain(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action is null");
        drainingIterator().forEachRemaining(t -> action.accept(t._1, t._2));
    }

    /**
     * Removes all entries from this set and passes them to the given action
     * in reverse iteration order.
     *
     * @param action an action
     * @throws NullPointerException if {@code action} is null
     */
    public void drainReverse(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action is null");
        drainingReverseIterator().forEachRemaining(t -> action.accept(t._1, t._2));
    }

    /**
     * Takes over all entries of this set and returns an iterator that
     * hands them out in iteration order. This set is empty when this method
     * returns. Entries that the iterator has not handed out yet are only
     * reachable through the iterator.
     *
     * @return a draining iterator
     */
    public Iterator<Tuple2<K, V>> drainingIterator() {
        final OrderedSet<K, V> taken = takeAll();
        taken.order.reverse();
        return new DrainingIterator<>(taken);
    }

    /**
     * Takes over all entries of this set and returns an iterator that
     * hands them out in reverse iteration order. This set is empty when this
     * method returns.
     *
     * @return a draining iterator
     */
    public Iterator<Tuple2<K, V>> drainingReverseIterator() {
        return new DrainingIterator<>(takeAll());
    }

    public java.util.LinkedHashMap<K, V> toJavaMap() {
        final java.util.LinkedHashMap<K, V> map = new java.util.LinkedHashMap<>();
        forEachEntry(map::put);
        return map;
    }

    public LinkedHashMap<K, V> toLinkedHashMap() {
        return LinkedHashMap.ofEntries(iterator());
    }

    /**
     * Two sets are equal if they contain equal entries in the same iteration order.
     *
     * @param o an object
     * @return true if {@code o} is an OrderedSet with the same entries in the same order
     */
    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof OrderedSet)) {
            return false;
        }
        final OrderedSet<?, ?> that = (OrderedSet<?, ?>) o;
        return size == that.size && iterator().toVector().equals(that.iterator().toVector());
    }

    @Override
    public int hashCode() {
        return iterator().toVector().hashCode();
    }

    public String stringPrefix() {
        return "OrderedSet";
    }

    @Override
    public String toString() {
        return iterator().map(t -> t._1 + " -> " + t._2).mkString(stringPrefix() + "(", ", ", ")");
    }

    /**
     * Checks that the index and the order describe the same keys, that no key
     * occurs twice in the order, and that the size matches both structures.
     */
    boolean isConsistent() {
        if (size != order.length() || size != index.size()) {
            return false;
        }
        final HashSet<K> keys = HashSet.ofAll(order.iterator());
        return keys.size() == size && keys.forAll(index::contains);
    }

    private ValueCell<V> addLast(K key, V value) {
        final ValueCell<V> cell = index.add(key, value);
        order.pushBack(key);
        size++;
        return cell;
    }

    private Tuple2<K, V> entry(K key) {
        return Tuple.of(key, index.cell(key).get());
    }

    private OrderedSet<K, V> takeAll() {
        final OrderedSet<K, V> taken = new OrderedSet<>(index, order, size);
        index = new KeyIndex<>();
        order = new KeyOrder<>();
        size = 0;
        return taken;
    }

    /**
     * Pops entries from the back of the set that it owns.
     */
    private static final class DrainingIterator<K, V> implements Iterator<Tuple2<K, V>> {
        private final OrderedSet<K, V> owned;

        DrainingIterator(OrderedSet<K, V> owned) {
            this.owned = owned;
        }

        @Override
        public boolean hasNext() {
            return owned.size > 0;
        }

        @Override
        public Tuple2<K, V> next() {
            if (!hasNext()) {
                throw new NoSuchElementException("next() on empty iterator");
            }
            final K key = owned.order.popBack();
            final V value = owned.index.remove(key);
            owned.size--;
            return Tuple.of(key, value);
        }
    }
}
