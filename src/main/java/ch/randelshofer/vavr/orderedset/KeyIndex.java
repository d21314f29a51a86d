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

import io.vavr.collection.HashMap;
import io.vavr.control.Option;

/**
 * Maps keys to value cells.
 * <p>
 * The index holds a persistent {@link HashMap}, which is a hash array mapped
 * trie. Structural changes replace the trie root; replacing the value of a
 * present key only writes to its {@link ValueCell} and leaves the trie
 * untouched.
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>contains, cell, find: O(1) in an amortized sense</li>
 *     <li>add, remove: O(1) in an amortized sense, plus the copy of a path
 *     from the root, whose length is bounded by the fixed height of the trie</li>
 * </ul>
 *
 * @param <K> the key type
 * @param <V> the value type
 */
final class KeyIndex<K, V> {

    private HashMap<K, ValueCell<V>> map;

    KeyIndex() {
        this.map = HashMap.empty();
    }

    boolean contains(K key) {
        return map.containsKey(key);
    }

    int size() {
        return map.size();
    }

    ValueCell<V> add(K key, V value) {
        if (map.containsKey(key)) {
            throw new KeyAlreadyExistsException(key);
        }
        final ValueCell<V> cell = new ValueCell<>(value);
        map = map.put(key, cell);
        return cell;
    }

    Option<ValueCell<V>> find(K key) {
        return map.get(key);
    }

    ValueCell<V> cell(K key) {
        return map.get(key).getOrElseThrow(() -> new KeyNotFoundException(key));
    }

    V getOrElse(K key, V defaultValue) {
        return map.get(key).map(ValueCell::get).getOrElse(defaultValue);
    }

    V remove(K key) {
        final ValueCell<V> cell = cell(key);
        map = map.remove(key);
        return cell.get();
    }

    HashMap<K, ValueCell<V>> toHashMap() {
        return map;
    }
}
