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

import io.vavr.collection.Iterator;
import io.vavr.collection.Vector;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * KeyOrder is a growable sequence of keys that records the order in which
 * keys were inserted.
 * <p>
 * The implementation holds a persistent {@link Vector}, which is based on a
 * `bit-mapped trie`, a very wide and shallow tree (i.e. depth ≤ 6).
 * Every mutation replaces the vector by an updated copy. Appending and
 * removing at the end are effectively constant; {@link #swapRemove(int)}
 * is effectively constant because it only touches the given slot and the
 * last slot.
 * <p>
 * Iterators and {@link #toVector()} return snapshots: later mutations of this
 * instance are not visible through them.
 *
 * @param <K> Component type of the KeyOrder.
 */
final class KeyOrder<K> {

    private Vector<K> vector;

    KeyOrder() {
        this.vector = Vector.empty();
    }

    boolean isDefinedAt(int index) {
        return 0 <= index && index < length();
    }

    int length() {
        return vector.length();
    }

    boolean isEmpty() {
        return length() == 0;
    }

    K get(int index) {
        if (isDefinedAt(index)) {
            return vector.get(index);
        }
        throw new IndexOutOfBoundsException("get(" + index + ")");
    }

    K last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty KeyOrder");
        }
        return vector.last();
    }

    void pushBack(K key) {
        vector = vector.append(key);
    }

    K popBack() {
        if (isEmpty()) {
            throw new NoSuchElementException("popBack of empty KeyOrder");
        }
        final K key = vector.last();
        vector = vector.init();
        return key;
    }

    /**
     * Removes the key at the given index by moving the last key into its slot.
     * The relative order of the remaining keys is not preserved.
     *
     * @param index an index
     * @return the removed key
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    K swapRemove(int index) {
        if (!isDefinedAt(index)) {
            throw new IndexOutOfBoundsException("swapRemove(" + index + ")");
        }
        final K removed = vector.get(index);
        final int lastIndex = length() - 1;
        if (index != lastIndex) {
            vector = vector.update(index, vector.get(lastIndex));
        }
        vector = vector.init();
        return removed;
    }

    void reverse() {
        vector = vector.reverse();
    }

    /**
     * Finds the index of the given key by scanning from the front.
     *
     * @param key a key, may be null
     * @return the index of the key, or -1
     */
    int indexOf(K key) {
        int index = 0;
        for (K k : vector) {
            if (Objects.equals(k, key)) {
                return index;
            }
            index++;
        }
        return -1;
    }

    Iterator<K> iterator() {
        return vector.iterator();
    }

    Vector<K> toVector() {
        return vector;
    }
}
