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

import java.util.Objects;
import java.util.function.Function;

/**
 * A mutable view of the value that an {@link OrderedSet} binds to a key.
 * <p>
 * Writing to a cell is visible to subsequent lookups of the same key.
 * Once the key has been removed from the set, the cell is detached and
 * writing to it no longer affects the set.
 *
 * @param <V> the value type
 */
public final class ValueCell<V> {

    private V value;

    ValueCell(V value) {
        this.value = value;
    }

    /**
     * Returns the current value.
     *
     * @return the value, may be null
     */
    public V get() {
        return value;
    }

    /**
     * Replaces the current value.
     *
     * @param value the new value, may be null
     * @return the previous value
     */
    public V set(V value) {
        final V old = this.value;
        this.value = value;
        return old;
    }

    /**
     * Replaces the current value with the result of applying the given function to it.
     *
     * @param updater a function
     * @return the new value
     * @throws NullPointerException if {@code updater} is null
     */
    public V update(Function<? super V, ? extends V> updater) {
        Objects.requireNonNull(updater, "updater is null");
        value = updater.apply(value);
        return value;
    }

    @Override
    public String toString() {
        return "ValueCell(" + value + ")";
    }
}
