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
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class KeyOrderTest {

    private static KeyOrder<String> keyOrderOf(String... keys) {
        final KeyOrder<String> order = new KeyOrder<>();
        for (String key : keys) {
            order.pushBack(key);
        }
        return order;
    }

    // -- pushBack, popBack

    @Test
    public void shouldKeepKeysInOrderOfPushBack() {
        final KeyOrder<String> order = keyOrderOf("c", "a", "b");
        assertThat(order.length()).isEqualTo(3);
        assertThat(order.toVector()).containsExactly("c", "a", "b");
    }

    @Test
    public void shouldPopKeysFromTheBack() {
        final KeyOrder<String> order = keyOrderOf("a", "b", "c");
        assertThat(order.popBack()).isEqualTo("c");
        assertThat(order.popBack()).isEqualTo("b");
        assertThat(order.length()).isEqualTo(1);
    }

    @Test
    public void shouldThrowWhenPoppingEmptyKeyOrder() {
        assertThatThrownBy(() -> new KeyOrder<String>().popBack())
                .isInstanceOf(NoSuchElementException.class)
                .hasMessage("popBack of empty KeyOrder");
    }

    @Test
    public void shouldThrowWhenTakingLastOfEmptyKeyOrder() {
        assertThatThrownBy(() -> new KeyOrder<String>().last())
                .isInstanceOf(NoSuchElementException.class);
    }

    // -- get

    @Test
    public void shouldGetKeyByIndex() {
        final KeyOrder<String> order = keyOrderOf("a", "b", "c");
        assertThat(order.get(0)).isEqualTo("a");
        assertThat(order.get(2)).isEqualTo("c");
        assertThat(order.last()).isEqualTo("c");
    }

    @Test
    public void shouldThrowWhenGettingOutOfRange() {
        final KeyOrder<String> order = keyOrderOf("a");
        assertThatThrownBy(() -> order.get(1))
                .isInstanceOf(IndexOutOfBoundsException.class)
                .hasMessage("get(1)");
        assertThatThrownBy(() -> order.get(-1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    // -- swapRemove

    @Test
    public void shouldMoveLastKeyIntoRemovedSlot() {
        final KeyOrder<String> order = keyOrderOf("a", "b", "c", "d");
        assertThat(order.swapRemove(1)).isEqualTo("b");
        assertThat(order.toVector()).containsExactly("a", "d", "c");
    }

    @Test
    public void shouldSwapRemoveLastKeyWithoutReordering() {
        final KeyOrder<String> order = keyOrderOf("a", "b", "c");
        assertThat(order.swapRemove(2)).isEqualTo("c");
        assertThat(order.toVector()).containsExactly("a", "b");
    }

    @Test
    public void shouldSwapRemoveSingleKey() {
        final KeyOrder<String> order = keyOrderOf("a");
        assertThat(order.swapRemove(0)).isEqualTo("a");
        assertThat(order.isEmpty()).isTrue();
    }

    @Test
    public void shouldThrowWhenSwapRemovingOutOfRange() {
        final KeyOrder<String> order = keyOrderOf("a", "b");
        assertThatThrownBy(() -> order.swapRemove(2))
                .isInstanceOf(IndexOutOfBoundsException.class)
                .hasMessage("swapRemove(2)");
        assertThat(order.toVector()).containsExactly("a", "b");
    }

    // -- reverse, indexOf

    @Test
    public void shouldReverse() {
        final KeyOrder<String> order = keyOrderOf("a", "b", "c");
        order.reverse();
        assertThat(order.toVector()).containsExactly("c", "b", "a");
    }

    @Test
    public void shouldFindIndexOfKey() {
        final KeyOrder<String> order = keyOrderOf("a", null, "c");
        assertThat(order.indexOf("c")).isEqualTo(2);
        assertThat(order.indexOf(null)).isEqualTo(1);
        assertThat(order.indexOf("x")).isEqualTo(-1);
    }

    // -- snapshots

    @Test
    public void shouldNotSeeLaterChangesThroughSnapshots() {
        final KeyOrder<String> order = keyOrderOf("a", "b");
        final Iterator<String> it = order.iterator();
        final Vector<String> snapshot = order.toVector();
        order.pushBack("c");
        order.swapRemove(0);
        assertThat(it.toList()).containsExactly("a", "b");
        assertThat(snapshot).containsExactly("a", "b");
    }
}
