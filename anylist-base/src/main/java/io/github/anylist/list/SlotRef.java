/*
 * Copyright The AnyList Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.anylist.list;

import io.github.anylist.util.Types;

import java.util.ConcurrentModificationException;
import java.util.function.UnaryOperator;

/**
 * Mutable access to a single slot of a {@link HeterogeneousList}, obtained from
 * {@link HeterogeneousList#getMut(int, Class)}.
 * <p>
 * A SlotRef is only valid until the list is modified by anything other than this handle.
 * After an insert, replace, clear, or a write through another SlotRef, every method of this
 * handle throws {@link ConcurrentModificationException}. Request a new handle instead of
 * keeping one around.
 * <p>
 * Writes keep the slot's type tag, so a value written here can always be read back with the
 * same type.
 *
 * @param <T> the type tag of the slot
 */
public final class SlotRef<T> {
    private final HeterogeneousList list;
    private final int index;
    private final Class<T> type;
    private int expectedModCount;

    SlotRef(HeterogeneousList list, int index, Class<T> type) {
        this.list = list;
        this.index = index;
        this.type = type;
        this.expectedModCount = list.modCount;
    }

    /**
     * Returns the current value of the slot. For mutable types, changes made to the returned
     * object are made to the stored value itself.
     * @return the value
     */
    public T get() {
        checkForComodification();
        return type.cast(list.slotAt(index).value());
    }

    /**
     * Stores {@code value} in the slot, keeping the slot's type tag.
     * @param value the new value, an instance of {@link #type()}
     */
    public void set(T value) {
        checkForComodification();
        list.overwrite(index, Slot.of(type, value));
        expectedModCount = list.modCount;
    }

    /**
     * Replaces the value with the result of applying {@code fn} to it.
     * @param fn the function computing the new value
     * @return the new value
     */
    public T update(UnaryOperator<T> fn) {
        T next = fn.apply(get());
        set(next);
        return next;
    }

    /**
     * @return the position of the slot this handle refers to
     */
    public int index() {
        return index;
    }

    /**
     * @return the type tag of the slot
     */
    public Class<T> type() {
        return type;
    }

    /**
     * @return false once the list has been modified other than through this handle
     */
    public boolean isValid() {
        return list.modCount == expectedModCount;
    }

    private void checkForComodification() {
        if (!isValid()) {
            throw new ConcurrentModificationException("List modified since slot " + index + " was borrowed");
        }
    }

    @Override
    public String toString() {
        return "SlotRef(index=" + index + ", type=" + Types.describe(type) + ")";
    }
}
