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

import io.github.anylist.exceptions.IndexOutOfRangeException;
import io.github.anylist.util.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An ordered, growable list whose elements may each have a different type.
 * <p>
 * Every element lives in a {@link Slot} that records the element's type tag. Values are read
 * back by position together with the type the caller expects; the read succeeds only when the
 * expected type is exactly the stored tag. There is no widening, narrowing or upcasting:
 * an {@code Integer} cannot be read as a {@code Long}, {@code Number} or {@code Object}.
 * Primitive class tokens are treated as their wrappers, so {@code int.class} and
 * {@code Integer.class} are interchangeable.
 * <p>
 * Typed reads ({@link #get}, {@link #getMut}, {@link #update}) report both an out-of-range
 * index and a type mismatch as absence. {@link #replace} is the one positional operation that
 * treats a bad index as an error, throwing {@link IndexOutOfRangeException} without modifying
 * the list. Callers that need to tell a mismatch from a missing slot can check {@link #size()}
 * or {@link #typeAt(int)} first.
 * <p>
 * The tag of a value inserted without an explicit type is its runtime class. The overloads
 * taking a {@code Class} store the value under that declared type instead, which is how to
 * store an {@code ArrayList} so that it reads back as a {@code List}.
 * <p>
 * Null values have no type and are rejected.
 * <p>
 * This class is not thread-safe. Reads may overlap each other, but writes must be exclusive.
 * Iterators and {@link SlotRef} handles are fail-fast: once the list is modified by anything
 * else, they throw {@link ConcurrentModificationException}.
 */
public class HeterogeneousList implements Iterable<Slot> {
    private static final Logger logger = LoggerFactory.getLogger(HeterogeneousList.class);

    private final ArrayList<Slot> items = new ArrayList<>();

    // bumped by every write; iterators and SlotRefs compare against it
    int modCount;

    /**
     * Creates an empty list.
     */
    public HeterogeneousList() {
    }

    /**
     * Appends {@code value}, tagged with its runtime class.
     * @param value the value to append, not null
     * @param <T> the type of the value
     */
    public <T> void insert(T value) {
        add(items.size(), Slot.of(value));
    }

    /**
     * Appends {@code value}, tagged with the declared {@code type}.
     * @param type the type tag to store the value under
     * @param value the value to append, not null and an instance of {@code type}
     * @param <T> the declared type
     */
    public <T> void insert(Class<T> type, T value) {
        add(items.size(), Slot.of(type, value));
    }

    /**
     * Inserts {@code value} at index 0, tagged with its runtime class. Every existing element
     * moves up by one position.
     * @param value the value to prepend, not null
     * @param <T> the type of the value
     */
    public <T> void insertAtBeginning(T value) {
        add(0, Slot.of(value));
    }

    /**
     * Inserts {@code value} at index 0, tagged with the declared {@code type}. Every existing
     * element moves up by one position.
     * @param type the type tag to store the value under
     * @param value the value to prepend, not null and an instance of {@code type}
     * @param <T> the declared type
     */
    public <T> void insertAtBeginning(Class<T> type, T value) {
        add(0, Slot.of(type, value));
    }

    /**
     * Replaces the element at {@code index} with {@code value}, tagged with its runtime class.
     * The new value need not have the same type as the one it replaces.
     * @param index the position to overwrite
     * @param value the new value, not null
     * @param <T> the type of the new value
     * @throws IndexOutOfRangeException if {@code index} is not in {@code [0, size())}; the list
     *     is left unchanged
     */
    public <T> void replace(int index, T value) {
        Slot slot = Slot.of(value);
        checkIndex(index);
        overwrite(index, slot);
    }

    /**
     * Replaces the element at {@code index} with {@code value}, tagged with the declared
     * {@code type}.
     * @param index the position to overwrite
     * @param type the type tag to store the value under
     * @param value the new value, not null and an instance of {@code type}
     * @param <T> the declared type
     * @throws IndexOutOfRangeException if {@code index} is not in {@code [0, size())}; the list
     *     is left unchanged
     */
    public <T> void replace(int index, Class<T> type, T value) {
        Slot slot = Slot.of(type, value);
        checkIndex(index);
        overwrite(index, slot);
    }

    /**
     * Returns the element at {@code index} if its type tag is exactly {@code type}.
     * @param index the position to read
     * @param type the expected type
     * @param <T> the expected type
     * @return the value, or empty if {@code index} is out of range or the types differ
     */
    public <T> Optional<T> get(int index, Class<T> type) {
        Slot slot = matching(index, type);
        return slot == null ? Optional.empty() : slot.as(type);
    }

    /**
     * Borrows the element at {@code index} for in-place modification, if its type tag is
     * exactly {@code type}. The returned handle stays usable only until the list is modified
     * through some other path; see {@link SlotRef}.
     * @param index the position to borrow
     * @param type the expected type
     * @param <T> the expected type
     * @return a handle on the slot, or empty if {@code index} is out of range or the types differ
     */
    public <T> Optional<SlotRef<T>> getMut(int index, Class<T> type) {
        Slot slot = matching(index, type);
        return slot == null ? Optional.empty() : Optional.of(new SlotRef<>(this, index, Types.boxed(type)));
    }

    /**
     * Replaces the element at {@code index} with {@code fn} applied to it, if its type tag is
     * exactly {@code type}. This is the usual way to modify immutable values in place, for
     * example {@code list.update(0, Integer.class, v -> v + 1)}.
     * @param index the position to update
     * @param type the expected type
     * @param fn computes the new value from the current one
     * @param <T> the expected type
     * @return true if the element was updated, false if {@code index} is out of range or the
     *     types differ
     */
    public <T> boolean update(int index, Class<T> type, UnaryOperator<T> fn) {
        Optional<SlotRef<T>> ref = getMut(index, type);
        if (ref.isEmpty()) {
            return false;
        }
        ref.get().update(fn);
        return true;
    }

    /**
     * Returns the type tag of the element at {@code index}.
     * @param index the position to inspect
     * @return the type tag, or empty if {@code index} is out of range
     */
    public Optional<Class<?>> typeAt(int index) {
        return inRange(index) ? Optional.<Class<?>>of(items.get(index).type()) : Optional.empty();
    }

    /**
     * Number of elements in the list.
     * @return the number of elements
     */
    public int size() {
        return items.size();
    }

    /**
     * @return true iff the list has no elements
     */
    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Removes every element. Clearing an empty list does nothing.
     */
    public void clear() {
        if (!items.isEmpty()) {
            logger.debug("Clearing {} slots", items.size());
        }
        items.clear();
        modCount++;
    }

    /**
     * Returns a fresh traversal of the elements in index order. The iterator does not support
     * removal, and throws {@link ConcurrentModificationException} if the list is modified while
     * it is in use.
     * @return an iterator over the slots of this list
     */
    @Override
    public Iterator<Slot> iterator() {
        return new SlotIterator();
    }

    @Override
    public Spliterator<Slot> spliterator() {
        return Spliterators.spliterator(iterator(), items.size(), Spliterator.ORDERED | Spliterator.NONNULL);
    }

    /**
     * @return a sequential stream over the slots of this list, in index order
     */
    public Stream<Slot> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    Slot slotAt(int index) {
        return items.get(index);
    }

    void overwrite(int index, Slot slot) {
        items.set(index, slot);
        modCount++;
    }

    private void add(int index, Slot slot) {
        items.add(index, slot);
        modCount++;
    }

    private boolean inRange(int index) {
        return index >= 0 && index < items.size();
    }

    private void checkIndex(int index) {
        if (!inRange(index)) {
            logger.debug("Rejecting write to index {} of a list of size {}", index, items.size());
            throw new IndexOutOfRangeException(index, items.size());
        }
    }

    /**
     * @return the slot at {@code index} if it exists and is tagged with {@code type}, else null
     */
    private Slot matching(int index, Class<?> type) {
        Objects.requireNonNull(type, "type");
        // no slot can hold void
        if (type == void.class || !inRange(index)) {
            return null;
        }
        Class<?> tag = Types.boxed(type);
        Slot slot = items.get(index);
        if (slot.type() != tag) {
            if (logger.isTraceEnabled()) {
                logger.trace("Slot {} holds {}, not {}", index, Types.describe(slot.type()), Types.describe(tag));
            }
            return null;
        }
        return slot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HeterogeneousList)) {
            return false;
        }
        return items.equals(((HeterogeneousList) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }

    private class SlotIterator implements Iterator<Slot> {
        private final int expectedModCount = modCount;
        private int cursor;

        @Override
        public boolean hasNext() {
            // a cursor past the end means the list shrank; next() reports it
            return cursor != items.size();
        }

        @Override
        public Slot next() {
            checkForComodification();
            if (cursor >= items.size()) {
                throw new NoSuchElementException();
            }
            return items.get(cursor++);
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }
}
