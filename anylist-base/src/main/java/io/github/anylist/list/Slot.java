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

import java.util.Objects;
import java.util.Optional;

/**
 * One position of a {@link HeterogeneousList}: a non-null value together with the type tag
 * it was stored under.
 * <p>
 * Slots are immutable. They are what iteration hands out, so callers can display every
 * element through {@link #toString()} without knowing its type, and recover the value only
 * through an exact type check with {@link #as(Class)}.
 */
public final class Slot {
    private final Class<?> type;
    private final Object value;

    private Slot(Class<?> type, Object value) {
        this.type = type;
        this.value = value;
    }

    /**
     * Creates a slot tagged with the runtime class of {@code value}.
     */
    static Slot of(Object value) {
        Objects.requireNonNull(value, "value");
        return new Slot(value.getClass(), value);
    }

    /**
     * Creates a slot tagged with the declared {@code type}, which {@code value} must be an
     * instance of.
     */
    static <T> Slot of(Class<T> type, T value) {
        Class<T> tag = Types.boxed(type);
        Objects.requireNonNull(value, "value");
        return new Slot(tag, tag.cast(value));
    }

    Object value() {
        return value;
    }

    /**
     * Returns the type tag of this slot. For values inserted without an explicit type this is
     * the runtime class of the value; otherwise it is the declared type, with primitive types
     * replaced by their wrappers.
     * @return the type tag
     */
    public Class<?> type() {
        return type;
    }

    /**
     * Checks whether this slot's type tag is exactly {@code type}. Supertypes, interfaces and
     * numerically compatible types do not match.
     * @param type the type to test for
     * @return true iff the tag equals {@code type} after primitive normalization
     */
    public boolean is(Class<?> type) {
        return type != void.class && this.type == Types.boxed(type);
    }

    /**
     * Returns the value if this slot's type tag is exactly {@code type}.
     * @param type the expected type
     * @param <T> the expected type
     * @return the value, or empty on a type mismatch
     */
    public <T> Optional<T> as(Class<T> type) {
        if (!is(type)) {
            return Optional.empty();
        }
        return Optional.of(Types.boxed(type).cast(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Slot)) {
            return false;
        }
        Slot other = (Slot) o;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
