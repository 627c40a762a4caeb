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

package io.github.anylist.util;

import java.util.Map;
import java.util.Objects;

/**
 * Utility methods for working with the type tags stored alongside list values.
 */
public class Types {
    /** Private constructor to prevent instantiation. */
    private Types() {
    }

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class);

    /**
     * Returns the class that values of the given type actually have on the heap.
     * Primitive class tokens map to their wrapper classes, so {@code int.class} and
     * {@code Integer.class} name the same type tag. Any other class is returned unchanged.
     *
     * @param type the requested type
     * @param <T> the type
     * @return the wrapper class for a primitive type, otherwise {@code type} itself
     * @throws IllegalArgumentException if {@code type} is {@code void.class}
     */
    @SuppressWarnings("unchecked")
    public static <T> Class<T> boxed(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == void.class) {
            throw new IllegalArgumentException("No value can have type void");
        }
        return (Class<T>) WRAPPERS.get(type);
    }

    /**
     * Returns a short, readable name for the given type, for use in log and error messages.
     * Anonymous and synthetic classes have no simple name, so their binary name is used instead.
     *
     * @param type the type to describe
     * @return a readable name
     */
    public static String describe(Class<?> type) {
        if (type == null) {
            return "null";
        }
        String simple = type.getSimpleName();
        return simple.isEmpty() ? type.getName() : simple;
    }
}
