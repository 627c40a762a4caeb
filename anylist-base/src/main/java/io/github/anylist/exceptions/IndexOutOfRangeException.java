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

package io.github.anylist.exceptions;

/**
 * Thrown when a positional write addresses a slot that does not exist.
 * <p>
 * The list that throws this exception is left exactly as it was before the call.
 */
public class IndexOutOfRangeException extends IndexOutOfBoundsException {
    private static final long serialVersionUID = 1L;

    private final int index;
    private final int size;

    /**
     * Creates an exception for an index that is not in {@code [0, size)}.
     * @param index the rejected index
     * @param size the size of the list at the time of the call
     */
    public IndexOutOfRangeException(int index, int size) {
        super(String.format("Index %d out of range for size %d", index, size));
        this.index = index;
        this.size = size;
    }

    /**
     * @return the rejected index
     */
    public int index() {
        return index;
    }

    /**
     * @return the size of the list when the index was rejected
     */
    public int size() {
        return size;
    }
}
