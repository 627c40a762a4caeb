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

/**
 * Provides custom exception types used by AnyList.
 * <p>
 * Typed reads never throw for a bad index or a type mismatch: they report absence through
 * {@link java.util.Optional}. The exceptions here cover the one positional write that can be
 * malformed.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.anylist.exceptions.IndexOutOfRangeException} - An unchecked
 *       exception thrown by {@code HeterogeneousList.replace} when the index is not in
 *       {@code [0, size)}. It extends {@link java.lang.IndexOutOfBoundsException}, so existing
 *       handlers for that type also catch it, and it carries the rejected index and the
 *       list size.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     list.replace(index, "updated");
 * } catch (IndexOutOfRangeException e) {
 *     // the list is unchanged
 *     logger.warn("No slot {} in a list of {}", e.index(), e.size());
 * }
 * }</pre>
 *
 * @see io.github.anylist.exceptions.IndexOutOfRangeException
 */
package io.github.anylist.exceptions;
