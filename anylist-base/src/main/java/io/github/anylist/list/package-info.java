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
 * Provides {@link io.github.anylist.list.HeterogeneousList}, an ordered list whose elements
 * may each have a different type, read back by position with an exact type check.
 *
 * <p>The package has three public types:
 *
 * <ul>
 *   <li>{@link io.github.anylist.list.HeterogeneousList}: the list itself, with
 *       insert / insertAtBeginning / replace / get / getMut / update / clear and iteration.
 *   <li>{@link io.github.anylist.list.Slot}: one element and its type tag, as handed out by
 *       iteration. Every slot can be displayed with {@code toString()} and downcast with
 *       {@link io.github.anylist.list.Slot#as(Class)}.
 *   <li>{@link io.github.anylist.list.SlotRef}: a short-lived handle from {@code getMut} for
 *       modifying one element in place.
 * </ul>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * HeterogeneousList list = new HeterogeneousList();
 * list.insert(42);
 * list.insert("hello");
 * list.insertAtBeginning(3.5);
 *
 * list.get(1, Integer.class);   // Optional[42]
 * list.get(1, Long.class);      // Optional.empty: no widening
 * list.get(9, Integer.class);   // Optional.empty: out of range
 *
 * list.update(1, Integer.class, v -> v + 1);
 * list.replace(2, List.class, List.of("a", "b"));
 *
 * for (Slot slot : list) {
 *     System.out.println(slot.type().getSimpleName() + ": " + slot);
 * }
 * }</pre>
 */
package io.github.anylist.list;
