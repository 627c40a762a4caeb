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

package io.github.anylist.example.tutorial;

import java.util.List;
import java.util.Optional;

import io.github.anylist.exceptions.IndexOutOfRangeException;
import io.github.anylist.list.HeterogeneousList;
import io.github.anylist.list.Slot;
import io.github.anylist.list.SlotRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Walks through every operation of HeterogeneousList.
public class ListIntro {
    private static final Logger log = LoggerFactory.getLogger(ListIntro.class);

    public static void main(String[] args) {
        HeterogeneousList list = run();
        log.info("Final contents: {}", list);
    }

    public static HeterogeneousList run() {
        HeterogeneousList list = new HeterogeneousList();

        // values of any type can be mixed; each is tagged with its runtime class
        list.insert(42);
        list.insert("hello");
        list.insert(2.5);
        // insertAtBeginning shifts everything else up by one
        list.insertAtBeginning(true);
        log.info("After inserts: {} (size {})", list, list.size());

        // reads must name the exact stored type
        Optional<Integer> answer = list.get(1, Integer.class);
        Optional<Long> widened = list.get(1, Long.class);
        log.info("get(1, Integer) = {}, get(1, Long) = {}", answer, widened);

        // out of range looks the same as a mismatch, so check the size or the tag if it matters
        log.info("get(10, Integer) = {}, typeAt(1) = {}", list.get(10, Integer.class), list.typeAt(1));

        // a declared type lets an implementation class be read back through its interface
        list.insert(List.class, List.of("a", "b"));
        log.info("get(4, List) = {}", list.get(4, List.class));

        // borrow a slot for in-place modification
        SlotRef<Integer> ref = list.getMut(1, Integer.class).orElseThrow();
        ref.update(v -> v + 1);
        // or do it in one call
        list.update(2, String.class, s -> s + ", world");

        // replace may change the type at a position
        list.replace(3, 'x');
        try {
            list.replace(list.size(), "nowhere");
        } catch (IndexOutOfRangeException e) {
            log.info("replace rejected: {}", e.getMessage());
        }

        // iteration displays every element without knowing its type
        for (Slot slot : list) {
            log.info("  {} : {}", slot.type().getSimpleName(), slot);
        }

        return list;
    }
}
