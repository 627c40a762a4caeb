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

import io.github.anylist.list.HeterogeneousList;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;

public class ListIntroTest {

    @Test
    public void tutorialLeavesExpectedContents() {
        HeterogeneousList list = ListIntro.run();

        assertEquals(5, list.size());
        assertEquals(Optional.of(true), list.get(0, Boolean.class));
        assertEquals(Optional.of(43), list.get(1, Integer.class));
        assertEquals(Optional.of("hello, world"), list.get(2, String.class));
        assertEquals(Optional.of('x'), list.get(3, Character.class));
        assertEquals(Optional.empty(), list.get(3, Double.class));
        assertEquals(Optional.of(List.of("a", "b")), list.get(4, List.class));
        assertEquals("[true, 43, hello, world, x, [a, b]]", list.toString());
    }

    @Test
    public void mainRuns() {
        ListIntro.main(new String[0]);
    }
}
