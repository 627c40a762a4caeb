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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestTypes extends RandomizedTest {
    @Test
    public void testPrimitivesMapToWrappers() {
        assertSame(Integer.class, Types.boxed(int.class));
        assertSame(Long.class, Types.boxed(long.class));
        assertSame(Double.class, Types.boxed(double.class));
        assertSame(Float.class, Types.boxed(float.class));
        assertSame(Boolean.class, Types.boxed(boolean.class));
        assertSame(Character.class, Types.boxed(char.class));
        assertSame(Byte.class, Types.boxed(byte.class));
        assertSame(Short.class, Types.boxed(short.class));
    }

    @Test
    public void testReferenceTypesAreUnchanged() {
        assertSame(Integer.class, Types.boxed(Integer.class));
        assertSame(String.class, Types.boxed(String.class));
        assertSame(List.class, Types.boxed(List.class));
        assertSame(int[].class, Types.boxed(int[].class));
    }

    @Test
    public void testVoidIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Types.boxed(void.class));
        assertThrows(NullPointerException.class, () -> Types.boxed(null));
    }

    @Test
    public void testDescribe() {
        assertEquals("Integer", Types.describe(Integer.class));
        assertEquals("ArrayList", Types.describe(ArrayList.class));
        assertEquals("int[]", Types.describe(int[].class));
        assertEquals("null", Types.describe(null));

        Object anonymous = new Object() {};
        assertEquals(anonymous.getClass().getName(), Types.describe(anonymous.getClass()));
    }
}
