/*
 * Copyright DataStax, Inc.
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

package io.github.simplevector;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.simplevector.growth.GrowthPolicy;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static io.github.simplevector.GrowableArray.compare;
import static io.github.simplevector.GrowableArray.greaterOrEqual;
import static io.github.simplevector.GrowableArray.greaterThan;
import static io.github.simplevector.GrowableArray.lessOrEqual;
import static io.github.simplevector.GrowableArray.lessThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class TestGrowableArrayOrdering extends RandomizedTest {

    @Test
    public void testEquality() {
        var a = GrowableArray.of(1, 2, 3);
        var b = new GrowableArray<Integer>();
        b.setGrowthPolicy(GrowthPolicy.ofFactor(2.0));
        b.pushBack(1);
        b.pushBack(2);
        b.pushBack(3);
        assertEquals(3, a.capacity());
        assertEquals(4, b.capacity());
        assertEquals(a, b);

        b.pushBack(4);
        assertNotEquals(a, b);
        b.popBack();
        assertEquals(a, b);
        b.set(2, 30);
        assertNotEquals(a, b);

        assertNotEquals(a, List.of(1, 2, 3));
        assertNotEquals(a, null);
        assertEquals(GrowableArray.of("x", null), GrowableArray.of("x", null));
    }

    @Test
    public void testLexicographicOrder() {
        var shorter = GrowableArray.of(1, 2);
        var longer = GrowableArray.of(1, 2, 3);
        var bigger = GrowableArray.of(1, 3);

        assertTrue(lessThan(shorter, longer));
        assertTrue(lessThan(longer, bigger));
        assertTrue(lessThan(shorter, bigger));
        assertFalse(lessThan(bigger, longer));

        assertTrue(greaterThan(bigger, longer));
        assertTrue(lessOrEqual(shorter, longer));
        assertTrue(greaterOrEqual(bigger, shorter));
        assertFalse(greaterOrEqual(shorter, longer));

        var empty = new GrowableArray<Integer>();
        assertTrue(lessThan(empty, shorter));
        assertEquals(0, compare(empty, new GrowableArray<>()));
    }

    @Test
    public void testEqualArraysAreBothLessOrEqualAndGreaterOrEqual() {
        var a = GrowableArray.of("a", "b");
        var b = GrowableArray.of("a", "b");
        b.reserve(16);
        assertFalse(lessThan(a, b));
        assertFalse(greaterThan(a, b));
        assertTrue(lessOrEqual(a, b));
        assertTrue(greaterOrEqual(a, b));
        assertEquals(0, compare(a, b));
    }

    @Test
    public void testCustomComparator() {
        var a = GrowableArray.of(3, 1);
        var b = GrowableArray.of(2, 9);
        assertTrue(compare(a, b) > 0);
        assertTrue(compare(a, b, Comparator.reverseOrder()) < 0);
    }

    @Test
    public void testSortingMatchesListOrder() {
        var arrays = new ArrayList<GrowableArray<Integer>>();
        for (int i = 0; i < 50; i++) {
            var array = new GrowableArray<Integer>();
            int n = randomIntBetween(0, 4);
            for (int j = 0; j < n; j++) {
                array.pushBack(randomIntBetween(0, 3));
            }
            arrays.add(array);
        }

        arrays.sort(GrowableArray.lexicographicOrder());
        for (int i = 1; i < arrays.size(); i++) {
            var prev = arrays.get(i - 1);
            var next = arrays.get(i);
            assertTrue(lessOrEqual(prev, next));
            assertEquals(lessThan(prev, next), !prev.equals(next));
        }
    }
}
