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

package io.github.simplevector.growth;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.simplevector.util.ArrayUtil;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestGrowthPolicy extends RandomizedTest {

    @Test
    public void testDefaultDoubles() {
        var policy = GrowthPolicy.ofFactor(GrowthPolicy.DEFAULT_GROWTH_FACTOR);
        assertEquals(1, policy.grow(0, 1));
        assertEquals(2, policy.grow(1, 2));
        assertEquals(8, policy.grow(4, 5));
        assertEquals(100, policy.grow(4, 100));
    }

    @Test
    public void testNeverUndershootsRequest() {
        for (int i = 0; i < 100; i++) {
            double factor = 1.0 + getRandom().nextDouble() * 3;
            var policy = GrowthPolicy.ofFactor(factor);
            int capacity = randomIntBetween(0, 10_000);
            int requested = capacity + randomIntBetween(1, 10_000);
            int grown = policy.grow(capacity, requested);
            assertTrue(grown >= requested);
            assertTrue(grown >= Math.ceil(capacity * factor));
        }
    }

    @Test
    public void testFactorOfOneGrowsToRequest() {
        var policy = GrowthPolicy.ofFactor(1.0);
        assertEquals(5, policy.grow(4, 5));
    }

    @Test
    public void testFractionalFactorRoundsUp() {
        var policy = GrowthPolicy.ofFactor(1.5);
        assertEquals(6, policy.grow(4, 5));
        assertEquals(5, policy.grow(3, 4));
    }

    @Test
    public void testGrowthIsCappedAtMaxArrayLength() {
        var policy = GrowthPolicy.ofFactor(2.0);
        int capacity = ArrayUtil.MAX_ARRAY_LENGTH - 10;
        assertEquals(ArrayUtil.MAX_ARRAY_LENGTH, policy.grow(capacity, capacity + 1));
        assertThrows(IllegalArgumentException.class, () -> policy.grow(capacity, Integer.MAX_VALUE));
        assertThrows(IllegalArgumentException.class, () -> policy.grow(capacity, -1));
    }

    @Test
    public void testInvalidFactorsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> GrowthPolicy.ofFactor(0.99));
        assertThrows(IllegalArgumentException.class, () -> GrowthPolicy.ofFactor(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> GrowthPolicy.ofFactor(Double.POSITIVE_INFINITY));
    }

    @Test
    public void testParseFactor() {
        assertEquals(2.0, GrowthPolicy.parseFactor(null), 0.0);
        assertEquals(2.0, GrowthPolicy.parseFactor("  "), 0.0);
        assertEquals(1.5, GrowthPolicy.parseFactor(" 1.5 "), 0.0);
        assertEquals(2.0, GrowthPolicy.parseFactor("fast"), 0.0);
        assertEquals(2.0, GrowthPolicy.parseFactor("NaN"), 0.0);
        assertEquals(1.0, GrowthPolicy.parseFactor("0.5"), 0.0);
    }

    @Test
    public void testDefaultPolicyIsAtLeastOne() {
        assertTrue(GrowthPolicy.getDefault().getFactor() >= GrowthPolicy.MIN_GROWTH_FACTOR);
    }
}
