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

package io.github.simplevector.util;

import org.junit.Assume;
import org.junit.Test;

import java.lang.management.ManagementFactory;
import java.lang.management.PlatformManagedObject;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestArrayUtil {

    @Test
    public void testCheckLength() {
        assertEquals(0, ArrayUtil.checkLength(0));
        assertEquals(ArrayUtil.MAX_ARRAY_LENGTH, ArrayUtil.checkLength(ArrayUtil.MAX_ARRAY_LENGTH));
        assertThrows(IllegalArgumentException.class, () -> ArrayUtil.checkLength(-1));
        assertThrows(IllegalArgumentException.class, () -> ArrayUtil.checkLength(ArrayUtil.MAX_ARRAY_LENGTH + 1));
    }

    @Test
    public void testScaledLength() {
        assertEquals(0, ArrayUtil.scaledLength(0, 0, 2.0));
        assertEquals(20, ArrayUtil.scaledLength(10, 11, 2.0));
        assertEquals(15, ArrayUtil.scaledLength(10, 11, 1.5));
        assertEquals(50, ArrayUtil.scaledLength(10, 50, 2.0));
    }

    @Test
    public void testShallowSizes() {
        assertEquals(0, RamUsageEstimator.alignObjectSize(0));
        assertEquals(RamUsageEstimator.NUM_BYTES_OBJECT_ALIGNMENT, RamUsageEstimator.alignObjectSize(1));
        assertEquals(RamUsageEstimator.NUM_BYTES_ARRAY_HEADER, RamUsageEstimator.shallowSizeOfObjectArray(0));
        assertTrue(RamUsageEstimator.shallowSizeOfObjectArray(10) >= RamUsageEstimator.NUM_BYTES_ARRAY_HEADER + 10L * RamUsageEstimator.NUM_BYTES_OBJECT_REF);
    }

    @Test
    public void testObjectLayoutConstantsAreConsistent() {
        assertEquals(RamUsageEstimator.COMPRESSED_REFS_ENABLED ? 4 : 8, RamUsageEstimator.NUM_BYTES_OBJECT_REF);
        assertEquals(8 + RamUsageEstimator.NUM_BYTES_OBJECT_REF, RamUsageEstimator.NUM_BYTES_OBJECT_HEADER);
        assertEquals(0, RamUsageEstimator.NUM_BYTES_ARRAY_HEADER % RamUsageEstimator.NUM_BYTES_OBJECT_ALIGNMENT);
        assertTrue(RamUsageEstimator.NUM_BYTES_ARRAY_HEADER >= RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + Integer.BYTES);
        assertEquals(Integer.MAX_VALUE - RamUsageEstimator.NUM_BYTES_ARRAY_HEADER, ArrayUtil.MAX_ARRAY_LENGTH);
    }

    @Test
    public void testLayoutIsReadFromTheDiagnosticBean() throws Exception {
        Class<?> beanClass;
        try {
            beanClass = Class.forName(RamUsageEstimator.HOTSPOT_BEAN_CLASS);
        } catch (ClassNotFoundException e) {
            Assume.assumeNoException("no HotSpot diagnostic bean on this runtime", e);
            return;
        }
        Object bean = ManagementFactory.getPlatformMXBean(beanClass.asSubclass(PlatformManagedObject.class));
        Assume.assumeNotNull(bean);
        Object vmOption = beanClass.getMethod("getVMOption", String.class).invoke(bean, "UseCompressedOops");
        boolean compressedOops = Boolean.parseBoolean(vmOption.getClass().getMethod("getValue").invoke(vmOption).toString());
        assertEquals(compressedOops, RamUsageEstimator.COMPRESSED_REFS_ENABLED);
    }
}
