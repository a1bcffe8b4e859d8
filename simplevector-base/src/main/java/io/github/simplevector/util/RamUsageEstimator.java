/*
 * All changes to the original code are Copyright DataStax, Inc.
 *
 * Please see the included license file for details.
 */

/*
 * Original license:
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.simplevector.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;

/**
 * Estimates the size (memory representation) of Java objects.
 * <p>
 * Only the shallow sizes SimpleVector needs are provided. The JVM layout is read once from the
 * HotSpot diagnostic bean, looked up reflectively so that runtimes without {@code jdk.management}
 * still load this class. On other VMs the estimates fall back to a 64-bit layout with compressed
 * references.
 */
public final class RamUsageEstimator {
    private static final Logger logger = LoggerFactory.getLogger(RamUsageEstimator.class);

    static final String MANAGEMENT_FACTORY_CLASS = "java.lang.management.ManagementFactory";
    static final String HOTSPOT_BEAN_CLASS = "com.sun.management.HotSpotDiagnosticMXBean";

    /** True iff references are compressed to 4 bytes on a 64-bit VM. */
    public static final boolean COMPRESSED_REFS_ENABLED;

    /** Number of bytes this JVM uses to represent an object reference. */
    public static final int NUM_BYTES_OBJECT_REF;

    /** Number of bytes to represent an object header (no fields, no alignments). */
    public static final int NUM_BYTES_OBJECT_HEADER;

    /** Number of bytes to represent an array header (no content, but with alignments). */
    public static final int NUM_BYTES_ARRAY_HEADER;

    /** A constant specifying the object alignment boundary inside the JVM. */
    public static final int NUM_BYTES_OBJECT_ALIGNMENT;

    static {
        boolean compressedOops = true;
        int objectAlignment = 8;
        try {
            final Class<?> beanClazz = Class.forName(HOTSPOT_BEAN_CLASS);
            final Object hotSpotBean = Class.forName(MANAGEMENT_FACTORY_CLASS)
                    .getMethod("getPlatformMXBean", Class.class)
                    .invoke(null, beanClazz);
            if (hotSpotBean != null) {
                final Method getVMOptionMethod = beanClazz.getMethod("getVMOption", String.class);
                compressedOops = Boolean.parseBoolean(vmOptionValue(getVMOptionMethod, hotSpotBean, "UseCompressedOops"));
                objectAlignment = Integer.parseInt(vmOptionValue(getVMOptionMethod, hotSpotBean, "ObjectAlignmentInBytes"));
            }
        } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
            logger.debug("Unable to read JVM object layout, assuming compressed references", e);
        }

        COMPRESSED_REFS_ENABLED = compressedOops;
        NUM_BYTES_OBJECT_ALIGNMENT = objectAlignment;
        NUM_BYTES_OBJECT_REF = COMPRESSED_REFS_ENABLED ? 4 : 8;
        // "mark word" plus a possibly compressed class pointer
        NUM_BYTES_OBJECT_HEADER = 8 + NUM_BYTES_OBJECT_REF;
        // the array length field is an int
        NUM_BYTES_ARRAY_HEADER = (int) alignObjectSize(NUM_BYTES_OBJECT_HEADER + Integer.BYTES);
    }

    private RamUsageEstimator() {
    }

    private static String vmOptionValue(Method getVMOptionMethod, Object hotSpotBean, String name) throws ReflectiveOperationException {
        final Object vmOption = getVMOptionMethod.invoke(hotSpotBean, name);
        return vmOption.getClass().getMethod("getValue").invoke(vmOption).toString();
    }

    /**
     * Aligns an object size to be the next multiple of {@link #NUM_BYTES_OBJECT_ALIGNMENT}.
     * @param size the unaligned size
     * @return the aligned size
     */
    public static long alignObjectSize(long size) {
        size += (long) NUM_BYTES_OBJECT_ALIGNMENT - 1L;
        return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
    }

    /**
     * Returns the shallow size of an {@code Object[]} of the given length; the referenced
     * objects are not counted.
     * @param length the array length
     * @return the aligned size in bytes
     */
    public static long shallowSizeOfObjectArray(int length) {
        return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_OBJECT_REF * length);
    }
}
