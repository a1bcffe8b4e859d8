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

/**
 * Methods for sizing arrays.
 */
public final class ArrayUtil {
    /**
     * Maximum length for an array (Integer.MAX_VALUE - RamUsageEstimator.NUM_BYTES_ARRAY_HEADER).
     */
    public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - RamUsageEstimator.NUM_BYTES_ARRAY_HEADER;

    private ArrayUtil() {
    }

    /**
     * Returns an array length that is at least {@code minLength} and, when possible,
     * {@code currentLength} scaled by {@code factor}. The result never exceeds
     * {@link #MAX_ARRAY_LENGTH}.
     *
     * @param currentLength the current array length
     * @param minLength the minimum length the caller needs
     * @param factor the multiplier to apply to {@code currentLength}, at least 1.0
     * @return the new array length
     * @throws IllegalArgumentException if {@code minLength} is negative or larger than {@link #MAX_ARRAY_LENGTH}
     */
    public static int scaledLength(int currentLength, int minLength, double factor) {
        // a negative minLength usually means the caller overflowed int
        checkLength(minLength);
        assert factor >= 1.0 : "growth factor must be at least 1.0, got " + factor;

        double scaled = Math.ceil(currentLength * factor);
        int grown = scaled >= MAX_ARRAY_LENGTH ? MAX_ARRAY_LENGTH : (int) scaled;
        return Math.max(minLength, grown);
    }

    /**
     * Verifies that an array of {@code length} elements can be allocated.
     * @param length the requested length
     * @return {@code length}
     * @throws IllegalArgumentException if the length is negative or exceeds {@link #MAX_ARRAY_LENGTH}
     */
    public static int checkLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException(String.format("array length must be non-negative, got %d", length));
        }
        if (length > MAX_ARRAY_LENGTH) {
            throw new IllegalArgumentException(String.format("requested array size %d exceeds maximum array in java (%d)", length, MAX_ARRAY_LENGTH));
        }
        return length;
    }
}
