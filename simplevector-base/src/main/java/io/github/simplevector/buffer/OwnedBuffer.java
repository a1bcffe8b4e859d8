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

package io.github.simplevector.buffer;

import io.github.simplevector.util.ArrayUtil;
import io.github.simplevector.util.RamUsageEstimator;

import java.util.function.Supplier;

/**
 * A single contiguous block of element slots, sized once at allocation and exclusively owned by
 * whoever holds it. The buffer cannot grow; callers that need more room allocate a larger buffer,
 * relocate into it with {@link #copyTo}, and {@link #swap} it into place.
 * <p>
 * Index access is raw: apart from the JVM's own array bounds check, no validation is done.
 *
 * @param <T> the element type
 */
public final class OwnedBuffer<T> {
    private static final Object[] EMPTY_SLOTS = new Object[0];

    private Object[] slots;

    private OwnedBuffer(Object[] slots) {
        this.slots = slots;
    }

    /**
     * Allocates a buffer of {@code length} slots, each initially {@code null}.
     * @param length the number of slots
     * @param <T> the element type
     * @return the new buffer
     * @throws IllegalArgumentException if {@code length} is negative or too large for a Java array
     */
    public static <T> OwnedBuffer<T> allocate(int length) {
        ArrayUtil.checkLength(length);
        return new OwnedBuffer<>(length == 0 ? EMPTY_SLOTS : new Object[length]);
    }

    /**
     * @param <T> the element type
     * @return a zero-length buffer
     */
    public static <T> OwnedBuffer<T> empty() {
        return new OwnedBuffer<>(EMPTY_SLOTS);
    }

    public int length() {
        return slots.length;
    }

    @SuppressWarnings("unchecked")
    public T get(int index) {
        return (T) slots[index];
    }

    public void set(int index, T value) {
        slots[index] = value;
    }

    /**
     * Stores a fresh value from {@code values} into every slot of {@code [from, to)}.
     */
    public void fill(int from, int to, Supplier<? extends T> values) {
        for (int i = from; i < to; i++) {
            slots[i] = values.get();
        }
    }

    /**
     * Relocates {@code length} slots starting at {@code srcPos} into {@code dest} starting at
     * {@code destPos}. Overlapping ranges within the same buffer are handled as if the source
     * range were first copied to a temporary location.
     */
    public void copyTo(int srcPos, OwnedBuffer<T> dest, int destPos, int length) {
        System.arraycopy(slots, srcPos, dest.slots, destPos, length);
    }

    /**
     * Exchanges storage with {@code other}. Neither buffer is copied.
     */
    public void swap(OwnedBuffer<T> other) {
        Object[] tmp = slots;
        slots = other.slots;
        other.slots = tmp;
    }

    /**
     * @return the shallow size of the slot array; referenced elements are not counted
     */
    public long ramBytesUsed() {
        return RamUsageEstimator.shallowSizeOfObjectArray(slots.length);
    }
}
