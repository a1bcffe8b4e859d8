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

/**
 * A request to pre-size a {@link GrowableArray} without populating it. Passing a hint to a
 * constructor yields an empty array with the requested capacity, whereas passing a plain
 * {@code int} yields that many default elements.
 *
 * <pre>{@code
 * import static io.github.simplevector.ReservationHint.reserve;
 *
 * var ids = new GrowableArray<Integer>(reserve(10));
 * }</pre>
 */
public final class ReservationHint {
    private final int capacity;

    private ReservationHint(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Creates a hint requesting {@code capacity} slots.
     * @param capacity the capacity to reserve
     * @return the hint
     * @throws IllegalArgumentException if {@code capacity} is negative
     */
    public static ReservationHint reserve(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException(String.format("Cannot reserve a negative capacity %d", capacity));
        }
        return new ReservationHint(capacity);
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReservationHint && ((ReservationHint) o).capacity == capacity;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(capacity);
    }

    @Override
    public String toString() {
        return "ReservationHint(" + capacity + ")";
    }
}
