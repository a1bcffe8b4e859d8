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

/**
 * Provides {@link io.github.simplevector.GrowableArray}, a resizable array with explicit
 * capacity management.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link io.github.simplevector.GrowableArray} - the container. Its first {@code size()}
 *       slots are the visible sequence; capacity beyond that is reserved storage.</li>
 *   <li>{@link io.github.simplevector.ReservationHint} - a construction-time request for capacity
 *       without elements, created with {@link io.github.simplevector.ReservationHint#reserve(int)}.</li>
 *   <li>{@link io.github.simplevector.ElementType} - how default elements are produced and how
 *       elements received from callers are copied.</li>
 * </ul>
 *
 * <h2>Copying and Ownership</h2>
 * <p>
 * {@code pushBack} and {@code insert} store {@link io.github.simplevector.ElementType#copy} of the
 * argument, while {@code pushBackOwned} and {@code insertOwned} store the reference itself. Copying
 * an array ({@code copy()}, the copy constructor, {@code assign}) yields an independent buffer;
 * {@link io.github.simplevector.GrowableArray#moveFrom} hands the buffer over and leaves the source
 * empty.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * import static io.github.simplevector.ReservationHint.reserve;
 *
 * var numbers = new GrowableArray<Integer>(ElementType.of(() -> 0), reserve(10));
 * for (int i = 0; i < 10; i++) {
 *     numbers.pushBack(i);   // never reallocates
 * }
 * numbers.insert(1, 99);     // grows to capacity 20
 * numbers.erase(0);
 * numbers.resize(12);        // exposes default zeros
 * }</pre>
 *
 * @see io.github.simplevector.buffer.OwnedBuffer
 * @see io.github.simplevector.growth.GrowthPolicy
 */
package io.github.simplevector;
