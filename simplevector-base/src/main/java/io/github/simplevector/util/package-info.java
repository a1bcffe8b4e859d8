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
 * Provides low-level helpers shared by the container and its buffer.
 *
 * <ul>
 *   <li><b>Array sizing</b>: {@link io.github.simplevector.util.ArrayUtil} validates requested
 *       lengths and computes scaled lengths for amortized growth.
 *   <li><b>Memory estimation</b>: {@link io.github.simplevector.util.RamUsageEstimator} and
 *       {@link io.github.simplevector.util.Accountable} estimate shallow object sizes.
 * </ul>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * int newLength = ArrayUtil.scaledLength(16, 17, 2.0); // 32
 * long bytes = RamUsageEstimator.shallowSizeOfObjectArray(newLength);
 * }</pre>
 */
package io.github.simplevector.util;
