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
 * Provides custom exception types used by SimpleVector.
 * <p>
 * Only one condition is reported to callers as a recoverable error: a checked access outside
 * the visible sequence of a {@link io.github.simplevector.GrowableArray}.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.simplevector.exceptions.OutOfRangeException} - An unchecked
 *       {@link java.lang.IndexOutOfBoundsException} thrown by {@code at} and {@code setAt}
 *       when the index is negative or not less than the size.</li>
 * </ul>
 *
 * <h2>Usage Guidelines</h2>
 * <p>
 * Precondition violations on the unchecked accessors ({@code get}, {@code set}, {@code popBack},
 * {@code erase}, {@code insert}) are caller bugs, not recoverable errors. They are caught by
 * {@code assert} statements when assertions are enabled, and are otherwise unspecified.
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     String name = names.at(requested);
 *     render(name);
 * } catch (OutOfRangeException e) {
 *     logger.warn("No entry {} (only {} present)", e.getIndex(), e.getSize());
 * }
 * }</pre>
 *
 * @see io.github.simplevector.exceptions.OutOfRangeException
 */
package io.github.simplevector.exceptions;
