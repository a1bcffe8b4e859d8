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

import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Describes how a {@link GrowableArray} materializes elements it did not receive from the caller,
 * and how it copies the ones it did.
 * <p>
 * {@link #defaultValue()} fills slots exposed by growth (for example by
 * {@link GrowableArray#resize(int)}), and {@link #copy(Object)} is applied by the copying
 * operations ({@code pushBack}, {@code insert}, the copy constructor). The owned variants
 * ({@code pushBackOwned}, {@code insertOwned}) store the caller's reference as-is.
 *
 * @param <T> the element type
 */
public interface ElementType<T> {
    /**
     * @return a fresh default element; may be {@code null}
     */
    T defaultValue();

    /**
     * Returns a copy of {@code value} that the container can own independently of the caller.
     * The default implementation returns {@code value} itself, which is correct for immutable types.
     * @param value the value to copy, possibly {@code null}
     * @return the copy
     */
    default T copy(T value) {
        return value;
    }

    /**
     * @param <T> the element type
     * @return an element type whose default is {@code null} and whose copy is the identity
     */
    static <T> ElementType<T> nullable() {
        return () -> null;
    }

    /**
     * @param defaults supplies default elements
     * @param <T> the element type
     * @return an element type with identity copies
     */
    static <T> ElementType<T> of(Supplier<? extends T> defaults) {
        return of(defaults, UnaryOperator.identity());
    }

    /**
     * @param defaults supplies default elements
     * @param copier copies elements the container takes from callers
     * @param <T> the element type
     * @return the element type
     */
    static <T> ElementType<T> of(Supplier<? extends T> defaults, UnaryOperator<T> copier) {
        Objects.requireNonNull(defaults, "defaults");
        Objects.requireNonNull(copier, "copier");
        return new ElementType<>() {
            @Override
            public T defaultValue() {
                return defaults.get();
            }

            @Override
            public T copy(T value) {
                return copier.apply(value);
            }
        };
    }
}
