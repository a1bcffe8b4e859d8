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

package io.github.simplevector.exceptions;

/**
 * Thrown by the checked accessors of {@link io.github.simplevector.GrowableArray} when an index
 * falls outside the visible sequence. Carries the offending index and the size at the time of the
 * access so callers can report or recover at the call site.
 */
public class OutOfRangeException extends IndexOutOfBoundsException {
    private static final long serialVersionUID = 1L;

    private final int index;
    private final int size;

    /**
     * Creates an exception for an access at {@code index} into a sequence of {@code size} elements.
     * @param index the requested index
     * @param size the number of visible elements
     */
    public OutOfRangeException(int index, int size) {
        super(String.format("Index %d out of range for size %d", index, size));
        this.index = index;
        this.size = size;
    }

    /**
     * @return the index that was requested
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return the number of visible elements when the access was attempted
     */
    public int getSize() {
        return size;
    }
}
