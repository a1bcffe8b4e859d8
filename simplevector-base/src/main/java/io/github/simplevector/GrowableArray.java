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

import io.github.simplevector.annotations.VisibleForTesting;
import io.github.simplevector.buffer.OwnedBuffer;
import io.github.simplevector.exceptions.OutOfRangeException;
import io.github.simplevector.growth.GrowthPolicy;
import io.github.simplevector.util.Accountable;
import io.github.simplevector.util.RamUsageEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * GrowableArray is a resizable array with explicit capacity management, built on a single
 * {@link OwnedBuffer}. The first {@link #size()} slots of the buffer form the visible sequence;
 * the remaining slots up to {@link #capacity()} are storage reserved for future growth.
 * <p>
 * Whenever an operation needs more room than the capacity allows, a new buffer is allocated, the
 * visible elements are relocated into it, and it is swapped into place. Growth follows the array's
 * {@link GrowthPolicy} (doubling by default), so a sequence of appends costs amortized O(1) each.
 * <p>
 * The unchecked accessors and the positional mutators ({@link #get}, {@link #set},
 * {@link #insert}, {@link #erase}, {@link #popBack}) state their index preconditions as
 * {@code assert}s; violating them is a caller bug. Only {@link #at} and {@link #setAt} report an
 * out-of-range index, by throwing {@link OutOfRangeException}.
 * <p>
 * Positions are plain indexes: {@code 0} is the front and {@code size()} is one past the end.
 * <p>
 * Instances are not thread-safe.
 *
 * @param <T> the element type
 */
public class GrowableArray<T> implements Iterable<T>, Accountable {
    private static final Logger logger = LoggerFactory.getLogger(GrowableArray.class);

    private final ElementType<T> elementType;
    private GrowthPolicy growthPolicy = GrowthPolicy.getDefault();
    private OwnedBuffer<T> items;
    private int size;
    private int capacity;

    /**
     * Creates an empty array whose default element is {@code null}.
     */
    public GrowableArray() {
        this(ElementType.nullable());
    }

    /**
     * Creates an empty array. No storage is allocated.
     * @param elementType supplies default elements and copies
     */
    public GrowableArray(ElementType<T> elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.items = OwnedBuffer.empty();
    }

    /**
     * Creates an array of {@code size} default elements; the capacity equals the size.
     * @param elementType supplies default elements and copies
     * @param size the number of elements
     */
    public GrowableArray(ElementType<T> elementType, int size) {
        this(elementType);
        items = OwnedBuffer.allocate(size);
        items.fill(0, size, elementType::defaultValue);
        this.size = size;
        this.capacity = size;
    }

    /**
     * Creates an array of {@code size} copies of {@code value}; the capacity equals the size.
     * @param elementType supplies default elements and copies
     * @param size the number of elements
     * @param value the value every element is copied from
     */
    public GrowableArray(ElementType<T> elementType, int size, T value) {
        this(elementType);
        items = OwnedBuffer.allocate(size);
        items.fill(0, size, () -> elementType.copy(value));
        this.size = size;
        this.capacity = size;
    }

    /**
     * Creates an empty array with the capacity requested by {@code hint}, and {@code null} as its
     * default element.
     * @param hint the capacity to reserve
     */
    public GrowableArray(ReservationHint hint) {
        this(ElementType.nullable(), hint);
    }

    /**
     * Creates an empty array with the capacity requested by {@code hint}.
     * @param elementType supplies default elements and copies
     * @param hint the capacity to reserve
     */
    public GrowableArray(ElementType<T> elementType, ReservationHint hint) {
        this(elementType);
        reserve(hint.getCapacity());
    }

    /**
     * Creates an independent copy of {@code other}: same visible sequence (each element passed
     * through the element type's copy), same size and same capacity, in a buffer of its own.
     * @param other the array to copy
     */
    public GrowableArray(GrowableArray<T> other) {
        this(other.elementType);
        growthPolicy = other.growthPolicy;
        items = OwnedBuffer.allocate(other.capacity);
        for (int i = 0; i < other.size; i++) {
            items.set(i, elementType.copy(other.items.get(i)));
        }
        size = other.size;
        capacity = other.capacity;
    }

    /**
     * Creates an array holding {@code values} in order, with {@code null} as its default element.
     * The capacity equals the number of values.
     */
    @SafeVarargs
    public static <T> GrowableArray<T> of(T... values) {
        return of(ElementType.nullable(), values);
    }

    /**
     * Creates an array holding copies of {@code values} in order. The capacity equals the number of values.
     */
    @SafeVarargs
    public static <T> GrowableArray<T> of(ElementType<T> elementType, T... values) {
        GrowableArray<T> array = new GrowableArray<>(elementType, ReservationHint.reserve(values.length));
        for (T value : values) {
            array.pushBack(value);
        }
        return array;
    }

    /**
     * Creates an array holding copies of {@code values} in iteration order. The capacity equals
     * the number of values.
     */
    public static <T> GrowableArray<T> copyOf(ElementType<T> elementType, Collection<? extends T> values) {
        GrowableArray<T> array = new GrowableArray<>(elementType, ReservationHint.reserve(values.size()));
        for (T value : values) {
            array.pushBack(value);
        }
        return array;
    }

    /**
     * Transfers the contents of {@code source} into a new array without copying any element.
     * {@code source} is left empty, with no capacity, and remains usable.
     * @param source the array to take the contents from
     * @return a new array holding what {@code source} held
     */
    public static <T> GrowableArray<T> moveFrom(GrowableArray<T> source) {
        GrowableArray<T> moved = new GrowableArray<>(source.elementType);
        moved.growthPolicy = source.growthPolicy;
        moved.swap(source);
        return moved;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public ElementType<T> getElementType() {
        return elementType;
    }

    public GrowthPolicy getGrowthPolicy() {
        return growthPolicy;
    }

    /**
     * Replaces the policy used by subsequent growth. Existing capacity is not affected.
     */
    public void setGrowthPolicy(GrowthPolicy growthPolicy) {
        this.growthPolicy = Objects.requireNonNull(growthPolicy, "growthPolicy");
    }

    /**
     * Returns the element at {@code index} without a range check. The caller guarantees
     * {@code 0 <= index < size()}.
     */
    public T get(int index) {
        assert index >= 0 && index < size : String.format("index %d out of range for size %d", index, size);
        return items.get(index);
    }

    /**
     * Replaces the element at {@code index} without a range check. The caller guarantees
     * {@code 0 <= index < size()}. The value is stored as given, not copied.
     */
    public void set(int index, T value) {
        assert index >= 0 && index < size : String.format("index %d out of range for size %d", index, size);
        items.set(index, value);
    }

    /**
     * Returns the element at {@code index}.
     * @throws OutOfRangeException if {@code index} is negative or not less than {@link #size()}
     */
    public T at(int index) {
        checkIndex(index);
        return items.get(index);
    }

    /**
     * Replaces the element at {@code index}. The value is stored as given, not copied.
     * @throws OutOfRangeException if {@code index} is negative or not less than {@link #size()}
     */
    public void setAt(int index, T value) {
        checkIndex(index);
        items.set(index, value);
    }

    public T front() {
        assert !isEmpty() : "front() on an empty array";
        return items.get(0);
    }

    public T back() {
        assert !isEmpty() : "back() on an empty array";
        return items.get(size - 1);
    }

    /**
     * Ensures room for at least {@code newCapacity} elements. When growth is needed, exactly
     * {@code newCapacity} slots are allocated; otherwise this is a no-op. The size never changes.
     */
    public void reserve(int newCapacity) {
        if (newCapacity > capacity) {
            reallocate(newCapacity);
        }
    }

    /**
     * Changes the number of visible elements. Growing exposes default elements; shrinking makes
     * the trailing elements logically absent without releasing them. When {@code newSize} exceeds
     * the capacity, the capacity becomes the larger of {@code newSize} and the growth policy's
     * scaled capacity.
     *
     * @throws IllegalArgumentException if {@code newSize} is negative
     */
    public void resize(int newSize) {
        if (newSize < 0) {
            throw new IllegalArgumentException(String.format("Cannot resize to a negative size %d", newSize));
        }
        if (newSize > capacity) {
            growFor(newSize);
        }
        if (newSize > size) {
            items.fill(size, newSize, elementType::defaultValue);
        }
        size = newSize;
    }

    /**
     * Appends a copy of {@code value}.
     */
    public void pushBack(T value) {
        pushBackOwned(elementType.copy(value));
    }

    /**
     * Appends {@code value} itself; the array takes over the reference without copying it.
     */
    public void pushBackOwned(T value) {
        if (size == capacity) {
            growFor(size + 1);
        }
        items.set(size, value);
        ++size;
    }

    /**
     * Inserts a copy of {@code value} at {@code index}, shifting the elements at and after
     * {@code index} one position towards the end. {@code index == size()} appends.
     * @return the position of the inserted element, which is {@code index}
     */
    public int insert(int index, T value) {
        return insertOwned(index, elementType.copy(value));
    }

    /**
     * Inserts {@code value} itself at {@code index}; the array takes over the reference without
     * copying it.
     * @return the position of the inserted element, which is {@code index}
     */
    public int insertOwned(int index, T value) {
        assert index >= 0 && index <= size : String.format("insert position %d out of range for size %d", index, size);
        if (size == capacity) {
            growFor(size + 1);
        }
        // arraycopy on the same buffer behaves as a back-to-front shift
        items.copyTo(index, items, index + 1, size - index);
        items.set(index, value);
        ++size;
        return index;
    }

    /**
     * Removes the last element. The array must not be empty.
     */
    public void popBack() {
        assert !isEmpty() : "popBack() on an empty array";
        --size;
    }

    /**
     * Removes the element at {@code index}, shifting the following elements one position
     * towards the front. The capacity is unchanged.
     * @return the position of the element that followed the erased one, which is {@code index};
     * equal to {@link #size()} if the last element was erased
     */
    public int erase(int index) {
        assert index >= 0 && index < size : String.format("erase position %d out of range for size %d", index, size);
        return eraseRange(index, index + 1);
    }

    /**
     * Removes the elements in {@code [from, to)}, shifting the following elements towards the front.
     * @return {@code from}, the position of the first element after the removed range
     */
    public int eraseRange(int from, int to) {
        assert from >= 0 && from <= to && to <= size : String.format("erase range [%d, %d) out of range for size %d", from, to, size);
        items.copyTo(to, items, from, size - to);
        int newSize = size - (to - from);
        // the shifted-out tail would otherwise be referenced twice
        items.fill(newSize, size, () -> null);
        size = newSize;
        return from;
    }

    /**
     * Makes every element logically absent. The capacity is unchanged.
     */
    public void clear() {
        size = 0;
    }

    /**
     * Exchanges buffers, sizes and capacities with {@code other}. No element is copied.
     * <p>
     * The element type and growth policy stay with each array. After a swap, each array copies
     * and grows the contents it received with its own {@link ElementType} and {@link GrowthPolicy}.
     */
    public void swap(GrowableArray<T> other) {
        items.swap(other.items);

        int tmpSize = size;
        size = other.size;
        other.size = tmpSize;

        int tmpCapacity = capacity;
        capacity = other.capacity;
        other.capacity = tmpCapacity;
    }

    /**
     * Replaces the contents of this array with a copy of {@code other}'s. If copying fails, this
     * array is left unchanged.
     */
    public void assign(GrowableArray<T> other) {
        if (other != this) {
            GrowableArray<T> copy = new GrowableArray<>(other);
            swap(copy);
        }
    }

    public GrowableArray<T> copy() {
        return new GrowableArray<>(this);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new OutOfRangeException(index, size);
        }
    }

    private void growFor(int requested) {
        reallocate(growthPolicy.grow(capacity, requested));
    }

    // the new buffer is fully populated before it replaces the old one
    private void reallocate(int newCapacity) {
        logger.trace("Reallocating from {} to {} slots, {} visible", capacity, newCapacity, size);
        OwnedBuffer<T> newItems = OwnedBuffer.allocate(newCapacity);
        items.copyTo(0, newItems, 0, size);
        items.swap(newItems);
        capacity = newCapacity;
    }

    /**
     * Returns a read-only iterator over the visible elements, front to back.
     * {@link Iterator#remove()} is not supported.
     */
    @Override
    public Iterator<T> iterator() {
        return new Itr();
    }

    /**
     * Returns a list iterator over the visible elements that supports
     * {@link ListIterator#set(Object)}. Structural changes through the iterator are not supported.
     */
    public ListIterator<T> listIterator() {
        return new ListItr(0);
    }

    /**
     * Returns a list iterator positioned before {@code index}.
     * @see #listIterator()
     */
    public ListIterator<T> listIterator(int index) {
        if (index < 0 || index > size) {
            throw new OutOfRangeException(index, size);
        }
        return new ListItr(index);
    }

    public Stream<T> stream() {
        return IntStream.range(0, size).mapToObj(items::get);
    }

    public T[] toArray(IntFunction<T[]> generator) {
        T[] result = generator.apply(size);
        for (int i = 0; i < size; i++) {
            result[i] = items.get(i);
        }
        return result;
    }

    /**
     * @return an unmodifiable snapshot of the visible elements
     */
    public List<T> toList() {
        return stream().collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }

    @VisibleForTesting
    int bufferLength() {
        return items.length();
    }

    @Override
    public long ramBytesUsed() {
        int REF_BYTES = RamUsageEstimator.NUM_BYTES_OBJECT_REF;
        int OH_BYTES = RamUsageEstimator.NUM_BYTES_OBJECT_HEADER;

        return RamUsageEstimator.alignObjectSize(OH_BYTES
                + 3L * REF_BYTES // elementType, growthPolicy, items
                + 2L * Integer.BYTES) // size, capacity
                + RamUsageEstimator.alignObjectSize(OH_BYTES + REF_BYTES) // OwnedBuffer
                + items.ramBytesUsed();
    }

    /**
     * Two arrays are equal iff their visible sequences are element-wise equal; capacity and
     * growth history are ignored.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GrowableArray)) {
            return false;
        }
        GrowableArray<?> other = (GrowableArray<?>) o;
        if (size != other.size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (!Objects.equals(items.get(i), other.items.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Computed over the visible sequence with the same formula as {@link List#hashCode()}.
     */
    @Override
    public int hashCode() {
        int hash = 1;
        for (int i = 0; i < size; i++) {
            hash = 31 * hash + Objects.hashCode(items.get(i));
        }
        return hash;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("GrowableArray(");
        sb.append(size).append("/").append(capacity).append(") [");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(items.get(i));
        }
        sb.append("]");
        return sb.toString();
    }

    /**
     * Compares two arrays lexicographically by their visible sequences using the elements'
     * natural order. A proper prefix orders before the longer sequence.
     * @return a negative number, zero, or a positive number as {@code a} orders before, equal to, or after {@code b}
     */
    public static <T extends Comparable<? super T>> int compare(GrowableArray<T> a, GrowableArray<T> b) {
        return compare(a, b, Comparator.naturalOrder());
    }

    /**
     * Compares two arrays lexicographically by their visible sequences using {@code comparator}.
     */
    public static <T> int compare(GrowableArray<T> a, GrowableArray<T> b, Comparator<? super T> comparator) {
        int common = Math.min(a.size, b.size);
        for (int i = 0; i < common; i++) {
            int c = comparator.compare(a.items.get(i), b.items.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size, b.size);
    }

    public static <T extends Comparable<? super T>> boolean lessThan(GrowableArray<T> a, GrowableArray<T> b) {
        return compare(a, b) < 0;
    }

    public static <T extends Comparable<? super T>> boolean lessOrEqual(GrowableArray<T> a, GrowableArray<T> b) {
        return !lessThan(b, a);
    }

    public static <T extends Comparable<? super T>> boolean greaterThan(GrowableArray<T> a, GrowableArray<T> b) {
        return lessThan(b, a);
    }

    public static <T extends Comparable<? super T>> boolean greaterOrEqual(GrowableArray<T> a, GrowableArray<T> b) {
        return !lessThan(a, b);
    }

    /**
     * @return a comparator ordering arrays lexicographically by their elements' natural order
     */
    public static <T extends Comparable<? super T>> Comparator<GrowableArray<T>> lexicographicOrder() {
        return (a, b) -> compare(a, b);
    }

    private class Itr implements Iterator<T> {
        private int cursor;

        @Override
        public boolean hasNext() {
            return cursor < size;
        }

        @Override
        public T next() {
            if (cursor >= size) {
                throw new NoSuchElementException();
            }
            return items.get(cursor++);
        }
    }

    private class ListItr implements ListIterator<T> {
        private int cursor;
        private int lastReturned = -1;

        private ListItr(int index) {
            cursor = index;
        }

        @Override
        public boolean hasNext() {
            return cursor < size;
        }

        @Override
        public T next() {
            if (cursor >= size) {
                throw new NoSuchElementException();
            }
            lastReturned = cursor++;
            return items.get(lastReturned);
        }

        @Override
        public boolean hasPrevious() {
            return cursor > 0;
        }

        @Override
        public T previous() {
            if (cursor <= 0) {
                throw new NoSuchElementException();
            }
            lastReturned = --cursor;
            return items.get(lastReturned);
        }

        @Override
        public int nextIndex() {
            return cursor;
        }

        @Override
        public int previousIndex() {
            return cursor - 1;
        }

        @Override
        public void set(T value) {
            if (lastReturned < 0) {
                throw new IllegalStateException("set() called before next() or previous()");
            }
            items.set(lastReturned, value);
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException("remove");
        }

        @Override
        public void add(T value) {
            throw new UnsupportedOperationException("add");
        }
    }
}
