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

package io.github.simplevector.bench;

import io.github.simplevector.ElementType;
import io.github.simplevector.GrowableArray;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Benchmark for the element-shifting paths: inserting at and erasing from the front, which
 * relocates the whole visible sequence, versus the same operations at the back.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class InsertEraseBenchmark {
    private static final ElementType<Integer> INTS = ElementType.of(() -> 0);

    /**
     * Creates a new benchmark instance.
     * <p>
     * This constructor is invoked by JMH and should not be called directly.
     */
    public InsertEraseBenchmark() {
    }

    /** Number of elements present before each invocation. */
    @Param({"1000", "10000"})
    private int size;

    private GrowableArray<Integer> array;

    @Setup(Level.Invocation)
    public void setup() {
        array = new GrowableArray<>(INTS, size, 7);
    }

    @Benchmark
    public void insertFrontThenErase(Blackhole blackhole) {
        blackhole.consume(array.insert(0, 42));
        blackhole.consume(array.erase(0));
    }

    @Benchmark
    public void insertBackThenErase(Blackhole blackhole) {
        blackhole.consume(array.insert(array.size(), 42));
        blackhole.consume(array.erase(array.size() - 1));
    }

    @Benchmark
    public void eraseAllFromFront(Blackhole blackhole) {
        while (!array.isEmpty()) {
            array.erase(0);
        }
        blackhole.consume(array.capacity());
    }
}
