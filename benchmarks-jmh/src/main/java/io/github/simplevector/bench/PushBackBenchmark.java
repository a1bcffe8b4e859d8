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
import io.github.simplevector.growth.GrowthPolicy;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

import static io.github.simplevector.ReservationHint.reserve;

/**
 * Benchmark that measures the amortized cost of appending, with and without a reservation hint,
 * under different growth factors.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class PushBackBenchmark {
    private static final Logger log = LoggerFactory.getLogger(PushBackBenchmark.class);
    private static final ElementType<Integer> INTS = ElementType.of(() -> 0);

    /**
     * Creates a new benchmark instance.
     * <p>
     * This constructor is invoked by JMH and should not be called directly.
     */
    public PushBackBenchmark() {
    }

    /** Number of elements appended per invocation. */
    @Param({"1000", "100000"})
    private int elementCount;

    /** Multiplier applied to the capacity on each reallocation. */
    @Param({"1.5", "2.0"})
    private double growthFactor;

    private GrowthPolicy policy;

    @Setup
    public void setup() {
        policy = GrowthPolicy.ofFactor(growthFactor);
        log.info("Appending {} elements with {}", elementCount, policy);
    }

    @Benchmark
    public void pushBackFromEmpty(Blackhole blackhole) {
        var array = new GrowableArray<>(INTS);
        array.setGrowthPolicy(policy);
        for (int i = 0; i < elementCount; i++) {
            array.pushBack(i);
        }
        blackhole.consume(array);
    }

    @Benchmark
    public void pushBackReserved(Blackhole blackhole) {
        var array = new GrowableArray<>(INTS, reserve(elementCount));
        array.setGrowthPolicy(policy);
        for (int i = 0; i < elementCount; i++) {
            array.pushBack(i);
        }
        blackhole.consume(array);
    }
}
