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
 * JMH benchmarks for {@link io.github.simplevector.GrowableArray}.
 * <ul>
 *   <li>{@link io.github.simplevector.bench.PushBackBenchmark} - amortized append cost, with and
 *       without a reservation hint, across growth factors</li>
 *   <li>{@link io.github.simplevector.bench.InsertEraseBenchmark} - cost of the shifting paths of
 *       insert and erase</li>
 * </ul>
 *
 * <h2>Running Benchmarks</h2>
 * <pre>
 * # Build the shaded JAR
 * mvn clean package -pl simplevector-base,benchmarks-jmh
 *
 * # Run all benchmarks
 * java -jar benchmarks-jmh/target/benchmarks-jmh-*.jar
 *
 * # Run a specific benchmark
 * java -jar benchmarks-jmh/target/benchmarks-jmh-*.jar PushBackBenchmark
 * </pre>
 */
package io.github.simplevector.bench;
