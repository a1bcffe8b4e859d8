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

package io.github.simplevector.growth;

import io.github.simplevector.util.ArrayUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how much capacity a growable container acquires when a request exceeds its current
 * capacity. The new capacity is the current one scaled by a constant factor, but never less than
 * what was requested, which keeps the amortized cost of an append constant.
 * <p>
 * The default factor is 2.0 and can be changed for the whole JVM with the
 * {@code simplevector.growth_factor} system property. Factors below 1.0 are clamped to 1.0.
 */
public final class GrowthPolicy {
    private static final Logger logger = LoggerFactory.getLogger(GrowthPolicy.class);

    /** System property consulted by {@link #getDefault()}. */
    public static final String GROWTH_FACTOR_PROPERTY = "simplevector.growth_factor";

    public static final double DEFAULT_GROWTH_FACTOR = 2.0;
    public static final double MIN_GROWTH_FACTOR = 1.0;

    private static final GrowthPolicy defaultPolicy = new GrowthPolicy(parseFactor(System.getProperty(GROWTH_FACTOR_PROPERTY)));

    private final double factor;

    private GrowthPolicy(double factor) {
        this.factor = factor;
    }

    /**
     * Returns the JVM-wide policy configured through {@value #GROWTH_FACTOR_PROPERTY}.
     * @return the default policy
     */
    public static GrowthPolicy getDefault() {
        return defaultPolicy;
    }

    /**
     * Creates a policy with an explicit growth factor.
     * @param factor the multiplier applied to the current capacity
     * @return the policy
     * @throws IllegalArgumentException if {@code factor} is below 1.0 or not a finite number
     */
    public static GrowthPolicy ofFactor(double factor) {
        if (!Double.isFinite(factor) || factor < MIN_GROWTH_FACTOR) {
            throw new IllegalArgumentException(String.format("growth factor must be a finite number >= %.1f, got %s", MIN_GROWTH_FACTOR, factor));
        }
        return new GrowthPolicy(factor);
    }

    public double getFactor() {
        return factor;
    }

    /**
     * Computes the capacity to allocate when {@code requested} slots are needed and only
     * {@code currentCapacity} are available.
     *
     * @param currentCapacity the capacity before growth
     * @param requested the minimum capacity needed
     * @return {@code max(requested, ceil(currentCapacity * factor))}
     */
    public int grow(int currentCapacity, int requested) {
        return ArrayUtil.scaledLength(currentCapacity, requested, factor);
    }

    static double parseFactor(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_GROWTH_FACTOR;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not a number, using {}", GROWTH_FACTOR_PROPERTY, raw, DEFAULT_GROWTH_FACTOR);
            return DEFAULT_GROWTH_FACTOR;
        }
        if (!Double.isFinite(parsed)) {
            logger.warn("Ignoring {}={}: not finite, using {}", GROWTH_FACTOR_PROPERTY, raw, DEFAULT_GROWTH_FACTOR);
            return DEFAULT_GROWTH_FACTOR;
        }
        if (parsed < MIN_GROWTH_FACTOR) {
            logger.warn("{}={} is below the minimum, clamping to {}", GROWTH_FACTOR_PROPERTY, raw, MIN_GROWTH_FACTOR);
            return MIN_GROWTH_FACTOR;
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "GrowthPolicy(factor=" + factor + ")";
    }
}
