/*
 * Copyright (c) 2023-2025 Umit Unal
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

package com.umitunal.bloom.sizing;

import com.umitunal.bloom.config.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the number of hash functions for a filter.
 * Every candidate {@code k} in [1, 16] is scored with the closed-form estimate
 * {@code (1 - e^(-k*n/m))^k} and the smallest score wins; on equal scores the
 * smaller {@code k} is kept.
 */
public final class SizingPolicy {
    private static final Logger logger = LoggerFactory.getLogger(SizingPolicy.class);

    public static final int MIN_BIT_ADDRESS_WIDTH = 6;
    public static final int MAX_BIT_ADDRESS_WIDTH = 32;
    public static final int MIN_HASH_COUNT = 1;
    public static final int MAX_HASH_COUNT = 16;

    private SizingPolicy() {
    }

    /**
     * Calculates the theoretical false positive rate of a filter.
     *
     * @param expectedElements the number of inserted elements (n)
     * @param bits the filter's length in bits (m)
     * @param hashCount the number of hash functions (k)
     * @return the false positive rate, between 0.0 and 1.0
     */
    public static double falsePositiveRate(long expectedElements, long bits, int hashCount) {
        double fractionOfZeros = Math.exp(-hashCount * (double) expectedElements / bits);
        return Math.pow(1 - fractionOfZeros, hashCount);
    }

    /**
     * Selects the hash count that minimizes the theoretical false positive rate.
     * This is a pure function of its arguments.
     *
     * @param expectedElements the expected number of elements, positive
     * @param bits the filter's length in bits, positive
     * @return the hash count, between 1 and 16
     */
    public static int selectHashCount(long expectedElements, long bits) {
        if (expectedElements <= 0) {
            throw new InvalidConfigurationException("expectedElements must be positive, but got " + expectedElements);
        }
        if (bits <= 0) {
            throw new InvalidConfigurationException("bits must be positive, but got " + bits);
        }

        int best = MIN_HASH_COUNT;
        double bestRate = falsePositiveRate(expectedElements, bits, MIN_HASH_COUNT);
        for (int k = MIN_HASH_COUNT + 1; k <= MAX_HASH_COUNT; k++) {
            double rate = falsePositiveRate(expectedElements, bits, k);
            if (rate < bestRate) {
                best = k;
                bestRate = rate;
            }
        }
        return best;
    }

    /**
     * Sizes a filter of {@code 2^bitAddressWidth} bits for the expected number of elements.
     * Logs a warning when the filter turns out to be undersized; the caller may go on regardless.
     *
     * @param bitAddressWidth the bit-address width, between 6 and 32
     * @param expectedElements the expected number of elements, positive
     * @return the sizing decision
     * @throws InvalidConfigurationException if a parameter is out of range
     */
    public static SizingDecision decide(int bitAddressWidth, long expectedElements) {
        checkBitAddressWidth(bitAddressWidth);
        checkExpectedElements(expectedElements);

        long bits = 1L << bitAddressWidth;
        int hashCount = selectHashCount(expectedElements, bits);
        SizingDecision decision = new SizingDecision(bitAddressWidth, expectedElements, hashCount,
            falsePositiveRate(expectedElements, bits, hashCount));

        if (decision.undersized()) {
            logger.warn("Bloom filter of {} ({} bits) is too small for {} expected elements; "
                    + "expected false positive rate is {}",
                SizeTier.forBitAddressWidth(bitAddressWidth), bits, expectedElements,
                decision.expectedFalsePositiveRate());
        } else {
            logger.debug("Sized Bloom filter: {} bits, {} expected elements, {} hash functions",
                bits, expectedElements, hashCount);
        }
        return decision;
    }

    /**
     * Converts a byte budget to a bit-address width, rounding down to the nearest
     * power-of-two number of bits: {@code floor(log2(bytes * 8))}.
     *
     * @param bytes the maximum size of the filter in bytes, positive
     * @return the bit-address width; may lie outside [6, 32] for very small or very large budgets
     * @throws InvalidConfigurationException if bytes is not positive
     */
    public static int bitAddressWidthForByteBudget(long bytes) {
        if (bytes <= 0) {
            throw new InvalidConfigurationException("bytes must be positive, but got " + bytes);
        }
        if (bytes > Long.MAX_VALUE >>> 3) {
            throw new InvalidConfigurationException("Byte budget too large: " + bytes);
        }
        long bits = bytes << 3;
        return Long.SIZE - 1 - Long.numberOfLeadingZeros(bits);
    }

    /**
     * @param bitAddressWidth the width to check
     * @throws InvalidConfigurationException if the width is outside [6, 32]
     */
    public static void checkBitAddressWidth(int bitAddressWidth) {
        if (bitAddressWidth < MIN_BIT_ADDRESS_WIDTH || bitAddressWidth > MAX_BIT_ADDRESS_WIDTH) {
            throw new InvalidConfigurationException("bitAddressWidth must be between " + MIN_BIT_ADDRESS_WIDTH
                + " and " + MAX_BIT_ADDRESS_WIDTH + ", but got " + bitAddressWidth);
        }
    }

    /**
     * @param expectedElements the element count to check
     * @throws InvalidConfigurationException if the count is not positive
     */
    public static void checkExpectedElements(long expectedElements) {
        if (expectedElements <= 0) {
            throw new InvalidConfigurationException("expectedElements must be positive, but got " + expectedElements);
        }
    }
}
