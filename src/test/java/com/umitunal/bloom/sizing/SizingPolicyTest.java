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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SizingPolicy class.
 */
class SizingPolicyTest {

    @ParameterizedTest
    @CsvSource({
        "100, 1024, 7",
        "1000, 8192, 6",
        "10000, 65536, 5",
        "1000, 64, 1",
        "100, 64, 1",
        "50, 64, 1",
        "2, 1024, 16",
        "10, 1048576, 16"
    })
    void testSelectHashCount(long expectedElements, long bits, int expectedHashCount) {
        assertEquals(expectedHashCount, SizingPolicy.selectHashCount(expectedElements, bits));
    }

    @Test
    void testSelectedHashCountIsOptimal() {
        for (long n = 1; n <= 5000; n += 37) {
            for (int width = 6; width <= 16; width++) {
                long bits = 1L << width;
                int k = SizingPolicy.selectHashCount(n, bits);
                double best = SizingPolicy.falsePositiveRate(n, bits, k);

                for (int other = 1; other <= 16; other++) {
                    assertTrue(best <= SizingPolicy.falsePositiveRate(n, bits, other),
                        "k=" + k + " is beaten by k=" + other + " for n=" + n + ", m=" + bits);
                }
            }
        }
    }

    @Test
    void testSelectHashCountIsPure() {
        int first = SizingPolicy.selectHashCount(777, 1 << 14);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, SizingPolicy.selectHashCount(777, 1 << 14));
        }
    }

    @Test
    void testSelectHashCountRejectsNonPositiveInputs() {
        assertThrows(InvalidConfigurationException.class, () -> SizingPolicy.selectHashCount(0, 1024));
        assertThrows(InvalidConfigurationException.class, () -> SizingPolicy.selectHashCount(10, 0));
    }

    @Test
    void testFalsePositiveRate() {
        assertEquals(0.0073, SizingPolicy.falsePositiveRate(100, 1024, 7), 0.0001);
        assertEquals(0.0433, SizingPolicy.falsePositiveRate(10000, 65536, 5), 0.0001);
    }

    @Test
    void testDecide() {
        SizingDecision decision = SizingPolicy.decide(10, 100);

        assertEquals(10, decision.bitAddressWidth());
        assertEquals(1024, decision.bitLength());
        assertEquals(100, decision.expectedElements());
        assertEquals(7, decision.hashCount());
        assertEquals(0.0073, decision.expectedFalsePositiveRate(), 0.0001);
        assertFalse(decision.undersized());
    }

    @Test
    void testDecideFlagsUndersizedFilter() {
        SizingDecision decision = SizingPolicy.decide(6, 1000);

        assertEquals(1, decision.hashCount());
        assertTrue(decision.undersized());
    }

    @Test
    void testDecideRejectsInvalidParameters() {
        assertThrows(InvalidConfigurationException.class, () -> SizingPolicy.decide(5, 100));
        assertThrows(InvalidConfigurationException.class, () -> SizingPolicy.decide(33, 100));
        assertThrows(InvalidConfigurationException.class, () -> SizingPolicy.decide(10, 0));
        assertThrows(InvalidConfigurationException.class, () -> SizingPolicy.decide(10, -5));
    }

    @ParameterizedTest
    @CsvSource({
        "1, 3",
        "7, 5",
        "8, 6",
        "1000, 12",
        "1024, 13",
        "1025, 13",
        "536870912, 32"
    })
    void testBitAddressWidthForByteBudget(long bytes, int expectedWidth) {
        assertEquals(expectedWidth, SizingPolicy.bitAddressWidthForByteBudget(bytes));
    }

    @Test
    void testBitAddressWidthForByteBudgetRejectsInvalidBudgets() {
        assertThrows(InvalidConfigurationException.class, () -> SizingPolicy.bitAddressWidthForByteBudget(0));
        assertThrows(InvalidConfigurationException.class, () -> SizingPolicy.bitAddressWidthForByteBudget(-1));
        assertThrows(InvalidConfigurationException.class,
            () -> SizingPolicy.bitAddressWidthForByteBudget(Long.MAX_VALUE));
    }
}
