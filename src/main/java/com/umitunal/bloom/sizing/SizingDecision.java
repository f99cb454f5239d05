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

/**
 * Record holding the parameters chosen by {@link SizingPolicy}.
 *
 * @param bitAddressWidth log2 of the filter's bit length
 * @param expectedElements the number of elements the filter was sized for
 * @param hashCount the selected number of hash functions
 * @param expectedFalsePositiveRate the theoretical false positive rate once
 *                                  {@code expectedElements} values are inserted
 */
public record SizingDecision(
    int bitAddressWidth,
    long expectedElements,
    int hashCount,
    double expectedFalsePositiveRate
) {

    /**
     * @return the filter's length in bits
     */
    public long bitLength() {
        return 1L << bitAddressWidth;
    }

    /**
     * A filter is undersized when a single hash function is the best choice:
     * the filter is too small for the expected elements to be useful.
     *
     * @return true if the filter is undersized
     */
    public boolean undersized() {
        return hashCount == SizingPolicy.MIN_HASH_COUNT;
    }
}
