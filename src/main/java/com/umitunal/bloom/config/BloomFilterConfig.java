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

package com.umitunal.bloom.config;

import com.umitunal.bloom.bitarray.BitArrayType;
import com.umitunal.bloom.sizing.SizeTier;
import com.umitunal.bloom.sizing.SizingPolicy;

/**
 * Configuration record for a Bloom filter.
 * This record encapsulates the parameters needed to build, save and load a filter.
 *
 * @param bitAddressWidth log2 of the filter's bit length, between 6 and 32
 * @param expectedElements the number of distinct elements the filter is sized for
 * @param bitArrayType the bit array backend to allocate
 * @param ioChunkSizeBytes the chunk size used when reading a filter from a file
 */
public record BloomFilterConfig(
    int bitAddressWidth,
    long expectedElements,
    BitArrayType bitArrayType,
    int ioChunkSizeBytes
) {

    /**
     * Creates a new BloomFilterConfig with the specified parameters.
     * Validates that all parameters are valid.
     *
     * @throws InvalidConfigurationException if any parameter is invalid
     */
    public BloomFilterConfig {
        SizingPolicy.checkBitAddressWidth(bitAddressWidth);
        SizingPolicy.checkExpectedElements(expectedElements);
        if (bitArrayType == null) {
            throw new InvalidConfigurationException("bitArrayType must not be null");
        }
        if (ioChunkSizeBytes <= 0) {
            throw new InvalidConfigurationException("ioChunkSizeBytes must be positive");
        }
    }

    /**
     * Creates a default configuration with:
     * - 8 KB filter (bit-address width 16)
     * - 10,000 expected elements
     * - PACKED bit array
     * - 8096 byte I/O chunks
     *
     * @return a default configuration
     */
    public static BloomFilterConfig getDefault() {
        return new BloomFilterConfig(16, 10_000, BitArrayType.PACKED, 8096);
    }

    /**
     * Creates a default configuration sized by a named tier.
     *
     * @param tier the size tier
     * @param expectedElements the expected number of elements
     * @return a configuration for the tier
     */
    public static BloomFilterConfig forSizeTier(SizeTier tier, long expectedElements) {
        return getDefault()
            .withBitAddressWidth(tier.bitAddressWidth())
            .withExpectedElements(expectedElements);
    }

    /**
     * Creates a default configuration for the largest filter that fits the byte budget.
     *
     * @param bytes the maximum filter size in bytes
     * @param expectedElements the expected number of elements
     * @return a configuration for the budget
     */
    public static BloomFilterConfig forByteBudget(long bytes, long expectedElements) {
        return getDefault()
            .withBitAddressWidth(SizingPolicy.bitAddressWidthForByteBudget(bytes))
            .withExpectedElements(expectedElements);
    }

    /**
     * @return the filter's length in bits
     */
    public long bitLength() {
        return 1L << bitAddressWidth;
    }

    /**
     * Creates a new configuration with a custom bit-address width.
     *
     * @param bitAddressWidth log2 of the filter's bit length
     * @return a new configuration with the specified width
     */
    public BloomFilterConfig withBitAddressWidth(int bitAddressWidth) {
        return new BloomFilterConfig(bitAddressWidth, this.expectedElements, this.bitArrayType, this.ioChunkSizeBytes);
    }

    /**
     * Creates a new configuration with a custom number of expected elements.
     *
     * @param expectedElements the expected number of elements
     * @return a new configuration with the specified element count
     */
    public BloomFilterConfig withExpectedElements(long expectedElements) {
        return new BloomFilterConfig(this.bitAddressWidth, expectedElements, this.bitArrayType, this.ioChunkSizeBytes);
    }

    /**
     * Creates a new configuration with a custom bit array backend.
     *
     * @param bitArrayType the backend type
     * @return a new configuration with the specified backend
     */
    public BloomFilterConfig withBitArrayType(BitArrayType bitArrayType) {
        return new BloomFilterConfig(this.bitAddressWidth, this.expectedElements, bitArrayType, this.ioChunkSizeBytes);
    }

    /**
     * Creates a new configuration with a custom I/O chunk size.
     *
     * @param ioChunkSizeBytes the chunk size in bytes
     * @return a new configuration with the specified chunk size
     */
    public BloomFilterConfig withIoChunkSizeBytes(int ioChunkSizeBytes) {
        return new BloomFilterConfig(this.bitAddressWidth, this.expectedElements, this.bitArrayType, ioChunkSizeBytes);
    }
}
