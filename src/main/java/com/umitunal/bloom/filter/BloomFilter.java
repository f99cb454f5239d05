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

package com.umitunal.bloom.filter;

import com.umitunal.bloom.bitarray.BitArray;
import com.umitunal.bloom.bitarray.BitArrayType;
import com.umitunal.bloom.config.BloomFilterConfig;
import com.umitunal.bloom.encoding.CanonicalValueEncoder;
import com.umitunal.bloom.encoding.ValueEncoder;
import com.umitunal.bloom.hash.OffsetGenerator;
import com.umitunal.bloom.sizing.SizeTier;
import com.umitunal.bloom.sizing.SizingDecision;
import com.umitunal.bloom.sizing.SizingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.Stream;

/**
 * Bloom filter implementation for approximate set membership.
 * A Bloom filter is a space-efficient probabilistic data structure that is used to test
 * whether an element is a member of a set. False positives are possible, but false negatives are not.
 *
 * <p>The filter occupies {@code 2^b} bits for a bit-address width {@code b} in [6, 32].
 * Each value is hashed once with SHA-256 (up to 8 hash functions) or SHA-512 (9 to 16),
 * and the digest is split into {@code k} 32-bit offsets that are masked into the bit range.
 * Bits only ever go from 0 to 1; there is no removal and no resizing.</p>
 *
 * <p>The filter is not synchronized. Concurrent inserts on a {@link BitArrayType#PACKED}
 * backend may lose bit sets; use {@link BitArrayType#ATOMIC} or external locking.</p>
 */
public class BloomFilter {
    private static final Logger logger = LoggerFactory.getLogger(BloomFilter.class);

    private final BitArray bits;
    private final long indexMask;
    private final int bitAddressWidth;
    private final int hashCount;
    private final ValueEncoder encoder;

    /**
     * Creates a Bloom filter over an existing bit array with the default value encoder.
     *
     * @param bits the bit array, exclusively owned by this filter from now on
     * @param hashCount the number of hash functions, between 1 and 16
     */
    public BloomFilter(BitArray bits, int hashCount) {
        this(bits, hashCount, CanonicalValueEncoder.INSTANCE);
    }

    /**
     * Creates a Bloom filter over an existing bit array.
     *
     * @param bits the bit array, exclusively owned by this filter from now on
     * @param hashCount the number of hash functions, between 1 and 16
     * @param encoder the encoder for values that are not byte arrays
     * @throws IllegalArgumentException if the bit array length or hash count is not supported
     */
    public BloomFilter(BitArray bits, int hashCount, ValueEncoder encoder) {
        if (bits == null || encoder == null) {
            throw new NullPointerException("Bit array and encoder cannot be null");
        }
        long bitLength = bits.bitLength();
        if (Long.bitCount(bitLength) != 1) {
            throw new IllegalArgumentException("Bit array length must be a power of two, but got " + bitLength);
        }
        int width = Long.numberOfTrailingZeros(bitLength);
        SizingPolicy.checkBitAddressWidth(width);
        if (hashCount < SizingPolicy.MIN_HASH_COUNT || hashCount > SizingPolicy.MAX_HASH_COUNT) {
            throw new IllegalArgumentException("hashCount must be between " + SizingPolicy.MIN_HASH_COUNT
                + " and " + SizingPolicy.MAX_HASH_COUNT + ", but got " + hashCount);
        }

        this.bits = bits;
        this.bitAddressWidth = width;
        this.indexMask = bitLength - 1;
        this.hashCount = hashCount;
        this.encoder = encoder;
    }

    /**
     * Creates a new Bloom filter of {@code 2^bitAddressWidth} bits sized for the expected elements.
     *
     * @param bitAddressWidth the bit-address width, between 6 and 32
     * @param expectedElements the expected number of elements, positive
     * @return a new, empty Bloom filter
     * @throws com.umitunal.bloom.config.InvalidConfigurationException if a parameter is out of range
     */
    public static BloomFilter create(int bitAddressWidth, long expectedElements) {
        return create(BloomFilterConfig.getDefault()
            .withBitAddressWidth(bitAddressWidth)
            .withExpectedElements(expectedElements));
    }

    /**
     * Creates a new Bloom filter of a named size.
     *
     * @param tier the size tier
     * @param expectedElements the expected number of elements, positive
     * @return a new, empty Bloom filter
     */
    public static BloomFilter create(SizeTier tier, long expectedElements) {
        return create(tier.bitAddressWidth(), expectedElements);
    }

    /**
     * Creates the largest Bloom filter that fits into {@code bytes} bytes.
     * The size is rounded down to a power of two.
     *
     * @param bytes the maximum size in bytes
     * @param expectedElements the expected number of elements, positive
     * @return a new, empty Bloom filter
     */
    public static BloomFilter createByByteBudget(long bytes, long expectedElements) {
        return create(BloomFilterConfig.forByteBudget(bytes, expectedElements));
    }

    /**
     * Creates a Bloom filter with a maximum size given as a named tier.
     * Equivalent to {@link #create(SizeTier, long)}.
     *
     * @param tier the size tier
     * @param expectedElements the expected number of elements, positive
     * @return a new, empty Bloom filter
     */
    public static BloomFilter createByByteBudget(SizeTier tier, long expectedElements) {
        return create(tier, expectedElements);
    }

    /**
     * Creates a new Bloom filter from a configuration.
     *
     * @param config the configuration
     * @return a new, empty Bloom filter
     */
    public static BloomFilter create(BloomFilterConfig config) {
        SizingDecision decision = SizingPolicy.decide(config.bitAddressWidth(), config.expectedElements());
        BitArray bits = config.bitArrayType().allocate(decision.bitLength());
        return new BloomFilter(bits, decision.hashCount());
    }

    /**
     * Inserts raw bytes into the filter.
     * Inserting the same bytes again changes nothing.
     *
     * @param value the bytes to insert; null is ignored
     */
    public void insert(byte[] value) {
        if (value == null) {
            logger.debug("Ignoring insert of null value");
            return;
        }

        for (long offset : OffsetGenerator.maskedOffsets(value, hashCount, indexMask)) {
            bits.put(offset, true);
        }
    }

    /**
     * Inserts a value into the filter after encoding it with the filter's {@link ValueEncoder}.
     *
     * @param value the value to insert; null is ignored
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    public void insert(Object value) {
        if (value == null) {
            logger.debug("Ignoring insert of null value");
            return;
        }
        insert(encoder.encode(value));
    }

    /**
     * Checks whether raw bytes might have been inserted.
     *
     * @param value the bytes to check
     * @return false if the bytes were definitely never inserted, true if they possibly were
     */
    public boolean query(byte[] value) {
        if (value == null) {
            return false;
        }

        for (long offset : OffsetGenerator.maskedOffsets(value, hashCount, indexMask)) {
            if (!bits.get(offset)) {
                return false; // Definitely not in the set
            }
        }
        return true; // Might be in the set
    }

    /**
     * Checks whether a value might have been inserted.
     *
     * @param value the value to check
     * @return false if the value was definitely never inserted, true if it possibly was
     */
    public boolean query(Object value) {
        if (value == null) {
            return false;
        }
        return query(encoder.encode(value));
    }

    /**
     * Negation of {@link #query(byte[])}.
     *
     * @param value the bytes to check
     * @return true if the bytes were definitely never inserted
     */
    public boolean notPresent(byte[] value) {
        return !query(value);
    }

    /**
     * Negation of {@link #query(Object)}.
     *
     * @param value the value to check
     * @return true if the value was definitely never inserted
     */
    public boolean notPresent(Object value) {
        return !query(value);
    }

    /**
     * Estimates the current false positive probability from the fill ratio:
     * {@code (ones / bits)^k}.
     * This counts every bit and is slow for large filters; avoid it on hot paths.
     *
     * @return the probability, between 0.0 and 1.0
     */
    public double falsePositiveProbability() {
        double fillRatio = (double) bits.countOnes() / bits.bitLength();
        return Math.pow(fillRatio, hashCount);
    }

    /**
     * Estimates how many distinct values have been inserted:
     * {@code -ln(1 - ones / bits) * bits / k}, rounded.
     * This counts every bit and is slow for large filters; avoid it on hot paths.
     *
     * @return the estimate; {@link Long#MAX_VALUE} once every bit is set
     */
    public long estimateCardinality() {
        long bitLength = bits.bitLength();
        double fractionOfZeros = 1 - (double) bits.countOnes() / bitLength;
        double elements = -Math.log(fractionOfZeros) * bitLength / hashCount;
        // Math.round saturates, so a full filter reports Long.MAX_VALUE
        return Math.round(elements);
    }

    /**
     * @return the filter's length in bits
     */
    public long bitLength() {
        return bits.bitLength();
    }

    /**
     * @return log2 of the filter's length in bits
     */
    public int bitAddressWidth() {
        return bitAddressWidth;
    }

    /**
     * @return the number of hash functions
     */
    public int hashCount() {
        return hashCount;
    }

    /**
     * @return the mask that folds an offset into the bit range
     */
    public long indexMask() {
        return indexMask;
    }

    /**
     * @return the number of bits currently set
     */
    public long countOnes() {
        return bits.countOnes();
    }

    /**
     * @return a copy of the bit array contents
     */
    public byte[] exportBytes() {
        return bits.toBytes();
    }

    /**
     * @return the bit array contents as a lazy stream of chunks
     */
    public Stream<byte[]> exportChunks() {
        return bits.toChunkStream();
    }

    @Override
    public boolean equals(Object other) {
        if (other == this) {
            return true;
        }
        if (!(other instanceof BloomFilter)) {
            return false;
        }
        BloomFilter that = (BloomFilter) other;
        return this.hashCount == that.hashCount
            && this.bitLength() == that.bitLength()
            && Arrays.equals(this.exportBytes(), that.exportBytes());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(exportBytes()) * 31 + hashCount;
    }

    @Override
    public String toString() {
        return "BloomFilter{" +
                "bitLength=" + bitLength() +
                ", hashCount=" + hashCount +
                '}';
    }
}
