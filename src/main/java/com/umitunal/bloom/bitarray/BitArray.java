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

package com.umitunal.bloom.bitarray;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Fixed-length array of single bits backing a Bloom filter.
 * Implementations keep the same byte layout: bit {@code i} lives in byte {@code i / 8}
 * at bit position {@code i % 8} (least significant bit first), so the exported bytes
 * of any two implementations holding the same bits are identical.
 *
 * <p>Instances are created through {@link BitArrayType#allocate(long)} or
 * {@link BitArrayType#fromBytes(byte[])}.</p>
 */
public interface BitArray {

    /**
     * Smallest supported length in bits.
     */
    long MIN_BIT_LENGTH = 8L;

    /**
     * Largest supported length in bits (512 MB of storage).
     */
    long MAX_BIT_LENGTH = 1L << 32;

    /**
     * Gets the bit at the given index.
     *
     * @param index the bit index
     * @return true if the bit is set
     * @throws IndexOutOfBoundsException if the index is outside the array
     */
    boolean get(long index);

    /**
     * Sets or clears the bit at the given index.
     *
     * @param index the bit index
     * @param value the new bit value
     * @throws IndexOutOfBoundsException if the index is outside the array
     */
    void put(long index, boolean value);

    /**
     * @return the number of bits in this array
     */
    long bitLength();

    /**
     * Counts the bits that are set. Runs in time linear to the array length.
     *
     * @return the population count
     */
    long countOnes();

    /**
     * Exports the whole array as one contiguous buffer of {@code bitLength() / 8} bytes.
     *
     * @return a copy of the array contents
     */
    byte[] toBytes();

    /**
     * Exports the array as a lazy sequence of byte chunks covering the whole array.
     * The implementation decides the chunk boundaries. Each chunk is a copy taken
     * when the stream reaches it.
     *
     * @return a single-use stream of chunks
     */
    Stream<byte[]> toChunkStream();

    /**
     * Writes streamed bytes into this array, starting at byte 0, until the
     * iterator is exhausted. Chunks may have any length.
     *
     * @param chunks the chunks to import
     * @return the number of bytes consumed
     * @throws IllegalArgumentException if the chunks hold more bytes than the array
     */
    long consumeFromStream(Iterator<byte[]> chunks);

    /**
     * Checks that a requested length is a supported power of two.
     *
     * @param lengthInBits the requested length
     * @throws IllegalArgumentException if the length is not supported
     */
    static void checkLength(long lengthInBits) {
        if (lengthInBits < MIN_BIT_LENGTH || lengthInBits > MAX_BIT_LENGTH) {
            throw new IllegalArgumentException("Bit length must be between " + MIN_BIT_LENGTH
                + " and " + MAX_BIT_LENGTH + ", but got " + lengthInBits);
        }
        if (Long.bitCount(lengthInBits) != 1) {
            throw new IllegalArgumentException("Bit length must be a power of two, but got " + lengthInBits);
        }
    }
}
