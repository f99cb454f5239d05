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

package com.umitunal.bloom.codec;

import com.umitunal.bloom.filter.BloomFilter;
import com.umitunal.bloom.sizing.SizingPolicy;

import java.util.Optional;

/**
 * Record for the fixed 4-byte header of a serialized Bloom filter.
 *
 * <pre>
 * byte 0: format version (1)
 * byte 1: magic (42)
 * byte 2: bit-address width b, body length is 2^(b-3) bytes
 * byte 3: hash count k
 * </pre>
 *
 * @param bitAddressWidth log2 of the filter's bit length
 * @param hashCount the number of hash functions
 */
public record FilterHeader(int bitAddressWidth, int hashCount) {

    public static final int FORMAT_VERSION = 1;
    public static final int MAGIC = 42;
    public static final int SIZE = 4;

    /**
     * @throws IllegalArgumentException if a field does not fit a valid filter
     */
    public FilterHeader {
        SizingPolicy.checkBitAddressWidth(bitAddressWidth);
        if (hashCount < SizingPolicy.MIN_HASH_COUNT || hashCount > SizingPolicy.MAX_HASH_COUNT) {
            throw new IllegalArgumentException("hashCount must be between " + SizingPolicy.MIN_HASH_COUNT
                + " and " + SizingPolicy.MAX_HASH_COUNT + ", but got " + hashCount);
        }
    }

    /**
     * Creates the header describing a filter.
     *
     * @param filter the filter
     * @return its header
     */
    public static FilterHeader of(BloomFilter filter) {
        return new FilterHeader(filter.bitAddressWidth(), filter.hashCount());
    }

    /**
     * Parses a header from the start of a buffer.
     * The header is recognized only when the version and magic bytes match and the
     * width and hash count describe a valid filter.
     *
     * @param buffer the buffer
     * @param length the number of valid bytes in the buffer
     * @return the header, or empty if the first bytes are not a recognized header
     */
    public static Optional<FilterHeader> parse(byte[] buffer, int length) {
        if (length < SIZE) {
            return Optional.empty();
        }
        int version = buffer[0] & 0xff;
        int magic = buffer[1] & 0xff;
        int width = buffer[2] & 0xff;
        int hashCount = buffer[3] & 0xff;

        if (version != FORMAT_VERSION || magic != MAGIC) {
            return Optional.empty();
        }
        if (width < SizingPolicy.MIN_BIT_ADDRESS_WIDTH || width > SizingPolicy.MAX_BIT_ADDRESS_WIDTH) {
            return Optional.empty();
        }
        if (hashCount < SizingPolicy.MIN_HASH_COUNT || hashCount > SizingPolicy.MAX_HASH_COUNT) {
            return Optional.empty();
        }
        return Optional.of(new FilterHeader(width, hashCount));
    }

    /**
     * @return the 4 header bytes
     */
    public byte[] toBytes() {
        return new byte[] {(byte) FORMAT_VERSION, (byte) MAGIC, (byte) bitAddressWidth, (byte) hashCount};
    }

    /**
     * @return the filter's length in bits
     */
    public long bitLength() {
        return 1L << bitAddressWidth;
    }

    /**
     * @return the number of body bytes that follow the header
     */
    public long bodyLength() {
        return 1L << (bitAddressWidth - 3);
    }
}
