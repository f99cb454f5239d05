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

package com.umitunal.bloom.hash;

import java.nio.ByteBuffer;

/**
 * Maps a byte string to candidate bit offsets with a single digest call.
 * The digest is cut into consecutive big-endian 32-bit words and the first
 * {@code hashCount} words are returned as unsigned values.
 */
public final class OffsetGenerator {

    private OffsetGenerator() {
    }

    /**
     * Computes the offsets of a value.
     *
     * @param value the value bytes
     * @param hashCount the number of offsets, between 1 and 16
     * @return {@code hashCount} unsigned 32-bit offsets, not yet masked to the filter size
     */
    public static long[] offsets(byte[] value, int hashCount) {
        DigestAlgorithm algorithm = DigestAlgorithm.forHashCount(hashCount);
        ByteBuffer digest = ByteBuffer.wrap(algorithm.newDigest().digest(value));

        long[] offsets = new long[hashCount];
        for (int i = 0; i < hashCount; i++) {
            offsets[i] = Integer.toUnsignedLong(digest.getInt());
        }
        return offsets;
    }

    /**
     * Computes the offsets of a value folded into a filter with the given index mask.
     *
     * @param value the value bytes
     * @param hashCount the number of offsets, between 1 and 16
     * @param indexMask the filter's bit length minus one
     * @return {@code hashCount} bit indices
     */
    public static long[] maskedOffsets(byte[] value, int hashCount, long indexMask) {
        long[] offsets = offsets(value, hashCount);
        for (int i = 0; i < offsets.length; i++) {
            offsets[i] &= indexMask;
        }
        return offsets;
    }
}
