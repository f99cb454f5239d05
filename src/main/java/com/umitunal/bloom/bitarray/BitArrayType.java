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

/**
 * Enum defining the available bit array backends.
 */
public enum BitArrayType {
    /**
     * Plain byte array storage.
     * Fastest option for a single writer or externally synchronized access.
     */
    PACKED,

    /**
     * Word storage with compare-and-set updates.
     * Individual bit sets from concurrent writers are never lost.
     */
    ATOMIC;

    /**
     * Allocates a zeroed bit array of this type.
     *
     * @param lengthInBits the length in bits, a power of two
     * @return the new bit array
     */
    public BitArray allocate(long lengthInBits) {
        return switch (this) {
            case PACKED -> new PackedBitArray(lengthInBits);
            case ATOMIC -> new AtomicBitArray(lengthInBits);
        };
    }

    /**
     * Creates a bit array of this type holding a copy of the given bytes.
     *
     * @param bytes the exported contents of a bit array
     * @return the new bit array
     */
    public BitArray fromBytes(byte[] bytes) {
        return switch (this) {
            case PACKED -> PackedBitArray.fromBytes(bytes);
            case ATOMIC -> AtomicBitArray.fromBytes(bytes);
        };
    }
}
