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

import java.util.Arrays;
import java.util.Iterator;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Bit array packed into a plain byte array.
 * Reads and writes are not synchronized; callers sharing an instance between
 * threads must synchronize externally.
 */
public final class PackedBitArray implements BitArray {

    /**
     * Default size of an exported chunk in bytes.
     */
    public static final int DEFAULT_CHUNK_SIZE_BYTES = 8192;

    private final byte[] data;
    private final int chunkSizeBytes;

    /**
     * Creates a new zeroed bit array.
     *
     * @param lengthInBits the length in bits, a power of two
     */
    public PackedBitArray(long lengthInBits) {
        this(lengthInBits, DEFAULT_CHUNK_SIZE_BYTES);
    }

    /**
     * Creates a new zeroed bit array with a custom export chunk size.
     *
     * @param lengthInBits the length in bits, a power of two
     * @param chunkSizeBytes the size of the chunks produced by {@link #toChunkStream()}
     */
    public PackedBitArray(long lengthInBits, int chunkSizeBytes) {
        BitArray.checkLength(lengthInBits);
        if (chunkSizeBytes <= 0) {
            throw new IllegalArgumentException("chunkSizeBytes must be positive");
        }
        this.data = new byte[(int) (lengthInBits >>> 3)];
        this.chunkSizeBytes = chunkSizeBytes;
    }

    /**
     * Creates a bit array holding a copy of the given bytes.
     *
     * @param bytes the exported contents of a bit array
     * @return the bit array
     */
    public static PackedBitArray fromBytes(byte[] bytes) {
        PackedBitArray array = new PackedBitArray((long) bytes.length << 3);
        System.arraycopy(bytes, 0, array.data, 0, bytes.length);
        return array;
    }

    @Override
    public boolean get(long index) {
        checkIndex(index);
        return (data[(int) (index >>> 3)] & (1 << (index & 7))) != 0;
    }

    @Override
    public void put(long index, boolean value) {
        checkIndex(index);
        int byteIndex = (int) (index >>> 3);
        int mask = 1 << (index & 7);
        if (value) {
            data[byteIndex] |= (byte) mask;
        } else {
            data[byteIndex] &= (byte) ~mask;
        }
    }

    @Override
    public long bitLength() {
        return (long) data.length << 3;
    }

    @Override
    public long countOnes() {
        long count = 0;
        for (byte b : data) {
            count += Integer.bitCount(b & 0xff);
        }
        return count;
    }

    @Override
    public byte[] toBytes() {
        return data.clone();
    }

    @Override
    public Stream<byte[]> toChunkStream() {
        int numChunks = (data.length + chunkSizeBytes - 1) / chunkSizeBytes;
        return IntStream.range(0, numChunks)
            .mapToObj(chunk -> {
                int from = chunk * chunkSizeBytes;
                return Arrays.copyOfRange(data, from, Math.min(from + chunkSizeBytes, data.length));
            });
    }

    @Override
    public long consumeFromStream(Iterator<byte[]> chunks) {
        int offset = 0;
        while (chunks.hasNext()) {
            byte[] chunk = chunks.next();
            if (chunk.length > data.length - offset) {
                throw new IllegalArgumentException("Stream holds more than " + data.length + " bytes");
            }
            System.arraycopy(chunk, 0, data, offset, chunk.length);
            offset += chunk.length;
        }
        return offset;
    }

    private void checkIndex(long index) {
        if (index < 0 || index >= bitLength()) {
            throw new IndexOutOfBoundsException("Bit index " + index + " out of range [0, " + bitLength() + ")");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PackedBitArray)) return false;
        PackedBitArray that = (PackedBitArray) o;
        return Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }
}
