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
import java.util.List;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Bit array stored in 64-bit words that are updated with compare-and-set.
 * A single {@link #put(long, boolean)} never loses a concurrent update to another bit
 * of the same word. Bulk operations ({@link #countOnes()}, exports, imports) are not
 * atomic snapshots.
 *
 * <p>Words are exported little-endian, which gives the same byte layout as
 * {@link PackedBitArray}.</p>
 */
public final class AtomicBitArray implements BitArray {

    /**
     * Default number of words per exported chunk (8 KB).
     */
    public static final int DEFAULT_CHUNK_SIZE_WORDS = 1024;

    private final AtomicLongArray words;
    private final long bitLength;
    private final int chunkSizeWords;

    /**
     * Creates a new zeroed bit array.
     *
     * @param lengthInBits the length in bits, a power of two
     */
    public AtomicBitArray(long lengthInBits) {
        this(lengthInBits, DEFAULT_CHUNK_SIZE_WORDS);
    }

    /**
     * Creates a new zeroed bit array with a custom export chunk size.
     *
     * @param lengthInBits the length in bits, a power of two
     * @param chunkSizeWords the number of 64-bit words per exported chunk
     */
    public AtomicBitArray(long lengthInBits, int chunkSizeWords) {
        BitArray.checkLength(lengthInBits);
        if (chunkSizeWords <= 0) {
            throw new IllegalArgumentException("chunkSizeWords must be positive");
        }
        // 8 and 16 bit arrays still need one word; only the low bytes are exported
        this.words = new AtomicLongArray((int) Math.max(1, lengthInBits >>> 6));
        this.bitLength = lengthInBits;
        this.chunkSizeWords = chunkSizeWords;
    }

    /**
     * Creates a bit array holding a copy of the given bytes.
     *
     * @param bytes the exported contents of a bit array
     * @return the bit array
     */
    public static AtomicBitArray fromBytes(byte[] bytes) {
        AtomicBitArray array = new AtomicBitArray((long) bytes.length << 3);
        array.consumeFromStream(List.of(bytes).iterator());
        return array;
    }

    @Override
    public boolean get(long index) {
        checkIndex(index);
        return (words.get((int) (index >>> 6)) & (1L << index)) != 0;
    }

    @Override
    public void put(long index, boolean value) {
        checkIndex(index);
        int wordIndex = (int) (index >>> 6);
        long mask = 1L << index;
        long current;
        long updated;
        do {
            current = words.get(wordIndex);
            updated = value ? current | mask : current & ~mask;
            if (updated == current) {
                return;
            }
        } while (!words.compareAndSet(wordIndex, current, updated));
    }

    @Override
    public long bitLength() {
        return bitLength;
    }

    @Override
    public long countOnes() {
        long count = 0;
        for (int i = 0; i < words.length(); i++) {
            count += Long.bitCount(words.get(i));
        }
        return count;
    }

    @Override
    public byte[] toBytes() {
        byte[] bytes = new byte[byteLength()];
        copyBytes(0, bytes.length, bytes);
        return bytes;
    }

    @Override
    public Stream<byte[]> toChunkStream() {
        int byteLength = byteLength();
        int chunkSizeBytes = chunkSizeWords * Long.BYTES;
        int numChunks = (byteLength + chunkSizeBytes - 1) / chunkSizeBytes;
        return IntStream.range(0, numChunks)
            .mapToObj(chunk -> {
                int from = chunk * chunkSizeBytes;
                byte[] bytes = new byte[Math.min(chunkSizeBytes, byteLength - from)];
                copyBytes(from, bytes.length, bytes);
                return bytes;
            });
    }

    @Override
    public long consumeFromStream(Iterator<byte[]> chunks) {
        int byteLength = byteLength();
        int offset = 0;
        while (chunks.hasNext()) {
            byte[] chunk = chunks.next();
            if (chunk.length > byteLength - offset) {
                throw new IllegalArgumentException("Stream holds more than " + byteLength + " bytes");
            }
            for (byte b : chunk) {
                putByte(offset++, b);
            }
        }
        return offset;
    }

    private int byteLength() {
        return (int) (bitLength >>> 3);
    }

    private void copyBytes(int fromByte, int length, byte[] target) {
        for (int i = 0; i < length; i++) {
            int position = fromByte + i;
            target[i] = (byte) (words.get(position >>> 3) >>> ((position & 7) * 8));
        }
    }

    private void putByte(int position, byte value) {
        int wordIndex = position >>> 3;
        int shift = (position & 7) * 8;
        long clear = ~(0xffL << shift);
        long bits = (value & 0xffL) << shift;
        long current;
        do {
            current = words.get(wordIndex);
        } while (!words.compareAndSet(wordIndex, current, (current & clear) | bits));
    }

    private void checkIndex(long index) {
        if (index < 0 || index >= bitLength) {
            throw new IndexOutOfBoundsException("Bit index " + index + " out of range [0, " + bitLength + ")");
        }
    }
}
