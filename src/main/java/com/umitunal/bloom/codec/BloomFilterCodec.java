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

import com.umitunal.bloom.bitarray.BitArrayType;
import com.umitunal.bloom.filter.BloomFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Binary format of a Bloom filter: the 4-byte {@link FilterHeader} followed by exactly
 * {@code 2^(b-3)} bytes of bit array contents, bit {@code i} being bit {@code i % 8}
 * (least significant first) of byte {@code i / 8}.
 *
 * <p>The streaming methods never hold more than one chunk of the body at a time, so
 * filters of hundreds of megabytes can be written and read incrementally.</p>
 */
public final class BloomFilterCodec {
    private static final Logger logger = LoggerFactory.getLogger(BloomFilterCodec.class);

    private BloomFilterCodec() {
    }

    /**
     * Serializes a filter into one byte array.
     *
     * @param filter the filter
     * @return the header followed by the whole body
     * @deprecated materializes the whole filter in memory; use {@link #toStream(BloomFilter)}
     */
    @Deprecated
    public static byte[] serialize(BloomFilter filter) {
        byte[] header = FilterHeader.of(filter).toBytes();
        byte[] body = filter.exportBytes();
        byte[] bytes = new byte[header.length + body.length];
        System.arraycopy(header, 0, bytes, 0, header.length);
        System.arraycopy(body, 0, bytes, header.length, body.length);
        return bytes;
    }

    /**
     * Deserializes a filter from one byte array.
     *
     * @param bytes the output of {@link #serialize(BloomFilter)}
     * @return the filter
     * @throws FilterFormatException if the bytes do not hold a filter
     * @deprecated use {@link #fromStream(Iterator)}
     */
    @Deprecated
    public static BloomFilter deserialize(byte[] bytes) throws FilterFormatException {
        return fromStream(List.of(bytes).iterator()).orElseThrow();
    }

    /**
     * Serializes a filter as a lazy stream of chunks: the header first, then the bit
     * array's own chunks.
     *
     * @param filter the filter
     * @return a single-use stream of chunks
     */
    public static Stream<byte[]> toStream(BloomFilter filter) {
        return Stream.concat(Stream.of(FilterHeader.of(filter).toBytes()), filter.exportChunks());
    }

    /**
     * Rebuilds a filter from chunks with arbitrary boundaries.
     *
     * @param chunks the chunks of a serialized filter
     * @return the filter, or the reason it could not be read
     */
    public static ReadResult fromStream(Iterator<byte[]> chunks) {
        return fromStream(chunks, BitArrayType.PACKED);
    }

    /**
     * Rebuilds a filter from chunks with arbitrary boundaries.
     *
     * @param chunks the chunks of a serialized filter
     * @param bitArrayType the backend to allocate for the filter
     * @return the filter, or the reason it could not be read
     */
    public static ReadResult fromStream(Iterator<byte[]> chunks, BitArrayType bitArrayType) {
        return new StreamingFilterReader(bitArrayType).read(chunks);
    }

    /**
     * Rebuilds a filter from a stream of chunks with arbitrary boundaries.
     *
     * @param chunks the chunks of a serialized filter
     * @return the filter, or the reason it could not be read
     */
    public static ReadResult fromStream(Stream<byte[]> chunks) {
        return fromStream(chunks.iterator());
    }

    /**
     * Writes a serialized filter to an output stream, chunk by chunk.
     * The output stream is neither flushed nor closed.
     *
     * @param filter the filter
     * @param out the output stream
     * @throws IOException if an I/O error occurs
     */
    public static void writeTo(BloomFilter filter, OutputStream out) throws IOException {
        long written = 0;
        Iterator<byte[]> chunks = toStream(filter).iterator();
        while (chunks.hasNext()) {
            byte[] chunk = chunks.next();
            out.write(chunk);
            written += chunk.length;
        }
        logger.debug("Wrote {} bytes for {}", written, filter);
    }

    /**
     * Reads a serialized filter from an input stream in chunks of {@code chunkSize} bytes.
     * The input stream is read to its end but not closed.
     *
     * @param in the input stream
     * @param chunkSize the chunk size in bytes
     * @param bitArrayType the backend to allocate for the filter
     * @return the filter, or the reason it could not be read
     * @throws IOException if an I/O error occurs
     */
    public static ReadResult readFrom(InputStream in, int chunkSize, BitArrayType bitArrayType) throws IOException {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        try {
            return fromStream(new InputStreamChunkIterator(in, chunkSize), bitArrayType);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Reads a serialized filter from an input stream into a {@link BitArrayType#PACKED} filter.
     *
     * @param in the input stream
     * @param chunkSize the chunk size in bytes
     * @return the filter, or the reason it could not be read
     * @throws IOException if an I/O error occurs
     */
    public static ReadResult readFrom(InputStream in, int chunkSize) throws IOException {
        return readFrom(in, chunkSize, BitArrayType.PACKED);
    }

    /**
     * Pulls fixed-size chunks from an input stream; the last chunk may be shorter.
     */
    private static final class InputStreamChunkIterator implements Iterator<byte[]> {
        private final InputStream in;
        private final int chunkSize;
        private byte[] next;
        private boolean exhausted;

        InputStreamChunkIterator(InputStream in, int chunkSize) {
            this.in = in;
            this.chunkSize = chunkSize;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                try {
                    byte[] chunk = in.readNBytes(chunkSize);
                    if (chunk.length == 0) {
                        exhausted = true;
                    } else {
                        next = chunk;
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return next != null;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more chunks");
            }
            byte[] chunk = next;
            next = null;
            return chunk;
        }
    }
}
