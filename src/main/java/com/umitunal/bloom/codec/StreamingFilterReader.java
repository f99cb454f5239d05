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

import com.umitunal.bloom.bitarray.BitArray;
import com.umitunal.bloom.bitarray.BitArrayType;
import com.umitunal.bloom.filter.BloomFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Rebuilds a Bloom filter from a stream of byte chunks whose boundaries need not line
 * up with the 4-byte header.
 *
 * <p>The reader is a state machine:</p>
 * <ul>
 *   <li>{@link State#AWAITING_HEADER}: chunks are appended to a lookahead buffer until its
 *       first 4 bytes form a recognized header, or until the buffer holds
 *       {@value #HEADER_LOOKAHEAD_LIMIT} bytes, which fails with {@link ReadFailure#INVALID_HEADER}.</li>
 *   <li>{@link State#STREAMING_BODY}: a bit array is allocated and fed the buffered tail
 *       followed by the rest of the stream.</li>
 *   <li>{@link State#DONE} or {@link State#FAILED}.</li>
 * </ul>
 *
 * Chunks are pulled one at a time; nothing beyond the lookahead buffer is held by the reader.
 * A reader instance reads a single stream.
 */
public final class StreamingFilterReader {
    private static final Logger logger = LoggerFactory.getLogger(StreamingFilterReader.class);

    /**
     * Number of buffered bytes after which a missing header is a format error.
     */
    public static final int HEADER_LOOKAHEAD_LIMIT = 100;

    /**
     * States of the reader.
     */
    public enum State {
        AWAITING_HEADER,
        STREAMING_BODY,
        DONE,
        FAILED
    }

    private final BitArrayType bitArrayType;
    private State state = State.AWAITING_HEADER;
    private byte[] buffer = new byte[0];
    private FilterHeader header;
    private ReadResult result;

    /**
     * Creates a reader that allocates {@link BitArrayType#PACKED} bit arrays.
     */
    public StreamingFilterReader() {
        this(BitArrayType.PACKED);
    }

    /**
     * Creates a reader.
     *
     * @param bitArrayType the backend to allocate for the filter
     */
    public StreamingFilterReader(BitArrayType bitArrayType) {
        this.bitArrayType = bitArrayType;
    }

    /**
     * @return the current state
     */
    public State state() {
        return state;
    }

    /**
     * @return the recognized header, once the reader has left {@link State#AWAITING_HEADER}
     */
    public Optional<FilterHeader> header() {
        return Optional.ofNullable(header);
    }

    /**
     * @return the number of bytes held in the lookahead buffer
     */
    public int bufferedBytes() {
        return buffer.length;
    }

    /**
     * Reads a whole stream: waits for the header, then streams the body.
     *
     * @param chunks the chunks of a serialized filter
     * @return the filter, or the reason it could not be read
     * @throws IllegalStateException if this reader has already been used
     */
    public ReadResult read(Iterator<byte[]> chunks) {
        requireState(State.AWAITING_HEADER);

        while (state == State.AWAITING_HEADER) {
            if (!chunks.hasNext()) {
                return endOfStream();
            }
            offerHeaderChunk(chunks.next());
        }

        if (state == State.FAILED) {
            return result;
        }
        return consumeBody(chunks);
    }

    /**
     * Adds one chunk to the lookahead buffer and looks for the header.
     *
     * @param chunk the next chunk of the stream
     * @return the state after the chunk: still {@link State#AWAITING_HEADER},
     *         {@link State#STREAMING_BODY} once the header is known, or {@link State#FAILED}
     * @throws IllegalStateException if the header was already found or reading failed
     */
    public State offerHeaderChunk(byte[] chunk) {
        requireState(State.AWAITING_HEADER);

        int previous = buffer.length;
        buffer = Arrays.copyOf(buffer, previous + chunk.length);
        System.arraycopy(chunk, 0, buffer, previous, chunk.length);

        Optional<FilterHeader> parsed = FilterHeader.parse(buffer, buffer.length);
        if (parsed.isPresent()) {
            header = parsed.get();
            state = State.STREAMING_BODY;
            logger.debug("Recognized filter header: width={}, hashCount={}",
                header.bitAddressWidth(), header.hashCount());
        } else if (buffer.length >= HEADER_LOOKAHEAD_LIMIT) {
            fail(ReadFailure.INVALID_HEADER,
                "No recognized header in the first " + buffer.length + " bytes");
        }
        return state;
    }

    /**
     * Signals that the stream ended while the header was still awaited.
     *
     * @return the failure result
     * @throws IllegalStateException if the reader is not awaiting the header
     */
    public ReadResult endOfStream() {
        requireState(State.AWAITING_HEADER);
        return fail(ReadFailure.TRUNCATED_HEADER,
            "Stream ended after " + buffer.length + " bytes without a recognized header");
    }

    /**
     * Streams the body into a freshly allocated bit array: first the bytes buffered
     * after the header, then every remaining chunk.
     *
     * @param remaining the rest of the stream
     * @return the filter, or {@link ReadFailure#BODY_OVERFLOW} if the body is too long
     * @throws IllegalStateException if the header has not been recognized
     */
    public ReadResult consumeBody(Iterator<byte[]> remaining) {
        requireState(State.STREAMING_BODY);

        BitArray bits = bitArrayType.allocate(header.bitLength());
        byte[] tail = Arrays.copyOfRange(buffer, FilterHeader.SIZE, buffer.length);
        buffer = new byte[0];

        long consumed;
        try {
            consumed = bits.consumeFromStream(new PrependedIterator(tail, remaining));
        } catch (IllegalArgumentException e) {
            return fail(ReadFailure.BODY_OVERFLOW,
                "Body is longer than " + header.bodyLength() + " bytes");
        }

        if (consumed < header.bodyLength()) {
            logger.warn("Filter body has {} of {} bytes; the remaining bits are left unset",
                consumed, header.bodyLength());
        }

        state = State.DONE;
        result = new ReadResult.Success(new BloomFilter(bits, header.hashCount()));
        return result;
    }

    private ReadResult fail(ReadFailure reason, String message) {
        logger.debug("Reading filter failed: {} ({})", reason, message);
        state = State.FAILED;
        result = new ReadResult.Failure(reason, message);
        return result;
    }

    private void requireState(State expected) {
        if (state != expected) {
            throw new IllegalStateException("Expected state " + expected + " but reader is " + state);
        }
    }

    /**
     * Iterator that yields one chunk before the chunks of another iterator.
     */
    private static final class PrependedIterator implements Iterator<byte[]> {
        private byte[] first;
        private final Iterator<byte[]> rest;

        PrependedIterator(byte[] first, Iterator<byte[]> rest) {
            this.first = first.length > 0 ? first : null;
            this.rest = rest;
        }

        @Override
        public boolean hasNext() {
            return first != null || rest.hasNext();
        }

        @Override
        public byte[] next() {
            if (first != null) {
                byte[] chunk = first;
                first = null;
                return chunk;
            }
            if (!rest.hasNext()) {
                throw new NoSuchElementException("No more chunks");
            }
            return rest.next();
        }
    }
}
