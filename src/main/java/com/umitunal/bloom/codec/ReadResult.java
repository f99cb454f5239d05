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

/**
 * Outcome of reading a Bloom filter from a stream.
 * Format problems are reported as a {@link Failure} value instead of an exception.
 */
public sealed interface ReadResult permits ReadResult.Success, ReadResult.Failure {

    /**
     * @return true if a filter was read
     */
    boolean isSuccess();

    /**
     * Returns the filter or throws the failure.
     *
     * @return the filter
     * @throws FilterFormatException if reading failed
     */
    BloomFilter orElseThrow() throws FilterFormatException;

    /**
     * A filter was read.
     *
     * @param filter the reconstructed filter
     */
    record Success(BloomFilter filter) implements ReadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public BloomFilter orElseThrow() {
            return filter;
        }
    }

    /**
     * The bytes did not hold a filter.
     *
     * @param reason the failure reason
     * @param message a description of the failure
     */
    record Failure(ReadFailure reason, String message) implements ReadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public BloomFilter orElseThrow() throws FilterFormatException {
            throw new FilterFormatException(reason, message);
        }
    }
}
