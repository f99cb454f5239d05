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

/**
 * Reasons a serialized Bloom filter cannot be read.
 */
public enum ReadFailure {
    /**
     * No recognized header within the first {@value StreamingFilterReader#HEADER_LOOKAHEAD_LIMIT} bytes.
     */
    INVALID_HEADER,

    /**
     * The stream ended before a header was recognized.
     */
    TRUNCATED_HEADER,

    /**
     * The body is longer than the header's bit-address width allows.
     */
    BODY_OVERFLOW
}
