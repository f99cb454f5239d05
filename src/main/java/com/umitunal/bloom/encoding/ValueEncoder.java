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

package com.umitunal.bloom.encoding;

/**
 * Turns values into the bytes that are hashed by a Bloom filter.
 * Implementations must be deterministic: equal values always give equal bytes,
 * otherwise membership tests across processes or versions break.
 */
@FunctionalInterface
public interface ValueEncoder {

    /**
     * Encodes a value.
     *
     * @param value the value, never null
     * @return the encoded bytes
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    byte[] encode(Object value);
}
