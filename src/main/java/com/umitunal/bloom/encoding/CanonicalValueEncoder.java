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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Default value encoder.
 *
 * <ul>
 *   <li>{@code byte[]} is used as is;</li>
 *   <li>{@link ByteBuffer} contributes its remaining bytes;</li>
 *   <li>{@link CharSequence} is encoded as UTF-8;</li>
 *   <li>anything else becomes the marker byte {@code 0x00} followed by canonical JSON:
 *       map entries ordered by key and bean properties ordered by name.</li>
 * </ul>
 *
 * The marker keeps a structured value apart from a string with the same JSON text,
 * e.g. the number {@code 1} and the string {@code "1"}. Unordered collections such as
 * {@link java.util.HashSet} have no canonical order and should not be inserted.
 */
public final class CanonicalValueEncoder implements ValueEncoder {

    /**
     * Shared instance; the encoder holds no mutable state.
     */
    public static final CanonicalValueEncoder INSTANCE = new CanonicalValueEncoder();

    static final byte STRUCTURED_VALUE_MARKER = 0x00;

    private final ObjectMapper mapper = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    @Override
    public byte[] encode(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof ByteBuffer buffer) {
            byte[] bytes = new byte[buffer.remaining()];
            buffer.duplicate().get(bytes);
            return bytes;
        }
        if (value instanceof CharSequence text) {
            return text.toString().getBytes(StandardCharsets.UTF_8);
        }

        try {
            byte[] json = mapper.writeValueAsBytes(value);
            byte[] encoded = new byte[json.length + 1];
            encoded[0] = STRUCTURED_VALUE_MARKER;
            System.arraycopy(json, 0, encoded, 1, json.length);
            return encoded;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode value of type " + value.getClass().getName(), e);
        }
    }
}
