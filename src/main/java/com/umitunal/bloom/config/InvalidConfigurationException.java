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

package com.umitunal.bloom.config;

/**
 * Thrown when a Bloom filter is requested with parameters it cannot be built with,
 * such as a bit-address width outside [6, 32] or a non-positive element count.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    /**
     * Creates a new InvalidConfigurationException.
     *
     * @param message the detail message
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
