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

import java.io.IOException;

/**
 * Signals that bytes do not hold a serialized Bloom filter.
 */
public class FilterFormatException extends IOException {

    private final ReadFailure reason;

    /**
     * Creates a new FilterFormatException.
     *
     * @param reason the failure reason
     * @param message the detail message
     */
    public FilterFormatException(ReadFailure reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * @return why the filter could not be read
     */
    public ReadFailure getReason() {
        return reason;
    }
}
