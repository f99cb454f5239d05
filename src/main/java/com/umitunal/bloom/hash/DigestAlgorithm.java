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

package com.umitunal.bloom.hash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Digests used to derive bit offsets. The digest is picked from the hash count alone.
 */
public enum DigestAlgorithm {
    SHA_256("SHA-256", 8),
    SHA_512("SHA-512", 16);

    private final String jcaName;
    private final int maxOffsets;

    DigestAlgorithm(String jcaName, int maxOffsets) {
        this.jcaName = jcaName;
        this.maxOffsets = maxOffsets;
    }

    /**
     * @return the number of 32-bit words in one digest
     */
    public int maxOffsets() {
        return maxOffsets;
    }

    /**
     * Chooses the digest for a hash count: SHA-256 up to 8 offsets, SHA-512 above.
     *
     * @param hashCount the number of offsets needed
     * @return the digest algorithm
     * @throws IllegalArgumentException if the hash count is outside [1, 16]
     */
    public static DigestAlgorithm forHashCount(int hashCount) {
        if (hashCount < 1 || hashCount > SHA_512.maxOffsets) {
            throw new IllegalArgumentException("hashCount must be between 1 and "
                + SHA_512.maxOffsets + ", but got " + hashCount);
        }
        return hashCount <= SHA_256.maxOffsets ? SHA_256 : SHA_512;
    }

    /**
     * Creates a fresh digest instance. {@link MessageDigest} is not thread-safe,
     * so instances are never shared.
     *
     * @return a new message digest
     */
    MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            // every Java platform must provide SHA-256 and SHA-512
            throw new IllegalStateException(jcaName + " is not available", e);
        }
    }
}
