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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BitArrayTypeTest {

    @Test
    void testAllocate() {
        assertInstanceOf(PackedBitArray.class, BitArrayType.PACKED.allocate(64));
        assertInstanceOf(AtomicBitArray.class, BitArrayType.ATOMIC.allocate(64));
        assertEquals(1L << 20, BitArrayType.ATOMIC.allocate(1L << 20).bitLength());
    }

    @Test
    void testFromBytes() {
        byte[] bytes = {0x01, 0, 0, 0, 0, 0, 0, (byte) 0x80};

        for (BitArrayType type : BitArrayType.values()) {
            BitArray bits = type.fromBytes(bytes);
            assertEquals(64, bits.bitLength(), type.name());
            assertTrue(bits.get(0), type.name());
            assertTrue(bits.get(63), type.name());
            assertEquals(2, bits.countOnes(), type.name());
        }
    }

    @Test
    void testFromBytesRejectsNonPowerOfTwoLength() {
        assertThrows(IllegalArgumentException.class, () -> BitArrayType.PACKED.fromBytes(new byte[3]));
        assertThrows(IllegalArgumentException.class, () -> BitArrayType.ATOMIC.fromBytes(new byte[0]));
    }
}
