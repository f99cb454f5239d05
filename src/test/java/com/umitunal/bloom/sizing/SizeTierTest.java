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

package com.umitunal.bloom.sizing;

import com.umitunal.bloom.config.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SizeTierTest {

    @Test
    void testTierRange() {
        assertEquals(27, SizeTier.values().length);
        assertEquals(6, SizeTier.BYTES_8.bitAddressWidth());
        assertEquals(8, SizeTier.BYTES_8.bytes());
        assertEquals(13, SizeTier.KB_1.bitAddressWidth());
        assertEquals(1024, SizeTier.KB_1.bytes());
        assertEquals(32, SizeTier.MB_512.bitAddressWidth());
        assertEquals(512L * 1024 * 1024, SizeTier.MB_512.bytes());
    }

    @Test
    void testEachTierDoublesThePrevious() {
        SizeTier[] tiers = SizeTier.values();
        for (int i = 1; i < tiers.length; i++) {
            assertEquals(tiers[i - 1].bytes() * 2, tiers[i].bytes());
        }
    }

    @Test
    void testFromLabel() {
        assertEquals(SizeTier.BYTES_512, SizeTier.fromLabel("512 Byte"));
        assertEquals(SizeTier.MB_2, SizeTier.fromLabel("2 MB"));
        assertEquals("1 KB", SizeTier.KB_1.toString());
        assertThrows(InvalidConfigurationException.class, () -> SizeTier.fromLabel("1 GB"));
    }

    @Test
    void testForBitAddressWidth() {
        for (SizeTier tier : SizeTier.values()) {
            assertEquals(tier, SizeTier.forBitAddressWidth(tier.bitAddressWidth()));
        }
        assertThrows(InvalidConfigurationException.class, () -> SizeTier.forBitAddressWidth(5));
        assertThrows(InvalidConfigurationException.class, () -> SizeTier.forBitAddressWidth(33));
    }
}
