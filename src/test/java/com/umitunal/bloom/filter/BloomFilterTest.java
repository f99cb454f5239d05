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

package com.umitunal.bloom.filter;

import com.umitunal.bloom.bitarray.BitArrayType;
import com.umitunal.bloom.bitarray.PackedBitArray;
import com.umitunal.bloom.config.BloomFilterConfig;
import com.umitunal.bloom.config.InvalidConfigurationException;
import com.umitunal.bloom.hash.OffsetGenerator;
import com.umitunal.bloom.sizing.SizeTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the BloomFilter class.
 */
class BloomFilterTest {
    private BloomFilter filter;

    @BeforeEach
    void setUp() {
        filter = BloomFilter.create(10, 100);
    }

    @Test
    void testCreate() {
        assertEquals(1024, filter.bitLength());
        assertEquals(10, filter.bitAddressWidth());
        assertEquals(7, filter.hashCount());
        assertEquals(1023, filter.indexMask());
        assertEquals(0, filter.countOnes());
        assertEquals(128, filter.exportBytes().length);
    }

    @Test
    void testEmptyFilterContainsNothing() {
        assertFalse(filter.query("alpha"));
        assertFalse(filter.query(new byte[0]));
        assertTrue(filter.notPresent("alpha"));
        assertEquals(0.0, filter.falsePositiveProbability());
        assertEquals(0, filter.estimateCardinality());
    }

    @Test
    void testInsertAndQuery() {
        filter.insert("alpha");
        filter.insert("beta");

        assertTrue(filter.query("alpha"));
        assertTrue(filter.query("beta"));
        assertFalse(filter.query("gamma"));
        assertFalse(filter.notPresent("alpha"));
        assertTrue(filter.notPresent("gamma"));
    }

    @Test
    void testStringAndItsBytesAreTheSameValue() {
        filter.insert("alpha");

        assertTrue(filter.query("alpha".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testStructuredValues() {
        filter.insert(Map.of("id", 7, "tags", List.of("x", "y")));
        filter.insert(12345L);

        assertTrue(filter.query(Map.of("tags", List.of("x", "y"), "id", 7)));
        assertTrue(filter.query(12345L));
        assertFalse(filter.query("12345"));
    }

    @Test
    void testNullValues() {
        filter.insert((Object) null);
        filter.insert((byte[]) null);

        assertEquals(0, filter.countOnes());
        assertFalse(filter.query((Object) null));
        assertFalse(filter.query((byte[]) null));
        assertTrue(filter.notPresent((Object) null));
    }

    @Test
    void testInsertSetsExactlyTheOffsetBits() {
        byte[] value = "alpha".getBytes(StandardCharsets.UTF_8);
        filter.insert(value);

        long[] offsets = OffsetGenerator.maskedOffsets(value, 7, 1023);
        long distinct = Arrays.stream(offsets).distinct().count();
        assertEquals(distinct, filter.countOnes());
    }

    @Test
    void testInsertIsIdempotent() {
        filter.insert("alpha");
        byte[] once = filter.exportBytes();

        filter.insert("alpha");

        assertArrayEquals(once, filter.exportBytes());
    }

    @Test
    void testBitsOnlyAccumulate() {
        long previous = 0;
        for (int i = 0; i < 200; i++) {
            filter.insert("value-" + i);
            long ones = filter.countOnes();
            assertTrue(ones >= previous);
            previous = ones;
        }
    }

    @Test
    void testNoFalseNegatives() {
        BloomFilter large = BloomFilter.create(SizeTier.KB_8, 1000);
        for (int i = 0; i < 1000; i++) {
            large.insert("key" + i);
        }

        for (int i = 0; i < 1000; i++) {
            assertTrue(large.query("key" + i), "key" + i + " must be present");
        }
    }

    @Test
    void testFalsePositiveRateIsLow() {
        BloomFilter large = BloomFilter.create(16, 1000);
        for (int i = 0; i < 1000; i++) {
            large.insert("key" + i);
        }

        int falsePositives = 0;
        for (int i = 0; i < 10000; i++) {
            if (large.query("other" + i)) {
                falsePositives++;
            }
        }

        assertTrue(falsePositives < 50, "Too many false positives: " + falsePositives);
        assertTrue(large.falsePositiveProbability() < 0.001);
    }

    @Test
    void testEstimateCardinality() {
        BloomFilter large = BloomFilter.create(16, 1000);
        for (int i = 0; i < 1000; i++) {
            large.insert("key" + i);
        }

        long estimate = large.estimateCardinality();
        assertTrue(estimate > 950 && estimate < 1050, "Estimate out of range: " + estimate);
    }

    @Test
    void testConstructorValidation() {
        assertThrows(NullPointerException.class, () -> new BloomFilter(null, 3));
        assertThrows(NullPointerException.class, () -> new BloomFilter(new PackedBitArray(64), 3, null));
        assertThrows(IllegalArgumentException.class, () -> new BloomFilter(new PackedBitArray(64), 0));
        assertThrows(IllegalArgumentException.class, () -> new BloomFilter(new PackedBitArray(64), 17));
        // 8 and 32 bit arrays are valid bit arrays but too small for a filter
        assertThrows(InvalidConfigurationException.class, () -> new BloomFilter(new PackedBitArray(32), 3));
    }

    @Test
    void testCreateValidation() {
        assertThrows(InvalidConfigurationException.class, () -> BloomFilter.create(5, 100));
        assertThrows(InvalidConfigurationException.class, () -> BloomFilter.create(33, 100));
        assertThrows(InvalidConfigurationException.class, () -> BloomFilter.create(10, 0));
        assertThrows(InvalidConfigurationException.class, () -> BloomFilter.createByByteBudget(7, 100));
    }

    @Test
    void testUndersizedFilterIsStillUsable() {
        BloomFilter tiny = BloomFilter.create(6, 1000);

        assertEquals(1, tiny.hashCount());
        tiny.insert("alpha");
        assertTrue(tiny.query("alpha"));
    }

    @Test
    void testCreateByByteBudget() {
        BloomFilter budgeted = BloomFilter.createByByteBudget(1000, 100);
        assertEquals(4096, budgeted.bitLength());

        BloomFilter tiered = BloomFilter.createByByteBudget(SizeTier.KB_1, 100);
        assertEquals(8192, tiered.bitLength());
        assertEquals(BloomFilter.create(SizeTier.KB_1, 100), tiered);
    }

    @Test
    void testSha512Path() {
        BloomFilter wide = new BloomFilter(new PackedBitArray(1 << 20), 12);

        wide.insert("alpha");

        assertTrue(wide.query("alpha"));
        assertFalse(wide.query("beta"));
        assertTrue(wide.countOnes() <= 12 && wide.countOnes() >= 11);
    }

    @Test
    void testBackendsAgree() {
        BloomFilterConfig config = BloomFilterConfig.getDefault().withBitAddressWidth(12).withExpectedElements(200);
        BloomFilter packed = BloomFilter.create(config);
        BloomFilter atomic = BloomFilter.create(config.withBitArrayType(BitArrayType.ATOMIC));

        for (int i = 0; i < 200; i++) {
            packed.insert("key" + i);
            atomic.insert("key" + i);
        }

        assertEquals(packed, atomic);
        assertEquals(packed.hashCode(), atomic.hashCode());
        assertArrayEquals(packed.exportBytes(), atomic.exportBytes());
    }

    @Test
    void testCustomEncoder() {
        BloomFilter lowerCase = new BloomFilter(new PackedBitArray(1024), 5,
            value -> value.toString().toLowerCase().getBytes(StandardCharsets.UTF_8));

        lowerCase.insert("Alpha");

        assertTrue(lowerCase.query("ALPHA"));
    }

    @Test
    void testEqualsAndToString() {
        BloomFilter other = BloomFilter.create(10, 100);
        assertEquals(filter, other);

        other.insert("alpha");
        assertNotEquals(filter, other);
        assertNotEquals(filter, BloomFilter.create(10, 10));
        assertEquals("BloomFilter{bitLength=1024, hashCount=7}", filter.toString());
    }
}
