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

/**
 * Named filter sizes. Each tier is twice the previous one, starting at 8 bytes
 * (a bit-address width of 6) and ending at 512 MB (a width of 32).
 *
 * <pre>
 * | width | size     | width | size   | width | size   |
 * |-------|----------|-------|--------|-------|--------|
 * |   6   | 8 Byte   |  13   | 1 KB   |  23   | 1 MB   |
 * |   7   | 16 Byte  |  14   | 2 KB   |  24   | 2 MB   |
 * |   8   | 32 Byte  |  15   | 4 KB   |  25   | 4 MB   |
 * |   9   | 64 Byte  |  16   | 8 KB   |  26   | 8 MB   |
 * |  10   | 128 Byte |  17   | 16 KB  |  27   | 16 MB  |
 * |  11   | 256 Byte |  18   | 32 KB  |  28   | 32 MB  |
 * |  12   | 512 Byte |  19   | 64 KB  |  29   | 64 MB  |
 * |       |          |  20   | 128 KB |  30   | 128 MB |
 * |       |          |  21   | 256 KB |  31   | 256 MB |
 * |       |          |  22   | 512 KB |  32   | 512 MB |
 * </pre>
 */
public enum SizeTier {
    BYTES_8("8 Byte"),
    BYTES_16("16 Byte"),
    BYTES_32("32 Byte"),
    BYTES_64("64 Byte"),
    BYTES_128("128 Byte"),
    BYTES_256("256 Byte"),
    BYTES_512("512 Byte"),
    KB_1("1 KB"),
    KB_2("2 KB"),
    KB_4("4 KB"),
    KB_8("8 KB"),
    KB_16("16 KB"),
    KB_32("32 KB"),
    KB_64("64 KB"),
    KB_128("128 KB"),
    KB_256("256 KB"),
    KB_512("512 KB"),
    MB_1("1 MB"),
    MB_2("2 MB"),
    MB_4("4 MB"),
    MB_8("8 MB"),
    MB_16("16 MB"),
    MB_32("32 MB"),
    MB_64("64 MB"),
    MB_128("128 MB"),
    MB_256("256 MB"),
    MB_512("512 MB");

    private final String label;

    SizeTier(String label) {
        this.label = label;
    }

    /**
     * @return the human readable label, e.g. "1 KB"
     */
    public String label() {
        return label;
    }

    /**
     * @return the bit-address width of this tier
     */
    public int bitAddressWidth() {
        return SizingPolicy.MIN_BIT_ADDRESS_WIDTH + ordinal();
    }

    /**
     * @return the size of this tier in bytes
     */
    public long bytes() {
        return 1L << (bitAddressWidth() - 3);
    }

    /**
     * Looks up a tier by its label.
     *
     * @param label the label, e.g. "512 Byte" or "2 MB"
     * @return the tier
     * @throws InvalidConfigurationException if no tier has that label
     */
    public static SizeTier fromLabel(String label) {
        for (SizeTier tier : values()) {
            if (tier.label.equals(label)) {
                return tier;
            }
        }
        throw new InvalidConfigurationException("Unknown size tier: " + label);
    }

    /**
     * Looks up the tier for a bit-address width.
     *
     * @param bitAddressWidth the width, between 6 and 32
     * @return the tier
     * @throws InvalidConfigurationException if the width is out of range
     */
    public static SizeTier forBitAddressWidth(int bitAddressWidth) {
        SizingPolicy.checkBitAddressWidth(bitAddressWidth);
        return values()[bitAddressWidth - SizingPolicy.MIN_BIT_ADDRESS_WIDTH];
    }

    @Override
    public String toString() {
        return label;
    }
}
