/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.unit.codec;

import com.sffkit.SffException;
import com.sffkit.codec.Rle8Codec;
import com.sffkit.test.SffFixtures;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Rle8CodecTest {

    @Test
    void markerRepeatsNextByte() throws SffException {
        byte[] out = Rle8Codec.decode(new byte[]{0x43, 0x07, 0x09}, 4, 1);
        assertArrayEquals(new byte[]{7, 7, 7, 9}, out);
    }

    @Test
    void highBytesAreLiterals() throws SffException {
        byte[] stream = {(byte) 0x80, (byte) 0xC3, (byte) 0xFF, 0x3F};
        assertArrayEquals(stream, Rle8Codec.decode(stream, 2, 2));
    }

    @Test
    void markerValueInRangeNeedsMarker() throws SffException {
        assertArrayEquals(new byte[]{0x55}, Rle8Codec.decode(new byte[]{0x41, 0x55}, 1, 1));
    }

    @Test
    void runIsClippedToImage() throws SffException {
        assertArrayEquals(new byte[]{2, 2}, Rle8Codec.decode(new byte[]{0x7F, 0x02}, 2, 1));
    }

    @Test
    void truncatedStreamFails() {
        assertThrows(SffException.DecodingFailed.class, () -> Rle8Codec.decode(new byte[]{0x45}, 5, 1));
        assertThrows(SffException.DecodingFailed.class, () -> Rle8Codec.decode(new byte[]{1, 2}, 2, 2));
    }

    @Property
    void encodedIndicesDecodeUnchanged(@ForAll @Size(min = 1, max = 400) byte[] indices) throws SffException {
        assertArrayEquals(indices, Rle8Codec.decode(SffFixtures.rle8(indices), indices.length, 1));
    }
}
