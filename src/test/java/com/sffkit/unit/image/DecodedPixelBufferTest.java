/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.unit.image;

import com.sffkit.SffException;
import com.sffkit.image.DecodedPixelBuffer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecodedPixelBufferTest {

    @Test
    void byteCountAtLargestAcceptedSize() throws SffException {
        assertEquals(1 << 30, DecodedPixelBuffer.byteCount(16384, 16384, DecodedPixelBuffer.TRUECOLOR));
    }

    @Test
    void byteCountOverflowIsInvalidDimensions() {
        SffException.InvalidDimensions e = assertThrows(SffException.InvalidDimensions.class,
                () -> DecodedPixelBuffer.byteCount(65535, 65535, DecodedPixelBuffer.TRUECOLOR));
        assertEquals(65535, e.getWidth());
        assertEquals(65535, e.getHeight());
    }

    @Test
    void bufferLengthMustMatchSize() {
        assertThrows(SffException.DecodingFailed.class, () -> DecodedPixelBuffer.indexed(2, 2, new byte[3]));
    }
}
