/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.unit.v1;

import com.sffkit.SffException;
import com.sffkit.image.ImageSurface;
import com.sffkit.palette.PaletteTable;
import com.sffkit.test.SffFixtures;
import com.sffkit.v1.PcxDecoder;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class PcxDecoderTest {

    private static final PaletteTable RAMP = PaletteTable.fromRgb(SffFixtures.rampRgb(), 0);

    private static byte[] pattern(int width, int height) {
        byte[] indices = new byte[width * height];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = (byte) ((i / 3) % 7 == 0 ? 0xC5 : i % 4);
        }
        return indices;
    }

    private static void assertPixels(byte[] indices, ImageSurface image) {
        for (int y = 0; y < image.height(); y++) {
            for (int x = 0; x < image.width(); x++) {
                int index = indices[y * image.width() + x] & 0xFF;
                assertEquals(index == 0 ? 0 : 255, image.alphaAt(x, y), "alpha at " + x + "," + y);
                assertEquals(index, image.rgbaAt(x, y) >>> 24, "red at " + x + "," + y);
            }
        }
    }

    @Test
    void shouldDecodeRunLengthEncodedImage() throws SffException {
        byte[] indices = pattern(13, 5);
        ImageSurface image = PcxDecoder.decode(SffFixtures.pcx(13, 5, indices, SffFixtures.rampRgb(), true), RAMP, 4096);
        assertEquals(13, image.width());
        assertEquals(5, image.height());
        assertPixels(indices, image);
    }

    @Test
    void shouldDecodeUncompressedImage() throws SffException {
        byte[] indices = pattern(4, 4);
        assertPixels(indices, PcxDecoder.decode(SffFixtures.pcx(4, 4, indices, null, false), RAMP, 4096));
    }

    @Test
    void paddingBytesAtLineEndAreSkipped() throws SffException {
        // width 3, 4 bytes per line
        byte[] pcx = SffFixtures.pcx(4, 2, new byte[]{1, 2, 3, 99, 4, 5, 6, 99}, null, false);
        SffFixtures.putU16(pcx, 8, 2);
        ImageSurface image = PcxDecoder.decode(pcx, RAMP, 4096);
        assertEquals(3, image.width());
        assertPixels(new byte[]{1, 2, 3, 4, 5, 6}, image);
    }

    @Test
    void trailerIsNotReadAsPixels() throws SffException {
        // image data ends early; the trailer must not fill the remaining pixels
        byte[] full = SffFixtures.pcx(4, 4, SffFixtures.filled(4, 4, 9), SffFixtures.rampRgb(), false);
        byte[] cut = SffFixtures.concat(
                Arrays.copyOfRange(full, 0, 128 + 4),
                Arrays.copyOfRange(full, full.length - 769, full.length));
        ImageSurface image = PcxDecoder.decode(cut, RAMP, 4096);
        assertEquals(255, image.alphaAt(3, 0));
        assertEquals(0, image.alphaAt(0, 1));
    }

    @Test
    void peekDimensionsReadsHeader() {
        byte[] pcx = SffFixtures.pcx(120, 90, new byte[120 * 90], null, true);
        assertArrayEquals(new int[]{120, 90}, PcxDecoder.peekDimensions(pcx, 0, pcx.length));
        assertArrayEquals(new int[]{0, 0}, PcxDecoder.peekDimensions(pcx, 0, 8));
        assertArrayEquals(new int[]{0, 0}, PcxDecoder.peekDimensions(new byte[64], 0, 64));
    }

    @Test
    void rejectsNonPcxPayload() {
        byte[] pcx = SffFixtures.pcx(2, 2, new byte[4], null, false);
        pcx[0] = 11;
        assertThrows(SffException.DecodingFailed.class, () -> PcxDecoder.decode(pcx, RAMP, 4096));
    }

    @Test
    void rejectsOtherBitDepths() {
        byte[] pcx = SffFixtures.pcx(2, 2, new byte[4], null, false);
        pcx[3] = 4;
        assertThrows(SffException.DecodingFailed.class, () -> PcxDecoder.decode(pcx, RAMP, 4096));
    }

    @Test
    void rejectsNarrowScanLines() {
        byte[] pcx = SffFixtures.pcx(4, 2, new byte[8], null, false);
        SffFixtures.putU16(pcx, 66, 3);
        assertThrows(SffException.DecodingFailed.class, () -> PcxDecoder.decode(pcx, RAMP, 4096));
    }

    @Test
    void rejectsOversizedImage() {
        byte[] pcx = SffFixtures.pcx(20, 2, new byte[40], null, false);
        SffException.InvalidDimensions e = assertThrows(SffException.InvalidDimensions.class,
                () -> PcxDecoder.decode(pcx, RAMP, 16));
        assertEquals(20, e.getWidth());
        assertEquals(2, e.getHeight());
    }

    @Test
    void rejectsInvertedBounds() {
        byte[] pcx = SffFixtures.pcx(2, 2, new byte[4], null, false);
        SffFixtures.putU16(pcx, 4, 5);
        assertThrows(SffException.InvalidDimensions.class, () -> PcxDecoder.decode(pcx, RAMP, 4096));
    }
}
