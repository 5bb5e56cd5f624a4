/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.v1;

import com.sffkit.SffException;
import com.sffkit.image.DecodedPixelBuffer;
import com.sffkit.image.ImageSurface;
import com.sffkit.image.PixelCompositor;
import com.sffkit.io.ByteReader;
import com.sffkit.palette.PaletteTable;
import com.sffkit.palette.V1PaletteResolver;

/**
 * Decodes the 8-bit PCX images that v1 archives embed as sprite payloads.
 *
 * <p>Header fields used (little-endian):
 * - Byte 0: manufacturer, must be 10
 * - Byte 2: encoding, 1 = RLE
 * - Byte 3: bits per pixel, must be 8
 * - Bytes 4-11: xmin, ymin, xmax, ymax
 * - Bytes 66-67: bytes per scan line
 *
 * Pixel data starts at byte 128 and stops before the 769-byte palette trailer
 * when one is present. With RLE encoding, a byte with both top bits set
 * repeats the following byte {@code b & 0x3F} times.
 */
public final class PcxDecoder {

    public static final int HEADER_SIZE = 128;
    private static final int MANUFACTURER_ZSOFT = 10;
    private static final int ENCODING_RLE = 1;

    private PcxDecoder() {}

    /**
     * Width and height from a PCX header inside the archive, without decoding.
     *
     * @return {width, height}, or {0, 0} when the header is missing or malformed
     */
    public static int[] peekDimensions(byte[] data, long offset, long length) {
        if (length < 12 || !ByteReader.fits(data, offset, 12)) {
            return new int[]{0, 0};
        }
        int at = (int) offset;
        if (ByteReader.u8(data, at) != MANUFACTURER_ZSOFT) {
            return new int[]{0, 0};
        }
        int width = ByteReader.u16(data, at + 8) - ByteReader.u16(data, at + 4) + 1;
        int height = ByteReader.u16(data, at + 10) - ByteReader.u16(data, at + 6) + 1;
        return new int[]{Math.max(width, 0), Math.max(height, 0)};
    }

    /**
     * Decode a PCX payload.
     *
     * @param pcx the payload bytes
     * @param palette palette chosen by {@link V1PaletteResolver}
     * @param maxDimension largest accepted width or height
     * @throws SffException.DecodingFailed if the header is not an 8-bit PCX
     * @throws SffException.InvalidDimensions if the declared size is out of range
     */
    public static ImageSurface decode(byte[] pcx, PaletteTable palette, int maxDimension) throws SffException {
        if (pcx.length <= HEADER_SIZE) {
            throw new SffException.DecodingFailed("PCX payload of " + pcx.length + " bytes has no image data");
        }
        int manufacturer = ByteReader.u8(pcx, 0);
        if (manufacturer != MANUFACTURER_ZSOFT) {
            throw new SffException.DecodingFailed("not a PCX image (manufacturer byte " + manufacturer + ")");
        }

        int encoding = ByteReader.u8(pcx, 2);
        int bitsPerPixel = ByteReader.u8(pcx, 3);
        int width = ByteReader.u16(pcx, 8) - ByteReader.u16(pcx, 4) + 1;
        int height = ByteReader.u16(pcx, 10) - ByteReader.u16(pcx, 6) + 1;

        if (width <= 0 || height <= 0 || width > maxDimension || height > maxDimension) {
            throw new SffException.InvalidDimensions(width, height);
        }
        DecodedPixelBuffer.byteCount(width, height, DecodedPixelBuffer.TRUECOLOR);
        if (bitsPerPixel != 8) {
            throw new SffException.DecodingFailed("unsupported PCX depth: " + bitsPerPixel + " bits per pixel");
        }

        int bytesPerLine = ByteReader.u16(pcx, 66);
        if (bytesPerLine < width) {
            throw new SffException.DecodingFailed(String.format(
                    "PCX scan line of %d bytes is narrower than width %d", bytesPerLine, width));
        }

        boolean hasTrailer = pcx.length > V1PaletteResolver.TRAILER_SIZE
                && ByteReader.u8(pcx, pcx.length - V1PaletteResolver.TRAILER_SIZE) == V1PaletteResolver.TRAILER_MARKER;
        int end = hasTrailer ? pcx.length - V1PaletteResolver.TRAILER_SIZE : pcx.length;

        byte[] pixels = new byte[Math.multiplyExact(width, height)];
        int src = HEADER_SIZE;
        int dst = 0;

        for (int y = 0; y < height && src < end; y++) {
            int x = 0;
            while (x < bytesPerLine && src < end) {
                int b = pcx[src++] & 0xFF;
                if (encoding == ENCODING_RLE && (b & 0xC0) == 0xC0) {
                    int count = b & 0x3F;
                    byte value = src < pcx.length ? pcx[src] : 0;
                    src++;
                    for (int i = 0; i < count; i++) {
                        if (x < width && dst < pixels.length) {
                            pixels[dst++] = value;
                        }
                        x++;
                    }
                } else {
                    if (x < width && dst < pixels.length) {
                        pixels[dst++] = (byte) b;
                    }
                    x++;
                }
            }
        }

        return PixelCompositor.composite(
                DecodedPixelBuffer.indexed(width, height, pixels),
                width, height, palette, PixelCompositor.AlphaMode.OPAQUE);
    }
}
