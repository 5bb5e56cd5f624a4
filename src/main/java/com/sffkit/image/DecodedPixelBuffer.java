/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.image;

import com.sffkit.SffException;

/**
 * Codec output: palette indices (1 byte per pixel) or RGBA (4 bytes per pixel).
 */
public final class DecodedPixelBuffer {

    public static final int INDEXED = 1;
    public static final int TRUECOLOR = 4;

    private final int width;
    private final int height;
    private final int bytesPerPixel;
    private final byte[] data;

    private DecodedPixelBuffer(int width, int height, int bytesPerPixel, byte[] data) {
        this.width = width;
        this.height = height;
        this.bytesPerPixel = bytesPerPixel;
        this.data = data;
    }

    /**
     * Buffer length for a {@code width x height} image.
     *
     * @throws SffException.InvalidDimensions if the length does not fit in an array
     */
    public static int byteCount(int width, int height, int bytesPerPixel) throws SffException.InvalidDimensions {
        try {
            return Math.multiplyExact(Math.multiplyExact(width, height), bytesPerPixel);
        } catch (ArithmeticException e) {
            throw new SffException.InvalidDimensions(width, height);
        }
    }

    public static DecodedPixelBuffer indexed(int width, int height, byte[] data) throws SffException.DecodingFailed {
        return of(width, height, INDEXED, data);
    }

    public static DecodedPixelBuffer truecolor(int width, int height, byte[] data) throws SffException.DecodingFailed {
        return of(width, height, TRUECOLOR, data);
    }

    private static DecodedPixelBuffer of(int width, int height, int bytesPerPixel, byte[] data)
            throws SffException.DecodingFailed {
        long expected = (long) width * height * bytesPerPixel;
        if (data == null || data.length != expected) {
            throw new SffException.DecodingFailed(String.format(
                    "expected %d bytes for %dx%d at %d bytes per pixel, got %d",
                    expected, width, height, bytesPerPixel, data == null ? 0 : data.length));
        }
        return new DecodedPixelBuffer(width, height, bytesPerPixel, data);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    public boolean isIndexed() {
        return bytesPerPixel == INDEXED;
    }

    byte[] data() {
        return data;
    }
}
