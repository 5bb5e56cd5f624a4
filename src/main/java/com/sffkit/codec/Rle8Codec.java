/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.codec;

import com.sffkit.SffException;

/**
 * RLE8 decoder (v2 format 2).
 *
 * <p>A byte in {@code 0x40-0x7F} is a run marker: its low six bits are the run
 * length and the next byte is the value. Every other byte, including
 * {@code 0x80-0xFF}, is a single literal pixel.
 */
public final class Rle8Codec {

    private static final int MARKER_MASK = 0xC0;
    private static final int MARKER_BITS = 0x40;
    private static final int RUN_MASK = 0x3F;

    private Rle8Codec() {}

    /**
     * @return {@code width * height} palette indices
     * @throws SffException.DecodingFailed if the stream ends before the image is full
     */
    public static byte[] decode(byte[] source, int width, int height) throws SffException.DecodingFailed {
        byte[] pixels = new byte[Math.multiplyExact(width, height)];
        ByteCursor in = new ByteCursor(source, "RLE8");
        int dst = 0;

        while (dst < pixels.length) {
            int value = in.next();
            int run = 1;
            if ((value & MARKER_MASK) == MARKER_BITS) {
                run = value & RUN_MASK;
                value = in.next();
            }
            for (int i = 0; i < run && dst < pixels.length; i++) {
                pixels[dst++] = (byte) value;
            }
        }
        return pixels;
    }
}
