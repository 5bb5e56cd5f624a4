/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.codec;

import com.sffkit.SffException;

/**
 * RLE5 decoder (v2 format 3).
 *
 * <p>Packets start with a run-length byte and a group byte. The group byte's
 * low seven bits count the packed bytes that follow; its top bit means a
 * literal color byte comes next (otherwise the first color is 0). Each packed
 * byte holds a 5-bit color and a 3-bit run length. Every color is emitted
 * run + 1 times.
 */
public final class Rle5Codec {

    private Rle5Codec() {}

    /**
     * @return {@code width * height} palette indices
     * @throws SffException.DecodingFailed if the stream ends before the image is full
     */
    public static byte[] decode(byte[] source, int width, int height) throws SffException.DecodingFailed {
        byte[] pixels = new byte[Math.multiplyExact(width, height)];
        ByteCursor in = new ByteCursor(source, "RLE5");
        int dst = 0;

        while (dst < pixels.length) {
            int run = in.next();
            int groupByte = in.next();
            int groupLength = groupByte & 0x7F;
            int color = 0;
            if ((groupByte & 0x80) != 0) {
                color = in.next();
            }

            while (true) {
                if (dst < pixels.length) {
                    pixels[dst++] = (byte) color;
                }
                run--;
                if (run < 0) {
                    groupLength--;
                    if (groupLength < 0) {
                        break;
                    }
                    int packed = in.next();
                    color = packed & 0x1F;
                    run = packed >> 5;
                }
            }
        }
        return pixels;
    }
}
