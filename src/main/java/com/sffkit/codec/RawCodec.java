/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.codec;

/**
 * Uncompressed sprite data (format 0). Short input is zero padded.
 */
public final class RawCodec {

    private RawCodec() {}

    /** 8-bit palette indices, one byte per pixel. */
    public static byte[] decodeIndexed(byte[] source, int width, int height) {
        return copyPadded(source, Math.multiplyExact(width, height));
    }

    /** 32-bit RGBA, four bytes per pixel. */
    public static byte[] decodeTruecolor(byte[] source, int width, int height) {
        return copyPadded(source, Math.multiplyExact(Math.multiplyExact(width, height), 4));
    }

    private static byte[] copyPadded(byte[] source, int outputLength) {
        byte[] pixels = new byte[outputLength];
        System.arraycopy(source, 0, pixels, 0, Math.min(source.length, outputLength));
        return pixels;
    }
}
