/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.io;

/**
 * Bounds-checked little-endian reads over a byte array.
 *
 * <p>Reads never throw. Any read that would touch bytes outside the array
 * returns 0, and callers are expected to validate the resulting record.
 */
public final class ByteReader {

    private ByteReader() {}

    /**
     * Unsigned byte at {@code offset}, or 0 when out of range.
     */
    public static int u8(byte[] data, int offset) {
        if (offset < 0 || offset >= data.length) {
            return 0;
        }
        return data[offset] & 0xFF;
    }

    /**
     * Unsigned 16-bit little-endian value at {@code offset}, or 0 when out of range.
     */
    public static int u16(byte[] data, int offset) {
        if (offset < 0 || (long) offset + 1 >= data.length) {
            return 0;
        }
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8);
    }

    /**
     * Signed 16-bit little-endian value at {@code offset}, or 0 when out of range.
     */
    public static int s16(byte[] data, int offset) {
        return (short) u16(data, offset);
    }

    /**
     * Unsigned 32-bit little-endian value at {@code offset}, or 0 when out of range.
     * Returned as a long so values above 2^31 keep their sign.
     */
    public static long u32(byte[] data, int offset) {
        if (offset < 0 || (long) offset + 3 >= data.length) {
            return 0;
        }
        return (data[offset] & 0xFFL)
                | ((data[offset + 1] & 0xFFL) << 8)
                | ((data[offset + 2] & 0xFFL) << 16)
                | ((data[offset + 3] & 0xFFL) << 24);
    }

    /**
     * True when {@code [offset, offset + length)} lies inside the array.
     * Accepts longs so that header fields can be checked before narrowing.
     */
    public static boolean fits(byte[] data, long offset, long length) {
        return offset >= 0 && length >= 0 && offset + length <= data.length;
    }
}
