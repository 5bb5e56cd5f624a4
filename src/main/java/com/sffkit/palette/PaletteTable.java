/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.palette;

import java.util.Arrays;

/**
 * Immutable 256-entry RGBA color table.
 *
 * <p>Entries beyond the source's color count are black with zero alpha. The
 * stored alpha of index 0 is kept as read; the compositor is responsible for
 * treating index 0 as transparent.
 */
public final class PaletteTable {

    public static final int MAX_COLORS = 256;

    /** Size of an RGB palette block (v1 embedded palettes, .act files). */
    public static final int RGB_BYTES = MAX_COLORS * 3;

    private static final PaletteTable EMPTY = new PaletteTable(new byte[MAX_COLORS * 4], 0);

    private final byte[] rgba;
    private final int colorCount;

    private PaletteTable(byte[] rgba, int colorCount) {
        this.rgba = rgba;
        this.colorCount = colorCount;
    }

    /**
     * All-zero palette. Indexed sprites composited against it come out black.
     */
    public static PaletteTable empty() {
        return EMPTY;
    }

    /**
     * Build from 768 bytes of RGB triplets starting at {@code offset}. Alpha is 255.
     *
     * @throws IllegalArgumentException if fewer than 768 bytes are available
     */
    public static PaletteTable fromRgb(byte[] source, int offset) {
        if (offset < 0 || offset + RGB_BYTES > source.length) {
            throw new IllegalArgumentException(String.format(
                    "RGB palette needs %d bytes at offset %d, buffer has %d",
                    RGB_BYTES, offset, source.length));
        }
        byte[] rgba = new byte[MAX_COLORS * 4];
        for (int i = 0; i < MAX_COLORS; i++) {
            rgba[i * 4] = source[offset + i * 3];
            rgba[i * 4 + 1] = source[offset + i * 3 + 1];
            rgba[i * 4 + 2] = source[offset + i * 3 + 2];
            rgba[i * 4 + 3] = (byte) 0xFF;
        }
        return new PaletteTable(rgba, MAX_COLORS);
    }

    /**
     * Build from {@code count} RGBA quadruplets starting at {@code offset}.
     * At most 256 colors are read.
     *
     * @throws IllegalArgumentException if the quadruplets do not fit the buffer
     */
    public static PaletteTable fromRgba(byte[] source, int offset, int count) {
        int colors = Math.min(Math.max(count, 0), MAX_COLORS);
        if (offset < 0 || offset + colors * 4 > source.length) {
            throw new IllegalArgumentException(String.format(
                    "RGBA palette needs %d bytes at offset %d, buffer has %d",
                    colors * 4, offset, source.length));
        }
        byte[] rgba = new byte[MAX_COLORS * 4];
        System.arraycopy(source, offset, rgba, 0, colors * 4);
        return new PaletteTable(rgba, colors);
    }

    public int colorCount() {
        return colorCount;
    }

    public int red(int index) {
        return rgba[index * 4] & 0xFF;
    }

    public int green(int index) {
        return rgba[index * 4 + 1] & 0xFF;
    }

    public int blue(int index) {
        return rgba[index * 4 + 2] & 0xFF;
    }

    /** Stored alpha, without the index-0 transparency rule applied. */
    public int alpha(int index) {
        return rgba[index * 4 + 3] & 0xFF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PaletteTable other)) return false;
        return colorCount == other.colorCount && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rgba) + colorCount;
    }

    @Override
    public String toString() {
        return "PaletteTable{colors=" + colorCount + "}";
    }
}
