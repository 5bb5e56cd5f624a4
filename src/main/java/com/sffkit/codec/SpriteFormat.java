/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.codec;

/**
 * Storage format codes of SFF sprites.
 */
public enum SpriteFormat {
    /** v1 sub-file payload; not a v2 code. */
    PCX(-1, false),
    RAW(0, false),
    RLE8(2, true),
    RLE5(3, true),
    LZ5(4, true),
    /** Indexed PNG re-colored through the archive palette. */
    PNG8(10, true),
    PNG24(11, true),
    PNG32(12, true);

    private final int code;
    private final boolean sizePrefixed;

    SpriteFormat(int code, boolean sizePrefixed) {
        this.code = code;
        this.sizePrefixed = sizePrefixed;
    }

    public int code() {
        return code;
    }

    /**
     * True when the payload starts with a 4-byte little-endian uncompressed size
     * that precedes the actual stream.
     */
    public boolean isSizePrefixed() {
        return sizePrefixed;
    }

    public boolean isPng() {
        return this == PNG8 || this == PNG24 || this == PNG32;
    }

    /**
     * @return the format for a v2 code, or null if the code is unknown
     */
    public static SpriteFormat fromCode(int code) {
        for (SpriteFormat format : values()) {
            if (format != PCX && format.code == code) {
                return format;
            }
        }
        return null;
    }
}
