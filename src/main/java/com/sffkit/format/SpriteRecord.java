/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.format;

/**
 * A located but undecoded sprite.
 *
 * <p>For v1 records the width and height are peeked from the PCX header and may
 * be 0 when the payload is too short to carry one; {@code formatCode} is always
 * {@link com.sffkit.codec.SpriteFormat#PCX}'s code. {@code dataOffset} is an
 * absolute offset into the archive buffer.
 *
 * @param index position in the sprite table (0-based)
 * @param group group number
 * @param image image number within the group
 * @param width declared width in pixels
 * @param height declared height in pixels
 * @param formatCode storage format code
 * @param colorDepth bits per pixel (v2), 8 for v1
 * @param region which region {@code dataOffset} points into
 * @param dataOffset absolute offset of the sprite payload
 * @param dataLength payload length in bytes
 * @param paletteIndex v2 palette table index, -1 for v1
 * @param linkedIndex raw linked-index field
 * @param linked true when the record reuses another sprite's pixels
 * @param samePalette v1 "shares the first sprite's palette" flag
 */
public record SpriteRecord(
        int index,
        int group,
        int image,
        int width,
        int height,
        int formatCode,
        int colorDepth,
        DataRegion region,
        long dataOffset,
        long dataLength,
        int paletteIndex,
        int linkedIndex,
        boolean linked,
        boolean samePalette) {

    /** Group number of select-screen portraits and stage previews. */
    public static final int PORTRAIT_GROUP = 9000;

    /**
     * True when the record carries pixel data of its own.
     */
    public boolean ownsData() {
        return !linked && dataLength > 0;
    }

    public boolean is(int group, int image) {
        return this.group == group && this.image == image;
    }

    public boolean hasPositiveArea() {
        return width > 0 && height > 0;
    }

    @Override
    public String toString() {
        return String.format("sprite #%d (%d,%d) %dx%d fmt=%d depth=%d %s@%d+%d%s",
                index, group, image, width, height, formatCode, colorDepth,
                region, dataOffset, dataLength, linked ? " linked" : "");
    }
}
