/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.image;

import com.sffkit.SffException;
import com.sffkit.palette.PaletteTable;

/**
 * Turns codec output into an {@link ImageSurface}.
 *
 * <p>Palette index 0 is the format's transparency key and always comes out
 * with alpha 0, whatever the palette stores for it.
 */
public final class PixelCompositor {

    /**
     * Alpha source for non-zero indices.
     */
    public enum AlphaMode {
        /** Every non-zero index is fully opaque. */
        OPAQUE,
        /** Non-zero indices take the palette's stored alpha (re-indexed PNG sprites). */
        PALETTE
    }

    private PixelCompositor() {}

    /**
     * Composite a decoded buffer.
     *
     * @param pixels codec output
     * @param width declared sprite width
     * @param height declared sprite height
     * @param palette palette for indexed buffers; ignored for truecolor
     * @param alphaMode alpha rule for indexed buffers
     * @throws SffException.DecodingFailed if the buffer's size differs from the declared size
     */
    public static ImageSurface composite(DecodedPixelBuffer pixels, int width, int height,
                                         PaletteTable palette, AlphaMode alphaMode)
            throws SffException.DecodingFailed {
        if (pixels.width() != width || pixels.height() != height) {
            throw new SffException.DecodingFailed(String.format(
                    "decoded %dx%d but sprite declares %dx%d",
                    pixels.width(), pixels.height(), width, height));
        }

        byte[] source = pixels.data();
        if (!pixels.isIndexed()) {
            return new ImageSurface(width, height, source.clone());
        }
        if (palette == null) {
            throw new SffException.DecodingFailed("indexed sprite without a palette");
        }

        byte[] rgba = new byte[Math.multiplyExact(Math.multiplyExact(width, height), 4)];
        for (int p = 0; p < source.length; p++) {
            int index = source[p] & 0xFF;
            int o = p * 4;
            rgba[o] = (byte) palette.red(index);
            rgba[o + 1] = (byte) palette.green(index);
            rgba[o + 2] = (byte) palette.blue(index);
            if (index == 0) {
                rgba[o + 3] = 0;
            } else {
                rgba[o + 3] = (byte) (alphaMode == AlphaMode.PALETTE ? palette.alpha(index) : 0xFF);
            }
        }
        return new ImageSurface(width, height, rgba);
    }
}
