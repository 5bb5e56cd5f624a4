/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.image;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Decoded sprite: row-major RGBA bytes with straight (non-premultiplied) alpha.
 */
public final class ImageSurface {

    private final int width;
    private final int height;
    private final byte[] rgba;

    ImageSurface(int width, int height, byte[] rgba) {
        this.width = width;
        this.height = height;
        this.rgba = rgba;
    }

    /**
     * Wrap an RGBA array. The array is copied.
     *
     * @throws IllegalArgumentException if the length is not {@code width * height * 4}
     */
    public static ImageSurface of(int width, int height, byte[] rgba) {
        if (width <= 0 || height <= 0 || rgba.length != (long) width * height * 4) {
            throw new IllegalArgumentException(String.format(
                    "RGBA length %d does not match %dx%d", rgba.length, width, height));
        }
        return new ImageSurface(width, height, rgba.clone());
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Copy of the RGBA bytes. */
    public byte[] toByteArray() {
        return rgba.clone();
    }

    /** Size of the pixel data in bytes. */
    public int byteSize() {
        return rgba.length;
    }

    /**
     * Pixel at {@code (x, y)} packed as {@code 0xRRGGBBAA}.
     */
    public int rgbaAt(int x, int y) {
        int i = (y * width + x) * 4;
        return ((rgba[i] & 0xFF) << 24)
                | ((rgba[i + 1] & 0xFF) << 16)
                | ((rgba[i + 2] & 0xFF) << 8)
                | (rgba[i + 3] & 0xFF);
    }

    public int alphaAt(int x, int y) {
        return rgba[(y * width + x) * 4 + 3] & 0xFF;
    }

    /**
     * Convert to an ARGB {@link BufferedImage}, e.g. for {@code ImageIO.write}.
     */
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] argb = new int[width * height];
        for (int p = 0; p < argb.length; p++) {
            int i = p * 4;
            argb[p] = ((rgba[i + 3] & 0xFF) << 24)
                    | ((rgba[i] & 0xFF) << 16)
                    | ((rgba[i + 1] & 0xFF) << 8)
                    | (rgba[i + 2] & 0xFF);
        }
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageSurface other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return "ImageSurface{" + width + "x" + height + "}";
    }
}
