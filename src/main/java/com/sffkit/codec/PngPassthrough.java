/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.codec;

import com.sffkit.SffException;
import com.sffkit.image.DecodedPixelBuffer;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Sprites stored as embedded PNG images (v2 formats 10, 11 and 12).
 *
 * <p>The caller strips the 4-byte size prefix. Format 10 keeps only the PNG's
 * palette indices so they can be re-colored with the archive palette; 11 and 12
 * use the PNG's own colors.
 */
public final class PngPassthrough {

    private PngPassthrough() {}

    /**
     * Decode a PNG payload.
     *
     * @param png PNG bytes
     * @param width declared sprite width
     * @param height declared sprite height
     * @param format PNG8, PNG24 or PNG32
     * @return indices (PNG8) or RGBA (PNG24/PNG32)
     * @throws SffException.DecodingFailed if the payload is not a readable PNG,
     *         its size differs from the declared one, or a PNG8 payload is not indexed
     */
    public static DecodedPixelBuffer decode(byte[] png, int width, int height, SpriteFormat format)
            throws SffException.DecodingFailed {
        BufferedImage image = read(png, width, height);

        if (format == SpriteFormat.PNG8) {
            if (!(image.getColorModel() instanceof IndexColorModel)) {
                throw new SffException.DecodingFailed("format 10 sprite does not contain an indexed PNG");
            }
            Raster raster = image.getRaster();
            byte[] indices = new byte[Math.multiplyExact(width, height)];
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    indices[y * width + x] = (byte) raster.getSample(x, y, 0);
                }
            }
            return DecodedPixelBuffer.indexed(width, height, indices);
        }

        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] rgba = new byte[Math.multiplyExact(argb.length, 4)];
        for (int p = 0; p < argb.length; p++) {
            int pixel = argb[p];
            rgba[p * 4] = (byte) (pixel >> 16);
            rgba[p * 4 + 1] = (byte) (pixel >> 8);
            rgba[p * 4 + 2] = (byte) pixel;
            rgba[p * 4 + 3] = (byte) (pixel >>> 24);
        }
        return DecodedPixelBuffer.truecolor(width, height, rgba);
    }

    /** The IHDR size must match the declared size before pixel data is read. */
    private static BufferedImage read(byte[] png, int width, int height) throws SffException.DecodingFailed {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(png))) {
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new SffException.DecodingFailed("embedded image is not a readable PNG");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                int pngWidth = reader.getWidth(0);
                int pngHeight = reader.getHeight(0);
                if (pngWidth != width || pngHeight != height) {
                    throw new SffException.DecodingFailed(String.format(
                            "embedded PNG is %dx%d but sprite declares %dx%d",
                            pngWidth, pngHeight, width, height));
                }
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new SffException.DecodingFailed("embedded PNG is corrupt: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SffException.DecodingFailed("embedded PNG could not be decoded: " + e, e);
        }
    }
}
