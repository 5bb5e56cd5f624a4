/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.v2;

import com.sffkit.SffException;
import com.sffkit.codec.Lz5Codec;
import com.sffkit.codec.PngPassthrough;
import com.sffkit.codec.RawCodec;
import com.sffkit.codec.Rle5Codec;
import com.sffkit.codec.Rle8Codec;
import com.sffkit.codec.SpriteFormat;
import com.sffkit.format.DataRegion;
import com.sffkit.format.SpriteRecord;
import com.sffkit.image.DecodedPixelBuffer;
import com.sffkit.image.ImageSurface;
import com.sffkit.image.PixelCompositor;
import com.sffkit.io.ByteReader;
import com.sffkit.palette.PaletteTable;
import com.sffkit.palette.V2PaletteResolver;

import java.util.Arrays;

/**
 * Decodes individual v2 sprite records: bounds and size checks, palette
 * lookup, codec dispatch and compositing.
 */
public final class V2SpriteDecoder {

    private static final int SIZE_PREFIX = 4;

    private final byte[] data;
    private final V2PaletteResolver palettes;
    private final int maxDimension;

    public V2SpriteDecoder(byte[] data, V2PaletteResolver palettes, int maxDimension) {
        this.data = data;
        this.palettes = palettes;
        this.maxDimension = maxDimension;
    }

    public ImageSurface decode(SpriteRecord record) throws SffException {
        if (record.region() == DataRegion.SUBFILE) {
            throw new SffException.CorruptedData(record + " is not a v2 sprite");
        }
        if (record.linked()) {
            throw new SffException.DecodingFailed(record + " is linked and has no pixel data of its own");
        }

        int width = record.width();
        int height = record.height();
        if (width <= 0 || height <= 0 || width > maxDimension || height > maxDimension) {
            throw new SffException.InvalidDimensions(width, height);
        }
        DecodedPixelBuffer.byteCount(width, height, DecodedPixelBuffer.TRUECOLOR);

        SpriteFormat format = SpriteFormat.fromCode(record.formatCode());
        if (format == null) {
            throw new SffException.DecodingFailed("unknown sprite format " + record.formatCode());
        }

        if (!ByteReader.fits(data, record.dataOffset(), record.dataLength())) {
            throw new SffException.CorruptedData(String.format(
                    "%s data range %d+%d exceeds %d-byte archive",
                    record, record.dataOffset(), record.dataLength(), data.length));
        }
        byte[] payload = payload(record, format);

        boolean indexed = record.colorDepth() == 8 && format != SpriteFormat.PNG24 && format != SpriteFormat.PNG32;
        PaletteTable palette = null;
        if (indexed) {
            palette = palettes.resolve(record.paletteIndex())
                    .orElseThrow(() -> new SffException.CorruptedData(
                            "palette " + record.paletteIndex() + " unavailable for " + record));
        }

        DecodedPixelBuffer pixels = decodePixels(payload, width, height, format, record.colorDepth());
        PixelCompositor.AlphaMode alphaMode = format == SpriteFormat.PNG8
                ? PixelCompositor.AlphaMode.PALETTE
                : PixelCompositor.AlphaMode.OPAQUE;
        return PixelCompositor.composite(pixels, width, height, palette, alphaMode);
    }

    private byte[] payload(SpriteRecord record, SpriteFormat format) throws SffException {
        int start = (int) record.dataOffset();
        int end = (int) (record.dataOffset() + record.dataLength());
        if (format.isSizePrefixed()) {
            if (record.dataLength() < SIZE_PREFIX) {
                throw new SffException.DecodingFailed(String.format(
                        "%s payload of %d bytes is shorter than its size prefix", format, record.dataLength()));
            }
            start += SIZE_PREFIX;
        }
        return Arrays.copyOfRange(data, start, end);
    }

    private static DecodedPixelBuffer decodePixels(byte[] payload, int width, int height,
                                                   SpriteFormat format, int colorDepth) throws SffException {
        switch (format) {
            case RAW:
                if (colorDepth == 8) {
                    return DecodedPixelBuffer.indexed(width, height, RawCodec.decodeIndexed(payload, width, height));
                }
                if (colorDepth == 32) {
                    return DecodedPixelBuffer.truecolor(width, height, RawCodec.decodeTruecolor(payload, width, height));
                }
                throw new SffException.DecodingFailed("unsupported color depth for raw sprite: " + colorDepth);
            case RLE8:
                return indexedOnly(colorDepth, format, width, height, Rle8Codec.decode(payload, width, height));
            case RLE5:
                return indexedOnly(colorDepth, format, width, height, Rle5Codec.decode(payload, width, height));
            case LZ5:
                return indexedOnly(colorDepth, format, width, height, Lz5Codec.decode(payload, width, height));
            case PNG8:
            case PNG24:
            case PNG32:
                return PngPassthrough.decode(payload, width, height, format);
            default:
                throw new SffException.DecodingFailed("format " + format + " is not a v2 sprite format");
        }
    }

    private static DecodedPixelBuffer indexedOnly(int colorDepth, SpriteFormat format, int width, int height,
                                                  byte[] indices) throws SffException.DecodingFailed {
        if (colorDepth != 8) {
            throw new SffException.DecodingFailed(String.format(
                    "%s produces palette indices but sprite declares %d-bit color", format, colorDepth));
        }
        return DecodedPixelBuffer.indexed(width, height, indices);
    }
}
