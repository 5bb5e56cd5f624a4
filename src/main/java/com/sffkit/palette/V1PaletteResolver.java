/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.palette;

import com.sffkit.format.SpriteRecord;
import com.sffkit.utils.LoggerUtil;

import java.util.List;

/**
 * Picks the palette for each v1 (PCX) sprite.
 *
 * <p>Priority for a given sprite:
 * <ol>
 *   <li>the sprite's own trailing palette block, if present</li>
 *   <li>for "same palette" sprites: the archive's shared palette (embedded in
 *       the first sprite that owns data), else the external palette</li>
 *   <li>an all-zero palette</li>
 * </ol>
 */
public final class V1PaletteResolver {

    /** Marker byte + 768 RGB bytes at the end of a PCX payload. */
    public static final int TRAILER_SIZE = 769;
    public static final int TRAILER_MARKER = 12;

    private final PaletteTable shared;

    private V1PaletteResolver(PaletteTable shared) {
        this.shared = shared;
    }

    /**
     * Build the resolver for an archive.
     *
     * @param data archive bytes
     * @param sprites records from the v1 walk
     * @param external caller-supplied palette, may be null
     */
    public static V1PaletteResolver forArchive(byte[] data, List<SpriteRecord> sprites, PaletteTable external) {
        PaletteTable shared = external;
        for (SpriteRecord record : sprites) {
            if (!record.ownsData()) {
                continue;
            }
            // Only the first sprite with data is consulted
            if (!record.samePalette()) {
                PaletteTable embedded = embedded(data, record.dataOffset(), record.dataLength());
                if (embedded != null) {
                    LoggerUtil.debug(() -> "[V1PaletteResolver] Shared palette from " + record);
                    shared = embedded;
                }
            }
            break;
        }
        return new V1PaletteResolver(shared);
    }

    /**
     * Read the trailing palette block of a PCX payload.
     *
     * @return the palette, or null when the payload is too short or the marker is missing
     */
    public static PaletteTable embedded(byte[] data, long payloadOffset, long payloadLength) {
        long end = Math.min(payloadOffset + payloadLength, data.length);
        long length = end - payloadOffset;
        if (payloadOffset < 0 || length <= TRAILER_SIZE) {
            return null;
        }
        int markerOffset = (int) (end - TRAILER_SIZE);
        if ((data[markerOffset] & 0xFF) != TRAILER_MARKER) {
            return null;
        }
        return PaletteTable.fromRgb(data, markerOffset + 1);
    }

    /**
     * Palette for one sprite.
     */
    public PaletteTable resolve(byte[] data, SpriteRecord record) {
        PaletteTable own = embedded(data, record.dataOffset(), record.dataLength());
        if (own != null) {
            return own;
        }
        if (record.samePalette() && shared != null) {
            return shared;
        }
        return PaletteTable.empty();
    }

    /**
     * The palette "same palette" sprites fall back to, or null if there is none.
     */
    public PaletteTable sharedPalette() {
        return shared;
    }
}
