/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.extract;

import com.sffkit.SffException;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.format.ArchiveHandle;
import com.sffkit.format.FormatSniffer;
import com.sffkit.format.SpriteTable;
import com.sffkit.palette.PaletteTable;
import com.sffkit.v1.V1SpriteTable;
import com.sffkit.v2.V2SpriteTable;

/**
 * Opens the right {@link SpriteTable} for an archive.
 */
public final class SpriteTables {

    private SpriteTables() {}

    /**
     * Sniff and open an archive.
     *
     * @param data complete archive bytes
     * @param externalPalette palette for v1 "same palette" sprites, may be null; unused for v2
     * @param config traversal limits
     */
    public static SpriteTable open(byte[] data, PaletteTable externalPalette, ExtractorConfig config)
            throws SffException {
        ArchiveHandle archive = FormatSniffer.sniff(data);
        return open(archive, externalPalette, config);
    }

    public static SpriteTable open(ArchiveHandle archive, PaletteTable externalPalette, ExtractorConfig config)
            throws SffException {
        return switch (archive.version()) {
            case V1 -> V1SpriteTable.open(archive, config, externalPalette);
            case V2 -> V2SpriteTable.open(archive, config);
        };
    }
}
