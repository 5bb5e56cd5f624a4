/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.v2;

import com.sffkit.SffException;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.format.ArchiveHandle;
import com.sffkit.format.DataRegion;
import com.sffkit.format.SffVersion;
import com.sffkit.format.SpriteRecord;
import com.sffkit.format.SpriteTable;
import com.sffkit.image.ImageSurface;
import com.sffkit.io.ByteReader;
import com.sffkit.palette.V2PaletteResolver;
import com.sffkit.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sprite table of a v2 archive.
 *
 * <p>Header fields (u32, little-endian): sprite list offset at 36, sprite
 * count at 40, palette list offset at 44, palette count at 48, l-data offset
 * at 52, l-data length at 56, t-data offset at 60, t-data length at 64.
 *
 * <p>Sprite record (28 bytes):
 * - Bytes 0-3: group, image
 * - Bytes 4-7: width, height
 * - Bytes 8-11: axis x, axis y
 * - Bytes 12-13: linked index (0 or 0xFFFF when the sprite owns its data)
 * - Byte 14: format code
 * - Byte 15: color depth
 * - Bytes 16-23: data offset, data length
 * - Bytes 24-25: palette index
 * - Bytes 26-27: flags, bit 0 selects t-data over l-data
 */
public final class V2SpriteTable implements SpriteTable {

    public static final int SPRITE_LIST_OFFSET = 36;
    public static final int SPRITE_COUNT_OFFSET = 40;
    public static final int PALETTE_LIST_OFFSET = 44;
    public static final int PALETTE_COUNT_OFFSET = 48;
    public static final int LDATA_OFFSET = 52;
    public static final int TDATA_OFFSET = 60;
    public static final int RECORD_SIZE = 28;

    private static final int NO_LINK = 0xFFFF;
    private static final int FLAG_TDATA = 0x1;

    private final List<SpriteRecord> sprites;
    private final long paletteCount;
    private final V2SpriteDecoder decoder;

    private V2SpriteTable(List<SpriteRecord> sprites, long paletteCount, V2SpriteDecoder decoder) {
        this.sprites = sprites;
        this.paletteCount = paletteCount;
        this.decoder = decoder;
    }

    /**
     * Scan the sprite table of a v2 archive.
     *
     * @throws SffException.CorruptedData if the header declares no sprites or
     *         the sprite list starts outside the buffer
     */
    public static V2SpriteTable open(ArchiveHandle archive, ExtractorConfig config) throws SffException {
        byte[] data = archive.data();
        long listOffset = ByteReader.u32(data, SPRITE_LIST_OFFSET);
        long count = ByteReader.u32(data, SPRITE_COUNT_OFFSET);
        long paletteListOffset = ByteReader.u32(data, PALETTE_LIST_OFFSET);
        long paletteCount = ByteReader.u32(data, PALETTE_COUNT_OFFSET);
        long ldataOffset = ByteReader.u32(data, LDATA_OFFSET);
        long tdataOffset = ByteReader.u32(data, TDATA_OFFSET);

        if (count == 0 || listOffset >= data.length) {
            throw new SffException.CorruptedData(String.format(
                    "invalid sprite count (%d) or sprite list offset (%d) for %d-byte archive",
                    count, listOffset, data.length));
        }

        List<SpriteRecord> sprites = new ArrayList<>();
        long limit = Math.min(count, config.v2MaxRecords());
        for (int i = 0; i < limit; i++) {
            long offset = listOffset + (long) i * RECORD_SIZE;
            if (!ByteReader.fits(data, offset, RECORD_SIZE)) {
                break;
            }
            sprites.add(readRecord(data, (int) offset, i, ldataOffset, tdataOffset));
        }
        LoggerUtil.debug(() -> String.format(
                "[V2SpriteTable] Scanned %d of %d declared sprites", sprites.size(), count));

        V2PaletteResolver palettes = new V2PaletteResolver(
                data, paletteListOffset, ldataOffset, config.paletteMaxLinkDepth());
        return new V2SpriteTable(Collections.unmodifiableList(sprites), paletteCount,
                new V2SpriteDecoder(data, palettes, config.maxDimension()));
    }

    private static SpriteRecord readRecord(byte[] data, int at, int index, long ldataOffset, long tdataOffset) {
        int linkedIndex = ByteReader.u16(data, at + 12);
        int flags = ByteReader.u16(data, at + 26);
        // The flag bit, not the format code, picks the region
        boolean inTdata = (flags & FLAG_TDATA) != 0;
        long base = inTdata ? tdataOffset : ldataOffset;

        return new SpriteRecord(
                index,
                ByteReader.u16(data, at),
                ByteReader.u16(data, at + 2),
                ByteReader.u16(data, at + 4),
                ByteReader.u16(data, at + 6),
                ByteReader.u8(data, at + 14),
                ByteReader.u8(data, at + 15),
                inTdata ? DataRegion.TDATA : DataRegion.LDATA,
                base + ByteReader.u32(data, at + 16),
                ByteReader.u32(data, at + 20),
                ByteReader.u16(data, at + 24),
                linkedIndex,
                linkedIndex != 0 && linkedIndex != NO_LINK,
                false);
    }

    @Override
    public SffVersion version() {
        return SffVersion.V2;
    }

    @Override
    public List<SpriteRecord> sprites() {
        return sprites;
    }

    /** Palette count declared by the header. */
    public long paletteCount() {
        return paletteCount;
    }

    @Override
    public ImageSurface decode(SpriteRecord record) throws SffException {
        return decoder.decode(record);
    }
}
