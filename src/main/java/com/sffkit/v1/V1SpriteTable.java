/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.v1;

import com.sffkit.SffException;
import com.sffkit.codec.SpriteFormat;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.format.ArchiveHandle;
import com.sffkit.format.DataRegion;
import com.sffkit.format.SffVersion;
import com.sffkit.format.SpriteRecord;
import com.sffkit.format.SpriteTable;
import com.sffkit.image.ImageSurface;
import com.sffkit.io.ByteReader;
import com.sffkit.palette.PaletteTable;
import com.sffkit.palette.V1PaletteResolver;
import com.sffkit.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Sprite table of a v1 archive: a forward linked list of sub-files.
 *
 * <p>Header fields: sprite count u32 at 20, first sub-file offset u32 at 24.
 * Sub-file header (32 bytes):
 * - Bytes 0-3: next sub-file offset
 * - Bytes 4-7: payload length
 * - Bytes 8-11: axis x, axis y
 * - Bytes 12-13: group
 * - Bytes 14-15: image
 * - Bytes 16-17: linked index
 * - Byte 18: same-palette flag
 * - Bytes 19-31: comment
 *
 * The walk stops at the record cap, at a header that does not fit the
 * buffer, or when the next offset is zero or does not move forward.
 */
public final class V1SpriteTable implements SpriteTable {

    public static final int COUNT_OFFSET = 20;
    public static final int FIRST_SUBFILE_OFFSET = 24;
    public static final int SUBFILE_HEADER_SIZE = 32;

    private final ArchiveHandle archive;
    private final ExtractorConfig config;
    private final List<SpriteRecord> sprites;
    private final V1PaletteResolver palettes;

    private V1SpriteTable(ArchiveHandle archive, ExtractorConfig config,
                          List<SpriteRecord> sprites, V1PaletteResolver palettes) {
        this.archive = archive;
        this.config = config;
        this.sprites = sprites;
        this.palettes = palettes;
    }

    /**
     * Walk the sub-file list of a v1 archive.
     *
     * @param archive sniffed v1 archive
     * @param config traversal limits
     * @param externalPalette caller-supplied palette, may be null
     * @throws SffException.CorruptedData if the header declares no sprites or
     *         points outside the buffer
     */
    public static V1SpriteTable open(ArchiveHandle archive, ExtractorConfig config,
                                     PaletteTable externalPalette) throws SffException {
        byte[] data = archive.data();
        long count = ByteReader.u32(data, COUNT_OFFSET);
        long firstOffset = ByteReader.u32(data, FIRST_SUBFILE_OFFSET);
        if (count == 0 || firstOffset >= data.length) {
            throw new SffException.CorruptedData(String.format(
                    "invalid sprite count (%d) or first sub-file offset (%d) for %d-byte archive",
                    count, firstOffset, data.length));
        }

        List<SpriteRecord> sprites = walk(data, count, firstOffset, config.v1MaxRecords());
        LoggerUtil.debug(() -> String.format(
                "[V1SpriteTable] Walked %d of %d declared sub-files", sprites.size(), count));
        V1PaletteResolver palettes = V1PaletteResolver.forArchive(data, sprites, externalPalette);
        return new V1SpriteTable(archive, config, Collections.unmodifiableList(sprites), palettes);
    }

    private static List<SpriteRecord> walk(byte[] data, long count, long firstOffset, int maxRecords) {
        List<SpriteRecord> sprites = new ArrayList<>();
        long limit = Math.min(count, maxRecords);
        long offset = firstOffset;

        for (int i = 0; i < limit; i++) {
            if (!ByteReader.fits(data, offset, SUBFILE_HEADER_SIZE)) {
                break;
            }
            int at = (int) offset;
            long nextOffset = ByteReader.u32(data, at);
            long length = ByteReader.u32(data, at + 4);
            int group = ByteReader.u16(data, at + 12);
            int image = ByteReader.u16(data, at + 14);
            int linkedIndex = ByteReader.u16(data, at + 16);
            boolean samePalette = ByteReader.u8(data, at + 18) != 0;

            long payloadOffset = offset + SUBFILE_HEADER_SIZE;
            int[] size = PcxDecoder.peekDimensions(data, payloadOffset, length);

            sprites.add(new SpriteRecord(i, group, image, size[0], size[1],
                    SpriteFormat.PCX.code(), 8, DataRegion.SUBFILE,
                    payloadOffset, length, -1, linkedIndex, linkedIndex != 0, samePalette));

            if (nextOffset == 0 || nextOffset <= offset) {
                break;
            }
            offset = nextOffset;
        }
        return sprites;
    }

    @Override
    public SffVersion version() {
        return SffVersion.V1;
    }

    @Override
    public List<SpriteRecord> sprites() {
        return sprites;
    }

    /**
     * The palette that "same palette" sprites fall back to, or null.
     */
    public PaletteTable sharedPalette() {
        return palettes.sharedPalette();
    }

    /**
     * Decode a sub-file's PCX payload. A payload cut short by the end of the
     * archive is decoded as far as it goes.
     */
    @Override
    public ImageSurface decode(SpriteRecord record) throws SffException {
        if (record.region() != DataRegion.SUBFILE) {
            throw new SffException.CorruptedData(record + " is not a v1 sub-file");
        }
        byte[] data = archive.data();
        long start = record.dataOffset();
        long end = Math.min(start + record.dataLength(), data.length);
        if (record.dataLength() <= 0 || end <= start) {
            throw new SffException.CorruptedData(record + " has no payload inside the archive");
        }

        byte[] pcx = Arrays.copyOfRange(data, (int) start, (int) end);
        PaletteTable palette = palettes.resolve(data, record);
        return PcxDecoder.decode(pcx, palette, config.maxDimension());
    }
}
