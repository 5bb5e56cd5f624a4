/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.palette;

import com.sffkit.io.ByteReader;
import com.sffkit.utils.LoggerUtil;

import java.util.Optional;

/**
 * Resolves v2 palette-table entries to color tables.
 *
 * <p>Palette node layout (16 bytes): group u16, item u16, color count u16,
 * linked index u16, data offset u32 (relative to l-data), data length u32.
 * A node with no data of its own and a non-zero link borrows the linked
 * node's colors.
 */
public final class V2PaletteResolver {

    public static final int NODE_SIZE = 16;

    private final byte[] data;
    private final long paletteListOffset;
    private final long ldataOffset;
    private final int maxLinkDepth;

    public V2PaletteResolver(byte[] data, long paletteListOffset, long ldataOffset, int maxLinkDepth) {
        this.data = data;
        this.paletteListOffset = paletteListOffset;
        this.ldataOffset = ldataOffset;
        this.maxLinkDepth = maxLinkDepth;
    }

    /**
     * Resolve the palette at {@code index}, following links.
     *
     * @return the palette, or empty when any node or color range falls outside
     *         the buffer or the link chain is deeper than allowed
     */
    public Optional<PaletteTable> resolve(int index) {
        int current = index;
        for (int depth = 0; depth <= maxLinkDepth; depth++) {
            long nodeOffset = paletteListOffset + (long) current * NODE_SIZE;
            if (!ByteReader.fits(data, nodeOffset, NODE_SIZE)) {
                LoggerUtil.debug(String.format(
                        "[V2PaletteResolver] Palette node %d at %d is outside the archive", current, nodeOffset));
                return Optional.empty();
            }
            int node = (int) nodeOffset;
            int colorCount = ByteReader.u16(data, node + 4);
            int linkedIndex = ByteReader.u16(data, node + 6);
            long colorOffset = ByteReader.u32(data, node + 8);
            long colorLength = ByteReader.u32(data, node + 12);

            if (colorLength == 0 && linkedIndex != 0) {
                current = linkedIndex;
                continue;
            }

            long start = ldataOffset + colorOffset;
            if (!ByteReader.fits(data, start, (long) colorCount * 4)) {
                LoggerUtil.debug(String.format(
                        "[V2PaletteResolver] Palette %d colors (%d at %d) exceed the archive",
                        current, colorCount, start));
                return Optional.empty();
            }
            return Optional.of(PaletteTable.fromRgba(data, (int) start, colorCount));
        }
        LoggerUtil.debug(String.format(
                "[V2PaletteResolver] Palette %d link chain longer than %d", index, maxLinkDepth));
        return Optional.empty();
    }
}
