/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.unit.palette;

import com.sffkit.palette.PaletteTable;
import com.sffkit.palette.V2PaletteResolver;
import com.sffkit.test.SffFixtures;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class V2PaletteResolverTest {

    private static final int PALETTE_LIST = 0;

    /** Palette list of {@code nodes} nodes followed by l-data holding {@code colors} gray entries. */
    private static byte[] table(int nodes, int colors) {
        return new byte[nodes * V2PaletteResolver.NODE_SIZE + colors * 4];
    }

    private static void node(byte[] data, int index, int count, int linked, int offset, int length) {
        int at = PALETTE_LIST + index * V2PaletteResolver.NODE_SIZE;
        SffFixtures.putU16(data, at + 4, count);
        SffFixtures.putU16(data, at + 6, linked);
        SffFixtures.putU32(data, at + 8, offset);
        SffFixtures.putU32(data, at + 12, length);
    }

    @Test
    void shouldReadColorsFromLdata() {
        byte[] data = table(1, 4);
        int ldata = V2PaletteResolver.NODE_SIZE;
        System.arraycopy(SffFixtures.grayRgba(4), 0, data, ldata, 16);
        node(data, 0, 4, 0, 0, 16);

        Optional<PaletteTable> palette = new V2PaletteResolver(data, PALETTE_LIST, ldata, 4).resolve(0);
        assertTrue(palette.isPresent());
        assertEquals(4, palette.get().colorCount());
        assertEquals(3, palette.get().red(3));
    }

    @Test
    void shouldFollowLinks() {
        byte[] data = table(3, 2);
        int ldata = 3 * V2PaletteResolver.NODE_SIZE;
        System.arraycopy(SffFixtures.grayRgba(2), 0, data, ldata, 8);
        node(data, 0, 2, 0, 0, 8);
        node(data, 1, 0, 2, 0, 0);
        node(data, 2, 2, 0, 0, 8);

        Optional<PaletteTable> palette = new V2PaletteResolver(data, PALETTE_LIST, ldata, 4).resolve(1);
        assertEquals(2, palette.orElseThrow().colorCount());
    }

    @Test
    void linkCycleStopsAtDepthCap() {
        byte[] data = table(3, 0);
        node(data, 1, 0, 2, 0, 0);
        node(data, 2, 0, 1, 0, 0);

        assertTrue(new V2PaletteResolver(data, PALETTE_LIST, data.length, 4).resolve(1).isEmpty());
    }

    @Test
    void nodeOutsideArchiveIsAbsent() {
        byte[] data = table(1, 0);
        assertTrue(new V2PaletteResolver(data, PALETTE_LIST, data.length, 4).resolve(5).isEmpty());
    }

    @Test
    void colorsOutsideArchiveAreAbsent() {
        byte[] data = table(1, 2);
        node(data, 0, 200, 0, 0, 800);
        assertTrue(new V2PaletteResolver(data, PALETTE_LIST, V2PaletteResolver.NODE_SIZE, 4).resolve(0).isEmpty());
    }
}
