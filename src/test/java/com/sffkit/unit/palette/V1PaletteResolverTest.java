/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.unit.palette;

import com.sffkit.SffException;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.format.FormatSniffer;
import com.sffkit.format.SpriteRecord;
import com.sffkit.palette.PaletteTable;
import com.sffkit.palette.V1PaletteResolver;
import com.sffkit.test.SffFixtures;
import com.sffkit.v1.V1SpriteTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Palette priority for v1 sprites: own trailer, then shared, then external, then black.
 */
class V1PaletteResolverTest {

    private static final PaletteTable RAMP = PaletteTable.fromRgb(SffFixtures.rampRgb(), 0);
    private static final PaletteTable RED = PaletteTable.fromRgb(SffFixtures.solidRgb(255, 0, 0), 0);
    private static final PaletteTable BLUE = PaletteTable.fromRgb(SffFixtures.solidRgb(0, 0, 255), 0);

    private static V1SpriteTable open(byte[] archive, PaletteTable external) throws SffException {
        return V1SpriteTable.open(FormatSniffer.sniff(archive), ExtractorConfig.defaults(), external);
    }

    @Test
    void embeddedPaletteNeedsMarkerAndLength() {
        byte[] withTrailer = SffFixtures.pcx(2, 2, SffFixtures.filled(2, 2, 1), SffFixtures.rampRgb(), false);
        assertEquals(RAMP, V1PaletteResolver.embedded(withTrailer, 0, withTrailer.length));

        byte[] noMarker = withTrailer.clone();
        noMarker[noMarker.length - 769] = 11;
        assertNull(V1PaletteResolver.embedded(noMarker, 0, noMarker.length));

        assertNull(V1PaletteResolver.embedded(new byte[769], 0, 769));
    }

    @Test
    @DisplayName("first sprite's embedded palette is shared and overrides the external palette")
    void firstSpritePaletteIsShared() throws SffException {
        byte[] archive = SffFixtures.v1()
                .sprite(0, 0, SffFixtures.pcx(2, 2, SffFixtures.filled(2, 2, 1), SffFixtures.solidRgb(255, 0, 0), false))
                .sprite(9000, 0, SffFixtures.pcx(2, 2, SffFixtures.filled(2, 2, 1), null, false), true)
                .build();
        V1SpriteTable table = open(archive, BLUE);

        assertEquals(RED, table.sharedPalette());
    }

    @Test
    void externalPaletteUsedWhenFirstSpriteHasNoTrailer() throws SffException {
        byte[] archive = SffFixtures.v1()
                .sprite(0, 0, SffFixtures.pcx(2, 2, SffFixtures.filled(2, 2, 1), null, false))
                .sprite(9000, 0, SffFixtures.pcx(2, 2, SffFixtures.filled(2, 2, 1), null, false), true)
                .build();
        V1SpriteTable table = open(archive, BLUE);
        SpriteRecord sameFlagged = table.sprites().get(1);

        V1PaletteResolver resolver = V1PaletteResolver.forArchive(archive, table.sprites(), BLUE);
        assertEquals(BLUE, resolver.resolve(archive, sameFlagged));
    }

    @Test
    void ownTrailerWinsOverSharedPalette() throws SffException {
        byte[] archive = SffFixtures.v1()
                .sprite(0, 0, SffFixtures.pcx(2, 2, SffFixtures.filled(2, 2, 1), SffFixtures.solidRgb(255, 0, 0), false))
                .sprite(9000, 0, SffFixtures.pcx(2, 2, SffFixtures.filled(2, 2, 1), SffFixtures.rampRgb(), false), true)
                .build();
        V1SpriteTable table = open(archive, null);

        V1PaletteResolver resolver = V1PaletteResolver.forArchive(archive, table.sprites(), null);
        assertEquals(RAMP, resolver.resolve(archive, table.sprites().get(1)));
    }

    @Test
    void spriteWithoutAnyPaletteComesOutBlack() throws SffException {
        byte[] archive = SffFixtures.v1()
                .sprite(0, 0, SffFixtures.pcx(2, 2, SffFixtures.filled(2, 2, 1), null, false))
                .build();
        V1SpriteTable table = open(archive, null);

        V1PaletteResolver resolver = V1PaletteResolver.forArchive(archive, table.sprites(), null);
        assertNull(resolver.sharedPalette());
        assertEquals(PaletteTable.empty(), resolver.resolve(archive, table.sprites().get(0)));
    }
}
