/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.unit.v2;

import com.sffkit.SffException;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.format.DataRegion;
import com.sffkit.format.FormatSniffer;
import com.sffkit.format.SpriteRecord;
import com.sffkit.io.ByteReader;
import com.sffkit.test.SffFixtures;
import com.sffkit.v2.V2SpriteTable;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class V2SpriteTableTest {

    private static V2SpriteTable open(byte[] archive, ExtractorConfig config) throws SffException {
        return V2SpriteTable.open(FormatSniffer.sniff(archive), config);
    }

    @Test
    void shouldReadSpriteRecords() throws SffException {
        byte[] archive = SffFixtures.v2()
                .palette(SffFixtures.grayRgba(4))
                .sprite(9000, 1, 120, 110, 2, 8, new byte[]{1, 2, 3, 4, 5}, 0)
                .sprite(0, 0, 64, 32, 0, 32, new byte[8], 0, true)
                .build();
        V2SpriteTable table = open(archive, ExtractorConfig.defaults());

        assertEquals(2, table.sprites().size());
        assertEquals(1, table.paletteCount());

        SpriteRecord portrait = table.sprites().get(0);
        assertTrue(portrait.is(9000, 1));
        assertEquals(120, portrait.width());
        assertEquals(110, portrait.height());
        assertEquals(2, portrait.formatCode());
        assertEquals(8, portrait.colorDepth());
        assertEquals(5, portrait.dataLength());
        assertEquals(DataRegion.LDATA, portrait.region());
        assertFalse(portrait.linked());

        SpriteRecord background = table.sprites().get(1);
        assertEquals(DataRegion.TDATA, background.region());
        assertEquals(32, background.colorDepth());
    }

    @Test
    void flagBitSelectsTdataBase() throws SffException {
        byte[] archive = SffFixtures.v2()
                .sprite(0, 0, 1, 1, 0, 32, new byte[]{9, 9, 9, 9}, 0, true)
                .build();
        long tdata = ByteReader.u32(archive, V2SpriteTable.TDATA_OFFSET);

        SpriteRecord record = open(archive, ExtractorConfig.defaults()).sprites().get(0);
        assertEquals(tdata, record.dataOffset());
    }

    @Test
    void linkIndexOfAllOnesIsNotALink() throws SffException {
        byte[] archive = SffFixtures.v2()
                .sprite(0, 0, 1, 1, 0, 32, new byte[4], 0)
                .linked(9000, 0, 4, 4, 0)
                .linked(9000, 1, 4, 4, 0xFFFF)
                .build();
        V2SpriteTable table = open(archive, ExtractorConfig.defaults());

        // link 0 and 0xFFFF both mean the record owns its data
        assertFalse(table.sprites().get(1).linked());
        assertFalse(table.sprites().get(2).linked());
    }

    @Test
    void linkedRecordIsMarked() throws SffException {
        byte[] archive = SffFixtures.v2()
                .sprite(0, 0, 1, 1, 0, 32, new byte[4], 0)
                .linked(9000, 0, 4, 4, 3)
                .build();
        SpriteRecord record = open(archive, ExtractorConfig.defaults()).sprites().get(1);
        assertTrue(record.linked());
        assertFalse(record.ownsData());
    }

    @Test
    void scanStopsAtRecordCap() throws SffException {
        SffFixtures.V2Builder builder = SffFixtures.v2();
        for (int i = 0; i < 5; i++) {
            builder.sprite(0, i, 1, 1, 0, 32, new byte[4], 0);
        }
        Properties props = new Properties();
        props.setProperty("sff.v2.max.records", "3");

        assertEquals(3, open(builder.build(), ExtractorConfig.fromProperties(props)).sprites().size());
    }

    @Test
    void scanStopsAtEndOfBuffer() throws SffException {
        byte[] archive = SffFixtures.v2()
                .sprite(0, 0, 1, 1, 0, 32, new byte[4], 0)
                .build();
        SffFixtures.putU32(archive, V2SpriteTable.SPRITE_COUNT_OFFSET, 1000);

        assertEquals(1, open(archive, ExtractorConfig.defaults()).sprites().size());
    }

    @Test
    void emptyTableIsCorrupted() {
        byte[] archive = SffFixtures.v2().sprite(0, 0, 1, 1, 0, 32, new byte[4], 0).build();
        SffFixtures.putU32(archive, V2SpriteTable.SPRITE_COUNT_OFFSET, 0);
        assertThrows(SffException.CorruptedData.class, () -> open(archive, ExtractorConfig.defaults()));
    }

    @Test
    void spriteListOutsideBufferIsCorrupted() {
        byte[] archive = SffFixtures.v2().sprite(0, 0, 1, 1, 0, 32, new byte[4], 0).build();
        SffFixtures.putU32(archive, V2SpriteTable.SPRITE_LIST_OFFSET, archive.length + 10);
        assertThrows(SffException.CorruptedData.class, () -> open(archive, ExtractorConfig.defaults()));
    }
}
