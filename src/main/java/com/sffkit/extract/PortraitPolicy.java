/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.extract;

import com.sffkit.config.ExtractorConfig;
import com.sffkit.format.SpriteRecord;
import com.sffkit.format.SpriteTable;
import com.sffkit.image.ImageSurface;

import java.util.ArrayList;
import java.util.List;

import static com.sffkit.format.SpriteRecord.PORTRAIT_GROUP;

/**
 * Chooses the select-screen portrait of a character archive.
 *
 * <p>By convention (9000,0) is the small select icon, (9000,1) the large
 * portrait and (9000,2) an alternate portrait.
 */
public class PortraitPolicy {

    private final ExtractorConfig config;

    public PortraitPolicy(ExtractorConfig config) {
        this.config = config;
    }

    public CandidateChain plan(SpriteTable table) {
        return switch (table.version()) {
            case V1 -> planV1(table);
            case V2 -> planV2(table);
        };
    }

    /**
     * v1: (9000,1) then (9000,2) if either lands in the usual portrait size
     * band, otherwise the first of 1, 2, 0 that decodes at any size.
     */
    private CandidateChain planV1(SpriteTable table) {
        List<SpriteRecord> large = new ArrayList<>();
        firstOf(table, 1, large);
        firstOf(table, 2, large);

        List<SpriteRecord> all = new ArrayList<>(large);
        firstOf(table, 0, all);

        return CandidateChain.builder(PORTRAIT_GROUP, 0)
                .tier("portrait size band", large, this::withinPortraitBand)
                .tier("any decodable portrait", all)
                .build();
    }

    /**
     * v2: first group-9000 sprite at least {@code v2PortraitMinSize} square,
     * then the first smaller group-9000 sprite, then a (0,0) standing sprite.
     */
    private CandidateChain planV2(SpriteTable table) {
        int min = config.v2PortraitMinSize();
        int standInMin = config.v2StandInMinSize();
        SpriteRecord preferred = null;
        SpriteRecord small = null;
        SpriteRecord standIn = null;

        for (SpriteRecord record : table.sprites()) {
            if (record.linked()) {
                continue;
            }
            if (record.group() == PORTRAIT_GROUP) {
                if (record.width() >= min && record.height() >= min) {
                    if (preferred == null) {
                        preferred = record;
                    }
                } else if (small == null) {
                    small = record;
                }
            } else if (standIn == null && record.is(0, 0)
                    && record.width() > standInMin && record.height() > standInMin) {
                standIn = record;
            }
        }

        return CandidateChain.builder(PORTRAIT_GROUP, 0)
                .tier("portrait", optional(preferred))
                .tier("small portrait", optional(small))
                .tier("standing sprite", optional(standIn))
                .build();
    }

    boolean withinPortraitBand(ImageSurface image) {
        int min = config.portraitMinSize();
        int max = config.portraitMaxSize();
        return image.width() >= min && image.width() <= max
                && image.height() >= min && image.height() <= max;
    }

    private static void firstOf(SpriteTable table, int image, List<SpriteRecord> into) {
        List<SpriteRecord> found = table.locate(PORTRAIT_GROUP, image);
        if (!found.isEmpty()) {
            into.add(found.get(0));
        }
    }

    private static List<SpriteRecord> optional(SpriteRecord record) {
        return record == null ? List.of() : List.of(record);
    }
}
