/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.extract;

import com.sffkit.format.SpriteRecord;
import com.sffkit.format.SpriteTable;

import java.util.List;
import java.util.stream.Collectors;

import static com.sffkit.format.SpriteRecord.PORTRAIT_GROUP;

/**
 * Chooses the preview image of a stage archive.
 */
public class StagePreviewPolicy {

    public CandidateChain plan(SpriteTable table) {
        return switch (table.version()) {
            case V1 -> planV1(table);
            case V2 -> planV2(table);
        };
    }

    /**
     * v1: any group-9000 sprite with data of its own, then the sprite with the largest
     * payload (usually the full background), then (0,0) even though it is
     * sometimes a transparent overlay.
     */
    private CandidateChain planV1(SpriteTable table) {
        List<SpriteRecord> sprites = table.sprites();

        SpriteRecord largest = null;
        for (SpriteRecord record : sprites) {
            if (record.ownsData() && (largest == null || record.dataLength() > largest.dataLength())) {
                largest = record;
            }
        }

        return CandidateChain.builder(PORTRAIT_GROUP, 0)
                .tier("preview group", sprites.stream()
                        .filter(r -> r.group() == PORTRAIT_GROUP && r.ownsData())
                        .collect(Collectors.toList()))
                .tier("largest sprite", largest == null ? List.of() : List.of(largest))
                .tier("background (0,0)", sprites.stream()
                        .filter(r -> r.is(0, 0) && r.ownsData())
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * v2: any group-9000 sprite with a positive size, then (0,0).
     */
    private CandidateChain planV2(SpriteTable table) {
        List<SpriteRecord> sprites = table.sprites();
        return CandidateChain.builder(PORTRAIT_GROUP, 0)
                .tier("preview group", sprites.stream()
                        .filter(r -> r.group() == PORTRAIT_GROUP && r.hasPositiveArea() && !r.linked())
                        .collect(Collectors.toList()))
                .tier("background (0,0)", sprites.stream()
                        .filter(r -> r.is(0, 0) && r.hasPositiveArea() && !r.linked())
                        .collect(Collectors.toList()))
                .build();
    }
}
