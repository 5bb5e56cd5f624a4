/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.inspect;

import com.sffkit.codec.SpriteFormat;
import com.sffkit.format.SpriteRecord;

/**
 * One row of an {@link ArchiveSummary}.
 */
public record SpriteSummary(
        int index,
        int group,
        int image,
        int width,
        int height,
        String format,
        int colorDepth,
        long dataLength,
        boolean linked) {

    static SpriteSummary of(SpriteRecord record) {
        return new SpriteSummary(record.index(), record.group(), record.image(),
                record.width(), record.height(), formatName(record.formatCode()),
                record.colorDepth(), record.dataLength(), record.linked());
    }

    static String formatName(int code) {
        if (code == SpriteFormat.PCX.code()) {
            return SpriteFormat.PCX.name();
        }
        SpriteFormat format = SpriteFormat.fromCode(code);
        return format != null ? format.name() : "UNKNOWN(" + code + ")";
    }
}
