/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.inspect;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Header facts and sprite listing of an archive.
 *
 * @param source file name or caller label
 * @param version dotted version bytes, e.g. {@code 2.0.1.0}
 * @param format V1 or V2
 * @param byteSize archive size in bytes
 * @param spriteCount sprites actually read from the table
 * @param paletteCount palettes declared by a v2 header, null for v1
 * @param portraitGroupSprites sprites in group 9000
 * @param inspectedAt when the summary was produced
 * @param sprites one entry per sprite
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArchiveSummary(
        String source,
        String version,
        String format,
        int byteSize,
        int spriteCount,
        Long paletteCount,
        long portraitGroupSprites,
        Instant inspectedAt,
        List<SpriteSummary> sprites) {
}
