/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.inspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sffkit.SffException;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.extract.SpriteTables;
import com.sffkit.format.ArchiveHandle;
import com.sffkit.format.FormatSniffer;
import com.sffkit.format.SpriteRecord;
import com.sffkit.format.SpriteTable;
import com.sffkit.utils.JacksonConfig;
import com.sffkit.utils.LoggerUtil;
import com.sffkit.v2.V2SpriteTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Lists the sprites of an archive without decoding any pixels.
 */
public class SffInspector {

    private final ExtractorConfig config;
    private final Clock clock;

    public SffInspector(ExtractorConfig config) {
        this(config, Clock.systemUTC());
    }

    public SffInspector(ExtractorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public ArchiveSummary inspect(Path sffFile) throws SffException {
        byte[] data;
        try {
            data = Files.readAllBytes(sffFile);
        } catch (IOException e) {
            throw new SffException.FileNotFound(sffFile, e);
        }
        return inspect(data, sffFile.getFileName().toString());
    }

    /**
     * @param data complete archive bytes
     * @param source label recorded in the summary
     */
    public ArchiveSummary inspect(byte[] data, String source) throws SffException {
        ArchiveHandle archive = FormatSniffer.sniff(data);
        SpriteTable table = SpriteTables.open(archive, null, config);
        List<SpriteSummary> sprites = table.sprites().stream().map(SpriteSummary::of).toList();
        long portraitGroup = table.sprites().stream()
                .filter(r -> r.group() == SpriteRecord.PORTRAIT_GROUP)
                .count();
        Long paletteCount = table instanceof V2SpriteTable v2 ? v2.paletteCount() : null;

        LoggerUtil.debug(() -> String.format("[SffInspector] %s: SFF %s, %d sprites",
                source, archive.versionString(), sprites.size()));
        return new ArchiveSummary(source, archive.versionString(), archive.version().name(),
                archive.length(), sprites.size(), paletteCount, portraitGroup,
                Instant.now(clock), sprites);
    }

    /**
     * Indented JSON form of a summary.
     */
    public static String toJson(ArchiveSummary summary) throws JsonProcessingException {
        return JacksonConfig.prettyMapper().writeValueAsString(summary);
    }
}
