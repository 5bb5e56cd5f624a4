/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.extract;

import com.sffkit.SffException;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.format.ArchiveHandle;
import com.sffkit.format.FormatSniffer;
import com.sffkit.format.SpriteTable;
import com.sffkit.image.ImageSurface;
import com.sffkit.palette.ActPaletteLoader;
import com.sffkit.palette.PaletteTable;
import com.sffkit.utils.LoggerUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extracts character portraits and stage previews from SFF archives.
 *
 * <p>Every call works on its own buffer and keeps no state between calls, so
 * one instance can be shared across threads. Results are not cached; see
 * {@link com.sffkit.cache.ImageCache} for that.
 */
public class SffExtractor {

    private final ExtractorConfig config;
    private final PortraitPolicy portraitPolicy;
    private final StagePreviewPolicy stagePreviewPolicy;

    public SffExtractor() {
        this(ExtractorConfig.defaults());
    }

    public SffExtractor(ExtractorConfig config) {
        this(config, new PortraitPolicy(config), new StagePreviewPolicy());
    }

    SffExtractor(ExtractorConfig config, PortraitPolicy portraitPolicy, StagePreviewPolicy stagePreviewPolicy) {
        this.config = config;
        this.portraitPolicy = portraitPolicy;
        this.stagePreviewPolicy = stagePreviewPolicy;
    }

    /**
     * Extract the portrait of a character archive without an external palette.
     */
    public ImageSurface extractPortrait(byte[] archive) throws SffException {
        return extractPortrait(archive, null);
    }

    /**
     * Extract the portrait of a character archive.
     *
     * @param archive complete archive bytes
     * @param externalPalette optional .act contents (768+ bytes RGB), used only
     *        for v1 sprites that share a palette the archive does not embed
     * @return the portrait
     * @throws SffException if the archive is unreadable or no candidate decodes
     */
    public ImageSurface extractPortrait(byte[] archive, byte[] externalPalette) throws SffException {
        ArchiveHandle handle = FormatSniffer.sniff(archive);
        LoggerUtil.info(String.format("[SffExtractor] Extracting portrait from %d-byte SFF %s archive",
                handle.length(), handle.versionString()));

        PaletteTable external = ActPaletteLoader.parse(externalPalette).orElse(null);
        SpriteTable table = SpriteTables.open(handle, external, config);
        return portraitPolicy.plan(table).resolve(table);
    }

    /**
     * Read an archive from disk and extract its portrait. A palette named
     * after the archive ({@code kfm.sff} → {@code kfm.act}) or, failing that,
     * the first .act file in the same directory is used as the external palette.
     *
     * @throws SffException.FileNotFound if the archive cannot be read
     */
    public ImageSurface extractPortrait(Path sffFile) throws SffException {
        byte[] archive = readArchive(sffFile);
        byte[] palette = ActPaletteLoader.readFor(sffFile);
        return extractPortrait(archive, palette);
    }

    /**
     * Extract the preview image of a stage archive.
     *
     * @throws SffException if the archive is unreadable or no candidate decodes
     */
    public ImageSurface extractStagePreview(byte[] archive) throws SffException {
        ArchiveHandle handle = FormatSniffer.sniff(archive);
        LoggerUtil.info(String.format("[SffExtractor] Extracting stage preview from %d-byte SFF %s archive",
                handle.length(), handle.versionString()));

        SpriteTable table = SpriteTables.open(handle, null, config);
        return stagePreviewPolicy.plan(table).resolve(table);
    }

    /**
     * Read an archive from disk and extract its stage preview.
     *
     * @throws SffException.FileNotFound if the archive cannot be read
     */
    public ImageSurface extractStagePreview(Path sffFile) throws SffException {
        return extractStagePreview(readArchive(sffFile));
    }

    public ExtractorConfig config() {
        return config;
    }

    static byte[] readArchive(Path sffFile) throws SffException.FileNotFound {
        try {
            return Files.readAllBytes(sffFile);
        } catch (IOException e) {
            LoggerUtil.debug(() -> "[SffExtractor] Cannot read " + sffFile + ": " + e.getMessage());
            throw new SffException.FileNotFound(sffFile, e);
        }
    }
}
