/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.palette;

import com.sffkit.utils.LoggerUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Loads external .act palettes (raw 768-byte RGB tables) that characters ship
 * next to their sprite archive.
 */
public final class ActPaletteLoader {

    private static final String ACT_EXTENSION = ".act";

    private ActPaletteLoader() {}

    /**
     * Parse external palette bytes. Only the first 768 bytes are used.
     *
     * @param bytes palette file contents, may be null
     * @return the palette, or empty when absent or shorter than 768 bytes
     */
    public static Optional<PaletteTable> parse(byte[] bytes) {
        if (bytes == null) {
            return Optional.empty();
        }
        if (bytes.length < PaletteTable.RGB_BYTES) {
            LoggerUtil.warn(String.format(
                    "[ActPaletteLoader] Ignoring external palette of %d bytes (need %d)",
                    bytes.length, PaletteTable.RGB_BYTES));
            return Optional.empty();
        }
        return Optional.of(PaletteTable.fromRgb(bytes, 0));
    }

    /**
     * Find the palette file that belongs to an archive: {@code <name>.act}
     * next to it, otherwise the first {@code .act} file (by name) in the same
     * directory.
     *
     * @param sffFile path of the sprite archive
     * @return the palette file, or empty if the directory has none
     */
    public static Optional<Path> locate(Path sffFile) {
        Path directory = sffFile.toAbsolutePath().getParent();
        if (directory == null) {
            return Optional.empty();
        }

        String fileName = sffFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path sibling = directory.resolve(baseName + ACT_EXTENSION);
        if (Files.isRegularFile(sibling)) {
            return Optional.of(sibling);
        }

        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ACT_EXTENSION))
                    .min(Comparator.comparing(p -> p.getFileName().toString()));
        } catch (IOException e) {
            LoggerUtil.warn("[ActPaletteLoader] Could not list " + directory + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Read the palette that belongs to an archive, if there is one.
     *
     * @param sffFile path of the sprite archive
     * @return raw palette bytes, or null when no readable palette file exists
     */
    public static byte[] readFor(Path sffFile) {
        Optional<Path> act = locate(sffFile);
        if (act.isEmpty()) {
            return null;
        }
        try {
            LoggerUtil.debug(() -> "[ActPaletteLoader] Using external palette " + act.get());
            return Files.readAllBytes(act.get());
        } catch (IOException e) {
            LoggerUtil.warn("[ActPaletteLoader] Could not read " + act.get() + ": " + e.getMessage());
            return null;
        }
    }
}
