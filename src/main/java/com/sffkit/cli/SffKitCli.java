/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.cli;

import com.sffkit.SffException;
import com.sffkit.config.ExtractorConfig;
import com.sffkit.extract.SffExtractor;
import com.sffkit.image.ImageSurface;
import com.sffkit.inspect.ArchiveSummary;
import com.sffkit.inspect.SffInspector;
import com.sffkit.utils.LoggerUtil;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import javax.imageio.ImageIO;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * <pre>
 * sffkit portrait kfm.sff -o kfm.png [--palette kfm.act]
 * sffkit preview stage0.sff -o stage0.png
 * sffkit info kfm.sff
 * </pre>
 *
 * Exit codes: 0 on success, 1 when the archive cannot be decoded, 2 on I/O errors.
 */
@Command(name = "sffkit", mixinStandardHelpOptions = true, version = "sffkit 1.0.0",
        description = "Extracts portraits and stage previews from SFF sprite archives.")
public class SffKitCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_DECODE_ERROR = 1;
    public static final int EXIT_IO_ERROR = 2;

    @Option(names = "--debug", description = "Enable debug logging")
    boolean debug;

    @Option(names = "--config", description = "Properties file overriding sffkit.properties")
    Path configFile;

    private final PrintWriter out;
    private final PrintWriter err;

    public SffKitCli() {
        this(new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    public SffKitCli(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String... args) {
        int result = new CommandLine(new SffKitCli()).execute(args);
        System.exit(result);
    }

    @Command(name = "portrait", description = "Write the select-screen portrait of a character archive as PNG")
    int portrait(
            @Parameters(index = "0", description = "Character .sff file") Path sffFile,
            @Option(names = "-o", required = true, description = "Output PNG file") File outputFile,
            @Option(names = "--palette", description = "External .act palette") Path paletteFile
    ) {
        SffExtractor extractor = new SffExtractor(config());
        try {
            ImageSurface portrait;
            if (paletteFile != null) {
                portrait = extractor.extractPortrait(readArchive(sffFile), Files.readAllBytes(paletteFile));
            } else {
                portrait = extractor.extractPortrait(sffFile);
            }
            writePng(portrait, outputFile);
            out.printf("Wrote %dx%d portrait to %s%n", portrait.width(), portrait.height(), outputFile);
            return EXIT_OK;
        } catch (SffException e) {
            return fail(EXIT_DECODE_ERROR, sffFile, e);
        } catch (IOException e) {
            return fail(EXIT_IO_ERROR, sffFile, e);
        }
    }

    @Command(name = "preview", description = "Write the preview image of a stage archive as PNG")
    int preview(
            @Parameters(index = "0", description = "Stage .sff file") Path sffFile,
            @Option(names = "-o", required = true, description = "Output PNG file") File outputFile
    ) {
        SffExtractor extractor = new SffExtractor(config());
        try {
            ImageSurface preview = extractor.extractStagePreview(sffFile);
            writePng(preview, outputFile);
            out.printf("Wrote %dx%d stage preview to %s%n", preview.width(), preview.height(), outputFile);
            return EXIT_OK;
        } catch (SffException e) {
            return fail(EXIT_DECODE_ERROR, sffFile, e);
        } catch (IOException e) {
            return fail(EXIT_IO_ERROR, sffFile, e);
        }
    }

    @Command(name = "info", description = "Print a JSON summary of an archive's sprites")
    int info(@Parameters(index = "0", description = ".sff file") Path sffFile) {
        try {
            ArchiveSummary summary = new SffInspector(config()).inspect(sffFile);
            out.println(SffInspector.toJson(summary));
            return EXIT_OK;
        } catch (SffException e) {
            return fail(EXIT_DECODE_ERROR, sffFile, e);
        } catch (IOException e) {
            return fail(EXIT_IO_ERROR, sffFile, e);
        }
    }

    private ExtractorConfig config() {
        ExtractorConfig config = configFile != null ? ExtractorConfig.load(configFile) : ExtractorConfig.load();
        LoggerUtil.setDebugEnabled(debug || config.debugLogging());
        return config;
    }

    private static byte[] readArchive(Path sffFile) throws SffException.FileNotFound {
        try {
            return Files.readAllBytes(sffFile);
        } catch (IOException e) {
            throw new SffException.FileNotFound(sffFile, e);
        }
    }

    private static void writePng(ImageSurface image, File outputFile) throws IOException {
        File parent = outputFile.getAbsoluteFile().getParentFile();
        if (parent != null) {
            Files.createDirectories(parent.toPath());
        }
        if (!ImageIO.write(image.toBufferedImage(), "png", outputFile)) {
            throw new IOException("No PNG writer available");
        }
    }

    private int fail(int exitCode, Path sffFile, Exception e) {
        LoggerUtil.error("[SffKitCli] " + sffFile + ": " + e.getMessage());
        err.println("Error: " + e.getMessage());
        return exitCode;
    }
}
