/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.config;

import com.sffkit.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Limits and thresholds used by the decoder and the image cache.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>sff.v1.max.records - v1 linked-list traversal cap (default: 2000)</li>
 *   <li>sff.v2.max.records - v2 sprite table scan cap (default: 5000)</li>
 *   <li>sff.max.dimension - largest accepted width or height (default: 4096, at most 16384)</li>
 *   <li>sff.portrait.min.size / sff.portrait.max.size - preferred v1 portrait band (default: 80-250)</li>
 *   <li>sff.v2.portrait.min.size - v2 preferred portrait threshold (default: 50)</li>
 *   <li>sff.v2.standin.min.size - v2 group 0 stand-in threshold, exclusive (default: 30)</li>
 *   <li>sff.palette.max.link.depth - v2 palette link hops (default: 4)</li>
 *   <li>cache.max.entries / cache.max.bytes - image cache limits (default: 500 / 100 MB)</li>
 *   <li>log.debug - enable debug logging (default: false)</li>
 * </ul>
 */
public final class ExtractorConfig {

    public static final String RESOURCE_NAME = "sffkit.properties";
    public static final int MAX_DIMENSION_CEILING = 16384;

    private static final int DEFAULT_V1_MAX_RECORDS = 2000;
    private static final int DEFAULT_V2_MAX_RECORDS = 5000;
    private static final int DEFAULT_MAX_DIMENSION = 4096;
    private static final int DEFAULT_PORTRAIT_MIN = 80;
    private static final int DEFAULT_PORTRAIT_MAX = 250;
    private static final int DEFAULT_V2_PORTRAIT_MIN = 50;
    private static final int DEFAULT_V2_STANDIN_MIN = 30;
    private static final int DEFAULT_PALETTE_LINK_DEPTH = 4;
    private static final long DEFAULT_CACHE_ENTRIES = 500;
    private static final long DEFAULT_CACHE_BYTES = 100L * 1024 * 1024;

    private final int v1MaxRecords;
    private final int v2MaxRecords;
    private final int maxDimension;
    private final int portraitMinSize;
    private final int portraitMaxSize;
    private final int v2PortraitMinSize;
    private final int v2StandInMinSize;
    private final int paletteMaxLinkDepth;
    private final long cacheMaxEntries;
    private final long cacheMaxBytes;
    private final boolean debugLogging;

    private ExtractorConfig(Properties config) {
        this.v1MaxRecords = parseInt(config, "sff.v1.max.records", DEFAULT_V1_MAX_RECORDS);
        this.v2MaxRecords = parseInt(config, "sff.v2.max.records", DEFAULT_V2_MAX_RECORDS);
        this.maxDimension = clampDimension(parseInt(config, "sff.max.dimension", DEFAULT_MAX_DIMENSION));
        this.portraitMinSize = parseInt(config, "sff.portrait.min.size", DEFAULT_PORTRAIT_MIN);
        this.portraitMaxSize = parseInt(config, "sff.portrait.max.size", DEFAULT_PORTRAIT_MAX);
        this.v2PortraitMinSize = parseInt(config, "sff.v2.portrait.min.size", DEFAULT_V2_PORTRAIT_MIN);
        this.v2StandInMinSize = parseInt(config, "sff.v2.standin.min.size", DEFAULT_V2_STANDIN_MIN);
        this.paletteMaxLinkDepth = parseInt(config, "sff.palette.max.link.depth", DEFAULT_PALETTE_LINK_DEPTH);
        this.cacheMaxEntries = parseLong(config, "cache.max.entries", DEFAULT_CACHE_ENTRIES);
        this.cacheMaxBytes = parseLong(config, "cache.max.bytes", DEFAULT_CACHE_BYTES);
        this.debugLogging = Boolean.parseBoolean(config.getProperty("log.debug", "false").trim());
    }

    /**
     * Built-in defaults, ignoring any properties files.
     */
    public static ExtractorConfig defaults() {
        return new ExtractorConfig(new Properties());
    }

    /**
     * Build from explicit properties. Missing keys take their defaults.
     */
    public static ExtractorConfig fromProperties(Properties config) {
        return new ExtractorConfig(config);
    }

    /**
     * Load configuration: classpath {@value #RESOURCE_NAME} first, then a
     * {@value #RESOURCE_NAME} in the working directory, then system properties.
     * Later sources override earlier ones.
     */
    public static ExtractorConfig load() {
        return load(Paths.get(RESOURCE_NAME));
    }

    /**
     * Same as {@link #load()} with an explicit override file.
     */
    public static ExtractorConfig load(Path externalConfigPath) {
        Properties config = new Properties();

        try (InputStream inputStream = ExtractorConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (inputStream != null) {
                config.load(inputStream);
            } else {
                LoggerUtil.debug("[ExtractorConfig] " + RESOURCE_NAME + " not on classpath, using defaults");
            }
        } catch (IOException e) {
            LoggerUtil.warn("[ExtractorConfig] Failed to read classpath " + RESOURCE_NAME + ": " + e.getMessage());
        }

        if (externalConfigPath != null && Files.isRegularFile(externalConfigPath)) {
            LoggerUtil.info("[ExtractorConfig] Loading overrides from " + externalConfigPath.toAbsolutePath());
            try (InputStream inputStream = Files.newInputStream(externalConfigPath)) {
                Properties external = new Properties();
                external.load(inputStream);
                config.putAll(external);
            } catch (IOException e) {
                LoggerUtil.warn("[ExtractorConfig] Failed to read " + externalConfigPath + ": " + e.getMessage());
            }
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("sff.") || key.startsWith("cache.") || key.startsWith("log.")) {
                config.setProperty(key, System.getProperty(key));
            }
        }

        return new ExtractorConfig(config);
    }

    private static int parseInt(Properties config, String key, int defaultValue) {
        long parsed = parseLong(config, key, defaultValue);
        if (parsed > Integer.MAX_VALUE) {
            LoggerUtil.warn("[ExtractorConfig] Value too large for " + key + ": " + parsed + ", using default: " + defaultValue);
            return defaultValue;
        }
        return (int) parsed;
    }

    private static int clampDimension(int maxDimension) {
        if (maxDimension > MAX_DIMENSION_CEILING) {
            LoggerUtil.warn("[ExtractorConfig] sff.max.dimension " + maxDimension + " exceeds " + MAX_DIMENSION_CEILING + ", clamping");
            return MAX_DIMENSION_CEILING;
        }
        return maxDimension;
    }

    private static long parseLong(Properties config, String key, long defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 0) {
                LoggerUtil.warn("[ExtractorConfig] Negative value for " + key + ": " + value + ", using default: " + defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            LoggerUtil.warn("[ExtractorConfig] Invalid value for " + key + ": " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }

    public int v1MaxRecords() {
        return v1MaxRecords;
    }

    public int v2MaxRecords() {
        return v2MaxRecords;
    }

    public int maxDimension() {
        return maxDimension;
    }

    public int portraitMinSize() {
        return portraitMinSize;
    }

    public int portraitMaxSize() {
        return portraitMaxSize;
    }

    public int v2PortraitMinSize() {
        return v2PortraitMinSize;
    }

    public int v2StandInMinSize() {
        return v2StandInMinSize;
    }

    public int paletteMaxLinkDepth() {
        return paletteMaxLinkDepth;
    }

    public long cacheMaxEntries() {
        return cacheMaxEntries;
    }

    public long cacheMaxBytes() {
        return cacheMaxBytes;
    }

    public boolean debugLogging() {
        return debugLogging;
    }

    @Override
    public String toString() {
        return "ExtractorConfig{" +
                "v1MaxRecords=" + v1MaxRecords +
                ", v2MaxRecords=" + v2MaxRecords +
                ", maxDimension=" + maxDimension +
                ", portraitBand=" + portraitMinSize + "-" + portraitMaxSize +
                ", v2PortraitMinSize=" + v2PortraitMinSize +
                ", v2StandInMinSize=" + v2StandInMinSize +
                ", paletteMaxLinkDepth=" + paletteMaxLinkDepth +
                ", cacheMaxEntries=" + cacheMaxEntries +
                ", cacheMaxBytes=" + cacheMaxBytes +
                '}';
    }
}
