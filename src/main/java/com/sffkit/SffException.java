/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit;

import java.nio.file.Path;

/**
 * Base exception for SFF archive extraction.
 *
 * <p>Each failure category is a nested subclass so callers can catch the
 * specific case they care about, or {@code SffException} for all of them.
 */
public class SffException extends Exception {

    public SffException(String message) {
        super(message);
    }

    public SffException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when the archive file (or its directory) cannot be read.
     */
    public static class FileNotFound extends SffException {
        private final Path path;

        public FileNotFound(Path path) {
            super("SFF file not found: " + path.getFileName());
            this.path = path;
        }

        public FileNotFound(Path path, Throwable cause) {
            super("SFF file not found: " + path.getFileName(), cause);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }
    }

    /**
     * Thrown when the buffer is shorter than the minimum header size.
     */
    public static class FileTooSmall extends SffException {
        private final int size;

        public FileTooSmall(int size) {
            super("SFF file is too small to be valid (" + size + " bytes)");
            this.size = size;
        }

        public int getSize() {
            return size;
        }
    }

    /**
     * Thrown when the buffer does not start with the Elecbyte signature.
     */
    public static class InvalidSignature extends SffException {
        public InvalidSignature() {
            super("Invalid SFF signature - not a valid SFF file");
        }
    }

    /**
     * Thrown when the archive declares a version this decoder cannot read.
     */
    public static class UnsupportedVersion extends SffException {
        private final int version;

        public UnsupportedVersion(int version) {
            super("Unsupported SFF version: " + version);
            this.version = version;
        }

        public int getVersion() {
            return version;
        }
    }

    /**
     * Thrown when every candidate sprite for a use case failed to decode.
     */
    public static class SpriteNotFound extends SffException {
        private final int group;
        private final int image;

        public SpriteNotFound(int group, int image) {
            super(String.format("Sprite not found: group %d, image %d", group, image));
            this.group = group;
            this.image = image;
        }

        public int getGroup() {
            return group;
        }

        public int getImage() {
            return image;
        }
    }

    /**
     * Thrown when header offsets or counts disagree with the buffer.
     */
    public static class CorruptedData extends SffException {
        public CorruptedData(String detail) {
            super("Corrupted SFF data: " + detail);
        }
    }

    /**
     * Thrown when a codec produced output that disagrees with the declared size,
     * or ran out of input before filling it.
     */
    public static class DecodingFailed extends SffException {
        public DecodingFailed(String detail) {
            super("Failed to decode sprite: " + detail);
        }

        public DecodingFailed(String detail, Throwable cause) {
            super("Failed to decode sprite: " + detail, cause);
        }
    }

    /**
     * Thrown when a sprite declares a zero, negative or implausibly large size.
     */
    public static class InvalidDimensions extends SffException {
        private final int width;
        private final int height;

        public InvalidDimensions(int width, int height) {
            super(String.format("Invalid sprite dimensions: %dx%d", width, height));
            this.width = width;
            this.height = height;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }
    }
}
