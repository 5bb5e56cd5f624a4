/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.format;

/**
 * A sniffed archive: the raw bytes plus the version read from the header.
 *
 * <p>The byte array is shared, not copied. Nothing in the decoder writes to it.
 *
 * @param data the whole archive
 * @param version layout selected from the version-major byte
 * @param versionBytes header bytes 12-15 in file order (lo3, lo2, lo1, hi)
 */
public record ArchiveHandle(byte[] data, SffVersion version, int[] versionBytes) {

    public int length() {
        return data.length;
    }

    /**
     * Dotted version string, most significant byte first (e.g. "1.0.1.0", "2.0.1.0").
     */
    public String versionString() {
        return versionBytes[3] + "." + versionBytes[2] + "." + versionBytes[1] + "." + versionBytes[0];
    }
}
