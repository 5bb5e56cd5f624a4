/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.format;

import com.sffkit.SffException;
import com.sffkit.io.ByteReader;

import java.nio.charset.StandardCharsets;

/**
 * Classifies a buffer as an SFF v1 or v2 archive.
 *
 * <p>Only the signature and the version-major byte are checked here. Table
 * offsets are validated by the walkers before each read.
 */
public final class FormatSniffer {

    /** Minimum buffer size: the v1 header up to the first-subfile offset. */
    public static final int MIN_HEADER_SIZE = 32;

    /** "ElecbyteSpr", the 11 significant signature bytes (a NUL follows on disk). */
    public static final byte[] SIGNATURE = "ElecbyteSpr".getBytes(StandardCharsets.US_ASCII);

    /** Header offset of the version-major byte. */
    public static final int VERSION_MAJOR_OFFSET = 15;

    private FormatSniffer() {}

    /**
     * Sniff the buffer and wrap it in an {@link ArchiveHandle}.
     *
     * @param data the complete archive
     * @return handle carrying the detected layout
     * @throws SffException.FileTooSmall if the buffer is under {@value #MIN_HEADER_SIZE} bytes
     * @throws SffException.InvalidSignature if the signature does not match
     */
    public static ArchiveHandle sniff(byte[] data) throws SffException {
        if (data == null || data.length < MIN_HEADER_SIZE) {
            throw new SffException.FileTooSmall(data == null ? 0 : data.length);
        }
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (data[i] != SIGNATURE[i]) {
                throw new SffException.InvalidSignature();
            }
        }

        int[] versionBytes = {
            ByteReader.u8(data, 12),
            ByteReader.u8(data, 13),
            ByteReader.u8(data, 14),
            ByteReader.u8(data, VERSION_MAJOR_OFFSET)
        };
        return new ArchiveHandle(data, SffVersion.fromMajor(versionBytes[3]), versionBytes);
    }
}
