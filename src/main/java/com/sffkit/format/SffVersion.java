/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.format;

/**
 * The two on-disk SFF layouts.
 */
public enum SffVersion {
    /** PCX sub-files in a forward linked list. */
    V1,
    /** Flat sprite and palette tables over l-data/t-data regions. */
    V2;

    /**
     * Maps the header's version-major byte to a layout. Anything from 2 up is
     * read as v2, anything below as v1.
     */
    public static SffVersion fromMajor(int major) {
        return major >= 2 ? V2 : V1;
    }
}
