/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.format;

/**
 * Where a sprite's raw bytes live.
 */
public enum DataRegion {
    /** v1: the PCX payload that follows a sub-file header. */
    SUBFILE,
    /** v2: the "literal" data region. */
    LDATA,
    /** v2: the "translated" data region, selected by flag bit 0. */
    TDATA
}
