/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.codec;

import com.sffkit.SffException;

/**
 * Forward-only reader over a compressed stream. Reading past the end fails
 * the decode instead of returning filler bytes.
 */
final class ByteCursor {

    private final byte[] data;
    private final String codec;
    private int position;

    ByteCursor(byte[] data, String codec) {
        this.data = data;
        this.codec = codec;
    }

    int next() throws SffException.DecodingFailed {
        if (position >= data.length) {
            throw new SffException.DecodingFailed(String.format(
                    "%s stream truncated after %d bytes", codec, data.length));
        }
        return data[position++] & 0xFF;
    }

    int position() {
        return position;
    }
}
