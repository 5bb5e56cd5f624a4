/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.format;

import com.sffkit.SffException;
import com.sffkit.image.ImageSurface;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Version-specific view over an archive's sprites.
 *
 * <p>Implementations walk their table once when opened and decode individual
 * records on demand. Candidate selection is done by the caller.
 */
public interface SpriteTable {

    SffVersion version();

    /**
     * All records reached by the bounded table walk, in table order.
     */
    List<SpriteRecord> sprites();

    /**
     * Records matching {@code (group, image)} that own pixel data, in table order.
     */
    default List<SpriteRecord> locate(int group, int image) {
        return sprites().stream()
                .filter(r -> r.is(group, image) && r.ownsData())
                .collect(Collectors.toList());
    }

    /**
     * Decode one record into an image surface.
     *
     * @param record a record returned by {@link #sprites()}
     * @return the decoded image
     * @throws SffException if the record cannot be decoded
     */
    ImageSurface decode(SpriteRecord record) throws SffException;
}
