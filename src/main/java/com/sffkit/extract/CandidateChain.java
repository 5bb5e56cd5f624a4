/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.extract;

import com.sffkit.SffException;
import com.sffkit.format.SpriteRecord;
import com.sffkit.format.SpriteTable;
import com.sffkit.image.ImageSurface;
import com.sffkit.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered fallback over candidate sprites.
 *
 * <p>Tiers are tried in order; within a tier, records are tried in order. The
 * first record that decodes and satisfies its tier's acceptance test wins.
 * Each record is decoded at most once per resolution, so a record that appears
 * in several tiers costs a single decode. Decode failures are logged and
 * skipped; only when every tier is exhausted does resolution fail.
 */
public final class CandidateChain {

    /**
     * One step of the fallback.
     *
     * @param label name used in log lines
     * @param records candidates in priority order
     * @param accept extra condition a decoded image must meet
     */
    public record Tier(String label, List<SpriteRecord> records, Predicate<ImageSurface> accept) {}

    private final List<Tier> tiers;
    private final int missingGroup;
    private final int missingImage;

    private CandidateChain(List<Tier> tiers, int missingGroup, int missingImage) {
        this.tiers = tiers;
        this.missingGroup = missingGroup;
        this.missingImage = missingImage;
    }

    /**
     * @param missingGroup group reported if no candidate decodes
     * @param missingImage image reported if no candidate decodes
     */
    public static Builder builder(int missingGroup, int missingImage) {
        return new Builder(missingGroup, missingImage);
    }

    public List<Tier> tiers() {
        return tiers;
    }

    /**
     * Decode candidates until one is accepted.
     *
     * @param table the table the records came from
     * @return the first accepted image
     * @throws SffException.SpriteNotFound when no candidate is accepted
     */
    public ImageSurface resolve(SpriteTable table) throws SffException.SpriteNotFound {
        Map<Integer, Optional<ImageSurface>> attempts = new HashMap<>();

        for (Tier tier : tiers) {
            for (SpriteRecord record : tier.records()) {
                Optional<ImageSurface> decoded = attempts.get(record.index());
                if (decoded == null) {
                    decoded = attempt(table, record);
                    attempts.put(record.index(), decoded);
                }
                if (decoded.isPresent() && tier.accept().test(decoded.get())) {
                    ImageSurface image = decoded.get();
                    LoggerUtil.debug(() -> String.format(
                            "[CandidateChain] Selected %s from tier '%s' (%dx%d)",
                            record, tier.label(), image.width(), image.height()));
                    return image;
                }
            }
        }
        throw new SffException.SpriteNotFound(missingGroup, missingImage);
    }

    private static Optional<ImageSurface> attempt(SpriteTable table, SpriteRecord record) {
        try {
            return Optional.of(table.decode(record));
        } catch (SffException e) {
            LoggerUtil.debug(() -> "[CandidateChain] Rejected " + record + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    public static final class Builder {
        private final List<Tier> tiers = new ArrayList<>();
        private final int missingGroup;
        private final int missingImage;

        private Builder(int missingGroup, int missingImage) {
            this.missingGroup = missingGroup;
            this.missingImage = missingImage;
        }

        /** Add a tier that accepts anything that decodes. */
        public Builder tier(String label, List<SpriteRecord> records) {
            return tier(label, records, image -> true);
        }

        public Builder tier(String label, List<SpriteRecord> records, Predicate<ImageSurface> accept) {
            tiers.add(new Tier(label, List.copyOf(records), accept));
            return this;
        }

        public CandidateChain build() {
            return new CandidateChain(List.copyOf(tiers), missingGroup, missingImage);
        }
    }
}
