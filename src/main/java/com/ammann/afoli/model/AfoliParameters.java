/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.enumeration.CenterStatistic;
import com.ammann.afoli.exception.ValidationException;
import java.util.List;
import java.util.Objects;

/**
 * Complete parameter set of one AFOLI run.
 *
 * @param sigma sigma-clip multipliers
 * @param centerStatistic center the clip measures deviations from
 * @param maxIterations sigma-clip iteration cap, {@code null} to iterate until convergence
 * @param extremes channels masked at each end of the spectrum
 * @param minWidth masked bands this wide or narrower are released
 * @param minGap unmasked gaps this wide or narrower between bands are masked,
 *     {@code null} to keep gaps
 * @param dilate channels added on each side of every masked band
 * @param flaggedChannels channel ranges always masked
 * @param invalidValues sentinel values that mark a channel as invalid
 * @param levels contamination levels to reconstruct masks for
 * @param levelMode trajectory interpolation used for the levels
 */
public record AfoliParameters(
        SigmaLimits sigma,
        CenterStatistic centerStatistic,
        Integer maxIterations,
        int extremes,
        int minWidth,
        Integer minGap,
        int dilate,
        List<ChannelRange> flaggedChannels,
        List<Double> invalidValues,
        List<Double> levels,
        LevelMode levelMode) {
    public static final int DEFAULT_EXTREMES = 10;
    public static final int DEFAULT_MIN_WIDTH = 2;

    public AfoliParameters {
        Objects.requireNonNull(sigma, "sigma");
        Objects.requireNonNull(centerStatistic, "centerStatistic");
        Objects.requireNonNull(levelMode, "levelMode");
        if (maxIterations != null && maxIterations < 1) {
            throw ValidationException.invalidParameter("niter", maxIterations, "positive iteration count");
        }
        if (extremes < 0) {
            throw ValidationException.invalidParameter("extremes", extremes, "non-negative channel count");
        }
        if (dilate < 0) {
            throw ValidationException.invalidParameter("dilate", dilate, "non-negative channel count");
        }
        flaggedChannels = flaggedChannels == null ? List.of() : List.copyOf(flaggedChannels);
        invalidValues = copyValues("invalidValues", invalidValues);
        levels = copyValues("levels", levels);
    }

    private static List<Double> copyValues(String name, List<Double> values) {
        if (values == null) {
            return List.of();
        }
        if (values.stream().anyMatch(Objects::isNull)) {
            throw ValidationException.invalidParameter(name, values, "list without null values");
        }
        return List.copyOf(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this parameter set. */
    public Builder toBuilder() {
        return new Builder()
                .sigma(sigma)
                .centerStatistic(centerStatistic)
                .maxIterations(maxIterations)
                .extremes(extremes)
                .minWidth(minWidth)
                .minGap(minGap)
                .dilate(dilate)
                .flaggedChannels(flaggedChannels)
                .invalidValues(invalidValues)
                .levels(levels)
                .levelMode(levelMode);
    }

    public boolean hasLevels() {
        return !levels.isEmpty();
    }

    /** Builder starting from the documented defaults. */
    public static final class Builder {
        private SigmaLimits sigma = SigmaLimits.DEFAULT;
        private CenterStatistic centerStatistic = CenterStatistic.MEDIAN;
        private Integer maxIterations;
        private int extremes = DEFAULT_EXTREMES;
        private int minWidth = DEFAULT_MIN_WIDTH;
        private Integer minGap;
        private int dilate;
        private List<ChannelRange> flaggedChannels = List.of();
        private List<Double> invalidValues = List.of();
        private List<Double> levels = List.of();
        private LevelMode levelMode = LevelMode.NEAREST;

        private Builder() {}

        public Builder sigma(SigmaLimits sigma) {
            this.sigma = sigma;
            return this;
        }

        public Builder centerStatistic(CenterStatistic centerStatistic) {
            this.centerStatistic = centerStatistic;
            return this;
        }

        public Builder maxIterations(Integer maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder extremes(int extremes) {
            this.extremes = extremes;
            return this;
        }

        public Builder minWidth(int minWidth) {
            this.minWidth = minWidth;
            return this;
        }

        public Builder minGap(Integer minGap) {
            this.minGap = minGap;
            return this;
        }

        public Builder dilate(int dilate) {
            this.dilate = dilate;
            return this;
        }

        public Builder flaggedChannels(List<ChannelRange> flaggedChannels) {
            this.flaggedChannels = flaggedChannels;
            return this;
        }

        public Builder invalidValues(List<Double> invalidValues) {
            this.invalidValues = invalidValues;
            return this;
        }

        public Builder levels(List<Double> levels) {
            this.levels = levels;
            return this;
        }

        public Builder levelMode(LevelMode levelMode) {
            this.levelMode = levelMode;
            return this;
        }

        public AfoliParameters build() {
            return new AfoliParameters(
                    sigma,
                    centerStatistic,
                    maxIterations,
                    extremes,
                    minWidth,
                    minGap,
                    dilate,
                    flaggedChannels,
                    invalidValues,
                    levels,
                    levelMode);
        }
    }
}
