/* (C)2026 */
package com.ammann.afoli.enumeration;

import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.math.MaskedStatistics;
import com.ammann.afoli.model.MaskedSpectrum;
import java.util.Arrays;
import java.util.Locale;

/**
 * Center statistic the sigma clip measures deviations from.
 */
public enum CenterStatistic {

    /** Median of the unmasked channels. */
    MEDIAN("median") {
        @Override
        public double center(MaskedSpectrum spectrum) {
            return MaskedStatistics.median(spectrum);
        }
    },

    /** Mean of the unmasked channels. */
    MEAN("mean") {
        @Override
        public double center(MaskedSpectrum spectrum) {
            return MaskedStatistics.mean(spectrum);
        }
    },

    /** Intercept of a line fitted against channel index, suited to sloped baselines. */
    LINEAR_REGRESSION_INTERCEPT("linregress") {
        @Override
        public double center(MaskedSpectrum spectrum) {
            return MaskedStatistics.centeredIntercept(spectrum);
        }
    };

    private final String configName;

    CenterStatistic(String configName) {
        this.configName = configName;
    }

    /** Computes the center of the unmasked channels, NaN if none is left. */
    public abstract double center(MaskedSpectrum spectrum);

    /** Name used in configuration and requests. */
    public String configName() {
        return configName;
    }

    /**
     * Resolves a configured statistic name ({@code median}, {@code mean},
     * {@code linregress}), also accepting the enum constant names.
     *
     * @throws ValidationException for any other name
     */
    public static CenterStatistic fromName(String name) {
        if (name != null) {
            String value = name.strip();
            for (CenterStatistic statistic : values()) {
                if (statistic.configName.equalsIgnoreCase(value)
                        || statistic.name().equalsIgnoreCase(value)) {
                    return statistic;
                }
            }
        }
        String supported = Arrays.stream(values())
                .map(CenterStatistic::configName)
                .toList()
                .toString();
        throw ValidationException.invalidParameter(
                "censtat", name, "one of " + supported.toLowerCase(Locale.ROOT));
    }
}
