/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;

/**
 * Frequency of every channel of a spectrum, in a single unit.
 *
 * <p>Produced by the cube extraction together with the spectrum; the values follow
 * channel order and may be ascending or descending.
 */
public final class FrequencyAxis {

    public static final String DEFAULT_UNIT = "GHz";

    private final double[] values;
    private final String unit;

    private FrequencyAxis(double[] values, String unit) {
        this.values = values;
        this.unit = unit;
    }

    public static FrequencyAxis of(double[] values, String unit) {
        if (values == null || values.length == 0) {
            throw ValidationException.insufficientData("frequency channels", 1, 0);
        }
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw ValidationException.invalidParameter("frequencies", value, "finite values");
            }
        }
        String resolvedUnit = unit == null || unit.isBlank() ? DEFAULT_UNIT : unit.strip();
        return new FrequencyAxis(values.clone(), resolvedUnit);
    }

    public int length() {
        return values.length;
    }

    public double get(int channel) {
        return values[channel];
    }

    public String unit() {
        return unit;
    }

    /**
     * Half the spacing between the first two channels, or zero for a single-channel
     * axis.
     */
    public double halfChannelWidth() {
        if (values.length < 2) {
            return 0.0;
        }
        return Math.abs(values[0] - values[1]) / 2.0;
    }
}
