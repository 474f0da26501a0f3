/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;
import java.util.Arrays;

/**
 * One-dimensional intensity spectrum extracted from a data cube.
 *
 * <p>Samples are indexed by channel and may be NaN where the extraction produced no
 * value. Instances are immutable: the backing array is copied on the way in and on
 * the way out.
 */
public final class Spectrum {

    private final double[] values;

    private Spectrum(double[] values) {
        this.values = values;
    }

    /**
     * Creates a spectrum from the given channel values.
     *
     * @param values intensity per channel, at least one sample
     * @return an immutable spectrum
     * @throws ValidationException if {@code values} is null or empty
     */
    public static Spectrum of(double... values) {
        if (values == null || values.length == 0) {
            throw ValidationException.insufficientData("spectrum channels", 1, 0);
        }
        return new Spectrum(values.clone());
    }

    public int length() {
        return values.length;
    }

    public double get(int channel) {
        return values[channel];
    }

    /** Returns a copy of the channel values. */
    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Spectrum other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Spectrum[" + values.length + " channels]";
    }
}
