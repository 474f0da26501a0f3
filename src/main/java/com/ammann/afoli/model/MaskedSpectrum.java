/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;
import java.util.Objects;

/**
 * A spectrum together with the mask currently applied to it.
 *
 * @param spectrum the channel values
 * @param mask exclusion flags, same length as {@code spectrum}
 */
public record MaskedSpectrum(Spectrum spectrum, Mask mask) {

    public MaskedSpectrum {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(mask, "mask");
        if (spectrum.length() != mask.length()) {
            throw ValidationException.invalidParameter(
                    "mask", mask.length() + " channels", spectrum.length() + " channels");
        }
    }

    /** Pairs a spectrum with an empty mask. */
    public static MaskedSpectrum unmasked(Spectrum spectrum) {
        return new MaskedSpectrum(spectrum, Mask.none(spectrum.length()));
    }

    public int length() {
        return spectrum.length();
    }

    /** Returns the same spectrum under a different mask. */
    public MaskedSpectrum withMask(Mask newMask) {
        return new MaskedSpectrum(spectrum, newMask);
    }

    /** Values of the unmasked channels in channel order. */
    public double[] unmaskedValues() {
        double[] result = new double[mask.unmaskedCount()];
        int j = 0;
        for (int i = 0; i < spectrum.length(); i++) {
            if (!mask.isMasked(i)) {
                result[j++] = spectrum.get(i);
            }
        }
        return result;
    }

    /** Channel indices of the unmasked channels in ascending order. */
    public int[] unmaskedChannels() {
        int[] result = new int[mask.unmaskedCount()];
        int j = 0;
        for (int i = 0; i < spectrum.length(); i++) {
            if (!mask.isMasked(i)) {
                result[j++] = i;
            }
        }
        return result;
    }
}
