/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;
import java.util.Objects;

/**
 * A spectrum together with the name its flag files are written under.
 *
 * @param name file stem, unique within a batch
 * @param spectrum flux values
 * @param frequencies frequency axis, {@code null} when unknown
 */
public record NamedSpectrum(String name, Spectrum spectrum, FrequencyAxis frequencies) {

    public NamedSpectrum {
        if (name == null || name.isBlank()) {
            throw ValidationException.invalidParameter("name", name, "non-blank spectrum name");
        }
        if (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.indexOf('\0') >= 0
                || name.equals(".") || name.equals("..")) {
            throw ValidationException.invalidParameter("name", name, "spectrum name without path separators");
        }
        Objects.requireNonNull(spectrum, "spectrum");
        if (frequencies != null && frequencies.length() != spectrum.length()) {
            throw ValidationException.lengthMismatch("spectrum", spectrum.length(), "frequency axis", frequencies.length());
        }
    }

    public boolean hasFrequencies() {
        return frequencies != null;
    }
}
