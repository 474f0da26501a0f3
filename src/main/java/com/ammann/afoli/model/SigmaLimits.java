/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;
import java.util.List;
import java.util.Objects;

/**
 * Spread multipliers of the asymmetric sigma clip.
 *
 * <p>Samples below {@code center - lower * std} or above {@code center + upper * std}
 * are rejected. The default {@code (3.0, 1.3)} rejects emission lines far more
 * eagerly than absorption.
 *
 * @param lower multiplier applied below the center
 * @param upper multiplier applied above the center
 */
public record SigmaLimits(double lower, double upper) {

    public static final SigmaLimits DEFAULT = new SigmaLimits(3.0, 1.3);

    public SigmaLimits {
        requirePositive("sigma lower", lower);
        requirePositive("sigma upper", upper);
    }

    public static SigmaLimits symmetric(double sigma) {
        return new SigmaLimits(sigma, sigma);
    }

    /**
     * Builds the limits from one symmetric value or a {@code (lower, upper)} pair.
     *
     * @throws ValidationException if the list does not hold exactly one or two values
     */
    public static SigmaLimits from(List<Double> values) {
        if (values == null || values.isEmpty() || values.size() > 2
                || values.stream().anyMatch(Objects::isNull)) {
            throw ValidationException.invalidParameter(
                    "sigma", values, "one symmetric value or a lower,upper pair");
        }
        if (values.size() == 1) {
            return symmetric(values.get(0));
        }
        return new SigmaLimits(values.get(0), values.get(1));
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw ValidationException.invalidParameter(name, value, "positive finite value");
        }
    }
}
