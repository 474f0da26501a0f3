/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.enumeration.CenterStatistic;
import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.math.MaskedStatistics;
import com.ammann.afoli.model.Mask;
import com.ammann.afoli.model.MaskedSpectrum;
import com.ammann.afoli.model.SigmaLimits;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Asymmetric iterative sigma clip.
 *
 * <p>Each iteration measures the center statistic and the population standard
 * deviation of the unmasked channels, then masks every unmasked channel below
 * {@code center - lower * std} or above {@code center + upper * std}. Iteration stops
 * when an iteration masks nothing or the iteration cap is reached. Channels already
 * masked on input stay masked, so the masked set only grows.
 */
@ApplicationScoped
public class SigmaClipService {

    /**
     * Runs the clip.
     *
     * @param input spectrum with its initial mask
     * @param sigma lower and upper multipliers
     * @param statistic center statistic
     * @param maxIterations iteration cap, {@code null} to run until nothing changes
     * @return the clipped spectrum with the final center and spread
     */
    public SigmaClipResult clip(
            MaskedSpectrum input,
            SigmaLimits sigma,
            CenterStatistic statistic,
            Integer maxIterations) {
        if (maxIterations != null && maxIterations < 1) {
            throw ValidationException.invalidParameter("niter", maxIterations, "positive iteration count");
        }

        boolean[] flags = input.mask().toArray();
        MaskedSpectrum current = input;
        int iterations = 0;

        while (maxIterations == null || iterations < maxIterations) {
            if (current.mask().isFullyMasked()) {
                break;
            }

            double center = statistic.center(current);
            double std = MaskedStatistics.std(current);
            if (Double.isNaN(center) || Double.isNaN(std)) {
                break;
            }

            double lowerBound = center - sigma.lower() * std;
            double upperBound = center + sigma.upper() * std;
            int newlyMasked = 0;
            for (int i = 0; i < flags.length; i++) {
                if (flags[i]) {
                    continue;
                }
                double value = input.spectrum().get(i);
                if (value < lowerBound || value > upperBound) {
                    flags[i] = true;
                    newlyMasked++;
                }
            }
            iterations++;

            if (newlyMasked == 0) {
                break;
            }
            current = input.withMask(Mask.of(flags));
        }

        return new SigmaClipResult(
                current,
                statistic.center(current),
                MaskedStatistics.std(current),
                iterations);
    }

    /**
     * Outcome of a sigma clip.
     *
     * @param clipped input spectrum under the clipped mask
     * @param center final center statistic of the unmasked channels
     * @param std final population standard deviation of the unmasked channels
     * @param iterations iterations run
     */
    public record SigmaClipResult(MaskedSpectrum clipped, double center, double std, int iterations) {
        public Mask mask() {
            return clipped.mask();
        }
    }
}
