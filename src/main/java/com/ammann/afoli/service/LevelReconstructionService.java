/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.math.TrajectoryInterpolation;
import com.ammann.afoli.model.IterationTrajectory;
import com.ammann.afoli.model.LevelMask;
import com.ammann.afoli.model.LevelMode;
import com.ammann.afoli.model.Mask;
import com.ammann.afoli.model.MaskedSpectrum;
import com.ammann.afoli.model.SigmaLimits;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BisectionSolver;

/**
 * Reconstructs the mask a sigma clip would have produced had it tolerated a given
 * contamination of the continuum.
 *
 * <p>For a level {@code l} the trajectory means, normalized by the converged
 * continuum, are searched for the fractional iteration where they equal
 * {@code 1 + l}. The continuum and standard deviation interpolated at that point are
 * then used to clip the basic-masked spectrum once with the original multipliers.
 * Since the clip advances in discrete, asymmetric steps the result is an
 * approximation. When {@code 1 + l} lies outside the recorded range the closest
 * trajectory point is used instead and the fallback is logged.
 */
@ApplicationScoped
public class LevelReconstructionService {

    static final double ROOT_ACCURACY = 1e-12;
    static final int MAX_EVALUATIONS = 1000;

    private final RegionEncodingService regionEncoder;

    @Inject
    public LevelReconstructionService(RegionEncodingService regionEncoder) {
        this.regionEncoder = regionEncoder;
    }

    /**
     * Reconstructs one mask per level, in the order requested.
     *
     * @param basic spectrum after basic masking only
     * @param levels contamination levels
     * @param trajectory sigma-clip trajectory of {@code basic}
     * @param continuum converged continuum value
     * @param sigma multipliers of the converged clip
     * @param mode trajectory interpolation
     * @param log processing log
     */
    public List<LevelMask> reconstruct(
            MaskedSpectrum basic,
            List<Double> levels,
            IterationTrajectory trajectory,
            double continuum,
            SigmaLimits sigma,
            LevelMode mode,
            ProcessingLog log) {
        List<LevelMask> masks = new ArrayList<>(levels.size());
        for (double level : levels) {
            masks.add(reconstruct(basic, level, trajectory, continuum, sigma, mode, log));
        }
        return masks;
    }

    /**
     * Reconstructs the mask for a single level.
     */
    public LevelMask reconstruct(
            MaskedSpectrum basic,
            double level,
            IterationTrajectory trajectory,
            double continuum,
            SigmaLimits sigma,
            LevelMode mode,
            ProcessingLog log) {
        log.logf("Processing level: %s", level);

        double target = 1.0 + level;
        double[] means = trajectory.means();
        double[] stds = trajectory.stds();
        double[] normalized = new double[means.length];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < means.length; i++) {
            normalized[i] = means[i] / continuum;
            if (!Double.isNaN(normalized[i])) {
                min = Math.min(min, normalized[i]);
                max = Math.max(max, normalized[i]);
            }
        }

        double levelContinuum;
        double levelStd;
        double iteration = Double.NaN;
        boolean interpolated = false;

        if (min < target && target < max && trajectory.size() >= mode.minimumPoints()) {
            double[] sites = new double[means.length];
            double[] centered = new double[means.length];
            for (int i = 0; i < means.length; i++) {
                sites[i] = i;
                centered[i] = normalized[i] - target;
            }
            UnivariateFunction offset = TrajectoryInterpolation.interpolate(mode, sites, centered);
            UnivariateFunction spread = TrajectoryInterpolation.interpolate(mode, sites, stds);

            iteration = findRoot(offset, centered);
            levelContinuum = (offset.value(iteration) + target) * continuum;
            levelStd = spread.value(iteration);
            interpolated = true;
        } else {
            if (min < target && target < max) {
                log.logf("Only %d trajectory points, %s interpolation needs %d",
                        trajectory.size(), mode, mode.minimumPoints());
            } else {
                log.log("Value outside range!");
            }
            log.log("Using nearest value instead");
            int nearest = nearestIndex(normalized, target);
            levelContinuum = means[nearest];
            levelStd = stds[nearest];
        }

        log.logf("Value at %s:", target);
        log.logf("Continuum = %s", levelContinuum);
        log.logf("Std dev = %s", levelStd);

        Mask mask = clipAround(basic, levelContinuum, levelStd, sigma);
        var ranges = regionEncoder.group(mask);
        log.logf("Flagged channels: %s", regionEncoder.encodeChannels(ranges));

        return new LevelMask(level, levelContinuum, levelStd, mask, ranges, interpolated, iteration);
    }

    /**
     * Locates a zero of {@code offset} inside the first pair of neighbouring sites
     * whose sampled values bracket it.
     */
    private double findRoot(UnivariateFunction offset, double[] samples) {
        for (int i = 0; i < samples.length; i++) {
            if (samples[i] == 0.0) {
                return i;
            }
            if (i + 1 < samples.length && samples[i] * samples[i + 1] < 0.0) {
                return new BisectionSolver(ROOT_ACCURACY).solve(MAX_EVALUATIONS, offset, i, i + 1.0);
            }
        }
        // unreachable while min < target < max: some neighbouring pair changes sign
        throw new IllegalStateException("No sign change in trajectory offsets");
    }

    private static int nearestIndex(double[] normalized, double target) {
        int best = normalized.length - 1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < normalized.length; i++) {
            double distance = Math.abs(target - normalized[i]);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }

    private static Mask clipAround(MaskedSpectrum basic, double continuum, double std, SigmaLimits sigma) {
        double lowerBound = continuum - sigma.lower() * std;
        double upperBound = continuum + sigma.upper() * std;
        boolean[] flags = basic.mask().toArray();
        for (int i = 0; i < flags.length; i++) {
            double value = basic.spectrum().get(i);
            if (value < lowerBound || value > upperBound) {
                flags[i] = true;
            }
        }
        return Mask.of(flags);
    }
}
