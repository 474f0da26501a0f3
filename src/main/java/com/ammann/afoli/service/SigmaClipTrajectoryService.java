/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.enumeration.CenterStatistic;
import com.ammann.afoli.math.MaskedStatistics;
import com.ammann.afoli.model.IterationTrajectory;
import com.ammann.afoli.model.MaskedSpectrum;
import com.ammann.afoli.model.SigmaLimits;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;

/**
 * Records how the sigma clip converges by re-running it with an increasing
 * iteration cap.
 *
 * <p>The first point holds the statistics of the input before clipping. A point is
 * appended whenever raising the cap by one changes the number of unmasked channels;
 * recording stops the first time it does not, which is exactly when the clip has
 * converged.
 */
@ApplicationScoped
public class SigmaClipTrajectoryService {

    private final SigmaClipService sigmaClipService;

    @Inject
    public SigmaClipTrajectoryService(SigmaClipService sigmaClipService) {
        this.sigmaClipService = sigmaClipService;
    }

    /**
     * Builds the trajectory for a basic-masked spectrum.
     *
     * @param basic spectrum after basic masking, not refined
     * @param sigma clip multipliers
     * @param statistic clip center statistic
     * @return trajectory from the unclipped input to the converged clip
     */
    public IterationTrajectory record(MaskedSpectrum basic, SigmaLimits sigma, CenterStatistic statistic) {
        List<IterationTrajectory.Point> points = new ArrayList<>();
        points.add(pointOf(0, basic));

        int lastCount = basic.mask().unmaskedCount();
        for (int iteration = 1; ; iteration++) {
            MaskedSpectrum clipped = sigmaClipService.clip(basic, sigma, statistic, iteration).clipped();
            int count = clipped.mask().unmaskedCount();
            if (count == lastCount) {
                break;
            }
            points.add(pointOf(iteration, clipped));
            lastCount = count;
        }

        return new IterationTrajectory(points);
    }

    private static IterationTrajectory.Point pointOf(int iteration, MaskedSpectrum spectrum) {
        double[] values = spectrum.unmaskedValues();
        return new IterationTrajectory.Point(
                iteration,
                values.length,
                MaskedStatistics.median(values),
                MaskedStatistics.mean(values),
                MaskedStatistics.std(values));
    }
}
