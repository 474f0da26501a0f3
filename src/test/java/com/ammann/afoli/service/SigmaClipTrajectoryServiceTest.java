/* (C)2026 */
package com.ammann.afoli.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.afoli.enumeration.CenterStatistic;
import com.ammann.afoli.model.IterationTrajectory;
import com.ammann.afoli.model.Mask;
import com.ammann.afoli.model.MaskedSpectrum;
import com.ammann.afoli.model.SigmaLimits;
import com.ammann.afoli.model.Spectrum;
import com.ammann.afoli.support.TestSpectra;
import org.junit.jupiter.api.Test;

class SigmaClipTrajectoryServiceTest {

    private final SigmaClipService sigmaClipService = new SigmaClipService();
    private final SigmaClipTrajectoryService service = new SigmaClipTrajectoryService(sigmaClipService);

    @Test
    void recordsEveryChangeUntilConvergence() {
        MaskedSpectrum basic = new BasicMaskingService()
                .mask(TestSpectra.gaussianLine(), 5, null, null, ProcessingLog.NONE);

        IterationTrajectory trajectory = service.record(basic, SigmaLimits.DEFAULT, CenterStatistic.MEDIAN);

        assertThat(trajectory.unmaskedCounts()).containsExactly(40, 35, 31, 29, 28);
        assertThat(trajectory.get(0).iteration()).isZero();
        assertThat(trajectory.last().iteration()).isEqualTo(4);
        assertThat(trajectory.get(0).mean()).isCloseTo(2.0838, within(1e-3));
        assertThat(trajectory.last().mean()).isCloseTo(0.9600, within(1e-3));
    }

    @Test
    void lastPointMatchesConvergedClip() {
        MaskedSpectrum basic = new BasicMaskingService()
                .mask(TestSpectra.gaussianLine(2024L, 0.05), 5, null, null, ProcessingLog.NONE);

        IterationTrajectory trajectory = service.record(basic, SigmaLimits.DEFAULT, CenterStatistic.MEAN);
        var converged = sigmaClipService.clip(basic, SigmaLimits.DEFAULT, CenterStatistic.MEAN, null);

        assertThat(trajectory.last().unmaskedCount()).isEqualTo(converged.mask().unmaskedCount());
        assertThat(trajectory.last().std()).isEqualTo(converged.std());
        int[] counts = trajectory.unmaskedCounts();
        for (int i = 1; i < counts.length; i++) {
            assertThat(counts[i]).isLessThan(counts[i - 1]);
        }
    }

    @Test
    void flatSpectrumHasOnlyTheInitialPoint() {
        MaskedSpectrum flat = MaskedSpectrum.unmasked(Spectrum.of(1.0, 1.0, 1.0, 1.0));

        IterationTrajectory trajectory = service.record(flat, SigmaLimits.DEFAULT, CenterStatistic.MEDIAN);

        assertThat(trajectory.size()).isEqualTo(1);
        assertThat(trajectory.get(0).mean()).isEqualTo(1.0);
        assertThat(trajectory.get(0).std()).isZero();
    }

    @Test
    void fullyMaskedSpectrumRecordsNaNStatistics() {
        MaskedSpectrum masked = new MaskedSpectrum(Spectrum.of(1.0, 2.0), Mask.all(2));

        IterationTrajectory trajectory = service.record(masked, SigmaLimits.DEFAULT, CenterStatistic.MEDIAN);

        assertThat(trajectory.size()).isEqualTo(1);
        assertThat(trajectory.get(0).unmaskedCount()).isZero();
        assertThat(trajectory.get(0).mean()).isNaN();
    }
}
