/* (C)2026 */
package com.ammann.afoli.support;

import com.ammann.afoli.model.Spectrum;
import com.ammann.afoli.service.AfoliService;
import com.ammann.afoli.service.BasicMaskingService;
import com.ammann.afoli.service.LevelReconstructionService;
import com.ammann.afoli.service.MaskRefinementService;
import com.ammann.afoli.service.RegionEncodingService;
import com.ammann.afoli.service.SigmaClipService;
import com.ammann.afoli.service.SigmaClipTrajectoryService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Random;

public final class TestSpectra {

    public static final int CHANNELS = 50;
    public static final int LINE_CENTER = 25;

    private TestSpectra() {}

    /**
     * Flat continuum of 1.0 with seeded Gaussian noise and a Gaussian line of
     * amplitude 9 and width 2 channels at channel 25.
     */
    public static Spectrum gaussianLine(long seed, double noise) {
        Random random = new Random(seed);
        double[] values = new double[CHANNELS];
        for (int i = 0; i < CHANNELS; i++) {
            double offset = (i - LINE_CENTER) / 2.0;
            values[i] = 1.0 + noise * random.nextGaussian() + 9.0 * Math.exp(-0.5 * offset * offset);
        }
        return Spectrum.of(values);
    }

    public static Spectrum gaussianLine() {
        return gaussianLine(42L, 0.05);
    }

    public static AfoliService afoliService(MeterRegistry meterRegistry) {
        RegionEncodingService regionEncoder = new RegionEncodingService();
        SigmaClipService sigmaClipService = new SigmaClipService();
        return new AfoliService(
                new BasicMaskingService(),
                sigmaClipService,
                new MaskRefinementService(regionEncoder),
                regionEncoder,
                new SigmaClipTrajectoryService(sigmaClipService),
                new LevelReconstructionService(regionEncoder),
                meterRegistry);
    }
}
