/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.math.MaskedStatistics;
import com.ammann.afoli.model.AfoliParameters;
import com.ammann.afoli.model.AfoliResult;
import com.ammann.afoli.model.ChannelRange;
import com.ammann.afoli.model.FrequencyAxis;
import com.ammann.afoli.model.FrequencyRange;
import com.ammann.afoli.model.IterationTrajectory;
import com.ammann.afoli.model.LevelMask;
import com.ammann.afoli.model.Mask;
import com.ammann.afoli.model.MaskedSpectrum;
import com.ammann.afoli.model.Spectrum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Runs the complete AFOLI pipeline on one spectrum.
 *
 * <p>Stages: basic masking, sigma clipping, mask refinement, continuum estimate,
 * trajectory recording and, when levels are requested, level reconstruction.
 * Range checks on the parameters run before any masking so that a rejected request
 * leaves nothing half done.
 */
@ApplicationScoped
public class AfoliService {

    private static final Logger LOG = Logger.getLogger(AfoliService.class);

    private final BasicMaskingService basicMaskingService;
    private final SigmaClipService sigmaClipService;
    private final MaskRefinementService maskRefinementService;
    private final RegionEncodingService regionEncoder;
    private final SigmaClipTrajectoryService trajectoryService;
    private final LevelReconstructionService levelReconstructionService;

    private Counter runsCounter;
    private Counter levelFallbackCounter;

    @Inject
    public AfoliService(
            BasicMaskingService basicMaskingService,
            SigmaClipService sigmaClipService,
            MaskRefinementService maskRefinementService,
            RegionEncodingService regionEncoder,
            SigmaClipTrajectoryService trajectoryService,
            LevelReconstructionService levelReconstructionService,
            Instance<MeterRegistry> meterRegistry) {
        this(basicMaskingService, sigmaClipService, maskRefinementService, regionEncoder,
                trajectoryService, levelReconstructionService,
                meterRegistry.isResolvable() ? meterRegistry.get() : null);
    }

    public AfoliService(
            BasicMaskingService basicMaskingService,
            SigmaClipService sigmaClipService,
            MaskRefinementService maskRefinementService,
            RegionEncodingService regionEncoder,
            SigmaClipTrajectoryService trajectoryService,
            LevelReconstructionService levelReconstructionService,
            MeterRegistry meterRegistry) {
        this.basicMaskingService = basicMaskingService;
        this.sigmaClipService = sigmaClipService;
        this.maskRefinementService = maskRefinementService;
        this.regionEncoder = regionEncoder;
        this.trajectoryService = trajectoryService;
        this.levelReconstructionService = levelReconstructionService;
        initMetrics(meterRegistry);
    }

    private void initMetrics(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        runsCounter =
                Counter.builder("afoli_runs_total")
                        .description("Total number of AFOLI runs completed")
                        .register(meterRegistry);

        levelFallbackCounter =
                Counter.builder("afoli_level_fallback_total")
                        .description("Level masks computed from the nearest trajectory point")
                        .register(meterRegistry);
    }

    /**
     * Runs AFOLI.
     *
     * @param spectrum input spectrum
     * @param frequencies frequency axis of the spectrum, {@code null} to skip frequency ranges
     * @param parameters run parameters
     * @param log processing log
     * @return masks, continuum and ranges of the run
     * @throws com.ammann.afoli.exception.MaskRangeException if {@code extremes} or
     *     {@code dilate} do not fit the spectrum
     */
    public AfoliResult afoli(
            Spectrum spectrum,
            FrequencyAxis frequencies,
            AfoliParameters parameters,
            ProcessingLog log) {
        int total = spectrum.length();
        if (frequencies != null && frequencies.length() != total) {
            throw ValidationException.lengthMismatch("spectrum", total, "frequency axis", frequencies.length());
        }
        MaskRefinementService.checkDilation(parameters.dilate(), total);

        log.logf("Number of channels = %d", total);
        MaskedSpectrum basic = basicMaskingService.mask(
                spectrum,
                parameters.extremes(),
                parameters.flaggedChannels(),
                parameters.invalidValues(),
                log);
        log.logf("Number of masked channels after basic masking = %d/%d", basic.mask().maskedCount(), total);

        log.logf("Sigma clipping with sigma = (%s, %s), cenfunc = %s",
                parameters.sigma().lower(), parameters.sigma().upper(),
                parameters.centerStatistic().configName());
        SigmaClipService.SigmaClipResult clip = sigmaClipService.clip(
                basic, parameters.sigma(), parameters.centerStatistic(), parameters.maxIterations());
        Mask clipped = clip.mask();
        log.logf("Sigma clip converged after %d iterations", clip.iterations());
        log.logf("Number of masked channels after sigma clip = %d/%d", clipped.maskedCount(), total);

        // band filters may release isolated invalid channels, which must stay out of the continuum
        Mask refined = maskRefinementService.refine(
                        clipped, parameters.dilate(), parameters.minWidth(), parameters.minGap(), log)
                .union(invalidChannels(spectrum, parameters.invalidValues()));

        MaskedSpectrum continuumChannels = basic.withMask(refined);
        double continuum = MaskedStatistics.mean(continuumChannels);
        double spread = MaskedStatistics.std(continuumChannels);
        log.logf("Continuum level = %s +/- %s", continuum, spread);

        IterationTrajectory trajectory =
                trajectoryService.record(basic, parameters.sigma(), parameters.centerStatistic());
        log.logf("Recorded %d sigma-clip trajectory points", trajectory.size());

        List<ChannelRange> ranges = regionEncoder.group(refined);
        String channelFlags = regionEncoder.encodeChannels(ranges);
        log.logf("Flagged channels: %s", channelFlags);

        List<FrequencyRange> frequencyRanges = List.of();
        if (frequencies != null) {
            frequencyRanges = regionEncoder.encodeFrequencies(frequencies, refined);
            log.logf("Flagged frequency ranges: %d", frequencyRanges.size());
        }

        List<LevelMask> levelMasks = List.of();
        if (parameters.hasLevels()) {
            levelMasks = levelReconstructionService.reconstruct(
                    basic,
                    parameters.levels(),
                    trajectory,
                    continuum,
                    parameters.sigma(),
                    parameters.levelMode(),
                    log);
            countFallbacks(levelMasks);
        }

        if (runsCounter != null) {
            runsCounter.increment();
        }
        LOG.debugf("AFOLI run finished: %d/%d channels masked, continuum=%f",
                Integer.valueOf(refined.maskedCount()), Integer.valueOf(total), Double.valueOf(continuum));

        return new AfoliResult(
                basic,
                clipped,
                refined,
                continuum,
                spread,
                clip.iterations(),
                trajectory,
                ranges,
                channelFlags,
                frequencyRanges,
                levelMasks);
    }

    private static Mask invalidChannels(Spectrum spectrum, List<Double> invalidValues) {
        boolean[] flags = new boolean[spectrum.length()];
        for (int i = 0; i < flags.length; i++) {
            double value = spectrum.get(i);
            flags[i] = !Double.isFinite(value) || BasicMaskingService.matchesAny(value, invalidValues);
        }
        return Mask.of(flags);
    }

    private void countFallbacks(List<LevelMask> levelMasks) {
        if (levelFallbackCounter == null) {
            return;
        }
        for (LevelMask levelMask : levelMasks) {
            if (!levelMask.interpolated()) {
                levelFallbackCounter.increment();
            }
        }
    }
}
