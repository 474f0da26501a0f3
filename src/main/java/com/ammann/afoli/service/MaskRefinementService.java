/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.exception.MaskRangeException;
import com.ammann.afoli.model.ChannelRange;
import com.ammann.afoli.model.Mask;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;

/**
 * Morphological clean-up of a sigma-clipped mask.
 *
 * <p>Applied in a fixed order: dilation, then release of narrow bands, then filling
 * of small gaps between bands. Every step returns a new mask.
 */
@ApplicationScoped
public class MaskRefinementService {

    private final RegionEncodingService regionEncoder;

    @Inject
    public MaskRefinementService(RegionEncodingService regionEncoder) {
        this.regionEncoder = regionEncoder;
    }

    /**
     * Runs the three refinement steps.
     *
     * @param mask sigma-clipped mask
     * @param dilate channels added on each side of every band
     * @param minWidth bands of this width or narrower are released
     * @param minGap gaps of this width or narrower between bands are masked, {@code null} to skip
     * @param log processing log
     * @return the refined mask
     * @throws MaskRangeException if {@code dilate} reaches half the spectrum
     */
    public Mask refine(Mask mask, int dilate, int minWidth, Integer minGap, ProcessingLog log) {
        int total = mask.length();
        checkDilation(dilate, total);

        Mask refined = mask;
        if (dilate > 0) {
            log.logf("Dilating the mask %d times", dilate);
            refined = dilate(refined, dilate);
            log.logf("Number of masked channels after dilating = %d/%d", refined.maskedCount(), total);
        }

        if (minWidth > 0) {
            log.log("Removing small masked bands");
            log.logf("Minimum masked band width: %d", minWidth);
            refined = filterMinWidth(refined, minWidth);
            log.logf("Number of masked channels after unmasking small bands = %d/%d",
                    refined.maskedCount(), total);
        }

        if (minGap != null && minGap > 1) {
            log.log("Masking small gaps between masked bands");
            refined = fillGaps(refined, minGap);
            log.logf("Number of masked channels after masking consecutive = %d/%d",
                    refined.maskedCount(), total);
        }

        return refined;
    }

    /**
     * Grows every masked band by {@code iterations} channels on both sides, clipped to
     * the spectrum.
     *
     * @throws MaskRangeException if {@code iterations} reaches half the spectrum
     */
    public Mask dilate(Mask mask, int iterations) {
        checkDilation(iterations, mask.length());
        if (iterations <= 0) {
            return mask;
        }
        int n = mask.length();
        boolean[] flags = new boolean[n];
        for (ChannelRange band : regionEncoder.group(mask)) {
            int from = Math.max(0, band.start() - iterations);
            int to = Math.min(n - 1, band.end() + iterations);
            for (int i = from; i <= to; i++) {
                flags[i] = true;
            }
        }
        return Mask.of(flags);
    }

    /**
     * Releases every masked band whose width does not exceed {@code minWidth}. A fully
     * masked spectrum is returned unchanged.
     */
    public Mask filterMinWidth(Mask mask, int minWidth) {
        if (minWidth <= 0 || mask.isFullyMasked()) {
            return mask;
        }
        boolean[] flags = mask.toArray();
        for (ChannelRange band : regionEncoder.group(mask)) {
            if (band.width() <= minWidth) {
                for (int i = band.start(); i <= band.end(); i++) {
                    flags[i] = false;
                }
            }
        }
        return Mask.of(flags);
    }

    /**
     * Masks every unmasked gap of at most {@code minGap} channels lying between two
     * masked bands, merging them into one band. Gaps at either end of the spectrum are
     * left alone.
     */
    public Mask fillGaps(Mask mask, Integer minGap) {
        if (minGap == null || minGap <= 1) {
            return mask;
        }
        List<ChannelRange> bands = regionEncoder.group(mask);
        boolean[] flags = mask.toArray();
        for (int k = 1; k < bands.size(); k++) {
            int gapStart = bands.get(k - 1).end() + 1;
            int gapEnd = bands.get(k).start() - 1;
            if (gapEnd - gapStart + 1 <= minGap) {
                for (int i = gapStart; i <= gapEnd; i++) {
                    flags[i] = true;
                }
            }
        }
        return Mask.of(flags);
    }

    static void checkDilation(int dilate, int channels) {
        if (dilate >= channels / 2.0) {
            throw new MaskRangeException("dilate", dilate, channels, "dilating lines over the whole spectrum");
        }
    }
}
