/* (C)2026 */
package com.ammann.afoli.model;

import java.util.List;

/**
 * Everything one AFOLI run produces for a spectrum.
 *
 * @param basic spectrum after edge, range and invalid-value masking
 * @param clippedMask mask after the sigma clip
 * @param refinedMask final mask after dilation and band filters
 * @param continuum mean of the channels left unmasked by {@code refinedMask}
 * @param spread population standard deviation of those channels
 * @param clipIterations sigma-clip iterations actually run
 * @param trajectory sigma-clip statistics per iteration
 * @param channelRanges masked bands of {@code refinedMask}
 * @param channelFlags {@code channelRanges} in channel-range notation
 * @param frequencyRanges masked bands in frequency, empty without a frequency axis
 * @param levelMasks one reconstructed mask per requested level
 */
public record AfoliResult(
        MaskedSpectrum basic,
        Mask clippedMask,
        Mask refinedMask,
        double continuum,
        double spread,
        int clipIterations,
        IterationTrajectory trajectory,
        List<ChannelRange> channelRanges,
        String channelFlags,
        List<FrequencyRange> frequencyRanges,
        List<LevelMask> levelMasks) {
    public AfoliResult {
        channelRanges = List.copyOf(channelRanges);
        frequencyRanges = List.copyOf(frequencyRanges);
        levelMasks = List.copyOf(levelMasks);
    }

    public int channelCount() {
        return refinedMask.length();
    }

    public int maskedCount() {
        return refinedMask.maskedCount();
    }
}
