/* (C)2026 */
package com.ammann.afoli.model;

import java.util.List;

/**
 * Mask reconstructed for one contamination level.
 *
 * @param level requested fractional deviation from the converged continuum
 * @param continuum continuum value at that level
 * @param spread standard deviation at that level
 * @param mask channels rejected around {@code continuum}
 * @param ranges masked bands of {@code mask}
 * @param interpolated {@code true} when the value was found by interpolating the
 *     trajectory, {@code false} when the nearest trajectory point was used
 * @param iteration fractional trajectory index of the root, NaN for nearest-point values
 */
public record LevelMask(
        double level,
        double continuum,
        double spread,
        Mask mask,
        List<ChannelRange> ranges,
        boolean interpolated,
        double iteration) {
    public LevelMask {
        ranges = List.copyOf(ranges);
    }
}
