/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;

/**
 * Inclusive range of channel indices forming one contiguous masked band.
 *
 * @param start first channel of the band
 * @param end last channel of the band, never below {@code start}
 */
public record ChannelRange(int start, int end) {

    public ChannelRange {
        if (start < 0) {
            throw ValidationException.invalidParameter("start", start, "non-negative channel");
        }
        if (end < start) {
            throw ValidationException.invalidParameter("end", end, "channel >= " + start);
        }
    }

    /** Range covering a single channel. */
    public static ChannelRange single(int channel) {
        return new ChannelRange(channel, channel);
    }

    public int width() {
        return end - start + 1;
    }

    /** Renders the range as {@code start~end}, or as the bare index for one channel. */
    public String toCasa() {
        return start == end ? Integer.toString(start) : start + "~" + end;
    }
}
