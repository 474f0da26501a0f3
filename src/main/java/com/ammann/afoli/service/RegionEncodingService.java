/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.model.ChannelRange;
import com.ammann.afoli.model.FrequencyAxis;
import com.ammann.afoli.model.FrequencyRange;
import com.ammann.afoli.model.Mask;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts masks into contiguous channel bands and into the text notations consumed
 * by the imaging engine.
 *
 * <p>Channel notation: {@code 3;6~8} (single channels as their index, ranges with an
 * inclusive end). Frequency notation: {@code 230.5000000000~230.6000000000GHz}, one
 * range per line, the unit attached to the upper bound.
 */
@ApplicationScoped
public class RegionEncodingService {

    public static final String DEFAULT_CHANNEL_SEPARATOR = ";";
    public static final String DEFAULT_FREQUENCY_SEPARATOR = "\n";

    private static final Pattern FREQUENCY_RANGE =
            Pattern.compile("^\\s*([-+0-9.eE]+)\\s*~\\s*([-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)\\s*(\\S+)\\s*$");

    /**
     * Maximal contiguous masked bands in ascending channel order.
     */
    public List<ChannelRange> group(Mask mask) {
        List<ChannelRange> ranges = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < mask.length(); i++) {
            if (mask.isMasked(i)) {
                if (start < 0) {
                    start = i;
                }
            } else if (start >= 0) {
                ranges.add(new ChannelRange(start, i - 1));
                start = -1;
            }
        }
        if (start >= 0) {
            ranges.add(new ChannelRange(start, mask.length() - 1));
        }
        return ranges;
    }

    /**
     * Rebuilds a mask of the given length from channel bands.
     *
     * @throws ValidationException if a band reaches past the last channel
     */
    public Mask toMask(List<ChannelRange> ranges, int length) {
        boolean[] flags = new boolean[length];
        for (ChannelRange range : ranges) {
            if (range.end() >= length) {
                throw ValidationException.invalidParameter(
                        "range", range.toCasa(), "channels below " + length);
            }
            for (int i = range.start(); i <= range.end(); i++) {
                flags[i] = true;
            }
        }
        return Mask.of(flags);
    }

    public String encodeChannels(List<ChannelRange> ranges) {
        return encodeChannels(ranges, DEFAULT_CHANNEL_SEPARATOR);
    }

    /**
     * Joins the bands in channel notation.
     */
    public String encodeChannels(List<ChannelRange> ranges, String separator) {
        return ranges.stream()
                .map(ChannelRange::toCasa)
                .collect(Collectors.joining(separator));
    }

    /**
     * Frequency interval of every masked band. Each band spans from the frequency of
     * its first channel to that of its last, ordered ascending and widened by half a
     * channel on both sides.
     *
     * @throws ValidationException if mask and axis differ in length
     */
    public List<FrequencyRange> encodeFrequencies(FrequencyAxis axis, Mask mask) {
        if (axis.length() != mask.length()) {
            throw ValidationException.lengthMismatch("mask", mask.length(), "frequency axis", axis.length());
        }
        double delta = axis.halfChannelWidth();
        List<FrequencyRange> ranges = new ArrayList<>();
        for (ChannelRange band : group(mask)) {
            double first = axis.get(band.start());
            double last = axis.get(band.end());
            ranges.add(new FrequencyRange(
                    Math.min(first, last) - delta,
                    Math.max(first, last) + delta,
                    axis.unit()));
        }
        return ranges;
    }

    public String formatFrequencies(List<FrequencyRange> ranges) {
        return formatFrequencies(ranges, DEFAULT_FREQUENCY_SEPARATOR);
    }

    /**
     * Joins frequency ranges in frequency notation.
     */
    public String formatFrequencies(List<FrequencyRange> ranges, String separator) {
        return ranges.stream()
                .map(FrequencyRange::toCasa)
                .collect(Collectors.joining(separator));
    }

    /**
     * Parses a frequency block, one {@code lower~upper<unit>} range per line. Blank
     * lines are skipped.
     *
     * @throws ValidationException for lines that are not frequency ranges
     */
    public List<FrequencyRange> parseFrequencies(String text) {
        List<FrequencyRange> ranges = new ArrayList<>();
        if (text == null) {
            return ranges;
        }
        for (String line : text.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            var matcher = FREQUENCY_RANGE.matcher(line);
            if (!matcher.matches()) {
                throw ValidationException.invalidParameter("frequency range", line, "lower~upper<unit>");
            }
            try {
                ranges.add(new FrequencyRange(
                        Double.parseDouble(matcher.group(1)),
                        Double.parseDouble(matcher.group(2)),
                        matcher.group(3)));
            } catch (NumberFormatException e) {
                throw new ValidationException("Invalid frequency range '" + line + "'", e);
            }
        }
        return ranges;
    }
}
