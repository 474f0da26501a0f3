/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.exception.MaskRangeException;
import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.model.ChannelRange;
import com.ammann.afoli.model.Mask;
import com.ammann.afoli.model.MaskedSpectrum;
import com.ammann.afoli.model.Spectrum;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Deterministic, non-statistical masking applied before the sigma clip.
 *
 * <p>Masks non-finite samples, a fixed number of channels at both ends of the
 * spectrum, explicitly flagged channel ranges and channels holding sentinel values.
 */
@ApplicationScoped
public class BasicMaskingService {

    public static final String DEFAULT_RANGE_SEPARATOR = ",";

    /**
     * Builds the initial masked spectrum.
     *
     * @param spectrum input spectrum, left untouched
     * @param edges channels masked at each end, {@code 0 <= edges < N}
     * @param flaggedChannels channel ranges to mask; ends past the spectrum are clipped
     * @param invalidValues sentinel values to mask wherever they occur
     * @param log processing log
     * @return the spectrum paired with its initial mask
     * @throws MaskRangeException if {@code edges} would mask the entire spectrum
     */
    public MaskedSpectrum mask(
            Spectrum spectrum,
            int edges,
            List<ChannelRange> flaggedChannels,
            List<Double> invalidValues,
            ProcessingLog log) {
        int n = spectrum.length();
        if (edges >= n) {
            throw new MaskRangeException("extremes", edges, n, "masking the entire spectrum");
        }
        if (edges < 0) {
            throw ValidationException.invalidParameter("extremes", edges, "non-negative channel count");
        }

        boolean[] flags = new boolean[n];
        for (int i = 0; i < n; i++) {
            flags[i] = !Double.isFinite(spectrum.get(i));
        }

        if (edges > 0) {
            log.logf("Masking %d channels at extremes", edges);
            for (int i = 0; i < edges; i++) {
                flags[i] = true;
                flags[n - 1 - i] = true;
            }
        }

        if (flaggedChannels != null) {
            for (ChannelRange range : flaggedChannels) {
                log.logf("Masking channel range: %s", range.toCasa());
                int last = Math.min(range.end(), n - 1);
                for (int i = range.start(); i <= last; i++) {
                    flags[i] = true;
                }
            }
        }

        if (invalidValues != null) {
            for (double value : invalidValues) {
                log.logf("Masking invalid value: %s", value);
                for (int i = 0; i < n; i++) {
                    if (spectrum.get(i) == value) {
                        flags[i] = true;
                    }
                }
            }
        }

        return new MaskedSpectrum(spectrum, Mask.of(flags));
    }

    /** Numeric sentinel match: {@code -0.0} matches a {@code 0.0} sentinel. */
    static boolean matchesAny(double value, List<Double> sentinels) {
        for (double sentinel : sentinels) {
            if (value == sentinel) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses flagged channels written as {@code start~end} items, or bare channel
     * indices, joined by {@code separator}. Blank items are ignored.
     *
     * @throws ValidationException for items that are not channel ranges
     */
    public List<ChannelRange> parseChannelRanges(String text, String separator) {
        List<ChannelRange> ranges = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return ranges;
        }
        String sep = separator == null || separator.isEmpty() ? DEFAULT_RANGE_SEPARATOR : separator;
        for (String item : text.split(Pattern.quote(sep))) {
            String token = item.strip();
            if (token.isEmpty()) {
                continue;
            }
            ranges.add(parseRange(token));
        }
        return ranges;
    }

    private ChannelRange parseRange(String token) {
        String[] bounds = token.split("~", -1);
        try {
            if (bounds.length == 1) {
                return ChannelRange.single(Integer.parseInt(bounds[0].strip()));
            }
            if (bounds.length == 2) {
                return new ChannelRange(
                        Integer.parseInt(bounds[0].strip()),
                        Integer.parseInt(bounds[1].strip()));
            }
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid channel range '" + token + "'", e);
        }
        throw ValidationException.invalidParameter("flagchans", token, "start~end or a channel index");
    }
}
