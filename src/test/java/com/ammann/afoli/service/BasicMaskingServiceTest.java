/* (C)2026 */
package com.ammann.afoli.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.afoli.exception.MaskRangeException;
import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.model.ChannelRange;
import com.ammann.afoli.model.Mask;
import com.ammann.afoli.model.MaskedSpectrum;
import com.ammann.afoli.model.Spectrum;
import com.ammann.afoli.support.TestSpectra;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link BasicMaskingService}.
 */
class BasicMaskingServiceTest {

    private final BasicMaskingService service = new BasicMaskingService();

    @Test
    void masksEdgesOnBothEndsOnly() {
        Spectrum spectrum = Spectrum.of(1, 1, 1, 1, 1, 1, 1, 1);

        MaskedSpectrum masked = service.mask(spectrum, 2, List.of(), List.of(), ProcessingLog.NONE);

        assertThat(masked.mask()).isEqualTo(Mask.of(true, true, false, false, false, false, true, true));
        assertThat(masked.spectrum()).isSameAs(spectrum);
    }

    @Test
    void zeroEdgesMasksNothing() {
        MaskedSpectrum masked = service.mask(Spectrum.of(1, 2, 3), 0, null, null, ProcessingLog.NONE);

        assertThat(masked.mask().maskedCount()).isZero();
    }

    @Test
    void edgesCoveringTheSpectrumAreARangeError() {
        Spectrum spectrum = TestSpectra.gaussianLine();
        double[] before = spectrum.values();

        assertThatThrownBy(() -> service.mask(spectrum, 50, List.of(), List.of(), ProcessingLog.NONE))
                .isInstanceOf(MaskRangeException.class)
                .hasMessageContaining("extremes");
        assertThat(spectrum.values()).containsExactly(before);
    }

    @Test
    void negativeEdgesAreRejected() {
        assertThatThrownBy(() -> service.mask(Spectrum.of(1, 2, 3), -1, List.of(), List.of(), ProcessingLog.NONE))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void masksNonFiniteChannels() {
        Spectrum spectrum = Spectrum.of(1, Double.NaN, 1, Double.POSITIVE_INFINITY, 1);

        MaskedSpectrum masked = service.mask(spectrum, 0, List.of(), List.of(), ProcessingLog.NONE);

        assertThat(masked.mask()).isEqualTo(Mask.of(false, true, false, true, false));
    }

    @Test
    void masksFlaggedRangesClippedToSpectrum() {
        Spectrum spectrum = Spectrum.of(1, 1, 1, 1, 1, 1);
        List<ChannelRange> ranges = List.of(ChannelRange.single(1), new ChannelRange(4, 20));

        MaskedSpectrum masked = service.mask(spectrum, 0, ranges, List.of(), ProcessingLog.NONE);

        assertThat(masked.mask()).isEqualTo(Mask.of(false, true, false, false, true, true));
    }

    @Test
    void masksSentinelValuesAndLogsEachStep() {
        Spectrum spectrum = Spectrum.of(1, -999, 1, 1, -999, 1, 1);
        List<String> messages = new ArrayList<>();

        MaskedSpectrum masked = service.mask(
                spectrum, 1, List.of(ChannelRange.single(3)), List.of(-999.0), messages::add);

        assertThat(masked.mask()).isEqualTo(Mask.of(true, true, false, true, true, false, true));
        assertThat(messages).containsExactly(
                "Masking 1 channels at extremes",
                "Masking channel range: 3",
                "Masking invalid value: -999.0");
    }

    @Test
    void parsesChannelRangesAndSingleChannels() {
        List<ChannelRange> ranges = service.parseChannelRanges("10~20, 35,, 40~41", ",");

        assertThat(ranges).containsExactly(
                new ChannelRange(10, 20), ChannelRange.single(35), new ChannelRange(40, 41));
    }

    @Test
    void blankRangeTextIsEmpty() {
        assertThat(service.parseChannelRanges("  ", ",")).isEmpty();
        assertThat(service.parseChannelRanges(null, ",")).isEmpty();
    }

    @Test
    void rejectsMalformedRangeItems() {
        assertThatThrownBy(() -> service.parseChannelRanges("1~x", ","))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.parseChannelRanges("1~2~3", ","))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.parseChannelRanges("8~2", ","))
                .isInstanceOf(ValidationException.class);
    }
}
