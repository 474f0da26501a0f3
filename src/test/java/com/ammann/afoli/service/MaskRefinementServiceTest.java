/* (C)2026 */
package com.ammann.afoli.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.afoli.exception.MaskRangeException;
import com.ammann.afoli.model.Mask;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MaskRefinementServiceTest {

    private final MaskRefinementService service = new MaskRefinementService(new RegionEncodingService());

    @Test
    void dilateGrowsBandsOnBothSides() {
        Mask mask = Mask.of(false, false, false, true, false, false, false, false, false, false);

        assertThat(service.dilate(mask, 2))
                .isEqualTo(Mask.of(false, true, true, true, true, true, false, false, false, false));
    }

    @Test
    void dilateIsClippedAtSpectrumEnds() {
        Mask mask = Mask.of(true, false, false, false, false, false, false, false, false, true);

        assertThat(service.dilate(mask, 2))
                .isEqualTo(Mask.of(true, true, true, false, false, false, false, true, true, true));
    }

    @ParameterizedTest
    @ValueSource(ints = {5, 6, 100})
    void dilationOverHalfTheSpectrumIsRejected(int dilate) {
        Mask mask = Mask.none(10);

        assertThatThrownBy(() -> service.dilate(mask, dilate))
                .isInstanceOf(MaskRangeException.class)
                .hasMessageContaining("'dilate'");
        assertThatThrownBy(() -> service.refine(mask, dilate, 0, null, ProcessingLog.NONE))
                .isInstanceOf(MaskRangeException.class);
    }

    @Test
    void dilationJustBelowHalfIsAccepted() {
        Mask mask = Mask.of(false, false, false, false, true, false, false, false, false, false);

        assertThat(service.dilate(mask, 4).maskedCount()).isEqualTo(9);
    }

    @Test
    void narrowBandsAreReleased() {
        // widths 1, 2 and 3
        Mask mask = Mask.of(true, false, true, true, false, true, true, true, false);

        assertThat(service.filterMinWidth(mask, 2))
                .isEqualTo(Mask.of(false, false, false, false, false, true, true, true, false));
    }

    @Test
    void fullyMaskedSpectrumSurvivesWidthFilter() {
        assertThat(service.filterMinWidth(Mask.all(3), 5)).isEqualTo(Mask.all(3));
    }

    @Test
    void smallGapsBetweenBandsAreFilledInclusively() {
        Mask mask = Mask.of(true, true, false, false, true, false, false, false, true);

        assertThat(service.fillGaps(mask, 2))
                .isEqualTo(Mask.of(true, true, true, true, true, false, false, false, true));
    }

    @Test
    void gapsAtSpectrumEndsAreNeverFilled() {
        Mask mask = Mask.of(false, true, false, true, false);

        assertThat(service.fillGaps(mask, 5)).isEqualTo(Mask.of(false, true, true, true, false));
    }

    @Test
    void gapOfOneDisablesFilling() {
        Mask mask = Mask.of(true, false, true);

        assertThat(service.fillGaps(mask, 1)).isEqualTo(mask);
        assertThat(service.fillGaps(mask, null)).isEqualTo(mask);
    }

    @Test
    void dilationRunsBeforeWidthFilter() {
        Mask spike = Mask.of(false, false, false, false, false, true, false, false, false, false, false);

        assertThat(service.refine(spike, 0, 2, null, ProcessingLog.NONE).maskedCount()).isZero();
        assertThat(service.refine(spike, 1, 2, null, ProcessingLog.NONE).maskedCount()).isEqualTo(3);
    }

    @Test
    void refineLogsEveryActiveStep() {
        Mask mask = Mask.of(false, true, true, true, false, false, true, true, true, false, false, false);
        List<String> messages = new ArrayList<>();

        Mask refined = service.refine(mask, 0, 2, 3, messages::add);

        assertThat(refined).isEqualTo(
                Mask.of(false, true, true, true, true, true, true, true, true, false, false, false));
        assertThat(messages).containsExactly(
                "Removing small masked bands",
                "Minimum masked band width: 2",
                "Number of masked channels after unmasking small bands = 6/12",
                "Masking small gaps between masked bands",
                "Number of masked channels after masking consecutive = 8/12");
    }

    @Test
    void refineNeverMutatesInput() {
        Mask mask = Mask.of(true, false, false, true, true, true, false);
        Mask copy = Mask.of(mask.toArray());

        service.refine(mask, 1, 1, 2, ProcessingLog.NONE);

        assertThat(mask).isEqualTo(copy);
    }
}
