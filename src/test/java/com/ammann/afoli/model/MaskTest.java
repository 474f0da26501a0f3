/* (C)2026 */
package com.ammann.afoli.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.afoli.exception.ValidationException;
import org.junit.jupiter.api.Test;

class MaskTest {

    @Test
    void countsMaskedAndUnmaskedChannels() {
        Mask mask = Mask.of(true, false, false, true, true);

        assertThat(mask.length()).isEqualTo(5);
        assertThat(mask.maskedCount()).isEqualTo(3);
        assertThat(mask.unmaskedCount()).isEqualTo(2);
        assertThat(mask.isMasked(0)).isTrue();
        assertThat(mask.isMasked(1)).isFalse();
        assertThat(mask.isFullyMasked()).isFalse();
    }

    @Test
    void factoriesBuildEmptyAndFullMasks() {
        assertThat(Mask.none(4).maskedCount()).isZero();
        assertThat(Mask.all(4).isFullyMasked()).isTrue();
    }

    @Test
    void isImmutableAgainstSourceAndCopyChanges() {
        boolean[] flags = {false, true};
        Mask mask = Mask.of(flags);

        flags[0] = true;
        mask.toArray()[1] = false;

        assertThat(mask).isEqualTo(Mask.of(false, true));
    }

    @Test
    void subsetRequiresEveryMaskedChannelInOther() {
        Mask small = Mask.of(false, true, false);
        Mask large = Mask.of(true, true, false);

        assertThat(small.isSubsetOf(large)).isTrue();
        assertThat(large.isSubsetOf(small)).isFalse();
        assertThat(small.isSubsetOf(Mask.none(2))).isFalse();
    }

    @Test
    void unionMasksChannelsOfEither() {
        Mask union = Mask.of(true, false, false).union(Mask.of(false, false, true));

        assertThat(union).isEqualTo(Mask.of(true, false, true));
    }

    @Test
    void unionRejectsDifferentLengths() {
        assertThatThrownBy(() -> Mask.none(3).union(Mask.none(4)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Length mismatch");
    }
}
