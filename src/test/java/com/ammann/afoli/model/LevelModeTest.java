/* (C)2026 */
package com.ammann.afoli.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.afoli.exception.ValidationException;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class LevelModeTest {

    static Stream<Arguments> names() {
        return Stream.of(
                Arguments.of("linear", LevelMode.LINEAR),
                Arguments.of("Nearest", LevelMode.NEAREST),
                Arguments.of("previous", LevelMode.PREVIOUS),
                Arguments.of("next", LevelMode.NEXT),
                Arguments.of("zero", LevelMode.spline(0)),
                Arguments.of("slinear", LevelMode.spline(1)),
                Arguments.of("quadratic", LevelMode.spline(2)),
                Arguments.of("cubic", LevelMode.spline(3)),
                Arguments.of(" 2 ", LevelMode.spline(2)));
    }

    @ParameterizedTest
    @MethodSource("names")
    void parsesKnownNames(String text, LevelMode expected) {
        assertThat(LevelMode.parse(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"spline", "4", "-1", ""})
    void rejectsUnknownNamesAndOrders(String text) {
        assertThatThrownBy(() -> LevelMode.parse(text))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("level_mode");
    }

    @Test
    void minimumPointsGrowsWithSplineOrder() {
        assertThat(LevelMode.NEAREST.minimumPoints()).isEqualTo(2);
        assertThat(LevelMode.spline(1).minimumPoints()).isEqualTo(2);
        assertThat(LevelMode.spline(2).minimumPoints()).isEqualTo(3);
        assertThat(LevelMode.spline(3).minimumPoints()).isEqualTo(4);
    }
}
