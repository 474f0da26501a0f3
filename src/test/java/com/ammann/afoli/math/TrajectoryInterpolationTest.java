/* (C)2026 */
package com.ammann.afoli.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.afoli.model.LevelMode;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TrajectoryInterpolationTest {

    private static final double[] X = {0, 1, 2, 3};
    private static final double[] Y = {10, 20, 40, 80};

    @ParameterizedTest
    @CsvSource({
            "0.25, 10, 10, 20",
            "0.5, 10, 10, 20",
            "0.75, 20, 10, 20",
            "2.0, 40, 40, 40",
            "2.6, 80, 40, 80"
    })
    void stepRules(double t, double nearest, double previous, double next) {
        assertThat(TrajectoryInterpolation.interpolate(LevelMode.NEAREST, X, Y).value(t)).isEqualTo(nearest);
        assertThat(TrajectoryInterpolation.interpolate(LevelMode.PREVIOUS, X, Y).value(t)).isEqualTo(previous);
        assertThat(TrajectoryInterpolation.interpolate(LevelMode.NEXT, X, Y).value(t)).isEqualTo(next);
    }

    @Test
    void linearInterpolatesAndClamps() {
        UnivariateFunction linear = TrajectoryInterpolation.interpolate(LevelMode.LINEAR, X, Y);

        assertThat(linear.value(1.5)).isCloseTo(30.0, within(1e-12));
        assertThat(linear.value(-2.0)).isEqualTo(10.0);
        assertThat(linear.value(7.0)).isEqualTo(80.0);
    }

    @Test
    void lowSplineOrdersMatchStepAndLinear() {
        assertThat(TrajectoryInterpolation.interpolate(LevelMode.spline(0), X, Y).value(1.9)).isEqualTo(20.0);
        assertThat(TrajectoryInterpolation.interpolate(LevelMode.spline(1), X, Y).value(1.5))
                .isCloseTo(30.0, within(1e-12));
    }

    @Test
    void cubicSplineUsesBSpline() {
        double[] y = {0, 1, 8, 27};

        UnivariateFunction cubic = TrajectoryInterpolation.interpolate(LevelMode.spline(3), X, y);

        assertThat(cubic.value(1.5)).isCloseTo(3.375, within(1e-9));
    }

    @Test
    void rejectsTooFewPointsForOrder() {
        assertThatThrownBy(() -> TrajectoryInterpolation.interpolate(
                        LevelMode.spline(3), new double[] {0, 1, 2}, new double[] {1, 2, 3}))
                .isInstanceOf(NumberIsTooSmallException.class);
    }

    @Test
    void rejectsLengthMismatch() {
        assertThatThrownBy(() -> TrajectoryInterpolation.interpolate(LevelMode.LINEAR, X, new double[] {1, 2}))
                .isInstanceOf(DimensionMismatchException.class);
    }
}
