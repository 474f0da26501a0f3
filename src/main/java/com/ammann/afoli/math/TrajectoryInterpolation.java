/* (C)2026 */
package com.ammann.afoli.math;

import com.ammann.afoli.model.LevelMode;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.util.MathArrays;

/**
 * Builds the interpolants used to search the sigma-clip trajectory.
 *
 * <p>Every interpolant is defined over {@code [x[0], x[n-1]]} and returns the first
 * or last sample outside it.
 */
public final class TrajectoryInterpolation {

    private TrajectoryInterpolation() {}

    /**
     * Interpolates {@code y} over the strictly increasing sites {@code x}.
     *
     * @throws NumberIsTooSmallException if there are fewer points than
     *     {@link LevelMode#minimumPoints()}
     */
    public static UnivariateFunction interpolate(LevelMode mode, double[] x, double[] y) {
        if (x.length != y.length) {
            throw new DimensionMismatchException(x.length, y.length);
        }
        if (x.length < mode.minimumPoints()) {
            throw new NumberIsTooSmallException(
                    LocalizedFormats.NUMBER_OF_POINTS, x.length, mode.minimumPoints(), true);
        }
        MathArrays.checkOrder(x);

        return switch (mode.kind()) {
            case LINEAR -> linear(x, y);
            case NEAREST -> new StepFunction(x, y, StepFunction.Rule.NEAREST);
            case PREVIOUS -> new StepFunction(x, y, StepFunction.Rule.PREVIOUS);
            case NEXT -> new StepFunction(x, y, StepFunction.Rule.NEXT);
            case SPLINE -> spline(mode.order(), x, y);
        };
    }

    private static UnivariateFunction spline(int order, double[] x, double[] y) {
        return switch (order) {
            case 0 -> new StepFunction(x, y, StepFunction.Rule.PREVIOUS);
            case 1 -> linear(x, y);
            default -> new BSplineInterpolator(order).interpolate(x, y);
        };
    }

    private static UnivariateFunction linear(double[] x, double[] y) {
        UnivariateFunction function = new LinearInterpolator().interpolate(x, y);
        double first = x[0];
        double last = x[x.length - 1];
        return t -> function.value(Math.max(first, Math.min(last, t)));
    }

    /**
     * Piecewise constant interpolant.
     */
    static final class StepFunction implements UnivariateFunction {
        enum Rule {
            /** Value of the closest site; halfway between two sites takes the lower one. */
            NEAREST,
            /** Value of the last site at or before the argument. */
            PREVIOUS,
            /** Value of the first site at or after the argument. */
            NEXT
        }

        private final double[] x;
        private final double[] y;
        private final Rule rule;

        StepFunction(double[] x, double[] y, Rule rule) {
            this.x = x.clone();
            this.y = y.clone();
            this.rule = rule;
        }

        @Override
        public double value(double t) {
            int last = x.length - 1;
            if (t <= x[0]) {
                return y[0];
            }
            if (t >= x[last]) {
                return y[last];
            }
            // x[i] < t < x[i + 1] unless t sits on a site
            int i = 0;
            while (x[i + 1] <= t) {
                i++;
            }
            if (x[i] == t) {
                return y[i];
            }
            return switch (rule) {
                case PREVIOUS -> y[i];
                case NEXT -> y[i + 1];
                case NEAREST -> t <= (x[i] + x[i + 1]) / 2.0 ? y[i] : y[i + 1];
            };
        }
    }
}
