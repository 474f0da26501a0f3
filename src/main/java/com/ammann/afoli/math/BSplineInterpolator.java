/* (C)2026 */
package com.ammann.afoli.math;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.MathArrays;

/**
 * Interpolating B-spline of degree 2 or 3 through a set of points.
 *
 * <p>The knot vector follows the not-a-knot construction: for odd degrees the
 * interior knots are the data sites without the first and last {@code (k+1)/2}
 * of them, for degree 2 they are the midpoints between sites without the first and
 * last one. Boundary knots are repeated {@code k+1} times. The coefficients solve
 * the collocation system {@code B(x_i) c = y_i}.
 */
public class BSplineInterpolator implements UnivariateInterpolator {

    private final int degree;

    public BSplineInterpolator(int degree) {
        if (degree < 2 || degree > 3) {
            throw new IllegalArgumentException("Only quadratic and cubic splines are supported, got degree " + degree);
        }
        this.degree = degree;
    }

    @Override
    public UnivariateFunction interpolate(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new DimensionMismatchException(x.length, y.length);
        }
        if (x.length < degree + 1) {
            throw new NumberIsTooSmallException(
                    LocalizedFormats.NUMBER_OF_POINTS, x.length, degree + 1, true);
        }
        MathArrays.checkOrder(x);

        int n = x.length;
        double[] knots = knots(x);
        RealMatrix collocation = new Array2DRowRealMatrix(n, n);
        for (int i = 0; i < n; i++) {
            int span = findSpan(knots, n, x[i]);
            double[] basis = basisFunctions(knots, span, x[i]);
            for (int r = 0; r <= degree; r++) {
                collocation.setEntry(i, span - degree + r, basis[r]);
            }
        }
        RealVector coefficients = new LUDecomposition(collocation)
                .getSolver()
                .solve(new ArrayRealVector(y, false));

        return new BSplineFunction(knots, coefficients.toArray(), x[0], x[n - 1]);
    }

    private double[] knots(double[] x) {
        int n = x.length;
        double[] interior;
        if (degree == 2) {
            // midpoints between sites, dropping the first and the last one
            interior = new double[Math.max(0, n - 3)];
            for (int i = 0; i < interior.length; i++) {
                interior[i] = (x[i + 1] + x[i + 2]) / 2.0;
            }
        } else {
            int m = (degree - 1) / 2;
            interior = new double[Math.max(0, n - 2 * m - 2)];
            System.arraycopy(x, m + 1, interior, 0, interior.length);
        }

        double[] knots = new double[n + degree + 1];
        for (int i = 0; i <= degree; i++) {
            knots[i] = x[0];
            knots[knots.length - 1 - i] = x[n - 1];
        }
        System.arraycopy(interior, 0, knots, degree + 1, interior.length);
        return knots;
    }

    /** Index {@code mu} with {@code knots[mu] <= t < knots[mu + 1]}, clamped to the last span. */
    private int findSpan(double[] knots, int coefficientCount, double t) {
        if (t >= knots[coefficientCount]) {
            return coefficientCount - 1;
        }
        if (t <= knots[degree]) {
            return degree;
        }
        int low = degree;
        int high = coefficientCount;
        int mid = (low + high) / 2;
        while (t < knots[mid] || t >= knots[mid + 1]) {
            if (t < knots[mid]) {
                high = mid;
            } else {
                low = mid;
            }
            mid = (low + high) / 2;
        }
        return mid;
    }

    /** Non-zero basis functions {@code B_{span-degree}..B_{span}} at {@code t}. */
    private double[] basisFunctions(double[] knots, int span, double t) {
        double[] values = new double[degree + 1];
        double[] left = new double[degree + 1];
        double[] right = new double[degree + 1];
        values[0] = 1.0;
        for (int j = 1; j <= degree; j++) {
            left[j] = t - knots[span + 1 - j];
            right[j] = knots[span + j] - t;
            double saved = 0.0;
            for (int r = 0; r < j; r++) {
                double temp = values[r] / (right[r + 1] + left[j - r]);
                values[r] = saved + right[r + 1] * temp;
                saved = left[j - r] * temp;
            }
            values[j] = saved;
        }
        return values;
    }

    /**
     * Spline built by {@link BSplineInterpolator}. Outside the data range it returns
     * the value at the nearest end.
     */
    public final class BSplineFunction implements UnivariateFunction {
        private final double[] knots;
        private final double[] coefficients;
        private final double lowerBound;
        private final double upperBound;

        private BSplineFunction(double[] knots, double[] coefficients, double lowerBound, double upperBound) {
            this.knots = knots;
            this.coefficients = coefficients;
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
        }

        @Override
        public double value(double t) {
            double clamped = Math.max(lowerBound, Math.min(upperBound, t));
            int span = findSpan(knots, coefficients.length, clamped);
            double[] basis = basisFunctions(knots, span, clamped);
            double sum = 0.0;
            for (int r = 0; r <= degree; r++) {
                sum += coefficients[span - degree + r] * basis[r];
            }
            return sum;
        }
    }
}
