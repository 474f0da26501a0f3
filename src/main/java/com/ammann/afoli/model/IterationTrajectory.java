/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;
import java.util.List;

/**
 * Statistics of the sigma clip recorded each time another iteration changed the
 * number of unmasked channels.
 *
 * <p>The first point describes the spectrum before any clipping; the last point is
 * the converged clip. Unmasked counts strictly decrease along the list.
 *
 * @param points recorded points in iteration order
 */
public record IterationTrajectory(List<Point> points) {

    /**
     * Statistics after a given number of sigma-clip iterations.
     *
     * @param iteration iterations run to reach this point (0 for the unclipped input)
     * @param unmaskedCount channels still contributing to the continuum
     * @param median median of the unmasked channels
     * @param mean mean of the unmasked channels
     * @param std population standard deviation of the unmasked channels
     */
    public record Point(int iteration, int unmaskedCount, double median, double mean, double std) {
    }

    public IterationTrajectory {
        if (points == null || points.isEmpty()) {
            throw ValidationException.insufficientData("trajectory points", 1, 0);
        }
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public Point get(int index) {
        return points.get(index);
    }

    public Point last() {
        return points.get(points.size() - 1);
    }

    public int[] unmaskedCounts() {
        return points.stream().mapToInt(Point::unmaskedCount).toArray();
    }

    public double[] medians() {
        return points.stream().mapToDouble(Point::median).toArray();
    }

    public double[] means() {
        return points.stream().mapToDouble(Point::mean).toArray();
    }

    public double[] stds() {
        return points.stream().mapToDouble(Point::std).toArray();
    }
}
