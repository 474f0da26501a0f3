/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;
import java.util.Locale;

/**
 * How the iteration trajectory is interpolated when reconstructing contamination
 * levels.
 *
 * <p>Accepted text forms: {@code linear}, {@code nearest}, {@code previous},
 * {@code next}, a spline order {@code 0..3}, or one of the spline aliases
 * {@code zero}, {@code slinear}, {@code quadratic}, {@code cubic}.
 *
 * @param kind interpolation family
 * @param order spline order, only meaningful for {@link Kind#SPLINE}
 */
public record LevelMode(Kind kind, int order) {

    public static final int MAX_SPLINE_ORDER = 3;

    public static final LevelMode LINEAR = new LevelMode(Kind.LINEAR, 1);
    public static final LevelMode NEAREST = new LevelMode(Kind.NEAREST, 0);
    public static final LevelMode PREVIOUS = new LevelMode(Kind.PREVIOUS, 0);
    public static final LevelMode NEXT = new LevelMode(Kind.NEXT, 0);

    public enum Kind {
        LINEAR,
        NEAREST,
        PREVIOUS,
        NEXT,
        SPLINE
    }

    public LevelMode {
        if (kind == null) {
            throw ValidationException.invalidParameter("level_mode", null, "interpolation kind");
        }
        if (kind == Kind.SPLINE && (order < 0 || order > MAX_SPLINE_ORDER)) {
            throw ValidationException.invalidParameter(
                    "level_mode", order, "spline order between 0 and " + MAX_SPLINE_ORDER);
        }
    }

    public static LevelMode spline(int order) {
        return new LevelMode(Kind.SPLINE, order);
    }

    /**
     * Parses the textual level mode.
     *
     * @throws ValidationException for unknown names or unsupported spline orders
     */
    public static LevelMode parse(String text) {
        if (text == null || text.isBlank()) {
            throw ValidationException.invalidParameter("level_mode", text, "non-blank value");
        }
        String value = text.strip().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "linear" -> LINEAR;
            case "nearest" -> NEAREST;
            case "previous" -> PREVIOUS;
            case "next" -> NEXT;
            case "zero" -> spline(0);
            case "slinear" -> spline(1);
            case "quadratic" -> spline(2);
            case "cubic" -> spline(3);
            default -> parseOrder(text, value);
        };
    }

    private static LevelMode parseOrder(String original, String value) {
        try {
            return spline(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new ValidationException(
                    String.format("Invalid parameter 'level_mode': got '%s', expected %s",
                            original, "linear, nearest, previous, next or a spline order"), e);
        }
    }

    /** Smallest number of trajectory points this interpolation can be built from. */
    public int minimumPoints() {
        return kind == Kind.SPLINE ? Math.max(2, order + 1) : 2;
    }

    @Override
    public String toString() {
        return kind == Kind.SPLINE ? "spline(" + order + ")" : kind.name().toLowerCase(Locale.ROOT);
    }
}
