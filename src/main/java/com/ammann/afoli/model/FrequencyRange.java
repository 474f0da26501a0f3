/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;
import java.util.Locale;

/**
 * Frequency interval covering one masked channel band.
 *
 * @param lower lower frequency bound
 * @param upper upper frequency bound, never below {@code lower}
 * @param unit frequency unit, e.g. {@code GHz}
 */
public record FrequencyRange(double lower, double upper, String unit) {

    public FrequencyRange {
        if (upper < lower) {
            throw ValidationException.invalidParameter("upper", upper, "value >= " + lower);
        }
        if (unit == null || unit.isBlank()) {
            throw ValidationException.invalidParameter("unit", unit, "non-blank unit");
        }
    }

    /** Renders the range as {@code lower~upper<unit>} with ten decimals. */
    public String toCasa() {
        return String.format(Locale.ROOT, "%.10f~%.10f%s", lower, upper, unit);
    }
}
