/* (C)2026 */
package com.ammann.afoli.dto;

import com.ammann.afoli.model.FrequencyRange;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Masked frequency range, widened by half a channel on each side")
public record FrequencyRangeDTO(
        @Schema(description = "Lower frequency")
        double lower,

        @Schema(description = "Upper frequency")
        double upper,

        @Schema(description = "Frequency unit", example = "GHz")
        String unit,

        @Schema(description = "Range in lower~upper<unit> notation", example = "230.0000000000~230.5000000000GHz")
        String range
) {
    public static FrequencyRangeDTO from(FrequencyRange range) {
        return new FrequencyRangeDTO(range.lower(), range.upper(), range.unit(), range.toCasa());
    }
}
