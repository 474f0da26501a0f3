/* (C)2026 */
package com.ammann.afoli.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Channel mask to convert into channel and frequency ranges")
public record RangesRequestDTO(
        @Schema(description = "Per-channel mask, true for masked channels")
        @NotEmpty
        List<Boolean> mask,

        @Schema(description = "Frequency per channel, same length as the mask")
        List<Double> frequencies,

        @Schema(description = "Unit of the frequencies", example = "GHz")
        String frequencyUnit,

        @Schema(description = "Separator between channel ranges, defaults to the configured one", example = ";")
        String separator
) {
}
