/* (C)2026 */
package com.ammann.afoli.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Single spectrum to run AFOLI on")
public record AfoliRequestDTO(
        @Schema(description = "Flux per channel")
        @NotEmpty
        List<Double> spectrum,

        @Schema(description = "Frequency per channel, same length as the spectrum")
        List<Double> frequencies,

        @Schema(description = "Unit of the frequencies", example = "GHz")
        String frequencyUnit,

        @Schema(description = "Parameter overrides")
        @Valid
        AfoliParametersDTO parameters
) {
}
