/* (C)2026 */
package com.ammann.afoli.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Spectrum of a batch, identified by the name its flag files are written under")
public record NamedSpectrumDTO(
        @Schema(description = "Spectrum name, used as flag file prefix", example = "source1.spw0")
        @NotBlank
        String name,

        @Schema(description = "Flux per channel")
        @NotEmpty
        List<Double> spectrum,

        @Schema(description = "Frequency per channel, same length as the spectrum")
        List<Double> frequencies,

        @Schema(description = "Unit of the frequencies", example = "GHz")
        String frequencyUnit
) {
}
