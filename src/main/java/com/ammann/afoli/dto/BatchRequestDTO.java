/* (C)2026 */
package com.ammann.afoli.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Spectra processed with one shared parameter set")
public record BatchRequestDTO(
        @Schema(description = "Spectra with unique names", maxItems = BatchRequestDTO.MAX_SPECTRA)
        @NotEmpty
        @Size(max = BatchRequestDTO.MAX_SPECTRA)
        List<@Valid NamedSpectrumDTO> spectra,

        @Schema(description = "Parameter overrides applied to every spectrum")
        @Valid
        AfoliParametersDTO parameters,

        @Schema(description = "Write flag files to the configured output directory", defaultValue = "false")
        Boolean writeFlags,

        @Schema(description = "Reuse existing frequency flag files instead of recomputing", defaultValue = "false")
        Boolean resume
) {
    public static final int MAX_SPECTRA = 64;

    public boolean shouldWriteFlags() {
        return Boolean.TRUE.equals(writeFlags);
    }

    public boolean shouldResume() {
        return Boolean.TRUE.equals(resume);
    }
}
