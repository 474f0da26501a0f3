/* (C)2026 */
package com.ammann.afoli.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Per-spectrum outcomes of a batch, in request order")
public record BatchResponseDTO(
        @Schema(description = "Number of spectra in the batch")
        int total,

        @Schema(description = "Spectra processed or resumed without error")
        int succeeded,

        @Schema(description = "Spectra that failed")
        int failed,

        @Schema(description = "Output directory flag files were written to, if any")
        String outputDirectory,

        @Schema(description = "Per-spectrum outcomes")
        List<BatchEntryDTO> entries
) {
    public static BatchResponseDTO of(String outputDirectory, List<BatchEntryDTO> entries) {
        int succeeded = (int) entries.stream().filter(BatchEntryDTO::success).count();
        return new BatchResponseDTO(entries.size(), succeeded, entries.size() - succeeded, outputDirectory, entries);
    }
}
