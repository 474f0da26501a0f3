/* (C)2026 */
package com.ammann.afoli.dto;

import com.ammann.afoli.model.BatchEntry;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.nio.file.Path;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of one spectrum of a batch")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchEntryDTO(
        @Schema(description = "Spectrum name")
        String name,

        @Schema(description = "Whether the spectrum was processed or resumed without error")
        boolean success,

        @Schema(description = "Whether existing frequency flags were reused")
        boolean resumed,

        @Schema(description = "Number of channels")
        Integer channels,

        @Schema(description = "Number of masked channels")
        Integer maskedChannels,

        @Schema(description = "Continuum estimate")
        Double continuum,

        @Schema(description = "Standard deviation of the continuum channels")
        Double spread,

        @Schema(description = "Masked channels in channel-range notation")
        String channelFlags,

        @Schema(description = "Masked frequency ranges, one per line")
        String frequencyFlags,

        @Schema(description = "Flag files written")
        List<String> files,

        @Schema(description = "Error message if processing failed")
        String errorMessage
) {
    public static BatchEntryDTO from(BatchEntry entry, String channelFlags, String frequencyFlags) {
        var result = entry.result();
        return new BatchEntryDTO(
                entry.name(),
                entry.succeeded(),
                entry.resumed(),
                result != null ? result.channelCount() : null,
                result != null ? result.maskedCount() : null,
                result != null ? result.continuum() : null,
                result != null ? result.spread() : null,
                channelFlags,
                frequencyFlags,
                entry.files().stream().map(Path::toString).toList(),
                entry.error()
        );
    }
}
