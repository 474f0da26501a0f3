/* (C)2026 */
package com.ammann.afoli.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Masked regions of a channel mask")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RangesResponseDTO(
        @Schema(description = "Masked channel ranges")
        List<ChannelRangeDTO> channelRanges,

        @Schema(description = "Masked channels in channel-range notation", example = "3;6~8")
        String channelFlags,

        @Schema(description = "Masked frequency ranges")
        List<FrequencyRangeDTO> frequencyRanges,

        @Schema(description = "Masked frequency ranges, one per line")
        String frequencyFlags
) {
}
