/* (C)2026 */
package com.ammann.afoli.dto;

import com.ammann.afoli.model.LevelMask;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Mask reconstructed for one contamination level")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LevelMaskDTO(
        @Schema(description = "Requested level as a fraction of the continuum", example = "0.1")
        double level,

        @Schema(description = "Continuum value at this level")
        double continuum,

        @Schema(description = "Standard deviation at this level")
        double spread,

        @Schema(description = "Whether the value was interpolated; false when the nearest trajectory point was used")
        boolean interpolated,

        @Schema(description = "Fractional trajectory index of the interpolated value")
        Double iteration,

        @Schema(description = "Number of masked channels")
        int maskedChannels,

        @Schema(description = "Masked channels in channel-range notation", example = "0~9;20~30;90~99")
        String channelFlags,

        @Schema(description = "Masked channel ranges")
        List<ChannelRangeDTO> channelRanges
) {
    public static LevelMaskDTO from(LevelMask levelMask, String channelFlags) {
        return new LevelMaskDTO(
                levelMask.level(),
                levelMask.continuum(),
                levelMask.spread(),
                levelMask.interpolated(),
                Double.isNaN(levelMask.iteration()) ? null : levelMask.iteration(),
                levelMask.mask().maskedCount(),
                channelFlags,
                levelMask.ranges().stream().map(ChannelRangeDTO::from).toList()
        );
    }
}
