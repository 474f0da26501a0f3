/* (C)2026 */
package com.ammann.afoli.dto;

import com.ammann.afoli.model.AfoliResult;
import com.ammann.afoli.model.Mask;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Line-free channel mask and continuum estimate of one spectrum")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AfoliResponseDTO(
        @Schema(description = "Number of channels")
        int channels,

        @Schema(description = "Number of masked channels")
        int maskedChannels,

        @Schema(description = "Per-channel mask, true for channels excluded from the continuum")
        List<Boolean> mask,

        @Schema(description = "Masked channels in channel-range notation", example = "0~9;20~30;90~99")
        String channelFlags,

        @Schema(description = "Masked channel ranges")
        List<ChannelRangeDTO> channelRanges,

        @Schema(description = "Masked frequency ranges, one per line")
        String frequencyFlags,

        @Schema(description = "Masked frequency ranges")
        List<FrequencyRangeDTO> frequencyRanges,

        @Schema(description = "Mean of the unmasked channels")
        double continuum,

        @Schema(description = "Population standard deviation of the unmasked channels")
        double spread,

        @Schema(description = "Sigma-clip iterations run")
        int clipIterations,

        @Schema(description = "Sigma-clip statistics per iteration")
        List<TrajectoryPointDTO> trajectory,

        @Schema(description = "Masks reconstructed for the requested levels")
        List<LevelMaskDTO> levelMasks
) {
    public static AfoliResponseDTO from(
            AfoliResult result,
            String channelFlags,
            String frequencyFlags,
            List<String> levelFlags) {
        List<LevelMaskDTO> levels = new ArrayList<>(result.levelMasks().size());
        for (int i = 0; i < result.levelMasks().size(); i++) {
            levels.add(LevelMaskDTO.from(result.levelMasks().get(i), levelFlags.get(i)));
        }
        return new AfoliResponseDTO(
                result.channelCount(),
                result.maskedCount(),
                toList(result.refinedMask()),
                channelFlags,
                result.channelRanges().stream().map(ChannelRangeDTO::from).toList(),
                frequencyFlags,
                result.frequencyRanges().stream().map(FrequencyRangeDTO::from).toList(),
                result.continuum(),
                result.spread(),
                result.clipIterations(),
                result.trajectory().points().stream().map(TrajectoryPointDTO::from).toList(),
                levels
        );
    }

    static List<Boolean> toList(Mask mask) {
        List<Boolean> flags = new ArrayList<>(mask.length());
        for (int i = 0; i < mask.length(); i++) {
            flags.add(mask.isMasked(i));
        }
        return flags;
    }
}
