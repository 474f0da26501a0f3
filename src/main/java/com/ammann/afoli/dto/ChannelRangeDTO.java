/* (C)2026 */
package com.ammann.afoli.dto;

import com.ammann.afoli.model.ChannelRange;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Inclusive range of masked channels")
public record ChannelRangeDTO(
        @Schema(description = "First masked channel", example = "6")
        int start,

        @Schema(description = "Last masked channel (inclusive)", example = "8")
        int end
) {
    public static ChannelRangeDTO from(ChannelRange range) {
        return new ChannelRangeDTO(range.start(), range.end());
    }
}
