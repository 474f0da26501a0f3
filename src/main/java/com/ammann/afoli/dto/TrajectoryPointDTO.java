/* (C)2026 */
package com.ammann.afoli.dto;

import com.ammann.afoli.model.IterationTrajectory;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Statistics of the unmasked channels after one sigma-clip iteration")
public record TrajectoryPointDTO(
        @Schema(description = "Iteration cap, 0 for the input before clipping")
        int iteration,

        @Schema(description = "Number of unmasked channels")
        int unmaskedChannels,

        @Schema(description = "Median of the unmasked channels")
        double median,

        @Schema(description = "Mean of the unmasked channels")
        double mean,

        @Schema(description = "Population standard deviation of the unmasked channels")
        double std
) {
    public static TrajectoryPointDTO from(IterationTrajectory.Point point) {
        return new TrajectoryPointDTO(
                point.iteration(), point.unmaskedCount(), point.median(), point.mean(), point.std());
    }
}
