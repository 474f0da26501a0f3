/* (C)2026 */
package com.ammann.afoli.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Optional overrides of the configured AFOLI parameters. Every {@code null} field
 * keeps the configured value.
 */
@Schema(description = "AFOLI parameter overrides; omitted fields keep the configured defaults")
public record AfoliParametersDTO(
        @Schema(description = "Sigma-clip multipliers: one symmetric value or lower,upper", example = "[3.0, 1.3]")
        @Size(min = 1, max = 2)
        List<@NotNull Double> sigma,

        @Schema(description = "Center statistic: median, mean or linregress", example = "median")
        String censtat,

        @Schema(description = "Maximum sigma-clip iterations, unset to iterate until convergence")
        @Min(1)
        Integer niter,

        @Schema(description = "Channels masked at each end of the spectrum", example = "10")
        @Min(0)
        Integer extremes,

        @Schema(description = "Masked bands this wide or narrower are released", example = "2")
        Integer minWidth,

        @Schema(description = "Unmasked gaps this wide or narrower between bands are masked")
        Integer minGap,

        @Schema(description = "Channels added on each side of every masked band", example = "0")
        @Min(0)
        Integer dilate,

        @Schema(description = "Channel ranges always masked, start~end items separated by commas", example = "100~120,300")
        String flagchans,

        @Schema(description = "Sentinel values marking invalid channels")
        List<@NotNull Double> invalidValues,

        @Schema(description = "Contamination levels to reconstruct masks for", example = "[0.05, 0.1]")
        List<@NotNull Double> levels,

        @Schema(description = "Trajectory interpolation: linear, nearest, previous, next, zero, slinear, quadratic, cubic or a spline order",
                example = "nearest")
        String levelMode
) {
}
