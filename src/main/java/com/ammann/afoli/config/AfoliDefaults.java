/* (C)2026 */
package com.ammann.afoli.config;

import com.ammann.afoli.dto.AfoliParametersDTO;
import com.ammann.afoli.enumeration.CenterStatistic;
import com.ammann.afoli.model.AfoliParameters;
import com.ammann.afoli.model.LevelMode;
import com.ammann.afoli.model.SigmaLimits;
import com.ammann.afoli.service.BasicMaskingService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * AFOLI parameters configured in {@code application.properties}.
 *
 * <p>Values are parsed once at startup, so a bad configuration fails the deployment
 * instead of the first request. Request payloads override them field by field.
 */
@ApplicationScoped
public class AfoliDefaults {

    private static final Logger LOG = Logger.getLogger(AfoliDefaults.class);

    private final BasicMaskingService basicMaskingService;
    private final AfoliParameters parameters;
    private final String channelSeparator;
    private final Optional<Path> outputDirectory;
    private final Optional<String> combinedFile;

    @Inject
    public AfoliDefaults(
            BasicMaskingService basicMaskingService,
            @ConfigProperty(name = "afoli.sigma", defaultValue = "3.0,1.3") List<Double> sigma,
            @ConfigProperty(name = "afoli.censtat", defaultValue = "median") String censtat,
            @ConfigProperty(name = "afoli.niter") Optional<Integer> niter,
            @ConfigProperty(name = "afoli.extremes", defaultValue = "10") int extremes,
            @ConfigProperty(name = "afoli.min-width", defaultValue = "2") int minWidth,
            @ConfigProperty(name = "afoli.min-gap") Optional<Integer> minGap,
            @ConfigProperty(name = "afoli.dilate", defaultValue = "0") int dilate,
            @ConfigProperty(name = "afoli.flagchans") Optional<String> flagchans,
            @ConfigProperty(name = "afoli.invalid-values") Optional<List<Double>> invalidValues,
            @ConfigProperty(name = "afoli.levels") Optional<List<Double>> levels,
            @ConfigProperty(name = "afoli.level-mode", defaultValue = "nearest") String levelMode,
            @ConfigProperty(name = "afoli.channel-separator", defaultValue = ";") String channelSeparator,
            @ConfigProperty(name = "afoli.output.directory") Optional<String> outputDirectory,
            @ConfigProperty(name = "afoli.output.combined-file") Optional<String> combinedFile) {
        this.basicMaskingService = basicMaskingService;
        this.parameters = AfoliParameters.builder()
                .sigma(SigmaLimits.from(sigma))
                .centerStatistic(CenterStatistic.fromName(censtat))
                .maxIterations(niter.orElse(null))
                .extremes(extremes)
                .minWidth(minWidth)
                .minGap(minGap.orElse(null))
                .dilate(dilate)
                .flaggedChannels(basicMaskingService.parseChannelRanges(
                        flagchans.orElse(null), BasicMaskingService.DEFAULT_RANGE_SEPARATOR))
                .invalidValues(invalidValues.orElse(List.of()))
                .levels(levels.orElse(List.of()))
                .levelMode(LevelMode.parse(levelMode))
                .build();
        this.channelSeparator = channelSeparator;
        this.outputDirectory = outputDirectory.filter(s -> !s.isBlank()).map(Path::of);
        this.combinedFile = combinedFile.filter(s -> !s.isBlank());

        LOG.infof("AFOLI defaults: sigma=%s, censtat=%s, extremes=%d, min_width=%d, level_mode=%s",
                parameters.sigma(), parameters.centerStatistic().configName(),
                parameters.extremes(), parameters.minWidth(), parameters.levelMode());
    }

    public AfoliParameters parameters() {
        return parameters;
    }

    /**
     * Applies request overrides on top of the configured parameters.
     *
     * @param overrides request parameters, {@code null} for none
     * @throws com.ammann.afoli.exception.ValidationException for malformed override values
     */
    public AfoliParameters merge(AfoliParametersDTO overrides) {
        if (overrides == null) {
            return parameters;
        }
        AfoliParameters.Builder builder = parameters.toBuilder();
        if (overrides.sigma() != null) {
            builder.sigma(SigmaLimits.from(overrides.sigma()));
        }
        if (overrides.censtat() != null) {
            builder.centerStatistic(CenterStatistic.fromName(overrides.censtat()));
        }
        if (overrides.niter() != null) {
            builder.maxIterations(overrides.niter());
        }
        if (overrides.extremes() != null) {
            builder.extremes(overrides.extremes());
        }
        if (overrides.minWidth() != null) {
            builder.minWidth(overrides.minWidth());
        }
        if (overrides.minGap() != null) {
            builder.minGap(overrides.minGap());
        }
        if (overrides.dilate() != null) {
            builder.dilate(overrides.dilate());
        }
        if (overrides.flagchans() != null) {
            builder.flaggedChannels(basicMaskingService.parseChannelRanges(
                    overrides.flagchans(), BasicMaskingService.DEFAULT_RANGE_SEPARATOR));
        }
        if (overrides.invalidValues() != null) {
            builder.invalidValues(overrides.invalidValues());
        }
        if (overrides.levels() != null) {
            builder.levels(overrides.levels());
        }
        if (overrides.levelMode() != null) {
            builder.levelMode(LevelMode.parse(overrides.levelMode()));
        }
        return builder.build();
    }

    public String channelSeparator() {
        return channelSeparator;
    }

    /** Directory flag files are written to, empty when flag files are disabled. */
    public Optional<Path> outputDirectory() {
        return outputDirectory;
    }

    /** File name of the combined flag file inside the output directory. */
    public Optional<String> combinedFile() {
        return combinedFile;
    }
}
