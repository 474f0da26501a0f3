/* (C)2026 */
package com.ammann.afoli.health;

import com.ammann.afoli.config.AfoliDefaults;
import com.ammann.afoli.model.AfoliParameters;
import com.ammann.afoli.model.AfoliResult;
import com.ammann.afoli.model.Spectrum;
import com.ammann.afoli.service.AfoliService;
import com.ammann.afoli.service.ProcessingLog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness health check that runs AFOLI on a built-in synthetic spectrum.
 *
 * <p>The spectrum is a flat continuum of 1.0 with a small deterministic ripple and a
 * Gaussian line at channel 25. Reports UP when the line peak is masked and the
 * continuum estimate is within 10% of 1.0. Uses the configured center statistic
 * and sigma limits with fixed masking parameters.
 */
@Readiness
@ApplicationScoped
public class AfoliEngineHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(AfoliEngineHealthCheck.class);

    static final int CHANNELS = 50;
    static final int LINE_CENTER = 25;
    static final double LINE_AMPLITUDE = 9.0;
    static final double LINE_WIDTH = 2.0;
    static final double RIPPLE = 0.02;
    static final double CONTINUUM_TOLERANCE = 0.1;

    @Inject AfoliService afoliService;

    @Inject AfoliDefaults defaults;

    @Override
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();

            AfoliParameters parameters = defaults.parameters().toBuilder()
                    .extremes(5)
                    .minWidth(2)
                    .minGap(null)
                    .dilate(0)
                    .flaggedChannels(null)
                    .invalidValues(null)
                    .levels(null)
                    .build();
            AfoliResult result = afoliService.afoli(syntheticSpectrum(), null, parameters, ProcessingLog.NONE);

            long elapsed = Duration.between(start, Instant.now()).toMillis();
            boolean lineFound = result.refinedMask().isMasked(LINE_CENTER);
            boolean continuumOk = Math.abs(result.continuum() - 1.0) < CONTINUUM_TOLERANCE;

            return HealthCheckResponse.named("afoli-engine")
                    .status(lineFound && continuumOk)
                    .withData("line-found", lineFound)
                    .withData("continuum", String.valueOf(result.continuum()))
                    .withData("masked-channels", result.maskedCount())
                    .withData("channel-flags", result.channelFlags())
                    .withData("run-time-ms", elapsed)
                    .build();

        } catch (Exception e) {
            LOG.warnf(e, "AFOLI engine health check failed");
            return HealthCheckResponse.named("afoli-engine")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }

    static Spectrum syntheticSpectrum() {
        double[] values = new double[CHANNELS];
        for (int i = 0; i < CHANNELS; i++) {
            double offset = (i - LINE_CENTER) / LINE_WIDTH;
            values[i] = 1.0
                    + RIPPLE * Math.sin(2.3 * i)
                    + LINE_AMPLITUDE * Math.exp(-0.5 * offset * offset);
        }
        return Spectrum.of(values);
    }
}
