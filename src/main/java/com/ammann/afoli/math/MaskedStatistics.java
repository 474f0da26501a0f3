/* (C)2026 */
package com.ammann.afoli.math;

import com.ammann.afoli.model.MaskedSpectrum;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Descriptive statistics over the unmasked channels of a spectrum.
 *
 * <p>All functions return NaN when no channel is left unmasked. Standard deviations
 * are population values (divisor {@code n}).
 */
public final class MaskedStatistics {

    private MaskedStatistics() {}

    public static double mean(MaskedSpectrum spectrum) {
        return mean(spectrum.unmaskedValues());
    }

    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : StatUtils.mean(values);
    }

    public static double median(MaskedSpectrum spectrum) {
        return median(spectrum.unmaskedValues());
    }

    public static double median(double[] values) {
        return values.length == 0 ? Double.NaN : new Median().evaluate(values);
    }

    public static double std(MaskedSpectrum spectrum) {
        return std(spectrum.unmaskedValues());
    }

    public static double std(double[] values) {
        return values.length == 0 ? Double.NaN : new StandardDeviation(false).evaluate(values);
    }

    /**
     * Intercept of the least-squares line through the unmasked channels, with the
     * channel index measured from the middle of the spectrum.
     *
     * <p>Evaluating the baseline at the band center keeps the estimate meaningful
     * for spectra with a sloped continuum. Returns NaN with fewer than two unmasked
     * channels.
     */
    public static double centeredIntercept(MaskedSpectrum spectrum) {
        int[] channels = spectrum.unmaskedChannels();
        if (channels.length < 2) {
            return Double.NaN;
        }
        double middle = spectrum.length() / 2.0;
        SimpleRegression regression = new SimpleRegression();
        for (int channel : channels) {
            regression.addData(channel - middle, spectrum.spectrum().get(channel));
        }
        return regression.getIntercept();
    }
}
