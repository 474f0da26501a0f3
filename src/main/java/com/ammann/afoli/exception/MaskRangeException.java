/* (C)2026 */
package com.ammann.afoli.exception;

/**
 * Raised before any masking when a masking parameter would cover the whole
 * spectrum: edge exclusion of at least the spectrum length, or a dilation of at
 * least half of it.
 *
 * <p>Mapped to HTTP 400 (Bad Request) with code {@code RANGE_ERROR}.
 */
public class MaskRangeException extends ApiException {

    private final String parameter;
    private final int value;
    private final int channels;

    public MaskRangeException(String parameter, int value, int channels, String reason) {
        super(String.format("Parameter '%s' = %d is out of range for %d channels: %s",
                parameter, value, channels, reason));
        this.parameter = parameter;
        this.value = value;
        this.channels = channels;
    }

    public String getParameter() {
        return parameter;
    }

    public int getValue() {
        return value;
    }

    public int getChannels() {
        return channels;
    }
}
