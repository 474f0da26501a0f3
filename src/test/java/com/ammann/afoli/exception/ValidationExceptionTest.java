/* (C)2026 */
package com.ammann.afoli.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ValidationExceptionTest {

    @Test
    void insufficientDataMessage() {
        ValidationException exception = ValidationException.insufficientData("spectrum channels", 1, 0);

        assertThat(exception).hasMessage("Insufficient spectrum channels: need at least 1, but got 0");
    }

    @Test
    void invalidParameterMessage() {
        ValidationException exception = ValidationException.invalidParameter("censtat", "mode", "median");

        assertThat(exception).hasMessage("Invalid parameter 'censtat': got 'mode', expected median");
    }

    @Test
    void lengthMismatchMessage() {
        ValidationException exception = ValidationException.lengthMismatch("mask", 10, "frequency axis", 12);

        assertThat(exception).hasMessage("Length mismatch: mask has 10 channels, frequency axis has 12");
    }

    @Test
    void rangeExceptionCarriesParameterDetails() {
        MaskRangeException exception = new MaskRangeException("dilate", 25, 50, "too wide");

        assertThat(exception).isInstanceOf(ApiException.class);
        assertThat(exception.getParameter()).isEqualTo("dilate");
        assertThat(exception.getValue()).isEqualTo(25);
        assertThat(exception.getChannels()).isEqualTo(50);
        assertThat(exception).hasMessage("Parameter 'dilate' = 25 is out of range for 50 channels: too wide");
    }

    @Test
    void flagFileExceptionNamesFile() {
        FlagFileException exception = new FlagFileException(Path.of("out", "a.txt"), new RuntimeException("disk"));

        assertThat(exception.getMessage()).contains("a.txt");
        assertThat(exception.getCause()).hasMessage("disk");
    }
}
