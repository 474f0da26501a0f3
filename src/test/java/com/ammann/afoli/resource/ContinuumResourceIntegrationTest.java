/* (C)2026 */
package com.ammann.afoli.resource;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.afoli.dto.AfoliParametersDTO;
import com.ammann.afoli.dto.AfoliRequestDTO;
import com.ammann.afoli.dto.AfoliResponseDTO;
import com.ammann.afoli.dto.BatchRequestDTO;
import com.ammann.afoli.dto.BatchResponseDTO;
import com.ammann.afoli.dto.NamedSpectrumDTO;
import com.ammann.afoli.support.TestSpectra;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.ws.rs.core.Response;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

@QuarkusTest
class ContinuumResourceIntegrationTest {

    @Inject ContinuumResource resource;

    @Inject Validator validator;

    private static final AfoliParametersDTO EDGES_5 =
            new AfoliParametersDTO(null, null, null, 5, null, null, null, null, null, null, null);

    private static List<Double> lineSpectrum() {
        return Arrays.stream(TestSpectra.gaussianLine().values()).boxed().toList();
    }

    @Test
    void runAfoli_usesInjectedServices() {
        Response response = resource.runAfoli(new AfoliRequestDTO(lineSpectrum(), null, null, EDGES_5));

        assertThat(response.getStatus()).isEqualTo(200);
        AfoliResponseDTO body = (AfoliResponseDTO) response.getEntity();
        assertThat(body.mask().get(TestSpectra.LINE_CENTER)).isTrue();
        assertThat(body.channelFlags()).isEqualTo("0~4;19~30;45~49");
    }

    @Test
    void runBatch_writesFlagFilesToConfiguredDirectory() {
        var request = new BatchRequestDTO(
                List.of(new NamedSpectrumDTO("integration_line", lineSpectrum(), null, null)),
                EDGES_5, true, null);

        BatchResponseDTO body = (BatchResponseDTO) resource.runBatch(request).getEntity();

        assertThat(body.failed()).isZero();
        assertThat(body.outputDirectory()).isNotNull();
        assertThat(Files.exists(Path.of(body.outputDirectory(), "integration_line.line_chan_flags.txt"))).isTrue();
    }

    @Test
    void batchRequest_isLimitedToMaxSpectra() {
        List<NamedSpectrumDTO> spectra = new ArrayList<>();
        for (int i = 0; i <= BatchRequestDTO.MAX_SPECTRA; i++) {
            spectra.add(new NamedSpectrumDTO("spectrum_" + i, lineSpectrum(), null, null));
        }

        Set<ConstraintViolation<BatchRequestDTO>> tooMany =
                validator.validate(new BatchRequestDTO(spectra, EDGES_5, null, null));
        Set<ConstraintViolation<BatchRequestDTO>> atLimit =
                validator.validate(new BatchRequestDTO(spectra.subList(0, BatchRequestDTO.MAX_SPECTRA), EDGES_5, null, null));

        assertThat(tooMany).extracting(violation -> violation.getPropertyPath().toString()).containsExactly("spectra");
        assertThat(atLimit).isEmpty();
    }

    @Test
    void parameterLists_rejectNullElements() {
        var parameters = new AfoliParametersDTO(
                null, null, null, null, null, null, null, null, null, Arrays.asList(0.1, null), null);

        Set<ConstraintViolation<AfoliRequestDTO>> violations =
                validator.validate(new AfoliRequestDTO(lineSpectrum(), null, null, parameters));

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getPropertyPath().toString()).startsWith("parameters.levels");
    }
}
