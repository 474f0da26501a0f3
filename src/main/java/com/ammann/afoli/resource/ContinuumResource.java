/* (C)2026 */
package com.ammann.afoli.resource;

import com.ammann.afoli.config.AfoliDefaults;
import com.ammann.afoli.dto.AfoliRequestDTO;
import com.ammann.afoli.dto.AfoliResponseDTO;
import com.ammann.afoli.dto.BatchEntryDTO;
import com.ammann.afoli.dto.BatchRequestDTO;
import com.ammann.afoli.dto.BatchResponseDTO;
import com.ammann.afoli.dto.ChannelRangeDTO;
import com.ammann.afoli.dto.FrequencyRangeDTO;
import com.ammann.afoli.dto.NamedSpectrumDTO;
import com.ammann.afoli.dto.RangesRequestDTO;
import com.ammann.afoli.dto.RangesResponseDTO;
import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.model.AfoliParameters;
import com.ammann.afoli.model.AfoliResult;
import com.ammann.afoli.model.BatchEntry;
import com.ammann.afoli.model.ChannelRange;
import com.ammann.afoli.model.FrequencyAxis;
import com.ammann.afoli.model.FrequencyRange;
import com.ammann.afoli.model.LevelMask;
import com.ammann.afoli.model.Mask;
import com.ammann.afoli.model.NamedSpectrum;
import com.ammann.afoli.model.Spectrum;
import com.ammann.afoli.properties.ApiProperties;
import com.ammann.afoli.service.AfoliService;
import com.ammann.afoli.service.ProcessingLog;
import com.ammann.afoli.service.RegionEncodingService;
import com.ammann.afoli.service.SpectrumBatchService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for line-free channel selection and continuum estimation.
 *
 * <p>Runs AFOLI on single spectra or batches and converts channel masks into
 * channel and frequency ranges. Request parameters override the configured
 * defaults field by field.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Continuum.BASE)
@Tag(name = "Continuum API", description = "Line-free channel selection with AFOLI")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ContinuumResource {

    private static final Logger LOG = Logger.getLogger(ContinuumResource.class);

    @Inject
    AfoliService afoliService;

    @Inject
    SpectrumBatchService batchService;

    @Inject
    RegionEncodingService regionEncoder;

    @Inject
    AfoliDefaults defaults;

    @POST
    @Path(ApiProperties.Continuum.AFOLI)
    @Operation(
            summary = "Run AFOLI on one spectrum",
            description = "Masks line emission by asymmetric sigma clipping and returns the line-free mask, continuum estimate, sigma-clip trajectory and optional level masks"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "AFOLI completed",
                    content = @Content(schema = @Schema(implementation = AfoliResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid parameters or parameters out of range for the spectrum"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response runAfoli(@Valid @NotNull AfoliRequestDTO request) {
        Spectrum spectrum = toSpectrum(request.spectrum());
        FrequencyAxis frequencies = toAxis(request.frequencies(), request.frequencyUnit());
        AfoliParameters parameters = defaults.merge(request.parameters());

        LOG.debugf("AFOLI request: channels=%d, frequencies=%s, parameters=%s",
                Integer.valueOf(spectrum.length()), Boolean.valueOf(frequencies != null), parameters);

        AfoliResult result = afoliService.afoli(spectrum, frequencies, parameters, ProcessingLog.jboss(LOG));

        String separator = defaults.channelSeparator();
        List<String> levelFlags = new ArrayList<>();
        for (LevelMask levelMask : result.levelMasks()) {
            levelFlags.add(regionEncoder.encodeChannels(levelMask.ranges(), separator));
        }
        var response = AfoliResponseDTO.from(
                result,
                regionEncoder.encodeChannels(result.channelRanges(), separator),
                frequencies != null ? regionEncoder.formatFrequencies(result.frequencyRanges()) : null,
                levelFlags);

        LOG.infof("AFOLI finished: %d/%d channels masked, continuum=%.6f",
                Integer.valueOf(result.maskedCount()), Integer.valueOf(result.channelCount()),
                Double.valueOf(result.continuum()));
        return Response.ok(response).build();
    }

    @POST
    @Path(ApiProperties.Continuum.BATCH)
    @Operation(
            summary = "Run AFOLI on a batch of spectra",
            description = "Processes named spectra in parallel with one parameter set, optionally writing flag files to the configured output directory and resuming from existing frequency flag files"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Batch completed; failed spectra are reported per entry",
                    content = @Content(schema = @Schema(implementation = BatchResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid batch or parameters"),
            @APIResponse(responseCode = "500", description = "Flag files could not be written")
    })
    public Response runBatch(@Valid @NotNull BatchRequestDTO request) {
        AfoliParameters parameters = defaults.merge(request.parameters());

        java.nio.file.Path outputDirectory = null;
        if (request.shouldWriteFlags() || request.shouldResume()) {
            outputDirectory = defaults.outputDirectory().orElseThrow(() -> new ValidationException(
                    "Flag file output requested but afoli.output.directory is not configured"));
        }

        List<NamedSpectrum> spectra = new ArrayList<>(request.spectra().size());
        for (NamedSpectrumDTO dto : request.spectra()) {
            spectra.add(new NamedSpectrum(
                    dto.name(), toSpectrum(dto.spectrum()), toAxis(dto.frequencies(), dto.frequencyUnit())));
        }

        List<BatchEntry> entries = batchService.processBatch(spectra, parameters, outputDirectory, request.shouldResume());

        String separator = defaults.channelSeparator();
        List<BatchEntryDTO> dtos = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            BatchEntry entry = entries.get(i);
            String channelFlags = entry.result() != null
                    ? regionEncoder.encodeChannels(entry.result().channelRanges(), separator)
                    : null;
            String frequencyFlags = spectra.get(i).hasFrequencies() && entry.succeeded()
                    ? regionEncoder.formatFrequencies(entry.frequencyRanges())
                    : null;
            dtos.add(BatchEntryDTO.from(entry, channelFlags, frequencyFlags));
        }

        var response = BatchResponseDTO.of(outputDirectory != null ? outputDirectory.toString() : null, dtos);
        LOG.infof("Batch request finished: %d spectra, %d failed", response.total(), response.failed());
        return Response.ok(response).build();
    }

    @POST
    @Path(ApiProperties.Continuum.RANGES)
    @Operation(
            summary = "Convert a channel mask into ranges",
            description = "Groups masked channels into inclusive ranges and, with a frequency axis, into frequency ranges widened by half a channel"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Ranges computed",
                    content = @Content(schema = @Schema(implementation = RangesResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Mask and frequency axis differ in length")
    })
    public Response toRanges(@Valid @NotNull RangesRequestDTO request) {
        Mask mask = toMask(request.mask());
        String separator = request.separator() != null && !request.separator().isEmpty()
                ? request.separator()
                : defaults.channelSeparator();

        List<ChannelRange> ranges = regionEncoder.group(mask);
        List<FrequencyRangeDTO> frequencyRanges = null;
        String frequencyFlags = null;
        FrequencyAxis frequencies = toAxis(request.frequencies(), request.frequencyUnit());
        if (frequencies != null) {
            List<FrequencyRange> encoded = regionEncoder.encodeFrequencies(frequencies, mask);
            frequencyRanges = encoded.stream().map(FrequencyRangeDTO::from).toList();
            frequencyFlags = regionEncoder.formatFrequencies(encoded);
        }

        var response = new RangesResponseDTO(
                ranges.stream().map(ChannelRangeDTO::from).toList(),
                regionEncoder.encodeChannels(ranges, separator),
                frequencyRanges,
                frequencyFlags);
        return Response.ok(response).build();
    }

    private static Spectrum toSpectrum(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw ValidationException.insufficientData("spectrum channels", 1, 0);
        }
        double[] flux = new double[values.size()];
        for (int i = 0; i < flux.length; i++) {
            Double value = values.get(i);
            // null channels count as invalid and are masked
            flux[i] = value != null ? value : Double.NaN;
        }
        return Spectrum.of(flux);
    }

    private static FrequencyAxis toAxis(List<Double> values, String unit) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        double[] frequencies = new double[values.size()];
        for (int i = 0; i < frequencies.length; i++) {
            Double value = values.get(i);
            if (value == null) {
                throw ValidationException.invalidParameter("frequencies[" + i + "]", null, "finite frequency");
            }
            frequencies[i] = value;
        }
        return FrequencyAxis.of(frequencies, unit);
    }

    private static Mask toMask(List<Boolean> values) {
        boolean[] flags = new boolean[values.size()];
        for (int i = 0; i < flags.length; i++) {
            flags[i] = Boolean.TRUE.equals(values.get(i));
        }
        return Mask.of(flags);
    }
}
