/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.config.AfoliDefaults;
import com.ammann.afoli.config.ExecutorProducer;
import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.model.AfoliParameters;
import com.ammann.afoli.model.AfoliResult;
import com.ammann.afoli.model.BatchEntry;
import com.ammann.afoli.model.FrequencyRange;
import com.ammann.afoli.model.NamedSpectrum;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.jboss.logging.Logger;

/**
 * Runs AFOLI over a set of named spectra in parallel.
 *
 * <p>Every spectrum is an independent task on the {@code afoli-batch-executor}. A
 * failing spectrum is reported in its own entry; the remaining spectra still run.
 * Entries come back in input order.
 */
@ApplicationScoped
public class SpectrumBatchService {

    private static final Logger LOG = Logger.getLogger(SpectrumBatchService.class);

    private final AfoliService afoliService;
    private final FlagFileService flagFileService;
    private final AfoliDefaults defaults;
    private final Executor executor;

    @Inject
    public SpectrumBatchService(
            AfoliService afoliService,
            FlagFileService flagFileService,
            AfoliDefaults defaults,
            @Named(ExecutorProducer.BATCH_EXECUTOR) Executor executor) {
        this.afoliService = afoliService;
        this.flagFileService = flagFileService;
        this.defaults = defaults;
        this.executor = executor;
    }

    /**
     * Processes a batch.
     *
     * @param spectra spectra with unique names
     * @param parameters parameters shared by every spectrum
     * @param outputDirectory directory for flag files, {@code null} to write none
     * @param resume reuse existing frequency flag files instead of recomputing
     * @return one entry per spectrum, in input order
     * @throws ValidationException for an empty batch or duplicate names
     */
    public List<BatchEntry> processBatch(
            List<NamedSpectrum> spectra,
            AfoliParameters parameters,
            Path outputDirectory,
            boolean resume) {
        if (spectra == null || spectra.isEmpty()) {
            throw ValidationException.insufficientData("spectra", 1, 0);
        }
        Set<String> names = new HashSet<>();
        for (NamedSpectrum spectrum : spectra) {
            if (!names.add(spectrum.name())) {
                throw ValidationException.invalidParameter("name", spectrum.name(), "unique spectrum names");
            }
        }

        LOG.infof("Processing batch of %d spectra (output=%s, resume=%s)",
                Integer.valueOf(spectra.size()), outputDirectory, Boolean.valueOf(resume));

        List<CompletableFuture<BatchEntry>> futures = new ArrayList<>(spectra.size());
        for (NamedSpectrum spectrum : spectra) {
            futures.add(submit(spectrum, parameters, outputDirectory, resume));
        }

        List<BatchEntry> entries = new ArrayList<>(futures.size());
        for (CompletableFuture<BatchEntry> future : futures) {
            entries.add(future.join());
        }

        if (outputDirectory != null) {
            defaults.combinedFile().ifPresent(name ->
                    writeCombined(outputDirectory.resolve(name), spectra, entries, resume));
        }

        long failures = entries.stream().filter(entry -> !entry.succeeded()).count();
        LOG.infof("Batch finished: %d spectra, %d failed", entries.size(), failures);
        return entries;
    }

    private BatchEntry processOne(
            NamedSpectrum spectrum,
            AfoliParameters parameters,
            Path outputDirectory,
            boolean resume) {
        ProcessingLog log = ProcessingLog.jboss(LOG, spectrum.name());

        if (resume && outputDirectory != null && spectrum.hasFrequencies()) {
            Path frequencyFile = flagFileService.frequencyFlagFile(outputDirectory, spectrum.name());
            if (Files.isRegularFile(frequencyFile)) {
                log.logf("Reusing frequency flags from %s", frequencyFile);
                return BatchEntry.resumed(
                        spectrum.name(), flagFileService.readFrequencyFlags(frequencyFile), frequencyFile);
            }
        }

        AfoliResult result = afoliService.afoli(spectrum.spectrum(), spectrum.frequencies(), parameters, log);

        List<Path> files = List.of();
        if (outputDirectory != null) {
            files = flagFileService.write(
                    outputDirectory,
                    spectrum.name(),
                    result,
                    defaults.channelSeparator(),
                    spectrum.hasFrequencies());
        }
        return BatchEntry.computed(spectrum.name(), result, files);
    }

    private void writeCombined(Path file, List<NamedSpectrum> spectra, List<BatchEntry> entries, boolean resume) {
        if (resume && Files.isRegularFile(file)) {
            LOG.infof("Keeping existing combined flag file %s", file);
            return;
        }
        Map<String, List<FrequencyRange>> flags = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            BatchEntry entry = entries.get(i);
            if (entry.succeeded() && spectra.get(i).hasFrequencies()) {
                Path frequencyFile = flagFileService.frequencyFlagFile(file.getParent(), entry.name());
                flags.put(frequencyFile.getFileName().toString(), entry.frequencyRanges());
            }
        }
        flagFileService.writeCombined(file, flags);
    }

    private CompletableFuture<BatchEntry> submit(
            NamedSpectrum spectrum, AfoliParameters parameters, Path outputDirectory, boolean resume) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> processOne(spectrum, parameters, outputDirectory, resume), executor)
                    .exceptionally(e -> failed(spectrum.name(), e));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(failed(spectrum.name(), e));
        }
    }

    private static BatchEntry failed(String name, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        LOG.warnf(cause, "AFOLI failed for spectrum %s", name);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return BatchEntry.failed(name, message);
    }
}
