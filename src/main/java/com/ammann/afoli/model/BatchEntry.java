/* (C)2026 */
package com.ammann.afoli.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one spectrum in a batch run.
 *
 * @param name spectrum name
 * @param result AFOLI result, {@code null} when resumed or failed
 * @param frequencyRanges masked frequency ranges, computed or read back on resume
 * @param resumed {@code true} when an existing frequency flag file was reused
 * @param files flag files written for this spectrum
 * @param error failure message, {@code null} on success
 */
public record BatchEntry(
        String name,
        AfoliResult result,
        List<FrequencyRange> frequencyRanges,
        boolean resumed,
        List<Path> files,
        String error) {
    public BatchEntry {
        frequencyRanges = frequencyRanges == null ? List.of() : List.copyOf(frequencyRanges);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static BatchEntry computed(String name, AfoliResult result, List<Path> files) {
        return new BatchEntry(name, result, result.frequencyRanges(), false, files, null);
    }

    public static BatchEntry resumed(String name, List<FrequencyRange> frequencyRanges, Path frequencyFile) {
        return new BatchEntry(name, null, frequencyRanges, true, List.of(frequencyFile), null);
    }

    public static BatchEntry failed(String name, String error) {
        return new BatchEntry(name, null, List.of(), false, List.of(), error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
