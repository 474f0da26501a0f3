/* (C)2026 */
package com.ammann.afoli.service;

import com.ammann.afoli.exception.FlagFileException;
import com.ammann.afoli.exception.ValidationException;
import com.ammann.afoli.model.AfoliResult;
import com.ammann.afoli.model.FrequencyRange;
import com.ammann.afoli.model.LevelMask;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Writes AFOLI results as plain-text flag files and reads frequency flags back.
 *
 * <p>For a spectrum stem {@code S} the files are {@code S.line_chan_flags.txt},
 * {@code S.line_freq_flags.txt}, {@code S.line_chan_flags.<level>.txt} and
 * {@code S.afoli_stats.txt}.
 */
@ApplicationScoped
public class FlagFileService {

    private static final Logger LOG = Logger.getLogger(FlagFileService.class);

    public static final String CHANNEL_FLAGS_SUFFIX = ".line_chan_flags";
    public static final String FREQUENCY_FLAGS_SUFFIX = ".line_freq_flags";
    public static final String STATS_SUFFIX = ".afoli_stats";
    public static final String EXTENSION = ".txt";

    private final RegionEncodingService regionEncoder;

    @Inject
    public FlagFileService(RegionEncodingService regionEncoder) {
        this.regionEncoder = regionEncoder;
    }

    public Path channelFlagFile(Path directory, String stem) {
        return resolve(directory, stem, stem + CHANNEL_FLAGS_SUFFIX + EXTENSION);
    }

    public Path frequencyFlagFile(Path directory, String stem) {
        return resolve(directory, stem, stem + FREQUENCY_FLAGS_SUFFIX + EXTENSION);
    }

    public Path levelFlagFile(Path directory, String stem, double level) {
        return resolve(directory, stem, stem + CHANNEL_FLAGS_SUFFIX + "." + level + EXTENSION);
    }

    public Path statsFile(Path directory, String stem) {
        return resolve(directory, stem, stem + STATS_SUFFIX + EXTENSION);
    }

    /**
     * Writes every flag file of one result.
     *
     * @param directory output directory, created when missing
     * @param stem spectrum name used as file name prefix
     * @param result AFOLI result
     * @param channelSeparator separator between channel ranges
     * @param writeFrequencies whether a frequency flag file is written
     * @return the files written, channel flags first
     * @throws FlagFileException if a file cannot be written
     */
    public List<Path> write(
            Path directory,
            String stem,
            AfoliResult result,
            String channelSeparator,
            boolean writeFrequencies) {
        createDirectory(directory);
        List<Path> written = new ArrayList<>();

        Path channels = channelFlagFile(directory, stem);
        writeText(channels, regionEncoder.encodeChannels(result.channelRanges(), channelSeparator));
        written.add(channels);

        if (writeFrequencies) {
            Path frequencies = frequencyFlagFile(directory, stem);
            writeText(frequencies, regionEncoder.formatFrequencies(result.frequencyRanges()));
            written.add(frequencies);
        }

        for (LevelMask levelMask : result.levelMasks()) {
            Path levelFile = levelFlagFile(directory, stem, levelMask.level());
            writeText(levelFile, regionEncoder.encodeChannels(levelMask.ranges(), channelSeparator));
            written.add(levelFile);
        }

        Path stats = statsFile(directory, stem);
        writeText(stats, statsLine(result));
        written.add(stats);

        LOG.debugf("Wrote %d flag files for %s to %s", written.size(), stem, directory);
        return written;
    }

    /** Continuum, spread and masked channel count as one tab-separated line. */
    public String statsLine(AfoliResult result) {
        return String.format(Locale.ROOT, "%10f\t%10f\t%10d",
                result.continuum(), result.spread(), result.maskedCount());
    }

    /**
     * Reads a frequency flag file written by {@link #write}.
     *
     * @throws FlagFileException if the file cannot be read
     */
    public List<FrequencyRange> readFrequencyFlags(Path file) {
        try {
            return regionEncoder.parseFrequencies(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FlagFileException(file, e);
        }
    }

    /**
     * Writes the combined flag file: for each entry its frequency flag file name
     * followed by a colon, then its frequency block.
     *
     * @param file combined file
     * @param flagsByFileName frequency ranges keyed by frequency flag file name, in output order
     */
    public void writeCombined(Path file, Map<String, List<FrequencyRange>> flagsByFileName) {
        List<String> lines = new ArrayList<>();
        flagsByFileName.forEach((name, ranges) -> {
            lines.add(name + ":");
            lines.add(regionEncoder.formatFrequencies(ranges));
        });
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            createDirectory(parent);
        }
        writeText(file, String.join("\n", lines));
        LOG.infof("Wrote combined flags of %d spectra to %s", flagsByFileName.size(), file);
    }

    private static Path resolve(Path directory, String stem, String fileName) {
        Path base = directory.normalize();
        Path file = base.resolve(fileName).normalize();
        if (!base.equals(file.getParent() != null ? file.getParent() : Path.of(""))) {
            throw ValidationException.invalidParameter("name", stem, "flag file inside " + directory);
        }
        return file;
    }

    private static void createDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new FlagFileException(directory, e);
        }
    }

    private static void writeText(Path file, String text) {
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FlagFileException(file, e);
        }
    }
}
