package nl.nfi.cnfparse.batch;

import nl.nfi.cnfparse.common.ini.IniConfig;
import nl.nfi.cnfparse.generate.WordGenerator;

import java.util.List;

/**
 * Defaults for a batch run, read from the {@code PARSER}, {@code GENERATOR} and {@code INPUT}
 * sections of an INI file. Keys that are absent keep their default value.
 */
public record BatchConfig(int decimals, int maxWordLength, int warnLength, List<String> extensions) {

    public static final int DEFAULT_DECIMALS = 6;
    public static final List<String> DEFAULT_EXTENSIONS = List.of(".txt", ".cfg");

    public BatchConfig {
        if (decimals < 0) {
            throw new IllegalArgumentException("Number of decimals must not be negative: " + decimals);
        }
        if (maxWordLength < 0) {
            throw new IllegalArgumentException("Maximum word length must not be negative: " + maxWordLength);
        }
        extensions = List.copyOf(extensions);
    }

    public static BatchConfig defaults() {
        return new BatchConfig(DEFAULT_DECIMALS, 0, WordGenerator.DEFAULT_WARN_LENGTH, DEFAULT_EXTENSIONS);
    }

    public static BatchConfig from(final IniConfig config) {
        return new BatchConfig(
                config.getInt("PARSER", "round_decimals", DEFAULT_DECIMALS),
                config.getInt("PARSER", "max_word_length", 0),
                config.getInt("GENERATOR", "warn_length", WordGenerator.DEFAULT_WARN_LENGTH),
                config.getList("INPUT", "extensions", DEFAULT_EXTENSIONS)
        );
    }

    public BatchConfig withDecimals(final int decimals) {
        return new BatchConfig(decimals, maxWordLength, warnLength, extensions);
    }

    public BatchConfig withMaxWordLength(final int maxWordLength) {
        return new BatchConfig(decimals, maxWordLength, warnLength, extensions);
    }

    public boolean accepts(final String fileName) {
        return extensions.stream().anyMatch(fileName::endsWith);
    }
}
