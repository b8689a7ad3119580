package nl.nfi.cnfparse.batch;

import nl.nfi.cnfparse.common.ini.IniConfig;
import nl.nfi.cnfparse.generate.WordGenerator;
import nl.nfi.cnfparse.grammar.Grammar;
import nl.nfi.cnfparse.grammar.GrammarReader;
import nl.nfi.cnfparse.parse.CykParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "cnf_parser", description = "Converts the grammar of each input file to CNF and parses its words")
public class CnfParserCli implements Callable<Integer> {

    @Option(names = {"--input"}, description = "A test file, or a directory of test files", required = true)
    private String inputPath;

    @Option(names = {"--output_directory"}, description = "The directory to write the results_<file> reports to")
    private String outputPath = "results";

    @Option(names = {"--config"}, description = "INI file with parser defaults")
    private String configPath = null;

    @Option(names = {"--decimals"}, description = "Round reported probabilities to this number of decimals")
    private Integer decimals = null;

    @Option(names = {"--max_word_length"}, description = "Skip words longer than this (0 means no limit)")
    private Integer maxWordLength = null;

    @Option(names = {"--enumerate"}, description = "Also list all words up to this length the grammar derives")
    private int enumerateLength = 0;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    private final PrintStream out;

    public CnfParserCli() {
        this(System.out);
    }

    CnfParserCli(final PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        // must happen before the first logger is created
        if (logPath != null) {
            System.setProperty("LOG_DIRECTORY_PATH", logPath);
        }
        final Logger log = LoggerFactory.getLogger(CnfParserCli.class);

        final BatchConfig config;
        final List<Path> inputs;
        final Path outputDirectory = Paths.get(outputPath);
        try {
            config = loadConfig();
            inputs = listInputs(Paths.get(inputPath), config);
            Files.createDirectories(outputDirectory);
        }
        catch (final IOException | IllegalArgumentException e) {
            log.error("Could not start batch run", e);
            System.err.println("Fatal error: " + e.getMessage());
            return ExitCode.USAGE;
        }

        int errors = 0;
        for (final Path input : inputs) {
            try {
                processFile(input, outputDirectory, config, enumerateLength);
                log.info("Processed {}", input);
            }
            catch (final Exception e) {
                log.error("Failed to process {}", input, e);
                errors++;
            }
        }

        out.printf("ALL %d FILES PROCESSED [%d ERRORS]%n", inputs.size(), errors);
        return errors == 0 ? ExitCode.OK : ExitCode.SOFTWARE;
    }

    private BatchConfig loadConfig() throws IOException {
        BatchConfig config = configPath == null
                ? BatchConfig.defaults()
                : BatchConfig.from(IniConfig.loadFrom(Paths.get(configPath)));
        if (decimals != null) {
            config = config.withDecimals(decimals);
        }
        if (maxWordLength != null) {
            config = config.withMaxWordLength(maxWordLength);
        }
        return config;
    }

    // a single file is always processed, directory entries only when their extension is configured
    static List<Path> listInputs(final Path input, final BatchConfig config) throws IOException {
        if (!Files.exists(input)) {
            throw new IllegalArgumentException("Input path does not exist: %s".formatted(input));
        }
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (final Stream<Path> files = Files.list(input)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> config.accepts(file.getFileName().toString()))
                    .sorted()
                    .toList();
        }
    }

    static void processFile(final Path input, final Path outputDirectory, final BatchConfig config, final int enumerateLength) throws IOException {
        final BatchInput batchInput = BatchInput.read(input);
        final Grammar grammar = GrammarReader.read(batchInput.grammarText());
        final CykParser parser = CykParser.forGrammar(grammar, true);

        final ResultWriter writer = new ResultWriter().grammar(grammar);
        for (final String word : batchInput.words()) {
            if (config.maxWordLength() > 0 && word.length() > config.maxWordLength()) {
                writer.skipped(word, config.maxWordLength());
            } else {
                writer.result(word, parser.parse(word, config.decimals()));
            }
        }
        if (enumerateLength > 0) {
            writer.generated(enumerateLength, WordGenerator.forGrammar(grammar, config.warnLength()).generate(enumerateLength));
        }

        Files.writeString(outputDirectory.resolve("results_" + input.getFileName()), writer.toString(), UTF_8);
    }
}
