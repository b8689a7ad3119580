package nl.nfi.cnfparse.batch;

import nl.nfi.cnfparse.grammar.GrammarFormatException;
import nl.nfi.cnfparse.grammar.Symbols;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.readAllLines;

// a test file: grammar rules up to the first blank line, then one word per line ("ε" is the empty word)
public record BatchInput(String grammarText, List<String> words) {

    public BatchInput {
        words = List.copyOf(words);
    }

    public static BatchInput read(final Path path) throws IOException {
        return parse(readAllLines(path, UTF_8));
    }

    public static BatchInput parse(final List<String> lines) {
        final StringBuilder grammarText = new StringBuilder();
        final List<String> words = new ArrayList<>();

        boolean inRules = true;
        for (final String line : lines) {
            final String stripped = line.strip();
            if (inRules) {
                if (stripped.isEmpty()) {
                    inRules = grammarText.isEmpty();
                } else {
                    grammarText.append(stripped).append('\n');
                }
            } else if (!stripped.isEmpty()) {
                words.add(Symbols.isEpsilon(stripped) ? "" : stripped);
            }
        }
        if (grammarText.isEmpty()) {
            throw new GrammarFormatException("The input does not contain any grammar rules");
        }
        return new BatchInput(grammarText.toString(), words);
    }
}
