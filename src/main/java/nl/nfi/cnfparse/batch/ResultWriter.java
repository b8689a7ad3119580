package nl.nfi.cnfparse.batch;

import nl.nfi.cnfparse.generate.GeneratedWord;
import nl.nfi.cnfparse.grammar.Grammar;
import nl.nfi.cnfparse.grammar.Symbols;
import nl.nfi.cnfparse.parse.ParseResult;

import java.util.List;

// renders the report of one input file, e.g.:
//      CFG(...)
//      ##################################################
//
//      ab -> true [0.25]
//      TREE -> S(A(a), B(b))
public final class ResultWriter {

    static final String SEPARATOR = "#".repeat(50);

    private final StringBuilder output = new StringBuilder();

    public ResultWriter grammar(final Grammar grammar) {
        output.append(grammar).append('\n');
        output.append(SEPARATOR).append("\n\n");
        return this;
    }

    public ResultWriter result(final String word, final ParseResult result) {
        output.append(display(word)).append(" -> ").append(result.accepted());
        if (result.accepted() && result.probability().isPresent()) {
            output.append(" [").append(result.probability().getAsDouble()).append(']');
        }
        output.append('\n');
        result.tree().ifPresent(tree -> output.append("TREE -> ").append(tree).append('\n'));
        output.append('\n');
        return this;
    }

    public ResultWriter skipped(final String word, final int maxWordLength) {
        output.append(display(word)).append(" -> skipped (longer than ").append(maxWordLength).append(")\n\n");
        return this;
    }

    public ResultWriter generated(final int maxLength, final List<GeneratedWord> words) {
        output.append(SEPARATOR).append('\n');
        output.append("WORDS UP TO LENGTH ").append(maxLength).append(" (").append(words.size()).append(")\n");
        for (final GeneratedWord word : words) {
            output.append(display(word.word()));
            word.probability().ifPresent(probability -> output.append(" [").append(probability).append(']'));
            output.append('\n');
        }
        return this;
    }

    private static String display(final String word) {
        return word.isEmpty() ? Symbols.EPSILON_STRING : word;
    }

    @Override
    public String toString() {
        return output.toString();
    }
}
