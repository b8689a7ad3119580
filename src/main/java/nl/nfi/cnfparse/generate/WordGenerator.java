package nl.nfi.cnfparse.generate;

import nl.nfi.cnfparse.grammar.Grammar;
import nl.nfi.cnfparse.grammar.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static java.util.Comparator.comparingDouble;

/**
 * Enumerates the words of a grammar up to a given length by breadth-first rewriting of the first
 * nonterminal in a sentential form. Forms longer than the bound are dropped, so words that can only
 * be reached through a longer intermediate form (epsilon productions below the start symbol) may be
 * missed. On grammars in CNF the enumeration is exact.
 * <p>
 * The number of forms grows exponentially with the bound.
 */
public final class WordGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(WordGenerator.class);

    public static final int DEFAULT_WARN_LENGTH = 10;

    private static final Comparator<GeneratedWord> BY_PROBABILITY = comparingDouble((GeneratedWord word) -> word.probability().orElse(0.0))
            .reversed()
            .thenComparing(GeneratedWord::word);

    private final Grammar grammar;
    private final int warnLength;

    private WordGenerator(final Grammar grammar, final int warnLength) {
        this.grammar = grammar;
        this.warnLength = warnLength;
    }

    public static WordGenerator forGrammar(final Grammar grammar) {
        return forGrammar(grammar, DEFAULT_WARN_LENGTH);
    }

    public static WordGenerator forGrammar(final Grammar grammar, final int warnLength) {
        return new WordGenerator(grammar, warnLength);
    }

    public List<GeneratedWord> generate(final int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("Maximum word length must not be negative: " + maxLength);
        }
        if (maxLength > warnLength) {
            LOG.warn("Generating all words up to length {}, this may take a long time", maxLength);
        }

        final List<GeneratedWord> words = grammar.isProbabilistic()
                ? generateWeighted(maxLength)
                : generatePlain(maxLength);
        LOG.debug("Generated {} words up to length {}", words.size(), maxLength);
        return words;
    }

    private List<GeneratedWord> generatePlain(final int maxLength) {
        final Set<String> words = new HashSet<>();
        final Set<String> visited = new HashSet<>();
        final Deque<String> queue = new ArrayDeque<>();

        final String initial = String.valueOf(grammar.startSymbol());
        visited.add(initial);
        queue.add(initial);

        while (!queue.isEmpty()) {
            final String form = queue.poll();
            final int index = firstNonterminal(form);
            if (index < 0) {
                words.add(form);
                continue;
            }
            for (final String rhs : grammar.productions(form.charAt(index))) {
                final String next = rewrite(form, index, rhs);
                if (next.length() <= maxLength && visited.add(next)) {
                    queue.add(next);
                }
            }
        }

        return words.stream()
                .sorted()
                .map(GeneratedWord::of)
                .toList();
    }

    // a form is expanded again only when it is reached with a strictly higher probability
    private List<GeneratedWord> generateWeighted(final int maxLength) {
        final Map<String, Double> words = new TreeMap<>();
        final Map<String, Double> best = new HashMap<>();
        final Deque<String> queue = new ArrayDeque<>();

        final String initial = String.valueOf(grammar.startSymbol());
        best.put(initial, 1.0);
        queue.add(initial);

        while (!queue.isEmpty()) {
            final String form = queue.poll();
            final double probability = best.get(form);
            final int index = firstNonterminal(form);
            if (index < 0) {
                words.merge(form, probability, Math::max);
                continue;
            }
            final char symbol = form.charAt(index);
            for (final String rhs : grammar.productions(symbol)) {
                final String next = rewrite(form, index, rhs);
                if (next.length() > maxLength) {
                    continue;
                }
                final double nextProbability = probability * grammar.probability(symbol, rhs);
                final Double known = best.get(next);
                if (known == null || nextProbability > known) {
                    best.put(next, nextProbability);
                    queue.add(next);
                }
            }
        }

        return words.entrySet().stream()
                .map(entry -> GeneratedWord.of(entry.getKey(), entry.getValue()))
                .sorted(BY_PROBABILITY)
                .toList();
    }

    private int firstNonterminal(final String form) {
        for (int i = 0; i < form.length(); i++) {
            if (grammar.isNonterminal(form.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static String rewrite(final String form, final int index, final String rhs) {
        final String replacement = Symbols.isEpsilon(rhs) ? "" : rhs;
        return form.substring(0, index) + replacement + form.substring(index + 1);
    }
}
