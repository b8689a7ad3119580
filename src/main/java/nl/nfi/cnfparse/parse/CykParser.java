package nl.nfi.cnfparse.parse;

import nl.nfi.cnfparse.grammar.Grammar;
import nl.nfi.cnfparse.grammar.Rule;
import nl.nfi.cnfparse.grammar.Symbols;
import nl.nfi.cnfparse.normalize.CnfNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Bottom-up chart parser for grammars in Chomsky Normal Form.
 * <p>
 * The chart is indexed as {@code chart[startOfSpan][spanLength - 1]}. Each cell keeps one entry
 * per nonterminal: for plain grammars the first derivation found, for probabilistic grammars the
 * most probable one (Viterbi). Spans are filled by increasing length; within a span, split points
 * are tried from small to large, children in symbol order and rules in {@code (lhs, rhs)} order,
 * and a later candidate only replaces a recorded one when it is strictly more probable. This makes
 * the returned tree deterministic.
 * <p>
 * Parsing takes {@code O(n^3 * |binary rules|)} time for a word of length {@code n}. The parser
 * does not modify the grammar, so one parser may be used for many words.
 */
public final class CykParser {

    private static final Logger LOG = LoggerFactory.getLogger(CykParser.class);

    private final Grammar grammar;
    private final Map<Character, List<Rule>> lexicalRules;
    private final Map<String, List<Rule>> binaryRules;

    private CykParser(final Grammar grammar) {
        this.grammar = grammar;
        this.lexicalRules = new HashMap<>();
        this.binaryRules = new HashMap<>();

        // rules() is sorted by (lhs, rhs), so every list below is too
        for (final Rule rule : grammar.rules()) {
            if (rule.isLexical()) {
                lexicalRules.computeIfAbsent(rule.left(), key -> new ArrayList<>()).add(rule);
            } else if (rule.isBinary()) {
                binaryRules.computeIfAbsent(rule.rhs(), key -> new ArrayList<>()).add(rule);
            }
        }
    }

    public static CykParser forGrammar(final Grammar grammar) {
        return forGrammar(grammar, false);
    }

    /**
     * @param normalize when the grammar is not in CNF, convert it in place first instead of failing
     */
    public static CykParser forGrammar(final Grammar grammar, final boolean normalize) {
        if (!grammar.isCnf()) {
            if (!normalize) {
                throw new IllegalArgumentException("The grammar is not in Chomsky Normal Form:\n" + grammar);
            }
            LOG.warn("The provided grammar is not in CNF. Converting to CNF, some productions and symbols may change.");
            CnfNormalizer.normalize(grammar);
        }
        return new CykParser(grammar);
    }

    public Grammar grammar() {
        return grammar;
    }

    public ParseResult parse(final String word) {
        return parse(word, OptionalInt.empty());
    }

    // reported probability rounded to the given number of decimals, comparisons use full precision
    public ParseResult parse(final String word, final int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("Number of decimals must not be negative: " + decimals);
        }
        return parse(word, OptionalInt.of(decimals));
    }

    private ParseResult parse(final String word, final OptionalInt decimals) {
        if (word.isEmpty()) {
            return parseEmpty(decimals);
        }

        final ChartCell[][] chart = fillChart(word);
        final ChartEntry top = chart[0][word.length() - 1].get(grammar.startSymbol());
        if (top == null) {
            return ParseResult.rejected(grammar.isProbabilistic());
        }

        final ParseTree tree = buildTree(chart, word, 0, word.length(), top);
        if (!grammar.isProbabilistic()) {
            return ParseResult.accepted(tree);
        }
        return ParseResult.accepted(tree, round(top.probability(), decimals));
    }

    private ParseResult parseEmpty(final OptionalInt decimals) {
        final char start = grammar.startSymbol();
        if (!grammar.producesEpsilon(start)) {
            return ParseResult.rejected(grammar.isProbabilistic());
        }
        // the empty word is matched by the start symbol's epsilon production alone
        if (!grammar.isProbabilistic()) {
            return ParseResult.accepted(ParseTree.epsilon());
        }
        return ParseResult.accepted(ParseTree.epsilon(), round(grammar.probability(start, Symbols.EPSILON_STRING), decimals));
    }

    ChartCell[][] fillChart(final String word) {
        final int numSymbols = word.length();
        final ChartCell[][] chart = new ChartCell[numSymbols][numSymbols];

        for (int startOfSpan = 0; startOfSpan < numSymbols; startOfSpan++) {
            final ChartCell cell = new ChartCell();
            for (final Rule rule : lexicalRules.getOrDefault(word.charAt(startOfSpan), List.of())) {
                cell.offer(new ChartEntry(rule.lhs(), rule.probability(), rule, 0));
            }
            chart[startOfSpan][0] = cell;
        }

        int size = 0;
        for (int spanLength = 2; spanLength <= numSymbols; spanLength++) {
            for (int startOfSpan = 0; startOfSpan <= numSymbols - spanLength; startOfSpan++) {
                final ChartCell cell = makeChartCell(chart, startOfSpan, spanLength);
                chart[startOfSpan][spanLength - 1] = cell;
                size += cell.size();
            }
        }
        LOG.debug("Filled chart for word of length {} with {} entries", numSymbols, size);
        return chart;
    }

    private ChartCell makeChartCell(final ChartCell[][] chart, final int startOfSpan, final int spanLength) {
        final ChartCell cell = new ChartCell();
        for (int split = 1; split < spanLength; split++) {
            final ChartCell left = chart[startOfSpan][split - 1];
            final ChartCell right = chart[startOfSpan + split][spanLength - split - 1];
            if (left.isEmpty() || right.isEmpty()) {
                continue;
            }

            for (final ChartEntry l : left.entries()) {
                for (final ChartEntry r : right.entries()) {
                    final List<Rule> rules = binaryRules.get(String.valueOf(new char[]{l.symbol(), r.symbol()}));
                    if (rules == null) {
                        continue;
                    }
                    for (final Rule rule : rules) {
                        final double probability = rule.probability() * l.probability() * r.probability();
                        cell.offer(new ChartEntry(rule.lhs(), probability, rule, split));
                    }
                }
            }
        }
        return cell;
    }

    // follows the back pointers down to the diagonal
    private static ParseTree buildTree(final ChartCell[][] chart, final String word, final int startOfSpan, final int spanLength, final ChartEntry entry) {
        if (entry.isLexical()) {
            return ParseTree.node(entry.symbol(), ParseTree.leaf(word.charAt(startOfSpan)));
        }
        final int split = entry.split();
        final ChartEntry left = chart[startOfSpan][split - 1].get(entry.rule().left());
        final ChartEntry right = chart[startOfSpan + split][spanLength - split - 1].get(entry.rule().right());
        return ParseTree.node(
                entry.symbol(),
                buildTree(chart, word, startOfSpan, split, left),
                buildTree(chart, word, startOfSpan + split, spanLength - split, right)
        );
    }

    private static double round(final double probability, final OptionalInt decimals) {
        if (decimals.isEmpty()) {
            return probability;
        }
        return BigDecimal.valueOf(probability).setScale(decimals.getAsInt(), RoundingMode.HALF_UP).doubleValue();
    }
}
