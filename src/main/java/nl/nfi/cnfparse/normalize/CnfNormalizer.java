package nl.nfi.cnfparse.normalize;

import nl.nfi.cnfparse.grammar.Grammar;
import nl.nfi.cnfparse.grammar.GrammarException;
import nl.nfi.cnfparse.grammar.ProbabilityException;
import nl.nfi.cnfparse.grammar.RuleSet;
import nl.nfi.cnfparse.grammar.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rewrites a grammar into Chomsky Normal Form in five stages:
 * <ol>
 *     <li>isolate the start symbol behind a fresh {@code S' -> S}</li>
 *     <li>replace terminals inside longer productions by dedicated nonterminals</li>
 *     <li>binarize productions longer than two symbols (left fold)</li>
 *     <li>remove epsilon productions, except at the start symbol</li>
 *     <li>remove unit productions and prune unreachable nonterminals</li>
 * </ol>
 * Each stage relies on the shape left behind by the previous one. The stages work on a copy of the
 * rules; the grammar itself is only replaced once all stages succeeded and the result passed the
 * CNF check.
 * <p>
 * Weighted grammars keep, for every left-hand side, probabilities that sum to one, and keep the
 * probability of every word the grammar derives.
 */
public final class CnfNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(CnfNormalizer.class);

    static final int MAX_NEWTON_ROUNDS = 200;
    static final double CONVERGENCE = 1e-15;
    // empty-string probabilities this close to one are taken as exactly one
    static final double CERTAINTY_TOLERANCE = 1e-9;
    static final double SINGULAR_PIVOT = 1e-12;

    private final Grammar grammar;
    private final RuleSet rules;
    private char startSymbol;

    private CnfNormalizer(final Grammar grammar) {
        this.grammar = grammar;
        this.rules = grammar.newRuleSet();
        this.startSymbol = grammar.startSymbol();
    }

    public static void normalize(final Grammar grammar) {
        final CnfNormalizer normalizer = new CnfNormalizer(grammar);
        LOG.debug("Normalizing grammar with {} rules, start symbol {}", normalizer.rules.size(), normalizer.startSymbol);

        normalizer.isolateStartSymbol();
        normalizer.logStage("isolate start symbol");
        normalizer.replaceNonsolitaryTerminals();
        normalizer.logStage("replace nonsolitary terminals");
        normalizer.binarizeLongProductions();
        normalizer.logStage("binarize long productions");
        normalizer.removeEpsilonProductions();
        normalizer.logStage("remove epsilon productions");
        normalizer.removeUnitProductions();
        normalizer.logStage("remove unit productions");

        normalizer.install();
        LOG.debug("Converted to CNF: {}", grammar);
    }

    private void logStage(final String stage) {
        LOG.debug("After stage '{}': {} rules over {} nonterminals", stage, rules.size(), rules.lhsSymbols().size());
    }

    // region Stage 1
    private void isolateStartSymbol() {
        final char newStart = rules.freshNonterminal();
        rules.add(newStart, String.valueOf(startSymbol), 1.0);
        startSymbol = newStart;
    }
    // endregion

    // region Stage 2
    private void replaceNonsolitaryTerminals() {
        for (final char lhs : snapshotOfLhs()) {
            final Map<String, Double> rewritten = new TreeMap<>();
            for (final Map.Entry<String, Double> production : rules.productions(lhs).entrySet()) {
                final String rhs = production.getKey();
                if (rhs.length() < 2) {
                    rewritten.put(rhs, production.getValue());
                    continue;
                }
                final StringBuilder replaced = new StringBuilder();
                for (final char symbol : rhs.toCharArray()) {
                    replaced.append(rules.contains(symbol) ? symbol : rules.findOrCreateNonterminal(String.valueOf(symbol)));
                }
                rewritten.merge(replaced.toString(), production.getValue(), Double::sum);
            }
            rules.replace(lhs, rewritten);
        }
    }
    // endregion

    // region Stage 3
    private void binarizeLongProductions() {
        for (final char lhs : snapshotOfLhs()) {
            final Map<String, Double> rewritten = new TreeMap<>();
            for (final Map.Entry<String, Double> production : rules.productions(lhs).entrySet()) {
                String rhs = production.getKey();
                while (rhs.length() > 2) {
                    final char pair = rules.findOrCreateNonterminal(rhs.substring(0, 2));
                    rhs = pair + rhs.substring(2);
                }
                rewritten.merge(rhs, production.getValue(), Double::sum);
            }
            rules.replace(lhs, rewritten);
        }
    }
    // endregion

    // region Stage 4
    private void removeEpsilonProductions() {
        final Set<Character> nullable = findNullable();
        if (nullable.isEmpty()) {
            return;
        }
        final Map<Character, Double> emptyProbability = rules.isProbabilistic()
                ? computeEmptyProbabilities(nullable)
                : Map.of();

        for (final char lhs : snapshotOfLhs()) {
            final Map<String, Double> rewritten = new TreeMap<>();
            double emptyMass = 0.0;

            for (final Map.Entry<String, Double> production : rules.productions(lhs).entrySet()) {
                final String rhs = production.getKey();
                if (Symbols.isEpsilon(rhs)) {
                    emptyMass += production.getValue();
                    continue;
                }
                final List<Integer> positions = new ArrayList<>();
                for (int i = 0; i < rhs.length(); i++) {
                    if (nullable.contains(rhs.charAt(i))) {
                        positions.add(i);
                    }
                }
                // bit i of mask set: nullable occurrence positions[i] is dropped
                for (int mask = 0; mask < (1 << positions.size()); mask++) {
                    double weight = production.getValue();
                    final StringBuilder variant = new StringBuilder();
                    int next = 0;
                    for (int i = 0; i < rhs.length(); i++) {
                        final char symbol = rhs.charAt(i);
                        if (next < positions.size() && positions.get(next) == i) {
                            final boolean dropped = (mask & (1 << next)) != 0;
                            next++;
                            if (rules.isProbabilistic()) {
                                final double empty = emptyProbability.get(symbol);
                                weight *= dropped ? empty : 1.0 - empty;
                            }
                            if (dropped) {
                                continue;
                            }
                        }
                        variant.append(symbol);
                    }
                    if (variant.isEmpty()) {
                        emptyMass += weight;
                    } else if (!rules.isProbabilistic() || weight > 0.0) {
                        rewritten.merge(variant.toString(), weight, Double::sum);
                    }
                }
            }

            if (lhs == startSymbol) {
                if (nullable.contains(lhs)) {
                    rewritten.put(Symbols.EPSILON_STRING, rules.isProbabilistic() ? emptyMass : 1.0);
                }
            } else if (rules.isProbabilistic()) {
                renormalize(rewritten);
            }
            rules.replace(lhs, rewritten);
        }

        removeEmptyNonterminals();
    }

    // least fixpoint: A is nullable if some production consists of epsilon and nullable symbols only
    private Set<Character> findNullable() {
        final Set<Character> nullable = new TreeSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (final char lhs : rules.lhsSymbols()) {
                if (nullable.contains(lhs)) {
                    continue;
                }
                for (final String rhs : rules.productions(lhs).keySet()) {
                    if (rhs.chars().allMatch(symbol -> symbol == Symbols.EPSILON || nullable.contains((char) symbol))) {
                        nullable.add(lhs);
                        changed = true;
                        break;
                    }
                }
            }
        }
        return nullable;
    }

    // probability e(A) that each nullable nonterminal derives the empty string: the least solution
    // of e = f(e), found with Newton's method starting from zero
    private Map<Character, Double> computeEmptyProbabilities(final Set<Character> nullable) {
        final List<Character> symbols = new ArrayList<>(nullable);
        final Map<Character, Integer> index = new HashMap<>();
        for (int i = 0; i < symbols.size(); i++) {
            index.put(symbols.get(i), i);
        }
        final int n = symbols.size();
        final double[] current = new double[n];

        for (int round = 0; round < MAX_NEWTON_ROUNDS; round++) {
            final double[][] step = new double[n][1];
            final double[][] matrix = new double[n][n];
            for (int i = 0; i < n; i++) {
                matrix[i][i] = 1.0;
                double value = 0.0;
                for (final Map.Entry<String, Double> production : rules.productions(symbols.get(i)).entrySet()) {
                    final String rhs = production.getKey();
                    final double probability = production.getValue();
                    value += probability * emptyProduct(rhs, -1, index, current);
                    for (int position = 0; position < rhs.length(); position++) {
                        final Integer j = index.get(rhs.charAt(position));
                        if (j != null) {
                            matrix[i][j] -= probability * emptyProduct(rhs, position, index, current);
                        }
                    }
                }
                step[i][0] = value - current[i];
            }

            try {
                solveInPlace(matrix, step);
            } catch (final ArithmeticException e) {
                // only happens once a critical nonterminal is within rounding distance of one
                LOG.debug("Newton iteration for empty-string probabilities stopped after {} rounds: {}", round, e.getMessage());
                break;
            }
            double delta = 0.0;
            for (int i = 0; i < n; i++) {
                final double next = Math.min(1.0, Math.max(0.0, current[i] + step[i][0]));
                delta = Math.max(delta, Math.abs(next - current[i]));
                current[i] = next;
            }
            if (delta < CONVERGENCE) {
                LOG.debug("Empty-string probabilities converged after {} rounds", round + 1);
                break;
            }
        }

        final Map<Character, Double> result = new HashMap<>();
        for (int i = 0; i < n; i++) {
            result.put(symbols.get(i), current[i] > 1.0 - CERTAINTY_TOLERANCE ? 1.0 : current[i]);
        }
        return result;
    }

    // product of e(symbol) over the symbols of rhs, skipping position "except"; terminals count as 0
    private static double emptyProduct(final String rhs, final int except, final Map<Character, Integer> index, final double[] empty) {
        double product = 1.0;
        for (int position = 0; position < rhs.length(); position++) {
            final char symbol = rhs.charAt(position);
            if (position == except || symbol == Symbols.EPSILON) {
                continue;
            }
            final Integer i = index.get(symbol);
            product *= i == null ? 0.0 : empty[i];
        }
        return product;
    }

    // removes nonterminals left without productions, and every production that mentions them
    private void removeEmptyNonterminals() {
        while (true) {
            final Set<Character> empty = new TreeSet<>();
            for (final char lhs : rules.lhsSymbols()) {
                if (lhs != startSymbol && rules.productions(lhs).isEmpty()) {
                    empty.add(lhs);
                }
            }
            if (empty.isEmpty()) {
                return;
            }
            empty.forEach(rules::remove);

            for (final char lhs : snapshotOfLhs()) {
                final Map<String, Double> kept = new TreeMap<>();
                rules.productions(lhs).forEach((rhs, probability) -> {
                    if (rhs.chars().noneMatch(symbol -> empty.contains((char) symbol))) {
                        kept.put(rhs, probability);
                    }
                });
                if (kept.size() != rules.productions(lhs).size()) {
                    if (rules.isProbabilistic()) {
                        renormalize(kept);
                    }
                    rules.replace(lhs, kept);
                }
            }
        }
    }
    // endregion

    // region Stage 5
    private void removeUnitProductions() {
        final Map<Character, Set<Character>> closure = new TreeMap<>();
        for (final char lhs : rules.lhsSymbols()) {
            closure.put(lhs, unitClosureOf(lhs));
        }
        final Map<Character, Map<Character, Double>> weights = rules.isProbabilistic()
                ? computeUnitWeights(closure)
                : Map.of();

        final Map<Character, Map<String, Double>> rewritten = new TreeMap<>();
        closure.forEach((lhs, targets) -> {
            final Map<String, Double> productions = new TreeMap<>();
            for (final char target : targets) {
                final double weight = rules.isProbabilistic() ? weights.get(lhs).get(target) : 1.0;
                rules.productions(target).forEach((rhs, probability) -> {
                    if (!isUnit(rhs)) {
                        productions.merge(rhs, weight * probability, Double::sum);
                    }
                });
            }
            rewritten.put(lhs, productions);
        });
        rewritten.forEach(rules::replace);

        final Set<Character> reachable = rules.reachableFrom(startSymbol);
        for (final char lhs : snapshotOfLhs()) {
            if (!reachable.contains(lhs)) {
                rules.remove(lhs);
            }
        }
    }

    private boolean isUnit(final String rhs) {
        return rhs.length() == 1 && rules.contains(rhs.charAt(0));
    }

    // every B with lhs =>* B through unit productions only, lhs itself included
    private Set<Character> unitClosureOf(final char lhs) {
        final Set<Character> visited = new TreeSet<>();
        final List<Character> toProcess = new ArrayList<>(List.of(lhs));
        while (!toProcess.isEmpty()) {
            final char current = toProcess.remove(toProcess.size() - 1);
            if (!visited.add(current)) {
                continue;
            }
            for (final String rhs : rules.productions(current).keySet()) {
                if (isUnit(rhs)) {
                    toProcess.add(rhs.charAt(0));
                }
            }
        }
        return visited;
    }

    // W(A, B): total probability of the unit chains from A to B, the solution of (I - U) * W = I
    private Map<Character, Map<Character, Double>> computeUnitWeights(final Map<Character, Set<Character>> closure) {
        final List<Character> symbols = new ArrayList<>(closure.keySet());
        final Map<Character, Integer> index = new HashMap<>();
        for (int i = 0; i < symbols.size(); i++) {
            index.put(symbols.get(i), i);
        }
        final int n = symbols.size();
        final double[][] matrix = new double[n][n];
        final double[][] weights = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            weights[i][i] = 1.0;
            for (final Map.Entry<String, Double> production : rules.productions(symbols.get(i)).entrySet()) {
                if (isUnit(production.getKey())) {
                    matrix[i][index.get(production.getKey().charAt(0))] -= production.getValue();
                }
            }
        }

        try {
            solveInPlace(matrix, weights);
        } catch (final ArithmeticException e) {
            throw new ProbabilityException("Unit productions among %s carry all probability mass, so they derive no word"
                    .formatted(Symbols.render(closedUnitCycle(closure))));
        }

        final Map<Character, Map<Character, Double>> result = new TreeMap<>();
        closure.forEach((lhs, targets) -> {
            final Map<Character, Double> row = new TreeMap<>();
            for (final char target : targets) {
                row.put(target, weights[index.get(lhs)][index.get(target)]);
            }
            result.put(lhs, row);
        });
        return result;
    }

    // nonterminals whose unit closure has no non-unit production at all
    private Set<Character> closedUnitCycle(final Map<Character, Set<Character>> closure) {
        final Set<Character> closed = new TreeSet<>();
        closure.forEach((lhs, targets) -> {
            if (targets.stream().allMatch(target -> rules.productions(target).keySet().stream().allMatch(this::isUnit))) {
                closed.add(lhs);
            }
        });
        return closed;
    }
    // endregion

    /**
     * Solves {@code matrix * X = rhs} by Gaussian elimination with partial pivoting. The solution
     * replaces {@code rhs}; {@code matrix} is destroyed.
     *
     * @throws ArithmeticException when the matrix is (numerically) singular
     */
    static void solveInPlace(final double[][] matrix, final double[][] rhs) {
        final int n = matrix.length;
        for (int column = 0; column < n; column++) {
            int pivot = column;
            for (int row = column + 1; row < n; row++) {
                if (Math.abs(matrix[row][column]) > Math.abs(matrix[pivot][column])) {
                    pivot = row;
                }
            }
            if (Math.abs(matrix[pivot][column]) < SINGULAR_PIVOT) {
                throw new ArithmeticException("Singular matrix at column " + column);
            }
            swap(matrix, column, pivot);
            swap(rhs, column, pivot);

            for (int row = 0; row < n; row++) {
                if (row == column || matrix[row][column] == 0.0) {
                    continue;
                }
                final double factor = matrix[row][column] / matrix[column][column];
                for (int k = column; k < n; k++) {
                    matrix[row][k] -= factor * matrix[column][k];
                }
                for (int k = 0; k < rhs[row].length; k++) {
                    rhs[row][k] -= factor * rhs[column][k];
                }
            }
        }
        for (int row = 0; row < n; row++) {
            for (int k = 0; k < rhs[row].length; k++) {
                rhs[row][k] /= matrix[row][row];
            }
        }
    }

    private static void swap(final double[][] rows, final int i, final int j) {
        final double[] row = rows[i];
        rows[i] = rows[j];
        rows[j] = row;
    }

    private void install() {
        try {
            grammar.rebuild(rules, startSymbol, candidate -> {
                if (!candidate.isCnf()) {
                    throw new CnfInvariantException("Normalized grammar is not in CNF:\n" + candidate);
                }
            });
        } catch (final GrammarException e) {
            throw new CnfInvariantException("Normalized grammar failed validation: " + e.getMessage(), e);
        }
    }

    private List<Character> snapshotOfLhs() {
        return new ArrayList<>(rules.lhsSymbols());
    }

    private static void renormalize(final Map<String, Double> productions) {
        final double total = productions.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0.0) {
            productions.clear();
            return;
        }
        productions.replaceAll((rhs, probability) -> probability / total);
    }
}
