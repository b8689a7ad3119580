package nl.nfi.cnfparse.grammar;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

import static java.util.stream.Collectors.joining;

/**
 * A context-free grammar over single-character symbols, optionally weighted.
 * <p>
 * Terminals and nonterminals are derived from the rules: every left-hand side is a nonterminal,
 * every other symbol used in a production is a terminal. Empty productions are stored as
 * {@link Symbols#EPSILON}. The grammar is only ever replaced as a whole, through {@link #rebuild},
 * which validates the new rules before installing them.
 */
public final class Grammar {

    // normalized grammars carry products and quotients of the user's weights
    public static final double REBUILD_TOLERANCE = 1e-9;

    private final boolean probabilistic;

    private Map<Character, Map<String, Double>> rules;
    private Set<Character> terminals;
    private Set<Character> nonterminals;
    private char startSymbol;
    private SymbolPool pool;

    private Grammar(final boolean probabilistic) {
        this.probabilistic = probabilistic;
    }

    public static Grammar create(final Map<String, ? extends Collection<String>> rules) {
        return create(rules, null);
    }

    public static Grammar create(final Map<String, ? extends Collection<String>> rules, final Character startSymbol) {
        if (rules == null) {
            throw new GrammarFormatException("The grammar must be given as a mapping of symbol to productions");
        }
        final RuleSet ruleSet = RuleSet.empty(false);
        rules.forEach((key, productions) -> {
            final char lhs = checkKey(key);
            if (productions == null) {
                throw new GrammarFormatException("The productions of %s must be a collection of strings".formatted(key));
            }
            ruleSet.define(lhs);
            for (final String production : productions) {
                if (production == null) {
                    throw new GrammarFormatException("All productions of %s must be strings".formatted(key));
                }
                ruleSet.add(lhs, canonical(production), 1.0);
            }
        });
        return fromRuleSet(ruleSet, startSymbol);
    }

    public static Grammar createProbabilistic(final Map<String, ? extends Collection<Production>> rules) {
        return createProbabilistic(rules, null);
    }

    public static Grammar createProbabilistic(final Map<String, ? extends Collection<Production>> rules, final Character startSymbol) {
        if (rules == null) {
            throw new GrammarFormatException("The grammar must be given as a mapping of symbol to (production, probability) pairs");
        }
        final RuleSet ruleSet = RuleSet.empty(true);
        rules.forEach((key, productions) -> {
            final char lhs = checkKey(key);
            if (productions == null) {
                throw new GrammarFormatException("The productions of %s must be a collection of (production, probability) pairs".formatted(key));
            }
            ruleSet.define(lhs);
            for (final Production production : productions) {
                if (production == null || production.symbols() == null) {
                    throw new GrammarFormatException("All productions of %s must be (string, probability) pairs".formatted(key));
                }
                if (!Double.isFinite(production.probability())) {
                    throw new GrammarFormatException("Probability of %s -> %s is not a number: %s".formatted(key, production.symbols(), production.probability()));
                }
                if (production.probability() < 0.0) {
                    throw new ProbabilityException("Probability of %s -> %s is negative: %s".formatted(key, production.symbols(), production.probability()));
                }
                ruleSet.add(lhs, canonical(production.symbols()), production.probability());
            }
        });
        return fromRuleSet(ruleSet, startSymbol);
    }

    public static Grammar fromRuleSet(final RuleSet ruleSet, final Character startSymbol) {
        final Grammar grammar = new Grammar(ruleSet.isProbabilistic());
        grammar.install(ruleSet, startSymbol, 0.0);
        return grammar;
    }

    private static char checkKey(final String key) {
        if (key == null || key.length() != 1) {
            throw new GrammarFormatException("All symbols must be single characters, got: %s".formatted(key));
        }
        return key.charAt(0);
    }

    // epsilon has no effect next to other symbols; an empty production is epsilon
    private static String canonical(final String production) {
        final String stripped = production.replace(Symbols.EPSILON_STRING, "");
        return stripped.isEmpty() ? Symbols.EPSILON_STRING : stripped;
    }

    /**
     * Validates the given rules and replaces the state of this grammar with them. Nothing changes
     * when validation fails. The spare-name pool is recomputed from the new nonterminals.
     */
    public void rebuild(final RuleSet ruleSet, final char startSymbol) {
        rebuild(ruleSet, startSymbol, candidate -> {
        });
    }

    // check may reject the validated candidate by throwing, before anything is replaced
    public void rebuild(final RuleSet ruleSet, final char startSymbol, final Consumer<Grammar> check) {
        if (ruleSet.isProbabilistic() != probabilistic) {
            throw new IllegalArgumentException("Cannot rebuild a %s grammar from %s rules".formatted(
                    probabilistic ? "probabilistic" : "plain",
                    ruleSet.isProbabilistic() ? "probabilistic" : "plain"));
        }
        final Grammar candidate = new Grammar(probabilistic);
        candidate.install(ruleSet, startSymbol, REBUILD_TOLERANCE);
        check.accept(candidate);

        this.rules = candidate.rules;
        this.terminals = candidate.terminals;
        this.nonterminals = candidate.nonterminals;
        this.startSymbol = candidate.startSymbol;
        this.pool = candidate.pool;
    }

    private void install(final RuleSet ruleSet, final Character requestedStart, final double tolerance) {
        final Set<Character> nonterminals = new TreeSet<>(ruleSet.lhsSymbols());
        for (final char symbol : nonterminals) {
            if (!Symbols.isNonterminalName(symbol)) {
                throw new CaseConventionException("All nonterminal symbols must be uppercase, got: %s".formatted(symbol));
            }
        }

        final Set<Character> terminals = new TreeSet<>();
        final Set<Character> produced = new TreeSet<>();
        for (final char lhs : nonterminals) {
            for (final String rhs : ruleSet.productions(lhs).keySet()) {
                for (final char symbol : rhs.toCharArray()) {
                    produced.add(symbol);
                    if (!nonterminals.contains(symbol)) {
                        terminals.add(symbol);
                    }
                }
            }
        }
        for (final char symbol : terminals) {
            if (!Symbols.isTerminalName(symbol)) {
                throw new CaseConventionException("All terminal symbols must be lowercase letters or digits, got: %s".formatted(symbol));
            }
        }

        final char start;
        if (requestedStart != null) {
            if (!nonterminals.contains(requestedStart)) {
                throw new GrammarFormatException("Start symbol %s has no rules".formatted(requestedStart));
            }
            start = requestedStart;
        } else {
            final Set<Character> candidates = new TreeSet<>(nonterminals);
            candidates.removeAll(produced);
            if (candidates.size() != 1) {
                throw new AmbiguousStartSymbolException(candidates);
            }
            start = candidates.iterator().next();
        }

        final Set<Character> unreachable = new TreeSet<>(nonterminals);
        unreachable.removeAll(ruleSet.reachableFrom(start));
        if (!unreachable.isEmpty()) {
            throw new UnreachableSymbolException(start, unreachable);
        }

        if (probabilistic) {
            for (final char lhs : nonterminals) {
                checkProbabilitySum(lhs, ruleSet.productions(lhs), tolerance);
            }
        }

        final Map<Character, Map<String, Double>> installed = new TreeMap<>();
        for (final char lhs : nonterminals) {
            installed.put(lhs, Collections.unmodifiableMap(new TreeMap<>(ruleSet.productions(lhs))));
        }

        this.rules = Collections.unmodifiableMap(installed);
        this.terminals = Collections.unmodifiableSet(terminals);
        this.nonterminals = Collections.unmodifiableSet(nonterminals);
        this.startSymbol = start;
        this.pool = SymbolPool.excluding(nonterminals);
    }

    private static void checkProbabilitySum(final char lhs, final Map<String, Double> productions, final double tolerance) {
        if (tolerance == 0.0) {
            BigDecimal sum = BigDecimal.ZERO;
            for (final double probability : productions.values()) {
                sum = sum.add(BigDecimal.valueOf(probability));
            }
            if (sum.compareTo(BigDecimal.ONE) != 0) {
                throw new ProbabilityException("Probabilities of %s sum to %s instead of 1".formatted(lhs, sum.toPlainString()));
            }
            return;
        }
        final double sum = productions.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > tolerance) {
            throw new ProbabilityException("Probabilities of %s sum to %s instead of 1".formatted(lhs, sum));
        }
    }

    public boolean isProbabilistic() {
        return probabilistic;
    }

    public char startSymbol() {
        return startSymbol;
    }

    public Set<Character> terminals() {
        return terminals;
    }

    public Set<Character> nonterminals() {
        return nonterminals;
    }

    public boolean isTerminal(final char symbol) {
        return terminals.contains(symbol);
    }

    public boolean isNonterminal(final char symbol) {
        return nonterminals.contains(symbol);
    }

    public Set<String> productions(final char symbol) {
        final Map<String, Double> productions = rules.get(symbol);
        return productions == null ? Set.of() : productions.keySet();
    }

    public double probability(final char lhs, final String rhs) {
        if (!probabilistic) {
            throw new IllegalStateException("Plain grammars have no production probabilities");
        }
        final Double probability = rules.getOrDefault(lhs, Map.of()).get(rhs);
        if (probability == null) {
            throw new IllegalArgumentException("No such rule: %s -> %s".formatted(lhs, rhs));
        }
        return probability;
    }

    // every rule, ordered by left-hand side and then right-hand side
    public List<Rule> rules() {
        final List<Rule> result = new ArrayList<>();
        rules.forEach((lhs, productions) -> productions.forEach((rhs, probability) -> result.add(new Rule(lhs, rhs, probability))));
        result.sort(Rule.ORDER);
        return result;
    }

    public boolean producesEpsilon(final char symbol) {
        return productions(symbol).contains(Symbols.EPSILON_STRING);
    }

    public boolean isCnf() {
        boolean startOnRightHandSide = false;
        for (final Map.Entry<Character, Map<String, Double>> entry : rules.entrySet()) {
            final char lhs = entry.getKey();
            for (final String rhs : entry.getValue().keySet()) {
                if (rhs.indexOf(startSymbol) >= 0) {
                    startOnRightHandSide = true;
                }
                if (Symbols.isEpsilon(rhs)) {
                    if (lhs != startSymbol) {
                        return false;
                    }
                } else if (rhs.length() == 1) {
                    if (!isTerminal(rhs.charAt(0))) {
                        return false;
                    }
                } else if (rhs.length() == 2) {
                    if (!isNonterminal(rhs.charAt(0)) || !isNonterminal(rhs.charAt(1))) {
                        return false;
                    }
                } else {
                    return false;
                }
            }
        }
        return !(startOnRightHandSide && producesEpsilon(startSymbol));
    }

    // a mutable copy of the rules, allocating fresh names from a copy of this grammar's pool
    public RuleSet newRuleSet() {
        final RuleSet ruleSet = RuleSet.withPool(probabilistic, pool.copy());
        rules.forEach((lhs, productions) -> {
            ruleSet.define(lhs);
            ruleSet.addAll(lhs, productions);
        });
        return ruleSet;
    }

    @Override
    public String toString() {
        final Set<Character> order = new LinkedHashSet<>();
        order.add(startSymbol);
        final Set<Character> producedByStart = new TreeSet<>();
        for (final String rhs : productions(startSymbol)) {
            for (final char symbol : rhs.toCharArray()) {
                if (isNonterminal(symbol)) {
                    producedByStart.add(symbol);
                }
            }
        }
        order.addAll(producedByStart);
        order.addAll(nonterminals);

        final String body = order.stream()
                .map(lhs -> "\t%s --> %s".formatted(lhs, rules.get(lhs).entrySet().stream()
                        .map(entry -> probabilistic ? "%s [%s]".formatted(entry.getKey(), entry.getValue()) : entry.getKey())
                        .collect(joining(" | "))))
                .collect(joining("\n"));

        return "%s(\n%s\n)\n\n* Start Symbol: %s\n* Terminal Symbols: %s\n* Non-Terminal Symbols: %s".formatted(
                probabilistic ? "PCFG" : "CFG",
                body,
                startSymbol,
                Symbols.render(terminals),
                Symbols.render(order));
    }
}
