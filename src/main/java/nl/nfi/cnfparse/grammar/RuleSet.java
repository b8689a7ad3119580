package nl.nfi.cnfparse.grammar;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

// mutable mapping of left-hand side to weighted productions, e.g.:
//      S -> {AB=0.6, a=0.4}
// grammars hand out copies of their rules as a RuleSet, rewrite them, and validate the result on rebuild
public final class RuleSet {

    private final boolean probabilistic;
    private final Map<Character, Map<String, Double>> rules;
    private SymbolPool pool;

    private RuleSet(final boolean probabilistic, final Map<Character, Map<String, Double>> rules, final SymbolPool pool) {
        this.probabilistic = probabilistic;
        this.rules = rules;
        this.pool = pool;
    }

    public static RuleSet empty(final boolean probabilistic) {
        return new RuleSet(probabilistic, new TreeMap<>(), null);
    }

    static RuleSet withPool(final boolean probabilistic, final SymbolPool pool) {
        return new RuleSet(probabilistic, new TreeMap<>(), pool);
    }

    public boolean isProbabilistic() {
        return probabilistic;
    }

    public Set<Character> lhsSymbols() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public boolean contains(final char lhs) {
        return rules.containsKey(lhs);
    }

    public Map<String, Double> productions(final char lhs) {
        final Map<String, Double> productions = rules.get(lhs);
        if (productions == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(productions);
    }

    // collisions of a weighted rule add up, plain rules are always weighted 1.0
    public void add(final char lhs, final String rhs, final double probability) {
        final Map<String, Double> productions = rules.computeIfAbsent(lhs, key -> new TreeMap<>());
        if (probabilistic) {
            productions.merge(rhs, probability, Double::sum);
        } else {
            productions.put(rhs, 1.0);
        }
    }

    public void addAll(final char lhs, final Map<String, Double> productions) {
        productions.forEach((rhs, probability) -> add(lhs, rhs, probability));
    }

    // registers a left-hand side, possibly without any productions yet
    public void define(final char lhs) {
        rules.computeIfAbsent(lhs, key -> new TreeMap<>());
    }

    public void replace(final char lhs, final Map<String, Double> productions) {
        rules.put(lhs, new TreeMap<>());
        addAll(lhs, productions);
    }

    public void remove(final char lhs) {
        rules.remove(lhs);
    }

    public int size() {
        return rules.values().stream().mapToInt(Map::size).sum();
    }

    // the left-hand side whose productions are exactly {rhs}, if any
    public Optional<Character> findSoleProducer(final String rhs) {
        for (final Map.Entry<Character, Map<String, Double>> entry : rules.entrySet()) {
            final Map<String, Double> productions = entry.getValue();
            if (productions.size() == 1 && productions.containsKey(rhs)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public char freshNonterminal() {
        if (pool == null) {
            pool = SymbolPool.excluding(rules.keySet());
        }
        final char symbol = pool.reserve();
        define(symbol);
        return symbol;
    }

    // reuses an existing nonterminal that only produces rhs, or defines a fresh one as (rhs, 1.0)
    public char findOrCreateNonterminal(final String rhs) {
        final Optional<Character> existing = findSoleProducer(rhs);
        if (existing.isPresent()) {
            return existing.get();
        }
        final char symbol = freshNonterminal();
        add(symbol, rhs, 1.0);
        return symbol;
    }

    public Set<Character> reachableFrom(final char start) {
        final Set<Character> reachable = new TreeSet<>();
        final Deque<Character> toProcess = new ArrayDeque<>();
        toProcess.push(start);
        while (!toProcess.isEmpty()) {
            final char current = toProcess.pop();
            if (!reachable.add(current)) {
                continue;
            }
            for (final String rhs : productions(current).keySet()) {
                for (final char symbol : rhs.toCharArray()) {
                    if (rules.containsKey(symbol) && !reachable.contains(symbol)) {
                        toProcess.push(symbol);
                    }
                }
            }
        }
        return reachable;
    }
}
