package nl.nfi.cnfparse.grammar;

import java.util.Set;

public final class AmbiguousStartSymbolException extends GrammarException {

    private final Set<Character> candidates;

    public AmbiguousStartSymbolException(final Set<Character> candidates) {
        super(candidates.isEmpty()
                ? "Could not infer the start symbol, every nonterminal is produced by some rule"
                : "Could not infer the start symbol, %d candidates found: %s".formatted(candidates.size(), candidates));
        this.candidates = Set.copyOf(candidates);
    }

    public Set<Character> candidates() {
        return candidates;
    }
}
