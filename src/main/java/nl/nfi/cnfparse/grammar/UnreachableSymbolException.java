package nl.nfi.cnfparse.grammar;

import java.util.Set;

public final class UnreachableSymbolException extends GrammarException {

    private final Set<Character> unreachable;

    public UnreachableSymbolException(final char startSymbol, final Set<Character> unreachable) {
        super("Nonterminals %s cannot be reached from start symbol %s".formatted(unreachable, startSymbol));
        this.unreachable = Set.copyOf(unreachable);
    }

    public Set<Character> unreachable() {
        return unreachable;
    }
}
