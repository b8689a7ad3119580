package nl.nfi.cnfparse.grammar;

import java.util.Collection;
import java.util.TreeSet;

// finite set of unused nonterminal names, owned by a single grammar (or its working copy)
public final class SymbolPool {

    private final TreeSet<Character> available;
    private final int capacity;

    private SymbolPool(final TreeSet<Character> available, final int capacity) {
        this.available = available;
        this.capacity = capacity;
    }

    public static SymbolPool excluding(final Collection<Character> inUse) {
        final TreeSet<Character> available = new TreeSet<>(Symbols.spareAlphabet());
        final int capacity = available.size();
        available.removeAll(inUse);
        return new SymbolPool(available, capacity);
    }

    // smallest unused name first
    public char reserve() {
        if (available.isEmpty()) {
            throw new ExhaustedAlphabetException(capacity);
        }
        return available.pollFirst();
    }

    public SymbolPool copy() {
        return new SymbolPool(new TreeSet<>(available), capacity);
    }
}
