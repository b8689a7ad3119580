package nl.nfi.cnfparse.parse;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

// one span of the chart: at most one entry per nonterminal, iterated in symbol order
final class ChartCell {

    private final Map<Character, ChartEntry> entries = new TreeMap<>();

    // keeps the first entry for a symbol unless a later one is strictly more probable
    boolean offer(final ChartEntry entry) {
        final ChartEntry existing = entries.get(entry.symbol());
        if (existing == null || entry.probability() > existing.probability()) {
            entries.put(entry.symbol(), entry);
            return true;
        }
        return false;
    }

    ChartEntry get(final char symbol) {
        return entries.get(symbol);
    }

    Collection<ChartEntry> entries() {
        return entries.values();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    int size() {
        return entries.size();
    }
}
