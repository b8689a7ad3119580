package nl.nfi.cnfparse.grammar;

// the spare nonterminal names are used up, CNF conversion cannot continue
public final class ExhaustedAlphabetException extends GrammarException {

    public ExhaustedAlphabetException(final int poolSize) {
        super("All %d spare nonterminal names are in use, the grammar cannot be converted to CNF".formatted(poolSize));
    }
}
