package nl.nfi.cnfparse.grammar;

// base of all errors raised while building or rewriting a grammar from user input
public abstract class GrammarException extends RuntimeException {

    protected GrammarException(final String message) {
        super(message);
    }
}
