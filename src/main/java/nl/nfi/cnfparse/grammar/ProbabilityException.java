package nl.nfi.cnfparse.grammar;

public final class ProbabilityException extends GrammarException {

    public ProbabilityException(final String message) {
        super(message);
    }
}
