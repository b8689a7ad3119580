package nl.nfi.cnfparse.grammar;

public final class GrammarFormatException extends GrammarException {

    public GrammarFormatException(final String message) {
        super(message);
    }
}
