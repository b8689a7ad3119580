package nl.nfi.cnfparse.grammar;

// nonterminals are uppercase letters, terminals lowercase letters or digits
public final class CaseConventionException extends GrammarException {

    public CaseConventionException(final String message) {
        super(message);
    }
}
