package nl.nfi.cnfparse.normalize;

// the normalizer produced something that is not a valid CNF grammar, i.e. a defect in the normalizer itself
public final class CnfInvariantException extends IllegalStateException {

    public CnfInvariantException(final String message) {
        super(message);
    }

    public CnfInvariantException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
