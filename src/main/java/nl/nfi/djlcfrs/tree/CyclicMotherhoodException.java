package nl.nfi.djlcfrs.tree;

public final class CyclicMotherhoodException extends MalformedTreeException {

    public CyclicMotherhoodException(final String message) {
        super(message);
    }
}
