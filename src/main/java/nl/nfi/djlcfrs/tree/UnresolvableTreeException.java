package nl.nfi.djlcfrs.tree;

public final class UnresolvableTreeException extends TreeException {

    public UnresolvableTreeException(final String message) {
        super(message);
    }
}
