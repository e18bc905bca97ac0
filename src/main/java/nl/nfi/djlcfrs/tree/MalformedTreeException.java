package nl.nfi.djlcfrs.tree;

public class MalformedTreeException extends TreeException {

    public MalformedTreeException(final String message) {
        super(message);
    }
}
