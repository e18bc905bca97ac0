package nl.nfi.djlcfrs.tree;

// failure local to a single tree, the tree contributes no rules
public class TreeException extends Exception {

    public TreeException(final String message) {
        super(message);
    }
}
