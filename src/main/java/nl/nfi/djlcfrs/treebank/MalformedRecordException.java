package nl.nfi.djlcfrs.treebank;

import nl.nfi.djlcfrs.tree.TreeException;

public final class MalformedRecordException extends TreeException {

    public MalformedRecordException(final String message) {
        super(message);
    }
}
