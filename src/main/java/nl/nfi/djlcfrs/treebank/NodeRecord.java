package nl.nfi.djlcfrs.treebank;

// a single node line of a sentence block, e.g. (NeGra export format 4):
//      Darüber    --    PROAV    --    MO    502
//      #502       --    VP       --    OC    501
//  where id = Darüber (the word, a leaf) or 502 (internal, marker stripped)
//  and motherId = null when the mother column holds the root sentinel
public record NodeRecord(String id, String label, String motherId, boolean internal) {

    public static NodeRecord leaf(final String word, final String label, final String motherId) {
        return new NodeRecord(word, label, motherId, false);
    }

    public static NodeRecord internal(final String id, final String label, final String motherId) {
        return new NodeRecord(id, label, motherId, true);
    }

    public boolean hasMother() {
        return motherId != null;
    }
}
