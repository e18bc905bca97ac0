package nl.nfi.djlcfrs.treebank;

import java.util.List;

// raw node lines between #BOS <id> and #EOS <id>,
// terminated is false when the block ended without #EOS
public record TreebankSentence(String id, List<String> lines, boolean terminated) {

    public TreebankSentence {
        lines = List.copyOf(lines);
    }
}
