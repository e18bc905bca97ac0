package nl.nfi.djlcfrs.induce;

import nl.nfi.djlcfrs.grammar.Grammar;

import java.time.Duration;

public record InductionResult(Grammar grammar, long treeCount, long skippedTreeCount, Duration duration) {

    public long inducedTreeCount() {
        return treeCount - skippedTreeCount;
    }
}
