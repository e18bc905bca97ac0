package nl.nfi.djlcfrs.grammar;

import nl.nfi.djlcfrs.tree.Node;

import java.util.ArrayList;
import java.util.List;

import static java.util.Comparator.comparingInt;

// order of the right-hand side predicates of a nonterminal rule
public enum DaughterOrder {

    // by the leftmost terminal position a daughter dominates
    POSITION,
    // as linked by the tree builder: leaves first, then internal nodes, in file order
    DECLARATION;

    public List<Node> arrange(final List<Node> daughters) {
        return switch (this) {
            case DECLARATION -> daughters;
            case POSITION -> {
                final List<Node> sorted = new ArrayList<>(daughters);
                sorted.sort(comparingInt(daughter -> daughter.span().min()));
                yield sorted;
            }
        };
    }
}
