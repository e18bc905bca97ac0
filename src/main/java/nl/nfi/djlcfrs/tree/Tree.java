package nl.nfi.djlcfrs.tree;

import java.util.List;
import java.util.Map;

// leaves in left-to-right input order (their index is their terminal position),
// internal nodes by id in declaration order
public final class Tree {

    private final List<Node> leaves;
    private final Map<String, Node> internalNodes;

    Tree(final List<Node> leaves, final Map<String, Node> internalNodes) {
        this.leaves = List.copyOf(leaves);
        this.internalNodes = internalNodes;
    }

    public List<Node> leaves() {
        return leaves;
    }

    public List<Node> internalNodes() {
        return List.copyOf(internalNodes.values());
    }

    public Node internalNode(final String id) {
        final Node node = internalNodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No internal node with id: %s".formatted(id));
        }
        return node;
    }

    public int terminalCount() {
        return leaves.size();
    }
}
