package nl.nfi.djlcfrs.tree;

import nl.nfi.djlcfrs.treebank.NodeRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// daughters are linked leaves first, then internal nodes, both in declaration order
// a node under the root sentinel is nobody's daughter, punctuation leaves included
public final class TreeBuilder {

    private TreeBuilder() {
    }

    public static Tree build(final List<NodeRecord> records) throws MalformedTreeException {
        if (records.isEmpty()) {
            throw new MalformedTreeException("Tree contains no nodes");
        }

        final List<Node> leaves = new ArrayList<>();
        final Map<String, Node> internalNodes = new LinkedHashMap<>();

        for (final NodeRecord record : records) {
            if (record.internal()) {
                if (internalNodes.containsKey(record.id())) {
                    throw new MalformedTreeException("Duplicate internal node id: #%s".formatted(record.id()));
                }
                internalNodes.put(record.id(), Node.internal(record.id(), record.label(), record.motherId()));
            } else {
                leaves.add(Node.leaf(record.id(), record.label(), record.motherId()));
            }
        }

        for (final Node leaf : leaves) {
            checkMother(leaf, internalNodes);
        }
        for (final Node node : internalNodes.values()) {
            checkMother(node, internalNodes);
        }
        checkAcyclic(internalNodes);

        for (final Node leaf : leaves) {
            if (leaf.hasMother()) {
                internalNodes.get(leaf.motherId()).addDaughter(leaf);
            }
        }
        for (final Node node : internalNodes.values()) {
            if (node.hasMother()) {
                internalNodes.get(node.motherId()).addDaughter(node);
            }
        }

        return new Tree(leaves, internalNodes);
    }

    private static void checkMother(final Node node, final Map<String, Node> internalNodes) throws MalformedTreeException {
        if (node.hasMother() && !internalNodes.containsKey(node.motherId())) {
            throw new MalformedTreeException("Node %s refers to unknown mother #%s".formatted(node.id(), node.motherId()));
        }
    }

    // a chain of mothers longer than the number of internal nodes must revisit a node
    private static void checkAcyclic(final Map<String, Node> internalNodes) throws CyclicMotherhoodException {
        for (final Node start : internalNodes.values()) {
            Node current = start;
            int steps = 0;
            while (current.hasMother()) {
                current = internalNodes.get(current.motherId());
                steps++;
                if (steps > internalNodes.size()) {
                    throw new CyclicMotherhoodException("Following mothers from #%s does not reach a root".formatted(start.id()));
                }
            }
        }
    }
}
