package nl.nfi.djlcfrs.tree;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static java.util.stream.Collectors.joining;

// leaves get their index among the leaves, internal nodes resolve by repeated scans
// once all their daughters carry a span; a scan without progress cannot be recovered
public final class SpanPropagator {

    private SpanPropagator() {
    }

    // returns the internal nodes in the order they were resolved, daughters before mothers
    public static List<Node> propagate(final Tree tree) throws UnresolvableTreeException {
        final List<Node> leaves = tree.leaves();
        for (int position = 0; position < leaves.size(); position++) {
            leaves.get(position).span(Span.of(position));
        }

        final List<Node> unresolved = new ArrayList<>(tree.internalNodes());
        final List<Node> resolved = new ArrayList<>(unresolved.size());

        while (!unresolved.isEmpty()) {
            boolean progress = false;
            for (final Iterator<Node> iterator = unresolved.iterator(); iterator.hasNext(); ) {
                final Node node = iterator.next();
                if (isResolvable(node)) {
                    node.span(Span.union(node.daughters().stream().map(Node::span).toList()));
                    resolved.add(node);
                    iterator.remove();
                    progress = true;
                }
            }
            if (!progress) {
                throw new UnresolvableTreeException("Cannot compute spans for nodes: %s".formatted(
                        unresolved.stream().map(node -> "#" + node.id()).collect(joining(", "))
                ));
            }
        }

        return resolved;
    }

    private static boolean isResolvable(final Node node) {
        if (node.daughters().isEmpty()) {
            return false;
        }
        for (final Node daughter : node.daughters()) {
            if (!daughter.hasSpan()) {
                return false;
            }
        }
        return true;
    }
}
