package nl.nfi.djlcfrs.tree;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;

public final class Node {

    // the word for a leaf, the id without marker for an internal node
    private final String id;
    private final String label;
    private final String motherId;
    private final boolean leaf;
    private final List<Node> daughters;

    private Span span;

    private Node(final String id, final String label, final String motherId, final boolean leaf) {
        this.id = id;
        this.label = label;
        this.motherId = motherId;
        this.leaf = leaf;
        this.daughters = new ArrayList<>();
        this.span = Span.empty();
    }

    static Node leaf(final String word, final String label, final String motherId) {
        return new Node(word, label, motherId, true);
    }

    static Node internal(final String id, final String label, final String motherId) {
        return new Node(id, label, motherId, false);
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public String motherId() {
        return motherId;
    }

    public boolean hasMother() {
        return motherId != null;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public List<Node> daughters() {
        return unmodifiableList(daughters);
    }

    public Span span() {
        return span;
    }

    public boolean hasSpan() {
        return !span.isEmpty();
    }

    void addDaughter(final Node daughter) {
        daughters.add(daughter);
    }

    void span(final Span span) {
        this.span = span;
    }

    @Override
    public String toString() {
        return "%s:%s%s".formatted(leaf ? id : "#" + id, label, span);
    }
}
