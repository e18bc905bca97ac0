package nl.nfi.djlcfrs.grammar;

import java.util.List;

import static java.util.stream.Collectors.joining;

// VP(X_0,X_1X_2)->VP(X_0,X_1)VAINF(X_2)
// VAINF(werden)->eps
public final class Rule {

    public static final String ARROW = "->";
    public static final String TERMINAL_MARKER = "eps";

    private final Predicate lhs;
    private final List<Predicate> rhs;
    private final String form;

    private Rule(final Predicate lhs, final List<Predicate> rhs) {
        this.lhs = lhs;
        this.rhs = List.copyOf(rhs);
        this.form = lhs.render() + ARROW + (rhs.isEmpty()
                ? TERMINAL_MARKER
                : rhs.stream().map(Predicate::render).collect(joining()));
    }

    public static Rule terminal(final Predicate lhs) {
        return new Rule(lhs, List.of());
    }

    public static Rule nonterminal(final Predicate lhs, final List<Predicate> rhs) {
        if (rhs.isEmpty()) {
            throw new IllegalArgumentException("Nonterminal rule %s needs at least one right-hand side predicate".formatted(lhs.render()));
        }
        return new Rule(lhs, rhs);
    }

    public Predicate lhs() {
        return lhs;
    }

    public List<Predicate> rhs() {
        return rhs;
    }

    public boolean isTerminal() {
        return rhs.isEmpty();
    }

    public int fanOut() {
        return lhs.fanOut();
    }

    public String form() {
        return form;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return form.equals(((Rule) o).form);
    }

    @Override
    public int hashCode() {
        return form.hashCode();
    }

    @Override
    public String toString() {
        return form;
    }
}
