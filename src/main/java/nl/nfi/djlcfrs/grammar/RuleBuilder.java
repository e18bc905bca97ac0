package nl.nfi.djlcfrs.grammar;

import nl.nfi.djlcfrs.tree.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static nl.nfi.djlcfrs.grammar.ArgumentDecomposer.decompose;

// each daughter argument is a run inside one mother argument and is contracted to a fresh variable
public final class RuleBuilder {

    private final DaughterOrder daughterOrder;

    private RuleBuilder(final DaughterOrder daughterOrder) {
        this.daughterOrder = daughterOrder;
    }

    public static RuleBuilder withDaughterOrder(final DaughterOrder daughterOrder) {
        return new RuleBuilder(daughterOrder);
    }

    public Rule ruleFor(final Node node) {
        return node.isLeaf() ? terminalRule(node) : nonterminalRule(node);
    }

    public Rule terminalRule(final Node leaf) {
        if (!leaf.isLeaf()) {
            throw new IllegalArgumentException("Not a leaf: %s".formatted(leaf));
        }
        return Rule.terminal(new Predicate(leaf.label(), List.of(Argument.of(new Token.Terminal(leaf.id())))));
    }

    public Rule nonterminalRule(final Node node) {
        if (node.isLeaf() || !node.hasSpan()) {
            throw new IllegalArgumentException("Not an internal node with a span: %s".formatted(node));
        }

        final List<List<Token>> lhsArguments = new ArrayList<>();
        for (final Argument argument : decompose(node.span())) {
            lhsArguments.add(new ArrayList<>(argument.tokens()));
        }

        int variableCount = 0;
        final List<Predicate> rhs = new ArrayList<>();
        for (final Node daughter : daughterOrder.arrange(node.daughters())) {
            final List<Argument> daughterArguments = new ArrayList<>();
            for (final Argument component : decompose(daughter.span())) {
                final Token.Variable variable = new Token.Variable(variableCount++);
                substitute(lhsArguments, component.tokens(), variable, node);
                daughterArguments.add(Argument.of(variable));
            }
            rhs.add(new Predicate(daughter.label(), daughterArguments));
        }

        final List<Argument> contracted = new ArrayList<>(lhsArguments.size());
        for (final List<Token> tokens : lhsArguments) {
            final Argument argument = new Argument(tokens);
            if (!argument.isVariablesOnly()) {
                throw new IllegalStateException("Daughters of %s do not cover argument %s".formatted(node, argument.render()));
            }
            contracted.add(argument);
        }

        return Rule.nonterminal(new Predicate(node.label(), contracted), rhs);
    }

    // replaces the run as a whole, token by token, so Y_1 never matches inside Y_10
    private static void substitute(final List<List<Token>> lhsArguments, final List<Token> run, final Token.Variable variable, final Node node) {
        for (final List<Token> argument : lhsArguments) {
            final int start = Collections.indexOfSubList(argument, run);
            if (start >= 0) {
                final List<Token> matched = argument.subList(start, start + run.size());
                matched.clear();
                matched.add(variable);
                return;
            }
        }
        throw new IllegalStateException("Daughter argument %s not found in arguments of %s".formatted(new Argument(run).render(), node));
    }
}
