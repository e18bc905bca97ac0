package nl.nfi.djlcfrs.grammar;

import nl.nfi.djlcfrs.tree.Span;

import java.util.ArrayList;
import java.util.List;

// maximal runs of consecutive positions, {0,2,3} -> Y_0 and Y_2Y_3
public final class ArgumentDecomposer {

    private ArgumentDecomposer() {
    }

    public static List<Argument> decompose(final Span span) {
        if (span.isEmpty()) {
            throw new IllegalArgumentException("Cannot decompose an empty span");
        }

        final List<Argument> arguments = new ArrayList<>();
        List<Token> component = new ArrayList<>();
        for (int i = 0; i < span.size(); i++) {
            final int position = span.positionAt(i);
            // gap: start a new component
            if (i > 0 && position != span.positionAt(i - 1) + 1) {
                arguments.add(new Argument(component));
                component = new ArrayList<>();
            }
            component.add(new Token.Position(position));
        }
        arguments.add(new Argument(component));
        return arguments;
    }

    public static int fanOut(final Span span) {
        return decompose(span).size();
    }
}
