package nl.nfi.djlcfrs.grammar;

import java.util.List;

import static java.util.stream.Collectors.joining;

public record Argument(List<Token> tokens) {

    public Argument {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Argument must contain at least one token");
        }
        tokens = List.copyOf(tokens);
    }

    public static Argument of(final Token... tokens) {
        return new Argument(List.of(tokens));
    }

    public boolean isVariablesOnly() {
        return tokens.stream().allMatch(token -> token instanceof Token.Variable);
    }

    public String render() {
        return tokens.stream().map(Token::render).collect(joining());
    }
}
