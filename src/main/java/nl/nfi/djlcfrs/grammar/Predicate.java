package nl.nfi.djlcfrs.grammar;

import java.util.List;

import static java.util.stream.Collectors.joining;

// rendered as Name(arg1,arg2,...)
public record Predicate(String name, List<Argument> arguments) {

    public Predicate {
        arguments = List.copyOf(arguments);
    }

    public int fanOut() {
        return arguments.size();
    }

    public String render() {
        return arguments.stream().map(Argument::render).collect(joining(",", name + "(", ")"));
    }
}
