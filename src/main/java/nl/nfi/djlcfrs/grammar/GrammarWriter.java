package nl.nfi.djlcfrs.grammar;

import java.io.PrintStream;

// one rule form per line, sorted
public final class GrammarWriter {

    private final PrintStream output;

    private GrammarWriter(final PrintStream output) {
        this.output = output;
    }

    public static GrammarWriter forOutput(final PrintStream output) {
        return new GrammarWriter(output);
    }

    public void write(final Grammar grammar) {
        for (final String form : grammar.forms()) {
            output.println(form);
        }
        output.flush();
    }
}
