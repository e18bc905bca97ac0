package nl.nfi.djlcfrs.main;

import nl.nfi.djlcfrs.induce.LcfrsInducerCli;
import picocli.CommandLine;

public final class InducerMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new LcfrsInducerCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }
}
