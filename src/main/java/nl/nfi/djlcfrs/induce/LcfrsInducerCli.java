package nl.nfi.djlcfrs.induce;

import nl.nfi.djlcfrs.grammar.DaughterOrder;
import nl.nfi.djlcfrs.grammar.GrammarWriter;
import nl.nfi.djlcfrs.treebank.CorpusFormat;
import nl.nfi.djlcfrs.treebank.ExportFormat;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "lcfrs_inducer", mixinStandardHelpOptions = true,
        description = "Induces an LCFRS grammar from a treebank in NeGra export format")
public class LcfrsInducerCli implements Callable<Integer> {

    @Option(names = {"--input"}, description = "The treebank file to induce the grammar from", required = true)
    private String inputPath;

    @Option(names = {"--output"}, description = "The file to write the sorted rules to (- for standard output)")
    private String outputPath = "-";

    @Option(names = {"--format"}, description = "Valid values: ${COMPLETION-CANDIDATES} (case insensitive)", defaultValue = "negra_v4")
    private ExportFormat format;

    @Option(names = {"--format_config"}, description = "INI file with a [CORPUS_FORMAT] section overriding the column layout of --format")
    private String formatConfigPath = null;

    @Option(names = {"--daughter_order"}, description = "Valid values: ${COMPLETION-CANDIDATES} (case insensitive)", defaultValue = "position")
    private DaughterOrder daughterOrder;

    @Option(names = {"--progress_interval"}, description = "Report progress every <interval> trees")
    private long progressInterval = 100;

    @Option(names = {"--thread_count"}, description = "Use <count> threads for induction")
    private int threadCount = 1;

    @Option(names = {"--strict"}, description = "Abort on the first malformed tree instead of skipping it")
    private boolean strict = false;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        // must be set before the first logger is created
        if (logPath != null) {
            System.setProperty("LOG_DIRECTORY_PATH", logPath);
        }

        try {
            final CorpusFormat corpusFormat = formatConfigPath != null
                    ? CorpusFormat.loadFrom(Paths.get(formatConfigPath), format.corpusFormat())
                    : format.corpusFormat();

            final InductionResult result = LcfrsInducer.withDefaults()
                    .format(corpusFormat)
                    .daughterOrder(daughterOrder)
                    .threadCount(threadCount)
                    .progressInterval(progressInterval)
                    .strict(strict)
                    .induce(Paths.get(inputPath));

            if (outputPath.equals("-")) {
                // UTF-8 regardless of the platform charset, flushed but never closed
                GrammarWriter.forOutput(new PrintStream(System.out, false, UTF_8)).write(result.grammar());
                return ExitCode.OK;
            }
            try (final PrintStream output = new PrintStream(new BufferedOutputStream(new FileOutputStream(Paths.get(outputPath).toFile())), false, UTF_8)) {
                GrammarWriter.forOutput(output).write(result.grammar());
            }
        }
        catch (final Throwable t) {
            LoggerFactory.getLogger(LcfrsInducerCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }
}
