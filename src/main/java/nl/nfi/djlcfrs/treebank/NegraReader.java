package nl.nfi.djlcfrs.treebank;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

// #BOS 1
// Peter    --    NE      --    SB    500
// schläft  --    VVFIN   --    HD    500
// #500     --    S       --    --    0
// #EOS 1
// node lines are left unparsed here, a malformed line only affects its own sentence
public final class NegraReader implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(NegraReader.class);

    private static final String BEGIN_OF_SENTENCE = "#BOS";
    private static final String END_OF_SENTENCE = "#EOS";
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final BufferedReader input;
    private final CorpusFormat format;

    // #BOS line that ended an unterminated block, starts the next one
    private String pendingBegin;
    private long lineNumber;

    private NegraReader(final BufferedReader input, final CorpusFormat format) {
        this.input = input;
        this.format = format;
    }

    public static NegraReader forInput(final Reader input, final CorpusFormat format) {
        return new NegraReader(input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input), format);
    }

    public static NegraReader open(final Path path, final CorpusFormat format) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Treebank file does not exist: %s".formatted(path));
        }
        return forInput(Files.newBufferedReader(path, UTF_8), format);
    }

    public Optional<TreebankSentence> next() throws IOException {
        String begin = pendingBegin;
        pendingBegin = null;
        while (begin == null) {
            final String line = readLine();
            if (line == null) {
                return Optional.empty();
            }
            if (line.startsWith(BEGIN_OF_SENTENCE)) {
                begin = line;
            } else if (line.startsWith(END_OF_SENTENCE)) {
                LOG.warn("Ignoring {} without preceding {} at line {}", END_OF_SENTENCE, BEGIN_OF_SENTENCE, lineNumber);
            }
        }

        // #BOS <id> [<editor> <date> <origin>]
        final String[] header = begin.substring(BEGIN_OF_SENTENCE.length()).strip().split("\\s+");
        final String id = header[0];
        final List<String> lines = new ArrayList<>();
        for (String line = readLine(); line != null; line = readLine()) {
            if (line.startsWith(END_OF_SENTENCE)) {
                return Optional.of(new TreebankSentence(id, lines, true));
            }
            if (line.startsWith(BEGIN_OF_SENTENCE)) {
                pendingBegin = line;
                return Optional.of(new TreebankSentence(id, lines, false));
            }
            if (!line.isBlank() && !format.isComment(line)) {
                lines.add(line);
            }
        }
        return Optional.of(new TreebankSentence(id, lines, false));
    }

    private String readLine() throws IOException {
        final String line = input.readLine();
        if (line == null) {
            return null;
        }
        lineNumber++;
        // the UTF-8 decoder keeps a leading byte order mark
        if (lineNumber == 1 && line.startsWith(BYTE_ORDER_MARK)) {
            return line.substring(BYTE_ORDER_MARK.length());
        }
        return line;
    }

    @Override
    public void close() throws IOException {
        input.close();
    }
}
