package nl.nfi.djlcfrs.induce;

import nl.nfi.djlcfrs.grammar.DaughterOrder;
import nl.nfi.djlcfrs.grammar.Grammar;
import nl.nfi.djlcfrs.grammar.Rule;
import nl.nfi.djlcfrs.grammar.RuleBuilder;
import nl.nfi.djlcfrs.tree.MalformedTreeException;
import nl.nfi.djlcfrs.tree.Node;
import nl.nfi.djlcfrs.tree.SpanPropagator;
import nl.nfi.djlcfrs.tree.Tree;
import nl.nfi.djlcfrs.tree.TreeBuilder;
import nl.nfi.djlcfrs.tree.TreeException;
import nl.nfi.djlcfrs.treebank.CorpusFormat;
import nl.nfi.djlcfrs.treebank.NegraReader;
import nl.nfi.djlcfrs.treebank.NodeRecord;
import nl.nfi.djlcfrs.treebank.TreebankSentence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.Reader;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongConsumer;

import static java.util.concurrent.Executors.newFixedThreadPool;
import static java.util.concurrent.TimeUnit.DAYS;

// per tree: link records, propagate spans, one rule per node, merge into the grammar
// with more than one thread only the merge is shared
public final class LcfrsInducer {

    private static final Logger LOG = LoggerFactory.getLogger(LcfrsInducer.class);

    private static final long DEFAULT_PROGRESS_INTERVAL = 100;
    // sentences read ahead per worker thread
    private static final int READ_AHEAD_PER_THREAD = 64;

    private final CorpusFormat format;
    private final DaughterOrder daughterOrder;
    private final int threadCount;
    private final long progressInterval;
    private final boolean strict;
    private final LongConsumer progressListener;

    private LcfrsInducer(final CorpusFormat format, final DaughterOrder daughterOrder, final int threadCount,
                         final long progressInterval, final boolean strict, final LongConsumer progressListener) {
        this.format = format;
        this.daughterOrder = daughterOrder;
        this.threadCount = threadCount;
        this.progressInterval = progressInterval;
        this.strict = strict;
        this.progressListener = progressListener;
    }

    public static LcfrsInducer withDefaults() {
        return new LcfrsInducer(CorpusFormat.NEGRA_V4, DaughterOrder.POSITION, 1, DEFAULT_PROGRESS_INTERVAL, false, count -> {});
    }

    public LcfrsInducer format(final CorpusFormat format) {
        return new LcfrsInducer(format, daughterOrder, threadCount, progressInterval, strict, progressListener);
    }

    public LcfrsInducer daughterOrder(final DaughterOrder daughterOrder) {
        return new LcfrsInducer(format, daughterOrder, threadCount, progressInterval, strict, progressListener);
    }

    public LcfrsInducer threadCount(final int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be positive: %d".formatted(threadCount));
        }
        return new LcfrsInducer(format, daughterOrder, threadCount, progressInterval, strict, progressListener);
    }

    public LcfrsInducer progressInterval(final long progressInterval) {
        if (progressInterval < 1) {
            throw new IllegalArgumentException("Progress interval must be positive: %d".formatted(progressInterval));
        }
        return new LcfrsInducer(format, daughterOrder, threadCount, progressInterval, strict, progressListener);
    }

    public LcfrsInducer strict(final boolean strict) {
        return new LcfrsInducer(format, daughterOrder, threadCount, progressInterval, strict, progressListener);
    }

    // receives the number of completed trees every progress interval
    public LcfrsInducer onProgress(final LongConsumer progressListener) {
        return new LcfrsInducer(format, daughterOrder, threadCount, progressInterval, strict, progressListener);
    }

    public InductionResult induce(final Path treebankPath) throws IOException {
        LOG.info("Inducing from: {}", treebankPath);
        try (final NegraReader reader = NegraReader.open(treebankPath, format)) {
            return induce(reader);
        }
    }

    public InductionResult induce(final Reader treebank) throws IOException {
        try (final NegraReader reader = NegraReader.forInput(treebank, format)) {
            return induce(reader);
        }
    }

    private InductionResult induce(final NegraReader reader) throws IOException {
        final long start = System.nanoTime();
        final Grammar grammar = Grammar.empty();
        final Progress progress = new Progress();

        if (threadCount == 1) {
            for (Optional<TreebankSentence> sentence = reader.next(); sentence.isPresent(); sentence = reader.next()) {
                induceInto(sentence.get(), grammar, progress);
            }
        } else {
            induceConcurrently(reader, grammar, progress);
        }

        final InductionResult result = new InductionResult(grammar, progress.completed.get(), progress.skipped.get(), Duration.ofNanos(System.nanoTime() - start));
        LOG.info("Induction complete: {} trees, {} skipped, {} rules, took {}",
                result.treeCount(), result.skippedTreeCount(), grammar.size(), result.duration());
        return result;
    }

    private void induceConcurrently(final NegraReader reader, final Grammar grammar, final Progress progress) throws IOException {
        final ExecutorService executor = newFixedThreadPool(threadCount);
        final Semaphore readAhead = new Semaphore(threadCount * READ_AHEAD_PER_THREAD);
        final AtomicReference<Throwable> failure = new AtomicReference<>();

        try {
            for (Optional<TreebankSentence> next = reader.next(); next.isPresent() && failure.get() == null; next = reader.next()) {
                final TreebankSentence sentence = next.get();
                readAhead.acquire();
                executor.execute(() -> {
                    try {
                        induceInto(sentence, grammar, progress);
                    } catch (final Throwable t) {
                        failure.compareAndSet(null, t);
                    } finally {
                        readAhead.release();
                    }
                });
            }
            executor.shutdown();
            executor.awaitTermination(Long.MAX_VALUE, DAYS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while inducing");
        } finally {
            executor.shutdownNow();
        }

        final Throwable t = failure.get();
        if (t instanceof RuntimeException) {
            throw (RuntimeException) t;
        }
        if (t instanceof Error) {
            throw (Error) t;
        }
        if (t != null) {
            throw new IllegalStateException("Induction failed", t);
        }
    }

    private void induceInto(final TreebankSentence sentence, final Grammar grammar, final Progress progress) {
        try {
            grammar.addRules(induceTree(sentence));
        } catch (final TreeException e) {
            if (strict) {
                throw new IllegalStateException("Could not induce rules from sentence %s".formatted(sentence.id()), e);
            }
            LOG.warn("Skipping sentence {}: {}", sentence.id(), e.getMessage());
            progress.skipped.incrementAndGet();
        }

        final long completed = progress.completed.incrementAndGet();
        if (completed % progressInterval == 0) {
            LOG.info("{} trees complete", completed);
            progressListener.accept(completed);
        }
    }

    // terminal rules in leaf order, then nonterminal rules daughters before mothers
    public List<Rule> induceTree(final TreebankSentence sentence) throws TreeException {
        if (!sentence.terminated()) {
            throw new MalformedTreeException("Sentence %s is not terminated by #EOS".formatted(sentence.id()));
        }

        final List<NodeRecord> records = new ArrayList<>(sentence.lines().size());
        for (final String line : sentence.lines()) {
            records.add(format.parse(line));
        }
        return induceTree(records);
    }

    public List<Rule> induceTree(final List<NodeRecord> records) throws TreeException {
        final Tree tree = TreeBuilder.build(records);
        final List<Node> bottomUp = SpanPropagator.propagate(tree);

        final RuleBuilder ruleBuilder = RuleBuilder.withDaughterOrder(daughterOrder);
        final List<Rule> rules = new ArrayList<>(tree.terminalCount() + bottomUp.size());
        for (final Node leaf : tree.leaves()) {
            rules.add(ruleBuilder.terminalRule(leaf));
        }
        for (final Node node : bottomUp) {
            rules.add(ruleBuilder.nonterminalRule(node));
        }
        return rules;
    }

    private static final class Progress {

        private final AtomicLong completed = new AtomicLong();
        private final AtomicLong skipped = new AtomicLong();
    }
}
