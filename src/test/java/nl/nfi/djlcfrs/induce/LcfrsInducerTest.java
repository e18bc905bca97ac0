package nl.nfi.djlcfrs.induce;

import nl.nfi.djlcfrs.grammar.DaughterOrder;
import nl.nfi.djlcfrs.grammar.Rule;
import nl.nfi.djlcfrs.tree.MalformedTreeException;
import nl.nfi.djlcfrs.tree.TreeException;
import nl.nfi.djlcfrs.treebank.CorpusFormat;
import nl.nfi.djlcfrs.treebank.MalformedRecordException;
import nl.nfi.djlcfrs.treebank.TreebankSentence;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static nl.nfi.djlcfrs.Utils.SAMPLE_FORMS_BY_DECLARATION;
import static nl.nfi.djlcfrs.Utils.SAMPLE_FORMS_BY_POSITION;
import static nl.nfi.djlcfrs.Utils.SAMPLE_TREEBANK_PATH;
import static nl.nfi.djlcfrs.Utils.TEST_RESOURCES_PATH;
import static nl.nfi.djlcfrs.Utils.discontinuousTree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LcfrsInducerTest {

    @Test
    void induceSample() throws IOException {
        final InductionResult result = LcfrsInducer.withDefaults().induce(SAMPLE_TREEBANK_PATH);

        assertThat(result.grammar().forms()).isEqualTo(SAMPLE_FORMS_BY_POSITION);
        assertThat(result.treeCount()).isEqualTo(4);
        // sentence 3 refers to an unknown mother
        assertThat(result.skippedTreeCount()).isEqualTo(1);
        assertThat(result.inducedTreeCount()).isEqualTo(3);
        assertThat(result.grammar().contains("ITJ(Hallo)->eps")).isFalse();
    }

    @Test
    void induceSampleInDeclarationOrder() throws IOException {
        final InductionResult result = LcfrsInducer.withDefaults()
            .daughterOrder(DaughterOrder.DECLARATION)
            .induce(SAMPLE_TREEBANK_PATH);

        assertThat(result.grammar().forms()).isEqualTo(SAMPLE_FORMS_BY_DECLARATION);
    }

    @Test
    void induceConcurrently() throws IOException {
        final InductionResult result = LcfrsInducer.withDefaults()
            .threadCount(4)
            .induce(SAMPLE_TREEBANK_PATH);

        assertThat(result.grammar().forms()).isEqualTo(SAMPLE_FORMS_BY_POSITION);
        assertThat(result.treeCount()).isEqualTo(4);
        assertThat(result.skippedTreeCount()).isEqualTo(1);
    }

    @Test
    void strictAbortsOnFirstMalformedTree() {
        assertThatThrownBy(() -> LcfrsInducer.withDefaults().strict(true).induce(SAMPLE_TREEBANK_PATH))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("sentence 3")
            .hasCauseInstanceOf(MalformedTreeException.class);
    }

    @Test
    void strictAbortsConcurrently() {
        assertThatThrownBy(() -> LcfrsInducer.withDefaults().strict(true).threadCount(2).induce(SAMPLE_TREEBANK_PATH))
            .isInstanceOf(IllegalStateException.class)
            .hasCauseInstanceOf(MalformedTreeException.class);
    }

    @Test
    void workerErrorIsRethrown() {
        final LcfrsInducer inducer = LcfrsInducer.withDefaults()
            .threadCount(2)
            .progressInterval(1)
            .onProgress(count -> {
                throw new OutOfMemoryError("listener failed at " + count);
            });

        assertThatThrownBy(() -> inducer.induce(SAMPLE_TREEBANK_PATH))
            .isInstanceOf(OutOfMemoryError.class)
            .hasMessageStartingWith("listener failed at");
    }

    @Test
    void progressNotifications() throws IOException {
        final List<Long> notified = new CopyOnWriteArrayList<>();

        LcfrsInducer.withDefaults()
            .progressInterval(2)
            .onProgress(notified::add)
            .induce(SAMPLE_TREEBANK_PATH);

        assertThat(notified).containsExactly(2L, 4L);
    }

    @Test
    void repeatedTreeAddsNoRules() throws TreeException {
        final LcfrsInducer inducer = LcfrsInducer.withDefaults();

        final List<Rule> first = inducer.induceTree(discontinuousTree());
        final List<Rule> second = inducer.induceTree(discontinuousTree());

        assertThat(second).isEqualTo(first);
        // leaf rules first, then daughters before mothers
        assertThat(first).extracting(Rule::form).containsExactly(
            "PROAV(Darüber)->eps",
            "VMFIN(muss)->eps",
            "VVPP(nachgedacht)->eps",
            "VAINF(werden)->eps",
            "$.(.)->eps",
            "VP(X_0,X_1)->PROAV(X_0)VVPP(X_1)",
            "VP(X_0,X_1X_2)->VP(X_0,X_1)VAINF(X_2)",
            "S(X_0X_2X_1)->VP(X_0,X_1)VMFIN(X_2)"
        );
    }

    @Test
    void malformedRecordFailsItsTree() {
        final TreebankSentence sentence = new TreebankSentence("9", List.of("Peter\tNE"), true);

        assertThatThrownBy(() -> LcfrsInducer.withDefaults().induceTree(sentence))
            .isInstanceOf(MalformedRecordException.class);
    }

    @Test
    void unterminatedSentenceIsSkipped() throws IOException {
        final String treebank = """
            #BOS 1
            Ja\t--\tPTKANT\t--\t--\t500
            #500\t--\tS\t--\t--\t0
            #EOS 1
            #BOS 2
            Nein\t--\tPTKANT\t--\t--\t500
            #500\t--\tS\t--\t--\t0
            """;

        final InductionResult result = LcfrsInducer.withDefaults().induce(new StringReader(treebank));

        assertThat(result.grammar().forms()).containsExactly("PTKANT(Ja)->eps", "S(X_0)->PTKANT(X_0)");
        assertThat(result.skippedTreeCount()).isEqualTo(1);
    }

    @Test
    void induceVersion3() throws IOException {
        final InductionResult result = LcfrsInducer.withDefaults()
            .format(CorpusFormat.NEGRA_V3)
            .induce(TEST_RESOURCES_PATH.resolve("negra/sample_v3.export"));

        assertThat(result.grammar().forms()).containsExactly(
            "NE(Peter)->eps",
            "S(X_0X_1)->NE(X_0)VVFIN(X_1)",
            "VVFIN(schläft)->eps"
        );
    }

    @Test
    void induceCustomFormat() throws IOException {
        final CorpusFormat format = CorpusFormat.loadFrom(TEST_RESOURCES_PATH.resolve("negra/custom_format.ini"), CorpusFormat.NEGRA_V4);

        final InductionResult result = LcfrsInducer.withDefaults()
            .format(format)
            .induce(TEST_RESOURCES_PATH.resolve("negra/custom_format.export"));

        assertThat(result.grammar().forms()).containsExactly(
            "NE(Peter)->eps",
            "S(X_0X_1)->NE(X_0)VVFIN(X_1)",
            "VVFIN(schläft)->eps"
        );
    }

    @Test
    void invalidSettings() {
        assertThatThrownBy(() -> LcfrsInducer.withDefaults().threadCount(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LcfrsInducer.withDefaults().progressInterval(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
