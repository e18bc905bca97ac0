package nl.nfi.djlcfrs;

import nl.nfi.djlcfrs.treebank.NodeRecord;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public final class Utils {

    public static final Path TEST_RESOURCES_PATH = Paths.get("src/test/resources").toAbsolutePath();
    public static final Path SAMPLE_TREEBANK_PATH = TEST_RESOURCES_PATH.resolve("negra/sample.export");

    public static final String ROOT = "0";

    // sorted rules of negra/sample.export, daughters in position order
    public static final List<String> SAMPLE_FORMS_BY_POSITION = List.of(
        "$.(.)->eps",
        "NE(Peter)->eps",
        "PROAV(Darüber)->eps",
        "S(X_0X_1X_2)->NE(X_0)VVFIN(X_1)$.(X_2)",
        "S(X_0X_2X_1)->VP(X_0,X_1)VMFIN(X_2)",
        "VAINF(werden)->eps",
        "VMFIN(muss)->eps",
        "VP(X_0,X_1)->PROAV(X_0)VVPP(X_1)",
        "VP(X_0,X_1X_2)->VP(X_0,X_1)VAINF(X_2)",
        "VVFIN(schläft)->eps",
        "VVPP(nachgedacht)->eps"
    );

    // same, daughters in declaration order (leaves first)
    public static final List<String> SAMPLE_FORMS_BY_DECLARATION = List.of(
        "$.(.)->eps",
        "NE(Peter)->eps",
        "PROAV(Darüber)->eps",
        "S(X_0X_1X_2)->NE(X_0)VVFIN(X_1)$.(X_2)",
        "S(X_1X_0X_2)->VMFIN(X_0)VP(X_1,X_2)",
        "VAINF(werden)->eps",
        "VMFIN(muss)->eps",
        "VP(X_0,X_1)->PROAV(X_0)VVPP(X_1)",
        "VP(X_1,X_2X_0)->VAINF(X_0)VP(X_1,X_2)",
        "VVFIN(schläft)->eps",
        "VVPP(nachgedacht)->eps"
    );

    public static NodeRecord leaf(final String word, final String label, final String mother) {
        return NodeRecord.leaf(word, label, mother.equals(ROOT) ? null : mother);
    }

    public static NodeRecord internal(final String id, final String label, final String mother) {
        return NodeRecord.internal(id, label, mother.equals(ROOT) ? null : mother);
    }

    // "Darüber muss nachgedacht werden ." with the discontinuous VP 502 over positions 0 and 2
    public static List<NodeRecord> discontinuousTree() {
        return List.of(
            leaf("Darüber", "PROAV", "502"),
            leaf("muss", "VMFIN", "500"),
            leaf("nachgedacht", "VVPP", "502"),
            leaf("werden", "VAINF", "501"),
            leaf(".", "$.", ROOT),
            internal("500", "S", ROOT),
            internal("501", "VP", "500"),
            internal("502", "VP", "501")
        );
    }

    // internal node i (id 500 + i) hangs below a random earlier internal node, every internal node
    // gets at least one leaf, the leaves are shuffled so constituents become discontinuous
    public static List<NodeRecord> randomTree(final Random random, final int internalCount, final int leafCount) {
        if (leafCount < internalCount) {
            throw new IllegalArgumentException("Need a leaf for every internal node");
        }
        final List<NodeRecord> leaves = new ArrayList<>();
        for (int i = 0; i < leafCount; i++) {
            final int mother = i < internalCount ? i : random.nextInt(internalCount);
            leaves.add(leaf("w" + i, "T" + random.nextInt(3), Integer.toString(500 + mother)));
        }
        Collections.shuffle(leaves, random);

        final List<NodeRecord> records = new ArrayList<>(leaves);
        for (int i = 0; i < internalCount; i++) {
            final String mother = i == 0 ? ROOT : Integer.toString(500 + random.nextInt(i));
            records.add(internal(Integer.toString(500 + i), "N" + random.nextInt(3), mother));
        }
        return records;
    }
}
