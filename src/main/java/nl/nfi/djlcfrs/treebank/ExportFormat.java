package nl.nfi.djlcfrs.treebank;

public enum ExportFormat {

    NEGRA_V3(CorpusFormat.NEGRA_V3),
    NEGRA_V4(CorpusFormat.NEGRA_V4);

    private final CorpusFormat corpusFormat;

    ExportFormat(final CorpusFormat corpusFormat) {
        this.corpusFormat = corpusFormat;
    }

    public CorpusFormat corpusFormat() {
        return corpusFormat;
    }
}
