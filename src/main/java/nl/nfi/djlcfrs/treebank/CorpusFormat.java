package nl.nfi.djlcfrs.treebank;

import nl.nfi.djlcfrs.common.ini.IniConfig;
import nl.nfi.djlcfrs.common.ini.IniSection;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

// tab separated; a first column starting with the internal marker is an internal node
public record CorpusFormat(
        int wordColumn,
        int labelColumn,
        int motherColumn,
        String internalMarker,
        String rootMother,
        List<String> commentPrefixes
) {

    public static final String SECTION = "CORPUS_FORMAT";

    // word lemma tag morph edge parent
    public static final CorpusFormat NEGRA_V4 = new CorpusFormat(0, 2, 5, "#", "0", List.of("%%"));
    // word tag morph edge parent
    public static final CorpusFormat NEGRA_V3 = new CorpusFormat(0, 1, 4, "#", "0", List.of("%%"));

    public CorpusFormat {
        if (wordColumn < 0 || labelColumn < 0 || motherColumn < 0) {
            throw new IllegalArgumentException("Column indices must be non-negative: word %d, label %d, mother %d"
                    .formatted(wordColumn, labelColumn, motherColumn));
        }
        if (internalMarker.isEmpty()) {
            throw new IllegalArgumentException("Internal node marker must not be empty");
        }
        commentPrefixes = List.copyOf(commentPrefixes);
    }

    public NodeRecord parse(final String line) throws MalformedRecordException {
        final String[] fields = line.split("\t", -1);
        final int required = Math.max(wordColumn, Math.max(labelColumn, motherColumn)) + 1;
        if (fields.length < required) {
            throw new MalformedRecordException("Expected at least %d tab separated fields, found %d: %s".formatted(required, fields.length, line));
        }

        final String id = fields[wordColumn];
        final String label = fields[labelColumn];
        final String mother = fields[motherColumn];
        if (id.isEmpty() || label.isEmpty() || mother.isEmpty()) {
            throw new MalformedRecordException("Empty id, label or mother field: %s".formatted(line));
        }

        final String motherId = mother.equals(rootMother) ? null : mother;
        if (!id.startsWith(internalMarker)) {
            return NodeRecord.leaf(id, label, motherId);
        }
        final String internalId = id.substring(internalMarker.length());
        if (internalId.isEmpty()) {
            throw new MalformedRecordException("Internal node without id: %s".formatted(line));
        }
        return NodeRecord.internal(internalId, label, motherId);
    }

    public boolean isComment(final String line) {
        for (final String prefix : commentPrefixes) {
            if (line.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    // keys missing from the [CORPUS_FORMAT] section keep the value of the given defaults
    public static CorpusFormat loadFrom(final Path path, final CorpusFormat defaults) throws IOException {
        final IniSection section = IniConfig.loadFrom(path).getSection(SECTION);
        return new CorpusFormat(
                section.getInt("word_column", defaults.wordColumn()),
                section.getInt("label_column", defaults.labelColumn()),
                section.getInt("mother_column", defaults.motherColumn()),
                section.getString("internal_marker", defaults.internalMarker()),
                section.getString("root_mother", defaults.rootMother()),
                section.getStringList("comment_prefixes", defaults.commentPrefixes())
        );
    }
}
