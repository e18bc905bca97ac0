package nl.nfi.djlcfrs.common.ini;

import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.readAllLines;

// minimal INI reader, e.g.:
//      [CORPUS_FORMAT]
//      label_column = 2
//      comment_prefixes = ["%%"]
//  lines starting with ';' are comments, list values are JSON arrays
public final class IniConfig {

    private final Path path;
    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Path path, final Map<String, Map<String, String>> sections) {
        this.path = path;
        this.sections = sections;
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        if (!hasSection(section)) {
            throw new IllegalArgumentException("INI config %s does not contain given section: %s".formatted(path, section));
        }
        return IniSection.ofConfig(this, section);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config %s does not contain key in given section: %s -> %s".formatted(path, section, key));
        }
        return sections.get(section).get(key);
    }

    public int getInt(final String section, final String key) {
        final String value = getString(section, key);
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("INI config %s has no integer value for %s -> %s: %s".formatted(path, section, key, value), e);
        }
    }

    public List<String> getStringList(final String section, final String key) {
        final String value = getString(section, key);
        try {
            final JSONArray array = new JSONArray(value);
            final List<String> values = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                values.add(array.getString(i));
            }
            return values;
        } catch (final JSONException e) {
            throw new IllegalArgumentException("INI config %s has no list of strings for %s -> %s: %s".formatted(path, section, key, value), e);
        }
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }

        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> section = null;
        for (final String rawLine : readAllLines(path, UTF_8)) {
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = sections.computeIfAbsent(line.substring(1, line.length() - 1).strip(), title -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI config %s has a key outside any section: %s".formatted(path, line));
            }
            final int separator = line.indexOf('=');
            if (separator < 0) {
                section.put(line, "");
            } else {
                section.put(line.substring(0, separator).strip(), line.substring(separator + 1).strip());
            }
        }
        return new IniConfig(path, sections);
    }
}
