package nl.nfi.djlcfrs.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Comparator.comparing;

// keyed by canonical form, first stored rule wins, never removed
public final class Grammar {

    // first-seen order
    private final Map<String, Rule> rules;

    private Grammar() {
        this.rules = new LinkedHashMap<>();
    }

    public static Grammar empty() {
        return new Grammar();
    }

    // returns false for a duplicate
    public synchronized boolean addRule(final Rule rule) {
        return rules.putIfAbsent(rule.form(), rule) == null;
    }

    public synchronized int addRules(final List<Rule> rules) {
        int added = 0;
        for (final Rule rule : rules) {
            if (addRule(rule)) {
                added++;
            }
        }
        return added;
    }

    public synchronized boolean contains(final String form) {
        return rules.containsKey(form);
    }

    public synchronized int size() {
        return rules.size();
    }

    // sorted by form
    public synchronized List<Rule> allRules() {
        final List<Rule> sorted = new ArrayList<>(rules.values());
        sorted.sort(comparing(Rule::form));
        return sorted;
    }

    public List<String> forms() {
        return allRules().stream().map(Rule::form).toList();
    }
}
