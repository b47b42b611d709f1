package com.fbo.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a free-text facility name into the key used to match records that describe the
 * same FBO. Rules run in priority order and are repeated until the name stops changing,
 * so {@code normalize(normalize(x)).equals(normalize(x))} always holds.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a facility name. Null or blank input yields the empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        // A removal can expose a new match ("fbaviationo"), so run passes until nothing changes.
        // Removal rules shorten the string on every changing pass; the seen set stops a custom
        // rule set that cycles.
        String result = cleanup(name.toLowerCase(Locale.ROOT));
        Set<String> seen = new HashSet<>();
        while (seen.add(result)) {
            String next = cleanup(applyRules(result));
            if (next.equals(result)) {
                break;
            }
            result = next;
        }
        return result;
    }

    /**
     * Checks whether two names produce the same comparison key.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }

    private String applyRules(String input) {
        String result = input;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }
        return result;
    }

    private static String cleanup(String value) {
        return value.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
