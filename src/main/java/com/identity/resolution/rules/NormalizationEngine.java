package com.identity.resolution.rules;

import com.identity.resolution.core.model.ParseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies normalization rules to names.
 * Diacritics are folded before any rule runs. Rules then run by priority (lower first), ties by
 * rule name so the order never depends on registration order. The result is lowercased with
 * whitespace collapsed.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

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

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes the given name using only the rules that apply to every type.
     */
    public String normalize(String name) {
        return normalize(name, null);
    }

    /**
     * Normalizes the given name for a specific parse type.
     */
    public String normalize(String name, ParseType type) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = foldDiacritics(name);

        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(type)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.trace("normalize.rule rule={} before='{}' after='{}'", rule.name(), before, result);
                }
            }
        }

        return WHITESPACE.matcher(result.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    public boolean areEquivalent(String name1, String name2, ParseType type) {
        return normalize(name1, type).equals(normalize(name2, type));
    }

    /**
     * Decomposes to NFD and strips combining marks, e.g. {@code "Zoë Müller" -> "Zoe Muller"}.
     */
    public static String foldDiacritics(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::priority).thenComparing(NormalizationRule::name));
    }
}
