package com.product.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies normalization rules to raw product fields.
 * Input is NFD-decomposed first, rules run in priority order (lower number first),
 * and the result is upper-cased, trimmed and whitespace-collapsed.
 * Normalization is total: {@code null} or blank input gives {@code ""}.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
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

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.name().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a raw value of the given field type.
     */
    public String normalize(String raw, FieldType field) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String result = Normalizer.normalize(raw, Normalizer.Form.NFD);

        for (NormalizationRule rule : rules) {
            if (field == null || rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
                }
            }
        }

        return WHITESPACE.matcher(result.toUpperCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }
}
