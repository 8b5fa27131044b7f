package com.orderline.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link CleanupRule}s to raw order-line text, lower priority number first,
 * then lowercases and collapses whitespace.
 */
public class LineCleanupEngine {
    private static final Logger log = LoggerFactory.getLogger(LineCleanupEngine.class);

    private final List<CleanupRule> rules;

    public LineCleanupEngine() {
        this.rules = new ArrayList<>();
    }

    public LineCleanupEngine(List<CleanupRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(CleanupRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<CleanupRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<CleanupRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Returns the cleaned text; never null.
     */
    public String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = text;
        for (CleanupRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(CleanupRule::getPriority));
    }
}
