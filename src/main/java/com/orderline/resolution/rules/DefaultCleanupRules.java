package com.orderline.resolution.rules;

import java.util.List;

/**
 * Built-in cleanup rules for chat and invoice order lines.
 */
public final class DefaultCleanupRules {

    private DefaultCleanupRules() {
    }

    public static LineCleanupEngine createDefaultEngine() {
        LineCleanupEngine engine = new LineCleanupEngine();
        engine.addRules(getSeparatorRules());
        engine.addRules(getPunctuationRules());
        return engine;
    }

    /**
     * Multiplication separators between quantity and product ("2 x", "2x", "x2", "2 * ", "2×").
     * A letter x inside a word ("box", "mixed") is never touched.
     */
    public static List<CleanupRule> getSeparatorRules() {
        return List.of(
                CleanupRule.builder()
                        .name("separator-symbols")
                        .pattern("[×*]")
                        .priority(10)
                        .build(),

                CleanupRule.builder()
                        .name("separator-letter-x")
                        .pattern("(?<!\\p{L})x(?!\\p{L})")
                        .priority(20)
                        .build()
        );
    }

    public static List<CleanupRule> getPunctuationRules() {
        return List.of(
                // Leading bullets and dashes used in chat lists
                CleanupRule.builder()
                        .name("list-bullets")
                        .pattern("(^|\\s)[-•>]+(?=\\s|$)")
                        .priority(30)
                        .build(),

                // Brackets, quotes, colons and similar
                CleanupRule.builder()
                        .name("brackets-quotes")
                        .pattern("[\"'`()\\[\\]{}:;!?,]")
                        .priority(40)
                        .build(),

                // Periods that are not decimal points
                CleanupRule.builder()
                        .name("stray-periods")
                        .pattern("(?<!\\d)\\.|\\.(?!\\d)")
                        .priority(50)
                        .build()
        );
    }
}
