package com.orderline.resolution.rules;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Synonym table for product words and unit words.
 *
 * <p>Product aliases cover regional names ("dhania" → "coriander"), alternative names
 * ("eggplant" → "aubergine") and common misspellings ("tomatoe" → "tomato"). Unit
 * aliases cover abbreviations ("pkt" → "packet"). Protected phrases are never aliased,
 * so "sweet potato" never turns into a plain potato lookup.</p>
 */
public final class AliasTable {

    private final Map<String, String> productAliases;
    private final Map<String, String> unitAliases;
    private final Set<String> protectedPhrases;

    private AliasTable(Builder builder) {
        this.productAliases = Map.copyOf(builder.productAliases);
        this.unitAliases = Map.copyOf(builder.unitAliases);
        this.protectedPhrases = Set.copyOf(builder.protectedPhrases);
    }

    public static AliasTable defaults() {
        return builder()
                .productAlias("tomatoe", "tomato")
                .productAlias("potatoe", "potato")
                .productAlias("eggplant", "aubergine")
                .productAlias("brinjal", "aubergine")
                .productAlias("cuke", "cucumber")
                .productAlias("cukes", "cucumber")
                .productAlias("avo", "avocado")
                .productAlias("avos", "avocado")
                .productAlias("cilantro", "coriander")
                .productAlias("dhania", "coriander")
                .productAlias("capsicum", "pepper")
                .productAlias("courgette", "baby marrow")
                .productAlias("zucchini", "baby marrow")
                .productAlias("arugula", "rocket")
                .unitAlias("pkt", "packet")
                .unitAlias("pckt", "packet")
                .unitAlias("pk", "packet")
                .unitAlias("pcs", "piece")
                .unitAlias("pc", "piece")
                .unitAlias("kgs", "kg")
                .unitAlias("kilo", "kg")
                .unitAlias("kilos", "kg")
                .unitAlias("ea", "each")
                .protectedPhrase("sweet potato")
                .protectedPhrase("sweet potatoes")
                .build();
    }

    public static AliasTable empty() {
        return builder().build();
    }

    /**
     * Alias target for a single product word, if any.
     */
    public Optional<String> productAliasOf(String word) {
        if (word == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(productAliases.get(word.toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolves a unit word through the unit aliases, keeping it only if the target
     * is part of the given vocabulary.
     */
    public Optional<String> unitAliasOf(String word, Collection<String> unitVocabulary) {
        if (word == null) {
            return Optional.empty();
        }
        String target = unitAliases.get(word.toLowerCase(Locale.ROOT));
        if (target == null || !unitVocabulary.contains(target)) {
            return Optional.empty();
        }
        return Optional.of(target);
    }

    /**
     * True when the phrase contains a protected phrase and must not be aliased.
     */
    public boolean isProtected(String phrase) {
        if (phrase == null) {
            return false;
        }
        String lower = phrase.toLowerCase(Locale.ROOT);
        for (String p : protectedPhrases) {
            if (lower.contains(p)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Alias targets of the phrase: the whole phrase first, then each word.
     * Empty for protected phrases.
     */
    public Set<String> aliasTargetsOf(Collection<String> productTokens) {
        Set<String> targets = new LinkedHashSet<>();
        if (productTokens == null || productTokens.isEmpty()) {
            return targets;
        }
        String phrase = String.join(" ", productTokens);
        if (isProtected(phrase)) {
            return targets;
        }
        productAliasOf(phrase).ifPresent(targets::add);
        for (String token : productTokens) {
            productAliasOf(token).ifPresent(targets::add);
        }
        return targets;
    }

    public int size() {
        return productAliases.size() + unitAliases.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> productAliases = new HashMap<>();
        private final Map<String, String> unitAliases = new HashMap<>();
        private final Set<String> protectedPhrases = new HashSet<>();

        public Builder productAlias(String alias, String target) {
            productAliases.put(alias.toLowerCase(Locale.ROOT), target.toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder productAliases(Map<String, String> aliases) {
            aliases.forEach(this::productAlias);
            return this;
        }

        public Builder unitAlias(String alias, String target) {
            unitAliases.put(alias.toLowerCase(Locale.ROOT), target.toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder protectedPhrase(String phrase) {
            protectedPhrases.add(phrase.toLowerCase(Locale.ROOT));
            return this;
        }

        public AliasTable build() {
            return new AliasTable(this);
        }
    }
}
