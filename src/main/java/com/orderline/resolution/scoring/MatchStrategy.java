package com.orderline.resolution.scoring;

import com.orderline.resolution.catalog.UnitCompatibility;
import com.orderline.resolution.core.model.CatalogEntry;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.similarity.PhoneticSimilarity;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The independent scoring strategies, in the fixed order the scorer applies them.
 * Each constant is a pure function from a {@link ScoringInput} to points; zero means
 * the strategy did not fire.
 */
public enum MatchStrategy {

    /**
     * Product phrase equals the candidate's core name, parentheticals ignored.
     */
    EXACT_NAME_MATCH("exact_name_match") {
        @Override
        public double score(ScoringInput in) {
            String phrase = in.line().productPhrase();
            if (phrase.isEmpty()) {
                return 0.0;
            }
            return phrase.equals(in.candidate().getCoreName()) ? in.weights().exactNameMatch() : 0.0;
        }
    },

    /**
     * Share of product words found as whole words in the candidate name.
     * Partial coverage only: silent when the exact name already matched.
     */
    WORD_OVERLAP_MATCH("word_overlap_match") {
        @Override
        public double score(ScoringInput in) {
            List<String> tokens = in.line().productTokens();
            if (tokens.isEmpty() || in.pointsOf(EXACT_NAME_MATCH) > 0.0) {
                return 0.0;
            }
            List<String> nameWords = wordsOf(in.candidate().getCanonicalName());
            long found = tokens.stream().filter(nameWords::contains).count();
            return in.weights().wordOverlapMax() * found / tokens.size();
        }
    },

    /**
     * Candidate unit equals the parsed unit; a compatible unit or a descriptor naming
     * the unit earns a reduced share.
     */
    UNIT_MATCH("unit_match") {
        @Override
        public double score(ScoringInput in) {
            String unit = in.line().unitToken();
            if (unit == null) {
                return 0.0;
            }
            CatalogEntry candidate = in.candidate();
            if (unit.equals(candidate.getUnit())) {
                return in.weights().unitMatch();
            }
            boolean compatible = UnitCompatibility.areCompatible(unit, candidate.getUnit())
                    || candidate.getBaseDescriptors().stream()
                    .anyMatch(d -> UnitCompatibility.areCompatible(unit, d));
            return compatible ? in.weights().unitMatch() * in.weights().compatibleUnitFactor() : 0.0;
        }
    },

    /**
     * Points per descriptor token found verbatim in the candidate's descriptors, capped.
     */
    DESCRIPTOR_MATCH("descriptor_match") {
        @Override
        public double score(ScoringInput in) {
            int matches = descriptorMatches(in.line(), in.candidate());
            return Math.min(matches * in.weights().descriptorMatch(), in.weights().descriptorMax());
        }
    },

    /**
     * The phrase or one of its words maps through the alias table onto the candidate's
     * core name ("tomatoe" onto "Tomatoes", "dhania" onto "Coriander").
     */
    ALIAS_MATCH("alias_match") {
        @Override
        public double score(ScoringInput in) {
            Set<String> targets = in.aliases().aliasTargetsOf(in.line().productTokens());
            if (targets.isEmpty()) {
                return 0.0;
            }
            String coreName = in.candidate().getCoreName();
            List<String> coreWords = wordsOf(coreName);
            for (String target : targets) {
                if (mentions(coreName, coreWords, target)) {
                    return in.weights().aliasMatch();
                }
            }
            return 0.0;
        }
    },

    /**
     * Fallback for misspellings, only when no name strategy scored: spelling or sound
     * similarity between the phrase (or one of its words) and the core name. Unit and
     * descriptor points do not suppress it.
     */
    PHONETIC_MATCH("phonetic_match") {
        @Override
        public double score(ScoringInput in) {
            if (in.nameMatched() || !in.line().hasProductTokens()) {
                return 0.0;
            }
            String coreName = in.candidate().getCoreName();
            double similarity = SIMILARITY.compute(in.line().productPhrase(), coreName);
            for (String token : in.line().productTokens()) {
                for (String word : wordsOf(coreName)) {
                    similarity = Math.max(similarity, SIMILARITY.compute(token, word));
                }
            }
            if (similarity <= in.weights().phoneticMinSimilarity()) {
                return 0.0;
            }
            return similarity * in.weights().phoneticMax();
        }
    };

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final PhoneticSimilarity SIMILARITY = new PhoneticSimilarity();

    private final String key;

    MatchStrategy(String key) {
        this.key = key;
    }

    /**
     * Name used in score breakdowns and matched reasons.
     */
    public String key() {
        return key;
    }

    public abstract double score(ScoringInput input);

    /**
     * Number of the line's descriptor tokens present in the candidate's descriptors.
     */
    public static int descriptorMatches(ParsedLine line, CatalogEntry candidate) {
        int matches = 0;
        for (String token : line.descriptorTokens()) {
            if (candidate.getBaseDescriptors().contains(token)) {
                matches++;
            }
        }
        return matches;
    }

    static List<String> wordsOf(String text) {
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    static boolean mentions(String coreName, List<String> coreWords, String target) {
        if (target.indexOf(' ') >= 0) {
            String padded = " " + coreName + " ";
            return padded.contains(" " + target + " ")
                    || padded.contains(" " + target + "s ")
                    || padded.contains(" " + target + "es ");
        }
        for (String word : coreWords) {
            if (samePlural(word, target)) {
                return true;
            }
        }
        return false;
    }

    static boolean samePlural(String word, String target) {
        return word.equals(target)
                || word.equals(target + "s")
                || word.equals(target + "es")
                || target.equals(word + "s")
                || target.equals(word + "es");
    }
}
