package com.orderline.resolution.scoring;

import com.orderline.resolution.catalog.CatalogIndex;
import com.orderline.resolution.core.model.CatalogEntry;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.rules.AliasTable;
import com.orderline.resolution.similarity.CharacterJaccardSimilarity;
import com.orderline.resolution.similarity.SimilarityAlgorithm;
import com.orderline.resolution.similarity.SoundexEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the candidate set for a parsed line from a catalog snapshot.
 *
 * <ol>
 *   <li>Direct containment of the product words in catalog names, narrowed by unit and
 *       descriptors as {@link CatalogIndex#candidatesFor} does.</li>
 *   <li>The same lookup for alias targets of the words ("eggplant" finds "Aubergine").</li>
 *   <li>Only when both find nothing: entries whose core words sound like a product word,
 *       or whose name starts with the phrase's first two letters and shares most of its
 *       characters.</li>
 * </ol>
 *
 * <p>Results keep catalog order so that scoring and ranking are deterministic.</p>
 */
public class CandidateGenerator {
    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    static final int MAX_PHONETIC_CANDIDATES = 10;
    static final double MIN_CHARACTER_OVERLAP = 0.3;

    private final AliasTable aliasTable;
    private final SimilarityAlgorithm characterOverlap = new CharacterJaccardSimilarity();

    public CandidateGenerator() {
        this(AliasTable.defaults());
    }

    public CandidateGenerator(AliasTable aliasTable) {
        this.aliasTable = aliasTable;
    }

    public List<CatalogEntry> generate(ParsedLine line, CatalogIndex catalog) {
        if (!line.hasProductTokens() || catalog.isEmpty()) {
            return List.of();
        }

        Set<CatalogEntry> found = new LinkedHashSet<>(
                catalog.candidatesFor(line.productTokens(), line.unitToken(), line.descriptorTokens()));

        Set<String> aliasTargets = aliasTable.aliasTargetsOf(line.productTokens());
        if (!aliasTargets.isEmpty()) {
            found.addAll(catalog.candidatesFor(aliasTargets, line.unitToken(), line.descriptorTokens()));
        }

        if (!found.isEmpty()) {
            List<CatalogEntry> ordered = inCatalogOrder(found, catalog);
            log.debug("candidates.generated line={} direct+alias={} aliasTargets={}",
                    line.id(), ordered.size(), aliasTargets);
            return ordered;
        }

        List<CatalogEntry> phonetic = phoneticFallback(line, catalog);
        log.debug("candidates.generated line={} phonetic={}", line.id(), phonetic.size());
        return phonetic;
    }

    private List<CatalogEntry> phoneticFallback(ParsedLine line, CatalogIndex catalog) {
        String phrase = line.productPhrase();
        String prefix = phrase.length() >= 2 ? phrase.substring(0, 2) : null;

        List<CatalogEntry> result = new ArrayList<>();
        for (CatalogEntry entry : catalog.entries()) {
            if (result.size() >= MAX_PHONETIC_CANDIDATES) {
                break;
            }
            String coreName = entry.getCoreName();
            if (soundsLikeAnyWord(line.productTokens(), coreName)
                    || (prefix != null && coreName.startsWith(prefix)
                    && characterOverlap.compute(phrase, coreName) > MIN_CHARACTER_OVERLAP)) {
                result.add(entry);
            }
        }
        return result;
    }

    private static boolean soundsLikeAnyWord(List<String> tokens, String coreName) {
        for (String word : MatchStrategy.wordsOf(coreName)) {
            for (String token : tokens) {
                if (SoundexEncoder.soundsAlike(token, word)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<CatalogEntry> inCatalogOrder(Set<CatalogEntry> found, CatalogIndex catalog) {
        List<CatalogEntry> ordered = new ArrayList<>(found.size());
        for (CatalogEntry entry : catalog.entries()) {
            if (found.contains(entry)) {
                ordered.add(entry);
            }
        }
        return ordered;
    }
}
