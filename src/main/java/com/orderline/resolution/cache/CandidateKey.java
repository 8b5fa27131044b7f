package com.orderline.resolution.cache;

import com.orderline.resolution.core.model.ParsedLine;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything scoring depends on for one line: product words, unit, descriptors and the
 * catalog version. Quantity is left out because it never changes a score, so "2 kg onions"
 * and "5 kg onions" share an entry.
 */
public record CandidateKey(List<String> productTokens, String unitToken, Set<String> descriptorTokens,
                           long catalogVersion) {

    public CandidateKey {
        productTokens = List.copyOf(productTokens);
        descriptorTokens = Set.copyOf(descriptorTokens);
    }

    public static CandidateKey of(ParsedLine line, long catalogVersion) {
        return new CandidateKey(line.productTokens(), line.unitToken(),
                new TreeSet<>(line.descriptorTokens()), catalogVersion);
    }
}
