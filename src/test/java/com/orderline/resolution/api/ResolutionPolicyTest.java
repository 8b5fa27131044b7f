package com.orderline.resolution.api;

import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.MatchCandidate;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.core.model.ResolutionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolutionPolicy Tests")
class ResolutionPolicyTest {

    private final ResolutionPolicy policy = new ResolutionPolicy();
    private final ParsedLine line = ParsedLine.empty("test line");

    private static MatchCandidate candidate(String id, String name, double score) {
        return new MatchCandidate(id, name, Map.of("word_overlap_match", score), score,
                List.of("word_overlap_match"), 0);
    }

    private static MatchCandidate exact(String id, String name, double score) {
        return new MatchCandidate(id, name, Map.of("exact_name_match", score), score,
                List.of("exact_name_match"), 0);
    }

    @Nested
    @DisplayName("Tiers")
    class Tiers {

        @ParameterizedTest
        @CsvSource({
                "100, AUTO",
                "50, AUTO",
                "49.9, TOP_SUGGESTION",
                "25, TOP_SUGGESTION",
                "24.9, SUGGESTION_LIST",
                "10, SUGGESTION_LIST",
                "9.9, NONE",
                "0, NONE"
        })
        @DisplayName("Thresholds are inclusive lower bounds")
        void tierBoundaries(double score, DecisionTier expected) {
            assertEquals(expected, policy.tierFor(score));
        }

        @Test
        @DisplayName("AUTO carries a best match and needs no confirmation")
        void auto() {
            ResolutionResult result = policy.resolve(line, List.of(candidate("p-1", "Rosemary", 75)));

            assertEquals(DecisionTier.AUTO, result.decisionTier());
            assertEquals("p-1", result.bestMatch().catalogEntryId());
            assertFalse(result.requiresConfirmation());
        }

        @Test
        @DisplayName("TOP_SUGGESTION carries a best match that must be confirmed")
        void topSuggestion() {
            ResolutionResult result = policy.resolve(line, List.of(
                    candidate("p-1", "Carrots", 30),
                    candidate("p-2", "Baby Carrots", 12),
                    candidate("p-3", "Carrot Cake", 5)));

            assertEquals(DecisionTier.TOP_SUGGESTION, result.decisionTier());
            assertEquals("p-1", result.bestMatch().catalogEntryId());
            assertTrue(result.requiresConfirmation());
            assertEquals(List.of("p-1", "p-2"),
                    result.suggestions().stream().map(MatchCandidate::catalogEntryId).toList());
        }

        @Test
        @DisplayName("Unattended options let TOP_SUGGESTION proceed")
        void unattendedTopSuggestion() {
            ResolutionPolicy unattended = new ResolutionPolicy(ResolutionOptions.unattended());

            ResolutionResult result = unattended.resolve(line, List.of(candidate("p-1", "Carrots", 30)));

            assertEquals(DecisionTier.TOP_SUGGESTION, result.decisionTier());
            assertFalse(result.requiresConfirmation());
        }

        @Test
        @DisplayName("SUGGESTION_LIST has suggestions but no best match")
        void suggestionList() {
            ResolutionResult result = policy.resolve(line, List.of(
                    candidate("p-3", "Tomatoes", 20),
                    candidate("p-1", "Cherry Tomatoes", 20),
                    candidate("p-2", "Cocktail Tomatoes", 20)));

            assertEquals(DecisionTier.SUGGESTION_LIST, result.decisionTier());
            assertNull(result.bestMatch());
            assertTrue(result.requiresConfirmation());
            assertEquals(List.of("Cherry Tomatoes", "Cocktail Tomatoes", "Tomatoes"),
                    result.suggestions().stream().map(MatchCandidate::canonicalName).toList());
        }

        @Test
        @DisplayName("NONE is returned for low scores and empty input")
        void none() {
            assertEquals(DecisionTier.NONE, policy.resolve(line, List.of(candidate("p-1", "Leeks", 4))).decisionTier());
            assertEquals(DecisionTier.NONE, policy.resolve(line, List.of()).decisionTier());
            assertEquals(DecisionTier.NONE, policy.resolve(line, null).decisionTier());
            assertTrue(policy.resolve(line, List.of()).suggestions().isEmpty());
        }
    }

    @Nested
    @DisplayName("Ranking")
    class Ranking {

        @Test
        @DisplayName("Exact name wins a score tie")
        void exactNameWinsTie() {
            ResolutionResult result = policy.resolve(line, List.of(
                    candidate("p-1", "Apples", 60),
                    exact("p-2", "Zucchini", 60)));

            assertEquals("p-2", result.bestMatch().catalogEntryId());
        }

        @Test
        @DisplayName("More descriptor matches win a remaining tie")
        void descriptorsWinTie() {
            MatchCandidate fewer = new MatchCandidate("p-1", "Apples", Map.of(), 40, List.of(), 0);
            MatchCandidate more = new MatchCandidate("p-2", "Bananas", Map.of(), 40, List.of(), 2);

            ResolutionResult result = policy.resolve(line, List.of(fewer, more));

            assertEquals("p-2", result.bestMatch().catalogEntryId());
        }

        @Test
        @DisplayName("Result does not depend on input order")
        void deterministic() {
            List<MatchCandidate> candidates = new ArrayList<>(List.of(
                    candidate("p-1", "Leeks", 20),
                    candidate("p-2", "Baby Leeks", 20),
                    candidate("p-3", "Leek Soup Mix", 15)));
            ResolutionResult first = policy.resolve(line, candidates);
            Collections.reverse(candidates);
            ResolutionResult second = policy.resolve(line, candidates);

            assertEquals(first.suggestions(), second.suggestions());
        }

        @Test
        @DisplayName("Suggestions are capped")
        void suggestionCap() {
            ResolutionPolicy capped = new ResolutionPolicy(ResolutionOptions.builder().maxSuggestions(3).build());
            List<MatchCandidate> candidates = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                candidates.add(candidate("p-" + i, "Product " + i, 15 + i));
            }

            ResolutionResult result = capped.resolve(line, candidates);

            assertEquals(3, result.suggestions().size());
            assertEquals("p-9", result.suggestions().get(0).catalogEntryId());
        }

        @Test
        @DisplayName("Catalog version is carried on the result")
        void catalogVersion() {
            ResolutionResult result = policy.resolve(line, List.of(candidate("p-1", "Leeks", 60)), 7L);
            assertEquals(7L, result.catalogVersion());
        }
    }

    @Nested
    @DisplayName("Options")
    class Options {

        @Test
        @DisplayName("Thresholds must be ordered and in range")
        void thresholdValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> ResolutionOptions.builder().autoThreshold(20).build());
            assertThrows(IllegalArgumentException.class,
                    () -> ResolutionOptions.builder().autoThreshold(120));
            assertThrows(IllegalArgumentException.class,
                    () -> ResolutionOptions.builder().maxSuggestions(0));
        }

        @Test
        @DisplayName("Conservative options raise the thresholds")
        void conservative() {
            ResolutionPolicy conservative = new ResolutionPolicy(ResolutionOptions.conservative());
            assertEquals(DecisionTier.TOP_SUGGESTION, conservative.tierFor(60));
            assertEquals(DecisionTier.NONE, conservative.tierFor(12));
        }
    }
}
