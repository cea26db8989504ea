package com.github.salilvnair.entityflow.engine.ranking;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimilarityScorerTest {

    private final SimilarityScorer scorer = new SimilarityScorer();

    @Test
    void exactAndCaseInsensitiveMatchesScoreHighest() {
        assertEquals(100, scorer.calculate("Acme Corp", "Acme Corp"));
        assertEquals(95, scorer.calculate("acme corp", "ACME Corp"));
    }

    @Test
    void candidateContainingIdentifierScoresEightyFive() {
        assertEquals(85, scorer.calculate("MacBook", "MacBook Pro 16"));
    }

    @Test
    void containmentOnlyCountsOneWay() {
        assertTrue(scorer.calculate("MacBook Pro 16", "MacBook") < 85);
    }

    @Test
    void singleTypoScoresOnSharedCharacters() {
        assertEquals(90, Math.round(scorer.levenshteinSimilarity("jon smith", "john smith")));
        assertEquals(95, scorer.calculate("Jon Smith", "John Smith"));
    }

    @Test
    void blankOrMissingInputScoresZero() {
        assertEquals(0, scorer.calculate(null, "Acme"));
        assertEquals(0, scorer.calculate("Acme", "   "));
    }

    @Test
    void scoresStayWithinRange() {
        String[][] pairs = {
                {"apple", "zebra"},
                {"red apple", "apple red"},
                {"a", "abcdefghijklmnopqrstuvwxyz"},
                {"Invoice 2024-01", "invoice 2023-12"}
        };
        for (String[] pair : pairs) {
            int score = scorer.calculate(pair[0], pair[1]);
            assertTrue(score >= 0 && score <= 100, pair[0] + " vs " + pair[1] + " scored " + score);
        }
    }

    @Test
    void levenshteinCountsEdits() {
        assertEquals(3, scorer.levenshtein("kitten", "sitting"));
        assertEquals(0, scorer.levenshtein("same", "same"));
    }
}
