package com.termcode.patch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityMatcherTest {

    @Test
    void identicalStringsScoreOne() {
        assertEquals(1.0, SimilarityMatcher.similarity("return x;", "return x;"));
        assertEquals(1.0, SimilarityMatcher.similarity("", ""));
    }

    @Test
    void completelyDifferentStringsScoreZero() {
        assertEquals(0.0, SimilarityMatcher.similarity("abc", "xyz"));
        assertEquals(0.0, SimilarityMatcher.similarity("", "abc"));
    }

    @Test
    void scoreIsNormalizedByLongerString() {
        // one substitution in five characters
        assertEquals(0.8, SimilarityMatcher.similarity("abcde", "abcdX"), 1e-9);
        // one insertion, longer string has four characters
        assertEquals(0.75, SimilarityMatcher.similarity("abc", "abcd"), 1e-9);
    }

    @Test
    void twentyOneEditsInHundredCharactersFallsBelowDefaultThreshold() {
        String expected = "a".repeat(100);
        String actual = "b".repeat(21) + "a".repeat(79);

        double score = SimilarityMatcher.similarity(expected, actual);

        assertEquals(0.79, score, 1e-9);
        assertTrue(score < HunkApplier.DEFAULT_FUZZY_THRESHOLD);
    }

    @Test
    void editDistanceCountsInsertDeleteAndSubstitute() {
        assertEquals(3, SimilarityMatcher.editDistance("kitten", "sitting"));
        assertEquals(0, SimilarityMatcher.editDistance("same", "same"));
        assertEquals(4, SimilarityMatcher.editDistance("", "four"));
        assertEquals(2, SimilarityMatcher.editDistance("flaw", "lawn"));
    }

    @Test
    void isSymmetric() {
        assertEquals(SimilarityMatcher.similarity("int count = 0;", "int counter = 0;"),
            SimilarityMatcher.similarity("int counter = 0;", "int count = 0;"));
    }

    @Test
    void nullIsTreatedAsEmpty() {
        assertEquals(1.0, SimilarityMatcher.similarity(null, ""));
        assertEquals(0.0, SimilarityMatcher.similarity(null, "x"));
    }
}
