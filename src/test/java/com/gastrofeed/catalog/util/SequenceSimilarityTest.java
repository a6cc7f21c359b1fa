package com.gastrofeed.catalog.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SequenceSimilarityTest {

    private static final String FIFTY = "abcdefghijklmnopqrstuvwxyz0123456789ABCDEFGHIJKLMN";

    @Test
    public void identicalStringsAreFullySimilar() {
        assertEquals(1.0, SequenceSimilarity.ratio("Stôl nerezový", "Stôl nerezový"));
        assertEquals(1.0, SequenceSimilarity.ratio("", ""));
    }

    @Test
    public void disjointStringsShareNothing() {
        assertEquals(0.0, SequenceSimilarity.ratio("abc", "xyz"));
        assertEquals(0.0, SequenceSimilarity.ratio("abc", ""));
    }

    @Test
    public void matchesDifflibOnClassicExample() {
        // difflib.SequenceMatcher(None, "abcd", "bcde").ratio() == 0.75
        assertEquals(0.75, SequenceSimilarity.ratio("abcd", "bcde"), 1e-9);
    }

    @Test
    public void ratioOfExactlyThresholdDoesNotExceed() {
        String other = FIFTY.substring(0, 49) + "Z";
        assertEquals(0.98, SequenceSimilarity.ratio(FIFTY, other));
        assertFalse(SequenceSimilarity.exceeds(FIFTY, other, 0.98));
    }

    @Test
    public void ratioJustAboveThresholdExceeds() {
        String a = FIFTY + "OPQRSTUVWX";
        String b = a.substring(0, 59) + "Z";
        double r = SequenceSimilarity.ratio(a, b);
        assertTrue(r > 0.98 && r < 0.99, "ratio " + r);
        assertTrue(SequenceSimilarity.exceeds(a, b, 0.98));
    }
}
