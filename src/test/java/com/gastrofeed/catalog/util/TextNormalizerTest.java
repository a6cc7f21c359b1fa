package com.gastrofeed.catalog.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextNormalizerTest {

    @Test
    public void unescapesEntitiesAndNonBreakingSpaces() {
        assertEquals("Chladenie & mrazenie", TextNormalizer.normalizeCategory(" Chladenie &amp; mrazenie "));
        assertEquals("Chladenie Vitr\u00EDny", TextNormalizer.normalizeCategory("Chladenie\u00A0Vitr\u00EDny"));
        assertEquals("Chladenie Vitríny", TextNormalizer.normalizeCategory("Chladenie&nbsp;Vitríny"));
    }

    @Test
    public void nfkcFoldsCompatibilityForms() {
        assertEquals("Vitr\u00EDny", TextNormalizer.normalizeCategory("Vitri\u0301ny"));
    }

    @Test
    public void placeholderTextCountsAsBlank() {
        assertTrue(TextNormalizer.isBlank(null));
        assertTrue(TextNormalizer.isBlank("  "));
        assertTrue(TextNormalizer.isBlank("nan"));
        assertTrue(TextNormalizer.isBlank("None"));
        assertFalse(TextNormalizer.isBlank("Stoly"));
    }
}
