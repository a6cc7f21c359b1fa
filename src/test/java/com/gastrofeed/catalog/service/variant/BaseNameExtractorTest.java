package com.gastrofeed.catalog.service.variant;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BaseNameExtractorTest {

    @Test
    public void stripsDimensionRunInsideName() {
        String base = BaseNameExtractor.extractBaseName("Table 400x400x850mm Steel");
        assertFalse(base.matches(".*\\dx\\d.*"), base);
        assertEquals("Table Steel", base);
    }

    @Test
    public void stripsDimensionRunAtEnd() {
        assertEquals("Stôl", BaseNameExtractor.extractBaseName("Stôl 400x400x850mm"));
        assertEquals("Stôl", BaseNameExtractor.extractBaseName("Stôl 400x400x1200mm"));
    }

    @Test
    public void stripsDashPrefixedAndTrailingNumbers() {
        assertEquals("Regál nerezový", BaseNameExtractor.extractBaseName("Regál nerezový -1200x400"));
        assertEquals("Varný kotol", BaseNameExtractor.extractBaseName("Varný kotol 150 l"));
    }

    @Test
    public void stripsParenthesizedDimensions() {
        assertEquals("Pracovný stôl", BaseNameExtractor.extractBaseName("Pracovný stôl (600x700)"));
    }

    @Test
    public void nullIsEmpty() {
        assertEquals("", BaseNameExtractor.extractBaseName(null));
    }
}
