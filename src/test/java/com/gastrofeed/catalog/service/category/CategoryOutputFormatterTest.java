package com.gastrofeed.catalog.service.category;

import com.gastrofeed.catalog.config.CatalogProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CategoryOutputFormatterTest {

    private final CategoryOutputFormatter formatter = new CategoryOutputFormatter(new CatalogProperties());

    @Test
    public void replacesSeparatorAndAddsPrefix() {
        assertEquals("Tovary a kategórie > Chladenie > Vitríny", formatter.format("Chladenie/Vitríny"));
    }

    @Test
    public void blankBecomesBarePrefix() {
        assertEquals("Tovary a kategórie > ", formatter.format(""));
        assertEquals("Tovary a kategórie > ", formatter.format(null));
    }

    @Test
    public void alreadyPrefixedValueIsKept() {
        assertEquals("Tovary a kategórie > Vitríny", formatter.format("Tovary a kategórie > Vitríny"));
    }
}
