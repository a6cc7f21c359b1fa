package com.gastrofeed.catalog.service.merge;

import com.gastrofeed.catalog.model.ProductRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class PriceParserTest {

    @Test
    public void parsesCommonFormats() {
        assertEquals(0, new BigDecimal("100").compareTo(PriceParser.parse("100")));
        assertEquals(0, new BigDecimal("100.5").compareTo(PriceParser.parse("100,50")));
        assertEquals(0, new BigDecimal("1234.5").compareTo(PriceParser.parse("1 234,50 €")));
        assertEquals(0, new BigDecimal("1234.5").compareTo(PriceParser.parse("1.234,50")));
        assertEquals(0, new BigDecimal("1234.5").compareTo(PriceParser.parse("1,234.50")));
    }

    @Test
    public void missingOrGarbageIsNoValue() {
        assertNull(PriceParser.parse(null));
        assertNull(PriceParser.parse("  "));
        assertNull(PriceParser.parse("nan"));
        assertNull(PriceParser.parse("na dopyt"));
    }

    @Test
    public void recordTakesPriceFromFeedText() {
        ProductRecord r = new ProductRecord("F001", "Fritéza");
        r.setPriceText("1 234,50 €");
        assertEquals(0, new BigDecimal("1234.5").compareTo(r.getPrice()));

        r.setPriceText("na dopyt");
        assertNull(r.getPrice());
    }
}
