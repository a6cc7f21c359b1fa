package com.gastrofeed.catalog.service.merge;

import com.gastrofeed.catalog.model.ProductRecord;
import com.gastrofeed.catalog.model.ProductTable;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SourceMergerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private final SourceMerger merger = new SourceMerger(Clock.fixed(NOW, ZoneOffset.UTC));

    private static ProductRecord product(String code, String name, String price, int images) {
        ProductRecord r = new ProductRecord(code, name);
        r.setPriceText(price);
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < images; i++) urls.add("https://img.example/" + code + "/" + i + ".jpg");
        r.setImages(urls);
        return r;
    }

    private static LinkedHashMap<String, ProductTable> feeds(Object... nameAndTable) {
        LinkedHashMap<String, ProductTable> m = new LinkedHashMap<>();
        for (int i = 0; i < nameAndTable.length; i += 2) {
            m.put((String) nameAndTable[i], (ProductTable) nameAndTable[i + 1]);
        }
        return m;
    }

    @Test
    public void richerFeedReplacesImagesAndPrice() {
        ProductTable a = ProductTable.of(List.of(product("F001", "Fritéza", "100.00", 1)));
        ProductTable b = ProductTable.of(List.of(product("F001", "Fritéza B", "120.00", 3)));

        MergeResult result = merger.merge(a, feeds("b", b));

        ProductRecord merged = result.table().find("F001").orElseThrow();
        assertEquals(3, merged.imageCount());
        assertEquals(0, new BigDecimal("120.00").compareTo(merged.getPrice()));
        assertEquals("Fritéza", merged.getName(), "name is never taken from the feed");
        assertEquals("b", merged.getSourceTag());
        assertEquals(NOW, merged.getLastUpdated());
        assertEquals(1, result.stats().getUpdated("b"));
        assertEquals(0, result.stats().getAdded("b"));
    }

    @Test
    public void poorerFeedStillUpdatesPriceButKeepsImages() {
        ProductTable a = ProductTable.of(List.of(product("F001", "Fritéza", "100", 4)));
        ProductTable b = ProductTable.of(List.of(product("F001", "Fritéza", "95,50", 1)));

        MergeResult result = merger.merge(a, feeds("b", b));

        ProductRecord merged = result.table().find("F001").orElseThrow();
        assertEquals(4, merged.imageCount());
        assertEquals(0, new BigDecimal("95.50").compareTo(merged.getPrice()));
        assertEquals(SourceMerger.PRIMARY_SOURCE, merged.getSourceTag());
        assertEquals(1, result.stats().getUpdated("b"));
    }

    @Test
    public void trailingZerosAreNotAPriceChange() {
        ProductTable a = ProductTable.of(List.of(product("F001", "Fritéza", "100.0", 2)));
        ProductTable b = ProductTable.of(List.of(product("F001", "Fritéza", "100.00", 2)));

        MergeResult result = merger.merge(a, feeds("b", b));

        assertEquals(0, result.stats().getUpdated("b"));
        assertNull(result.table().find("F001").orElseThrow().getLastUpdated());
    }

    @Test
    public void blankOrUnparseablePriceNeverUpdates() {
        ProductTable a = ProductTable.of(List.of(product("F001", "Fritéza", "100", 2)));
        ProductTable b = ProductTable.of(List.of(
                product("F001", "Fritéza", "", 1),
                product("F002", "Panvica", "na dopyt", 0)));

        MergeResult result = merger.merge(a, feeds("b", b));

        assertEquals(0, new BigDecimal("100").compareTo(result.table().find("F001").orElseThrow().getPrice()));
        assertEquals(0, result.stats().getUpdated("b"));
        assertNull(result.table().find("F002").orElseThrow().getPrice());
    }

    @Test
    public void newCodesAreAppendedAndCodesUpperCased() {
        ProductTable a = ProductTable.of(List.of(product("a1", "Prvý", "10", 0)));
        ProductTable b = ProductTable.of(List.of(product(" b2 ", "Druhý", "20", 1), product("A1", "Prvý", "10", 0)));

        MergeResult result = merger.merge(a, feeds("feed", b));

        List<ProductRecord> records = result.table().getRecords();
        assertEquals(2, records.size());
        assertEquals("A1", records.get(0).getCode());
        assertEquals("B2", records.get(1).getCode());
        assertEquals("feed", records.get(1).getSourceTag());
        assertEquals(1, result.stats().getAdded("feed"));
        assertEquals("a1", a.getRecords().get(0).getCode(), "input table must not be mutated");
    }

    @Test
    public void duplicateCodesInOneSourceKeepFirstRecordWithLastPrice() {
        ProductTable b = ProductTable.of(List.of(
                product("D1", "First", "10", 1),
                product("D1", "Second", "12", 2),
                product("D1", "Third", "", 0)));

        MergeResult result = merger.merge(ProductTable.empty(), feeds("b", b));

        assertEquals(1, result.table().size());
        ProductRecord r = result.table().getRecords().get(0);
        assertEquals("First", r.getName());
        assertEquals(1, r.imageCount());
        assertEquals(0, new BigDecimal("12").compareTo(r.getPrice()));
    }

    @Test
    public void duplicateCodesInPrimaryKeepFirstRecordWithLastPrice() {
        ProductTable a = ProductTable.of(List.of(
                product("F001", "Fritéza", "100", 1),
                product("f001 ", "Fritéza duplicitná", "150", 2)));

        MergeResult result = merger.merge(a, feeds());

        assertEquals(1, result.table().size());
        ProductRecord merged = result.table().find("F001").orElseThrow();
        assertEquals("Fritéza", merged.getName());
        assertEquals(1, merged.imageCount());
        assertEquals(0, new BigDecimal("150").compareTo(merged.getPrice()));
        assertEquals(SourceMerger.PRIMARY_SOURCE, merged.getSourceTag());
    }

    @Test
    public void sourceWithoutCodeColumnIsSkipped() {
        ProductTable a = ProductTable.of(List.of(product("F001", "Fritéza", "100", 1)));
        ProductTable broken = new ProductTable(Set.of(ProductTable.NAME), List.of(product("X", "X", "1", 5)));

        MergeResult result = merger.merge(a, feeds("broken", broken));

        assertEquals(List.of("broken"), result.stats().getSkippedSources());
        assertEquals(1, result.table().size());
        assertEquals(1, result.table().find("F001").orElseThrow().imageCount());
    }

    @Test
    public void primaryWithoutCodeColumnIsReturnedUnchanged() {
        ProductTable a = new ProductTable(Set.of(ProductTable.NAME), List.of(product("F001", "Fritéza", "100", 1)));
        ProductTable b = ProductTable.of(List.of(product("F002", "Panvica", "5", 1)));

        MergeResult result = merger.merge(a, feeds("b", b));

        assertSame(a, result.table());
        assertFalse(result.stats().getWarnings().isEmpty());
    }

    @Test
    public void mergingTheSameFeedTwiceIsIdempotent() {
        ProductTable a = ProductTable.of(List.of(product("F001", "Fritéza", "100", 1), product("F003", "Gril", "300", 2)));
        ProductTable b = ProductTable.of(List.of(product("F001", "Fritéza", "120", 3), product("F002", "Panvica", "5", 1)));

        ProductTable once = merger.merge(a, feeds("b", b)).table();
        MergeResult twice = merger.merge(once, feeds("b", b));

        assertEquals(0, twice.stats().getTotalUpdated());
        assertEquals(0, twice.stats().getTotalAdded());
        assertEquals(once.size(), twice.table().size());
        for (int i = 0; i < once.size(); i++) {
            ProductRecord x = once.getRecords().get(i);
            ProductRecord y = twice.table().getRecords().get(i);
            assertEquals(x.getCode(), y.getCode());
            assertEquals(x.getImages(), y.getImages());
            assertEquals(0, x.getPrice().compareTo(y.getPrice()));
            assertEquals(x.getSourceTag(), y.getSourceTag());
        }
    }

    @Test
    public void mergedImageCountIsTheMaximumOfferedBySources() {
        ProductTable a = ProductTable.of(List.of(product("M1", "Miešač", "1", 2)));
        ProductTable b = ProductTable.of(List.of(product("M1", "Miešač", "1", 5)));
        ProductTable c = ProductTable.of(List.of(product("M1", "Miešač", "1", 3)));

        MergeResult result = merger.merge(a, feeds("b", b, "c", c));

        assertEquals(5, result.table().find("M1").orElseThrow().imageCount());
        assertEquals("b", result.table().find("M1").orElseThrow().getSourceTag());
    }

    @Test
    public void onlyTheFirstEightImageSlotsCount() {
        ProductTable a = ProductTable.of(List.of(product("M1", "Miešač", "1", 8)));
        ProductTable b = ProductTable.of(List.of(product("M1", "Miešač", "1", 10)));

        MergeResult result = merger.merge(a, feeds("b", b));

        assertEquals(0, result.stats().getUpdated("b"));
    }

    @Test
    public void categoryFilterDropsUnselectedPrimaryOnlyRecords() {
        ProductRecord kept = product("K1", "Kept", "1", 0);
        kept.setCategory("Stoly");
        ProductRecord dropped = product("R1", "Removed", "1", 0);
        dropped.setCategory("Chladničky");
        ProductRecord fed = product("U1", "Fed", "1", 0);
        fed.setCategory("Chladničky");
        ProductTable a = ProductTable.of(List.of(kept, dropped, fed));
        ProductTable b = ProductTable.of(List.of(product("U1", "Fed", "2", 0)));

        MergeResult result = merger.merge(a, feeds("b", b), List.of("Stoly"));

        assertTrue(result.table().find("K1").isPresent());
        assertTrue(result.table().find("U1").isPresent(), "records touched by a feed are always kept");
        assertFalse(result.table().find("R1").isPresent());
        assertEquals(1, result.stats().getKept());
        assertEquals(1, result.stats().getRemoved());
        assertEquals(2, result.stats().getTotalProducts());
    }
}
