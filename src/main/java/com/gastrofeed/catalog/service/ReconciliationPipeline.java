package com.gastrofeed.catalog.service;

import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.service.category.CategoryMapper;
import com.gastrofeed.catalog.service.category.CategoryOutputFormatter;
import com.gastrofeed.catalog.service.merge.MergeResult;
import com.gastrofeed.catalog.service.merge.SourceMerger;
import com.gastrofeed.catalog.service.report.ReportWriter;
import com.gastrofeed.catalog.service.variant.VariantDetectionResult;
import com.gastrofeed.catalog.service.variant.VariantMatcher;
import com.gastrofeed.catalog.service.variant.VariantReportApplier;
import com.gastrofeed.catalog.service.variant.VariantReportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Runs one reconciliation of the supplier feeds into the canonical catalog.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>merge the primary table with the feeds ({@link SourceMerger})</li>
 *   <li>resolve raw categories ({@link CategoryMapper}); may park on the resolver</li>
 *   <li>detect variant families, assign parents, extract differences ({@link VariantMatcher})</li>
 *   <li>write the variant-groups and differences reports</li>
 *   <li>render canonical categories in output form ({@link CategoryOutputFormatter})</li>
 * </ol>
 * Differences are extracted before the output prefix is applied, because the extraction
 * schema is keyed by plain category names.
 */
@Service
public class ReconciliationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationPipeline.class);

    private final SourceMerger merger;
    private final CategoryMapper categoryMapper;
    private final CategoryOutputFormatter outputFormatter;
    private final VariantMatcher variantMatcher;
    private final VariantReportApplier reportApplier;
    private final ReportWriter reportWriter;

    public ReconciliationPipeline(SourceMerger merger,
                                  CategoryMapper categoryMapper,
                                  CategoryOutputFormatter outputFormatter,
                                  VariantMatcher variantMatcher,
                                  VariantReportApplier reportApplier,
                                  ReportWriter reportWriter) {
        this.merger = merger;
        this.categoryMapper = categoryMapper;
        this.outputFormatter = outputFormatter;
        this.variantMatcher = variantMatcher;
        this.reportApplier = reportApplier;
        this.reportWriter = reportWriter;
    }

    public ReconciliationResult run(ProductTable primary, Map<String, ProductTable> feeds) {
        return run(primary, feeds, null);
    }

    public ReconciliationResult run(ProductTable primary, Map<String, ProductTable> feeds,
                                    Collection<String> selectedCategories) {
        long started = System.currentTimeMillis();
        log.info("Reconciliation started: {} feeds", feeds != null ? feeds.size() : 0);

        MergeResult merged = merger.merge(primary, feeds != null ? feeds : Map.of(), selectedCategories);
        ProductTable table = merged.table();

        categoryMapper.applyTo(table);

        VariantDetectionResult variants = variantMatcher.identify(table);
        List<Path> reports = new ArrayList<>();
        if (!variants.groups().isEmpty()) {
            reportWriter.writeVariantGroups(variants.groups()).ifPresent(reports::add);
            reportWriter.writeDifferences(table, variants.groups()).ifPresent(reports::add);
        }

        outputFormatter.applyTo(table);

        log.info("Reconciliation finished in {} ms: {} products, {} variant groups",
                System.currentTimeMillis() - started, table.size(), variants.groups().size());
        return new ReconciliationResult(table, merged.stats(), variants, reports);
    }

    /**
     * Applies an operator-approved variant report to an already reconciled table.
     */
    public VariantReportResult applyVariantReport(ProductTable table, String reportText,
                                                  boolean override, boolean extractDifferences) {
        VariantReportResult result = reportApplier.apply(table, reportText, override, extractDifferences);
        reportWriter.writeAssignmentSummary(result.summary());
        if (extractDifferences && !result.groups().isEmpty()) {
            reportWriter.writeDifferences(table, result.groups());
        }
        return result;
    }
}
