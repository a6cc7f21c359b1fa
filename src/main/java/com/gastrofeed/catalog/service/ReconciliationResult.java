package com.gastrofeed.catalog.service;

import com.gastrofeed.catalog.model.ProductTable;
import com.gastrofeed.catalog.service.merge.MergeStatistics;
import com.gastrofeed.catalog.service.variant.VariantDetectionResult;

import java.nio.file.Path;
import java.util.List;

public record ReconciliationResult(ProductTable table,
                                   MergeStatistics mergeStatistics,
                                   VariantDetectionResult variants,
                                   List<Path> reports) {
}
