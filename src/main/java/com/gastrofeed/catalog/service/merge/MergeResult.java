package com.gastrofeed.catalog.service.merge;

import com.gastrofeed.catalog.model.ProductTable;

public record MergeResult(ProductTable table, MergeStatistics stats) {
}
