package com.gastrofeed.catalog.service.variant;

import com.gastrofeed.catalog.model.VariantGroup;

import java.util.List;

/**
 * @param groups  groups with resolved codes, as applied to the table
 * @param summary counts and itemized issues
 */
public record VariantReportResult(List<VariantGroup> groups, AssignmentSummary summary) {
}
