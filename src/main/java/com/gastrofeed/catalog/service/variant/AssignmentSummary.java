package com.gastrofeed.catalog.service.variant;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Audit trail of one report re-application.
 */
public class AssignmentSummary {
    private int groups;

    @JsonProperty("total_products")
    private int totalProducts;

    @JsonProperty("assigned_count")
    private int assignedCount;

    @JsonProperty("unmatched_parents")
    private final List<AssignmentIssue> unmatchedParents = new ArrayList<>();

    @JsonProperty("unmatched_products")
    private final List<AssignmentIssue> unmatchedProducts = new ArrayList<>();

    @JsonProperty("ambiguous_parents")
    private final List<AssignmentIssue> ambiguousParents = new ArrayList<>();

    @JsonProperty("ambiguous_products")
    private final List<AssignmentIssue> ambiguousProducts = new ArrayList<>();

    @JsonProperty("overridden_conflicts")
    private final List<AssignmentIssue> overriddenConflicts = new ArrayList<>();

    @JsonProperty("skipped_conflicts")
    private final List<AssignmentIssue> skippedConflicts = new ArrayList<>();

    public int getGroups() { return groups; }
    public void setGroups(int groups) { this.groups = groups; }
    public int getTotalProducts() { return totalProducts; }
    public void setTotalProducts(int totalProducts) { this.totalProducts = totalProducts; }
    public int getAssignedCount() { return assignedCount; }
    public void setAssignedCount(int assignedCount) { this.assignedCount = assignedCount; }
    public List<AssignmentIssue> getUnmatchedParents() { return unmatchedParents; }
    public List<AssignmentIssue> getUnmatchedProducts() { return unmatchedProducts; }
    public List<AssignmentIssue> getAmbiguousParents() { return ambiguousParents; }
    public List<AssignmentIssue> getAmbiguousProducts() { return ambiguousProducts; }
    public List<AssignmentIssue> getOverriddenConflicts() { return overriddenConflicts; }
    public List<AssignmentIssue> getSkippedConflicts() { return skippedConflicts; }

    void incrementAssigned() {
        assignedCount++;
    }

    /** True if any token was unmatched or ambiguous, or any conflict was seen. */
    public boolean hasIssues() {
        return !unmatchedParents.isEmpty() || !unmatchedProducts.isEmpty()
                || !ambiguousParents.isEmpty() || !ambiguousProducts.isEmpty()
                || !overriddenConflicts.isEmpty() || !skippedConflicts.isEmpty();
    }

    @Override
    public String toString() {
        return "AssignmentSummary{groups=" + groups + ", totalProducts=" + totalProducts
                + ", assigned=" + assignedCount + ", unmatched=" + (unmatchedParents.size() + unmatchedProducts.size())
                + ", ambiguous=" + (ambiguousParents.size() + ambiguousProducts.size())
                + ", conflicts=" + (overriddenConflicts.size() + skippedConflicts.size()) + "}";
    }
}
