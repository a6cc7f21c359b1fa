package com.gastrofeed.catalog.service.variant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One itemized finding of a report re-application.
 *
 * <p>Only the fields relevant to the issue kind are set; the rest stay null and are left
 * out of the JSON line written to the assignment summary.
 *
 * <h3>Kinds</h3>
 * <ul>
 *   <li><strong>unmatched</strong> - token matched no live code ({@code group_id}, {@code token})</li>
 *   <li><strong>ambiguous</strong> - token matched several codes ({@code match_count}, and for
 *       parents the {@code selected} code)</li>
 *   <li><strong>conflict overridden</strong> - {@code old_parent} replaced by {@code new_parent}</li>
 *   <li><strong>conflict skipped</strong> - {@code existing_parent} kept, {@code desired_parent} dropped</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssignmentIssue {
    @JsonProperty("group_id")
    private Integer groupId;

    private String token;

    @JsonProperty("match_count")
    private Integer matchCount;

    private String selected;

    private String catalog;

    @JsonProperty("old_parent")
    private String oldParent;

    @JsonProperty("new_parent")
    private String newParent;

    @JsonProperty("existing_parent")
    private String existingParent;

    @JsonProperty("desired_parent")
    private String desiredParent;

    public AssignmentIssue() {}

    public static AssignmentIssue unmatched(int groupId, String token) {
        AssignmentIssue issue = new AssignmentIssue();
        issue.groupId = groupId;
        issue.token = token;
        return issue;
    }

    public static AssignmentIssue ambiguousProduct(int groupId, String token, int matchCount) {
        AssignmentIssue issue = unmatched(groupId, token);
        issue.matchCount = matchCount;
        return issue;
    }

    public static AssignmentIssue ambiguousParent(int groupId, String token, int matchCount, String selected) {
        AssignmentIssue issue = ambiguousProduct(groupId, token, matchCount);
        issue.selected = selected;
        return issue;
    }

    public static AssignmentIssue conflictOverridden(int groupId, String catalog, String oldParent, String newParent) {
        AssignmentIssue issue = new AssignmentIssue();
        issue.groupId = groupId;
        issue.catalog = catalog;
        issue.oldParent = oldParent;
        issue.newParent = newParent;
        return issue;
    }

    public static AssignmentIssue conflictSkipped(int groupId, String catalog, String existingParent, String desiredParent) {
        AssignmentIssue issue = new AssignmentIssue();
        issue.groupId = groupId;
        issue.catalog = catalog;
        issue.existingParent = existingParent;
        issue.desiredParent = desiredParent;
        return issue;
    }

    public Integer getGroupId() { return groupId; }
    public void setGroupId(Integer groupId) { this.groupId = groupId; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public Integer getMatchCount() { return matchCount; }
    public void setMatchCount(Integer matchCount) { this.matchCount = matchCount; }
    public String getSelected() { return selected; }
    public void setSelected(String selected) { this.selected = selected; }
    public String getCatalog() { return catalog; }
    public void setCatalog(String catalog) { this.catalog = catalog; }
    public String getOldParent() { return oldParent; }
    public void setOldParent(String oldParent) { this.oldParent = oldParent; }
    public String getNewParent() { return newParent; }
    public void setNewParent(String newParent) { this.newParent = newParent; }
    public String getExistingParent() { return existingParent; }
    public void setExistingParent(String existingParent) { this.existingParent = existingParent; }
    public String getDesiredParent() { return desiredParent; }
    public void setDesiredParent(String desiredParent) { this.desiredParent = desiredParent; }
}
