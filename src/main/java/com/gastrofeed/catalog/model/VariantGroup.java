package com.gastrofeed.catalog.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A family of products that share a near-identical base name.
 *
 * <p>Groups are computed per run by {@link com.gastrofeed.catalog.service.variant.VariantMatcher}
 * or parsed back from an edited report. A group parsed from a report may still hold raw,
 * unresolved catalog tokens in {@link #getParentCode()} and in its members' codes until
 * {@link com.gastrofeed.catalog.service.variant.VariantReportApplier} resolves them.
 */
public class VariantGroup {
    private int groupId;
    private String parentCode;
    private final List<VariantMember> members = new ArrayList<>();

    public VariantGroup() {}

    public VariantGroup(int groupId, String parentCode) {
        this.groupId = groupId;
        this.parentCode = parentCode;
    }

    public int getGroupId() { return groupId; }
    public void setGroupId(int groupId) { this.groupId = groupId; }
    public String getParentCode() { return parentCode; }
    public void setParentCode(String parentCode) { this.parentCode = parentCode; }
    public List<VariantMember> getMembers() { return members; }

    public VariantGroup addMember(VariantMember member) {
        members.add(member);
        return this;
    }

    public int size() {
        return members.size();
    }
}
