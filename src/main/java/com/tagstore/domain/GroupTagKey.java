package com.tagstore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A tag name scoped to a single issue.
 */
public class GroupTagKey extends TagKey {

    @JsonProperty("group_id")
    private final long groupId;

    public GroupTagKey(long groupId, String key, long valuesSeen) {
        super(key, valuesSeen);
        this.groupId = groupId;
    }

    public long getGroupId() {
        return groupId;
    }

    @Override
    public String toString() {
        return "GroupTagKey{groupId=" + groupId + ", key='" + getKey() + "', valuesSeen=" + getValuesSeen() + "}";
    }
}
