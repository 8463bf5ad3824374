package com.tagstore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A specific tag value scoped to a single issue.
 */
public class GroupTagValue extends TagValue {

    @JsonProperty("group_id")
    private final long groupId;

    public GroupTagValue(long groupId, String key, String value, long timesSeen, Instant firstSeen, Instant lastSeen) {
        super(key, value, timesSeen, firstSeen, lastSeen);
        this.groupId = groupId;
    }

    public long getGroupId() {
        return groupId;
    }

    @Override
    public String toString() {
        return "GroupTagValue{groupId=" + groupId + ", key='" + getKey() + "', value='" + getValue()
            + "', timesSeen=" + getTimesSeen() + ", firstSeen=" + getFirstSeen() + ", lastSeen=" + getLastSeen() + "}";
    }
}
