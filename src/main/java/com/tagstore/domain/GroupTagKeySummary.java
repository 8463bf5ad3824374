package com.tagstore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-issue overview of one tag key: how many values it has, how often it was
 * set, and its most frequent values.
 */
public class GroupTagKeySummary {

    @JsonProperty("group_id")
    private final long groupId;

    @JsonProperty("key")
    private final String key;

    @JsonProperty("unique_values")
    private final long uniqueValues;

    @JsonProperty("total_values")
    private final long totalValues;

    @JsonProperty("top_values")
    private final List<String> topValues;

    public GroupTagKeySummary(long groupId, String key, long uniqueValues, long totalValues, List<String> topValues) {
        this.groupId = groupId;
        this.key = key;
        this.uniqueValues = uniqueValues;
        this.totalValues = totalValues;
        this.topValues = topValues != null ? List.copyOf(topValues) : List.of();
    }

    public long getGroupId() {
        return groupId;
    }

    public String getKey() {
        return key;
    }

    public long getUniqueValues() {
        return uniqueValues;
    }

    public long getTotalValues() {
        return totalValues;
    }

    public List<String> getTopValues() {
        return topValues;
    }
}
