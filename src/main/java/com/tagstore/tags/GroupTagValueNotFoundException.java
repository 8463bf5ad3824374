package com.tagstore.tags;

/**
 * Thrown when a tag value was not seen on a given issue in the query window.
 */
public class GroupTagValueNotFoundException extends TagStoreNotFoundException {

    private static final long serialVersionUID = 1L;

    private final long groupId;
    private final String value;

    public GroupTagValueNotFoundException(long groupId, String key, String value, Reason reason) {
        super("Tag value not found on group " + groupId + ": " + key + "=" + value, key, reason);
        this.groupId = groupId;
        this.value = value;
    }

    public long getGroupId() {
        return groupId;
    }

    public String getValue() {
        return value;
    }
}
