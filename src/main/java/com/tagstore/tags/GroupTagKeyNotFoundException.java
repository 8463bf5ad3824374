package com.tagstore.tags;

/**
 * Thrown when a tag key has no values on a given issue in the query window.
 */
public class GroupTagKeyNotFoundException extends TagStoreNotFoundException {

    private static final long serialVersionUID = 1L;

    private final long groupId;

    public GroupTagKeyNotFoundException(long groupId, String key, Reason reason) {
        super("Tag key not found on group " + groupId + ": " + key, key, reason);
        this.groupId = groupId;
    }

    public long getGroupId() {
        return groupId;
    }
}
