package com.tagstore.tags;

import com.tagstore.domain.GroupTagValue;
import com.tagstore.domain.TagValue;

import java.time.Instant;

/**
 * Builds value records from a result row. Chosen once per call, bound to the
 * issue when the call is issue-scoped.
 */
@FunctionalInterface
public interface TagValueFactory<V extends TagValue> {

    V create(String key, String value, long timesSeen, Instant firstSeen, Instant lastSeen);

    static TagValueFactory<TagValue> project() {
        return TagValue::new;
    }

    static TagValueFactory<GroupTagValue> group(long groupId) {
        return (key, value, timesSeen, firstSeen, lastSeen) ->
            new GroupTagValue(groupId, key, value, timesSeen, firstSeen, lastSeen);
    }
}
