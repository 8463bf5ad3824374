package com.tagstore.tags;

import com.tagstore.domain.GroupTagKey;
import com.tagstore.domain.TagKey;

/**
 * Builds key records from a result row. Chosen once per call, bound to the
 * issue when the call is issue-scoped.
 */
@FunctionalInterface
public interface TagKeyFactory<K extends TagKey> {

    K create(String key, long valuesSeen);

    static TagKeyFactory<TagKey> project() {
        return TagKey::new;
    }

    static TagKeyFactory<GroupTagKey> group(long groupId) {
        return (key, valuesSeen) -> new GroupTagKey(groupId, key, valuesSeen);
    }
}
