package com.tagstore.tags;

import com.tagstore.domain.EventUser;
import com.tagstore.domain.GroupTagKey;
import com.tagstore.domain.GroupTagKeySummary;
import com.tagstore.domain.GroupTagValue;
import com.tagstore.domain.LabeledTagStat;
import com.tagstore.domain.TagKey;
import com.tagstore.domain.TagKeyStatus;
import com.tagstore.domain.TagValue;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to event tags: keys, values and per-issue tag statistics.
 *
 * Every operation reads a fresh snapshot of the default query window. Single
 * key and value lookups throw a {@link TagStoreNotFoundException} subclass when
 * nothing matched; every other operation reports "nothing matched" as an empty
 * result. A {@code null} environment id means "any environment".
 */
public interface TagStorage {

    // Project scope

    TagKey getTagKey(long projectId, Long environmentId, String key);

    TagKey getTagKey(long projectId, Long environmentId, String key, TagKeyStatus status);

    List<TagKey> getTagKeys(long projectId, Long environmentId);

    List<TagKey> getTagKeys(long projectId, Long environmentId, TagKeyStatus status);

    List<TagKey> getTagKeys(long projectId, Long environmentId, TagKeyStatus status, int limit);

    TagValue getTagValue(long projectId, Long environmentId, String key, String value);

    List<TagValue> getTagValues(long projectId, Long environmentId, String key);

    // Issue scope

    GroupTagKey getGroupTagKey(long projectId, long groupId, Long environmentId, String key);

    List<GroupTagKey> getGroupTagKeys(long projectId, long groupId, Long environmentId);

    /**
     * @param limit maximum number of keys, or {@code null} for no limit
     */
    List<GroupTagKey> getGroupTagKeys(long projectId, long groupId, Long environmentId, Integer limit);

    GroupTagValue getGroupTagValue(long projectId, long groupId, Long environmentId, String key, String value);

    List<GroupTagValue> getGroupTagValues(long projectId, long groupId, Long environmentId, String key);

    /**
     * Checks one tag/value pair across many issues at once.
     *
     * @return records keyed by issue id; issues without the value are absent
     */
    Map<Long, GroupTagValue> getGroupListTagValue(long projectId, Collection<Long> groupIds, Long environmentId,
                                                  String key, String value);

    long getGroupTagValueCount(long projectId, long groupId, Long environmentId, String key);

    List<GroupTagValue> getTopGroupTagValues(long projectId, long groupId, Long environmentId, String key);

    List<GroupTagValue> getTopGroupTagValues(long projectId, long groupId, Long environmentId, String key,
                                             int limit);

    List<GroupTagKeySummary> getGroupTagKeysAndTopValues(long projectId, long groupId, Long environmentId);

    // Releases

    /**
     * @param groupId issue to restrict to, or {@code null} for the whole project
     * @param first {@code true} for the earliest release, {@code false} for the latest
     */
    Optional<String> getRelease(long projectId, Long groupId, boolean first);

    Optional<String> getFirstRelease(long projectId, Long groupId);

    Optional<String> getLastRelease(long projectId, Long groupId);

    List<LabeledTagStat> getReleaseTags(Collection<Long> projectIds, Long environmentId,
                                        Collection<String> versions);

    // Events and users

    /**
     * Ids of events carrying any of the given tag/value pairs.
     */
    Set<String> getGroupEventIds(long projectId, Long environmentId, Map<String, String> tags);

    /**
     * Issues touched by any of the users, most recently seen first.
     */
    List<Long> getGroupIdsForUsers(Collection<Long> projectIds, Collection<EventUser> eventUsers);

    List<Long> getGroupIdsForUsers(Collection<Long> projectIds, Collection<EventUser> eventUsers, int limit);

    List<LabeledTagStat> getGroupTagValuesForUsers(Collection<EventUser> eventUsers);

    List<LabeledTagStat> getGroupTagValuesForUsers(Collection<EventUser> eventUsers, int limit);

    /**
     * Distinct users per issue; every requested issue is present, zero when unseen.
     */
    Map<Long, Long> getGroupsUserCounts(long projectId, Collection<Long> groupIds, Long environmentId);

    /**
     * Not supported by this storage.
     *
     * @throws UnsupportedOperationException always
     */
    List<Long> getGroupIdsForSearchFilter(long projectId, Long environmentId, Map<String, String> tags,
                                          Collection<Long> candidates, int limit);
}
