package com.tagstore.tags;

import com.tagstore.domain.EventUser;
import com.tagstore.domain.GroupTagKey;
import com.tagstore.domain.GroupTagKeySummary;
import com.tagstore.domain.GroupTagValue;
import com.tagstore.domain.LabeledTagStat;
import com.tagstore.domain.TagKey;
import com.tagstore.domain.TagKeyStatus;
import com.tagstore.domain.TagValue;
import com.tagstore.query.QueryResult;
import com.tagstore.query.TagQuery;
import com.tagstore.query.TagQueryBuilder;
import com.tagstore.query.TimeRange;
import com.tagstore.storage.AnalyticsEngine;
import com.tagstore.tags.TagStoreNotFoundException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * {@link TagStorage} backed by the analytics engine.
 *
 * Each call derives a fresh trailing window from the clock, builds one query,
 * runs it and maps the rows. Nothing is cached between calls and engine
 * failures propagate to the caller unchanged.
 */
@Service
public class AnalyticsTagStorage implements TagStorage {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsTagStorage.class);

    private final AnalyticsEngine engine;
    private final TagQueryBuilder queryBuilder;
    private final TagResultMapper mapper;
    private final Clock clock;
    private final int windowDays;

    public AnalyticsTagStorage(
            AnalyticsEngine engine,
            TagQueryBuilder queryBuilder,
            TagResultMapper mapper,
            Clock clock,
            @Value("${tagstore.query.window-days:90}") int windowDays) {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("Query window must be at least one day: " + windowDays);
        }
        this.engine = engine;
        this.queryBuilder = queryBuilder;
        this.mapper = mapper;
        this.clock = clock;
        this.windowDays = windowDays;
    }

    /**
     * Default window for a query issued now.
     */
    // TODO: bound the window by the project's retention period once it is available here
    TimeRange defaultTimeRange() {
        return TimeRange.trailingDays(clock, windowDays);
    }

    // ========== Project scope ==========

    @Override
    public TagKey getTagKey(long projectId, Long environmentId, String key) {
        return getTagKey(projectId, environmentId, key, TagKeyStatus.VISIBLE);
    }

    @Override
    public TagKey getTagKey(long projectId, Long environmentId, String key, TagKeyStatus status) {
        requireQueryable(status);
        return tagKey(projectId, null, environmentId, key, TagKeyFactory.project());
    }

    @Override
    public List<TagKey> getTagKeys(long projectId, Long environmentId) {
        return getTagKeys(projectId, environmentId, TagKeyStatus.VISIBLE);
    }

    @Override
    public List<TagKey> getTagKeys(long projectId, Long environmentId, TagKeyStatus status) {
        return getTagKeys(projectId, environmentId, status, TagQueryBuilder.DEFAULT_TAG_KEYS_LIMIT);
    }

    @Override
    public List<TagKey> getTagKeys(long projectId, Long environmentId, TagKeyStatus status, int limit) {
        requireQueryable(status);
        return tagKeys(projectId, null, environmentId, limit, TagKeyFactory.project());
    }

    @Override
    public TagValue getTagValue(long projectId, Long environmentId, String key, String value) {
        return tagValue(projectId, null, environmentId, key, value, TagValueFactory.project());
    }

    @Override
    public List<TagValue> getTagValues(long projectId, Long environmentId, String key) {
        return tagValues(projectId, null, environmentId, key, TagValueFactory.project());
    }

    // ========== Issue scope ==========

    @Override
    public GroupTagKey getGroupTagKey(long projectId, long groupId, Long environmentId, String key) {
        return tagKey(projectId, groupId, environmentId, key, TagKeyFactory.group(groupId));
    }

    @Override
    public List<GroupTagKey> getGroupTagKeys(long projectId, long groupId, Long environmentId) {
        return getGroupTagKeys(projectId, groupId, environmentId, null);
    }

    @Override
    public List<GroupTagKey> getGroupTagKeys(long projectId, long groupId, Long environmentId, Integer limit) {
        return tagKeys(projectId, groupId, environmentId, limit, TagKeyFactory.group(groupId));
    }

    @Override
    public GroupTagValue getGroupTagValue(long projectId, long groupId, Long environmentId, String key,
                                          String value) {
        return tagValue(projectId, groupId, environmentId, key, value, TagValueFactory.group(groupId));
    }

    @Override
    public List<GroupTagValue> getGroupTagValues(long projectId, long groupId, Long environmentId, String key) {
        return tagValues(projectId, groupId, environmentId, key, TagValueFactory.group(groupId));
    }

    @Override
    public Map<Long, GroupTagValue> getGroupListTagValue(long projectId, Collection<Long> groupIds,
                                                         Long environmentId, String key, String value) {
        return queryBuilder.groupListTagValue(defaultTimeRange(), projectId, groupIds, environmentId, key, value)
            .map(query -> mapper.toGroupTagValuesByIssue(engine.query(query), key, value))
            .orElseGet(Map::of);
    }

    @Override
    public long getGroupTagValueCount(long projectId, long groupId, Long environmentId, String key) {
        TagQuery query = queryBuilder.groupTagValueCount(defaultTimeRange(), projectId, groupId, environmentId, key);
        return mapper.toCount(engine.query(query));
    }

    @Override
    public List<GroupTagValue> getTopGroupTagValues(long projectId, long groupId, Long environmentId, String key) {
        return getTopGroupTagValues(projectId, groupId, environmentId, key, TagQueryBuilder.DEFAULT_TOP_VALUES_LIMIT);
    }

    @Override
    public List<GroupTagValue> getTopGroupTagValues(long projectId, long groupId, Long environmentId, String key,
                                                    int limit) {
        TagQuery query = queryBuilder.topGroupTagValues(defaultTimeRange(), projectId, groupId, environmentId,
            key, limit);
        return mapper.toTagValues(engine.query(query), key, TagValueFactory.group(groupId));
    }

    @Override
    public List<GroupTagKeySummary> getGroupTagKeysAndTopValues(long projectId, long groupId, Long environmentId) {
        TagQuery query = queryBuilder.groupTagKeysAndTopValues(defaultTimeRange(), projectId, groupId, environmentId);
        return mapper.toKeySummaries(engine.query(query), groupId);
    }

    // ========== Releases ==========

    @Override
    public Optional<String> getRelease(long projectId, Long groupId, boolean first) {
        TagQuery query = queryBuilder.release(defaultTimeRange(), projectId, groupId, first);
        return mapper.toFirstGroupKey(engine.query(query));
    }

    @Override
    public Optional<String> getFirstRelease(long projectId, Long groupId) {
        return getRelease(projectId, groupId, true);
    }

    @Override
    public Optional<String> getLastRelease(long projectId, Long groupId) {
        return getRelease(projectId, groupId, false);
    }

    @Override
    public List<LabeledTagStat> getReleaseTags(Collection<Long> projectIds, Long environmentId,
                                               Collection<String> versions) {
        return queryBuilder.releaseTags(defaultTimeRange(), projectIds, environmentId, versions)
            .map(query -> mapper.toLabeledStats(engine.query(query), LabeledTagStat.RELEASE_KEY))
            .orElseGet(() -> skipped("getReleaseTags", List.of()));
    }

    // ========== Events and users ==========

    @Override
    public Set<String> getGroupEventIds(long projectId, Long environmentId, Map<String, String> tags) {
        return queryBuilder.groupEventIds(defaultTimeRange(), projectId, environmentId, tags)
            .map(query -> mapper.toGroupKeys(engine.query(query)))
            .orElseGet(() -> skipped("getGroupEventIds", Set.of()));
    }

    @Override
    public List<Long> getGroupIdsForUsers(Collection<Long> projectIds, Collection<EventUser> eventUsers) {
        return getGroupIdsForUsers(projectIds, eventUsers, TagQueryBuilder.DEFAULT_USERS_LIMIT);
    }

    @Override
    public List<Long> getGroupIdsForUsers(Collection<Long> projectIds, Collection<EventUser> eventUsers, int limit) {
        return queryBuilder.groupIdsForUsers(defaultTimeRange(), projectIds, eventUsers, limit)
            .map(query -> mapper.toIssueIds(engine.query(query)))
            .orElseGet(() -> skipped("getGroupIdsForUsers", List.of()));
    }

    @Override
    public List<LabeledTagStat> getGroupTagValuesForUsers(Collection<EventUser> eventUsers) {
        return getGroupTagValuesForUsers(eventUsers, TagQueryBuilder.DEFAULT_USERS_LIMIT);
    }

    @Override
    public List<LabeledTagStat> getGroupTagValuesForUsers(Collection<EventUser> eventUsers, int limit) {
        return queryBuilder.groupTagValuesForUsers(defaultTimeRange(), eventUsers, limit)
            .map(query -> mapper.toLabeledStats(engine.query(query), LabeledTagStat.USER_KEY))
            .orElseGet(() -> skipped("getGroupTagValuesForUsers", List.of()));
    }

    @Override
    public Map<Long, Long> getGroupsUserCounts(long projectId, Collection<Long> groupIds, Long environmentId) {
        return queryBuilder.groupsUserCounts(defaultTimeRange(), projectId, groupIds, environmentId)
            .map(query -> mapper.toZeroFilledCounts(engine.query(query), groupIds))
            .orElseGet(() -> mapper.zeroCounts(groupIds));
    }

    @Override
    public List<Long> getGroupIdsForSearchFilter(long projectId, Long environmentId, Map<String, String> tags,
                                                 Collection<Long> candidates, int limit) {
        throw new UnsupportedOperationException("Search filter group resolution is not supported by this storage");
    }

    // ========== Shared lookups ==========

    private <K extends TagKey> K tagKey(long projectId, Long groupId, Long environmentId, String key,
                                        TagKeyFactory<K> factory) {
        Function<Reason, TagStoreNotFoundException> notFound = groupId == null
            ? reason -> new TagKeyNotFoundException(key, reason)
            : reason -> new GroupTagKeyNotFoundException(groupId, key, reason);
        TagQuery query = queryBuilder.tagKey(defaultTimeRange(), projectId, groupId, environmentId, key);
        return mapper.toTagKey(engine.query(query), key, factory, notFound);
    }

    private <K extends TagKey> List<K> tagKeys(long projectId, Long groupId, Long environmentId, Integer limit,
                                               TagKeyFactory<K> factory) {
        TagQuery query = queryBuilder.tagKeys(defaultTimeRange(), projectId, groupId, environmentId, limit);
        return mapper.toTagKeys(engine.query(query), factory);
    }

    private <V extends TagValue> V tagValue(long projectId, Long groupId, Long environmentId, String key,
                                            String value, TagValueFactory<V> factory) {
        Function<Reason, TagStoreNotFoundException> notFound = groupId == null
            ? reason -> new TagValueNotFoundException(key, value, reason)
            : reason -> new GroupTagValueNotFoundException(groupId, key, value, reason);
        TagQuery query = queryBuilder.tagValue(defaultTimeRange(), projectId, groupId, environmentId, key, value);
        return mapper.toTagValue(engine.query(query), key, value, factory, notFound);
    }

    private <V extends TagValue> List<V> tagValues(long projectId, Long groupId, Long environmentId, String key,
                                                   TagValueFactory<V> factory) {
        TagQuery query = queryBuilder.tagValues(defaultTimeRange(), projectId, groupId, environmentId, key);
        return mapper.toTagValues(engine.query(query), key, factory);
    }

    private static void requireQueryable(TagKeyStatus status) {
        if (status == null || !status.isQueryable()) {
            throw new IllegalArgumentException("Only visible tag keys can be queried, got status: " + status);
        }
    }

    private static <T> T skipped(String operation, T empty) {
        log.debug("Skipping {} query: request cannot match any rows", operation);
        return empty;
    }
}
