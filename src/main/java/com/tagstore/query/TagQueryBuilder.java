package com.tagstore.query;

import com.tagstore.domain.EventUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds the query descriptor for each tag store operation.
 *
 * Every method is a pure function of its arguments, the time range included.
 * A {@code null} group id means the query is scoped to the whole project; a
 * {@code null} environment id means no environment filter is applied.
 *
 * Methods returning {@link Optional} yield nothing when the request cannot
 * match any row (an empty id list, an OR-group with no clauses); callers must
 * then skip the engine and return an empty result.
 */
@Component
public class TagQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TagQueryBuilder.class);

    public static final String VALUES_SEEN = "values_seen";
    public static final String TIMES_SEEN = "times_seen";
    public static final String FIRST_SEEN = "first_seen";
    public static final String LAST_SEEN = "last_seen";
    public static final String COUNT = "count";
    public static final String SEEN = "seen";
    public static final String TOP = "top";
    public static final String UNIQ = "uniq";

    public static final int DEFAULT_TAG_KEYS_LIMIT = 1000;
    public static final int DEFAULT_TOP_VALUES_LIMIT = 3;
    public static final int DEFAULT_USERS_LIMIT = 100;
    public static final int TOP_VALUES_PER_KEY = 10;

    public TagQuery tagKey(TimeRange range, long projectId, Long groupId, Long environmentId, String key) {
        String tag = Columns.tag(key);
        TagQuery query = scoped(range, projectId, groupId, environmentId)
            .where(ComparisonExpression.notEq(tag, ""))
            .aggregate(Aggregation.uniq(tag, VALUES_SEEN));
        return logged("tagKey", query);
    }

    /**
     * @param limit maximum number of keys, or {@code null} for no limit
     */
    public TagQuery tagKeys(TimeRange range, long projectId, Long groupId, Long environmentId, Integer limit) {
        TagQuery query = scoped(range, projectId, groupId, environmentId)
            .groupBy(Columns.TAGS_KEY)
            .aggregate(Aggregation.uniq(Columns.TAGS_VALUE, VALUES_SEEN))
            .orderBy(SortField.desc(VALUES_SEEN));
        if (limit != null) {
            query.limit(requirePositive(limit));
        }
        return logged("tagKeys", query);
    }

    public TagQuery tagValue(TimeRange range, long projectId, Long groupId, Long environmentId,
                             String key, String value) {
        TagQuery query = withSeenStats(scoped(range, projectId, groupId, environmentId), TIMES_SEEN)
            .where(ComparisonExpression.eq(Columns.tag(key), value));
        return logged("tagValue", query);
    }

    public TagQuery tagValues(TimeRange range, long projectId, Long groupId, Long environmentId, String key) {
        return logged("tagValues", valuesOf(range, projectId, groupId, environmentId, key));
    }

    /**
     * One tag/value pair checked across several issues at once, grouped by issue.
     */
    public Optional<TagQuery> groupListTagValue(TimeRange range, long projectId, Collection<Long> groupIds,
                                                Long environmentId, String key, String value) {
        if (groupIds.isEmpty()) {
            return Optional.empty();
        }
        TagQuery query = withSeenStats(scoped(range, projectId, null, environmentId), TIMES_SEEN)
            .filter(Columns.ISSUE, groupIds)
            .where(ComparisonExpression.eq(Columns.tag(key), value))
            .groupBy(Columns.ISSUE);
        return Optional.of(logged("groupListTagValue", query));
    }

    public TagQuery groupTagValueCount(TimeRange range, long projectId, long groupId, Long environmentId,
                                       String key) {
        TagQuery query = scoped(range, projectId, groupId, environmentId)
            .where(ComparisonExpression.notEq(Columns.tag(key), ""))
            .aggregate(Aggregation.count(COUNT));
        return logged("groupTagValueCount", query);
    }

    public TagQuery topGroupTagValues(TimeRange range, long projectId, long groupId, Long environmentId,
                                      String key, int limit) {
        TagQuery query = valuesOf(range, projectId, groupId, environmentId, key)
            .orderBy(SortField.desc(TIMES_SEEN))
            .limit(requirePositive(limit));
        return logged("topGroupTagValues", query);
    }

    public TagQuery groupTagKeysAndTopValues(TimeRange range, long projectId, long groupId, Long environmentId) {
        TagQuery query = scoped(range, projectId, groupId, environmentId)
            .where(ComparisonExpression.isNotNull(Columns.TAGS_VALUE))
            .groupBy(Columns.TAGS_KEY)
            .aggregate(Aggregation.count(COUNT))
            .aggregate(new Aggregation("topK(" + TOP_VALUES_PER_KEY + ")", Columns.TAGS_VALUE, TOP))
            .aggregate(Aggregation.uniq(Columns.TAGS_VALUE, UNIQ));
        return logged("groupTagKeysAndTopValues", query);
    }

    /**
     * Earliest ({@code first}) or latest release seen on a project or issue.
     */
    public TagQuery release(TimeRange range, long projectId, Long groupId, boolean first) {
        TagQuery query = new TagQuery(range)
            .filter(Columns.PROJECT_ID, projectId)
            .where(ComparisonExpression.isNotNull(Columns.RELEASE))
            .groupBy(Columns.RELEASE)
            .aggregate(first ? Aggregation.min(Columns.TIMESTAMP, SEEN) : Aggregation.max(Columns.TIMESTAMP, SEEN))
            .orderBy(first ? SortField.asc(SEEN) : SortField.desc(SEEN))
            .limit(1);
        if (groupId != null) {
            query.filter(Columns.ISSUE, groupId);
        }
        return logged("release", query);
    }

    /**
     * Versions are matched as literal release strings in a condition. Translating
     * them to release ids for a filter is the caller's concern.
     */
    public Optional<TagQuery> releaseTags(TimeRange range, Collection<Long> projectIds, Long environmentId,
                                          Collection<String> versions) {
        if (projectIds.isEmpty() || versions.isEmpty()) {
            return Optional.empty();
        }
        TagQuery query = new TagQuery(range).filter(Columns.PROJECT_ID, projectIds);
        if (environmentId != null) {
            query.filter(Columns.ENVIRONMENT, environmentId);
        }
        withSeenStats(query, COUNT)
            .where(ComparisonExpression.in(Columns.RELEASE, versions))
            .groupBy(Columns.RELEASE);
        return Optional.of(logged("releaseTags", query));
    }

    /**
     * Events carrying any of the given tag/value pairs.
     */
    public Optional<TagQuery> groupEventIds(TimeRange range, long projectId, Long environmentId,
                                            Map<String, String> tags) {
        List<ComparisonExpression> clauses = new ArrayList<>();
        tags.forEach((key, value) -> clauses.add(ComparisonExpression.eq(Columns.tag(key), value)));
        return OrExpression.anyOf(clauses).map(anyTag -> logged("groupEventIds",
            scoped(range, projectId, null, environmentId)
                .where(anyTag)
                .groupBy(Columns.EVENT_ID)));
    }

    public Optional<TagQuery> groupIdsForUsers(TimeRange range, Collection<Long> projectIds,
                                               Collection<EventUser> eventUsers, int limit) {
        requirePositive(limit);
        if (projectIds.isEmpty()) {
            return Optional.empty();
        }
        return userConditions(eventUsers).map(anyUser -> logged("groupIdsForUsers",
            new TagQuery(range)
                .filter(Columns.PROJECT_ID, projectIds)
                .where(anyUser)
                .groupBy(Columns.ISSUE)
                .aggregate(Aggregation.max(Columns.TIMESTAMP, SEEN))
                .orderBy(SortField.desc(SEEN))
                .limit(limit)));
    }

    public Optional<TagQuery> groupTagValuesForUsers(TimeRange range, Collection<EventUser> eventUsers, int limit) {
        requirePositive(limit);
        Set<Long> projectIds = new LinkedHashSet<>();
        for (EventUser eventUser : eventUsers) {
            projectIds.add(eventUser.getProjectId());
        }
        if (projectIds.isEmpty()) {
            return Optional.empty();
        }
        return userConditions(eventUsers).map(anyUser -> logged("groupTagValuesForUsers",
            withSeenStats(new TagQuery(range).filter(Columns.PROJECT_ID, projectIds), COUNT)
                .where(anyUser)
                .groupBy(Columns.USER_ID)
                .orderBy(SortField.desc(LAST_SEEN))
                .limit(limit)));
    }

    public Optional<TagQuery> groupsUserCounts(TimeRange range, long projectId, Collection<Long> groupIds,
                                               Long environmentId) {
        if (groupIds.isEmpty()) {
            return Optional.empty();
        }
        TagQuery query = scoped(range, projectId, null, environmentId)
            .filter(Columns.ISSUE, groupIds)
            .groupBy(Columns.ISSUE)
            .aggregate(Aggregation.uniq(Columns.USER_ID, COUNT));
        return Optional.of(logged("groupsUserCounts", query));
    }

    /**
     * OR-group with one {@code IN} clause per identity field that has at least one
     * non-blank value among the users.
     */
    Optional<OrExpression> userConditions(Collection<EventUser> eventUsers) {
        return OrExpression.anyOf(List.of(
            identityClause(Columns.USER_ID, eventUsers, EventUser::getIdent),
            identityClause(Columns.EMAIL, eventUsers, EventUser::getEmail),
            identityClause(Columns.USERNAME, eventUsers, EventUser::getUsername),
            identityClause(Columns.IP_ADDRESS, eventUsers, EventUser::getIpAddress)));
    }

    private ComparisonExpression identityClause(String column, Collection<EventUser> eventUsers,
                                                Function<EventUser, String> field) {
        Set<String> values = new LinkedHashSet<>();
        for (EventUser eventUser : eventUsers) {
            String value = field.apply(eventUser);
            if (value != null && !value.isBlank()) {
                values.add(value);
            }
        }
        return ComparisonExpression.in(column, values);
    }

    private TagQuery scoped(TimeRange range, long projectId, Long groupId, Long environmentId) {
        TagQuery query = new TagQuery(range).filter(Columns.PROJECT_ID, projectId);
        if (environmentId != null) {
            query.filter(Columns.ENVIRONMENT, environmentId);
        }
        if (groupId != null) {
            query.filter(Columns.ISSUE, groupId);
        }
        return query;
    }

    private TagQuery valuesOf(TimeRange range, long projectId, Long groupId, Long environmentId, String key) {
        String tag = Columns.tag(key);
        return withSeenStats(scoped(range, projectId, groupId, environmentId), TIMES_SEEN)
            .where(ComparisonExpression.notEq(tag, ""))
            .groupBy(tag);
    }

    private TagQuery withSeenStats(TagQuery query, String countAlias) {
        return query
            .aggregate(Aggregation.count(countAlias))
            .aggregate(Aggregation.min(Columns.TIMESTAMP, FIRST_SEEN))
            .aggregate(Aggregation.max(Columns.TIMESTAMP, LAST_SEEN));
    }

    private static int requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        return limit;
    }

    private TagQuery logged(String operation, TagQuery query) {
        logger.debug("Built {} query: {}", operation, query);
        return query;
    }
}
