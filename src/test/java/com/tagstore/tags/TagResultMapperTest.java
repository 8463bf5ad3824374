package com.tagstore.tags;

import com.tagstore.domain.EventUser;
import com.tagstore.domain.GroupTagKey;
import com.tagstore.domain.GroupTagKeySummary;
import com.tagstore.domain.GroupTagValue;
import com.tagstore.domain.LabeledTagStat;
import com.tagstore.domain.TagKey;
import com.tagstore.domain.TagValue;
import com.tagstore.query.QueryResult;
import com.tagstore.query.TagQuery;
import com.tagstore.query.TagQueryBuilder;
import com.tagstore.query.TimeRange;
import com.tagstore.tags.TagStoreNotFoundException.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for TagResultMapper
 */
class TagResultMapperTest {

    private static final TimeRange RANGE = new TimeRange(
        Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-03-31T00:00:00Z"));
    private static final Instant FIRST = Instant.parse("2024-02-01T00:00:00Z");
    private static final Instant LAST = Instant.parse("2024-02-10T12:00:00Z");

    private TagResultMapper mapper;
    private TagQueryBuilder builder;

    @BeforeEach
    void setUp() {
        mapper = new TagResultMapper();
        builder = new TagQueryBuilder();
    }

    @Test
    void testTagKeyFromScalarRow() {
        QueryResult result = result(builder.tagKey(RANGE, 1L, null, 7L, "browser"),
            row("values_seen", 7L));

        TagKey key = mapper.toTagKey(result, "browser", TagKeyFactory.project(),
            reason -> new TagKeyNotFoundException("browser", reason));

        assertThat(key.getKey()).isEqualTo("browser");
        assertThat(key.getValuesSeen()).isEqualTo(7L);
    }

    @Test
    void testTagKeyZeroCountIsNotFound() {
        QueryResult result = result(builder.tagKey(RANGE, 1L, null, 7L, "browser"),
            row("values_seen", 0L));

        assertThatThrownBy(() -> mapper.toTagKey(result, "browser", TagKeyFactory.project(),
            reason -> new TagKeyNotFoundException("browser", reason)))
            .isInstanceOf(TagKeyNotFoundException.class)
            .extracting("reason").isEqualTo(Reason.ZERO_COUNT);
    }

    @Test
    void testTagKeyWithoutRowsIsNotFound() {
        QueryResult result = result(builder.tagKey(RANGE, 1L, 42L, 7L, "browser"));

        assertThatThrownBy(() -> mapper.toTagKey(result, "browser", TagKeyFactory.group(42L),
            reason -> new GroupTagKeyNotFoundException(42L, "browser", reason)))
            .isInstanceOf(GroupTagKeyNotFoundException.class)
            .hasMessageContaining("reason=NO_ROWS");
    }

    @Test
    void testTagKeysKeepEngineOrderAndDropZeroCounts() {
        // Given: Rows ordered by the engine, one with no values
        QueryResult result = result(builder.tagKeys(RANGE, 1L, 42L, 7L, null),
            row("tags_key", "os", "values_seen", 9L),
            row("tags_key", "empty", "values_seen", 0L),
            row("tags_key", "browser", "values_seen", 2L));

        // When: Mapping issue-scoped keys
        List<GroupTagKey> keys = mapper.toTagKeys(result, TagKeyFactory.group(42L));

        // Then: Order is preserved and the zero row is gone
        assertThat(keys)
            .extracting(GroupTagKey::getGroupId, GroupTagKey::getKey, GroupTagKey::getValuesSeen)
            .containsExactly(tuple(42L, "os", 9L), tuple(42L, "browser", 2L));
    }

    @Test
    void testTagValueCarriesSeenStats() {
        QueryResult result = result(builder.tagValue(RANGE, 1L, null, 7L, "browser", "Chrome"),
            row("times_seen", 12L, "first_seen", Timestamp.from(FIRST), "last_seen", LAST));

        TagValue value = mapper.toTagValue(result, "browser", "Chrome", TagValueFactory.project(),
            reason -> new TagValueNotFoundException("browser", "Chrome", reason));

        assertThat(value.getKey()).isEqualTo("browser");
        assertThat(value.getValue()).isEqualTo("Chrome");
        assertThat(value.getTimesSeen()).isEqualTo(12L);
        assertThat(value.getFirstSeen()).isEqualTo(FIRST);
        assertThat(value.getLastSeen()).isEqualTo(LAST);
    }

    @Test
    void testTagValueZeroCountIsNotFound() {
        QueryResult result = result(builder.tagValue(RANGE, 1L, 42L, 7L, "browser", "Chrome"),
            row("times_seen", 0L, "first_seen", null, "last_seen", null));

        assertThatThrownBy(() -> mapper.toTagValue(result, "browser", "Chrome", TagValueFactory.group(42L),
            reason -> new GroupTagValueNotFoundException(42L, "browser", "Chrome", reason)))
            .isInstanceOf(GroupTagValueNotFoundException.class)
            .extracting("reason").isEqualTo(Reason.ZERO_COUNT);
    }

    @Test
    void testTagValuesKeyedByTagColumn() {
        QueryResult result = result(builder.tagValues(RANGE, 1L, null, 7L, "browser"),
            row("tags[browser]", "Chrome", "times_seen", 5L, "first_seen", FIRST, "last_seen", LAST),
            row("tags[browser]", "Firefox", "times_seen", 0L, "first_seen", FIRST, "last_seen", LAST),
            row("tags[browser]", "Safari", "times_seen", 1L, "first_seen", LAST, "last_seen", LAST));

        List<TagValue> values = mapper.toTagValues(result, "browser", TagValueFactory.project());

        assertThat(values).extracting(TagValue::getValue).containsExactly("Chrome", "Safari");
        assertThat(values).allSatisfy(value -> {
            assertThat(value.getKey()).isEqualTo("browser");
            assertThat(value.getFirstSeen()).isBeforeOrEqualTo(value.getLastSeen());
        });
    }

    @Test
    void testGroupTagValuesByIssueOmitsZeroCounts() {
        // Given: Issue 11 has the pair zero times
        QueryResult result = result(
            builder.groupListTagValue(RANGE, 1L, List.of(10L, 11L), 7L, "env", "prod").orElseThrow(),
            row("issue", 10L, "times_seen", 4L, "first_seen", FIRST, "last_seen", LAST),
            row("issue", 11L, "times_seen", 0L, "first_seen", null, "last_seen", null));

        // When: Mapping by issue
        Map<Long, GroupTagValue> byIssue = mapper.toGroupTagValuesByIssue(result, "env", "prod");

        // Then: Only issue 10 is present
        assertThat(byIssue).containsOnlyKeys(10L);
        GroupTagValue value = byIssue.get(10L);
        assertThat(value.getGroupId()).isEqualTo(10L);
        assertThat(value.getKey()).isEqualTo("env");
        assertThat(value.getValue()).isEqualTo("prod");
        assertThat(value.getTimesSeen()).isEqualTo(4L);
    }

    @Test
    void testKeySummariesCarryTopValues() {
        QueryResult result = result(builder.groupTagKeysAndTopValues(RANGE, 1L, 42L, 7L),
            row("tags_key", "browser", "count", 20L, "top", List.of("Chrome", "Firefox"), "uniq", 2L));

        List<GroupTagKeySummary> summaries = mapper.toKeySummaries(result, 42L);

        assertThat(summaries).hasSize(1);
        GroupTagKeySummary summary = summaries.get(0);
        assertThat(summary.getGroupId()).isEqualTo(42L);
        assertThat(summary.getKey()).isEqualTo("browser");
        assertThat(summary.getTotalValues()).isEqualTo(20L);
        assertThat(summary.getUniqueValues()).isEqualTo(2L);
        assertThat(summary.getTopValues()).containsExactly("Chrome", "Firefox");
    }

    @Test
    void testLabeledStatsUseFixedLabel() {
        QueryResult result = result(
            builder.releaseTags(RANGE, List.of(1L), null, List.of("1.0", "2.0")).orElseThrow(),
            row("release", "1.0", "count", 3L, "first_seen", "2024-02-01 00:00:00", "last_seen",
                LocalDateTime.of(2024, 2, 10, 12, 0)));

        List<LabeledTagStat> stats = mapper.toLabeledStats(result, LabeledTagStat.RELEASE_KEY);

        assertThat(stats).hasSize(1);
        LabeledTagStat stat = stats.get(0);
        assertThat(stat.getId()).isEqualTo(LabeledTagStat.SYNTHETIC_ID);
        assertThat(stat.getKey()).isEqualTo("release");
        assertThat(stat.getValue()).isEqualTo("1.0");
        assertThat(stat.getTimesSeen()).isEqualTo(3L);
        assertThat(stat.getFirstSeen()).isEqualTo(FIRST);
        assertThat(stat.getLastSeen()).isEqualTo(LAST);
    }

    @Test
    void testNullUserKeepsNullValue() {
        // Given: Users matched by email on events without a user id
        QueryResult result = result(
            builder.groupTagValuesForUsers(RANGE, List.of(new EventUser(1L, null, "a@example.com", null, null)), 100)
                .orElseThrow(),
            row("user_id", null, "count", 2L, "first_seen", FIRST, "last_seen", LAST),
            row("user_id", "u1", "count", 1L, "first_seen", FIRST, "last_seen", LAST));

        // When: Mapping to labeled statistics
        List<LabeledTagStat> stats = mapper.toLabeledStats(result, LabeledTagStat.USER_KEY);

        // Then: The missing identifier stays null instead of becoming text
        assertThat(stats).extracting(LabeledTagStat::getValue).containsExactly(null, "u1");
    }

    @Test
    void testNullGroupKeysSkippedForIdentifiers() {
        QueryResult events = result(
            builder.groupEventIds(RANGE, 1L, null, Map.of("browser", "Chrome")).orElseThrow(),
            row("event_id", null),
            row("event_id", "a1"));
        QueryResult releases = result(builder.release(RANGE, 1L, null, true), row("release", null, "seen", FIRST));

        assertThat(mapper.toGroupKeys(events)).containsExactly("a1");
        assertThat(mapper.toFirstGroupKey(releases)).isEmpty();
    }

    @Test
    void testCountDefaultsToZeroWithoutRows() {
        TagQuery query = builder.groupTagValueCount(RANGE, 1L, 42L, 7L, "browser");

        assertThat(mapper.toCount(result(query))).isZero();
        assertThat(mapper.toCount(result(query, row("count", 17L)))).isEqualTo(17L);
    }

    @Test
    void testFirstGroupKey() {
        TagQuery query = builder.release(RANGE, 1L, null, true);

        assertThat(mapper.toFirstGroupKey(result(query))).isEmpty();
        assertThat(mapper.toFirstGroupKey(result(query, row("release", "1.0", "seen", FIRST)))).contains("1.0");
    }

    @Test
    void testZeroFilledCountsCoverEveryRequestedIssue() {
        // Given: Counts only for issue 11
        QueryResult result = result(
            builder.groupsUserCounts(RANGE, 1L, List.of(10L, 11L, 12L), 7L).orElseThrow(),
            row("issue", 11L, "count", 4L));

        // When: Zero-filling
        Map<Long, Long> counts = mapper.toZeroFilledCounts(result, List.of(10L, 11L, 12L));

        // Then: Every issue is present in request order
        assertThat(counts).containsExactly(entry(10L, 0L), entry(11L, 4L), entry(12L, 0L));
    }

    @Test
    void testIssueIdsKeepEngineOrder() {
        QueryResult issues = result(
            builder.groupIdsForUsers(RANGE, List.of(1L), List.of(
                new EventUser(1L, "u1", null, null, null)), 100).orElseThrow(),
            row("issue", "12", "seen", LAST),
            row("issue", 10L, "seen", FIRST));

        assertThat(mapper.toIssueIds(issues)).containsExactly(12L, 10L);
    }

    @Test
    void testToLongRejectsNonNumericValues() {
        assertThat(TagResultMapper.toLong(null)).isZero();
        assertThat(TagResultMapper.toLong("15")).isEqualTo(15L);
        assertThatThrownBy(() -> TagResultMapper.toLong("many"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToInstantParsesEngineFormats() {
        assertThat(TagResultMapper.toInstant(null)).isNull();
        assertThat(TagResultMapper.toInstant(1706745600L)).isEqualTo(FIRST);
        assertThat(TagResultMapper.toInstant("2024-02-01T00:00:00Z")).isEqualTo(FIRST);
        assertThat(TagResultMapper.toInstant("2024-02-01 00:00:00")).isEqualTo(FIRST);
    }

    @SafeVarargs
    private static QueryResult result(TagQuery query, Map<String, Object>... rows) {
        return new QueryResult(query, List.of(rows));
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
