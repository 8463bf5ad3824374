package com.tagstore.tags;

import com.tagstore.domain.GroupTagKeySummary;
import com.tagstore.domain.GroupTagValue;
import com.tagstore.domain.LabeledTagStat;
import com.tagstore.domain.TagKey;
import com.tagstore.domain.TagValue;
import com.tagstore.query.QueryResult;
import com.tagstore.query.TagQueryBuilder;
import com.tagstore.tags.TagStoreNotFoundException.Reason;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns engine results into tag store records.
 *
 * Singular lookups raise the supplied not-found exception when nothing
 * matched; listings return empty collections instead and drop rows whose
 * leading count is zero. Row order from the engine is preserved.
 */
@Component
public class TagResultMapper {

    public <K extends TagKey> K toTagKey(QueryResult result, String key, TagKeyFactory<K> factory,
                                         Function<Reason, ? extends TagStoreNotFoundException> notFound) {
        Map<String, Object> row = result.firstRow().orElseThrow(() -> notFound.apply(Reason.NO_ROWS));
        long valuesSeen = toLong(row.get(TagQueryBuilder.VALUES_SEEN));
        if (valuesSeen == 0) {
            throw notFound.apply(Reason.ZERO_COUNT);
        }
        return factory.create(key, valuesSeen);
    }

    public <K extends TagKey> List<K> toTagKeys(QueryResult result, TagKeyFactory<K> factory) {
        List<K> keys = new ArrayList<>();
        result.byGroup().forEach((key, row) -> {
            long valuesSeen = toLong(row.get(TagQueryBuilder.VALUES_SEEN));
            if (valuesSeen > 0) {
                keys.add(factory.create(toText(key), valuesSeen));
            }
        });
        return keys;
    }

    public <V extends TagValue> V toTagValue(QueryResult result, String key, String value,
                                             TagValueFactory<V> factory,
                                             Function<Reason, ? extends TagStoreNotFoundException> notFound) {
        Map<String, Object> row = result.firstRow().orElseThrow(() -> notFound.apply(Reason.NO_ROWS));
        long timesSeen = toLong(row.get(TagQueryBuilder.TIMES_SEEN));
        if (timesSeen == 0) {
            throw notFound.apply(Reason.ZERO_COUNT);
        }
        return factory.create(key, value, timesSeen,
            toInstant(row.get(TagQueryBuilder.FIRST_SEEN)), toInstant(row.get(TagQueryBuilder.LAST_SEEN)));
    }

    /**
     * Rows keyed by tag value, one record per value.
     */
    public <V extends TagValue> List<V> toTagValues(QueryResult result, String key, TagValueFactory<V> factory) {
        List<V> values = new ArrayList<>();
        result.byGroup().forEach((value, row) -> {
            long timesSeen = toLong(row.get(TagQueryBuilder.TIMES_SEEN));
            if (timesSeen > 0) {
                values.add(factory.create(key, toText(value), timesSeen,
                    toInstant(row.get(TagQueryBuilder.FIRST_SEEN)), toInstant(row.get(TagQueryBuilder.LAST_SEEN))));
            }
        });
        return values;
    }

    /**
     * Rows keyed by issue id, one record per issue that has the tag value.
     */
    public Map<Long, GroupTagValue> toGroupTagValuesByIssue(QueryResult result, String key, String value) {
        Map<Long, GroupTagValue> byIssue = new LinkedHashMap<>();
        result.byGroup().forEach((issue, row) -> {
            long timesSeen = toLong(row.get(TagQueryBuilder.TIMES_SEEN));
            if (issue != null && timesSeen > 0) {
                long groupId = toLong(issue);
                byIssue.put(groupId, TagValueFactory.group(groupId).create(key, value, timesSeen,
                    toInstant(row.get(TagQueryBuilder.FIRST_SEEN)), toInstant(row.get(TagQueryBuilder.LAST_SEEN))));
            }
        });
        return byIssue;
    }

    public List<GroupTagKeySummary> toKeySummaries(QueryResult result, long groupId) {
        List<GroupTagKeySummary> summaries = new ArrayList<>();
        result.byGroup().forEach((key, row) -> summaries.add(new GroupTagKeySummary(
            groupId,
            toText(key),
            toLong(row.get(TagQueryBuilder.UNIQ)),
            toLong(row.get(TagQueryBuilder.COUNT)),
            toStrings(row.get(TagQueryBuilder.TOP)))));
        return summaries;
    }

    /**
     * Statistics rows keyed by a non-tag dimension, labelled with a fixed key.
     */
    public List<LabeledTagStat> toLabeledStats(QueryResult result, String label) {
        List<LabeledTagStat> stats = new ArrayList<>();
        result.byGroup().forEach((name, row) -> stats.add(new LabeledTagStat(
            label,
            toText(name),
            toLong(row.get(TagQueryBuilder.COUNT)),
            toInstant(row.get(TagQueryBuilder.FIRST_SEEN)),
            toInstant(row.get(TagQueryBuilder.LAST_SEEN)))));
        return stats;
    }

    public long toCount(QueryResult result) {
        return result.scalar().map(TagResultMapper::toLong).orElse(0L);
    }

    /**
     * Leading group key of the first row that has one.
     */
    public Optional<String> toFirstGroupKey(QueryResult result) {
        for (Object key : result.byGroup().keySet()) {
            if (key != null) {
                return Optional.of(String.valueOf(key));
            }
        }
        return Optional.empty();
    }

    public Set<String> toGroupKeys(QueryResult result) {
        Set<String> keys = new LinkedHashSet<>();
        for (Object key : result.byGroup().keySet()) {
            if (key != null) {
                keys.add(String.valueOf(key));
            }
        }
        return keys;
    }

    public List<Long> toIssueIds(QueryResult result) {
        List<Long> ids = new ArrayList<>();
        for (Object issue : result.byGroup().keySet()) {
            if (issue != null) {
                ids.add(toLong(issue));
            }
        }
        return ids;
    }

    /**
     * Counts keyed by issue; every requested issue is present, defaulting to zero.
     */
    public Map<Long, Long> toZeroFilledCounts(QueryResult result, Collection<Long> groupIds) {
        Map<Long, Long> counts = zeroCounts(groupIds);
        result.byGroup().forEach((issue, row) -> {
            if (issue == null) {
                return;
            }
            long groupId = toLong(issue);
            if (counts.containsKey(groupId)) {
                counts.put(groupId, toLong(row.get(TagQueryBuilder.COUNT)));
            }
        });
        return counts;
    }

    public Map<Long, Long> zeroCounts(Collection<Long> groupIds) {
        Map<Long, Long> counts = new LinkedHashMap<>();
        for (Long groupId : groupIds) {
            counts.put(groupId, 0L);
        }
        return counts;
    }

    static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a numeric value but got: " + value, e);
        }
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof Instant) {
            return (Instant) value;
        } else if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toInstant();
        } else if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        } else if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        } else if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        } else if (value instanceof Number) {
            // Epoch seconds
            return Instant.ofEpochSecond(((Number) value).longValue());
        }
        String text = value.toString();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        }
    }

    /**
     * Group key as text; a NULL key stays {@code null} rather than becoming "null".
     */
    private static String toText(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static List<String> toStrings(Object value) {
        List<String> strings = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                strings.add(String.valueOf(element));
            }
        } else if (value instanceof Object[]) {
            for (Object element : (Object[]) value) {
                strings.add(String.valueOf(element));
            }
        }
        return strings;
    }
}
