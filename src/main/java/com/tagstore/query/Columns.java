package com.tagstore.query;

/**
 * Logical column names understood by the analytics engine client.
 */
public final class Columns {

    public static final String PROJECT_ID = "project_id";
    public static final String ENVIRONMENT = "environment";
    public static final String ISSUE = "issue";
    public static final String TIMESTAMP = "timestamp";
    public static final String TAGS_KEY = "tags_key";
    public static final String TAGS_VALUE = "tags_value";
    public static final String RELEASE = "release";
    public static final String EVENT_ID = "event_id";
    public static final String USER_ID = "user_id";
    public static final String EMAIL = "email";
    public static final String USERNAME = "username";
    public static final String IP_ADDRESS = "ip_address";

    private static final String TAG_PREFIX = "tags[";
    private static final String TAG_SUFFIX = "]";

    private Columns() {
    }

    /**
     * Column holding the value of a single tag, e.g. {@code tags[browser]}.
     */
    public static String tag(String key) {
        return TAG_PREFIX + key + TAG_SUFFIX;
    }

    public static boolean isTag(String column) {
        return column.startsWith(TAG_PREFIX) && column.endsWith(TAG_SUFFIX);
    }

    /**
     * Tag key named by a {@link #tag(String)} column.
     */
    public static String tagKey(String column) {
        return column.substring(TAG_PREFIX.length(), column.length() - TAG_SUFFIX.length());
    }
}
