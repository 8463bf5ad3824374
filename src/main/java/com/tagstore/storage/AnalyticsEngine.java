package com.tagstore.storage;

import com.tagstore.query.QueryResult;
import com.tagstore.query.TagQuery;

/**
 * Executes query descriptors against the external analytics engine.
 *
 * Implementations report query, transport and descriptor errors as runtime
 * exceptions of their own; an empty result always means "no data".
 */
public interface AnalyticsEngine {

    QueryResult query(TagQuery query);
}
