package com.github.fred84.requestlog.middleware;

import java.util.List;

/**
 * Running, append-only log of executed SQL queries. Middlewares only read it.
 */
public interface QueryLog {

    List<ExecutedQuery> queries();

    default int count() {
        return queries().size();
    }

    /**
     * {@code false} when queries are not recorded at all, so counts are meaningless.
     */
    default boolean isTracking() {
        return true;
    }
}
