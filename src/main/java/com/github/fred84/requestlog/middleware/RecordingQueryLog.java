package com.github.fred84.requestlog.middleware;

import static java.util.Collections.unmodifiableList;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Query log fed by the data access layer, e.g. from a statement interceptor.
 */
public class RecordingQueryLog implements QueryLog {

    private final List<ExecutedQuery> queries = new CopyOnWriteArrayList<>();

    public void record(String sql, Duration time) {
        queries.add(new ExecutedQuery(sql, time));
    }

    @Override
    public List<ExecutedQuery> queries() {
        return unmodifiableList(queries);
    }
}
