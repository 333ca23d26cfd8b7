package com.github.fred84.requestlog.middleware;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

public final class ExecutedQuery {

    private final String sql;
    private final Duration time;

    public ExecutedQuery(String sql, Duration time) {
        this.sql = requireNonNull(sql, "sql");
        this.time = requireNonNull(time, "time");
    }

    public String getSql() {
        return sql;
    }

    public Duration getTime() {
        return time;
    }

    String seconds() {
        return String.format(Locale.ROOT, "%.3f", time.toNanos() / 1_000_000_000d);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof ExecutedQuery)) {
            return false;
        } else {
            ExecutedQuery that = (ExecutedQuery) o;
            return Objects.equals(this.sql, that.sql) && Objects.equals(this.time, that.time);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, time);
    }

    @Override
    public String toString() {
        return String.format("query [%s] in %ss", sql, seconds());
    }
}
