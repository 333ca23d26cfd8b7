package com.github.fred84.requestlog.tracking;

import static java.util.Objects.requireNonNull;

import com.github.fred84.requestlog.middleware.NoopQueryLog;
import com.github.fred84.requestlog.middleware.QueryLog;
import com.github.fred84.requestlog.util.ElapsedTime;
import java.time.Duration;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Logs execution time and, optionally, the number of database queries of a unit of work.
 */
public class ExecutionTracker {

    public static final class Builder {
        private Level level = Level.INFO;
        private boolean logQueries;
        private Integer queryThreshold;
        private boolean queryExceedWarning;
        private QueryLog queryLog = new NoopQueryLog();

        private Builder() {
        }

        @NotNull
        public Builder level(@NotNull Level val) {
            level = val;
            return this;
        }

        @NotNull
        public Builder logQueries(boolean val) {
            logQueries = val;
            return this;
        }

        @NotNull
        public Builder queryThreshold(int val) {
            queryThreshold = val;
            return this;
        }

        @NotNull
        public Builder queryExceedWarning(boolean val) {
            queryExceedWarning = val;
            return this;
        }

        @NotNull
        public Builder queryLog(@NotNull QueryLog val) {
            queryLog = val;
            return this;
        }

        @NotNull
        public ExecutionTracker build() {
            return new ExecutionTracker(this);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionTracker.class);

    private final Level level;
    private final boolean logQueries;
    private final Integer queryThreshold;
    private final boolean queryExceedWarning;
    private final QueryLog queryLog;

    private ExecutionTracker(Builder builder) {
        if (builder.queryThreshold != null && builder.queryThreshold < 0) {
            throw new IllegalArgumentException(
                    String.format("query threshold %d should not be negative", builder.queryThreshold)
            );
        }

        level = requireNonNull(builder.level, "level");
        logQueries = builder.logQueries;
        queryThreshold = builder.queryThreshold;
        queryExceedWarning = builder.queryExceedWarning;
        queryLog = requireNonNull(builder.queryLog, "query log");
    }

    @NotNull
    public static Builder executionTracker() {
        return new Builder();
    }

    public <T> T track(@NotNull String name, @NotNull Supplier<T> body) {
        requireNonNull(name, "name");
        requireNonNull(body, "body");

        if (logQueries && !queryLog.isTracking()) {
            LOG.warn("Query logging requested for '{}' but queries are not being recorded", name);
        }

        StackTraceElement caller = caller();
        int initialQueries = queryLog.count();
        long startNanos = System.nanoTime();

        T result;
        try {
            result = body.get();
        } catch (RuntimeException e) {
            LOG.error("Error executing function '{}': {}", name, e.toString(), e);
            throw e;
        }

        report(name, caller, Duration.ofNanos(System.nanoTime() - startNanos), queryLog.count() - initialQueries);
        return result;
    }

    public void track(@NotNull String name, @NotNull Runnable body) {
        requireNonNull(body, "body");

        track(name, () -> {
            body.run();
            return null;
        });
    }

    private void report(String name, @Nullable StackTraceElement caller, Duration elapsed, int queries) {
        StringBuilder message = new StringBuilder()
                .append("Performance Metrics for Function: '").append(name).append("'\n");
        if (caller != null) {
            message.append("  Module: ").append(caller.getClassName()).append('\n')
                    .append("  File: ").append(caller.getFileName()).append(", Line: ").append(caller.getLineNumber()).append('\n');
        }
        message.append("  Execution Time: ").append(ElapsedTime.format(elapsed));

        boolean exceeded = queryThreshold != null && queries > queryThreshold;
        if (logQueries) {
            message.append("\n  Database Queries: ").append(queries).append(" queries");
            if (exceeded) {
                message.append(" (exceeds threshold of (").append(queryThreshold).append("))");
            }
        }

        LOG.atLevel(level).log(message.toString());

        if (logQueries && exceeded && queryExceedWarning) {
            LOG.warn("Function '{}' executed {} queries, exceeding the threshold of {}", name, queries, queryThreshold);
        }
    }

    /**
     * First frame outside this class, {@code null} if the JVM omitted the stack trace.
     */
    @Nullable
    private static StackTraceElement caller() {
        for (StackTraceElement frame : new Throwable().getStackTrace()) {
            if (!frame.getClassName().startsWith(ExecutionTracker.class.getName())) {
                return frame;
            }
        }
        return null;
    }
}
