package com.github.fred84.requestlog.tracking;

import static com.github.fred84.requestlog.tracking.ExecutionTracker.executionTracker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import com.github.fred84.requestlog.LogCapture;
import com.github.fred84.requestlog.context.ContextStore;
import com.github.fred84.requestlog.context.DefaultContextHandler;
import com.github.fred84.requestlog.middleware.RecordingQueryLog;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutionTrackerTest {

    private final ContextStore store = new ContextStore(new DefaultContextHandler());
    private final RecordingQueryLog queryLog = new RecordingQueryLog();
    private LogCapture log;

    @BeforeEach
    void captureLogs() {
        log = LogCapture.capture(ExecutionTracker.class, store);
    }

    @AfterEach
    void releaseLogs() {
        log.close();
    }

    @Test
    void executionTimeIsLogged() {
        String result = executionTracker().build().track("load", () -> "loaded");

        assertThat(result).isEqualTo("loaded");
        ILoggingEvent event = log.events().get(0);
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
        assertThat(event.getFormattedMessage())
                .startsWith("Performance Metrics for Function: 'load'\n  Module: ")
                .contains("\n  Execution Time: ")
                .doesNotContain("Database Queries");
    }

    @Test
    void callingCodeIsLocated() {
        executionTracker().build().track("load", () -> {
        });

        assertThat(log.messages().get(0))
                .contains("\n  Module: " + ExecutionTrackerTest.class.getName() + "\n")
                .containsPattern("\n  File: ExecutionTrackerTest\\.java, Line: \\d+\n");
    }

    @Test
    void levelIsConfigurable() {
        executionTracker().level(org.slf4j.event.Level.WARN).build().track("load", () -> {
        });

        assertThat(log.events().get(0).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void queriesOverThresholdAreReported() {
        queryLog.record("SELECT 0", Duration.ZERO);

        executionTracker()
                .logQueries(true)
                .queryThreshold(1)
                .queryExceedWarning(true)
                .queryLog(queryLog)
                .build()
                .track("save", () -> {
                    queryLog.record("INSERT 1", Duration.ZERO);
                    queryLog.record("INSERT 2", Duration.ZERO);
                });

        List<String> messages = log.messages();
        assertThat(messages.get(0)).endsWith("\n  Database Queries: 2 queries (exceeds threshold of (1))");
        assertThat(messages.get(1)).isEqualTo("Function 'save' executed 2 queries, exceeding the threshold of 1");
        assertThat(log.events().get(1).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void queriesWithinThresholdAreNotFlagged() {
        executionTracker()
                .logQueries(true)
                .queryThreshold(5)
                .queryExceedWarning(true)
                .queryLog(queryLog)
                .build()
                .track("save", () -> queryLog.record("INSERT 1", Duration.ZERO));

        assertThat(log.messages()).hasSize(1);
        assertThat(log.messages().get(0)).endsWith("Database Queries: 1 queries");
    }

    @Test
    void untrackedQueryLogIsReported() {
        executionTracker().logQueries(true).build().track("load", () -> 1);

        assertThat(log.messages().get(0)).isEqualTo("Query logging requested for 'load' but queries are not being recorded");
    }

    @Test
    void errorsAreLoggedAndRethrown() {
        store.bind(Map.of("request_id", "r1"));
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(
                IllegalStateException.class,
                () -> executionTracker().build().track("explode", () -> {
                    throw failure;
                })
        );

        assertSame(failure, thrown);
        ILoggingEvent event = log.events().get(0);
        assertThat(event.getLevel()).isEqualTo(Level.ERROR);
        assertThat(event.getFormattedMessage()).isEqualTo("Error executing function 'explode': java.lang.IllegalStateException: boom");
        assertThat(event.getThrowableProxy()).isNotNull();
        assertThat(LogCapture.context(event)).containsEntry("request_id", "r1");
    }

    @Test
    void negativeThresholdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> executionTracker().queryThreshold(-1).build());
    }
}
