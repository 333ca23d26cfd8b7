package com.github.fred84.requestlog.filter;

import static java.util.Objects.requireNonNull;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import com.github.fred84.requestlog.context.ContextStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.event.KeyValuePair;

/**
 * Merges the context of the current execution into every record passing through an appender. Context attached
 * at the call site ({@code LOG.atInfo().addKeyValue(...)}) wins over the ambient one; the result is stored as
 * a single key/value pair named {@value #CONTEXT}.
 *
 * <p>The filter never drops a record. It has to run on the thread that emitted the record, so attach it to
 * synchronous appenders or to an {@code AsyncAppender} itself, not to the appenders behind it.
 */
public class ContextMergeFilter extends Filter<ILoggingEvent> {

    public static final String CONTEXT = "context";

    private final ContextStore contextStore;

    public ContextMergeFilter() {
        this(ContextStore.contextStore());
    }

    public ContextMergeFilter(ContextStore contextStore) {
        this.contextStore = requireNonNull(contextStore, "context store");
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (!(event instanceof LoggingEvent)) {
            // deferred or deserialized events are read-only
            return FilterReply.NEUTRAL;
        }

        LoggingEvent loggingEvent = (LoggingEvent) event;
        Map<String, Object> explicit = new LinkedHashMap<>();
        List<KeyValuePair> pairs = new ArrayList<>();

        List<KeyValuePair> original = loggingEvent.getKeyValuePairs();
        if (original != null) {
            for (KeyValuePair pair : original) {
                if (CONTEXT.equals(pair.key) && pair.value instanceof Map) {
                    ((Map<?, ?>) pair.value).forEach((k, v) -> explicit.put(String.valueOf(k), v));
                } else {
                    explicit.put(pair.key, pair.value);
                    pairs.add(pair);
                }
            }
        }

        pairs.add(new KeyValuePair(CONTEXT, ContextStore.merge(explicit, contextStore.snapshot())));
        loggingEvent.setKeyValuePairs(pairs);

        return FilterReply.NEUTRAL;
    }

    /**
     * Context merged into {@code event}, empty if the event never passed this filter.
     */
    @SuppressWarnings("unchecked")
    public static Optional<Map<String, Object>> mergedContext(ILoggingEvent event) {
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            for (KeyValuePair pair : pairs) {
                if (CONTEXT.equals(pair.key) && pair.value instanceof Map) {
                    return Optional.of((Map<String, Object>) pair.value);
                }
            }
        }
        return Optional.empty();
    }
}
