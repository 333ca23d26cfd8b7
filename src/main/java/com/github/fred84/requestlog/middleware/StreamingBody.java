package com.github.fred84.requestlog.middleware;

import static java.util.Objects.requireNonNull;

import com.github.fred84.requestlog.context.ContextStore;
import com.github.fred84.requestlog.context.ContextStore.Scope;
import com.github.fred84.requestlog.context.LogContext;
import com.github.fred84.requestlog.metrics.RequestMetrics;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single use view of a blocking streaming body which logs when draining starts, finishes or fails. Items are
 * passed through one by one, the log context of the request is attached while the source produces them.
 */
final class StreamingBody<T> implements Iterable<T> {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingBody.class);

    private final Iterable<T> source;
    private final String requestId;
    private final LogContext logContext;
    private final ContextStore contextStore;
    private final RequestMetrics metrics;
    private boolean consumed;

    StreamingBody(
            Iterable<T> source,
            String requestId,
            LogContext logContext,
            ContextStore contextStore,
            RequestMetrics metrics
    ) {
        this.source = requireNonNull(source, "source");
        this.requestId = requireNonNull(requestId, "request id");
        this.logContext = requireNonNull(logContext, "log context");
        this.contextStore = requireNonNull(contextStore, "context store");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    @NotNull
    @Override
    public synchronized Iterator<T> iterator() {
        if (consumed) {
            throw new IllegalStateException(String.format("streaming body of request %s is already consumed", requestId));
        }
        consumed = true;
        return new DrainingIterator();
    }

    private final class DrainingIterator implements Iterator<T> {

        private Iterator<T> delegate;
        private boolean done;

        @Override
        public boolean hasNext() {
            if (done) {
                return false;
            }

            boolean hasNext = pull(() -> delegate.hasNext());
            if (!hasNext) {
                done = true;
                inContext(() -> LOG.info("Streaming finished: request_id={}", requestId));
                metrics.incrementStreamCounter("finished");
            }
            return hasNext;
        }

        @Override
        public T next() {
            if (done) {
                throw new NoSuchElementException();
            }
            return pull(() -> delegate.next());
        }

        private <R> R pull(Supplier<R> step) {
            try (Scope ignored = contextStore.attach(logContext)) {
                if (delegate == null) {
                    LOG.info("Streaming started: request_id={}", requestId);
                    delegate = source.iterator();
                }
                return step.get();
            } catch (CancellationException e) {
                done = true;
                inContext(() -> LOG.warn("Streaming was cancelled: request_id={}", requestId));
                metrics.incrementStreamCounter("cancelled");
                throw e;
            } catch (NoSuchElementException e) {
                // next() past the end is a caller error, not a failed stream
                throw e;
            } catch (RuntimeException e) {
                done = true;
                inContext(() -> LOG.error("Streaming failed: request_id={}", requestId, e));
                metrics.incrementStreamCounter("failed");
                throw e;
            }
        }
    }

    private void inContext(Runnable logStatement) {
        try (Scope ignored = contextStore.attach(logContext)) {
            logStatement.run();
        }
    }
}
