package com.github.fred84.requestlog.middleware;

import com.github.fred84.requestlog.context.ContextStore;
import com.github.fred84.requestlog.context.ContextStore.Scope;
import com.github.fred84.requestlog.context.LogContext;
import com.github.fred84.requestlog.metrics.RequestMetrics;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

final class ReactiveStreamingBody {

    private static final Logger LOG = LoggerFactory.getLogger(ReactiveStreamingBody.class);

    private ReactiveStreamingBody() {
    }

    /**
     * Decorates {@code source} with start / finish / cancel / failure logging. Signals are passed through
     * untouched. The body's subscription context gets a holder seeded with the request's log context, so
     * bindings made while producing the body show up in the records that follow.
     */
    static <T> Flux<T> wrap(
            Flux<T> source,
            String requestId,
            LogContext logContext,
            ContextStore contextStore,
            RequestMetrics metrics
    ) {
        return Flux.defer(() -> {
            AtomicReference<LogContext> holder = new AtomicReference<>(logContext);

            return source
                    .doOnSubscribe(s -> inContext(contextStore, holder,
                            () -> LOG.info("Streaming started: request_id={}", requestId)))
                    .doOnComplete(() -> {
                        inContext(contextStore, holder, () -> LOG.info("Streaming finished: request_id={}", requestId));
                        metrics.incrementStreamCounter("finished");
                    })
                    .doOnCancel(() -> {
                        inContext(contextStore, holder, () -> LOG.warn("Streaming was cancelled: request_id={}", requestId));
                        metrics.incrementStreamCounter("cancelled");
                    })
                    .doOnError(e -> {
                        inContext(contextStore, holder, () -> LOG.error("Streaming failed: request_id={}", requestId, e));
                        metrics.incrementStreamCounter("failed");
                    })
                    .contextWrite(c -> contextStore.getContextHandler().subscriptionContext(c, holder));
        });
    }

    private static void inContext(ContextStore contextStore, AtomicReference<LogContext> holder, Runnable logStatement) {
        try (Scope ignored = contextStore.attach(holder)) {
            logStatement.run();
        }
    }
}
