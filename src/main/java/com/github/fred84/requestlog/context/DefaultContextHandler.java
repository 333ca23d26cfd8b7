package com.github.fred84.requestlog.context;

import java.util.concurrent.atomic.AtomicReference;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

/**
 * Keeps the holder under a single well known key.
 */
public final class DefaultContextHandler implements ContextHandler {

    private static final String KEY = "requestLogContext";

    @Override
    public AtomicReference<LogContext> holder(ContextView subscriptionContext) {
        AtomicReference<LogContext> holder = subscriptionContext.getOrDefault(KEY, null);
        return holder == null ? new AtomicReference<>(LogContext.empty()) : holder;
    }

    @Override
    public Context subscriptionContext(Context originalSubscriptionContext, AtomicReference<LogContext> holder) {
        return originalSubscriptionContext.put(KEY, holder);
    }
}
