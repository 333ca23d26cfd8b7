package com.github.fred84.requestlog.context;

import java.util.concurrent.atomic.AtomicReference;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

/**
 * Carries the log context of a reactive pipeline in its subscription context.
 *
 * <p>The subscription context holds a mutable holder rather than the {@link LogContext} itself. Every callback
 * of the pipeline that attaches the holder with {@link ContextStore#attach(AtomicReference)} writes its final
 * bindings back to it, so later callbacks of the same subscription observe them. Installing a holder with
 * {@link #subscriptionContext(Context, LogContext)} starts a new branch: the upstream operators share the new
 * holder, and nothing they bind is visible downstream of the installing operator.
 */
public interface ContextHandler {

    /**
     * Holder installed upstream of the current operator. A pipeline without one gets a detached holder with
     * an empty context; writes to it are not seen by any other callback.
     */
    AtomicReference<LogContext> holder(ContextView subscriptionContext);

    /**
     * Installs {@code holder} for the operators upstream of the caller.
     */
    Context subscriptionContext(Context originalSubscriptionContext, AtomicReference<LogContext> holder);

    default LogContext logContext(ContextView subscriptionContext) {
        return holder(subscriptionContext).get();
    }

    /**
     * Installs a new holder seeded with {@code logContext}.
     */
    default Context subscriptionContext(Context originalSubscriptionContext, LogContext logContext) {
        return subscriptionContext(originalSubscriptionContext, new AtomicReference<>(logContext));
    }
}
