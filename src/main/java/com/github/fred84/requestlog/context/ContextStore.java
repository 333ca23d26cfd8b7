package com.github.fred84.requestlog.context;

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Execution scoped key/value store merged into every log record emitted while handling a request.
 *
 * <p>Blocking code sees the context of its own thread. Reactive code keeps a holder of its {@link LogContext}
 * in the subscription context (see {@link ContextHandler}) and attaches it to the running thread only while a
 * callback executes, so requests sharing a worker pool never observe each other's bindings.
 */
public final class ContextStore {

    /**
     * Restores the previously attached context when closed.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {

        @Override
        void close();
    }

    private static final ContextStore SHARED = new ContextStore(new DefaultContextHandler());

    private final ThreadLocal<LogContext> current = ThreadLocal.withInitial(LogContext::empty);
    private final ContextHandler contextHandler;

    public ContextStore(@NotNull ContextHandler contextHandler) {
        this.contextHandler = requireNonNull(contextHandler, "context handler");
    }

    @NotNull
    public static ContextStore contextStore() {
        return SHARED;
    }

    @NotNull
    public ContextHandler getContextHandler() {
        return contextHandler;
    }

    public void bind(@NotNull Map<String, ?> pairs) {
        current.set(current.get().with(pairs));
    }

    public void bind(@NotNull String key, Object value) {
        current.set(current.get().with(key, value));
    }

    @NotNull
    public Map<String, RestoreToken> batchBind(@NotNull Map<String, ?> pairs) {
        requireNonNull(pairs, "pairs");

        LogContext context = current.get();
        Map<String, RestoreToken> tokens = new LinkedHashMap<>();
        pairs.keySet().forEach(key -> tokens.put(key, new RestoreToken(key, context.entry(key))));

        current.set(context.with(pairs));
        return tokens;
    }

    public void unbind(@NotNull String key) {
        current.set(current.get().without(key));
    }

    public void reset(@NotNull Map<String, RestoreToken> tokens) {
        requireNonNull(tokens, "tokens");

        // no token is consumed unless the whole batch can be applied
        tokens.values().forEach(RestoreToken::checkUnused);

        LogContext context = current.get();
        for (RestoreToken token : tokens.values()) {
            token.markUsed();
            context = context.restore(token.getKey(), token.getPrevious());
        }
        current.set(context);
    }

    public void clearAll() {
        current.set(current.get().cleared());
    }

    @NotNull
    public Map<String, Object> snapshot() {
        return current.get().snapshot();
    }

    @NotNull
    public LogContext current() {
        return current.get();
    }

    /**
     * Makes {@code context} the current one of this thread until the returned scope is closed.
     */
    @NotNull
    public Scope attach(@NotNull LogContext context) {
        requireNonNull(context, "context");

        LogContext previous = current.get();
        current.set(context);
        return () -> current.set(previous);
    }

    /**
     * Makes the context of {@code holder} the current one of this thread. On close the context the thread
     * ended up with is written back to {@code holder} and the previous one is restored.
     */
    @NotNull
    public Scope attach(@NotNull AtomicReference<LogContext> holder) {
        requireNonNull(holder, "holder");

        LogContext previous = current.get();
        current.set(holder.get());
        return () -> {
            holder.set(current.get());
            current.set(previous);
        };
    }

    public <T> T scoped(@NotNull Map<String, ?> pairs, @NotNull Supplier<T> body) {
        requireNonNull(body, "body");

        Map<String, RestoreToken> tokens = batchBind(pairs);
        try {
            return body.get();
        } finally {
            reset(tokens);
        }
    }

    public void scoped(@NotNull Map<String, ?> pairs, @NotNull Runnable body) {
        requireNonNull(body, "body");

        scoped(pairs, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Binds {@code pairs} for the subscriptions of {@code body} only. Bindings made inside {@code body} stay
     * there as well.
     */
    @NotNull
    public <T> Mono<T> scoped(@NotNull Map<String, ?> pairs, @NotNull Mono<T> body) {
        requireNonNull(pairs, "pairs");

        return body.contextWrite(c -> contextHandler.subscriptionContext(c, contextHandler.logContext(c).with(pairs)));
    }

    @NotNull
    public <T> Flux<T> scoped(@NotNull Map<String, ?> pairs, @NotNull Flux<T> body) {
        requireNonNull(pairs, "pairs");

        return body.contextWrite(c -> contextHandler.subscriptionContext(c, contextHandler.logContext(c).with(pairs)));
    }

    /**
     * Runs {@code body} on subscription with the subscription's log context attached to the current thread.
     * Whatever {@code body} binds is kept for the later callbacks of the subscription.
     */
    @NotNull
    public <T> Mono<T> withLogContext(@NotNull Callable<T> body) {
        requireNonNull(body, "body");

        return Mono.deferContextual(view -> {
            try (Scope ignored = attach(contextHandler.holder(view))) {
                return Mono.justOrEmpty(body.call());
            } catch (Exception e) {
                return Mono.error(e);
            }
        });
    }

    @NotNull
    public static Map<String, Object> merge(@NotNull Map<String, ?> explicit, @NotNull Map<String, ?> ambient) {
        Map<String, Object> merged = new LinkedHashMap<>(ambient);
        merged.putAll(explicit);
        return merged;
    }
}
