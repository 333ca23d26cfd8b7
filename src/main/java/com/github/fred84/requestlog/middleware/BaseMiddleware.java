package com.github.fred84.requestlog.middleware;

import com.github.fred84.requestlog.http.HttpRequest;
import com.github.fred84.requestlog.http.HttpResponse;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Mono;

/**
 * Middleware wrapping one downstream handler. The calling convention of that handler decides, once, whether
 * requests go through {@link #handleBlocking(HttpRequest)} or {@link #handleReactive(HttpRequest)}.
 * {@link #handler()} exposes the middleware with the same convention, so middlewares can be chained.
 */
public abstract class BaseMiddleware {

    private final RequestHandler next;
    private final DispatchMode mode;
    private final RequestHandler dispatcher;

    protected BaseMiddleware(@NotNull RequestHandler next) {
        this.mode = DispatchMode.of(next);
        this.next = next;

        if (mode == DispatchMode.COOPERATIVE) {
            this.dispatcher = (ReactiveRequestHandler) this::handleReactive;
        } else {
            this.dispatcher = (BlockingRequestHandler) this::handleBlocking;
        }
    }

    @NotNull
    public final DispatchMode getMode() {
        return mode;
    }

    @NotNull
    public final RequestHandler handler() {
        return dispatcher;
    }

    protected HttpResponse handleBlocking(HttpRequest request) {
        throw new UnsupportedOperationException("handleBlocking must be implemented by subclass " + getClass().getName());
    }

    protected Mono<HttpResponse> handleReactive(HttpRequest request) {
        throw new UnsupportedOperationException("handleReactive must be implemented by subclass " + getClass().getName());
    }

    protected final BlockingRequestHandler blockingNext() {
        return (BlockingRequestHandler) next;
    }

    protected final ReactiveRequestHandler reactiveNext() {
        return (ReactiveRequestHandler) next;
    }

    @Override
    public String toString() {
        return String.format("%s[next=%s, mode=%s]", getClass().getSimpleName(), next.getClass().getName(), mode);
    }
}
