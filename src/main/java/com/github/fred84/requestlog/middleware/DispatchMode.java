package com.github.fred84.requestlog.middleware;

import static java.util.Objects.requireNonNull;

/**
 * Calling convention of a downstream handler, fixed once per middleware instance.
 */
public enum DispatchMode {
    BLOCKING,
    COOPERATIVE;

    static DispatchMode of(RequestHandler handler) {
        requireNonNull(handler, "handler");

        if (handler instanceof ReactiveRequestHandler) {
            return COOPERATIVE;
        }
        if (handler instanceof BlockingRequestHandler) {
            return BLOCKING;
        }
        throw new IllegalArgumentException(String.format(
                "handler %s should implement either BlockingRequestHandler or ReactiveRequestHandler",
                handler.getClass().getName()
        ));
    }
}
