package com.github.fred84.requestlog.middleware;

/**
 * Downstream handler of a middleware. Implement {@link BlockingRequestHandler} or {@link ReactiveRequestHandler}.
 */
public interface RequestHandler {
}
