package com.github.fred84.requestlog.middleware;

import com.github.fred84.requestlog.http.HttpRequest;
import com.github.fred84.requestlog.http.HttpResponse;
import reactor.core.publisher.Mono;

@FunctionalInterface
public interface ReactiveRequestHandler extends RequestHandler {

    Mono<HttpResponse> handle(HttpRequest request);
}
