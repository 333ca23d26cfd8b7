package com.github.fred84.requestlog.middleware;

import com.github.fred84.requestlog.http.HttpRequest;
import com.github.fred84.requestlog.http.HttpResponse;

@FunctionalInterface
public interface BlockingRequestHandler extends RequestHandler {

    HttpResponse handle(HttpRequest request);
}
