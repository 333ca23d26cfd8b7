package com.github.fred84.requestlog.middleware;

import static java.util.Objects.requireNonNull;

import com.github.fred84.requestlog.context.ContextHandler;
import com.github.fred84.requestlog.context.ContextStore;
import com.github.fred84.requestlog.context.ContextStore.Scope;
import com.github.fred84.requestlog.context.LogContext;
import com.github.fred84.requestlog.http.HttpRequest;
import com.github.fred84.requestlog.http.HttpResponse;
import com.github.fred84.requestlog.http.Principal;
import com.github.fred84.requestlog.metrics.NoopRequestMetrics;
import com.github.fred84.requestlog.metrics.RequestMetrics;
import com.github.fred84.requestlog.util.ElapsedTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Logs the start and the end of every request and binds {@code request_id}, {@code ip_address} and
 * {@code user_agent} to the log context for the time the request is handled.
 */
public class RequestLogMiddleware extends BaseMiddleware {

    public static final class Builder {
        private RequestHandler next;
        private ContextStore contextStore = ContextStore.contextStore();
        private QueryLog queryLog = new NoopQueryLog();
        private boolean logSqlQueries;
        private String usernameField = "username";
        private RequestMetrics metrics = new NoopRequestMetrics();

        private Builder() {
        }

        @NotNull
        public Builder next(@NotNull RequestHandler val) {
            next = val;
            return this;
        }

        @NotNull
        public Builder contextStore(@NotNull ContextStore val) {
            contextStore = val;
            return this;
        }

        @NotNull
        public Builder queryLog(@NotNull QueryLog val) {
            queryLog = val;
            return this;
        }

        @NotNull
        public Builder logSqlQueries(boolean val) {
            logSqlQueries = val;
            return this;
        }

        @NotNull
        public Builder usernameField(@NotNull String val) {
            usernameField = val;
            return this;
        }

        @NotNull
        public Builder metrics(@NotNull RequestMetrics val) {
            metrics = val;
            return this;
        }

        @NotNull
        public RequestLogMiddleware build() {
            return new RequestLogMiddleware(this);
        }
    }

    public static final String REQUEST_ID = "request_id";
    public static final String IP_ADDRESS = "ip_address";
    public static final String USER_AGENT = "user_agent";

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String ANONYMOUS = "Anonymous";

    private static final Logger LOG = LoggerFactory.getLogger(RequestLogMiddleware.class);

    private final ContextStore contextStore;
    private final QueryLog queryLog;
    private final boolean logSqlQueries;
    private final String usernameField;
    private final RequestMetrics metrics;

    private RequestLogMiddleware(Builder builder) {
        super(requireNonNull(builder.next, "next handler"));
        contextStore = requireNonNull(builder.contextStore, "context store");
        queryLog = requireNonNull(builder.queryLog, "query log");
        logSqlQueries = builder.logSqlQueries;
        usernameField = requireNonNull(builder.usernameField, "username field");
        metrics = requireNonNull(builder.metrics, "metrics");
    }

    @NotNull
    public static Builder requestLogMiddleware() {
        return new Builder();
    }

    @Override
    protected HttpResponse handleBlocking(HttpRequest request) {
        String requestId = prepareRequest(request);
        long startNanos = System.nanoTime();
        int initialQueries = queryLog.count();

        HttpResponse response = null;
        try {
            response = requireNonNull(blockingNext().handle(request), "handler returned no response");
            wrapStreamingContent(response, requestId, contextStore.current());
            return response;
        } finally {
            if (response != null) {
                finalizeRequest(request, response, startNanos, initialQueries);
            } else {
                contextStore.clearAll();
            }
        }
    }

    @Override
    protected Mono<HttpResponse> handleReactive(HttpRequest request) {
        ContextHandler contextHandler = contextStore.getContextHandler();

        return Mono.deferContextual(view -> {
            AtomicReference<LogContext> requestContext = new AtomicReference<>(contextHandler.logContext(view));
            String requestId;
            try (Scope ignored = contextStore.attach(requestContext)) {
                requestId = prepareRequest(request);
            }
            long startNanos = System.nanoTime();
            int initialQueries = queryLog.count();

            return Mono
                    .defer(() -> {
                        try (Scope ignored = contextStore.attach(requestContext)) {
                            return requireNonNull(reactiveNext().handle(request), "handler returned no response");
                        }
                    })
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException("handler completed without a response")))
                    .doOnCancel(() -> {
                        inContext(requestContext.get(), () -> LOG.warn("Request was cancelled: request_id={}", requestId));
                        metrics.incrementCancelledRequestCounter(getMode());
                    })
                    .map(response -> {
                        // read before finalizing, which clears the holder
                        wrapStreamingContent(response, requestId, requestContext.get());
                        try (Scope ignored = contextStore.attach(requestContext)) {
                            finalizeRequest(request, response, startNanos, initialQueries);
                        }
                        return response;
                    })
                    .contextWrite(c -> contextHandler.subscriptionContext(c, requestContext));
        });
    }

    /**
     * Binds the request context and logs the start of the request.
     *
     * @return id of the request, taken from the request or generated
     */
    String prepareRequest(HttpRequest request) {
        String requestId = getRequestId(request);
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put(REQUEST_ID, requestId);
        context.put(IP_ADDRESS, getIpAddress(request));
        context.put(USER_AGENT, getUserAgent(request));
        contextStore.bind(context);

        LOG.info(
                "REQUEST STARTED:\n\tmethod={}\n\tpath={}\n\tquery_params={}\n\treferrer={}\n",
                request.getMethod(),
                request.getPath(),
                request.getQueryParams().isEmpty() ? "None" : literal(request.getQueryParams()),
                request.getMetadata().getOrDefault("HTTP_REFERER", "None")
        );

        return requestId;
    }

    /**
     * Logs the outcome of the request. The log context is cleared even if logging fails.
     */
    void finalizeRequest(HttpRequest request, HttpResponse response, long startNanos, int initialQueries) {
        try {
            String contentType = response.getHeader("Content-Type");
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

            LOG.info(
                    "REQUEST FINISHED:\n\tuser={}\n\tstatus_code={}\n\tcontent_type=[{}]\n\tresponse_time=[{}]\n\t{}",
                    getUser(request),
                    response.getStatus(),
                    contentType == null ? "Unknown" : contentType,
                    ElapsedTime.format(elapsed),
                    logSqlQueries ? sqlQueriesSummary(initialQueries) : ""
            );

            metrics.incrementRequestCounter(getMode(), response.getStatus());
            metrics.recordRequestDuration(getMode(), elapsed);
        } finally {
            contextStore.clearAll();
        }
    }

    String getUser(HttpRequest request) {
        return request.getPrincipal()
                .filter(Principal::isAuthenticated)
                .map(principal -> {
                    Object username = principal.attribute(usernameField);
                    return String.format("[%s (ID:%s)]", username == null ? ANONYMOUS : username, principal.getId());
                })
                .orElse(ANONYMOUS);
    }

    String sqlQueriesSummary(int initialQueries) {
        List<ExecutedQuery> all = new ArrayList<>(queryLog.queries());
        if (all.size() <= initialQueries) {
            return "";
        }

        List<ExecutedQuery> executed = all.subList(initialQueries, all.size());
        List<String> lines = new ArrayList<>(executed.size());
        for (int i = 0; i < executed.size(); i++) {
            ExecutedQuery query = executed.get(i);
            lines.add(String.format("\t\tQuery%d={'Time': %s(s), 'Query': [%s]}\n\t", i + 1, query.seconds(), query.getSql()));
        }

        return executed.size() + " SQL QUERIES EXECUTED\n" + String.join("\n", lines) + "\n";
    }

    private void wrapStreamingContent(HttpResponse response, String requestId, LogContext requestContext) {
        Iterable<byte[]> streamingContent = response.getStreamingContent();
        if (streamingContent != null) {
            response.setStreamingContent(new StreamingBody<>(streamingContent, requestId, requestContext, contextStore, metrics));
        }

        Flux<byte[]> reactiveContent = response.getReactiveContent();
        if (reactiveContent != null) {
            response.setReactiveContent(ReactiveStreamingBody.wrap(reactiveContent, requestId, requestContext, contextStore, metrics));
        }
    }

    private void inContext(LogContext context, Runnable logStatement) {
        try (Scope ignored = contextStore.attach(context)) {
            logStatement.run();
        }
    }

    /**
     * Header value wins over transport metadata.
     */
    @Nullable
    static String getRequestId(HttpRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header != null && !header.isBlank()) {
            return header;
        }

        String meta = request.getMetadata().get("HTTP_X_REQUEST_ID");
        return meta == null || meta.isBlank() ? null : meta;
    }

    /**
     * First address of {@code X-Forwarded-For}, otherwise the remote address. Cached on the request.
     */
    static String getIpAddress(HttpRequest request) {
        Object cached = request.getAttribute(IP_ADDRESS);
        if (cached != null) {
            return cached.toString();
        }

        String ipAddress = null;
        String forwardedFor = request.getMetadata().get("HTTP_X_FORWARDED_FOR");
        if (forwardedFor != null) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                ipAddress = first;
            }
        }
        if (ipAddress == null) {
            ipAddress = request.getMetadata().getOrDefault("REMOTE_ADDR", "Unknown IP");
        }

        request.setAttribute(IP_ADDRESS, ipAddress);
        return ipAddress;
    }

    static String getUserAgent(HttpRequest request) {
        return request.getMetadata().getOrDefault("HTTP_USER_AGENT", "Unknown");
    }

    // rendered as a literal so structured layouts can turn it back into a map
    private static String literal(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> quote(e.getKey()) + ": " + quote(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
