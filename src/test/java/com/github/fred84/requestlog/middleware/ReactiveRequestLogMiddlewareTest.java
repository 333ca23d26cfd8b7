package com.github.fred84.requestlog.middleware;

import static com.github.fred84.requestlog.LogCapture.context;
import static com.github.fred84.requestlog.http.HttpRequest.request;
import static com.github.fred84.requestlog.http.HttpResponse.response;
import static com.github.fred84.requestlog.middleware.RequestLogMiddleware.requestLogMiddleware;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.stream.Collectors.toSet;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import com.github.fred84.requestlog.LogCapture;
import com.github.fred84.requestlog.context.ContextStore;
import com.github.fred84.requestlog.context.DefaultContextHandler;
import com.github.fred84.requestlog.http.HttpResponse;
import com.github.fred84.requestlog.metrics.MicrometerRequestMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class ReactiveRequestLogMiddlewareTest {

    private static final String SEEN_REQUEST_ID = "X-Seen-Request-ID";

    private final ContextStore store = new ContextStore(new DefaultContextHandler());
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final Random random = new Random();
    private LogCapture middlewareLog;
    private LogCapture streamingLog;

    @BeforeEach
    void captureLogs() {
        middlewareLog = LogCapture.capture(RequestLogMiddleware.class, store);
        streamingLog = LogCapture.capture(ReactiveStreamingBody.class, store);
    }

    @AfterEach
    void releaseLogs() {
        middlewareLog.close();
        streamingLog.close();
    }

    @Test
    void reactiveHandlerIsDispatchedCooperatively() {
        ReactiveRequestHandler handler = handler(echoRequestId());

        StepVerifier.create(handler.handle(request().header("X-Request-ID", "r1").build()))
                .assertNext(r -> assertThat(r.getHeader(SEEN_REQUEST_ID)).isEqualTo("r1"))
                .verifyComplete();

        List<ILoggingEvent> events = middlewareLog.events();
        assertThat(events).extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(m -> m.startsWith("REQUEST STARTED"))
                .anyMatch(m -> m.startsWith("REQUEST FINISHED"));
        events.forEach(e -> assertThat(context(e)).containsEntry(RequestLogMiddleware.REQUEST_ID, "r1"));
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void concurrentRequestsOnSharedWorkersAreIsolated() {
        ReactiveRequestHandler handler = handler(r -> Mono
                .delay(Duration.ofMillis(random.nextInt(20)), Schedulers.parallel())
                .then(echoRequestId().handle(r)));

        Flux<Boolean> matches = Flux.range(0, 30)
                .flatMap(i -> handler
                        .handle(request().header("X-Request-ID", "req-" + i).build())
                        .map(r -> ("req-" + i).equals(r.getHeader(SEEN_REQUEST_ID))));

        StepVerifier.create(matches)
                .thenConsumeWhile(Boolean::booleanValue)
                .verifyComplete();

        Set<Object> finishedIds = middlewareLog.startingWith("REQUEST FINISHED").stream()
                .map(e -> context(e).get(RequestLogMiddleware.REQUEST_ID))
                .collect(toSet());
        assertThat(finishedIds).hasSize(30);
        assertThat(finishedIds).containsAll(IntStream.range(0, 30).mapToObj(i -> "req-" + i).collect(toSet()));
    }

    @Test
    void cancellationIsLoggedAsWarning() {
        ReactiveRequestHandler handler = handler(r -> Mono.never());

        StepVerifier.create(handler.handle(request().header("X-Request-ID", "slow").build()))
                .expectSubscription()
                .thenCancel()
                .verify();

        List<ILoggingEvent> cancelled = middlewareLog.startingWith("Request was cancelled");
        assertThat(cancelled).hasSize(1);
        assertThat(cancelled.get(0).getLevel()).isEqualTo(Level.WARN);
        assertThat(context(cancelled.get(0))).containsEntry(RequestLogMiddleware.REQUEST_ID, "slow");
        assertThat(registry.get("request.log.requests").tag("mode", "cooperative").tag("status", "cancelled").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void handlerErrorIsSignalled() {
        ReactiveRequestHandler handler = handler(r -> Mono.error(new IllegalArgumentException("bad input")));

        StepVerifier.create(handler.handle(request().build()))
                .expectErrorMessage("bad input")
                .verify();

        assertThat(middlewareLog.messages()).noneMatch(m -> m.startsWith("REQUEST FINISHED"));
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void emptyResultIsAnError() {
        ReactiveRequestHandler handler = handler(r -> Mono.empty());

        StepVerifier.create(handler.handle(request().build()))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void reactiveBodyIsLoggedWithRequestContext() {
        ReactiveRequestHandler handler = handler(r -> Mono.just(response()
                .reactiveContent(Flux.just("chunk1", "chunk2").map(s -> s.getBytes(UTF_8)))
                .build()));

        HttpResponse response = handler.handle(request().header("X-Request-ID", "stream-2").build()).block();

        StepVerifier.create(response.getReactiveContent().map(b -> new String(b, UTF_8)))
                .expectNext("chunk1", "chunk2")
                .verifyComplete();

        assertThat(streamingLog.messages()).containsExactly(
                "Streaming started: request_id=stream-2",
                "Streaming finished: request_id=stream-2"
        );
        streamingLog.events().forEach(e -> assertThat(context(e)).containsEntry(RequestLogMiddleware.REQUEST_ID, "stream-2"));
    }

    @Test
    void outerSubscriptionContextIsKept() {
        ReactiveRequestHandler handler = handler(r -> store.withLogContext(() -> response()
                .header("X-Tenant", String.valueOf(store.current().get("tenant")))
                .build()));

        Mono<HttpResponse> withTenant = store.scoped(Map.of("tenant", "acme"), handler.handle(request().build()));

        StepVerifier.create(withTenant)
                .assertNext(r -> assertThat(r.getHeader("X-Tenant")).isEqualTo("acme"))
                .verifyComplete();

        middlewareLog.events().forEach(e -> assertThat(context(e)).containsEntry("tenant", "acme"));
    }

    @Test
    void handlerBindingsReachFinishedRecord() {
        ReactiveRequestHandler handler = handler(r -> store
                .withLogContext(() -> {
                    store.bind("user_id", 7);
                    return "authenticated";
                })
                .then(echoRequestId().handle(r)));

        StepVerifier.create(handler.handle(request().header("X-Request-ID", "bound-1").build()))
                .expectNextCount(1)
                .verifyComplete();

        List<ILoggingEvent> finished = middlewareLog.startingWith("REQUEST FINISHED");
        assertThat(finished).hasSize(1);
        assertThat(context(finished.get(0)))
                .containsEntry("user_id", 7)
                .containsEntry(RequestLogMiddleware.REQUEST_ID, "bound-1");
        assertThat(middlewareLog.startingWith("REQUEST STARTED")).noneMatch(e -> context(e).containsKey("user_id"));
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void handlerBindingsReachStreamingRecords() {
        ReactiveRequestHandler handler = handler(r -> store.withLogContext(() -> {
            store.bind("user_id", 7);
            return response()
                    .reactiveContent(Flux.just("chunk1").map(s -> s.getBytes(UTF_8)))
                    .build();
        }));

        HttpResponse response = handler.handle(request().header("X-Request-ID", "stream-3").build()).block();

        StepVerifier.create(response.getReactiveContent())
                .expectNextCount(1)
                .verifyComplete();

        assertThat(streamingLog.events()).hasSize(2);
        streamingLog.events().forEach(e -> assertThat(context(e))
                .containsEntry("user_id", 7)
                .containsEntry(RequestLogMiddleware.REQUEST_ID, "stream-3"));
    }

    @Test
    void handlerBindingsReachCancellationWarning() {
        ReactiveRequestHandler handler = handler(r -> store
                .withLogContext(() -> {
                    store.bind("user_id", 7);
                    return "authenticated";
                })
                .then(Mono.never()));

        StepVerifier.create(handler.handle(request().build()))
                .expectSubscription()
                .thenCancel()
                .verify();

        List<ILoggingEvent> cancelled = middlewareLog.startingWith("Request was cancelled");
        assertThat(cancelled).hasSize(1);
        assertThat(context(cancelled.get(0))).containsEntry("user_id", 7);
    }

    private ReactiveRequestHandler echoRequestId() {
        return r -> store.withLogContext(() -> response()
                .header(SEEN_REQUEST_ID, String.valueOf(store.current().get(RequestLogMiddleware.REQUEST_ID)))
                .build());
    }

    private ReactiveRequestHandler handler(ReactiveRequestHandler next) {
        RequestLogMiddleware middleware = requestLogMiddleware()
                .next(next)
                .contextStore(store)
                .metrics(new MicrometerRequestMetrics(registry))
                .build();

        assertThat(middleware.getMode()).isEqualTo(DispatchMode.COOPERATIVE);
        return (ReactiveRequestHandler) middleware.handler();
    }
}
