package com.github.fred84.requestlog.metrics;

import com.github.fred84.requestlog.middleware.DispatchMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class MicrometerRequestMetrics implements RequestMetrics {

    private final Map<DispatchMode, Map<String, Counter>> requestCounters = new ConcurrentHashMap<>();
    private final Map<DispatchMode, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> streamCounters = new ConcurrentHashMap<>();
    private final MeterRegistry registry;

    public MicrometerRequestMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementRequestCounter(DispatchMode mode, int status) {
        getRequestCounter(mode, Integer.toString(status)).increment();
    }

    @Override
    public void recordRequestDuration(DispatchMode mode, Duration duration) {
        timers
                .computeIfAbsent(mode, m -> Timer
                        .builder("request.log.duration")
                        .tag("mode", modeTag(m))
                        .register(registry)
                )
                .record(duration);
    }

    @Override
    public void incrementCancelledRequestCounter(DispatchMode mode) {
        getRequestCounter(mode, "cancelled").increment();
    }

    @Override
    public void incrementStreamCounter(String outcome) {
        streamCounters
                .computeIfAbsent(outcome, o -> Counter
                        .builder("request.log.streams")
                        .tag("outcome", o)
                        .register(registry)
                )
                .increment();
    }

    private Counter getRequestCounter(DispatchMode mode, String status) {
        return requestCounters
                .computeIfAbsent(mode, m -> new ConcurrentHashMap<>())
                .computeIfAbsent(status, s -> Counter
                        .builder("request.log.requests")
                        .tag("mode", modeTag(mode))
                        .tag("status", s)
                        .register(registry)
                );
    }

    private static String modeTag(DispatchMode mode) {
        return mode.name().toLowerCase();
    }
}
