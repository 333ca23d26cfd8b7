package com.github.fred84.requestlog.metrics;

import com.github.fred84.requestlog.middleware.DispatchMode;
import java.time.Duration;

public class NoopRequestMetrics implements RequestMetrics {

    @Override
    public void incrementRequestCounter(DispatchMode mode, int status) {
        // no-op
    }

    @Override
    public void recordRequestDuration(DispatchMode mode, Duration duration) {
        // no-op
    }

    @Override
    public void incrementCancelledRequestCounter(DispatchMode mode) {
        // no-op
    }

    @Override
    public void incrementStreamCounter(String outcome) {
        // no-op
    }
}
