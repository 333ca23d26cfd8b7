package com.github.fred84.requestlog.metrics;

import com.github.fred84.requestlog.middleware.DispatchMode;
import java.time.Duration;

public interface RequestMetrics {

    void incrementRequestCounter(DispatchMode mode, int status);

    void recordRequestDuration(DispatchMode mode, Duration duration);

    void incrementCancelledRequestCounter(DispatchMode mode);

    /**
     * @param outcome one of {@code finished}, {@code cancelled} or {@code failed}
     */
    void incrementStreamCounter(String outcome);
}
