package com.github.fred84.requestlog.util;

import java.time.Duration;
import java.util.Locale;

public final class ElapsedTime {

    private ElapsedTime() {
    }

    /**
     * Renders {@code elapsed} as {@code "N minute(s) and S.SS second(s)"}, or {@code "S.SS second(s)"} below one minute.
     */
    public static String format(Duration elapsed) {
        if (elapsed.isNegative()) {
            throw new IllegalArgumentException(String.format("elapsed time %s should not be negative", elapsed));
        }

        double totalSeconds = elapsed.toNanos() / 1_000_000_000d;
        long minutes = (long) (totalSeconds / 60);
        double seconds = totalSeconds - minutes * 60;

        if (minutes > 0) {
            return String.format(Locale.ROOT, "%d minute(s) and %.2f second(s)", minutes, seconds);
        }
        return String.format(Locale.ROOT, "%.2f second(s)", seconds);
    }
}
