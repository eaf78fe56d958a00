package com.retryloop.core.backoff;

import com.retryloop.core.spi.Backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * 固定间隔策略
 */
public class FixedBackoff implements Backoff {

    private final Duration interval;

    public FixedBackoff(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0, got " + interval);
        }
        this.interval = interval;
    }

    @Override
    public Duration next() {
        return interval;
    }

    public Duration getInterval() {
        return interval;
    }
}
