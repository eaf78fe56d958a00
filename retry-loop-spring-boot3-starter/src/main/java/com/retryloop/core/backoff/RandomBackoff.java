package com.retryloop.core.backoff;

import com.retryloop.core.spi.Backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * 均匀随机间隔, 每次在 [min, max] 内取值, 与历史无关
 */
public class RandomBackoff implements Backoff {

    private final Duration min;

    private final Duration max;

    private final Random random;

    private Duration interval;

    public RandomBackoff(Duration min, Duration max) {
        this(min, max, new Random());
    }

    public RandomBackoff(Duration min, Duration max, Random random) {
        this.min = Objects.requireNonNull(min, "min");
        this.max = Objects.requireNonNull(max, "max");
        this.random = Objects.requireNonNull(random, "random");
        if (min.isNegative()) {
            throw new IllegalArgumentException("min must be >= 0, got " + min);
        }
        if (max.compareTo(min) < 0) {
            throw new IllegalArgumentException("max must be >= min");
        }
    }

    @Override
    public Duration next() {
        double salt = random.nextDouble();
        long span = max.toNanos() - min.toNanos();
        this.interval = min.plusNanos(Math.round(salt * span));
        return interval;
    }

    public Duration getInterval() { return interval; }

    public Duration getMin() { return min; }

    public Duration getMax() { return max; }
}
