package com.retryloop.core.backoff;

import com.retryloop.core.spi.Backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * 指数退避 + 抖动
 *
 * 每次返回 [current*(1-r), current*(1+r)] 内的均匀随机值,
 * 之后 current *= multiplier 并限制在 [100ms, max] 内
 */
public class ExponentialBackoff implements Backoff {

    /** current 的下限 */
    public static final Duration MIN_CURRENT = Duration.ofMillis(100);

    public static final Duration DEFAULT_MAX = Duration.ofSeconds(60);

    public static final double DEFAULT_RANDOMIZATION_FACTOR = 0.5;

    public static final double DEFAULT_MULTIPLIER = 1.5;

    private final Duration initial;

    private final Duration max;

    private final double randomizationFactor;

    private final double multiplier;

    private final Random random;

    private Duration current;

    /** 最近一次返回的等待时长 */
    private Duration interval;

    public ExponentialBackoff(Duration initial) {
        this(initial, DEFAULT_MAX, DEFAULT_RANDOMIZATION_FACTOR, DEFAULT_MULTIPLIER, new Random());
    }

    public ExponentialBackoff(Duration initial, Duration max, double randomizationFactor,
                              double multiplier, Random random) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.max = Objects.requireNonNull(max, "max");
        this.random = Objects.requireNonNull(random, "random");
        if (initial.isNegative()) {
            throw new IllegalArgumentException("initial must be >= 0, got " + initial);
        }
        if (max.isNegative() || max.isZero()) {
            throw new IllegalArgumentException("max must be > 0, got " + max);
        }
        if (randomizationFactor < 0 || randomizationFactor > 1) {
            throw new IllegalArgumentException("randomizationFactor must be in [0, 1], got " + randomizationFactor);
        }
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be > 0, got " + multiplier);
        }
        this.randomizationFactor = randomizationFactor;
        this.multiplier = multiplier;
        reset();
    }

    /** 回到初始间隔 */
    public void reset() {
        this.current = initial;
    }

    @Override
    public Duration next() {
        this.interval = randomize();
        increment();
        return interval;
    }

    private Duration randomize() {
        double salt = random.nextDouble();
        double cur = current.toNanos();
        double delta = randomizationFactor * cur;
        double lower = cur - delta;
        double upper = cur + delta;
        return Duration.ofNanos(Math.round(lower + salt * (upper - lower)));
    }

    private void increment() {
        double grown = Math.min((double) max.toNanos(), current.toNanos() * multiplier);
        // 至少 100ms
        this.current = Duration.ofNanos(Math.max((long) grown, MIN_CURRENT.toNanos()));
    }

    public Duration getCurrent() { return current; }

    public Duration getInterval() { return interval; }

    public Duration getInitial() { return initial; }

    public Duration getMax() { return max; }

    public double getRandomizationFactor() { return randomizationFactor; }

    public double getMultiplier() { return multiplier; }
}
