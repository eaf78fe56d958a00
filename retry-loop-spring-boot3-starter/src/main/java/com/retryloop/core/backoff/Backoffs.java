package com.retryloop.core.backoff;

import com.retryloop.core.spi.Backoff;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * 内置策略的快捷构造
 */
public final class Backoffs {

    private Backoffs() {
    }

    /** 不等待, 默认策略 */
    public static FixedBackoff none() {
        return new FixedBackoff(Duration.ZERO);
    }

    public static FixedBackoff fixed(Duration interval) {
        return new FixedBackoff(interval);
    }

    public static ExponentialBackoff exponential(Duration initial) {
        return new ExponentialBackoff(initial);
    }

    public static ExponentialBackoff exponential(Duration initial, Duration max, double randomizationFactor,
                                                 double multiplier, long seed) {
        return new ExponentialBackoff(initial, max, randomizationFactor, multiplier, new Random(seed));
    }

    public static RandomBackoff random(Duration min, Duration max) {
        return new RandomBackoff(min, max);
    }

    public static RandomBackoff random(Duration min, Duration max, long seed) {
        return new RandomBackoff(min, max, new Random(seed));
    }

    public static SequenceBackoff sequence(Iterable<Duration> durations) {
        return SequenceBackoff.of(durations);
    }

    public static SequenceBackoff sequence(Duration... durations) {
        return SequenceBackoff.of(Arrays.asList(durations));
    }

    /**
     * 循环使用给定时长, 永不耗尽
     */
    public static SequenceBackoff cycle(Duration... durations) {
        if (durations.length == 0) {
            throw new IllegalArgumentException("durations must not be empty");
        }
        List<Duration> values = List.of(durations);
        return new SequenceBackoff(IntStream.iterate(0, i -> (i + 1) % values.size())
                .mapToObj(values::get)
                .iterator());
    }
}
