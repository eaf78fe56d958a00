package com.retryloop.core.backoff;

import com.retryloop.core.spi.Backoff;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * 外部提供的时长序列, 每次消费一个元素
 */
public class SequenceBackoff implements Backoff {

    private final Iterator<Duration> durations;

    public SequenceBackoff(Iterator<Duration> durations) {
        this.durations = Objects.requireNonNull(durations, "durations");
    }

    public static SequenceBackoff of(Iterable<Duration> durations) {
        return new SequenceBackoff(durations.iterator());
    }

    public static SequenceBackoff generate(Supplier<Duration> supplier) {
        return new SequenceBackoff(Stream.generate(supplier).iterator());
    }

    @Override
    public Duration next() {
        if (!durations.hasNext()) {
            throw new NoSuchElementException("backoff sequence exhausted");
        }
        return Objects.requireNonNull(durations.next(), "backoff sequence produced null");
    }
}
