package com.retryloop.core.engine;

import com.retryloop.core.spi.Sleeper;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Thread 睡眠
 */
public final class ThreadSleeper implements Sleeper {

    public static final ThreadSleeper INSTANCE = new ThreadSleeper();

    private ThreadSleeper() {
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
