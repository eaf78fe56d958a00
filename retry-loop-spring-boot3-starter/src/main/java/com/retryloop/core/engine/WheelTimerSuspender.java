package com.retryloop.core.engine;

import com.retryloop.core.spi.Suspender;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timer;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 基于时间轮的挂起等待
 * 到期后把恢复动作投递到 executor, 不在时间轮线程上执行业务调用
 */
public class WheelTimerSuspender implements Suspender {

    private final Timer timer;

    private final Executor executor;

    public WheelTimerSuspender(Timer timer, Executor executor) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * 非 Spring 环境下的共享实例, 首次使用时创建
     */
    public static WheelTimerSuspender shared() {
        return Holder.INSTANCE;
    }

    @Override
    public CompletableFuture<Void> suspend(Duration duration) {
        CompletableFuture<Void> f = new CompletableFuture<>();
        timer.newTimeout(timeout -> {
            try {
                executor.execute(() -> f.complete(null));
            } catch (RejectedExecutionException e) {
                f.completeExceptionally(e);
            }
        }, duration.toNanos(), TimeUnit.NANOSECONDS);
        return f;
    }

    private static final class Holder {
        private static final WheelTimerSuspender INSTANCE = new WheelTimerSuspender(
                new HashedWheelTimer(new NamedThreadFactory("retry-loop-timer"), 10, TimeUnit.MILLISECONDS, 512),
                ForkJoinPool.commonPool());
    }
}
