package com.retryloop.core;

import com.retryloop.core.backoff.Backoffs;
import com.retryloop.core.decision.Deciders;
import com.retryloop.core.decision.SplitDecider;
import com.retryloop.core.engine.BlockingExecution;
import com.retryloop.core.engine.RetryEngine;
import com.retryloop.core.engine.SuspendingExecution;
import com.retryloop.core.engine.ThreadSleeper;
import com.retryloop.core.engine.WheelTimerSuspender;
import com.retryloop.core.metric.RetryMetrics;
import com.retryloop.core.notify.LoggingRetryListener;
import com.retryloop.core.notify.NotifyingFacade;
import com.retryloop.core.spi.Backoff;
import com.retryloop.core.spi.CheckedFunction;
import com.retryloop.core.spi.ExceptionDecider;
import com.retryloop.core.spi.GlobalDecider;
import com.retryloop.core.spi.ResultDecider;
import com.retryloop.core.spi.RetryListener;
import com.retryloop.core.spi.Sleeper;
import com.retryloop.core.spi.Suspender;
import com.retryloop.model.RetryOptions;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 重试入口
 *
 * 配置在 {@link Builder#build()} 时一次性校验；同一配置既可用于同步操作（阻塞式）,
 * 也可用于返回 CompletionStage 的操作（挂起式）。每次调用拥有独立的上下文和退避状态,
 * 因此同一个 Retryer 可以被多个线程并发使用
 *
 * <pre>
 * Retryer&lt;String&gt; retryer = Retryer.&lt;String&gt;builder()
 *         .maxTries(4)
 *         .backoff(() -&gt; Backoffs.exponential(Duration.ofMillis(200)))
 *         .build();
 * String body = retryer.call(() -&gt; client.fetch(id));
 * </pre>
 */
public final class Retryer<T> {

    private final RetryOptions<T> options;

    private final RetryEngine<T> engine;

    private final Sleeper sleeper;

    private final Suspender suspender;

    private Retryer(RetryOptions<T> options, RetryEngine<T> engine, Sleeper sleeper, Suspender suspender) {
        this.options = options;
        this.engine = engine;
        this.sleeper = sleeper;
        this.suspender = suspender;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public RetryOptions<T> getOptions() {
        return options;
    }

    /**
     * 阻塞式执行
     * 未包装的最终异常原样抛出, 包括受检异常
     */
    public T call(Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        return new BlockingExecution<>(engine, sleeper).run(operation);
    }

    /**
     * 挂起式执行, 最终异常通过返回的 future 传递
     */
    public CompletableFuture<T> callAsync(Supplier<? extends CompletionStage<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        Suspender s = suspender != null ? suspender : WheelTimerSuspender.shared();
        return new SuspendingExecution<>(engine, s, operation).start();
    }

    public Callable<T> decorateCallable(Callable<T> operation) {
        return () -> call(operation);
    }

    /** 每次调用都以同一个参数执行原操作 */
    public <A> CheckedFunction<A, T> decorateFunction(CheckedFunction<A, T> operation) {
        return arg -> call(() -> operation.apply(arg));
    }

    public Supplier<CompletableFuture<T>> decorateCompletionStage(Supplier<? extends CompletionStage<T>> operation) {
        return () -> callAsync(operation);
    }

    public <A> Function<A, CompletableFuture<T>> decorateAsyncFunction(Function<A, ? extends CompletionStage<T>> operation) {
        return arg -> callAsync(() -> operation.apply(arg));
    }

    public static final class Builder<T> {

        private String name = "default";
        private ResultDecider<T> onResult;
        private ExceptionDecider<T> onException;
        private GlobalDecider<T> onGlobal;
        private Integer maxTries;
        private Supplier<? extends Backoff> backoff = Backoffs::none;
        private Duration giveupAfter;
        private boolean wrapException;
        private boolean reraise;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = ThreadSleeper.INSTANCE;
        private Suspender suspender;
        private RetryMetrics metrics;
        private List<RetryListener> listeners = new ArrayList<>(List.of(LoggingRetryListener.INSTANCE));

        private Builder() {
        }

        public Builder<T> name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /** 正常返回时是否重试, 默认不重试 */
        public Builder<T> onResult(ResultDecider<T> onResult) {
            this.onResult = onResult;
            return this;
        }

        /** 抛出异常时是否重试, 默认重试 */
        public Builder<T> onException(ExceptionDecider<T> onException) {
            this.onException = onException;
            return this;
        }

        /** 统一决策, 与 onResult/onException 互斥 */
        public Builder<T> onGlobal(GlobalDecider<T> onGlobal) {
            this.onGlobal = onGlobal;
            return this;
        }

        /**
         * 最大调用次数, null 表示不限
         * 0 表示不调用, 直接以 MaxRetriesException 结束
         */
        public Builder<T> maxTries(Integer maxTries) {
            this.maxTries = maxTries;
            return this;
        }

        /** 每次调用都会通过该工厂创建新的退避策略 */
        public Builder<T> backoff(Supplier<? extends Backoff> backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        /** 从第一次调用开始的总时间预算, null 表示不限 */
        public Builder<T> giveupAfter(Duration giveupAfter) {
            this.giveupAfter = giveupAfter;
            return this;
        }

        public Builder<T> wrapException(boolean wrapException) {
            this.wrapException = wrapException;
            return this;
        }

        public Builder<T> reraise(boolean reraise) {
            this.reraise = reraise;
            return this;
        }

        public Builder<T> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder<T> sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder<T> suspender(Suspender suspender) {
            this.suspender = suspender;
            return this;
        }

        public Builder<T> metrics(RetryMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /** 替换全部监听器 */
        public Builder<T> listeners(List<? extends RetryListener> listeners) {
            this.listeners = new ArrayList<>(listeners);
            return this;
        }

        public Builder<T> listener(RetryListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Retryer<T> build() {
            if (onGlobal != null && onResult != null) {
                throw new IllegalStateException("onGlobal and onResult are mutually exclusive");
            }
            if (onGlobal != null && onException != null) {
                throw new IllegalStateException("onGlobal and onException are mutually exclusive");
            }
            if (maxTries != null && maxTries < 0) {
                throw new IllegalArgumentException("maxTries must be >= 0, got " + maxTries);
            }
            if (giveupAfter != null && giveupAfter.isNegative()) {
                throw new IllegalArgumentException("giveupAfter must be >= 0, got " + giveupAfter);
            }
            GlobalDecider<T> decider = onGlobal != null
                    ? onGlobal
                    : new SplitDecider<>(
                            onResult != null ? onResult : Deciders.stopOnResult(),
                            onException != null ? onException : Deciders.retryOnException());

            RetryOptions<T> options = RetryOptions.<T>builder()
                    .name(name)
                    .decider(decider)
                    .maxTries(maxTries)
                    .backoff(backoff)
                    .giveupAfter(giveupAfter)
                    .wrapException(wrapException)
                    .reraise(reraise)
                    .build();
            RetryMetrics m = metrics != null ? metrics : RetryMetrics.noop();
            RetryEngine<T> engine = new RetryEngine<>(options, clock, m, new NotifyingFacade(listeners, m));
            return new Retryer<>(options, engine, sleeper, suspender);
        }
    }
}
