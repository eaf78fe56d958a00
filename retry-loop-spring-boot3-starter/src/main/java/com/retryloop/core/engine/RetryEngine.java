package com.retryloop.core.engine;

import com.retryloop.core.metric.RetryMetrics;
import com.retryloop.core.notify.NotifyingFacade;
import com.retryloop.core.spi.Backoff;
import com.retryloop.exception.DecisionException;
import com.retryloop.exception.MaxRetriesException;
import com.retryloop.exception.RejectedResultException;
import com.retryloop.exception.RetryException;
import com.retryloop.exception.RetryTimeoutException;
import com.retryloop.model.Attempt;
import com.retryloop.model.RetryOptions;
import com.retryloop.model.ctx.RetryContext;
import com.retryloop.model.enums.RetryEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 重试状态机
 *
 * Start -> CheckLimit -> Wait -> Invoke -> Record -> Consult -> {Continue | Resolve}
 *
 * 只负责状态迁移, 不做等待也不做调用：
 * 阻塞式 {@link BlockingExecution} 与挂起式 {@link SuspendingExecution} 共用同一套迁移规则,
 * 区别仅在于如何等待、如何调用
 */
public class RetryEngine<T> {

    private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);

    private final RetryOptions<T> options;

    private final Clock clock;

    private final RetryMetrics metrics;

    private final NotifyingFacade notifier;

    public RetryEngine(RetryOptions<T> options, Clock clock, RetryMetrics metrics, NotifyingFacade notifier) {
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    /**
     * 开始一次逻辑调用, 截止时间从此刻起算
     */
    public RetryContext<T> open() {
        Instant now = clock.instant();
        Instant deadline = options.getGiveupAfter() == null ? null : now.plus(options.getGiveupAfter());
        Backoff backoff = Objects.requireNonNull(options.getBackoff().get(), "backoff factory returned null");
        metrics.incCalls();
        return new RetryContext<>(options.getName(), backoff, deadline);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * CheckLimit + Wait 决策
     * 第 0 轮不等待也不检查截止时间；之后每轮先取等待时长, 再用等待前的时刻判断是否越过截止时间
     */
    public Plan checkLimits(RetryContext<T> ctx, int i) {
        Instant start = clock.instant();
        Integer maxTries = options.getMaxTries();
        if (maxTries != null && i == maxTries) {
            return Plan.giveUp(limitReached(ctx, RetryEventType.MAX_TRIES));
        }
        if (i == 0) {
            return Plan.proceed(start, Duration.ZERO);
        }
        Duration wait = Objects.requireNonNull(ctx.getBackoff().next(), "backoff returned null");
        // 比较时长而不是时刻, 超大的等待时长不会溢出
        if (ctx.getDeadline() != null && wait.compareTo(Duration.between(start, ctx.getDeadline())) >= 0) {
            return Plan.giveUp(limitReached(ctx, RetryEventType.TIMEOUT));
        }
        if (isPositive(wait)) {
            metrics.recordWait(wait);
            log.debug("[Retry-{}] waiting {} ms before attempt #{}", ctx.getName(), wait.toMillis(), i + 1);
        }
        return Plan.proceed(start, wait);
    }

    /**
     * Record + Consult
     * 无论决策是否抛异常, 本轮调用都恰好记录一次
     */
    Step<T> complete(RetryContext<T> ctx, Instant start, Invocation<T> invocation) {
        boolean retry;
        DecisionException fatal = null;
        try {
            if (invocation.isTryAgain()) {
                metrics.incTryAgain();
                retry = true;
            } else {
                retry = options.getDecider().shouldRetry(invocation.getResult(), invocation.getException(), ctx);
            }
        } catch (Exception e) {
            fatal = new DecisionException(invocation.getResult(), invocation.getException(), ctx, e);
            retry = false;
        } finally {
            Attempt<T> attempt = ctx.addAttempt(invocation.getResult(), invocation.getException(), start);
            metrics.incAttempts();
            notifier.attempt(ctx, attempt);
        }

        if (fatal != null) {
            metrics.incDecisionErr();
            resolve(ctx, RetryEventType.DECISION_ERROR, fatal);
            return Step.fail(fatal);
        }
        if (retry) {
            return Step.next();
        }
        Throwable error = invocation.getException();
        if (error != null) {
            metrics.incFailed();
            Throwable raised = options.isWrapException()
                    ? new RetryException(error.getMessage(), ctx, error)
                    : error;
            resolve(ctx, RetryEventType.FAILURE, raised);
            return Step.fail(raised);
        }
        metrics.incSuccess();
        resolve(ctx, RetryEventType.SUCCESS, null);
        return Step.done(invocation.getResult());
    }

    /**
     * 等待本身失败（线程被中断、时间轮拒绝等）时结束本次调用
     * 不记录调用, 只通知监听器与指标
     */
    public void abort(RetryContext<T> ctx, Throwable error) {
        metrics.incAborted();
        resolve(ctx, RetryEventType.ABORTED, error);
    }

    /**
     * 触发上限
     * reraise 时改为抛出最后一次调用自身的异常, 没有异常则抛出携带其返回值的 RejectedResultException
     */
    private Throwable limitReached(RetryContext<T> ctx, RetryEventType type) {
        Throwable error;
        if (options.isReraise() && !ctx.isEmpty()) {
            Attempt<T> last = ctx.last();
            error = last.getException() != null ? last.getException() : new RejectedResultException(last.getResult());
        } else if (type == RetryEventType.TIMEOUT) {
            error = new RetryTimeoutException("timeout limit reached", ctx);
        } else {
            error = new MaxRetriesException("max tries limit reached", ctx);
        }
        if (type == RetryEventType.TIMEOUT) {
            metrics.incTimeout();
        } else {
            metrics.incMaxTries();
        }
        resolve(ctx, type, error);
        return error;
    }

    private void resolve(RetryContext<T> ctx, RetryEventType type, Throwable error) {
        metrics.recordCallAttempts(ctx.tries());
        notifier.resolved(ctx, type, error);
    }

    static boolean isPositive(Duration d) {
        return !d.isNegative() && !d.isZero();
    }

    /**
     * 一轮开始前的计划：放弃, 或在 start 时刻之后等待 wait 再调用
     */
    public static final class Plan {

        private final Instant start;

        private final Duration wait;

        private final Throwable error;

        private Plan(Instant start, Duration wait, Throwable error) {
            this.start = start;
            this.wait = wait;
            this.error = error;
        }

        static Plan proceed(Instant start, Duration wait) { return new Plan(start, wait, null); }

        static Plan giveUp(Throwable error) { return new Plan(null, null, error); }

        public boolean isGiveUp() { return error != null; }

        public boolean shouldWait() { return wait != null && isPositive(wait); }

        public Instant getStart() { return start; }

        public Duration getWait() { return wait; }

        public Throwable getError() { return error; }
    }

    /**
     * 一轮结束后的去向
     */
    public static final class Step<T> {

        public enum Kind { CONTINUE, RETURN, FAIL }

        private final Kind kind;

        private final T result;

        private final Throwable error;

        private Step(Kind kind, T result, Throwable error) {
            this.kind = kind;
            this.result = result;
            this.error = error;
        }

        static <T> Step<T> next() { return new Step<>(Kind.CONTINUE, null, null); }

        static <T> Step<T> done(T result) { return new Step<>(Kind.RETURN, result, null); }

        static <T> Step<T> fail(Throwable error) { return new Step<>(Kind.FAIL, null, error); }

        public Kind getKind() { return kind; }

        public T getResult() { return result; }

        public Throwable getError() { return error; }
    }
}
