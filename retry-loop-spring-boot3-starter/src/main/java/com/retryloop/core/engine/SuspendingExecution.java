package com.retryloop.core.engine;

import com.retryloop.core.spi.Suspender;
import com.retryloop.model.ctx.RetryContext;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 挂起式执行：退避等待交给 {@link Suspender}, 不占用线程
 *
 * 同步完成的调用和已完成的等待都在当前线程内循环处理, 只有尚未完成的等待或调用才注册回调,
 * 因此连续重试不会加深调用栈
 * 等待失败时本次调用以该异常结束, 并通知监听器
 * 调用方取消返回的 future 后, 循环在下一次等待或调用前停止
 */
public final class SuspendingExecution<T> {

    private final RetryEngine<T> engine;

    private final Suspender suspender;

    private final Supplier<? extends CompletionStage<T>> operation;

    private final CompletableFuture<T> promise = new CompletableFuture<>();

    private RetryContext<T> ctx;

    private int index;

    public SuspendingExecution(RetryEngine<T> engine, Suspender suspender,
                               Supplier<? extends CompletionStage<T>> operation) {
        this.engine = engine;
        this.suspender = suspender;
        this.operation = operation;
    }

    public CompletableFuture<T> start() {
        try {
            this.ctx = engine.open();
            loop();
        } catch (Throwable t) {
            promise.completeExceptionally(t);
        }
        return promise;
    }

    private void loop() {
        while (!promise.isDone()) {
            RetryEngine.Plan plan = engine.checkLimits(ctx, index);
            if (plan.isGiveUp()) {
                promise.completeExceptionally(plan.getError());
                return;
            }
            Instant start = plan.getStart();
            if (plan.shouldWait()) {
                CompletableFuture<Void> wait;
                try {
                    wait = suspender.suspend(plan.getWait());
                } catch (RuntimeException e) {
                    abort(e);
                    return;
                }
                if (!wait.isDone()) {
                    wait.whenComplete((v, e) -> resume(e));
                    return;
                }
                // 已完成的等待在当前循环内继续, 不注册回调
                Throwable waitError = failureOf(wait);
                if (waitError != null) {
                    abort(waitError);
                    return;
                }
                if (promise.isDone()) {
                    return;
                }
                start = engine.now();
            }
            if (!attempt(start)) {
                return;
            }
        }
    }

    private void resume(Throwable waitError) {
        try {
            if (waitError != null) {
                abort(waitError);
                return;
            }
            if (!promise.isDone() && attempt(engine.now())) {
                loop();
            }
        } catch (Throwable t) {
            promise.completeExceptionally(t);
        }
    }

    private void abort(Throwable waitError) {
        Throwable cause = Invocation.unwrap(waitError);
        engine.abort(ctx, cause);
        promise.completeExceptionally(cause);
    }

    private static Throwable failureOf(CompletableFuture<Void> wait) {
        if (!wait.isCompletedExceptionally()) {
            return null;
        }
        try {
            wait.join();
            return null;
        } catch (Throwable t) {
            return t;
        }
    }

    /**
     * @return true 表示本轮已同步结束且需要继续循环
     */
    private boolean attempt(Instant start) {
        CompletableFuture<T> call = invoke();
        if (!call.isDone()) {
            call.whenComplete((r, e) -> {
                try {
                    if (settle(start, r, e)) {
                        loop();
                    }
                } catch (Throwable t) {
                    promise.completeExceptionally(t);
                }
            });
            return false;
        }
        T result = null;
        Throwable error = null;
        try {
            result = call.join();
        } catch (Throwable t) {
            error = t;
        }
        return settle(start, result, error);
    }

    private boolean settle(Instant start, T result, Throwable failure) {
        Invocation<T> invocation;
        if (failure == null) {
            invocation = Invocation.returned(result);
        } else {
            Throwable cause = Invocation.unwrap(failure);
            if (cause instanceof Error) {
                // 与阻塞式一致, Error 不参与决策
                promise.completeExceptionally(cause);
                return false;
            }
            invocation = Invocation.failed(cause);
        }
        RetryEngine.Step<T> step = engine.complete(ctx, start, invocation);
        index++;
        switch (step.getKind()) {
            case RETURN -> promise.complete(step.getResult());
            case FAIL -> promise.completeExceptionally(step.getError());
            default -> {
                return !promise.isDone();
            }
        }
        return false;
    }

    private CompletableFuture<T> invoke() {
        try {
            CompletionStage<T> stage = operation.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("operation returned null stage"));
            }
            return stage.toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
