package com.retryloop.core.engine;

import com.retryloop.core.spi.Sleeper;
import com.retryloop.exception.TryAgainException;
import com.retryloop.model.ctx.RetryContext;

import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * 阻塞式执行：调用线程在整个调用期间（包括退避等待）都被占用
 */
public final class BlockingExecution<T> {

    private final RetryEngine<T> engine;

    private final Sleeper sleeper;

    public BlockingExecution(RetryEngine<T> engine, Sleeper sleeper) {
        this.engine = engine;
        this.sleeper = sleeper;
    }

    public T run(Callable<T> operation) throws Exception {
        RetryContext<T> ctx = engine.open();
        for (int i = 0; ; i++) {
            RetryEngine.Plan plan = engine.checkLimits(ctx, i);
            if (plan.isGiveUp()) {
                throw asException(plan.getError());
            }
            Instant start = plan.getStart();
            if (plan.shouldWait()) {
                try {
                    sleeper.sleep(plan.getWait());
                } catch (Exception e) {
                    engine.abort(ctx, e);
                    throw e;
                }
                start = engine.now();
            }

            RetryEngine.Step<T> step = engine.complete(ctx, start, invoke(operation));
            if (step.getKind() == RetryEngine.Step.Kind.RETURN) {
                return step.getResult();
            }
            if (step.getKind() == RetryEngine.Step.Kind.FAIL) {
                throw asException(step.getError());
            }
        }
    }

    private Invocation<T> invoke(Callable<T> operation) {
        try {
            return Invocation.returned(operation.call());
        } catch (TryAgainException again) {
            return Invocation.tryAgain();
        } catch (Exception e) {
            return Invocation.failed(e);
        }
    }

    /**
     * 记录的异常都来自 Callable, 因此只可能是 Exception 或 Error
     */
    private static Exception asException(Throwable t) {
        if (t instanceof Error) {
            throw (Error) t;
        }
        return (Exception) t;
    }
}
