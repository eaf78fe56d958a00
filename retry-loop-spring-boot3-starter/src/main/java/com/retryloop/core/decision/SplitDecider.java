package com.retryloop.core.decision;

import com.retryloop.core.spi.ExceptionDecider;
import com.retryloop.core.spi.GlobalDecider;
import com.retryloop.core.spi.ResultDecider;
import com.retryloop.model.ctx.RetryContext;

import java.util.Objects;

/**
 * 将 onResult / onException 组合为统一决策
 * 有异常走 onException, 否则走 onResult
 */
public final class SplitDecider<T> implements GlobalDecider<T> {

    private final ResultDecider<T> onResult;

    private final ExceptionDecider<T> onException;

    public SplitDecider(ResultDecider<T> onResult, ExceptionDecider<T> onException) {
        this.onResult = Objects.requireNonNull(onResult, "onResult");
        this.onException = Objects.requireNonNull(onException, "onException");
    }

    @Override
    public boolean shouldRetry(T result, Throwable exception, RetryContext<T> ctx) throws Exception {
        if (exception != null) {
            return onException.shouldRetry(exception, ctx);
        }
        return onResult.shouldRetry(result, ctx);
    }
}
