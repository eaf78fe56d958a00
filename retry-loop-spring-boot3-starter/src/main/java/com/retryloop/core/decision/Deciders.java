package com.retryloop.core.decision;

import com.retryloop.core.spi.ExceptionDecider;
import com.retryloop.core.spi.GlobalDecider;
import com.retryloop.core.spi.ResultDecider;

import java.util.Arrays;
import java.util.List;

/**
 * 常用决策
 */
public final class Deciders {

    private Deciders() {
    }

    /** 任何返回值都停止 */
    public static <T> ResultDecider<T> stopOnResult() {
        return (result, ctx) -> false;
    }

    /** 任何异常都重试 */
    public static <T> ExceptionDecider<T> retryOnException() {
        return (exception, ctx) -> true;
    }

    /** 默认决策：返回即停止, 异常即重试 */
    public static <T> GlobalDecider<T> defaults() {
        return new SplitDecider<>(stopOnResult(), retryOnException());
    }

    /**
     * 仅当异常属于给定类型之一时重试
     */
    @SafeVarargs
    public static <T> ExceptionDecider<T> retryOn(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> retryable = Arrays.asList(types);
        return (exception, ctx) -> retryable.stream().anyMatch(t -> t.isInstance(exception));
    }
}
