package com.retryloop.core.spi;

/**
 * 允许抛出受检异常的单参数操作
 */
@FunctionalInterface
public interface CheckedFunction<A, R> {

    R apply(A arg) throws Exception;
}
