package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

/**
 * 正常返回时的决策
 */
@FunctionalInterface
public interface ResultDecider<T> {

    /**
     * @return true=重试；false=停止并返回 result
     */
    boolean shouldRetry(T result, RetryContext<T> ctx) throws Exception;
}
