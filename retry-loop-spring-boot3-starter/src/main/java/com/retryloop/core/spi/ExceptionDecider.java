package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

/**
 * 抛出异常时的决策（可按异常类型决定是否可重试）
 */
@FunctionalInterface
public interface ExceptionDecider<T> {

    /**
     * @return true=重试；false=停止并抛出（或包装）该异常
     */
    boolean shouldRetry(Throwable exception, RetryContext<T> ctx) throws Exception;
}
