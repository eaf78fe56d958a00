package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

/**
 * 统一决策, 引擎只认这一种形式
 * result 与 exception 只有一个有意义, 取决于本轮是正常返回还是抛出异常
 */
@FunctionalInterface
public interface GlobalDecider<T> {

    /**
     * 抛出任何异常都视为致命错误, 引擎立即终止
     * @return true=重试；false=停止
     */
    boolean shouldRetry(T result, Throwable exception, RetryContext<T> ctx) throws Exception;
}
