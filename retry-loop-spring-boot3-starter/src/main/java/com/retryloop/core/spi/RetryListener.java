package com.retryloop.core.spi;

import com.retryloop.model.Attempt;
import com.retryloop.model.ctx.RetryContext;
import com.retryloop.model.enums.RetryEventType;

/**
 * 重试事件监听器, 同步调用
 * 抛出的异常只记录日志与指标, 不影响重试结果
 */
public interface RetryListener {

    /**
     * 返回监听器名称, 用于日志
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * 每记录一次调用后触发
     */
    default void onAttempt(RetryContext<?> ctx, Attempt<?> attempt) {
    }

    /**
     * 一次逻辑调用结束时触发一次
     * @param error 抛给调用方的异常, SUCCESS 时为 null
     */
    default void onResolved(RetryContext<?> ctx, RetryEventType type, Throwable error) {
    }
}
