package com.retryloop.exception;

import com.retryloop.model.ctx.RetryContext;

/**
 * 重试异常基类
 * 携带完整上下文, 调用方可直接查看每一次调用记录
 */
public class RetryException extends RuntimeException {

    private final transient RetryContext<?> context;

    public RetryException(String message, RetryContext<?> context) {
        super(message);
        this.context = context;
    }

    public RetryException(String message, RetryContext<?> context, Throwable cause) {
        super(message, cause);
        this.context = context;
    }

    public RetryContext<?> getContext() {
        return context;
    }
}
