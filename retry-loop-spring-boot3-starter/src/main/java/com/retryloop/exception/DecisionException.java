package com.retryloop.exception;

import com.retryloop.model.ctx.RetryContext;

/**
 * 决策回调自身抛出异常, 属于致命错误
 * 不是 {@link RetryException}, 不会被重试
 */
public class DecisionException extends RuntimeException {

    private final transient Object result;

    private final Throwable exception;

    private final transient RetryContext<?> context;

    public DecisionException(Object result, Throwable exception, RetryContext<?> context, Throwable cause) {
        super("Decision raised: " + cause, cause);
        this.result = result;
        this.exception = exception;
        this.context = context;
    }

    /** 最后一次调用的返回值 */
    public Object getResult() { return result; }

    /** 最后一次调用抛出的异常 */
    public Throwable getException() { return exception; }

    public RetryContext<?> getContext() { return context; }
}
