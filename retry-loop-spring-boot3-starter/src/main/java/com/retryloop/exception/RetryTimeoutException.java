package com.retryloop.exception;

import com.retryloop.model.ctx.RetryContext;

/**
 * 下一次等待将越过截止时间
 */
public class RetryTimeoutException extends RetryException {

    public RetryTimeoutException(String message, RetryContext<?> context) {
        super(message, context);
    }
}
