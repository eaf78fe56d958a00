package com.retryloop.exception;

import com.retryloop.model.ctx.RetryContext;

/**
 * 达到最大调用次数仍未得到停止决策
 */
public class MaxRetriesException extends RetryException {

    public MaxRetriesException(String message, RetryContext<?> context) {
        super(message, context);
    }
}
