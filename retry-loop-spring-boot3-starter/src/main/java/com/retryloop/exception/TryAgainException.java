package com.retryloop.exception;

/**
 * 由被包装的操作抛出, 表示无条件重试, 不经过决策判断
 * 仍受 maxTries / giveupAfter 限制, 永远不会抛给调用方
 */
public class TryAgainException extends RuntimeException {

    public TryAgainException() {
        super(null, null, false, false);
    }

    public TryAgainException(String message) {
        super(message, null, false, false);
    }
}
