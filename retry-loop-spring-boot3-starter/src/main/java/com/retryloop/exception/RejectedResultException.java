package com.retryloop.exception;

/**
 * reraise 模式下, 最后一次调用没有异常时抛出, 携带其返回值
 */
public class RejectedResultException extends IllegalStateException {

    private final transient Object result;

    public RejectedResultException(Object result) {
        super(String.valueOf(result));
        this.result = result;
    }

    public Object getResult() {
        return result;
    }
}
