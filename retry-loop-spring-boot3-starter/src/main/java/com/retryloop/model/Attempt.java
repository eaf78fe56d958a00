package com.retryloop.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * 单次调用的结果记录, 创建后不可变
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class Attempt<T> {

    /** 正常返回值, 抛异常或 try-again 时为 null */
    private final T result;

    /** 调用抛出的异常 */
    private final Throwable exception;

    /** 本次调用开始时间 */
    private final Instant time;

    public boolean isFailed() {
        return exception != null;
    }
}
