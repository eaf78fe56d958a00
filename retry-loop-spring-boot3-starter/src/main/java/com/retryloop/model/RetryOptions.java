package com.retryloop.model;

import com.retryloop.core.spi.Backoff;
import com.retryloop.core.spi.GlobalDecider;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 一个 Retryer 的已校验配置, 构建后不可变
 */
@Getter
@Builder
@ToString
public class RetryOptions<T> {

    /** 用于日志 */
    private final String name;

    /** onResult/onException 已合并为统一决策 */
    private final GlobalDecider<T> decider;

    /** 最大调用次数, null 表示不限 */
    private final Integer maxTries;

    /** 每次调用创建新的退避策略 */
    private final Supplier<? extends Backoff> backoff;

    /** 总时间预算, null 表示不限 */
    private final Duration giveupAfter;

    private final boolean wrapException;

    private final boolean reraise;
}
