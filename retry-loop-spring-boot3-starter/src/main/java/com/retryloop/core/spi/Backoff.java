package com.retryloop.core.spi;

import java.time.Duration;

/**
 * 回退策略（计算下一次等待时长）
 * 有状态, 每次逻辑调用使用独立实例
 */
public interface Backoff {

    /**
     * 下一次等待时长, 第一次调用前不会被调用
     */
    Duration next();
}
