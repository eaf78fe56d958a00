package com.retryloop.core.spi;

import com.retryloop.config.RetryLoopProperties;

import java.util.function.Function;

/**
 * 回退策略工厂, 注册到 BackoffRegistry 后可通过 "spi:{name}" 引用
 */
public interface BackoffProvider {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 为一次调用创建新的策略实例
     * @param props 全局退避配置
     */
    Backoff create(RetryLoopProperties.Backoff props);

    static BackoffProvider of(String name, Function<RetryLoopProperties.Backoff, Backoff> factory) {
        return new BackoffProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Backoff create(RetryLoopProperties.Backoff props) {
                return factory.apply(props);
            }
        };
    }
}
