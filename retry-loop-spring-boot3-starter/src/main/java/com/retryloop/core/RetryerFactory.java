package com.retryloop.core;

import com.retryloop.config.RetryLoopProperties;
import com.retryloop.core.backoff.BackoffRegistry;
import com.retryloop.core.metric.RetryMetrics;
import com.retryloop.core.spi.RetryListener;
import com.retryloop.core.spi.Suspender;

import java.util.List;

/**
 * 以 retry.* 配置为初始值创建 Retryer
 * 返回的 Builder 仍可逐项覆盖
 */
public class RetryerFactory {

    private final RetryLoopProperties props;

    private final BackoffRegistry backoffRegistry;

    private final Suspender suspender;

    private final RetryMetrics metrics;

    private final List<RetryListener> listeners;

    public RetryerFactory(RetryLoopProperties props,
                          BackoffRegistry backoffRegistry,
                          Suspender suspender,
                          RetryMetrics metrics,
                          List<RetryListener> listeners) {
        this.props = props;
        this.backoffRegistry = backoffRegistry;
        this.suspender = suspender;
        this.metrics = metrics;
        this.listeners = List.copyOf(listeners);
    }

    public <T> Retryer.Builder<T> builder(String name) {
        return Retryer.<T>builder()
                .name(name)
                .maxTries(props.getMaxTries())
                .giveupAfter(props.getGiveupAfter())
                .wrapException(props.isWrapException())
                .reraise(props.isReraise())
                .backoff(backoffRegistry.defaultFactory())
                .suspender(suspender)
                .metrics(metrics)
                .listeners(listeners);
    }

    /**
     * 使用指定的退避策略名称（fixed / exponential / random / spi:{name}）
     */
    public <T> Retryer.Builder<T> builder(String name, String backoffStrategy) {
        return this.<T>builder(name).backoff(backoffRegistry.factory(backoffStrategy));
    }

    public <T> Retryer<T> create(String name) {
        return this.<T>builder(name).build();
    }
}
