package com.retryloop.autoconfig;

import com.retryloop.config.RetryLoopProperties;
import com.retryloop.core.RetryerFactory;
import com.retryloop.core.backoff.BackoffRegistry;
import com.retryloop.core.engine.WheelTimerSuspender;
import com.retryloop.core.metric.RetryMetrics;
import com.retryloop.core.notify.LoggingRetryListener;
import com.retryloop.core.spi.BackoffProvider;
import com.retryloop.core.spi.RetryListener;
import com.retryloop.core.spi.Suspender;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮、恢复线程池、退避策略注册中心及 RetryerFactory
 */
@AutoConfiguration(after = RetryLoopMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RetryLoopProperties.class)
public class RetryLoopAutoConfiguration {

    /**
     * 时间轮, 挂起式等待使用
     */
    @Bean(name = "retryWheelTimer", destroyMethod = "stop")
    @ConditionalOnMissingBean(name = "retryWheelTimer")
    public HashedWheelTimer retryWheelTimer(RetryLoopProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("retry-loop-timer"),
                props.getTimer().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getTimer().getTicksPerWheel(),
                false,
                props.getTimer().getMaxPendingTimeouts()
        );
    }

    /**
     * 等待结束后恢复执行的线程池
     */
    @Bean(name = "retryResumeExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "retryResumeExecutor")
    public ExecutorService retryResumeExecutor(RetryLoopProperties props) {
        RetryLoopProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("retry-loop-resume"),
                exec.getRejectedHandler().toHandler()
        );
    }

    @Bean
    @ConditionalOnMissingBean(Suspender.class)
    public Suspender retrySuspender(@Qualifier("retryWheelTimer") HashedWheelTimer timer,
                                    @Qualifier("retryResumeExecutor") ExecutorService executor) {
        return new WheelTimerSuspender(timer, executor);
    }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(RetryLoopProperties props,
                                           @Autowired(required = false) List<BackoffProvider> discoveredProviders) {
        return new BackoffRegistry(props, discoveredProviders);
    }

    /**
     * 默认日志监听
     */
    @Bean
    @ConditionalOnMissingBean
    public LoggingRetryListener loggingRetryListener() {
        return new LoggingRetryListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryerFactory retryerFactory(RetryLoopProperties props,
                                         BackoffRegistry backoffRegistry,
                                         Suspender suspender,
                                         RetryMetrics metrics,
                                         ObjectProvider<RetryListener> listeners) {
        return new RetryerFactory(props, backoffRegistry, suspender, metrics, listeners.orderedStream().toList());
    }
}
