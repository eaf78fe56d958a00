package com.retryloop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 重试默认配置（绑定前缀：retry）, 作为 RetryerFactory 创建的 Retryer 的初始值
 *
 * YAML 示例：
 * retry:
 *   max-tries: 5
 *   giveup-after: 30s
 *   wrap-exception: false
 *   reraise: false
 *   backoff:
 *     strategy: exponential
 *     interval: 0ms
 *     initial: 1s
 *     min: 0ms
 *     max: 60s
 *     randomization-factor: 0.5
 *     multiplier: 1.5
 *   timer:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *     max-pending-timeouts: 100000
 *   executor:
 *     core-pool-size: 8
 *     max-pool-size: 32
 *     queue-capacity: 1000
 *     keep-alive: 60s
 *     rejected-handler: CALLER_RUNS
 */
@ConfigurationProperties(prefix = "retry")
public class RetryLoopProperties {

    /** 最大调用次数, 为空表示不限 */
    private Integer maxTries;

    /** 从第一次调用开始的总时间预算, 为空表示不限 */
    private Duration giveupAfter;

    /** 最终异常是否包装为 RetryException */
    private boolean wrapException = false;

    /** 触发上限时是否直接抛出最后一次调用自身的异常 */
    private boolean reraise = false;

    private Backoff backoff = new Backoff();

    private Timer timer = new Timer();

    private Exec executor = new Exec();

    // ----------------- 嵌套配置对象 -----------------

    public static class Backoff {
        /** 策略：none | fixed | exponential | random | spi:{name} */
        private String strategy = "fixed";

        /** 固定间隔 */
        private Duration interval = Duration.ZERO;

        /** 指数退避的初始间隔 */
        private Duration initial = Duration.ofSeconds(1);

        /** 随机策略的最小间隔 */
        private Duration min = Duration.ZERO;

        /** 指数退避的上限 / 随机策略的最大间隔 */
        private Duration max = Duration.ofSeconds(60);

        /** 抖动比例（0~1），例如 0.5 表示 ±50% */
        private double randomizationFactor = 0.5;

        /** 指数增长倍数 */
        private double multiplier = 1.5;

        /** 随机种子, 为空时使用非固定种子 */
        private Long seed;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getInitial() { return initial; }
        public void setInitial(Duration initial) { this.initial = initial; }
        public Duration getMin() { return min; }
        public void setMin(Duration min) { this.min = min; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public double getRandomizationFactor() { return randomizationFactor; }
        public void setRandomizationFactor(double randomizationFactor) { this.randomizationFactor = randomizationFactor; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
    }

    public static class Timer {
        /** 时间轮刻度, 挂起式等待的精度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    /** 等待结束后恢复执行的线程池 */
    public static class Exec {
        private int corePoolSize = 8;

        private int maxPoolSize = 32;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.CALLER_RUNS;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    // ----------------- 公共枚举/工具 -----------------

    /**
     * 恢复线程池的拒绝策略
     * 不提供 DISCARD 类策略：被丢弃的恢复任务永远不会完成对应的等待, 调用方的 future 会一直挂起
     */
    public enum RejectedHandlerPolicy {
        /** 抛出 RejectedExecutionException, 本次调用以该异常结束 */
        ABORT,
        /** 在时间轮线程上直接恢复 */
        CALLER_RUNS;

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Integer getMaxTries() { return maxTries; }
    public void setMaxTries(Integer maxTries) { this.maxTries = maxTries; }

    public Duration getGiveupAfter() { return giveupAfter; }
    public void setGiveupAfter(Duration giveupAfter) { this.giveupAfter = giveupAfter; }

    public boolean isWrapException() { return wrapException; }
    public void setWrapException(boolean wrapException) { this.wrapException = wrapException; }

    public boolean isReraise() { return reraise; }
    public void setReraise(boolean reraise) { this.reraise = reraise; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Timer getTimer() { return timer; }
    public void setTimer(Timer timer) { this.timer = timer; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }
}
