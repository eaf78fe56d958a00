package com.retryloop.core.backoff;

import com.retryloop.config.RetryLoopProperties;
import com.retryloop.core.spi.Backoff;
import com.retryloop.core.spi.BackoffProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 策略注册中心：
 * - 内置 none / fixed / exponential / random
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffProvider（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(BackoffRegistry.class);

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT_STRATEGY = "fixed";

    private final Map<String, BackoffProvider> providers = new ConcurrentHashMap<>(16);

    private final RetryLoopProperties props;

    public BackoffRegistry(RetryLoopProperties props, @Nullable List<BackoffProvider> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        providers.putIfAbsent("none", BackoffProvider.of("none", b -> Backoffs.none()));
        providers.putIfAbsent("fixed", BackoffProvider.of("fixed", b -> new FixedBackoff(b.getInterval())));
        providers.putIfAbsent("exponential", BackoffProvider.of("exponential",
                b -> new ExponentialBackoff(b.getInitial(), b.getMax(), b.getRandomizationFactor(),
                        b.getMultiplier(), random(b))));
        providers.putIfAbsent("random", BackoffProvider.of("random",
                b -> new RandomBackoff(b.getMin(), b.getMax(), random(b))));
    }

    public BackoffRegistry(RetryLoopProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffProvider provider) {
        providers.put(normalize(name), provider);
        return this;
    }

    /**
     * 按名称解析策略
     * 支持 spi:{name} 前缀, 不存在时退回默认 fixed 策略
     */
    public BackoffProvider resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return providers.get(DEFAULT_STRATEGY);
        }
        String s = strategy.trim();
        String key = s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())
                ? normalize(s.substring(PREFIX_SPI.length()))
                : normalize(s);
        BackoffProvider provider = providers.get(key);
        if (provider == null) {
            log.warn("[BackoffRegistry] unknown backoff strategy '{}', fallback to '{}'", strategy, DEFAULT_STRATEGY);
            return providers.get(DEFAULT_STRATEGY);
        }
        return provider;
    }

    /**
     * 每次调用都创建新实例的工厂, 策略状态不跨调用共享
     */
    public Supplier<Backoff> factory(String strategy) {
        BackoffProvider provider = resolve(strategy);
        return () -> provider.create(props.getBackoff());
    }

    /** 按配置的 retry.backoff.strategy 解析 */
    public Supplier<Backoff> defaultFactory() {
        return factory(props.getBackoff().getStrategy());
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(providers.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    private static Random random(RetryLoopProperties.Backoff b) {
        return b.getSeed() == null ? new Random() : new Random(b.getSeed());
    }

    @Override
    public void afterPropertiesSet() {
        // 参数校验
        RetryLoopProperties.Backoff b = props.getBackoff();
        if (b.getInterval().isNegative() || b.getInitial().isNegative() || b.getMin().isNegative()) {
            throw new IllegalArgumentException("retry.backoff durations must be >= 0");
        }
        if (b.getMax().compareTo(b.getMin()) < 0) {
            throw new IllegalArgumentException("retry.backoff.max must be >= retry.backoff.min");
        }
        if (b.getRandomizationFactor() < 0 || b.getRandomizationFactor() > 1) {
            throw new IllegalArgumentException("retry.backoff.randomization-factor must be in [0, 1]");
        }
        if (b.getMultiplier() <= 0) {
            throw new IllegalArgumentException("retry.backoff.multiplier must be > 0");
        }
        if (props.getMaxTries() != null && props.getMaxTries() < 0) {
            throw new IllegalArgumentException("retry.max-tries must be >= 0");
        }
        if (props.getGiveupAfter() != null && props.getGiveupAfter().isNegative()) {
            throw new IllegalArgumentException("retry.giveup-after must be >= 0");
        }
    }
}
