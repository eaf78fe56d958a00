package com.retryloop.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 重试指标使用的注册表
 * 容器中发现的注册表合并为一个 composite（嵌套 composite 会被展开、重复的只加一次）,
 * 一个都没有时使用 SimpleMeterRegistry, 指标仍可在进程内读取
 */
public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public RetryMeterRegistryProvider(List<? extends MeterRegistry> discovered) {
        Set<MeterRegistry> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        if (discovered != null) {
            discovered.forEach(r -> flatten(r, seen));
        }
        if (seen.isEmpty()) {
            seen.add(new SimpleMeterRegistry());
        }
        seen.forEach(composite::add);
    }

    private static void flatten(MeterRegistry registry, Set<MeterRegistry> into) {
        if (registry instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) registry).getRegistries().forEach(r -> flatten(r, into));
        } else {
            into.add(registry);
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
