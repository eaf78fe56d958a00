package com.retryloop.core.spi;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 挂起式等待, 不占用线程, 到期后完成返回的 future
 */
@FunctionalInterface
public interface Suspender {

    CompletableFuture<Void> suspend(Duration duration);
}
