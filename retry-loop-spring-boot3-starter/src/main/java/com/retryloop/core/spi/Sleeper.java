package com.retryloop.core.spi;

import java.time.Duration;

/**
 * 阻塞式等待, 占用调用线程
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
