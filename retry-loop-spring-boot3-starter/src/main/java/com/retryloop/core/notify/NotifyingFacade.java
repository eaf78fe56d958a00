package com.retryloop.core.notify;

import com.retryloop.core.metric.RetryMetrics;
import com.retryloop.core.spi.RetryListener;
import com.retryloop.model.Attempt;
import com.retryloop.model.ctx.RetryContext;
import com.retryloop.model.enums.RetryEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 同步派发到所有监听器, 单个监听器失败不影响其他监听器和重试结果
 */
public class NotifyingFacade {

    private final Logger log = LoggerFactory.getLogger(NotifyingFacade.class);

    private final List<RetryListener> listeners;

    private final RetryMetrics metrics;

    public NotifyingFacade(List<RetryListener> listeners, RetryMetrics metrics) {
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
    }

    public void attempt(RetryContext<?> ctx, Attempt<?> attempt) {
        for (RetryListener l : listeners) {
            try {
                l.onAttempt(ctx, attempt);
            } catch (Exception e) {
                metrics.incListenerFailed();
                log.error("[Notify] listener={} attempt event failed", l.name(), e);
            }
        }
    }

    public void resolved(RetryContext<?> ctx, RetryEventType type, Throwable error) {
        for (RetryListener l : listeners) {
            try {
                l.onResolved(ctx, type, error);
            } catch (Exception e) {
                metrics.incListenerFailed();
                log.error("[Notify] listener={} event={} failed", l.name(), type, e);
            }
        }
    }
}
