package com.retryloop.core.notify;

import com.retryloop.core.spi.RetryListener;
import com.retryloop.model.Attempt;
import com.retryloop.model.ctx.RetryContext;
import com.retryloop.model.enums.RetryEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志监听, 默认启用
 */
public class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    public static final LoggingRetryListener INSTANCE = new LoggingRetryListener();

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void onAttempt(RetryContext<?> ctx, Attempt<?> attempt) {
        if (attempt.isFailed()) {
            log.debug("[Retry-{}] attempt #{} failed: {}", ctx.getName(), ctx.tries(), truncate(String.valueOf(attempt.getException())));
        } else {
            log.debug("[Retry-{}] attempt #{} returned", ctx.getName(), ctx.tries());
        }
    }

    @Override
    public void onResolved(RetryContext<?> ctx, RetryEventType type, Throwable error) {
        switch (type) {
            case DECISION_ERROR -> log.error("[Retry-{}] decision failed after {} tries", ctx.getName(), ctx.tries(), error);
            case ABORTED -> log.warn("[Retry-{}] wait aborted after {} tries, err={}",
                    ctx.getName(), ctx.tries(), truncate(String.valueOf(error)));
            case MAX_TRIES, TIMEOUT -> log.warn("[Retry-{}] gave up, reason={}, tries={}, err={}",
                    ctx.getName(), type, ctx.tries(), truncate(String.valueOf(error)));
            case FAILURE -> log.info("[Retry-{}] stopped on error after {} tries, err={}",
                    ctx.getName(), ctx.tries(), truncate(String.valueOf(error)));
            default -> log.debug("[Retry-{}] succeeded after {} tries", ctx.getName(), ctx.tries());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
