package com.retryloop.core.engine;

import com.retryloop.exception.TryAgainException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 一次调用的三种结局：正常返回 / try-again / 异常
 */
final class Invocation<T> {

    private final T result;

    private final Throwable exception;

    private final boolean tryAgain;

    private Invocation(T result, Throwable exception, boolean tryAgain) {
        this.result = result;
        this.exception = exception;
        this.tryAgain = tryAgain;
    }

    static <T> Invocation<T> returned(T result) {
        return new Invocation<>(result, null, false);
    }

    static <T> Invocation<T> tryAgain() {
        return new Invocation<>(null, null, true);
    }

    static <T> Invocation<T> failed(Throwable exception) {
        return exception instanceof TryAgainException ? tryAgain() : new Invocation<>(null, exception, false);
    }

    /** 剥掉异步框架的包装异常 */
    static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }

    T getResult() { return result; }

    Throwable getException() { return exception; }

    boolean isTryAgain() { return tryAgain; }
}
