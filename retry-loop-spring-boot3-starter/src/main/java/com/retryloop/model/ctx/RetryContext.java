package com.retryloop.model.ctx;

import com.retryloop.core.spi.Backoff;
import com.retryloop.model.Attempt;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 单次逻辑调用的上下文
 * - attempts 只追加, 不删除不重排, tries() == size()
 * - backoff 可在决策回调中替换, 从下一次等待开始生效
 * - 每次调用独占, 不跨调用共享
 */
public class RetryContext<T> implements Iterable<Attempt<T>> {

    private final String name;

    private final List<Attempt<T>> attempts = new ArrayList<>();

    private final Instant deadline;

    private Backoff backoff;

    public RetryContext(String name, Backoff backoff, Instant deadline) {
        this.name = name;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.deadline = deadline;
    }

    /**
     * 追加一次调用记录, 由引擎在每轮结束时调用
     */
    public Attempt<T> addAttempt(T result, Throwable exception, Instant time) {
        Attempt<T> attempt = new Attempt<>(result, exception, time);
        attempts.add(attempt);
        return attempt;
    }

    public String getName() { return name; }

    /** 截止时间, 未配置 giveupAfter 时为 null */
    public Instant getDeadline() { return deadline; }

    public Backoff getBackoff() { return backoff; }

    public void setBackoff(Backoff backoff) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    public int tries() {
        return attempts.size();
    }

    public int size() {
        return attempts.size();
    }

    public boolean isEmpty() {
        return attempts.isEmpty();
    }

    /** index 从 0 开始, 0 为第一次调用 */
    public Attempt<T> get(int index) {
        return attempts.get(index);
    }

    public Attempt<T> first() {
        if (attempts.isEmpty()) {
            throw new NoSuchElementException("no attempt recorded");
        }
        return attempts.get(0);
    }

    /** 最近一次调用 */
    public Attempt<T> last() {
        if (attempts.isEmpty()) {
            throw new NoSuchElementException("no attempt recorded");
        }
        return attempts.get(attempts.size() - 1);
    }

    public List<Attempt<T>> attempts() {
        return Collections.unmodifiableList(attempts);
    }

    public Stream<Attempt<T>> stream() {
        return attempts.stream();
    }

    @Override
    public Iterator<Attempt<T>> iterator() {
        return attempts().iterator();
    }

    @Override
    public String toString() {
        return "RetryContext{name=" + name + ", tries=" + attempts.size()
                + ", deadline=" + deadline + ", backoff=" + backoff.getClass().getSimpleName() + "}";
    }
}
