package com.retryloop.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.time.Duration;

public final class RetryMetrics {
    private final Counter calls;
    private final Counter attempts;
    private final Counter success;
    private final Counter failed;
    private final Counter tryAgain;
    private final Counter maxTries;
    private final Counter timeout;
    private final Counter decisionErr;
    private final Counter listenerFailed;
    private final Counter aborted;
    private final DistributionSummary callAttempts;
    private final Timer waitTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.calls    = Counter.builder("retry.calls").description("logical calls started").register(reg);
        this.attempts = Counter.builder("retry.attempts").description("operation invocations").register(reg);
        this.success  = Counter.builder("retry.success").description("calls resolved with a result").register(reg);
        this.failed   = Counter.builder("retry.failed").description("calls resolved with the operation error").register(reg);
        this.tryAgain = Counter.builder("retry.try_again").description("try-again signals").register(reg);
        this.maxTries = Counter.builder("retry.max_tries").description("calls stopped by max tries").register(reg);
        this.timeout  = Counter.builder("retry.timeout").description("calls stopped by deadline").register(reg);
        this.decisionErr = Counter.builder("retry.decision.error").description("decision callbacks raised").register(reg);
        this.listenerFailed = Counter.builder("retry.listener.failed").description("listener failures").register(reg);
        this.aborted = Counter.builder("retry.aborted").description("calls stopped by a failed wait").register(reg);
        this.callAttempts = DistributionSummary.builder("retry.call.attempts")
                .description("attempt count per call").baseUnit("times").register(reg);
        this.waitTimer = Timer.builder("retry.wait.time").description("backoff wait between attempts").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    /** 不挂任何注册表的 composite, 所有记录都是空操作 */
    public static RetryMetrics noop() { return new RetryMetrics(new CompositeMeterRegistry()); }

    public void incCalls(){    calls.increment(); }
    public void incAttempts(){ attempts.increment(); }
    public void incSuccess(){  success.increment(); }
    public void incFailed(){   failed.increment(); }
    public void incTryAgain(){ tryAgain.increment(); }
    public void incMaxTries(){ maxTries.increment(); }
    public void incTimeout(){  timeout.increment(); }
    public void incDecisionErr(){ decisionErr.increment(); }
    public void incListenerFailed(){ listenerFailed.increment(); }
    public void incAborted(){  aborted.increment(); }
    public void recordCallAttempts(int n){ callAttempts.record(n); }
    public void recordWait(Duration wait){ waitTimer.record(wait); }
}
