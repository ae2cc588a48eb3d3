package com.linkchex.core.http;

import com.linkchex.core.model.ProbeFailure;

import java.time.Duration;

/** 전송 계층 실패에서만 재시도. 지연은 attempt × base (1s → 2s → 3s ...) */
public final class LinearRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final Duration base;

    public LinearRetryPolicy(int maxRetries, Duration base) {
        this.maxAttempts = Math.max(0, maxRetries) + 1;
        this.base = (base == null || base.isNegative()) ? Duration.ZERO : base;
    }

    @Override public boolean shouldRetry(ProbeFailure failure, int attempt) {
        if (failure == null || attempt >= maxAttempts) return false;
        return failure.isRetryable();
    }

    @Override public Duration nextDelay(int attempt) {
        return base.multipliedBy(Math.max(1, attempt));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
