package com.linkchex.core.http;

import com.linkchex.core.model.ProbeFailure;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터 시작(방금 실패한 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(ProbeFailure failure, int attempt);
    /** attempt 실패 후 다음 시도 전 지연 시간. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). 예: 재시도 1이면 2. */
    int maxAttempts();
}
