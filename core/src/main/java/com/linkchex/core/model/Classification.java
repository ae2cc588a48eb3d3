package com.linkchex.core.model;

/** 결과 분류 버킷. 캐시 재사용이든 신규 프로브든 같은 규칙으로 판정한다. */
public enum Classification {
    SUCCESS, WARNING, BROKEN, SKIPPED, CANCELLED;

    /**
     * 취소 → CANCELLED, 오류 → BROKEN, 4xx/5xx → BROKEN, 3xx → WARNING, 그 외 SUCCESS.
     */
    public static Classification of(int statusCode, ProbeFailure error) {
        if (error != null) {
            return error.isCancelled() ? CANCELLED : BROKEN;
        }
        if (statusCode >= 400) return BROKEN;
        if (statusCode >= 300) return WARNING;
        return SUCCESS;
    }

    public static Classification of(ProbeOutcome outcome) {
        return of(outcome.getStatusCode(), outcome.getError());
    }
}
