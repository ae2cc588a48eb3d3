package com.linkchex.core.model;

/** 프로브/페이지 실패 분류. 재시도 대상은 전송 계층 실패뿐. */
public enum FailureKind {
    DNS(true),
    CONNECT(true),
    TLS(true),
    TIMEOUT(true),
    IO(true),
    REDIRECT_LIMIT(false),
    INVALID_URL(false),
    CANCELLED(false),
    PAGE_STATUS(false),
    PARSE(false);

    private final boolean retryable;

    FailureKind(boolean retryable) { this.retryable = retryable; }

    public boolean retryable() { return retryable; }
}
