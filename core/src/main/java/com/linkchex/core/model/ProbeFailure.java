package com.linkchex.core.model;

import java.util.Objects;

/** 응답을 얻지 못한 원인. message는 사용자 노출용, cause는 마지막 원본 예외(없을 수 있음). */
public final class ProbeFailure {
    private final FailureKind kind;
    private final String message;
    private final Throwable cause;

    public ProbeFailure(FailureKind kind, String message, Throwable cause) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = (message == null || message.isBlank()) ? kind.name() : message;
        this.cause = cause;
    }

    public static ProbeFailure of(FailureKind kind, String message) {
        return new ProbeFailure(kind, message, null);
    }

    public static ProbeFailure cancelled() {
        return new ProbeFailure(FailureKind.CANCELLED, "run cancelled", null);
    }

    public FailureKind getKind() { return kind; }
    public String getMessage() { return message; }
    public Throwable getCause() { return cause; }

    public boolean isRetryable() { return kind.retryable(); }
    public boolean isCancelled() { return kind == FailureKind.CANCELLED; }

    /** 재시도 소진 시 마지막 원인을 감싼다: "failed after N attempts: ..." */
    public ProbeFailure wrapAttempts(int attempts) {
        return new ProbeFailure(kind, "failed after " + attempts + " attempts: " + message, cause);
    }

    /** 같은 종류, 앞에 문맥을 붙인 메시지 (예: "failed to fetch page: ...") */
    public ProbeFailure withPrefix(String prefix) {
        return new ProbeFailure(kind, prefix + ": " + message, cause);
    }

    @Override
    public String toString() { return message; }
}
