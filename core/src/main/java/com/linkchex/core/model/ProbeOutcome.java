package com.linkchex.core.model;

import java.time.Duration;
import java.util.Objects;

/** 단일 프로브(재시도 포함) 결과. 반환 후 불변. 본문은 GET일 때만 채워진다. */
public final class ProbeOutcome {
    private static final byte[] EMPTY = new byte[0];

    private final String url;
    private final int statusCode;          // 0 = 응답 없음
    private final String statusText;
    private final String finalUrl;         // 리다이렉트 추적 후
    private final ProbeFailure error;      // null이면 응답 수신
    private final Duration duration;       // 모든 시도 합산 경과 시간
    private final int attempts;
    private final byte[] body;
    private final String contentType;

    private ProbeOutcome(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.statusText = (b.statusText == null) ? "" : b.statusText;
        this.finalUrl = (b.finalUrl == null) ? b.url : b.finalUrl;
        this.error = b.error;
        this.duration = (b.duration == null) ? Duration.ZERO : b.duration;
        this.attempts = Math.max(0, b.attempts);
        this.body = (b.body == null) ? EMPTY : b.body;
        this.contentType = b.contentType;
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getStatusText() { return statusText; }
    public String getFinalUrl() { return finalUrl; }
    public ProbeFailure getError() { return error; }
    public Duration getDuration() { return duration; }
    public int getAttempts() { return attempts; }
    public String getContentType() { return contentType; }

    /** 방어적 복사 없이 내부 배열을 넘긴다. 호출자는 수정하지 말 것. */
    public byte[] getBody() { return body; }

    public boolean hasError() { return error != null; }

    public boolean isCancelled() { return error != null && error.isCancelled(); }

    public static ProbeOutcome failed(String url, ProbeFailure error, Duration elapsed, int attempts) {
        return builder()
                .url(url)
                .statusCode(0)
                .statusText("Failed")
                .error(error)
                .duration(elapsed)
                .attempts(attempts)
                .build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int statusCode;
        private String statusText;
        private String finalUrl;
        private ProbeFailure error;
        private Duration duration;
        private int attempts = 1;
        private byte[] body;
        private String contentType;

        public Builder url(String url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder statusText(String statusText) { this.statusText = statusText; return this; }
        public Builder finalUrl(String finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder error(ProbeFailure error) { this.error = error; return this; }
        public Builder duration(Duration duration) { this.duration = duration; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }

        public ProbeOutcome build() {
            Objects.requireNonNull(url, "url");
            return new ProbeOutcome(this);
        }
    }
}
