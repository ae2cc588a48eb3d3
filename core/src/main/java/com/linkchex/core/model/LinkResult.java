package com.linkchex.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * (페이지, 참조) 쌍 하나의 검증 결과.
 * 페이지 자체를 가져오지 못한 경우에는 source="sitemap"인 합성 결과가 된다.
 */
public final class LinkResult {

    /** 페이지 실패 합성 결과의 source 표기 */
    public static final String SITEMAP_SOURCE = "sitemap";

    private final String sourceUrl;
    private final String targetUrl;
    private final int statusCode;
    private final String statusText;
    private final ProbeFailure error;
    private final boolean external;
    private final ReferenceKind kind;      // 페이지 실패 합성 결과는 null
    private final String text;
    private final Duration duration;
    private final Classification classification;
    private final boolean cacheHit;

    private LinkResult(Builder b) {
        this.sourceUrl = Objects.requireNonNull(b.sourceUrl, "sourceUrl");
        this.targetUrl = Objects.requireNonNull(b.targetUrl, "targetUrl");
        this.statusCode = b.statusCode;
        this.statusText = (b.statusText == null) ? "" : b.statusText;
        this.error = b.error;
        this.external = b.external;
        this.kind = b.kind;
        this.text = (b.text == null) ? "" : b.text;
        this.duration = (b.duration == null) ? Duration.ZERO : b.duration;
        this.classification = Objects.requireNonNull(b.classification, "classification");
        this.cacheHit = b.cacheHit;
    }

    public String getSourceUrl() { return sourceUrl; }
    public String getTargetUrl() { return targetUrl; }
    public int getStatusCode() { return statusCode; }
    public String getStatusText() { return statusText; }
    public ProbeFailure getError() { return error; }
    public boolean isExternal() { return external; }
    public ReferenceKind getKind() { return kind; }
    public String getText() { return text; }
    public Duration getDuration() { return duration; }
    public Classification getClassification() { return classification; }
    public boolean isCacheHit() { return cacheHit; }

    public boolean isBroken() { return classification == Classification.BROKEN; }

    /** 참조 + 프로브 결과 조합 */
    public static LinkResult of(String sourceUrl, Reference ref, ProbeOutcome outcome, boolean cacheHit) {
        return builder()
                .sourceUrl(sourceUrl)
                .reference(ref)
                .statusCode(outcome.getStatusCode())
                .statusText(outcome.getStatusText())
                .error(outcome.getError())
                .duration(outcome.getDuration())
                .classification(Classification.of(outcome))
                .cacheHit(cacheHit)
                .build();
    }

    public static LinkResult skipped(String sourceUrl, Reference ref) {
        return builder()
                .sourceUrl(sourceUrl)
                .reference(ref)
                .statusText("Skipped (excluded by pattern)")
                .classification(Classification.SKIPPED)
                .build();
    }

    public static LinkResult cancelled(String sourceUrl, Reference ref) {
        return builder()
                .sourceUrl(sourceUrl)
                .reference(ref)
                .statusText("Cancelled")
                .error(ProbeFailure.cancelled())
                .classification(Classification.CANCELLED)
                .build();
    }

    /** 페이지 단위 실패: 형제 페이지는 계속 진행 */
    public static LinkResult pageFailure(String pageUrl, ProbeFailure error) {
        return builder()
                .sourceUrl(SITEMAP_SOURCE)
                .targetUrl(pageUrl)
                .statusText(error.isCancelled() ? "Cancelled" : "Failed")
                .error(error)
                .classification(error.isCancelled() ? Classification.CANCELLED : Classification.BROKEN)
                .build();
    }

    @Override
    public String toString() {
        return classification + " " + targetUrl + " (" + statusCode + ", from " + sourceUrl + ")";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String sourceUrl;
        private String targetUrl;
        private int statusCode;
        private String statusText;
        private ProbeFailure error;
        private boolean external;
        private ReferenceKind kind;
        private String text;
        private Duration duration;
        private Classification classification;
        private boolean cacheHit;

        public Builder sourceUrl(String v) { this.sourceUrl = v; return this; }
        public Builder targetUrl(String v) { this.targetUrl = v; return this; }
        public Builder statusCode(int v) { this.statusCode = v; return this; }
        public Builder statusText(String v) { this.statusText = v; return this; }
        public Builder error(ProbeFailure v) { this.error = v; return this; }
        public Builder external(boolean v) { this.external = v; return this; }
        public Builder kind(ReferenceKind v) { this.kind = v; return this; }
        public Builder text(String v) { this.text = v; return this; }
        public Builder duration(Duration v) { this.duration = v; return this; }
        public Builder classification(Classification v) { this.classification = v; return this; }
        public Builder cacheHit(boolean v) { this.cacheHit = v; return this; }

        /** url/kind/text/external을 한 번에 */
        public Builder reference(Reference ref) {
            this.targetUrl = ref.url();
            this.kind = ref.kind();
            this.text = ref.text();
            this.external = ref.external();
            return this;
        }

        public LinkResult build() { return new LinkResult(this); }
    }
}
