package com.linkchex.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 실행 1회의 집계 결과 + 전체 결과 목록. ReportAggregator가 한 번 만들고 이후 수정하지 않는다.
 */
public final class ValidationReport {
    private final List<LinkResult> results;
    private final int totalLinks;
    private final int brokenLinks;
    private final int warningLinks;
    private final int successLinks;
    private final int skippedLinks;
    private final int cancelledLinks;
    private final int internalLinks;
    private final int externalLinks;
    private final int uniqueUrls;
    private final int cacheSize;
    private final int cacheHits;
    private final int pagesProcessed;
    private final int pagesFailed;
    private final boolean checkExternal;
    private final Map<ReferenceKind, Integer> linksByKind;
    private final Map<Integer, Integer> linksByStatus;
    private final Instant startedAt;
    private final Instant finishedAt;

    private ValidationReport(Builder b) {
        this.results = List.copyOf(b.results);
        this.totalLinks = b.totalLinks;
        this.brokenLinks = b.brokenLinks;
        this.warningLinks = b.warningLinks;
        this.successLinks = b.successLinks;
        this.skippedLinks = b.skippedLinks;
        this.cancelledLinks = b.cancelledLinks;
        this.internalLinks = b.internalLinks;
        this.externalLinks = b.externalLinks;
        this.uniqueUrls = b.uniqueUrls;
        this.cacheSize = b.cacheSize;
        this.cacheHits = b.cacheHits;
        this.pagesProcessed = b.pagesProcessed;
        this.pagesFailed = b.pagesFailed;
        this.checkExternal = b.checkExternal;
        this.linksByKind = Collections.unmodifiableMap(new EnumMap<>(b.linksByKind));
        this.linksByStatus = Collections.unmodifiableMap(new TreeMap<>(b.linksByStatus));
        this.startedAt = (b.startedAt == null) ? Instant.now() : b.startedAt;
        this.finishedAt = (b.finishedAt == null) ? this.startedAt : b.finishedAt;
    }

    public List<LinkResult> getResults() { return results; }
    public int getTotalLinks() { return totalLinks; }
    public int getBrokenLinks() { return brokenLinks; }
    public int getWarningLinks() { return warningLinks; }
    public int getSuccessLinks() { return successLinks; }
    public int getSkippedLinks() { return skippedLinks; }
    public int getCancelledLinks() { return cancelledLinks; }
    public int getInternalLinks() { return internalLinks; }
    public int getExternalLinks() { return externalLinks; }
    public int getUniqueUrls() { return uniqueUrls; }
    /** 실행 종료 시점 캐시 엔트리 수(정보용 "캐시 히트" 대용치) */
    public int getCacheSize() { return cacheSize; }
    /** 실제로 캐시를 재사용한 결과 수 */
    public int getCacheHits() { return cacheHits; }
    public int getPagesProcessed() { return pagesProcessed; }
    public int getPagesFailed() { return pagesFailed; }
    public boolean isCheckExternal() { return checkExternal; }
    public Map<ReferenceKind, Integer> getLinksByKind() { return linksByKind; }
    public Map<Integer, Integer> getLinksByStatus() { return linksByStatus; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public Duration getDuration() { return Duration.between(startedAt, finishedAt); }

    public boolean hasBrokenLinks() { return brokenLinks > 0; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private List<LinkResult> results = List.of();
        private int totalLinks, brokenLinks, warningLinks, successLinks, skippedLinks, cancelledLinks;
        private int internalLinks, externalLinks, uniqueUrls, cacheSize, cacheHits;
        private int pagesProcessed, pagesFailed;
        private boolean checkExternal;
        private Map<ReferenceKind, Integer> linksByKind = new EnumMap<>(ReferenceKind.class);
        private Map<Integer, Integer> linksByStatus = new TreeMap<>();
        private Instant startedAt, finishedAt;

        public Builder results(List<LinkResult> v) { this.results = v; return this; }
        public Builder totalLinks(int v) { this.totalLinks = v; return this; }
        public Builder brokenLinks(int v) { this.brokenLinks = v; return this; }
        public Builder warningLinks(int v) { this.warningLinks = v; return this; }
        public Builder successLinks(int v) { this.successLinks = v; return this; }
        public Builder skippedLinks(int v) { this.skippedLinks = v; return this; }
        public Builder cancelledLinks(int v) { this.cancelledLinks = v; return this; }
        public Builder internalLinks(int v) { this.internalLinks = v; return this; }
        public Builder externalLinks(int v) { this.externalLinks = v; return this; }
        public Builder uniqueUrls(int v) { this.uniqueUrls = v; return this; }
        public Builder cacheSize(int v) { this.cacheSize = v; return this; }
        public Builder cacheHits(int v) { this.cacheHits = v; return this; }
        public Builder pagesProcessed(int v) { this.pagesProcessed = v; return this; }
        public Builder pagesFailed(int v) { this.pagesFailed = v; return this; }
        public Builder checkExternal(boolean v) { this.checkExternal = v; return this; }
        public Builder linksByKind(Map<ReferenceKind, Integer> v) { this.linksByKind = v; return this; }
        public Builder linksByStatus(Map<Integer, Integer> v) { this.linksByStatus = v; return this; }
        public Builder startedAt(Instant v) { this.startedAt = v; return this; }
        public Builder finishedAt(Instant v) { this.finishedAt = v; return this; }

        public ValidationReport build() { return new ValidationReport(this); }
    }
}
