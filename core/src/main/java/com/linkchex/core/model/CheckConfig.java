package com.linkchex.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 링크 검증 설정 (linkchex.yml / CLI 플래그 매핑 대상). 순수 설정 보관용.
 * 기본값은 원래 도구의 기본값과 동일하다.
 */
public final class CheckConfig {

    /** 리포트 출력 형식 */
    public enum OutputFormat {
        TEXT, JSON, CSV, HTML, PDF;

        public static OutputFormat parse(String s) {
            if (s == null || s.isBlank()) return TEXT;
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unsupported format: " + s);
            }
        }
    }

    public static final String DEFAULT_USER_AGENT = "Linkchex/0.1.1 (Link Validator)";
    /** 한 번의 시도 안에서 따라가는 리다이렉트 상한 */
    public static final int MAX_REDIRECTS = 10;

    // ---------- 입력 ----------
    private String url;                  // 사이트맵 탐색용 베이스 URL
    private String sitemap;              // 사이트맵 URL 또는 로컬 경로

    // ---------- 프로브 ----------
    private Duration timeout = Duration.ofSeconds(10);
    private int maxRetries = 1;
    private Duration retryDelay = Duration.ofSeconds(1);
    private String userAgent = DEFAULT_USER_AGENT;

    // ---------- 동시성/속도 ----------
    private int linkConcurrency = 200;
    private int pageConcurrency = 10;
    private double rateLimit = 0.0;      // 초당 요청 수, 0 = 무제한
    private Duration runTimeout;         // null = 전체 기한 없음

    // ---------- 필터 ----------
    private boolean checkExternal = false;
    private boolean skipResources = false;
    private boolean defaultExcludes = false;
    private List<String> excludePatterns = List.of();
    private List<String> includePatterns = List.of();

    // ---------- 출력 ----------
    private OutputFormat outputFormat = OutputFormat.TEXT;
    private Path output;                 // null = stdout
    private boolean listOnly = false;
    private boolean verbose = false;
    private boolean progress = false;

    // ---------- getters ----------
    public String getUrl() { return url; }
    public String getSitemap() { return sitemap; }
    public Duration getTimeout() { return timeout; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryDelay() { return retryDelay; }
    public String getUserAgent() { return userAgent; }
    public int getLinkConcurrency() { return linkConcurrency; }
    public int getPageConcurrency() { return pageConcurrency; }
    public double getRateLimit() { return rateLimit; }
    public Duration getRunTimeout() { return runTimeout; }
    public boolean isCheckExternal() { return checkExternal; }
    public boolean isSkipResources() { return skipResources; }
    public boolean isDefaultExcludes() { return defaultExcludes; }
    public List<String> getExcludePatterns() { return excludePatterns; }
    public List<String> getIncludePatterns() { return includePatterns; }
    public OutputFormat getOutputFormat() { return outputFormat; }
    public Path getOutput() { return output; }
    public boolean isListOnly() { return listOnly; }
    public boolean isVerbose() { return verbose; }
    public boolean isProgress() { return progress; }

    // ---------- fluent setters ----------
    public CheckConfig setUrl(String url) { this.url = blankToNull(url); return this; }
    public CheckConfig setSitemap(String sitemap) { this.sitemap = blankToNull(sitemap); return this; }
    public CheckConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CheckConfig setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
    public CheckConfig setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; return this; }
    public CheckConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CheckConfig setLinkConcurrency(int v) { this.linkConcurrency = v; return this; }
    public CheckConfig setPageConcurrency(int v) { this.pageConcurrency = v; return this; }
    public CheckConfig setRateLimit(double rateLimit) { this.rateLimit = rateLimit; return this; }
    public CheckConfig setRunTimeout(Duration runTimeout) { this.runTimeout = runTimeout; return this; }
    public CheckConfig setCheckExternal(boolean v) { this.checkExternal = v; return this; }
    public CheckConfig setSkipResources(boolean v) { this.skipResources = v; return this; }
    public CheckConfig setDefaultExcludes(boolean v) { this.defaultExcludes = v; return this; }
    public CheckConfig setExcludePatterns(List<String> v) { this.excludePatterns = (v == null) ? List.of() : List.copyOf(v); return this; }
    public CheckConfig setIncludePatterns(List<String> v) { this.includePatterns = (v == null) ? List.of() : List.copyOf(v); return this; }
    public CheckConfig setOutputFormat(OutputFormat v) { this.outputFormat = (v == null) ? OutputFormat.TEXT : v; return this; }
    public CheckConfig setOutput(Path output) { this.output = output; return this; }
    public CheckConfig setListOnly(boolean v) { this.listOnly = v; return this; }
    public CheckConfig setVerbose(boolean v) { this.verbose = v; return this; }
    public CheckConfig setProgress(boolean v) { this.progress = v; return this; }

    public CheckConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }

    /** 패턴 필터가 하나라도 있으면 true */
    public boolean hasPatterns() {
        return defaultExcludes || !excludePatterns.isEmpty() || !includePatterns.isEmpty();
    }

    // ---------- validate ----------
    /** 검증 엔진 관점의 필수값 확인. 워커 시작 전에 호출된다. */
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (retryDelay == null || retryDelay.isNegative())
            throw new IllegalArgumentException("retryDelay must be >= 0");
        if (linkConcurrency < 1) throw new IllegalArgumentException("linkConcurrency must be >= 1");
        if (pageConcurrency < 1) throw new IllegalArgumentException("pageConcurrency must be >= 1");
        if (rateLimit < 0 || Double.isNaN(rateLimit) || Double.isInfinite(rateLimit))
            throw new IllegalArgumentException("rateLimit must be >= 0");
        if (runTimeout != null && (runTimeout.isNegative() || runTimeout.isZero()))
            throw new IllegalArgumentException("runTimeout must be > 0");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        Objects.requireNonNull(outputFormat, "outputFormat");
        if (outputFormat == OutputFormat.PDF && output == null)
            throw new IllegalArgumentException("pdf format requires an output file");
    }

    /** 입력 소스(--url / --sitemap)까지 포함한 검증. CLI 경로에서 사용. */
    public void validateSource() {
        if (url == null && sitemap == null)
            throw new IllegalArgumentException("either url or sitemap must be provided");
        if (url != null && sitemap != null)
            throw new IllegalArgumentException("cannot specify both url and sitemap");
    }

    // ---------- helpers ----------
    public static CheckConfig defaults() { return new CheckConfig(); }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    @Override
    public String toString() {
        return "CheckConfig{url=" + url + ", sitemap=" + sitemap
                + ", timeout=" + timeout + ", maxRetries=" + maxRetries
                + ", linkConcurrency=" + linkConcurrency + ", pageConcurrency=" + pageConcurrency
                + ", rateLimit=" + rateLimit + ", checkExternal=" + checkExternal
                + ", skipResources=" + skipResources + ", format=" + outputFormat + "}";
    }
}
