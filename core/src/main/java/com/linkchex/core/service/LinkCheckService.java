package com.linkchex.core.service;

import com.linkchex.core.api.IProbeClient;
import com.linkchex.core.api.IReferenceExtractor;
import com.linkchex.core.cache.ValidationCache;
import com.linkchex.core.extract.JsoupReferenceExtractor;
import com.linkchex.core.extract.ReferenceFilter;
import com.linkchex.core.http.ProbeClient;
import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.model.Classification;
import com.linkchex.core.model.FailureKind;
import com.linkchex.core.model.LinkResult;
import com.linkchex.core.model.ProbeFailure;
import com.linkchex.core.model.ProbeOutcome;
import com.linkchex.core.model.Reference;
import com.linkchex.core.model.RunStats;
import com.linkchex.core.model.ValidationReport;
import com.linkchex.core.util.ProgressListener;
import com.linkchex.core.util.RateLimiter;
import com.linkchex.core.util.RunSignal;
import com.linkchex.core.util.StructuredLog;
import com.linkchex.core.util.UrlMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 링크 검증 오케스트레이터:
 *  - 페이지 수집(GET) → 참조 추출 → 참조별 검증(HEAD) → 집계
 *  - 페이지 풀: min(pageConcurrency, 페이지 수) 스레드
 *  - 링크 상한: 페이지마다 Semaphore(linkConcurrency). 스레드는 실행 전체가 공유하는 풀에서
 *  - URL당 프로브는 single-flight 캐시로 최대 1회
 *  - RunSignal(취소/기한)이 모든 대기 지점에 전달된다
 *
 * 인스턴스 하나가 실행 한 번을 담당한다(캐시 수명 = 실행 1회).
 */
public final class LinkCheckService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LinkCheckService.class);
    private static final StructuredLog SLOG = StructuredLog.get(LinkCheckService.class);

    /** 실행 상태 */
    public enum State { IDLE, SCHEDULING_PAGES, SCHEDULING_LINKS, AGGREGATING, DONE }

    private final CheckConfig config;
    private final IProbeClient http;
    private final IReferenceExtractor extractor;
    private final UrlMatcher matcher;          // 패턴이 없으면 null
    private final RunStats stats;
    private final ValidationCache cache = new ValidationCache();
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    /** 기본 구현: ProbeClient + JsoupReferenceExtractor, 설정의 rateLimit으로 리미터 생성 */
    public LinkCheckService(CheckConfig config) {
        this(config, new RunStats());
    }

    private LinkCheckService(CheckConfig config, RunStats stats) {
        this(config,
             new ProbeClient(validated(config), new RateLimiter(config.getRateLimit()), stats),
             new JsoupReferenceExtractor(config.isSkipResources()),
             stats);
    }

    /** DI/테스트용 */
    public LinkCheckService(CheckConfig config, IProbeClient http, IReferenceExtractor extractor, RunStats stats) {
        this.config = validated(config);
        this.http = Objects.requireNonNull(http, "http");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.stats = (stats == null) ? new RunStats() : stats;
        this.matcher = buildMatcher(config);   // 잘못된 패턴은 여기서 실패(워커 시작 전)
    }

    /* =========================
       실행 API
       ========================= */

    public ValidationReport run(List<String> pages) {
        return run(pages, ProgressListener.NONE, null);
    }

    public ValidationReport run(List<String> pages, ProgressListener listener) {
        return run(pages, listener, null);
    }

    /**
     * @param signal null이면 설정의 runTimeout으로 새로 만든다
     */
    public ValidationReport run(List<String> pages, ProgressListener listener, RunSignal signal) {
        Objects.requireNonNull(pages, "pages");
        if (!state.compareAndSet(State.IDLE, State.SCHEDULING_PAGES)) {
            throw new IllegalStateException("service already ran (state=" + state.get() + ")");
        }
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final RunSignal sig = (signal != null) ? signal : RunSignal.withTimeout(config.getRunTimeout());
        final Instant startedAt = Instant.now();

        final int total = pages.size();
        final int pageCc = Math.max(1, Math.min(config.getPageConcurrency(), total));
        final int linkCc = config.getLinkConcurrency();
        LOG.info("Run start: pages={}, pageCc={}, linkCc={}, rateLimit={}, checkExternal={}",
                total, pageCc, linkCc, config.getRateLimit(), config.isCheckExternal());
        SLOG.info("run-start",
                "pages", total,
                "pageCc", pageCc,
                "linkCc", linkCc,
                "rateLimit", config.getRateLimit(),
                "checkExternal", config.isCheckExternal(),
                "patterns", matcher == null ? 0 : matcher.size());

        final Progress progress = new Progress(pl, total);
        final List<LinkResult> results = new ArrayList<>();

        if (total > 0) {
            ExecutorService pagePool = fixedPool(pageCc, "page-worker");
            // 페이지 pageCc개 × 페이지당 linkCc개가 동시에 돌 수 있다
            ExecutorService linkPool = elasticPool((int) Math.min(Integer.MAX_VALUE, (long) pageCc * linkCc), "link-worker");
            try {
                CompletionService<List<LinkResult>> done = new ExecutorCompletionService<>(pagePool);
                Map<Future<List<LinkResult>>, String> pageOf = new HashMap<>();
                for (String pageUrl : pages) {
                    pageOf.put(done.submit(() -> processPage(pageUrl, linkPool, sig, progress)), pageUrl);
                }
                // 페이지 블록은 완료 순서대로 붙인다
                for (int i = 0; i < total; i++) {
                    results.addAll(takeBlock(done, pageOf, progress));
                }
            } finally {
                shutdown(linkPool);
                shutdown(pagePool);
            }
        }

        state.set(State.AGGREGATING);
        ValidationReport report = ReportAggregator.aggregate(results, new ReportAggregator.Context(
                startedAt, Instant.now(), cache.size(), total, config.isCheckExternal()));
        state.set(State.DONE);

        RunStats.Snapshot snap = stats.snapshot();
        LOG.info("Run done. results={}, broken={}, cancelled={}, unique={}, cacheSize={}, maxObservedCC={}",
                report.getTotalLinks(), report.getBrokenLinks(), report.getCancelledLinks(),
                report.getUniqueUrls(), report.getCacheSize(), snap.maxObservedConcurrency);
        SLOG.info("run-done",
                "results", report.getTotalLinks(),
                "broken", report.getBrokenLinks(),
                "warning", report.getWarningLinks(),
                "skipped", report.getSkippedLinks(),
                "cancelled", report.getCancelledLinks(),
                "cacheSize", report.getCacheSize(),
                "cacheHits", report.getCacheHits(),
                "attempts", snap.attemptsTotal,
                "retries", snap.retriesTotal,
                "maxObservedCC", snap.maxObservedConcurrency,
                "durationMs", report.getDuration().toMillis());
        return report;
    }

    /* =========================
       페이지 / 링크 단위 작업
       ========================= */

    /** 페이지 하나: 수집 → 추출 → 참조별 검증. 실패는 합성 결과 1건으로 격리된다. */
    private List<LinkResult> processPage(String pageUrl, ExecutorService linkPool, RunSignal sig, Progress progress) {
        if (sig.isCancelled()) {
            return progress.pageDone(List.of(progress.emit(LinkResult.pageFailure(pageUrl, ProbeFailure.cancelled()))));
        }

        LOG.debug("Fetch page: {}", pageUrl);
        stats.onPageFetch();
        ProbeOutcome page = http.get(pageUrl, sig);
        if (page.isCancelled() || (page.hasError() && sig.isCancelled())) {
            return pageFailed(pageUrl, ProbeFailure.cancelled(), progress);
        }
        if (page.hasError()) {
            return pageFailed(pageUrl, page.getError().withPrefix("failed to fetch page"), progress);
        }
        if (page.getStatusCode() != 200) {
            return pageFailed(pageUrl, ProbeFailure.of(FailureKind.PAGE_STATUS,
                    "page returned status " + page.getStatusCode()), progress);
        }

        List<Reference> refs;
        try {
            refs = ReferenceFilter.apply(
                    extractor.extract(page.getBody(), charsetOf(page.getContentType()), page.getFinalUrl()),
                    config.isCheckExternal());
        } catch (RuntimeException e) {
            return pageFailed(pageUrl, new ProbeFailure(FailureKind.PARSE,
                    "failed to extract links: " + e.getMessage(), e), progress);
        }

        state.compareAndSet(State.SCHEDULING_PAGES, State.SCHEDULING_LINKS);
        LOG.debug("Page {} -> {} references", pageUrl, refs.size());

        // 인덱스 위치에 기록 → 완료 순서와 무관하게 추출 순서 유지
        final LinkResult[] slots = new LinkResult[refs.size()];
        final List<Future<?>> futures = new ArrayList<>(refs.size());
        final Semaphore inFlight = new Semaphore(config.getLinkConcurrency());   // 이 페이지의 동시 참조 상한
        for (int i = 0; i < refs.size(); i++) {
            if (!acquire(inFlight, sig)) break;   // 취소: 남은 슬롯은 아래에서 CANCELLED
            final int idx = i;
            final Reference ref = refs.get(i);
            try {
                futures.add(linkPool.submit(() -> {
                    try {
                        slots[idx] = progress.emit(validate(pageUrl, ref, sig));
                    } finally {
                        inFlight.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                inFlight.release();
                LOG.warn("Link pool rejected {}: {}", ref.url(), e.toString());
                break;
            }
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                sig.cancel();
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null) ? e.getCause() : e;
                LOG.warn("Link task failed: {}", cause.toString());
                SLOG.error("link-task-failed", cause, "page", pageUrl, "target", refs.get(i).url());
            }
        }
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                // 작업이 결과를 남기지 못한 경우(인터럽트/예외)
                slots[i] = progress.emit(sig.isCancelled()
                        ? LinkResult.cancelled(pageUrl, refs.get(i))
                        : LinkResult.builder().sourceUrl(pageUrl).reference(refs.get(i))
                            .statusText("Failed")
                            .error(ProbeFailure.of(FailureKind.IO, "validation task failed"))
                            .classification(Classification.BROKEN)
                            .build());
            }
        }

        int n = progress.pagesDone.get() + 1;
        LOG.info("Checked {} (page #{}) -> links={}", pageUrl, n, slots.length);
        SLOG.info("page-checked", "url", pageUrl, "pageNo", n, "links", slots.length);
        return progress.pageDone(Arrays.asList(slots));
    }

    /** 참조 1건: 필터 → 캐시(single-flight) → HEAD */
    LinkResult validate(String sourceUrl, Reference ref, RunSignal sig) {
        if (sig.isCancelled()) return LinkResult.cancelled(sourceUrl, ref);
        if (matcher != null && !matcher.shouldCheck(ref.url())) {
            LOG.debug("Skip (pattern): {}", ref.url());
            return LinkResult.skipped(sourceUrl, ref);
        }
        ValidationCache.Lookup hit = cache.getOrProbe(ref.url(), sig, u -> probe(u, sig));
        return LinkResult.of(sourceUrl, ref, hit.getOutcome(), hit.isCacheHit());
    }

    private ProbeOutcome probe(String url, RunSignal sig) {
        stats.probeStarted();
        long t0 = System.nanoTime();
        try {
            return http.head(url, sig);
        } finally {
            stats.probeFinished(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
        }
    }

    private List<LinkResult> pageFailed(String pageUrl, ProbeFailure error, Progress progress) {
        if (!error.isCancelled()) {
            LOG.warn("Page failed: {} ({})", pageUrl, error.getMessage());
            SLOG.warn("page-failed", "url", pageUrl, "kind", error.getKind().name(), "error", error.getMessage());
        }
        return progress.pageDone(List.of(progress.emit(LinkResult.pageFailure(pageUrl, error))));
    }

    private List<LinkResult> takeBlock(CompletionService<List<LinkResult>> done,
                                       Map<Future<List<LinkResult>>, String> pageOf, Progress progress) {
        Future<List<LinkResult>> f;
        try {
            f = done.take();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while collecting page results", ie);
        }
        try {
            return f.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while collecting page results", ie);
        } catch (ExecutionException e) {
            // processPage는 실패를 결과로 돌려주므로 여기 오는 건 예상 밖 오류. 그래도 페이지당 1건은 남긴다
            Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            String pageUrl = pageOf.get(f);
            SLOG.error("page-task-failed", cause, "url", pageUrl);
            return pageFailed(pageUrl, new ProbeFailure(FailureKind.IO,
                    "failed to check page: " + cause, cause), progress);
        }
    }

    /** 슬롯을 얻을 때까지 대기. 취소되면 false */
    private static boolean acquire(Semaphore permits, RunSignal sig) {
        try {
            while (!sig.isCancelled()) {
                if (permits.tryAcquire(RunSignal.SLICE_MS, TimeUnit.MILLISECONDS)) return true;
            }
            return false;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            sig.cancel();
            return false;
        }
    }

    /* =========================
       공용 유틸 / 게터
       ========================= */

    public State getState() { return state.get(); }

    public RunStats.Snapshot getRuntimeSnapshot() { return stats.snapshot(); }

    public int getCacheSize() { return cache.size(); }

    @Override
    public void close() {
        try {
            http.close();
        } catch (Exception e) {
            LOG.warn("Failed to close http client: {}", e.toString());
        }
    }

    private static CheckConfig validated(CheckConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    private static UrlMatcher buildMatcher(CheckConfig config) {
        if (!config.hasPatterns()) return null;
        List<String> excludes = new ArrayList<>(config.getExcludePatterns());
        if (config.isDefaultExcludes()) excludes.addAll(UrlMatcher.defaultExcludes());
        return UrlMatcher.of(excludes, config.getIncludePatterns());
    }

    /** Content-Type의 charset 파라미터. 없거나 모르면 null(파서가 판단) */
    static Charset charsetOf(String contentType) {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring(8).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    LOG.debug("Unknown charset '{}', falling back to UTF-8", name);
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return null;
    }

    /** 고정 스레드풀(+역압): 큐가 차면 제출자가 기다린다 */
    private static ExecutorService fixedPool(int size, String prefix) {
        return new ThreadPoolExecutor(
                size, size,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(size * 2),
                new NamedThreadFactory(prefix),
                (r, e) -> {
                    if (e.isShutdown()) throw new RejectedExecutionException("pool shut down");
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );
    }

    /** 필요할 때만 스레드를 만들고(최대 max) 놀면 회수. 제출은 호출자가 Semaphore로 조절한다 */
    private static ExecutorService elasticPool(int max, String prefix) {
        return new ThreadPoolExecutor(
                0, Math.max(1, max),
                30L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new NamedThreadFactory(prefix),
                (r, e) -> {
                    // 방금 release한 스레드가 아직 큐로 돌아오지 않은 순간: 빈 워커가 받을 때까지 기다린다
                    if (e.isShutdown()) throw new RejectedExecutionException("pool shut down");
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while handing off", ie);
                    }
                }
        );
    }

    private static void shutdown(ExecutorService exec) {
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate in time");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /** 진행률 관찰자 호출 + 카운터 */
    private static final class Progress {
        final ProgressListener listener;
        final int pagesTotal;
        final AtomicLong linksDone = new AtomicLong(0);
        final AtomicInteger pagesDone = new AtomicInteger(0);

        Progress(ProgressListener listener, int pagesTotal) {
            this.listener = listener;
            this.pagesTotal = pagesTotal;
        }

        LinkResult emit(LinkResult r) {
            long n = linksDone.incrementAndGet();
            try {
                listener.onResult(r, n, pagesDone.get(), pagesTotal);
            } catch (RuntimeException e) {
                LOG.warn("Progress listener failed: {}", e.toString());
            }
            return r;
        }

        List<LinkResult> pageDone(List<LinkResult> block) {
            pagesDone.incrementAndGet();
            return block;
        }
    }
}
