package com.linkchex.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class RunStats {
    private final AtomicLong attemptsTotal = new AtomicLong(0);    // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);    // 재시도 횟수 총합
    private final AtomicLong probesTotal   = new AtomicLong(0);    // HEAD 프로브(캐시 미스) 수
    private final AtomicLong pageFetches   = new AtomicLong(0);
    private final AtomicLong sumProbeMs    = new AtomicLong(0);
    private final AtomicInteger inFlight   = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void onAttempt() { attemptsTotal.incrementAndGet(); }
    public void onRetry() { retriesTotal.incrementAndGet(); }
    public void onPageFetch() { pageFetches.incrementAndGet(); }

    /** 링크 프로브 시작: 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void probeStarted() {
        probesTotal.incrementAndGet();
        int now = inFlight.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(now, Math::max);
    }

    public void probeFinished(long wallMs) {
        inFlight.decrementAndGet();
        sumProbeMs.addAndGet(wallMs);
    }

    public Snapshot snapshot() {
        long probes = probesTotal.get();
        long avg = sumProbeMs.get() / Math.max(1, probes);
        return new Snapshot(attemptsTotal.get(), retriesTotal.get(), probes,
                pageFetches.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long attemptsTotal;
        public final long retriesTotal;
        public final long probesTotal;
        public final long pageFetches;
        public final int  maxObservedConcurrency;
        public final long avgProbeMs;
        public Snapshot(long attempts, long retries, long probes, long pages, int maxCC, long avg) {
            this.attemptsTotal = attempts;
            this.retriesTotal = retries;
            this.probesTotal = probes;
            this.pageFetches = pages;
            this.maxObservedConcurrency = maxCC;
            this.avgProbeMs = avg;
        }

        @Override
        public String toString() {
            return "attempts=" + attemptsTotal + ", retries=" + retriesTotal + ", probes=" + probesTotal
                    + ", pages=" + pageFetches + ", maxCC=" + maxObservedConcurrency + ", avgProbeMs=" + avgProbeMs;
        }
    }
}
