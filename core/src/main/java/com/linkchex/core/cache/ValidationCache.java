package com.linkchex.core.cache;

import com.linkchex.core.model.ProbeFailure;
import com.linkchex.core.model.ProbeOutcome;
import com.linkchex.core.util.RunSignal;
import com.linkchex.core.util.UrlUtils;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 실행 1회 동안 유지되는 single-flight 검증 캐시.
 * - 키: 정규화된 URL (UrlUtils.normalize)
 * - 처음 놓친 호출자만 프로브하고, 같은 URL의 나머지 호출자는 그 future를 기다린다
 * - 축출 없음. 엔트리 수는 단조 증가
 */
public final class ValidationCache {

    /** 조회 결과: 재사용이면 cacheHit=true */
    public static final class Lookup {
        private final ProbeOutcome outcome;
        private final boolean cacheHit;

        Lookup(ProbeOutcome outcome, boolean cacheHit) {
            this.outcome = outcome;
            this.cacheHit = cacheHit;
        }

        public ProbeOutcome getOutcome() { return outcome; }
        public boolean isCacheHit() { return cacheHit; }
    }

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, CompletableFuture<ProbeOutcome>> entries = new HashMap<>();

    /**
     * url의 결과를 돌려준다. 없으면 이 호출자가 probe를 실행한다(락 밖에서).
     * 다른 워커가 이미 프로브 중이면 그 결과를 기다린다. 대기 중 신호가 취소되면 취소 결과.
     */
    public Lookup getOrProbe(String url, RunSignal signal, Function<String, ProbeOutcome> probe) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(probe, "probe");
        String key = UrlUtils.normalize(url);

        CompletableFuture<ProbeOutcome> existing;
        lock.readLock().lock();
        try {
            existing = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (existing != null) return new Lookup(await(url, existing, signal), true);

        CompletableFuture<ProbeOutcome> mine = new CompletableFuture<>();
        lock.writeLock().lock();
        try {
            existing = entries.putIfAbsent(key, mine);
        } finally {
            lock.writeLock().unlock();
        }
        if (existing != null) return new Lookup(await(url, existing, signal), true);

        // 프로브는 락 밖에서
        try {
            ProbeOutcome outcome = probe.apply(url);
            mine.complete(outcome);
            return new Lookup(outcome, false);
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static ProbeOutcome await(String url, CompletableFuture<ProbeOutcome> f, RunSignal signal) {
        RunSignal sig = (signal == null) ? RunSignal.create() : signal;
        try {
            while (true) {
                if (f.isDone()) return f.get();
                if (sig.isCancelled()) {
                    return ProbeOutcome.failed(url, ProbeFailure.cancelled(), Duration.ZERO, 0);
                }
                try {
                    return f.get(RunSignal.SLICE_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException slice) {
                    continue;
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ProbeOutcome.failed(url, ProbeFailure.cancelled(), Duration.ZERO, 0);
        } catch (ExecutionException e) {
            Throwable c = e.getCause();
            if (c instanceof RuntimeException re) throw re;
            throw new IllegalStateException("probe failed for " + url, c);
        }
    }
}
