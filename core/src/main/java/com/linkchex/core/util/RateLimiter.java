package com.linkchex.core.util;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 용량 1짜리 토큰 버킷.
 * - 생성 시 토큰 1개가 미리 채워진다(시작 버스트는 정확히 1).
 * - 백그라운드 데몬 스레드가 1/R 간격으로 토큰을 채운다. 버킷이 차 있으면 버린다.
 * - R = 0 이면 무제한: acquire()는 즉시 반환, stop()은 no-op.
 */
public final class RateLimiter implements AutoCloseable {

    private static final Object TOKEN = new Object();

    private final BlockingQueue<Object> tokens;          // 무제한이면 null
    private final ScheduledExecutorService refiller;     // 무제한이면 null
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public RateLimiter(double requestsPerSecond) {
        if (requestsPerSecond <= 0) {
            this.tokens = null;
            this.refiller = null;
            return;
        }
        long intervalNanos = Math.max(1L, Math.round(1_000_000_000d / requestsPerSecond));

        this.tokens = new ArrayBlockingQueue<>(1);
        this.tokens.offer(TOKEN); // 초기 토큰

        this.refiller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rate-limiter");
            t.setDaemon(true);
            return t;
        });
        this.refiller.scheduleAtFixedRate(() -> tokens.offer(TOKEN),
                intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
    }

    public static RateLimiter unlimited() { return new RateLimiter(0); }

    public boolean isUnlimited() { return tokens == null; }

    /** 토큰을 얻을 때까지 블록 */
    public void acquire() throws InterruptedException {
        if (tokens == null) return;
        ensureRunning();
        tokens.take();
    }

    /**
     * 토큰을 얻거나 신호가 취소될 때까지 블록.
     * @return 토큰을 얻었으면 true, 취소로 빠져나왔으면 false
     */
    public boolean acquire(RunSignal signal) throws InterruptedException {
        if (signal == null) { acquire(); return true; }
        if (signal.isCancelled()) return false;
        if (tokens == null) return true;
        ensureRunning();
        while (true) {
            if (tokens.poll(RunSignal.SLICE_MS, TimeUnit.MILLISECONDS) != null) return true;
            if (signal.isCancelled()) return false;
        }
    }

    /** 리필 스레드 종료. 여러 스레드가 동시에 불러도 한 번만 수행된다. */
    public void stop() {
        if (refiller == null) return;
        if (stopped.compareAndSet(false, true)) {
            refiller.shutdownNow();
        }
    }

    public boolean isStopped() { return stopped.get(); }

    @Override
    public void close() { stop(); }

    private void ensureRunning() {
        if (stopped.get()) throw new IllegalStateException("rate limiter stopped");
    }
}
