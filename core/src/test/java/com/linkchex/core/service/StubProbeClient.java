package com.linkchex.core.service;

import com.linkchex.core.api.IProbeClient;
import com.linkchex.core.model.FailureKind;
import com.linkchex.core.model.ProbeFailure;
import com.linkchex.core.model.ProbeOutcome;
import com.linkchex.core.util.RunSignal;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** 네트워크 없는 프로브 클라이언트: 페이지 HTML과 링크 상태를 미리 정해 둔다. */
final class StubProbeClient implements IProbeClient {
    final Map<String, String> pages = new ConcurrentHashMap<>();
    final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    final Map<String, AtomicInteger> headCalls = new ConcurrentHashMap<>();
    final AtomicInteger inFlight = new AtomicInteger(0);
    final AtomicInteger maxInFlight = new AtomicInteger(0);
    volatile Function<String, Long> delayMs = u -> 0L;
    /** 동시성 집계 단위(예: 링크가 속한 페이지). 기본은 전부 한 그룹 */
    volatile Function<String, String> groupOf = u -> "";
    final Map<String, AtomicInteger> groupInFlight = new ConcurrentHashMap<>();
    final Map<String, AtomicInteger> groupMax = new ConcurrentHashMap<>();
    volatile boolean closed;

    StubProbeClient page(String url, String html) { pages.put(url, html); return this; }

    StubProbeClient link(String url, int status) { statuses.put(url, status); return this; }

    int headCount(String url) {
        AtomicInteger n = headCalls.get(url);
        return (n == null) ? 0 : n.get();
    }

    @Override
    public ProbeOutcome get(String url, RunSignal signal) {
        String html = pages.get(url);
        if (html == null) {
            Integer st = statuses.get(url);
            if (st != null) {
                return ProbeOutcome.builder().url(url).statusCode(st).duration(Duration.ofMillis(1)).build();
            }
            return ProbeOutcome.failed(url, ProbeFailure.of(FailureKind.DNS, "no such host"), Duration.ofMillis(1), 1);
        }
        return ProbeOutcome.builder()
                .url(url)
                .statusCode(200)
                .statusText("OK")
                .contentType("text/html; charset=utf-8")
                .body(html.getBytes(StandardCharsets.UTF_8))
                .duration(Duration.ofMillis(1))
                .build();
    }

    @Override
    public ProbeOutcome head(String url, RunSignal signal) {
        headCalls.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        String group = groupOf.apply(url);
        int inGroup = groupInFlight.computeIfAbsent(group, k -> new AtomicInteger()).incrementAndGet();
        groupMax.computeIfAbsent(group, k -> new AtomicInteger()).accumulateAndGet(inGroup, Math::max);
        long start = System.nanoTime();
        try {
            long d = delayMs.apply(url);
            if (d > 0) {
                try {
                    if (!signal.sleep(Duration.ofMillis(d))) {
                        return ProbeOutcome.failed(url, ProbeFailure.cancelled(), Duration.ofNanos(System.nanoTime() - start), 1);
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return ProbeOutcome.failed(url, ProbeFailure.cancelled(), Duration.ZERO, 1);
                }
            }
            Integer st = statuses.get(url);
            if (st == null) {
                return ProbeOutcome.failed(url, ProbeFailure.of(FailureKind.CONNECT, "connection refused"),
                        Duration.ofNanos(System.nanoTime() - start), 1);
            }
            return ProbeOutcome.builder()
                    .url(url)
                    .statusCode(st)
                    .duration(Duration.ofNanos(System.nanoTime() - start))
                    .build();
        } finally {
            groupInFlight.get(group).decrementAndGet();
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void close() { closed = true; }

    static String html(String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String h : hrefs) sb.append("<a href=\"").append(h).append("\">").append(h).append("</a>");
        return sb.append("</body></html>").toString();
    }
}
