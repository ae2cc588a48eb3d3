package com.linkchex.core.service;

import com.linkchex.core.extract.JsoupReferenceExtractor;
import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.model.RunStats;
import com.linkchex.core.model.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrencyCapTest {

    @Test
    void link_ceiling_applies_per_page() {
        final int CC = 4;        // 페이지당 링크 동시성 상한
        final int PAGES = 5;     // 페이지가 동시에 돌면 전체 동시성은 CC × PAGES까지

        // 1) 스텁: 페이지마다 고유 링크 8개, 각 프로브 100ms
        StubProbeClient http = new StubProbeClient();
        List<String> pages = new ArrayList<>();
        for (int p = 0; p < PAGES; p++) {
            String[] links = new String[8];
            for (int i = 0; i < links.length; i++) {
                links[i] = "https://x/p" + p + "/l" + i;
                http.link(links[i], 200);
            }
            String page = "https://x/page" + p;
            http.page(page, StubProbeClient.html(links));
            pages.add(page);
        }
        http.delayMs = u -> 100L;
        http.groupOf = u -> u.substring(0, u.lastIndexOf('/'));   // https://x/pN

        // 2) 설정
        CheckConfig cfg = CheckConfig.defaults()
                .setLinkConcurrency(CC)
                .setPageConcurrency(PAGES);

        // 3) 실행
        LinkCheckService svc = new LinkCheckService(cfg, http, new JsoupReferenceExtractor(false), new RunStats());
        ValidationReport report = svc.run(pages);

        // 4) 검증
        assertEquals(PAGES, http.groupMax.size());
        http.groupMax.forEach((page, max) ->
                assertTrue(max.get() <= CC, page + " observed=" + max.get() + " > CC=" + CC));
        var rt = svc.getRuntimeSnapshot();
        assertTrue(rt.maxObservedConcurrency <= CC * PAGES, "observed=" + rt.maxObservedConcurrency);
        assertTrue(http.maxInFlight.get() > CC, "pages did not overlap: " + http.maxInFlight.get());
        assertEquals(PAGES * 8, report.getTotalLinks());
        assertEquals(PAGES * 8L, rt.probesTotal);
    }

    @Test
    void page_concurrency_multiplies_link_throughput() {
        StubProbeClient http = new StubProbeClient()
                .page("https://x/a", StubProbeClient.html("https://x/slow-a"))
                .page("https://x/b", StubProbeClient.html("https://x/slow-b"))
                .link("https://x/slow-a", 200)
                .link("https://x/slow-b", 200);
        http.delayMs = u -> 500L;

        CheckConfig cfg = CheckConfig.defaults()
                .setLinkConcurrency(1)
                .setPageConcurrency(2);

        long t0 = System.nanoTime();
        ValidationReport report = new LinkCheckService(cfg, http, new JsoupReferenceExtractor(false), new RunStats())
                .run(List.of("https://x/a", "https://x/b"));
        long ms = (System.nanoTime() - t0) / 1_000_000L;

        assertEquals(2, report.getSuccessLinks());
        assertEquals(2, http.maxInFlight.get());
        assertTrue(ms < 950, "pages ran one after another: " + ms + "ms");
    }
}
