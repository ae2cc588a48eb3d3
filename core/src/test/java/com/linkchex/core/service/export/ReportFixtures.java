package com.linkchex.core.service.export;

import com.linkchex.core.model.Classification;
import com.linkchex.core.model.FailureKind;
import com.linkchex.core.model.LinkResult;
import com.linkchex.core.model.ProbeFailure;
import com.linkchex.core.model.ReferenceKind;
import com.linkchex.core.model.ValidationReport;
import com.linkchex.core.service.ReportAggregator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** 렌더러 테스트 공용 리포트 */
public final class ReportFixtures {
    private ReportFixtures() {}

    public static ValidationReport sample() {
        List<LinkResult> results = List.of(
                LinkResult.builder().sourceUrl("https://ex.com/").targetUrl("https://ex.com/about")
                        .kind(ReferenceKind.ANCHOR).text("About, \"us\"").statusCode(200).statusText("OK")
                        .duration(Duration.ofMillis(12)).classification(Classification.SUCCESS).build(),
                LinkResult.builder().sourceUrl("https://ex.com/").targetUrl("https://ex.com/old")
                        .kind(ReferenceKind.ANCHOR).text("Old").statusCode(301).statusText("Moved Permanently")
                        .duration(Duration.ofMillis(8)).classification(Classification.WARNING).build(),
                LinkResult.builder().sourceUrl("https://ex.com/").targetUrl("https://ex.com/missing.png")
                        .kind(ReferenceKind.IMAGE).statusCode(404).statusText("Not Found")
                        .duration(Duration.ofMillis(5)).classification(Classification.BROKEN).build(),
                LinkResult.builder().sourceUrl("https://ex.com/blog").targetUrl("https://other.org/<x>")
                        .kind(ReferenceKind.ANCHOR).text("Other").external(true)
                        .error(ProbeFailure.of(FailureKind.TIMEOUT, "failed after 2 attempts: request timed out"))
                        .statusText("Failed").duration(Duration.ofMillis(2000))
                        .classification(Classification.BROKEN).build(),
                LinkResult.builder().sourceUrl("https://ex.com/about").targetUrl("https://ex.com/about")
                        .kind(ReferenceKind.ANCHOR).text("Self").statusCode(200).statusText("OK")
                        .duration(Duration.ofMillis(12)).classification(Classification.SUCCESS).cacheHit(true).build(),
                LinkResult.pageFailure("https://ex.com/gone",
                        ProbeFailure.of(FailureKind.PAGE_STATUS, "page returned status 410")));
        Instant start = Instant.parse("2026-01-02T03:04:05Z");
        return ReportAggregator.aggregate(results,
                new ReportAggregator.Context(start, start.plusMillis(2500), 4, 4, true));
    }

    public static ValidationReport empty() {
        Instant start = Instant.parse("2026-01-02T03:04:05Z");
        return ReportAggregator.aggregate(List.of(),
                new ReportAggregator.Context(start, start.plusMillis(40), 0, 0, false));
    }
}
