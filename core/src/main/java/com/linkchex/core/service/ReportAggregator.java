package com.linkchex.core.service;

import com.linkchex.core.model.LinkResult;
import com.linkchex.core.model.ReferenceKind;
import com.linkchex.core.model.ValidationReport;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** 결과 목록 → 집계 리포트. 한 번 훑는 순수 함수. */
public final class ReportAggregator {
    private ReportAggregator() {}

    /** 결과 목록 밖에서 오는 실행 정보 */
    public record Context(Instant startedAt, Instant finishedAt, int cacheSize,
                          int pagesProcessed, boolean checkExternal) {}

    public static ValidationReport aggregate(List<LinkResult> results, Context ctx) {
        int broken = 0, warning = 0, success = 0, skipped = 0, cancelled = 0;
        int internal = 0, external = 0, cacheHits = 0, pagesFailed = 0;
        Map<ReferenceKind, Integer> byKind = new EnumMap<>(ReferenceKind.class);
        Map<Integer, Integer> byStatus = new TreeMap<>();
        Set<String> unique = new HashSet<>();

        for (LinkResult r : results) {
            unique.add(r.getTargetUrl());
            switch (r.getClassification()) {
                case BROKEN -> broken++;
                case WARNING -> warning++;
                case SUCCESS -> success++;
                case SKIPPED -> skipped++;
                case CANCELLED -> cancelled++;
            }
            if (r.isExternal()) external++; else internal++;
            if (r.getKind() != null) byKind.merge(r.getKind(), 1, Integer::sum);
            if (r.getStatusCode() > 0) byStatus.merge(r.getStatusCode(), 1, Integer::sum);
            if (r.isCacheHit()) cacheHits++;
            if (LinkResult.SITEMAP_SOURCE.equals(r.getSourceUrl()) && r.getKind() == null) pagesFailed++;
        }

        return ValidationReport.builder()
                .results(results)
                .totalLinks(results.size())
                .brokenLinks(broken)
                .warningLinks(warning)
                .successLinks(success)
                .skippedLinks(skipped)
                .cancelledLinks(cancelled)
                .internalLinks(internal)
                .externalLinks(external)
                .uniqueUrls(unique.size())
                .cacheSize(ctx.cacheSize())
                .cacheHits(cacheHits)
                .pagesProcessed(ctx.pagesProcessed())
                .pagesFailed(pagesFailed)
                .checkExternal(ctx.checkExternal())
                .linksByKind(byKind)
                .linksByStatus(byStatus)
                .startedAt(ctx.startedAt())
                .finishedAt(ctx.finishedAt())
                .build();
    }
}
