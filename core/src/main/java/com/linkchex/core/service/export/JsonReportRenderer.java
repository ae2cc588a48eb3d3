package com.linkchex.core.service.export;

import com.linkchex.core.model.LinkResult;
import com.linkchex.core.model.ReferenceKind;
import com.linkchex.core.model.ValidationReport;
import com.linkchex.core.util.Json;

import java.util.Map;

/**
 * JSON 리포트: summary / linksByType / linksByStatus / results.
 * 의존성 없이 직접 조립한다(들여쓰기 2칸).
 */
public class JsonReportRenderer implements ReportRenderer {

    @Override
    public String render(ValidationReport r) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("{\n");

        // summary
        sb.append("  \"summary\": {\n");
        field(sb, 4, "pagesProcessed", r.getPagesProcessed(), true);
        field(sb, 4, "pagesFailed", r.getPagesFailed(), true);
        field(sb, 4, "totalLinks", r.getTotalLinks(), true);
        field(sb, 4, "uniqueUrls", r.getUniqueUrls(), true);
        field(sb, 4, "successLinks", r.getSuccessLinks(), true);
        field(sb, 4, "brokenLinks", r.getBrokenLinks(), true);
        field(sb, 4, "warningLinks", r.getWarningLinks(), true);
        field(sb, 4, "skippedLinks", r.getSkippedLinks(), true);
        field(sb, 4, "cancelledLinks", r.getCancelledLinks(), true);
        field(sb, 4, "internalLinks", r.getInternalLinks(), true);
        field(sb, 4, "externalLinks", r.getExternalLinks(), true);
        field(sb, 4, "cachedLinks", r.getCacheSize(), true);
        field(sb, 4, "cacheHits", r.getCacheHits(), true);
        field(sb, 4, "checkExternal", r.isCheckExternal(), true);
        field(sb, 4, "startTime", r.getStartedAt().toString(), true);
        field(sb, 4, "endTime", r.getFinishedAt().toString(), true);
        field(sb, 4, "durationMs", r.getDuration().toMillis(), false);
        sb.append("  },\n");

        // linksByType
        sb.append("  \"linksByType\": {");
        int i = 0;
        for (Map.Entry<ReferenceKind, Integer> e : r.getLinksByKind().entrySet()) {
            sb.append(i++ == 0 ? "" : ", ").append(Json.kv(e.getKey().tag(), e.getValue()));
        }
        sb.append("},\n");

        // linksByStatus
        sb.append("  \"linksByStatus\": {");
        i = 0;
        for (Map.Entry<Integer, Integer> e : r.getLinksByStatus().entrySet()) {
            sb.append(i++ == 0 ? "" : ", ").append(Json.kv(String.valueOf(e.getKey()), e.getValue()));
        }
        sb.append("},\n");

        // results
        sb.append("  \"results\": [");
        int n = r.getResults().size();
        for (int k = 0; k < n; k++) {
            LinkResult x = r.getResults().get(k);
            sb.append(k == 0 ? "\n" : ",\n").append("    {");
            sb.append(Json.kv("sourceUrl", x.getSourceUrl())).append(", ");
            sb.append(Json.kv("targetUrl", x.getTargetUrl())).append(", ");
            sb.append(Json.kv("statusCode", x.getStatusCode())).append(", ");
            sb.append(Json.kv("status", x.getStatusText())).append(", ");
            sb.append(Json.kv("classification", x.getClassification().name())).append(", ");
            sb.append(Json.kv("isBroken", x.isBroken())).append(", ");
            sb.append(Json.kv("isExternal", x.isExternal())).append(", ");
            sb.append(Json.kv("tag", x.getKind() == null ? "" : x.getKind().tag())).append(", ");
            sb.append(Json.kv("linkText", x.getText())).append(", ");
            sb.append(Json.kv("error", x.getError() == null ? null : x.getError().getMessage())).append(", ");
            sb.append(Json.kv("durationMs", x.getDuration().toMillis())).append(", ");
            sb.append(Json.kv("cacheHit", x.isCacheHit()));
            sb.append('}');
        }
        sb.append(n == 0 ? "]\n" : "\n  ]\n");
        sb.append("}\n");
        return sb.toString();
    }

    private static void field(StringBuilder sb, int indent, String k, Object v, boolean comma) {
        sb.append(" ".repeat(indent)).append(Json.kv(k, v)).append(comma ? ",\n" : "\n");
    }
}
