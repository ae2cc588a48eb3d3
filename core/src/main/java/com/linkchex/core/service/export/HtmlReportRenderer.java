package com.linkchex.core.service.export;

import static com.linkchex.core.service.export.HtmlReportTemplates.*;

import com.linkchex.core.model.Classification;
import com.linkchex.core.model.LinkResult;
import com.linkchex.core.model.ReferenceKind;
import com.linkchex.core.model.ValidationReport;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/** 단일 HTML 리포트: 요약 카드 + 비율 바 + 정렬/필터 가능한 결과 테이블 */
public class HtmlReportRenderer implements ReportRenderer {

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private boolean interactive = true;

    /** PDF 변환용: 툴바/스크립트 없이 */
    public HtmlReportRenderer printable() {
        this.interactive = false;
        return this;
    }

    @Override
    public String render(ValidationReport r) {
        StringBuilder sb = new StringBuilder(8192 + r.getResults().size() * 256);
        sb.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n")
          .append("<title>Link Validation Report</title>\n")
          .append(css())
          .append("</head>\n<body>\n");

        sb.append(header("Link Validation Report",
                "Started " + TS.format(r.getStartedAt()) + " · duration "
                        + TextReportRenderer.format(r.getDuration())
                        + (r.isCheckExternal() ? " · external links checked" : " · internal links only")));

        // ---- summary ----
        sb.append("<div class='cards'>\n")
          .append(card("", "Pages", String.valueOf(r.getPagesProcessed())))
          .append(card("", "Links", String.valueOf(r.getTotalLinks())))
          .append(card("", "Unique URLs", String.valueOf(r.getUniqueUrls())))
          .append(card("ok", "Success", String.valueOf(r.getSuccessLinks())))
          .append(card("warn", "Warnings", String.valueOf(r.getWarningLinks())))
          .append(card("bad", "Broken", String.valueOf(r.getBrokenLinks())));
        if (r.getSkippedLinks() > 0) sb.append(card("", "Skipped", String.valueOf(r.getSkippedLinks())));
        if (r.getCancelledLinks() > 0) sb.append(card("", "Cancelled", String.valueOf(r.getCancelledLinks())));
        sb.append(card("", "Internal / External", r.getInternalLinks() + " / " + r.getExternalLinks()))
          .append(card("", "Cached", r.getCacheSize() + " (" + r.getCacheHits() + " hits)"))
          .append("</div>\n");
        sb.append(summaryBar(r.getSuccessLinks(), r.getWarningLinks(), r.getBrokenLinks()));

        if (!r.getLinksByKind().isEmpty()) {
            sb.append("<p class='muted'>By type: ");
            int i = 0;
            for (Map.Entry<ReferenceKind, Integer> e : r.getLinksByKind().entrySet()) {
                sb.append(i++ == 0 ? "" : " · ").append(esc("<" + e.getKey().tag() + ">"))
                  .append(' ').append(e.getValue());
            }
            sb.append("</p>\n");
        }

        // ---- table ----
        if (interactive) {
            sb.append("<div class='toolbar'>")
              .append("<input id='q' type='search' placeholder='Filter by URL, status, text…'>")
              .append("<select id='cls'><option value=''>All</option>");
            for (Classification c : Classification.values()) {
                sb.append("<option value='").append(c.name()).append("'>").append(c.name()).append("</option>");
            }
            sb.append("</select></div>\n");
        }

        sb.append("<table id='results'>\n<thead><tr>")
          .append("<th class='sortable'>Result</th>")
          .append("<th class='sortable' data-num>Status</th>")
          .append("<th class='sortable'>Target URL</th>")
          .append("<th class='sortable'>Source</th>")
          .append("<th class='sortable'>Tag</th>")
          .append("<th class='sortable'>Text / Error</th>")
          .append("<th class='sortable' data-num>ms</th>")
          .append("</tr></thead>\n<tbody>\n");
        for (LinkResult x : r.getResults()) {
            String cls = x.getClassification().name();
            String note = (x.getError() != null) ? x.getError().getMessage() : x.getText();
            sb.append("<tr data-cls='").append(cls).append("'>")
              .append("<td class='c-").append(cls).append("'>").append(cls)
              .append(x.isCacheHit() ? " <span class='muted'>(cached)</span>" : "").append("</td>")
              .append("<td data-v='").append(x.getStatusCode()).append("'>")
              .append(x.getStatusCode() > 0 ? x.getStatusCode() + " " + esc(x.getStatusText()) : esc(x.getStatusText()))
              .append("</td>")
              .append("<td class='url'><a href=\"").append(esc(x.getTargetUrl())).append("\">")
              .append(esc(x.getTargetUrl())).append("</a>").append(x.isExternal() ? " <span class='muted'>↗</span>" : "")
              .append("</td>")
              .append("<td class='url'>").append(esc(x.getSourceUrl())).append("</td>")
              .append("<td>").append(x.getKind() == null ? "" : esc("<" + x.getKind().tag() + ">")).append("</td>")
              .append("<td>").append(esc(note)).append("</td>")
              .append("<td data-v='").append(x.getDuration().toMillis()).append("'>")
              .append(x.getDuration().toMillis()).append("</td>")
              .append("</tr>\n");
        }
        sb.append("</tbody>\n</table>\n");

        sb.append(footer());
        if (interactive) sb.append(script());
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }
}
