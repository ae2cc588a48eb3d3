package com.linkchex.core.service.export;

import com.linkchex.core.model.Classification;
import com.linkchex.core.model.LinkResult;
import com.linkchex.core.model.ReferenceKind;
import com.linkchex.core.model.ValidationReport;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/** 사람이 읽는 텍스트 리포트: 요약 → 태그별 → 깨진 링크 → 리다이렉트 경고 → 결론 한 줄 */
public class TextReportRenderer implements ReportRenderer {

    @Override
    public String render(ValidationReport r) {
        StringBuilder sb = new StringBuilder(1024);
        int total = r.getTotalLinks();

        sb.append("Link Validation Report\n");
        sb.append("======================\n\n");

        line(sb, "Pages Processed:", String.valueOf(r.getPagesProcessed()));
        line(sb, "Total Links:", String.valueOf(total));
        line(sb, "Unique URLs:", String.valueOf(r.getUniqueUrls()));
        line(sb, "✓ Success:", count(r.getSuccessLinks(), total));
        line(sb, "✗ Broken:", count(r.getBrokenLinks(), total));
        line(sb, "⚠ Warnings:", count(r.getWarningLinks(), total));
        if (r.getSkippedLinks() > 0) line(sb, "Skipped:", count(r.getSkippedLinks(), total));
        if (r.getCancelledLinks() > 0) line(sb, "Cancelled:", count(r.getCancelledLinks(), total));
        line(sb, "Internal Links:", String.valueOf(r.getInternalLinks()));
        line(sb, "External Links:", String.valueOf(r.getExternalLinks()));
        line(sb, "Cached Results:", r.getCacheSize() + " (" + r.getCacheHits() + " reused)");
        line(sb, "Duration:", format(r.getDuration()));
        sb.append('\n');

        if (!r.getLinksByKind().isEmpty()) {
            sb.append("Links by Type:\n");
            for (Map.Entry<ReferenceKind, Integer> e : r.getLinksByKind().entrySet()) {
                sb.append("  <").append(e.getKey().tag()).append(">: ").append(e.getValue()).append('\n');
            }
            sb.append('\n');
        }

        if (r.getBrokenLinks() > 0) {
            sb.append("Broken Links:\n");
            sb.append("-------------\n");
            for (LinkResult x : r.getResults()) {
                if (x.getClassification() != Classification.BROKEN) continue;
                sb.append("\n✗ ").append(x.getTargetUrl()).append('\n');
                sb.append("  Source: ").append(x.getSourceUrl()).append('\n');
                if (x.getKind() != null) sb.append("  Tag:    <").append(x.getKind().tag()).append(">\n");
                if (!x.getText().isEmpty()) sb.append("  Text:   ").append(truncate(x.getText(), 60)).append('\n');
                if (x.getError() != null) {
                    sb.append("  Error:  ").append(x.getError().getMessage()).append('\n');
                } else {
                    sb.append("  Status: ").append(x.getStatusCode()).append(' ').append(x.getStatusText()).append('\n');
                }
            }
            sb.append('\n');
        }

        if (r.getWarningLinks() > 0) {
            sb.append("Warnings (Redirects):\n");
            sb.append("--------------------\n");
            for (LinkResult x : r.getResults()) {
                if (x.getClassification() != Classification.WARNING) continue;
                sb.append("\n⚠ ").append(x.getTargetUrl()).append('\n');
                sb.append("  Source: ").append(x.getSourceUrl()).append('\n');
                sb.append("  Status: ").append(x.getStatusCode()).append(' ').append(x.getStatusText()).append('\n');
            }
            sb.append('\n');
        }

        if (r.getCancelledLinks() > 0) {
            sb.append("⚠ Run was cancelled before ").append(r.getCancelledLinks()).append(" link(s) could be checked.\n");
        }
        if (r.getBrokenLinks() == 0) {
            sb.append("✓ All links are valid!\n");
        } else {
            sb.append("✗ Found ").append(r.getBrokenLinks()).append(" broken link(s) that need attention.\n");
        }
        return sb.toString();
    }

    // ------------ helpers ------------
    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format(Locale.ROOT, "%-19s%s", label, value)).append('\n');
    }

    private static String count(int part, int total) {
        return String.format(Locale.ROOT, "%d (%.1f%%)", part, percentage(part, total));
    }

    static double percentage(int part, int total) {
        return (total == 0) ? 0.0 : (double) part / (double) total * 100.0;
    }

    static String truncate(String s, int max) {
        return (s.length() <= max) ? s : s.substring(0, max - 3) + "...";
    }

    static String format(Duration d) {
        long ms = d.toMillis();
        if (ms < 1000) return ms + "ms";
        return String.format(Locale.ROOT, "%.3fs", ms / 1000.0);
    }
}
