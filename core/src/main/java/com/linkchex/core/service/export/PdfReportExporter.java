package com.linkchex.core.service.export;

import com.linkchex.core.model.ValidationReport;

import java.nio.file.Path;
import java.util.Objects;

/** PDF 리포트: 인쇄용 HTML을 만든 뒤 openhtmltopdf로 변환. 파일 출력만 지원. */
public class PdfReportExporter {

    public Path export(ValidationReport report, Path pdfPath) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(pdfPath, "pdfPath");
        String html = new HtmlReportRenderer().printable().render(report);
        OpenHtmlToPdfSupport.htmlToPdf(html, pdfPath);
        return pdfPath;
    }
}
