package com.linkchex.core.service.export;

import com.linkchex.core.model.CheckConfig.OutputFormat;
import com.linkchex.core.model.ValidationReport;

/** 집계 리포트 → 문자열 표현 (text/json/csv/html). PDF는 PdfReportExporter가 파일로만 만든다. */
public interface ReportRenderer {

    String render(ValidationReport report);

    static ReportRenderer forFormat(OutputFormat format) {
        return switch (format) {
            case TEXT -> new TextReportRenderer();
            case JSON -> new JsonReportRenderer();
            case CSV -> new CsvReportRenderer();
            case HTML -> new HtmlReportRenderer();
            case PDF -> throw new IllegalArgumentException("pdf is written to a file, not rendered as text");
        };
    }
}
