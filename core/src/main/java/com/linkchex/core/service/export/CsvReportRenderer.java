package com.linkchex.core.service.export;

import com.linkchex.core.model.LinkResult;
import com.linkchex.core.model.ValidationReport;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;

/** 결과 1건 = 1행. 헤더 고정. */
public class CsvReportRenderer implements ReportRenderer {

    static final String[] HEADER = {
            "Source URL", "Target URL", "Status Code", "Status", "Is Broken",
            "Is External", "Tag", "Link Text", "Error", "Duration (ms)"
    };

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator("\n")
            .build();

    @Override
    public String render(ValidationReport report) {
        StringBuilder sb = new StringBuilder(256 + report.getResults().size() * 128);
        try (CSVPrinter csv = new CSVPrinter(sb, FORMAT)) {
            for (LinkResult x : report.getResults()) {
                csv.printRecord(
                        x.getSourceUrl(),
                        x.getTargetUrl(),
                        x.getStatusCode(),
                        x.getStatusText(),
                        x.isBroken(),
                        x.isExternal(),
                        x.getKind() == null ? "" : x.getKind().tag(),
                        x.getText(),
                        x.getError() == null ? "" : x.getError().getMessage(),
                        x.getDuration().toMillis());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }
}
