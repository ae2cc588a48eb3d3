package com.linkchex.core.service.export;

import com.linkchex.core.model.CheckConfig.OutputFormat;
import com.linkchex.core.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/** 형식별 렌더링 후 파일(output) 또는 stdout으로 내보낸다. */
public final class ReportWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final PrintStream stdout;

    public ReportWriter(PrintStream stdout) {
        this.stdout = Objects.requireNonNull(stdout, "stdout");
    }

    /** @return 파일로 썼으면 그 경로, stdout이면 null */
    public Path write(ValidationReport report, OutputFormat format, Path output) throws IOException {
        Objects.requireNonNull(report, "report");
        OutputFormat fmt = (format == null) ? OutputFormat.TEXT : format;

        if (fmt == OutputFormat.PDF) {
            if (output == null) throw new IllegalArgumentException("pdf format requires an output file");
            new PdfReportExporter().export(report, output);
            LOG.info("Report written to {}", output.toAbsolutePath());
            return output;
        }

        String content = ReportRenderer.forFormat(fmt).render(report);
        if (output == null) {
            stdout.println(content);
            stdout.flush();
            return null;
        }
        Path abs = output.toAbsolutePath();
        if (abs.getParent() != null) Files.createDirectories(abs.getParent());
        Files.writeString(abs, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        LOG.info("Report written to {}", abs);
        return output;
    }
}
