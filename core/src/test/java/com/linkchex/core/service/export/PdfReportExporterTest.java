package com.linkchex.core.service.export;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PdfReportExporterTest {

    @TempDir Path tmp;

    @Test
    void export_writes_valid_pdf_without_leftovers() throws Exception {
        Path pdf = tmp.resolve("reports/links.pdf");

        Path out = new PdfReportExporter().export(ReportFixtures.sample(), pdf);

        assertEquals(pdf, out);
        assertTrue(OpenHtmlToPdfSupport.isValidPdf(pdf), "PDF signature/size check failed");
        assertFalse(hasAnyTmpFile(tmp), ".tmp must be moved into place");
    }

    @Test
    void when_final_move_fails_tmp_is_removed() throws Exception {
        // 비어있지 않은 디렉터리를 출력 경로로 → 최종 이동 실패
        Path outDir = Files.createDirectory(tmp.resolve("out-as-dir"));
        Files.writeString(outDir.resolve("keep.txt"), "x");

        assertThrows(UncheckedIOException.class,
                () -> OpenHtmlToPdfSupport.htmlToPdf("<html><body><h1>Fail PDF</h1></body></html>", outDir));
        assertFalse(hasAnyTmpFile(tmp), "PDF 실패 후 .tmp 임시파일이 남지 않아야 합니다.");
    }

    @Test
    void invalid_arguments() {
        assertThrows(IllegalArgumentException.class, () -> OpenHtmlToPdfSupport.htmlToPdf(null, tmp.resolve("a.pdf")));
        assertFalse(OpenHtmlToPdfSupport.isValidPdf(tmp.resolve("missing.pdf")));
    }

    private static boolean hasAnyTmpFile(Path root) throws IOException {
        try (Stream<Path> s = Files.walk(root)) {
            return s.anyMatch(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".tmp"));
        }
    }
}
