package com.linkchex.core.service.export;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.jsoup.nodes.Document;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/** HTML 문자열 → PDF 파일 (openhtmltopdf, 임시 파일에 쓴 뒤 교체) */
public final class OpenHtmlToPdfSupport {

    private OpenHtmlToPdfSupport() {}

    public static void htmlToPdf(String html, Path pdfPath) {
        if (html == null || pdfPath == null) {
            throw new IllegalArgumentException("html/pdfPath is null");
        }
        Path abs = pdfPath.toAbsolutePath();
        try {
            Files.createDirectories(abs.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create PDF directory: " + abs.getParent(), e);
        }

        String baseUri = abs.getParent().toUri().toString();

        // Jsoup 파싱
        Document jdoc = Jsoup.parse(html, baseUri);
        if (jdoc.head().selectFirst("meta[charset]") == null) {
            jdoc.head().prepend("<meta charset=\"UTF-8\">");
        }
        // 폼/컨트롤 및 스크립트 제거 (fast-mode NPE 회피)
        jdoc.select("form, input, button, select, textarea").remove();
        jdoc.select("script, link[rel=preload]").remove();

        org.w3c.dom.Document w3cDoc = new W3CDom().fromJsoup(jdoc);

        Path tmp = abs.resolveSibling(abs.getFileName().toString() + ".tmp");
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(
                tmp, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))) {

            PdfRendererBuilder builder = new PdfRendererBuilder();
            builder.withW3cDocument(w3cDoc, baseUri);
            builder.toStream(os);
            builder.run();
            os.flush();

        } catch (Exception ex) {
            deleteQuietly(tmp, ex);
            throw new IllegalStateException("openhtmltopdf failed: " + ex.getMessage(), ex);
        }

        if (!isValidPdf(tmp)) {
            IllegalStateException bad = new IllegalStateException("Produced PDF seems invalid (size/signature).");
            deleteQuietly(tmp, bad);
            throw bad;
        }
        try {
            Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new UncheckedIOException("Failed to move temp PDF to final path: " + abs, e);
        }
    }

    /** 정리 실패는 원래 예외에 suppressed로 붙인다 */
    private static void deleteQuietly(Path p, Throwable primary) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    static boolean isValidPdf(Path p) {
        try {
            if (p == null || !Files.exists(p)) return false;
            if (Files.size(p) < 100) return false;
            byte[] sig = new byte[5];
            try (var in = Files.newInputStream(p)) {
                int n = in.read(sig);
                if (n < 5) return false;
            }
            return new String(sig, StandardCharsets.US_ASCII).startsWith("%PDF-");
        } catch (IOException e) {
            return false;
        }
    }
}
