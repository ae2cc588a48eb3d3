package com.linkchex.cli;

import com.linkchex.core.util.RunSignal;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @TempDir Path tmp;

    private HttpServer server;
    private String base;
    private final Map<String, String> pages = new ConcurrentHashMap<>();
    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private void handle(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        String body = pages.get(path);
        int status = (body != null) ? 200 : path.equals("/ok") ? 200 : 404;
        if ("HEAD".equals(ex.getRequestMethod()) || body == null) {
            ex.sendResponseHeaders(status, -1);
            ex.close();
            return;
        }
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(200, b.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8),
                RunSignal.create());
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    private Path sitemap(String... paths) throws IOException {
        StringBuilder sb = new StringBuilder("<?xml version=\"1.0\"?><urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">");
        for (String p : paths) sb.append("<url><loc>").append(base).append(p).append("</loc></url>");
        Path f = tmp.resolve("sitemap.xml");
        Files.writeString(f, sb.append("</urlset>").toString(), StandardCharsets.UTF_8);
        return f;
    }

    @Test
    void version_and_help_exit_zero() {
        assertThat(run("--version")).isEqualTo(0);
        assertThat(out()).contains("linkchex version " + Main.VERSION);

        assertThat(run("--help")).isEqualTo(0);
        assertThat(out()).contains("Usage: linkchex");
    }

    @Test
    void usage_errors_exit_two() {
        assertThat(run()).isEqualTo(2);
        assertThat(err()).contains("Error: either url or sitemap must be provided").contains("Usage:");

        assertThat(run("--nope")).isEqualTo(2);
        assertThat(run("--url", "https://ex.com", "--sitemap", "s.xml")).isEqualTo(2);
        assertThat(run("--sitemap", "s.xml", "--format", "pdf")).isEqualTo(2);
        assertThat(run("--sitemap", "s.xml", "--format", "yaml")).isEqualTo(2);
    }

    @Test
    void missing_sitemap_file_is_fatal() {
        assertThat(run("--sitemap", tmp.resolve("absent.xml").toString())).isEqualTo(1);
        assertThat(err()).contains("Error: failed to parse sitemap").contains("failed to open sitemap file");
    }

    @Test
    void list_only_prints_numbered_urls() throws Exception {
        Path sm = sitemap("/a", "/b");

        assertThat(run("--sitemap", sm.toString(), "--list-only")).isEqualTo(0);

        assertThat(out()).contains("URLs discovered:\n================\n")
                .contains("1. " + base + "/a\n")
                .contains("2. " + base + "/b\n")
                .contains("Total: 2 URLs");
    }

    @Test
    void broken_links_exit_one_and_report_goes_to_file() throws Exception {
        pages.put("/a", "<html><body><a href=\"/ok\">ok</a><a href=\"/missing\">gone</a></body></html>");
        pages.put("/b", "<html><body><a href=\"/ok\">ok again</a></body></html>");
        Path sm = sitemap("/a", "/b");
        Path report = tmp.resolve("out/report.json");

        int code = run("--sitemap", sm.toString(), "--format", "json", "--output", report.toString(),
                "--retries", "0", "--timeout", "5");

        assertThat(code).isEqualTo(1);
        String json = Files.readString(report, StandardCharsets.UTF_8);
        assertThat(json).contains("\"totalLinks\":3").contains("\"brokenLinks\":1").contains("\"uniqueUrls\":2");
        assertThat(err()).contains("Report written to: " + report);
    }

    @Test
    void clean_site_exits_zero_with_text_report_on_stdout() throws Exception {
        pages.put("/a", "<html><body><a href=\"/ok\">ok</a><a href=\"mailto:x@ex.com\">mail</a></body></html>");
        Path sm = sitemap("/a");

        assertThat(run("--sitemap", sm.toString(), "--retries", "0")).isEqualTo(0);
        assertThat(out()).contains("Link Validation Report").contains("✓ All links are valid!");
    }

    @Test
    void cancelled_before_start_reports_cancelled_links() throws Exception {
        pages.put("/a", "<html><body><a href=\"/ok\">ok</a></body></html>");
        Path sm = sitemap("/a");
        RunSignal sig = RunSignal.create();
        sig.cancel();

        int code = Main.run(new String[]{"--sitemap", sm.toString()},
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8), sig);

        assertThat(code).isEqualTo(0);
        assertThat(err()).contains("Run cancelled");
        assertThat(out()).contains("Cancelled:");
    }
}
