package com.linkchex.cli;

import com.linkchex.core.http.ProbeClient;
import com.linkchex.core.extract.JsoupReferenceExtractor;
import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.model.CheckConfig.OutputFormat;
import com.linkchex.core.model.RunStats;
import com.linkchex.core.model.ValidationReport;
import com.linkchex.core.service.LinkCheckService;
import com.linkchex.core.service.export.ReportWriter;
import com.linkchex.core.sitemap.SitemapException;
import com.linkchex.core.sitemap.SitemapSource;
import com.linkchex.core.util.Json;
import com.linkchex.core.util.ProgressListener;
import com.linkchex.core.util.RateLimiter;
import com.linkchex.core.util.RunSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * linkchex 명령행 진입점.
 * 종료 코드: 0 = 깨진 링크 없음, 1 = 깨진 링크 있음 또는 치명 오류, 2 = 사용법 오류.
 * Ctrl+C(SIGINT)는 실행 신호를 취소하고, 그때까지의 결과로 리포트를 쓴다.
 */
public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final String VERSION = "0.1.1";

    static final int EXIT_OK = 0;
    static final int EXIT_BROKEN = 1;
    static final int EXIT_USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        RunSignal signal = RunSignal.create();
        CountDownLatch finished = new CountDownLatch(1);
        AtomicBoolean shuttingDown = new AtomicBoolean(false);

        // SIGINT → 취소 후 리포트가 써질 때까지 잠시 기다린다
        Thread hook = new Thread(() -> {
            shuttingDown.set(true);
            signal.cancel();
            try {
                finished.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "linkchex-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int code;
        try {
            code = run(args, System.out, System.err, signal);
        } finally {
            finished.countDown();
        }
        if (!shuttingDown.get()) {
            System.exit(code);
        }
    }

    /** 테스트용 진입점: 프로세스를 끝내지 않고 종료 코드를 돌려준다. */
    static int run(String[] args, PrintStream out, PrintStream err, RunSignal externalSignal) {
        CliOptions opts;
        CheckConfig config;
        try {
            opts = CliOptions.parse(args);
            if (opts.help) {
                out.print(CliOptions.usage());
                return EXIT_OK;
            }
            if (opts.version) {
                out.println("linkchex version " + VERSION);
                return EXIT_OK;
            }
            config = opts.toConfig();
            config.validateSource();
            config.validate();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.print(CliOptions.usage());
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        LogSetup.init(config.isVerbose());
        LOG.info("Starting linkchex {} with {}", VERSION, config);

        // 외부 신호(SIGINT) + 설정 기한
        RunSignal signal = (externalSignal != null)
                ? externalSignal.child(config.getRunTimeout())
                : RunSignal.withTimeout(config.getRunTimeout());

        RunStats stats = new RunStats();
        try (RateLimiter limiter = new RateLimiter(config.getRateLimit());
             ProbeClient http = new ProbeClient(config, limiter, stats)) {

            List<String> pages = new SitemapSource(http).resolvePages(config);
            LOG.info("Discovered {} URLs from sitemap(s)", pages.size());

            if (config.isListOnly()) {
                printList(pages, config.getOutputFormat(), out);
                return EXIT_OK;
            }

            ProgressPrinter printer = (config.isProgress() && !config.isVerbose()) ? new ProgressPrinter(err) : null;
            ValidationReport report;
            try (LinkCheckService service = new LinkCheckService(config, http,
                    new JsoupReferenceExtractor(config.isSkipResources()), stats)) {
                report = service.run(pages, printer != null ? printer : ProgressListener.NONE, signal);
            }
            if (printer != null) printer.finish(report.getTotalLinks(), pages.size());
            if (signal.isCancelled()) {
                err.println("Run cancelled: " + report.getCancelledLinks() + " link(s) not checked.");
            }

            new ReportWriter(out).write(report, config.getOutputFormat(), config.getOutput());
            if (config.getOutput() != null) {
                err.println("Report written to: " + config.getOutput());
            }
            return report.hasBrokenLinks() ? EXIT_BROKEN : EXIT_OK;

        } catch (SitemapException e) {
            LOG.error("Sitemap resolution failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_BROKEN;
        } catch (IOException | UncheckedIOException e) {
            LOG.error("Failed to write report", e);
            err.println("Error: failed to write report: " + e.getMessage());
            return EXIT_BROKEN;
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Run failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_BROKEN;
        }
    }

    static void printList(List<String> pages, OutputFormat format, PrintStream out) {
        switch (format) {
            case JSON -> {
                StringBuilder sb = new StringBuilder("[");
                for (int i = 0; i < pages.size(); i++) {
                    sb.append(i == 0 ? "\n  " : ",\n  ").append(Json.str(pages.get(i)));
                }
                out.println(sb.append(pages.isEmpty() ? "]" : "\n]"));
            }
            case TEXT -> {
                out.println("URLs discovered:");
                out.println("================");
                for (int i = 0; i < pages.size(); i++) {
                    out.println((i + 1) + ". " + pages.get(i));
                }
                out.println();
                out.println("Total: " + pages.size() + " URLs");
            }
            default -> pages.forEach(out::println);
        }
    }
}
