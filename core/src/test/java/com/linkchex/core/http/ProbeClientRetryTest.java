package com.linkchex.core.http;

import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.model.Classification;
import com.linkchex.core.model.FailureKind;
import com.linkchex.core.model.ProbeOutcome;
import com.linkchex.core.model.RunStats;
import com.linkchex.core.util.RateLimiter;
import com.linkchex.core.util.RunSignal;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ProbeClientRetryTest {

    private static CheckConfig cfg(int retries, long delayMs) {
        return CheckConfig.defaults()
                .setTimeoutMs(2000)
                .setMaxRetries(retries)
                .setRetryDelay(Duration.ofMillis(delayMs));
    }

    @Test
    void transport_failure_is_retried_with_linear_delay_then_wrapped() {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeClient.HttpSender sender = (req, sig) -> {
            calls.incrementAndGet();
            throw new ConnectException("Connection refused");
        };
        TestSleeper sleeper = new TestSleeper();
        RunStats stats = new RunStats();
        ProbeClient client = new ProbeClient(cfg(2, 100), RateLimiter.unlimited(), stats, sender, sleeper);

        ProbeOutcome out = client.head("https://ex.com/a");

        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        assertThat(out.getAttempts()).isEqualTo(3);
        assertThat(out.getStatusCode()).isZero();
        assertThat(out.getError().getKind()).isEqualTo(FailureKind.CONNECT);
        assertThat(out.getError().getMessage()).startsWith("failed after 3 attempts: ");
        assertThat(stats.snapshot().attemptsTotal).isEqualTo(3);
        assertThat(stats.snapshot().retriesTotal).isEqualTo(2);
    }

    @Test
    void succeeds_on_second_attempt() {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeClient.HttpSender sender = (req, sig) -> {
            if (calls.incrementAndGet() == 1) throw new HttpTimeoutException("request timed out");
            return FakeResponse.status(req, 200);
        };
        TestSleeper sleeper = new TestSleeper();
        ProbeClient client = new ProbeClient(cfg(1, 1000), null, null, sender, sleeper);

        ProbeOutcome out = client.head("https://ex.com/a");

        assertThat(out.hasError()).isFalse();
        assertThat(out.getStatusCode()).isEqualTo(200);
        assertThat(out.getStatusText()).isEqualTo("OK");
        assertThat(out.getAttempts()).isEqualTo(2);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void http_error_statuses_are_answers_not_retried() {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeClient.HttpSender sender = (req, sig) -> {
            calls.incrementAndGet();
            return FakeResponse.status(req, 503);
        };
        ProbeClient client = new ProbeClient(cfg(3, 10), null, null, sender, new TestSleeper());

        ProbeOutcome out = client.head("https://ex.com/down");

        assertThat(calls.get()).isEqualTo(1);
        assertThat(out.getStatusCode()).isEqualTo(503);
        assertThat(out.hasError()).isFalse();
    }

    @Test
    void every_attempt_takes_a_rate_token_but_redirect_hops_do_not() {
        final double rate = 5.0;                 // 토큰 간격 200ms
        AtomicInteger calls = new AtomicInteger(0);
        ProbeClient.HttpSender sender = (req, sig) -> {
            if (calls.incrementAndGet() <= 2) throw new ConnectException("Connection refused");
            return switch (req.uri().getPath()) {
                case "/start" -> FakeResponse.redirect(req, 302, "/hop1");
                case "/hop1" -> FakeResponse.redirect(req, 302, "/hop2");
                case "/hop2" -> FakeResponse.redirect(req, 301, "/end");
                default -> FakeResponse.status(req, 200);
            };
        };

        long t0 = System.nanoTime();
        ProbeOutcome out;
        try (ProbeClient client = new ProbeClient(cfg(2, 0), new RateLimiter(rate), new RunStats(),
                sender, new TestSleeper())) {
            out = client.head("https://ex.com/start");
        }
        long ms = (System.nanoTime() - t0) / 1_000_000L;

        assertThat(out.getStatusCode()).isEqualTo(200);
        assertThat(out.getAttempts()).isEqualTo(3);
        assertThat(calls.get()).isEqualTo(2 + 4);
        // 시도 3번 → 토큰 3개 → 최소 (3-1)/R 초
        assertThat(ms).isGreaterThanOrEqualTo((long) ((out.getAttempts() - 1) / rate * 1000));
        // 홉마다 토큰을 썼다면 6개 → 1000ms 이상
        assertThat(ms).isLessThan(900);
    }

    @Test
    void redirects_are_followed_within_one_attempt() {
        ProbeClient.HttpSender sender = (req, sig) -> switch (req.uri().getPath()) {
            case "/old" -> FakeResponse.redirect(req, 301, "/mid");
            case "/mid" -> FakeResponse.redirect(req, 308, "https://ex.com/new");
            default -> FakeResponse.status(req, 200);
        };
        ProbeClient client = new ProbeClient(cfg(0, 0), null, null, sender, new TestSleeper());

        ProbeOutcome out = client.head("https://ex.com/old");

        assertThat(out.getStatusCode()).isEqualTo(200);
        assertThat(out.getFinalUrl()).isEqualTo("https://ex.com/new");
        assertThat(out.getAttempts()).isEqualTo(1);
    }

    @Test
    void redirect_loop_stops_after_ten_hops_and_is_not_retried() {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeClient.HttpSender sender = (req, sig) -> {
            calls.incrementAndGet();
            return FakeResponse.redirect(req, 302, "/loop");
        };
        TestSleeper sleeper = new TestSleeper();
        ProbeClient client = new ProbeClient(cfg(3, 10), null, null, sender, sleeper);

        ProbeOutcome out = client.head("https://ex.com/loop");

        assertThat(calls.get()).isEqualTo(CheckConfig.MAX_REDIRECTS + 1);
        assertThat(out.getError().getKind()).isEqualTo(FailureKind.REDIRECT_LIMIT);
        assertThat(out.getError().getMessage()).isEqualTo("stopped after 10 redirects");
        assertThat(out.getAttempts()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void redirect_without_location_is_returned_as_is() {
        ProbeClient.HttpSender sender = (req, sig) -> FakeResponse.status(req, 302);
        ProbeClient client = new ProbeClient(cfg(0, 0), null, null, sender, new TestSleeper());

        ProbeOutcome out = client.head("https://ex.com/x");

        assertThat(out.getStatusCode()).isEqualTo(302);
        assertThat(out.hasError()).isFalse();
    }

    @Test
    void invalid_url_makes_no_attempt() {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeClient.HttpSender sender = (req, sig) -> {
            calls.incrementAndGet();
            return FakeResponse.status(req, 200);
        };
        ProbeClient client = new ProbeClient(cfg(2, 10), null, null, sender, new TestSleeper());

        ProbeOutcome out = client.head("ht!tp://bad url");

        assertThat(calls.get()).isZero();
        assertThat(out.getAttempts()).isZero();
        assertThat(out.getError().getKind()).isEqualTo(FailureKind.INVALID_URL);
    }

    @Test
    void malformed_escape_is_invalid_url_and_broken() {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeClient.HttpSender sender = (req, sig) -> {
            calls.incrementAndGet();
            return FakeResponse.status(req, 200);
        };
        ProbeClient client = new ProbeClient(cfg(2, 10), null, null, sender, new TestSleeper());

        ProbeOutcome out = client.head("https://ex.com/%zz");

        assertThat(calls.get()).isZero();
        assertThat(out.getError().getKind()).isEqualTo(FailureKind.INVALID_URL);
        assertThat(Classification.of(out)).isEqualTo(Classification.BROKEN);
    }

    @Test
    void get_keeps_body_and_head_does_not_and_user_agent_is_sent() {
        List<String> agents = new java.util.concurrent.CopyOnWriteArrayList<>();
        ProbeClient.HttpSender sender = (req, sig) -> {
            agents.add(req.headers().firstValue("User-Agent").orElse(""));
            return FakeResponse.html(req, "<a href='/x'>x</a>");
        };
        CheckConfig c = cfg(0, 0).setUserAgent("TestBot/2");
        ProbeClient client = new ProbeClient(c, null, null, sender, new TestSleeper());

        ProbeOutcome page = client.get("https://ex.com/");
        ProbeOutcome link = client.head("https://ex.com/");

        assertThat(new String(page.getBody(), StandardCharsets.UTF_8)).contains("href='/x'");
        assertThat(page.getContentType()).startsWith("text/html");
        assertThat(link.getBody()).isEmpty();
        assertThat(agents).containsExactly("TestBot/2", "TestBot/2");
    }

    @Test
    void cancelled_signal_stops_before_sending() {
        AtomicInteger calls = new AtomicInteger(0);
        ProbeClient.HttpSender sender = (req, sig) -> {
            calls.incrementAndGet();
            return FakeResponse.status(req, 200);
        };
        ProbeClient client = new ProbeClient(cfg(2, 10), null, null, sender, new TestSleeper());
        RunSignal sig = RunSignal.create();
        sig.cancel();

        ProbeOutcome out = client.head("https://ex.com/", sig);

        assertThat(calls.get()).isZero();
        assertThat(out.isCancelled()).isTrue();
    }

    @Test
    void request_cut_by_run_deadline_is_cancelled_not_broken() {
        ProbeClient.HttpSender sender = (req, sig) -> {
            // JDK 클라이언트처럼 요청 timeout(= 남은 기한)에 맞춰 타임아웃
            Thread.sleep(req.timeout().orElseThrow().toMillis() + 20);
            throw new HttpTimeoutException("request timed out");
        };
        TestSleeper sleeper = new TestSleeper();
        ProbeClient client = new ProbeClient(cfg(2, 10), null, null, sender, sleeper);

        ProbeOutcome out = client.head("https://ex.com/slow", RunSignal.withTimeout(Duration.ofMillis(300)));

        assertThat(out.isCancelled()).isTrue();
        assertThat(Classification.of(out)).isEqualTo(Classification.CANCELLED);
        assertThat(out.getAttempts()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void classify_walks_cause_chain() {
        assertThat(ProbeClient.classify(new UnknownHostException("nope.invalid")).getKind()).isEqualTo(FailureKind.DNS);
        assertThat(ProbeClient.classify(new IOException("wrapped", new SSLHandshakeException("bad cert"))).getKind())
                .isEqualTo(FailureKind.TLS);
        assertThat(ProbeClient.classify(new HttpTimeoutException("timed out")).getKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(ProbeClient.classify(new IOException("x", new ConnectException("refused"))).getKind())
                .isEqualTo(FailureKind.CONNECT);
        assertThat(ProbeClient.classify(new IOException("reset")).getKind()).isEqualTo(FailureKind.IO);
        assertThat(ProbeClient.classify(new java.util.concurrent.CancellationException()).isCancelled()).isTrue();
    }
}
