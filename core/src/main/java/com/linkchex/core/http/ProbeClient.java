package com.linkchex.core.http;

import com.linkchex.core.api.IProbeClient;
import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.model.FailureKind;
import com.linkchex.core.model.ProbeFailure;
import com.linkchex.core.model.ProbeOutcome;
import com.linkchex.core.model.RunStats;
import com.linkchex.core.util.DefaultSleeper;
import com.linkchex.core.util.RateLimiter;
import com.linkchex.core.util.RunSignal;
import com.linkchex.core.util.Sleeper;
import com.linkchex.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP 프로브: 요청 → (수동 리다이렉트 추적) → ProbeOutcome.
 * - 시도마다 레이트리미터 토큰 1개 (리다이렉트 홉은 추가 토큰 없음)
 * - 전송 계층 실패만 재시도, 상태 코드는 무엇이든 최종 결과
 * - 예외를 밖으로 던지지 않는다
 */
public class ProbeClient implements IProbeClient {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeClient.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req, RunSignal signal) throws Exception;
    }

    private final CheckConfig config;
    private final RateLimiter limiter;
    private final RunStats stats;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public ProbeClient(CheckConfig config, RateLimiter limiter, RunStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.limiter = (limiter == null) ? RateLimiter.unlimited() : limiter;
        this.stats = (stats == null) ? new RunStats() : stats;
        this.policy = new LinearRetryPolicy(config.getMaxRetries(), config.getRetryDelay());
        this.sleeper = new DefaultSleeper();
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)   // 홉 수를 직접 센다
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = this::sendAsync;
    }

    /** 테스트용 생성자(송신 훅 + 대기 훅 주입) */
    public ProbeClient(CheckConfig config, RateLimiter limiter, RunStats stats,
                       HttpSender testSender, Sleeper testSleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.limiter = (limiter == null) ? RateLimiter.unlimited() : limiter;
        this.stats = (stats == null) ? new RunStats() : stats;
        this.policy = new LinearRetryPolicy(config.getMaxRetries(), config.getRetryDelay());
        this.sleeper = Objects.requireNonNull(testSleeper, "testSleeper");
        this.client = null; // 테스트에선 사용 안 함
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public ProbeOutcome get(String url, RunSignal signal) {
        return probe("GET", url, signal);
    }

    @Override
    public ProbeOutcome head(String url, RunSignal signal) {
        return probe("HEAD", url, signal);
    }

    /** 재시도 루프: 시도 → 실패 분류 → (재시도 가능하면) 선형 백오프 */
    private ProbeOutcome probe(String method, String url, RunSignal signal) {
        Objects.requireNonNull(url, "url");
        RunSignal sig = (signal == null) ? RunSignal.create() : signal;
        long start = System.nanoTime();

        URI uri = parse(url);
        if (uri == null) {
            return ProbeOutcome.failed(url, ProbeFailure.of(FailureKind.INVALID_URL, "invalid url: " + url),
                    elapsed(start), 0);
        }

        int attempt = 0;
        ProbeFailure last = null;
        try {
            while (attempt < policy.maxAttempts()) {
                if (sig.isCancelled() || !limiter.acquire(sig)) {
                    return ProbeOutcome.failed(url, ProbeFailure.cancelled(), elapsed(start), attempt);
                }
                attempt++;
                stats.onAttempt();

                Attempt a = attemptOnce(method, uri, sig);
                if (a.response != null) {
                    HttpResponse<byte[]> resp = a.response;
                    ProbeOutcome.Builder b = ProbeOutcome.builder()
                            .url(url)
                            .statusCode(resp.statusCode())
                            .statusText(HttpStatusText.of(resp.statusCode()))
                            .finalUrl(a.finalUri.toString())
                            .contentType(resp.headers().firstValue("Content-Type").orElse(null))
                            .duration(elapsed(start))
                            .attempts(attempt);
                    if ("GET".equals(method)) b.body(resp.body());
                    return b.build();
                }

                last = a.failure;
                // 기한에 잘린 요청은 HttpTimeoutException으로 끝나기도 한다 → 전송 실패가 아니라 취소
                if (last.isCancelled() || sig.isCancelled()) {
                    return ProbeOutcome.failed(url, ProbeFailure.cancelled(), elapsed(start), attempt);
                }
                if (!policy.shouldRetry(last, attempt)) break;

                Duration delay = policy.nextDelay(attempt);
                LOG.debug("retry {} {} after {}ms (attempt {}): {}", method, url, delay.toMillis(), attempt, last);
                stats.onRetry();
                if (!sleeper.sleep(delay, sig)) {
                    return ProbeOutcome.failed(url, ProbeFailure.cancelled(), elapsed(start), attempt);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ProbeOutcome.failed(url, ProbeFailure.cancelled(), elapsed(start), attempt);
        }

        if (sig.isCancelled()) {
            return ProbeOutcome.failed(url, ProbeFailure.cancelled(), elapsed(start), attempt);
        }
        ProbeFailure finalError = last.isRetryable() ? last.wrapAttempts(attempt) : last;
        return ProbeOutcome.failed(url, finalError, elapsed(start), attempt);
    }

    /** 한 번의 시도: 최대 MAX_REDIRECTS 홉까지 리다이렉트를 따라간다. */
    private Attempt attemptOnce(String method, URI uri, RunSignal sig) throws InterruptedException {
        URI current = uri;
        int redirects = 0;
        while (true) {
            HttpResponse<byte[]> resp;
            try {
                HttpRequest req = HttpRequest.newBuilder(current)
                        .timeout(sig.cap(config.getTimeout()))
                        .header("User-Agent", config.getUserAgent())
                        .method(method, HttpRequest.BodyPublishers.noBody())
                        .build();
                resp = sender.send(req, sig);
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                return Attempt.failed(classify(e));
            }

            int status = resp.statusCode();
            if (!isRedirect(status)) return Attempt.ok(resp, current);

            String location = resp.headers().firstValue("Location").orElse(null);
            if (location == null || location.isBlank()) return Attempt.ok(resp, current);

            if (redirects >= CheckConfig.MAX_REDIRECTS) {
                return Attempt.failed(ProbeFailure.of(FailureKind.REDIRECT_LIMIT,
                        "stopped after " + CheckConfig.MAX_REDIRECTS + " redirects"));
            }
            URI next;
            try {
                next = current.resolve(location.trim());
            } catch (IllegalArgumentException e) {
                return Attempt.failed(new ProbeFailure(FailureKind.INVALID_URL, "bad redirect location: " + location, e));
            }
            if (!UrlUtils.isHttp(next)) {
                return Attempt.failed(ProbeFailure.of(FailureKind.INVALID_URL, "unsupported redirect target: " + next));
            }
            redirects++;
            current = next;
        }
    }

    /** 신호를 보면서 비동기 전송 결과를 기다린다. */
    private HttpResponse<byte[]> sendAsync(HttpRequest req, RunSignal sig) throws Exception {
        CompletableFuture<HttpResponse<byte[]>> f = client.sendAsync(req, HttpResponse.BodyHandlers.ofByteArray());
        while (true) {
            if (sig.isCancelled()) {
                f.cancel(true);
                throw new CancellationException("run cancelled");
            }
            try {
                return f.get(RunSignal.SLICE_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException slice) {
                continue;
            } catch (ExecutionException e) {
                Throwable c = e.getCause();
                if (c instanceof Exception ex) throw ex;
                throw e;
            }
        }
    }

    /** 예외 → 실패 종류. 원인 체인까지 본다. */
    static ProbeFailure classify(Throwable t) {
        String msg = describe(t);
        if (t instanceof CancellationException) return ProbeFailure.cancelled();
        if (hasCause(t, UnknownHostException.class) || hasCause(t, UnresolvedAddressException.class))
            return new ProbeFailure(FailureKind.DNS, msg, t);
        if (hasCause(t, SSLException.class)) return new ProbeFailure(FailureKind.TLS, msg, t);
        if (hasCause(t, HttpTimeoutException.class)) return new ProbeFailure(FailureKind.TIMEOUT, msg, t);
        if (hasCause(t, ConnectException.class)) return new ProbeFailure(FailureKind.CONNECT, msg, t);
        if (t instanceof IllegalArgumentException) return new ProbeFailure(FailureKind.INVALID_URL, msg, t);
        if (t instanceof IOException) return new ProbeFailure(FailureKind.IO, msg, t);
        return new ProbeFailure(FailureKind.IO, msg, t);
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c)) return true;
            if (c.getCause() == c) break;
        }
        return false;
    }

    private static String describe(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + m;
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static URI parse(String url) {
        try {
            URI u = new URI(url.trim());
            return (UrlUtils.isHttp(u) && u.getHost() != null) ? u : null;
        } catch (Exception e) {
            return null;
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        limiter.stop();
    }

    /** 시도 1회의 결과: 응답 또는 실패 */
    private static final class Attempt {
        final HttpResponse<byte[]> response;
        final URI finalUri;
        final ProbeFailure failure;

        private Attempt(HttpResponse<byte[]> response, URI finalUri, ProbeFailure failure) {
            this.response = response;
            this.finalUri = finalUri;
            this.failure = failure;
        }

        static Attempt ok(HttpResponse<byte[]> r, URI finalUri) { return new Attempt(r, finalUri, null); }
        static Attempt failed(ProbeFailure f) { return new Attempt(null, null, f); }
    }
}
