package com.linkchex.core.sitemap;

import com.linkchex.core.api.IProbeClient;
import com.linkchex.core.model.ProbeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 베이스 URL → 사이트맵 위치 목록.
 * 1) robots.txt의 Sitemap: 줄
 * 2) 없으면 흔한 경로를 차례로 확인(HEAD, 405면 GET), 처음 200인 곳 하나
 */
public final class SitemapDiscovery {
    private static final Logger LOG = LoggerFactory.getLogger(SitemapDiscovery.class);

    static final List<String> COMMON_PATHS = List.of(
            "/sitemap.xml",
            "/sitemap_index.xml",
            "/sitemap/sitemap.xml",
            "/sitemap/index.xml"
    );

    private final IProbeClient http;

    public SitemapDiscovery(IProbeClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    public List<String> discover(String baseUrl) throws SitemapException {
        String origin = originOf(baseUrl);

        List<String> found = new ArrayList<>(fromRobots(origin));
        if (found.isEmpty()) {
            for (String path : COMMON_PATHS) {
                String candidate = origin + path;
                if (exists(candidate)) {
                    found.add(candidate);
                    break;
                }
            }
        }
        if (found.isEmpty()) {
            throw new SitemapException("no sitemap found at " + origin);
        }
        LOG.info("Discovered {} sitemap(s) at {}", found.size(), origin);
        return found;
    }

    /** scheme이 없으면 https:// 를 붙이고 scheme://authority 만 남긴다 */
    static String originOf(String baseUrl) throws SitemapException {
        if (baseUrl == null || baseUrl.isBlank()) throw new SitemapException("invalid URL: empty");
        String s = baseUrl.trim();
        String lower = s.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) s = "https://" + s;
        try {
            URI u = new URI(s);
            if (u.getRawAuthority() == null || u.getHost() == null) {
                throw new SitemapException("invalid URL: " + baseUrl);
            }
            return u.getScheme().toLowerCase(Locale.ROOT) + "://" + u.getRawAuthority();
        } catch (URISyntaxException e) {
            throw new SitemapException("invalid URL: " + e.getMessage(), e);
        }
    }

    private List<String> fromRobots(String origin) {
        List<String> out = new ArrayList<>();
        ProbeOutcome resp = http.get(origin + "/robots.txt");
        if (resp.hasError() || resp.getStatusCode() != 200) {
            LOG.debug("robots.txt unavailable at {} (status={}, error={})",
                    origin, resp.getStatusCode(), resp.getError());
            return out;
        }
        try (BufferedReader r = new BufferedReader(new InputStreamReader(
                new ByteArrayInputStream(resp.getBody()), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                String t = line.trim();
                if (t.toLowerCase(Locale.ROOT).startsWith("sitemap:")) {
                    String loc = t.substring("sitemap:".length()).trim();
                    if (!loc.isEmpty()) out.add(loc);
                }
            }
        } catch (IOException e) {
            LOG.debug("Failed to read robots.txt at {}: {}", origin, e.toString());
        }
        return out;
    }

    private boolean exists(String url) {
        ProbeOutcome resp = http.head(url);
        if (!resp.hasError() && resp.getStatusCode() == 405) {
            resp = http.get(url);   // HEAD 미지원 서버
        }
        return !resp.hasError() && resp.getStatusCode() == 200;
    }
}
