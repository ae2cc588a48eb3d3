package com.linkchex.core.sitemap;

import com.linkchex.core.api.IProbeClient;
import com.linkchex.core.model.ProbeOutcome;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * 사이트맵(URL 또는 로컬 파일) → 페이지 URL 목록(문서 순서).
 * - gzip은 매직 바이트로 판별해 푼다
 * - sitemapindex는 재귀(자식 실패는 경고 후 건너뜀), 같은 사이트맵은 한 번만, 깊이 상한 5
 */
public final class SitemapParser {
    private static final Logger LOG = LoggerFactory.getLogger(SitemapParser.class);

    static final int MAX_DEPTH = 5;

    private final IProbeClient http;

    public SitemapParser(IProbeClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    public List<String> parse(String location) throws SitemapException {
        Objects.requireNonNull(location, "location");
        List<String> out = new ArrayList<>();
        parseInto(location.trim(), 0, new HashSet<>(), out);
        return out;
    }

    private void parseInto(String location, int depth, Set<String> visited, List<String> out) throws SitemapException {
        if (!visited.add(location)) {
            LOG.debug("Sitemap already parsed, skipping: {}", location);
            return;
        }
        Document xml;
        try (InputStream in = decode(read(location), location)) {
            xml = Jsoup.parse(in, null, "", Parser.xmlParser());
        } catch (IOException e) {
            throw new SitemapException("failed to parse sitemap XML: " + e.getMessage(), e);
        }

        if (xml.selectFirst("sitemapindex") != null) {
            for (Element loc : xml.select("sitemap > loc")) {
                String child = resolve(location, loc.text());
                if (child.isEmpty()) continue;
                if (depth + 1 > MAX_DEPTH) {
                    LOG.warn("Sitemap nesting deeper than {}, skipping {}", MAX_DEPTH, child);
                    continue;
                }
                try {
                    parseInto(child, depth + 1, visited, out);
                } catch (SitemapException e) {
                    LOG.warn("Failed to parse sitemap {}: {}", child, e.getMessage());
                }
            }
            return;
        }
        if (xml.selectFirst("urlset") == null) {
            throw new SitemapException("failed to parse sitemap XML: no <urlset> or <sitemapindex> in " + location);
        }
        for (Element loc : xml.select("url > loc")) {
            String u = loc.text().trim();
            if (!u.isEmpty()) out.add(u);
        }
    }

    private byte[] read(String location) throws SitemapException {
        if (isRemote(location)) {
            ProbeOutcome resp = http.get(location);
            if (resp.hasError()) {
                throw new SitemapException("failed to fetch sitemap: " + resp.getError().getMessage());
            }
            if (resp.getStatusCode() != 200) {
                throw new SitemapException("sitemap returned status " + resp.getStatusCode());
            }
            return resp.getBody();
        }
        try {
            return Files.readAllBytes(Path.of(location));
        } catch (IOException | InvalidPathException e) {
            throw new SitemapException("failed to open sitemap file: " + location, e);
        }
    }

    /** gzip 매직(1f 8b)이면 풀어서 돌려준다 */
    static InputStream decode(byte[] bytes, String location) throws SitemapException {
        if (bytes.length >= 2 && (bytes[0] & 0xff) == 0x1f && (bytes[1] & 0xff) == 0x8b) {
            try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(bytes));
                 ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
                gz.transferTo(bos);
                return new ByteArrayInputStream(bos.toByteArray());
            } catch (IOException e) {
                throw new SitemapException("failed to read sitemap: bad gzip payload in " + location, e);
            }
        }
        return new ByteArrayInputStream(bytes);
    }

    private static String resolve(String parent, String loc) {
        String s = loc.trim();
        if (s.isEmpty() || isRemote(s) || !isRemote(parent)) return s;
        try {
            return URI.create(parent).resolve(s).toString();
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static boolean isRemote(String location) {
        String l = location.toLowerCase(Locale.ROOT);
        return l.startsWith("http://") || l.startsWith("https://");
    }
}
