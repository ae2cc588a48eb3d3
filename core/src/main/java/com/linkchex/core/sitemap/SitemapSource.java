package com.linkchex.core.sitemap;

import com.linkchex.core.api.IProbeClient;
import com.linkchex.core.api.ISitemapSource;
import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** --url → 탐색 후 전부 파싱, --sitemap → 바로 파싱. 결과는 순서대로 이어 붙인다. */
public final class SitemapSource implements ISitemapSource {
    private static final Logger LOG = LoggerFactory.getLogger(SitemapSource.class);
    private static final StructuredLog SLOG = StructuredLog.get(SitemapSource.class);

    private final SitemapDiscovery discovery;
    private final SitemapParser parser;

    public SitemapSource(IProbeClient http) {
        this(new SitemapDiscovery(http), new SitemapParser(http));
    }

    public SitemapSource(SitemapDiscovery discovery, SitemapParser parser) {
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public List<String> resolvePages(CheckConfig config) throws SitemapException {
        config.validateSource();

        List<String> sitemaps;
        if (config.getUrl() != null) {
            LOG.info("Discovering sitemap from base URL: {}", config.getUrl());
            try {
                sitemaps = discovery.discover(config.getUrl());
            } catch (SitemapException e) {
                throw new SitemapException("sitemap discovery failed: " + e.getMessage(), e);
            }
        } else {
            sitemaps = List.of(config.getSitemap());
        }

        List<String> pages = new ArrayList<>();
        for (String sm : sitemaps) {
            LOG.info("Parsing sitemap: {}", sm);
            try {
                pages.addAll(parser.parse(sm));
            } catch (SitemapException e) {
                throw new SitemapException("failed to parse sitemap " + sm + ": " + e.getMessage(), e);
            }
        }
        SLOG.info("sitemap-resolved", "sitemaps", sitemaps.size(), "pages", pages.size());
        return pages;
    }
}
