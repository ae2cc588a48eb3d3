package com.linkchex.core.api;

import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.sitemap.SitemapException;

import java.util.List;

/** 설정(url 또는 sitemap) → 검증할 페이지 URL 목록(순서 유지). */
public interface ISitemapSource {
    List<String> resolvePages(CheckConfig config) throws SitemapException;
}
