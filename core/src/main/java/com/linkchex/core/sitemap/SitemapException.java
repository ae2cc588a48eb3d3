package com.linkchex.core.sitemap;

/** 사이트맵을 찾거나 읽지 못함. 실행 전체가 시작되지 않는 치명 오류. */
public class SitemapException extends Exception {
    public SitemapException(String message) { super(message); }
    public SitemapException(String message, Throwable cause) { super(message, cause); }
}
