package com.linkchex.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** URL 정규화 + 호스트 비교 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 캐시 키용 정규화:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로를 "/"로
     * 파싱할 수 없는 문자열은 앞뒤 공백만 제거해 그대로 쓴다.
     */
    public static String normalize(String url) {
        if (url == null) return null;
        String s = url.trim();
        try {
            URI u = new URI(s);
            if (u.getScheme() == null || u.getRawAuthority() == null) {
                return stripFragment(s);
            }
            String scheme = u.getScheme().toLowerCase(Locale.ROOT);
            String host = (u.getHost() != null) ? u.getHost().toLowerCase(Locale.ROOT) : null;
            if (host == null) return stripFragment(s);

            int port = u.getPort();
            if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
                port = -1;
            }
            StringBuilder sb = new StringBuilder(s.length());
            sb.append(scheme).append("://");
            if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
            sb.append(host);
            if (port >= 0) sb.append(':').append(port);
            String path = u.getRawPath();
            sb.append((path == null || path.isEmpty()) ? "/" : path);
            if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
            return sb.toString();
        } catch (URISyntaxException e) {
            return stripFragment(s);
        }
    }

    /**
     * 브라우저가 요청 전에 인코딩하는 문자만 %XX로 바꾼다: 공백, " < > ` { } | \ ^, 비ASCII.
     * authority(호스트)는 건드리지 않고, 이미 있는 %는 그대로 둔다(잘못된 %XX는 잘못된 채로).
     */
    public static String encodeUnsafe(String url) {
        if (url == null) return null;
        int from = 0;
        int scheme = url.indexOf("://");
        if (scheme >= 0) {
            from = url.length();
            for (int i = scheme + 3; i < url.length(); i++) {
                char c = url.charAt(i);
                if (c == '/' || c == '?' || c == '#') { from = i; break; }
            }
        }
        StringBuilder sb = null;
        for (int i = from; i < url.length(); i++) {
            char c = url.charAt(i);
            if (!unsafe(c)) {
                if (sb != null) sb.append(c);
                continue;
            }
            if (sb == null) sb = new StringBuilder(url.length() + 16).append(url, 0, i);
            int end = (Character.isHighSurrogate(c) && i + 1 < url.length()) ? i + 2 : i + 1;
            for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
            }
            i = end - 1;
        }
        return (sb == null) ? url : sb.toString();
    }

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private static boolean unsafe(char c) {
        if (c <= 0x20 || c >= 0x7F) return true;
        return switch (c) {
            case '"', '<', '>', '`', '{', '}', '|', '\\', '^' -> true;
            default -> false;
        };
    }

    /** scheme이 http/https 인지 */
    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme();
        return s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https");
    }

    /** host:port 기준 동일 출처 판정(소문자 비교, 기본 포트 동일 취급) */
    public static boolean sameAuthority(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return ha.equals(hb) && effectivePort(a) == effectivePort(b);
    }

    private static int effectivePort(URI u) {
        if (u.getPort() >= 0) return u.getPort();
        String s = (u.getScheme() == null) ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        return s.equals("https") ? 443 : s.equals("http") ? 80 : -1;
    }

    private static String stripFragment(String s) {
        int i = s.indexOf('#');
        return (i >= 0) ? s.substring(0, i) : s;
    }
}
