package com.linkchex.core.extract;

import com.linkchex.core.api.IReferenceExtractor;
import com.linkchex.core.model.Reference;
import com.linkchex.core.model.ReferenceKind;
import com.linkchex.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * JSoup 기반 참조 추출기: a[href], img[src], link[href], script[src] → 문서 순서 그대로.
 * skipResources면 link/script는 건너뛴다.
 * <p>
 * 공백, | 같은 문자는 브라우저처럼 %XX로 인코딩한다. 그래도 URI로 읽을 수 없는 http 링크
 * (잘못된 %XX, 깨진 호스트 등)는 버리지 않고 원문 그대로 내보내서 검사 단계에서 INVALID_URL이 된다.
 * javascript:, mailto: 같은 http가 아닌 scheme만 건너뛴다.
 */
public class JsoupReferenceExtractor implements IReferenceExtractor {
    private static final String ALL = "a[href], img[src], link[href], script[src]";
    private static final String NO_RESOURCES = "a[href], img[src]";
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    private final boolean skipResources;

    public JsoupReferenceExtractor(boolean skipResources) {
        this.skipResources = skipResources;
    }

    @Override
    public List<Reference> extract(byte[] html, Charset charset, String pageUrl) {
        Objects.requireNonNull(pageUrl, "pageUrl");
        URI base = toUri(pageUrl);

        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(html == null ? new byte[0] : html),
                    charset == null ? null : charset.name(), pageUrl);
        } catch (IOException e) {
            throw new IllegalArgumentException("failed to parse html of " + pageUrl + ": " + e.getMessage(), e);
        }

        List<Reference> out = new ArrayList<>();
        for (Element el : doc.select(skipResources ? NO_RESOURCES : ALL)) {
            ReferenceKind kind = ReferenceKind.fromTag(el.tagName());
            String attr = (kind == ReferenceKind.ANCHOR || kind == ReferenceKind.STYLESHEET) ? "href" : "src";
            String raw = el.attr(attr).trim();
            if (raw.isEmpty() || raw.startsWith("#")) continue;   // 같은 페이지 앵커

            if (SCHEME.matcher(raw).find() && !isHttpScheme(raw)) continue;   // mailto:, javascript:, data: 등

            String abs = el.absUrl(attr).trim();
            if (abs.isEmpty()) abs = raw;          // jsoup이 해석 못 한 경우 원문
            String url = UrlUtils.encodeUnsafe(abs);
            URI target = parseOrNull(url);
            if (target != null && !UrlUtils.isHttp(target)) continue;
            if (target == null || target.getHost() == null) {
                out.add(new Reference(url, kind, anchorText(el, kind), false));
                continue;
            }

            boolean external = base != null && !UrlUtils.sameAuthority(base, target);
            out.add(new Reference(url, kind, anchorText(el, kind), external));
        }
        return out;
    }

    private static String anchorText(Element el, ReferenceKind kind) {
        return (kind == ReferenceKind.ANCHOR) ? el.text().trim() : "";
    }

    private static boolean isHttpScheme(String raw) {
        String s = raw.toLowerCase(Locale.ROOT);
        return s.startsWith("http:") || s.startsWith("https:");
    }

    private static URI parseOrNull(String s) {
        try {
            return new URI(s);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static URI toUri(String s) {
        try {
            return new URI(s.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid page url: " + s, e);
        }
    }
}
